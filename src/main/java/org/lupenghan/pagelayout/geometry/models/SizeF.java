package org.lupenghan.pagelayout.geometry.models;

import lombok.Data;

@Data
public final class SizeF {
    public static final SizeF ZERO = new SizeF(0.0, 0.0);

    private final double width;
    private final double height;
}
