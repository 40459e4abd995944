package org.lupenghan.pagelayout.geometry.models;

import lombok.Data;

/**
 * 内容区域矩形（像素坐标），对存储层来说是不透明的几何数据
 */
@Data
public final class RectF {
    public static final RectF EMPTY = new RectF(0.0, 0.0, 0.0, 0.0);

    private final double x;
    private final double y;
    private final double width;
    private final double height;

    public boolean isEmpty() {
        return width <= 0.0 || height <= 0.0;
    }
}
