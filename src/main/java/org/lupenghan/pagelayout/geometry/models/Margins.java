package org.lupenghan.pagelayout.geometry.models;

import lombok.Data;

/**
 * 页边距，单位毫米。不做合法性校验。
 */
@Data
public final class Margins {
    private final double left;
    private final double top;
    private final double right;
    private final double bottom;

    public Margins(double left, double top, double right, double bottom) {
        this.left = left;
        this.top = top;
        this.right = right;
        this.bottom = bottom;
    }

    // 左右边距之和
    public double horizontal() {
        return left + right;
    }

    // 上下边距之和
    public double vertical() {
        return top + bottom;
    }
}
