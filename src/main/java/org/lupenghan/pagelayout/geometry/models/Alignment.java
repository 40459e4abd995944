package org.lupenghan.pagelayout.geometry.models;

import lombok.Data;
import lombok.Getter;

import java.util.Objects;

/**
 * 内容在页面硬区域内的对齐方式（垂直 + 水平）
 */
@Data
public final class Alignment {

    @Getter
    public enum Vertical {
        TOP(0),
        VCENTER(1),
        BOTTOM(2);

        private final int value;
        Vertical(int value) {
            this.value = value;
        }

        public static Vertical fromValue(int value) {
            for (Vertical v : values()) {
                if (v.value == value) {
                    return v;
                }
            }
            throw new IllegalArgumentException("Invalid vertical alignment value: " + value);
        }
    }

    @Getter
    public enum Horizontal {
        LEFT(0),
        HCENTER(1),
        RIGHT(2);

        private final int value;
        Horizontal(int value) {
            this.value = value;
        }

        public static Horizontal fromValue(int value) {
            for (Horizontal h : values()) {
                if (h.value == value) {
                    return h;
                }
            }
            throw new IllegalArgumentException("Invalid horizontal alignment value: " + value);
        }
    }

    private final Vertical vertical;
    private final Horizontal horizontal;

    public Alignment(Vertical vertical, Horizontal horizontal) {
        this.vertical = Objects.requireNonNull(vertical, "vertical");
        this.horizontal = Objects.requireNonNull(horizontal, "horizontal");
    }
}
