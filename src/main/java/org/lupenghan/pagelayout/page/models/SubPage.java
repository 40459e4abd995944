package org.lupenghan.pagelayout.page.models;

import lombok.Getter;

@Getter
public enum SubPage {
    // 整张图像就是一页
    SINGLE_PAGE(0),
    // 拆分后的左半页
    LEFT_PAGE(1),
    // 拆分后的右半页
    RIGHT_PAGE(2);

    private final int value;
    SubPage(int value) {
        this.value = value;
    }

    public static SubPage fromValue(int value) {
        for (SubPage subPage : values()) {
            if (subPage.value == value) {
                return subPage;
            }
        }
        throw new IllegalArgumentException("Invalid sub page value: " + value);
    }
}
