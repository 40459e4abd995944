package org.lupenghan.pagelayout.page.models;

import lombok.Getter;

import java.util.Objects;

/**
 * 页面标识符类，用于唯一标识文档中的一个逻辑页面。
 * 一张扫描图像可以拆分成左右两页，因此标识由图像文件、图像内页号和子页组成。
 * {@link #NULL} 作为"未找到"的哨兵值，排在所有真实页面之前。
 */
@Getter
public final class PageId implements Comparable<PageId> {

    public static final PageId NULL = new PageId();

    private final String imageFile;   // 图像文件路径，哨兵值为null

    private final int page;           // 图像文件中的页号（多页TIFF）

    private final SubPage subPage;    // 子页

    private PageId() {
        this.imageFile = null;
        this.page = 0;
        this.subPage = SubPage.SINGLE_PAGE;
    }

    /**
     * 创建页面标识符
     * @param imageFile 图像文件路径
     * @param page 图像文件中的页号
     * @param subPage 子页
     */
    public PageId(String imageFile, int page, SubPage subPage) {
        this.imageFile = Objects.requireNonNull(imageFile, "imageFile");
        this.page = page;
        this.subPage = Objects.requireNonNull(subPage, "subPage");
    }

    public PageId(String imageFile, int page) {
        this(imageFile, page, SubPage.SINGLE_PAGE);
    }

    public boolean isNull() {
        return imageFile == null;
    }

    @Override
    public int compareTo(PageId other) {
        if (imageFile == null || other.imageFile == null) {
            if (imageFile == other.imageFile) {
                return 0;
            }
            return imageFile == null ? -1 : 1;
        }
        int c = imageFile.compareTo(other.imageFile);
        if (c != 0) return c;
        c = Integer.compare(page, other.page);
        if (c != 0) return c;
        return Integer.compare(subPage.getValue(), other.subPage.getValue());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        PageId other = (PageId) obj;
        return page == other.page
                && subPage == other.subPage
                && Objects.equals(imageFile, other.imageFile);
    }

    @Override
    public int hashCode() {
        int result = imageFile == null ? 0 : imageFile.hashCode();
        result = 31 * result + page;
        return 31 * result + subPage.getValue();
    }

    @Override
    public String toString() {
        if (isNull()) {
            return "PageId{NULL}";
        }
        return "PageId{imageFile=" + imageFile + ", page=" + page + ", subPage=" + subPage + "}";
    }
}
