package org.lupenghan.pagelayout.settings.models;

import lombok.Getter;
import lombok.Setter;
import org.lupenghan.pagelayout.geometry.models.Alignment;
import org.lupenghan.pagelayout.geometry.models.Margins;
import org.lupenghan.pagelayout.geometry.models.RectF;
import org.lupenghan.pagelayout.geometry.models.SizeF;
import org.lupenghan.pagelayout.page.models.PageId;

/**
 * 单个页面的布局条目，只在存储内部使用。
 * 硬宽度/硬高度每次都根据当前字段重新计算，不做缓存；
 * 修改边距或内容尺寸之前必须先把条目从排序索引中移除。
 */
@Getter
@Setter
public class PageLayoutItem {
    private final PageId pageId;
    private Margins hardMarginsMM;
    private RectF contentRect;
    private SizeF contentSizeMM;
    private Alignment alignment;

    public PageLayoutItem(PageId pageId, Margins hardMarginsMM, RectF contentRect,
                          SizeF contentSizeMM, Alignment alignment) {
        this.pageId = pageId;
        this.hardMarginsMM = hardMarginsMM;
        this.contentRect = contentRect;
        this.contentSizeMM = contentSizeMM;
        this.alignment = alignment;
    }

    public double hardWidthMM() {
        return contentSizeMM.getWidth() + hardMarginsMM.getLeft() + hardMarginsMM.getRight();
    }

    public double hardHeightMM() {
        return contentSizeMM.getHeight() + hardMarginsMM.getTop() + hardMarginsMM.getBottom();
    }

    public Params toParams() {
        return new Params(hardMarginsMM, contentRect, contentSizeMM, alignment);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return pageId.equals(((PageLayoutItem) obj).pageId);
    }

    @Override
    public int hashCode() {
        return pageId.hashCode();
    }

    @Override
    public String toString() {
        return "PageLayoutItem{pageId=" + pageId + ", hardWidthMM=" + hardWidthMM()
                + ", hardHeightMM=" + hardHeightMM() + "}";
    }
}
