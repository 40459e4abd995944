package org.lupenghan.pagelayout.settings;

import org.lupenghan.pagelayout.geometry.models.Alignment;
import org.lupenghan.pagelayout.geometry.models.Margins;
import org.lupenghan.pagelayout.geometry.models.RectF;
import org.lupenghan.pagelayout.geometry.models.SizeF;
import org.lupenghan.pagelayout.page.models.PageId;
import org.lupenghan.pagelayout.settings.Impl.PageLayoutStoreImpl;
import org.lupenghan.pagelayout.settings.interfaces.PageLayoutStore;
import org.lupenghan.pagelayout.settings.models.LayoutDefaults;
import org.lupenghan.pagelayout.settings.models.Params;

import java.util.Objects;
import java.util.Optional;

/**
 * 页面布局设置，应用其余部分访问布局参数的唯一入口，所有调用直接转发给存储实现
 */
public class Settings {

    private final PageLayoutStore store;

    public Settings() {
        this(new PageLayoutStoreImpl());
    }

    public Settings(LayoutDefaults defaults) {
        this(new PageLayoutStoreImpl(defaults));
    }

    public Settings(PageLayoutStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public Optional<Params> getPageParams(PageId pageId) {
        return store.getPageParams(pageId);
    }

    public Margins getHardMarginsMM(PageId pageId) {
        return store.getHardMarginsMM(pageId);
    }

    public void setHardMarginsMM(PageId pageId, Margins marginsMM) {
        store.setHardMarginsMM(pageId, marginsMM);
    }

    public Alignment getPageAlignment(PageId pageId) {
        return store.getPageAlignment(pageId);
    }

    public void setPageAlignment(PageId pageId, Alignment alignment) {
        store.setPageAlignment(pageId, alignment);
    }

    public void setContentZone(PageId pageId, RectF contentRect, SizeF contentSizeMM) {
        store.setContentZone(pageId, contentRect, contentSizeMM);
    }

    public SizeF getAggregateHardSizeMM() {
        return store.getAggregateHardSizeMM();
    }

    public SizeF getAggregateHardSizeMM(PageId pageId, SizeF hypotheticalContentSizeMM) {
        return store.getAggregateHardSizeMM(pageId, hypotheticalContentSizeMM);
    }

    public PageId findWidestPage() {
        return store.findWidestPage();
    }

    public PageId findTallestPage() {
        return store.findTallestPage();
    }

    public int size() {
        return store.size();
    }

    public boolean contains(PageId pageId) {
        return store.contains(pageId);
    }

    public void clear() {
        store.clear();
    }
}
