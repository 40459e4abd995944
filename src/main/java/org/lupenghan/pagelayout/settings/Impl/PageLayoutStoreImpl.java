package org.lupenghan.pagelayout.settings.Impl;

import lombok.extern.slf4j.Slf4j;
import org.lupenghan.pagelayout.geometry.models.Alignment;
import org.lupenghan.pagelayout.geometry.models.Margins;
import org.lupenghan.pagelayout.geometry.models.RectF;
import org.lupenghan.pagelayout.geometry.models.SizeF;
import org.lupenghan.pagelayout.page.models.PageId;
import org.lupenghan.pagelayout.settings.interfaces.PageLayoutStore;
import org.lupenghan.pagelayout.settings.models.LayoutDefaults;
import org.lupenghan.pagelayout.settings.models.PageLayoutItem;
import org.lupenghan.pagelayout.settings.models.Params;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * 页面布局存储的实现。
 * 主索引按PageId排序，另有两个按硬宽度、硬高度降序的索引，
 * 降序值相同时按PageId升序排列。三个结构由同一把锁保护。
 */
@Slf4j
public class PageLayoutStoreImpl implements PageLayoutStore {

    private static final Comparator<PageLayoutItem> DESC_WIDTH =
            Comparator.<PageLayoutItem>comparingDouble(PageLayoutItem::hardWidthMM).reversed()
                    .thenComparing(PageLayoutItem::getPageId);

    private static final Comparator<PageLayoutItem> DESC_HEIGHT =
            Comparator.<PageLayoutItem>comparingDouble(PageLayoutItem::hardHeightMM).reversed()
                    .thenComparing(PageLayoutItem::getPageId);

    private final Map<PageId, PageLayoutItem> items;          // 主索引：页面ID -> 条目
    private final NavigableSet<PageLayoutItem> descWidthOrder;  // 按硬宽度降序
    private final NavigableSet<PageLayoutItem> descHeightOrder; // 按硬高度降序
    private final ReentrantLock lock;                          // 并发控制锁
    private final LayoutDefaults defaults;

    public PageLayoutStoreImpl() {
        this(LayoutDefaults.standard());
    }

    /**
     * 创建页面布局存储
     * @param defaults 新建条目时使用的默认值
     */
    public PageLayoutStoreImpl(LayoutDefaults defaults) {
        this.items = new TreeMap<>();
        this.descWidthOrder = new TreeSet<>(DESC_WIDTH);
        this.descHeightOrder = new TreeSet<>(DESC_HEIGHT);
        this.lock = new ReentrantLock();
        this.defaults = Objects.requireNonNull(defaults, "defaults");
        log.info("页面布局存储已创建，默认边距 {}，默认对齐 {}",
                defaults.getHardMarginsMM(), defaults.getAlignment());
    }

    @Override
    public Optional<Params> getPageParams(PageId pageId) {
        Objects.requireNonNull(pageId, "pageId");
        lock.lock();
        try {
            PageLayoutItem item = items.get(pageId);
            if (item == null) {
                return Optional.empty();
            }
            return Optional.of(item.toParams());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Margins getHardMarginsMM(PageId pageId) {
        Objects.requireNonNull(pageId, "pageId");
        lock.lock();
        try {
            PageLayoutItem item = items.get(pageId);
            return item == null ? defaults.getHardMarginsMM() : item.getHardMarginsMM();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setHardMarginsMM(PageId pageId, Margins marginsMM) {
        Objects.requireNonNull(pageId, "pageId");
        Objects.requireNonNull(marginsMM, "marginsMM");
        lock.lock();
        try {
            PageLayoutItem item = items.get(pageId);
            if (item == null) {
                insert(new PageLayoutItem(pageId, marginsMM, defaults.getContentRect(),
                        defaults.getContentSizeMM(), defaults.getAlignment()));
            } else {
                modify(item, it -> it.setHardMarginsMM(marginsMM));
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Alignment getPageAlignment(PageId pageId) {
        Objects.requireNonNull(pageId, "pageId");
        lock.lock();
        try {
            PageLayoutItem item = items.get(pageId);
            return item == null ? defaults.getAlignment() : item.getAlignment();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setPageAlignment(PageId pageId, Alignment alignment) {
        Objects.requireNonNull(pageId, "pageId");
        Objects.requireNonNull(alignment, "alignment");
        lock.lock();
        try {
            PageLayoutItem item = items.get(pageId);
            if (item == null) {
                insert(new PageLayoutItem(pageId, defaults.getHardMarginsMM(), defaults.getContentRect(),
                        defaults.getContentSizeMM(), alignment));
            } else {
                // 对齐方式不影响硬尺寸，无需调整索引
                item.setAlignment(alignment);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setContentZone(PageId pageId, RectF contentRect, SizeF contentSizeMM) {
        Objects.requireNonNull(pageId, "pageId");
        Objects.requireNonNull(contentRect, "contentRect");
        Objects.requireNonNull(contentSizeMM, "contentSizeMM");
        lock.lock();
        try {
            PageLayoutItem item = items.get(pageId);
            if (item == null) {
                insert(new PageLayoutItem(pageId, defaults.getHardMarginsMM(), contentRect,
                        contentSizeMM, defaults.getAlignment()));
            } else {
                modify(item, it -> {
                    it.setContentRect(contentRect);
                    it.setContentSizeMM(contentSizeMM);
                });
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public SizeF getAggregateHardSizeMM() {
        lock.lock();
        try {
            if (items.isEmpty()) {
                return SizeF.ZERO;
            }
            double width = descWidthOrder.first().hardWidthMM();
            double height = descHeightOrder.first().hardHeightMM();
            return new SizeF(width, height);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public SizeF getAggregateHardSizeMM(PageId pageId, SizeF hypotheticalContentSizeMM) {
        Objects.requireNonNull(pageId, "pageId");
        Objects.requireNonNull(hypotheticalContentSizeMM, "hypotheticalContentSizeMM");
        lock.lock();
        try {
            if (items.isEmpty()) {
                return SizeF.ZERO;
            }

            double width;
            {
                Iterator<PageLayoutItem> it = descWidthOrder.iterator();
                PageLayoutItem widest = it.next();
                if (!widest.getPageId().equals(pageId)) {
                    width = widest.hardWidthMM();
                } else {
                    double hypothetical = hypotheticalContentSizeMM.getWidth()
                            + widest.getHardMarginsMM().horizontal();
                    width = it.hasNext() ? Math.max(hypothetical, it.next().hardWidthMM()) : hypothetical;
                }
            }

            double height;
            {
                Iterator<PageLayoutItem> it = descHeightOrder.iterator();
                PageLayoutItem tallest = it.next();
                if (!tallest.getPageId().equals(pageId)) {
                    height = tallest.hardHeightMM();
                } else {
                    double hypothetical = hypotheticalContentSizeMM.getHeight()
                            + tallest.getHardMarginsMM().vertical();
                    height = it.hasNext() ? Math.max(hypothetical, it.next().hardHeightMM()) : hypothetical;
                }
            }

            return new SizeF(width, height);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public PageId findWidestPage() {
        lock.lock();
        try {
            if (items.isEmpty()) {
                return PageId.NULL;
            }
            return descWidthOrder.first().getPageId();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public PageId findTallestPage() {
        lock.lock();
        try {
            if (items.isEmpty()) {
                return PageId.NULL;
            }
            return descHeightOrder.first().getPageId();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean contains(PageId pageId) {
        Objects.requireNonNull(pageId, "pageId");
        lock.lock();
        try {
            return items.containsKey(pageId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            int count = items.size();
            items.clear();
            descWidthOrder.clear();
            descHeightOrder.clear();
            log.info("页面布局存储已清空，共移除 {} 个页面", count);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 按硬宽度降序返回页面ID（测试用，调用方拿到的是副本）
     */
    List<PageId> descWidthPageIds() {
        lock.lock();
        try {
            return pageIdsOf(descWidthOrder);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 按硬高度降序返回页面ID（测试用）
     */
    List<PageId> descHeightPageIds() {
        lock.lock();
        try {
            return pageIdsOf(descHeightOrder);
        } finally {
            lock.unlock();
        }
    }

    private static List<PageId> pageIdsOf(NavigableSet<PageLayoutItem> order) {
        List<PageId> result = new ArrayList<>(order.size());
        for (PageLayoutItem item : order) {
            result.add(item.getPageId());
        }
        return result;
    }

    /**
     * 插入新条目到三个索引，调用方必须持有锁
     */
    private void insert(PageLayoutItem item) {
        items.put(item.getPageId(), item);
        boolean addedW = descWidthOrder.add(item);
        boolean addedH = descHeightOrder.add(item);
        assert addedW && addedH : "duplicate entry in size order: " + item.getPageId();
        assert items.size() == descWidthOrder.size() && items.size() == descHeightOrder.size();
        log.debug("新建页面布局条目 {}，硬尺寸 {} x {}", item.getPageId(), item.hardWidthMM(), item.hardHeightMM());
    }

    /**
     * 修改影响硬尺寸的字段：先从两个降序索引中移除，修改后重新插入。
     * 调用方必须持有锁。
     */
    private void modify(PageLayoutItem item, Consumer<PageLayoutItem> modification) {
        boolean removedW = descWidthOrder.remove(item);
        boolean removedH = descHeightOrder.remove(item);
        assert removedW && removedH : "size order out of sync for " + item.getPageId();

        modification.accept(item);

        descWidthOrder.add(item);
        descHeightOrder.add(item);
        assert items.size() == descWidthOrder.size() && items.size() == descHeightOrder.size();
        log.debug("更新页面布局条目 {}，硬尺寸 {} x {}", item.getPageId(), item.hardWidthMM(), item.hardHeightMM());
    }
}
