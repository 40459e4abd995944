package org.lupenghan.pagelayout.settings.interfaces;

import org.lupenghan.pagelayout.geometry.models.Alignment;
import org.lupenghan.pagelayout.geometry.models.Margins;
import org.lupenghan.pagelayout.geometry.models.RectF;
import org.lupenghan.pagelayout.geometry.models.SizeF;
import org.lupenghan.pagelayout.page.models.PageId;
import org.lupenghan.pagelayout.settings.models.Params;

import java.util.Optional;

/**
 * 页面布局参数存储接口 - 按页面保存边距、内容区域和对齐方式，
 * 并维护按硬宽度/硬高度降序的两个索引以支持整体尺寸查询。
 * 所有方法都是线程安全的，返回值均为不可变的副本。
 */
public interface PageLayoutStore {
    /**
     * 获取页面的全部布局参数
     * @param pageId 页面ID
     * @return 参数快照，页面不存在时为空
     */
    Optional<Params> getPageParams(PageId pageId);

    /**
     * 获取页面的硬边距
     * @param pageId 页面ID
     * @return 已保存的边距，页面不存在时返回默认边距
     */
    Margins getHardMarginsMM(PageId pageId);

    /**
     * 设置页面的硬边距，页面不存在时以默认值创建
     * @param pageId 页面ID
     * @param marginsMM 边距（毫米）
     */
    void setHardMarginsMM(PageId pageId, Margins marginsMM);

    /**
     * 获取页面的对齐方式
     * @param pageId 页面ID
     * @return 已保存的对齐方式，页面不存在时返回默认值
     */
    Alignment getPageAlignment(PageId pageId);

    /**
     * 设置页面的对齐方式，页面不存在时以默认值创建
     * @param pageId 页面ID
     * @param alignment 对齐方式
     */
    void setPageAlignment(PageId pageId, Alignment alignment);

    /**
     * 同时设置内容区域矩形和内容尺寸，页面不存在时以默认值创建
     * @param pageId 页面ID
     * @param contentRect 内容区域（像素坐标）
     * @param contentSizeMM 内容尺寸（毫米）
     */
    void setContentZone(PageId pageId, RectF contentRect, SizeF contentSizeMM);

    /**
     * 所有页面硬宽度和硬高度各自的最大值
     * @return 整体硬尺寸，存储为空时为(0,0)
     */
    SizeF getAggregateHardSizeMM();

    /**
     * 假设指定页面的内容尺寸变为hypotheticalContentSizeMM时的整体硬尺寸，不修改存储。
     * 只有当该页面正是某个方向上的当前最大值时，假设值才会参与该方向的计算。
     * @param pageId 页面ID
     * @param hypotheticalContentSizeMM 假设的内容尺寸（毫米）
     * @return 整体硬尺寸，存储为空时为(0,0)
     */
    SizeF getAggregateHardSizeMM(PageId pageId, SizeF hypotheticalContentSizeMM);

    /**
     * @return 硬宽度最大的页面，存储为空时返回 {@link PageId#NULL}
     */
    PageId findWidestPage();

    /**
     * @return 硬高度最大的页面，存储为空时返回 {@link PageId#NULL}
     */
    PageId findTallestPage();

    /**
     * 获取当前保存的页面数量
     * @return 页面数量
     */
    int size();

    boolean contains(PageId pageId);

    /**
     * 清空所有页面（文档会话重置时使用）
     */
    void clear();
}
