package org.lupenghan.pagelayout.settings.models;

import lombok.Builder;
import lombok.Getter;
import org.lupenghan.pagelayout.geometry.models.Alignment;
import org.lupenghan.pagelayout.geometry.models.Margins;
import org.lupenghan.pagelayout.geometry.models.RectF;
import org.lupenghan.pagelayout.geometry.models.SizeF;

/**
 * 新建条目时未提供字段所使用的默认值
 */
@Getter
@Builder
public class LayoutDefaults {
    @Builder.Default
    private final Margins hardMarginsMM = new Margins(10.0, 5.0, 10.0, 5.0);
    @Builder.Default
    private final Alignment alignment = new Alignment(Alignment.Vertical.VCENTER, Alignment.Horizontal.HCENTER);
    @Builder.Default
    private final SizeF contentSizeMM = SizeF.ZERO;
    @Builder.Default
    private final RectF contentRect = RectF.EMPTY;

    public static LayoutDefaults standard() {
        return LayoutDefaults.builder().build();
    }
}
