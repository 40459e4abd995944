package org.lupenghan.pagelayout.settings.models;

import lombok.Data;
import org.lupenghan.pagelayout.geometry.models.Alignment;
import org.lupenghan.pagelayout.geometry.models.Margins;
import org.lupenghan.pagelayout.geometry.models.RectF;
import org.lupenghan.pagelayout.geometry.models.SizeF;

/**
 * 返回给调用方的页面布局参数快照
 */
@Data
public final class Params {
    private final Margins hardMarginsMM;
    private final RectF contentRect;
    private final SizeF contentSizeMM;
    private final Alignment alignment;
}
