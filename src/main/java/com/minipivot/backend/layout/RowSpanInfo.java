package com.minipivot.backend.layout;

import java.util.Objects;

/**
 * 某行某个行分组层级的纵向合并信息。
 * span = 0 表示该单元格被上方单元格覆盖，不需要渲染；span = k 表示从本行起合并 k 行。
 */
public final class RowSpanInfo {

    private final int span;
    private final boolean subtotal;
    /** 小计行的小计层级，数据行为 -1 */
    private final int level;

    public RowSpanInfo(int span, boolean subtotal, int level) {
        this.span = span;
        this.subtotal = subtotal;
        this.level = level;
    }

    public int getSpan() {
        return span;
    }

    public boolean isSubtotal() {
        return subtotal;
    }

    public int getLevel() {
        return level;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof RowSpanInfo)) {
            return false;
        }
        RowSpanInfo that = (RowSpanInfo) o;
        return span == that.span && subtotal == that.subtotal && level == that.level;
    }

    @Override
    public int hashCode() {
        return Objects.hash(span, subtotal, level);
    }

    @Override
    public String toString() {
        return "RowSpanInfo{span=" + span + ", subtotal=" + subtotal + ", level=" + level + "}";
    }
}
