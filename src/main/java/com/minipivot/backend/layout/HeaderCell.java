package com.minipivot.backend.layout;

import java.util.Objects;

/**
 * 列表头中的一个单元格，colSpan 为其下方叶子列的数量。
 */
public final class HeaderCell {

    private final String label;
    private final int colSpan;

    public HeaderCell(String label, int colSpan) {
        if(colSpan < 1) {
            throw new IllegalArgumentException("colSpan must be >= 1");
        }
        this.label = label;
        this.colSpan = colSpan;
    }

    public String getLabel() {
        return label;
    }

    public int getColSpan() {
        return colSpan;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof HeaderCell)) {
            return false;
        }
        HeaderCell that = (HeaderCell) o;
        return colSpan == that.colSpan && Objects.equals(label, that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, colSpan);
    }

    @Override
    public String toString() {
        return label + "x" + colSpan;
    }
}
