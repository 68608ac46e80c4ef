package com.minipivot.backend.estimate;

/**
 * 列裁剪结果摘要，用于界面提示“仅显示部分列”。
 */
public final class ColumnLimitInfo {

    public static final ColumnLimitInfo NONE = new ColumnLimitInfo(false, 0, 0);

    private final boolean columnsLimited;
    private final long originalColumns;
    private final long displayedColumns;

    public ColumnLimitInfo(boolean columnsLimited, long originalColumns, long displayedColumns) {
        this.columnsLimited = columnsLimited;
        this.originalColumns = originalColumns;
        this.displayedColumns = displayedColumns;
    }

    public boolean isColumnsLimited() {
        return columnsLimited;
    }

    public long getOriginalColumns() {
        return originalColumns;
    }

    public long getDisplayedColumns() {
        return displayedColumns;
    }

    @Override
    public String toString() {
        return "ColumnLimitInfo{columnsLimited=" + columnsLimited
                + ", originalColumns=" + originalColumns
                + ", displayedColumns=" + displayedColumns + "}";
    }
}
