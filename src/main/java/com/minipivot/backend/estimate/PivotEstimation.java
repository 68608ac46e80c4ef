package com.minipivot.backend.estimate;

/**
 * 列数估算结果，交给告警展示方决定是否继续。
 */
public final class PivotEstimation {

    private final long estimatedColumns;
    private final boolean shouldWarn;
    private final long uniqueColumnCombinations;

    public PivotEstimation(long estimatedColumns, boolean shouldWarn, long uniqueColumnCombinations) {
        this.estimatedColumns = estimatedColumns;
        this.shouldWarn = shouldWarn;
        this.uniqueColumnCombinations = uniqueColumnCombinations;
    }

    public long getEstimatedColumns() {
        return estimatedColumns;
    }

    public boolean isShouldWarn() {
        return shouldWarn;
    }

    public long getUniqueColumnCombinations() {
        return uniqueColumnCombinations;
    }

    @Override
    public String toString() {
        return "PivotEstimation{estimatedColumns=" + estimatedColumns
                + ", shouldWarn=" + shouldWarn
                + ", uniqueColumnCombinations=" + uniqueColumnCombinations + "}";
    }
}
