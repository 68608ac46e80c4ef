package com.minipivot.backend.engine;

import com.minipivot.backend.estimate.CardinalityEstimator;
import com.minipivot.backend.estimate.ColumnLimiter;

/**
 * 引擎参数：告警阈值、采样大小与列裁剪上限。
 */
public final class EngineOptions {

    private final int warningThreshold;
    private final int sampleSize;
    private final int maxColumns;
    private final int minCombinations;

    public EngineOptions(int warningThreshold, int sampleSize, int maxColumns, int minCombinations) {
        this.warningThreshold = warningThreshold;
        this.sampleSize = sampleSize;
        this.maxColumns = maxColumns;
        this.minCombinations = minCombinations;
    }

    public static EngineOptions defaults() {
        return new EngineOptions(
                CardinalityEstimator.DEFAULT_WARNING_THRESHOLD,
                CardinalityEstimator.DEFAULT_SAMPLE_SIZE,
                ColumnLimiter.DEFAULT_MAX_COLUMNS,
                ColumnLimiter.DEFAULT_MIN_COMBINATIONS);
    }

    public int getWarningThreshold() {
        return warningThreshold;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public int getMaxColumns() {
        return maxColumns;
    }

    public int getMinCombinations() {
        return minCombinations;
    }
}
