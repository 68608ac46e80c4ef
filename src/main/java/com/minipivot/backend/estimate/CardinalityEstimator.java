package com.minipivot.backend.estimate;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.minipivot.backend.aggregator.AggregationSpec;
import com.minipivot.backend.pivot.KeyBuilder;
import com.minipivot.backend.record.Record;

/**
 * 基于采样估算透视结果的列数，在真正计算前决定是否需要告警。
 * <p>
 * 取前 sampleSize 条记录构造列组合键，去重数超过阈值即提前停止；
 * 数据量大于样本时按 总数 / 样本数 线性外推并向上取整。
 */
public class CardinalityEstimator {

    public static final int DEFAULT_WARNING_THRESHOLD = 1000;
    public static final int DEFAULT_SAMPLE_SIZE = 10_000;

    private final int warningThreshold;
    private final int sampleSize;

    public CardinalityEstimator() {
        this(DEFAULT_WARNING_THRESHOLD, DEFAULT_SAMPLE_SIZE);
    }

    public CardinalityEstimator(int warningThreshold, int sampleSize) {
        if(warningThreshold < 1 || sampleSize < 1) {
            throw new IllegalArgumentException("warningThreshold and sampleSize must be positive");
        }
        this.warningThreshold = warningThreshold;
        this.sampleSize = sampleSize;
    }

    public PivotEstimation estimate(List<Record> records, List<String> colFields, List<AggregationSpec> values) {
        if(colFields.isEmpty() || records.isEmpty()) {
            // 没有列分组时列数就是值项数，不会发生列爆炸
            return new PivotEstimation(values.size(), false, 0);
        }

        int sample = Math.min(records.size(), sampleSize);
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < sample; i++) {
            seen.add(KeyBuilder.columnKey(colFields, records.get(i)));
            if(seen.size() > warningThreshold) {
                break;
            }
        }

        long unique = seen.size();
        long combos = sample < records.size()
                ? (long) Math.ceil((double) unique * records.size() / sample)
                : unique;
        long estimatedColumns = combos * Math.max(1, values.size());
        return new PivotEstimation(estimatedColumns, estimatedColumns > warningThreshold, combos);
    }

    public int getWarningThreshold() {
        return warningThreshold;
    }

    public int getSampleSize() {
        return sampleSize;
    }
}
