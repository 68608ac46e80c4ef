package com.minipivot.backend.estimate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import com.minipivot.backend.aggregator.AggregationSpec;
import com.minipivot.backend.pivot.KeyBuilder;
import com.minipivot.backend.record.Record;

/**
 * 用户接受告警后，只保留字典序前 N 个列组合对应的记录。
 * <p>
 * 列组合在全量数据上精确统计（不采样），N = max(minCombinations, floor(maxColumns / 值项数))。
 */
public class ColumnLimiter {

    public static final int DEFAULT_MAX_COLUMNS = 1000;
    public static final int DEFAULT_MIN_COMBINATIONS = 10;

    private final int maxColumns;
    private final int minCombinations;

    public ColumnLimiter() {
        this(DEFAULT_MAX_COLUMNS, DEFAULT_MIN_COMBINATIONS);
    }

    public ColumnLimiter(int maxColumns, int minCombinations) {
        if(maxColumns < 1 || minCombinations < 1) {
            throw new IllegalArgumentException("maxColumns and minCombinations must be positive");
        }
        this.maxColumns = maxColumns;
        this.minCombinations = minCombinations;
    }

    public LimitedData limit(List<Record> records, List<String> colFields, List<AggregationSpec> values) {
        if(colFields.isEmpty() || records.isEmpty()) {
            return new LimitedData(records, ColumnLimitInfo.NONE);
        }
        int valueCount = Math.max(1, values.size());

        TreeSet<String> combos = new TreeSet<>();
        for (Record r : records) {
            combos.add(KeyBuilder.columnKey(colFields, r));
        }

        int keep = Math.max(minCombinations, maxColumns / valueCount);
        Set<String> kept = new HashSet<>();
        for (String combo : combos) {
            if(kept.size() >= keep) {
                break;
            }
            kept.add(combo);
        }

        List<Record> limited;
        if(kept.size() == combos.size()) {
            limited = records;
        } else {
            limited = new ArrayList<>();
            for (Record r : records) {
                if(kept.contains(KeyBuilder.columnKey(colFields, r))) {
                    limited.add(r);
                }
            }
        }
        ColumnLimitInfo info = new ColumnLimitInfo(
                kept.size() < combos.size(),
                (long) combos.size() * valueCount,
                (long) kept.size() * valueCount);
        return new LimitedData(limited, info);
    }

    public int getMaxColumns() {
        return maxColumns;
    }

    public int getMinCombinations() {
        return minCombinations;
    }
}
