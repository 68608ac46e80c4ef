package com.minipivot.backend.pivot;

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.minipivot.backend.aggregator.AggregationSpec;

/**
 * {@link Aggregator} 的输出：未插入小计的扁平表、排好序的列键以及列键 -> 聚合信息。
 */
public final class AggregateResult {

    private final List<PivotRow> table;
    private final List<String> colKeys;
    private final Map<String, AggregationSpec> colAggInfo;

    public AggregateResult(List<PivotRow> table, List<String> colKeys, Map<String, AggregationSpec> colAggInfo) {
        this.table = ImmutableList.copyOf(table);
        this.colKeys = ImmutableList.copyOf(colKeys);
        this.colAggInfo = ImmutableMap.copyOf(colAggInfo);
    }

    public List<PivotRow> getTable() {
        return table;
    }

    public List<String> getColKeys() {
        return colKeys;
    }

    public Map<String, AggregationSpec> getColAggInfo() {
        return colAggInfo;
    }

    public boolean isEmpty() {
        return table.isEmpty();
    }
}
