package com.minipivot.backend.pivot;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.minipivot.backend.aggregator.AggregationSpec;
import com.minipivot.backend.aggregator.CellStats;
import com.minipivot.backend.aggregator.CellStatsAccumulator;
import com.minipivot.backend.record.Record;

/**
 * 单次遍历记录，按 (行键, 列键) 分桶累加统计，生成未插入小计的扁平表。
 * <p>
 * 列顺序：列键去重后按字典序排序；行顺序：行键首次出现的顺序。
 */
public class Aggregator {

    private Aggregator() {
    }

    public static AggregateResult aggregate(List<Record> records, List<String> rowFields,
                                            List<String> colFields, List<AggregationSpec> values) {
        if(records.isEmpty()) {
            return new AggregateResult(List.of(), List.of(), Map.of());
        }
        // 重复的值项落在同一列，只统计一次
        List<AggregationSpec> specs = new ArrayList<>(new LinkedHashSet<>(values));
        boolean hasValues = !specs.isEmpty();
        boolean hasColumns = !colFields.isEmpty();

        // 行键 -> (列键 -> 累加器)，LinkedHashMap 保留行键首次出现顺序
        Map<String, Map<String, CellStatsAccumulator>> buckets = new LinkedHashMap<>();
        Map<String, Set<String>> presence = new HashMap<>();
        TreeSet<String> colKeys = new TreeSet<>();
        Map<String, AggregationSpec> colAggInfo = new HashMap<>();

        for (Record record : records) {
            String rowKey = KeyBuilder.rowKey(rowFields, record);
            Map<String, CellStatsAccumulator> row = buckets.computeIfAbsent(rowKey, k -> new HashMap<>());
            String colKeyBase = KeyBuilder.columnKey(colFields, record);

            if(hasValues) {
                for (AggregationSpec spec : specs) {
                    String colKey = KeyBuilder.withAggregation(colKeyBase, hasColumns, spec.label());
                    if(colKeys.add(colKey)) {
                        colAggInfo.put(colKey, spec);
                    }
                    row.computeIfAbsent(colKey, k -> new CellStatsAccumulator(spec.getField())).accept(record);
                }
            } else if(hasColumns) {
                // 仅列分组：单元格只记录是否出现
                colKeys.add(colKeyBase);
                presence.computeIfAbsent(rowKey, k -> new LinkedHashSet<>()).add(colKeyBase);
            }
        }

        List<PivotRow> table = new ArrayList<>(buckets.size());
        for (Map.Entry<String, Map<String, CellStatsAccumulator>> e : buckets.entrySet()) {
            String rowKey = e.getKey();
            List<String> rowValues = KeyBuilder.split(rowKey, rowFields.size());
            // 按列序输出单元格，保证结果与插入顺序无关
            Map<String, CellStats> cells = new LinkedHashMap<>();
            for (String colKey : colKeys) {
                CellStatsAccumulator acc = e.getValue().get(colKey);
                if(acc != null) {
                    cells.put(colKey, acc.toStats());
                }
            }
            Set<String> present = presence.getOrDefault(rowKey, Set.of());
            table.add(PivotRow.data(rowValues, cells, new TreeSet<>(present)));
        }
        return new AggregateResult(table, new ArrayList<>(colKeys), new TreeMap<>(colAggInfo));
    }
}
