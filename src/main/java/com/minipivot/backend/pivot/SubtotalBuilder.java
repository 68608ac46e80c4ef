package com.minipivot.backend.pivot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.minipivot.backend.aggregator.CellStats;
import com.minipivot.backend.aggregator.CellStatsAccumulator;

/**
 * 按行分组层级递归划分扁平表，在每个包含多行的分组之后插入小计行。
 * <p>
 * 同层分组按分组值字典序处理。小计统计由“覆盖集”合并得到：
 * 覆盖集由下一层的小计行与未被小计覆盖的独立行组成，二者互不重叠，
 * 因此任何叶子行都只被计入一次。
 */
public class SubtotalBuilder {

    private SubtotalBuilder() {
    }

    public static List<PivotRow> insertSubtotals(List<PivotRow> table, List<String> rowFields, List<String> colKeys) {
        if(rowFields.isEmpty() || table.isEmpty()) {
            return table;
        }
        return process(table, 0, new ArrayList<>(), rowFields.size(), colKeys).rows;
    }

    private static GroupOutput process(List<PivotRow> rows, int level, List<String> parentValues,
                                       int depth, List<String> colKeys) {
        // TreeMap 保证分组按值字典序输出，组内保持原有顺序
        Map<String, List<PivotRow>> groups = new TreeMap<>();
        for (PivotRow row : rows) {
            groups.computeIfAbsent(row.value(level), k -> new ArrayList<>()).add(row);
        }

        GroupOutput out = new GroupOutput();
        boolean last = level == depth - 1;
        for (Map.Entry<String, List<PivotRow>> e : groups.entrySet()) {
            String groupValue = e.getKey();
            List<PivotRow> childRows;
            List<PivotRow> childCover;
            if(last) {
                childRows = e.getValue();
                childCover = e.getValue();
            } else {
                List<String> path = new ArrayList<>(parentValues);
                path.add(groupValue);
                GroupOutput child = process(e.getValue(), level + 1, path, depth, colKeys);
                childRows = child.rows;
                childCover = child.cover;
            }

            out.rows.addAll(childRows);
            if(childRows.size() > 1) {
                PivotRow subtotal = PivotRow.subtotal(level, parentValues, groupValue, depth,
                        mergeCells(childCover, colKeys));
                out.rows.add(subtotal);
                out.cover.add(subtotal);
            } else {
                out.cover.addAll(childCover);
            }
        }
        return out;
    }

    /**
     * 逐列合并一组互不重叠行的统计；所有行在该列都为空时该列保持为空。
     */
    static Map<String, CellStats> mergeCells(List<PivotRow> rows, List<String> colKeys) {
        Map<String, CellStats> cells = new LinkedHashMap<>();
        for (String colKey : colKeys) {
            List<CellStats> parts = new ArrayList<>(rows.size());
            for (PivotRow row : rows) {
                CellStats s = row.cell(colKey);
                if(s != null) {
                    parts.add(s);
                }
            }
            if(!parts.isEmpty()) {
                cells.put(colKey, CellStatsAccumulator.merge(parts));
            }
        }
        return cells;
    }

    private static final class GroupOutput {
        /** 输出行（含插入的小计） */
        private final List<PivotRow> rows = new ArrayList<>();
        /** 汇总本层所有分组所需的最小不重叠行集合 */
        private final List<PivotRow> cover = new ArrayList<>();
    }
}
