package com.minipivot.backend.pivot;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 由已插入小计的表计算总计行。
 * <p>
 * 合并所有第 0 层小计行，以及没有第 0 层小计的分组（单行分组）的数据行，
 * 被小计覆盖的数据行不会重复计入。
 */
public class GrandTotalCalculator {

    private GrandTotalCalculator() {
    }

    /**
     * @return 总计行；表为空时返回 null
     */
    public static PivotRow compute(List<PivotRow> table, List<String> rowFields, List<String> colKeys) {
        if(table.isEmpty()) {
            return null;
        }
        if(rowFields.isEmpty()) {
            // 无行分组时只有 TOTAL 一行，总计即其本身
            for (PivotRow row : table) {
                if(row.isData()) {
                    return PivotRow.grandTotal(0, row.getCells());
                }
            }
            return null;
        }

        Set<String> covered = new HashSet<>();
        for (PivotRow row : table) {
            if(row.isSubtotal() && row.getSubtotalLevel() == 0) {
                covered.add(row.getGroupValue());
            }
        }
        List<PivotRow> parts = new ArrayList<>();
        for (PivotRow row : table) {
            if(row.isSubtotal()) {
                if(row.getSubtotalLevel() == 0) {
                    parts.add(row);
                }
            } else if(row.isData() && !covered.contains(row.value(0))) {
                parts.add(row);
            }
        }
        return PivotRow.grandTotal(rowFields.size(), SubtotalBuilder.mergeCells(parts, colKeys));
    }
}
