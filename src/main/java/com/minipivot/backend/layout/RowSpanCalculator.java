package com.minipivot.backend.layout;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;
import com.minipivot.backend.pivot.PivotRow;

/**
 * 计算行分组列的纵向合并跨度。
 * <p>
 * 第 L 层只合并 0..L 层取值完全相同的连续数据行；小计行从两侧截断合并区间，
 * 自身只在其小计层级占 1 行。
 */
public class RowSpanCalculator {

    private RowSpanCalculator() {
    }

    /**
     * @return 按行索引、再按层级索引的合并信息；表或行分组为空时返回空列表
     */
    public static List<List<RowSpanInfo>> compute(List<PivotRow> rows, List<String> rowFields) {
        int depth = rowFields.size();
        if(rows.isEmpty() || depth == 0) {
            return ImmutableList.of();
        }

        RowSpanInfo[][] spans = new RowSpanInfo[rows.size()][depth];
        for (int i = 0; i < rows.size(); i++) {
            PivotRow row = rows.get(i);
            if(!row.isData()) {
                int level = row.getSubtotalLevel();
                for (int lvl = 0; lvl < depth; lvl++) {
                    spans[i][lvl] = new RowSpanInfo(lvl == level ? 1 : 0, row.isSubtotal(), level);
                }
            }
        }

        for (int lvl = 0; lvl < depth; lvl++) {
            int i = 0;
            while (i < rows.size()) {
                if(!rows.get(i).isData()) {
                    i++;
                    continue;
                }
                int j = i + 1;
                while (j < rows.size() && rows.get(j).isData() && samePath(rows.get(i), rows.get(j), lvl)) {
                    j++;
                }
                spans[i][lvl] = new RowSpanInfo(j - i, false, -1);
                for (int k = i + 1; k < j; k++) {
                    spans[k][lvl] = new RowSpanInfo(0, false, -1);
                }
                i = j;
            }
        }

        List<List<RowSpanInfo>> result = new ArrayList<>(rows.size());
        for (RowSpanInfo[] row : spans) {
            result.add(ImmutableList.copyOf(row));
        }
        return ImmutableList.copyOf(result);
    }

    private static boolean samePath(PivotRow a, PivotRow b, int level) {
        for (int k = 0; k <= level; k++) {
            if(!Objects.equals(a.value(k), b.value(k))) {
                return false;
            }
        }
        return true;
    }
}
