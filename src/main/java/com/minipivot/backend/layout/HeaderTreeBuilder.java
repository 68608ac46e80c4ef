package com.minipivot.backend.layout;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.minipivot.backend.pivot.KeyBuilder;

/**
 * 由有序叶子列键构造多行列表头。
 * <p>
 * 每个列分组字段一行，存在值字段时再加一行聚合标签。同一行内，标签相同且所有更浅层级
 * 标签也相同的相邻叶子列合并为一个单元格。空字符串值按原样显示，只有缺失的层级显示为 N/A。
 */
public class HeaderTreeBuilder {

    private HeaderTreeBuilder() {
    }

    public static List<List<HeaderCell>> build(List<String> leafCols, List<String> colFields, boolean withValueLabels) {
        if(leafCols.isEmpty()) {
            return ImmutableList.of();
        }
        int groupLevels = colFields.size();
        if(groupLevels == 0) {
            ImmutableList.Builder<HeaderCell> row = ImmutableList.builder();
            for (String col : leafCols) {
                row.add(new HeaderCell(col, 1));
            }
            return ImmutableList.of(row.build());
        }

        int partCount = withValueLabels ? groupLevels + 1 : groupLevels;
        List<List<String>> parts = new ArrayList<>(leafCols.size());
        for (String col : leafCols) {
            parts.add(KeyBuilder.split(col, partCount));
        }

        ImmutableList.Builder<List<HeaderCell>> headerRows = ImmutableList.builder();
        for (int level = 0; level < partCount; level++) {
            List<HeaderCell> row = new ArrayList<>();
            int i = 0;
            while (i < leafCols.size()) {
                String label = labelAt(parts.get(i), level);
                int j = i + 1;
                while (j < leafCols.size()
                        && label.equals(labelAt(parts.get(j), level))
                        && sameAncestors(parts.get(i), parts.get(j), level)) {
                    j++;
                }
                row.add(new HeaderCell(label, j - i));
                i = j;
            }
            headerRows.add(ImmutableList.copyOf(row));
        }
        return headerRows.build();
    }

    private static String labelAt(List<String> parts, int level) {
        if(level >= parts.size()) {
            return KeyBuilder.MISSING;
        }
        return parts.get(level);
    }

    private static boolean sameAncestors(List<String> a, List<String> b, int level) {
        for (int k = 0; k < level; k++) {
            if(!labelAt(a, k).equals(labelAt(b, k))) {
                return false;
            }
        }
        return true;
    }
}
