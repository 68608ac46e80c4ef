package com.minipivot.backend.pivot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.minipivot.backend.aggregator.CellStats;

/**
 * 透视结果中的一行：行分组字段值 + 列键 -> 单元格。
 * <p>
 * 普通数据行、小计行与总计行共用这一结构，通过 {@link Kind} 区分。
 * 仅有列分组、没有值字段时，单元格只记录“出现/未出现”，见 {@link #isPresent(String)}。
 */
public final class PivotRow {

    public static final String GRAND_TOTAL_LABEL = "Grand Total";
    public static final String SUBTOTAL_PREFIX = "Total ";

    public enum Kind {
        DATA,
        SUBTOTAL,
        GRAND_TOTAL
    }

    private final Kind kind;
    /** 按行分组层级排列的值，小计行更深层级为 null */
    private final List<String> rowValues;
    private final Map<String, CellStats> cells;
    private final Set<String> present;
    private final int subtotalLevel;
    private final String groupValue;

    private PivotRow(Kind kind, List<String> rowValues, Map<String, CellStats> cells,
                     Set<String> present, int subtotalLevel, String groupValue) {
        this.kind = kind;
        this.rowValues = Collections.unmodifiableList(new ArrayList<>(rowValues));
        this.cells = ImmutableMap.copyOf(cells);
        this.present = ImmutableSet.copyOf(present);
        this.subtotalLevel = subtotalLevel;
        this.groupValue = groupValue;
    }

    public static PivotRow data(List<String> rowValues, Map<String, CellStats> cells, Set<String> present) {
        return new PivotRow(Kind.DATA, rowValues, cells, present, -1, null);
    }

    /**
     * 小计行：祖先层级保留父分组值，本层级写入 "Total xxx"，更深层级置空。
     */
    public static PivotRow subtotal(int level, List<String> parentValues, String groupValue,
                                    int depth, Map<String, CellStats> cells) {
        List<String> values = new ArrayList<>(depth);
        for (int i = 0; i < depth; i++) {
            if(i < level) {
                values.add(parentValues.get(i));
            } else if(i == level) {
                values.add(SUBTOTAL_PREFIX + groupValue);
            } else {
                values.add(null);
            }
        }
        return new PivotRow(Kind.SUBTOTAL, values, cells, Collections.emptySet(), level, groupValue);
    }

    public static PivotRow grandTotal(int depth, Map<String, CellStats> cells) {
        List<String> values = new ArrayList<>(depth);
        for (int i = 0; i < depth; i++) {
            values.add(i == 0 ? GRAND_TOTAL_LABEL : null);
        }
        return new PivotRow(Kind.GRAND_TOTAL, values, cells, Collections.emptySet(), -1, null);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isData() {
        return kind == Kind.DATA;
    }

    public boolean isSubtotal() {
        return kind == Kind.SUBTOTAL;
    }

    public boolean isGrandTotal() {
        return kind == Kind.GRAND_TOTAL;
    }

    public List<String> getRowValues() {
        return rowValues;
    }

    /** 指定层级的行分组值 */
    public String value(int level) {
        return level < rowValues.size() ? rowValues.get(level) : null;
    }

    public Map<String, CellStats> getCells() {
        return cells;
    }

    /** 列键对应的统计，无记录落入该单元格时返回 null */
    public CellStats cell(String colKey) {
        return cells.get(colKey);
    }

    public Set<String> getPresent() {
        return present;
    }

    public boolean isPresent(String colKey) {
        return present.contains(colKey) || cells.containsKey(colKey);
    }

    /** 小计所关闭的分组层级，非小计行为 -1 */
    public int getSubtotalLevel() {
        return subtotalLevel;
    }

    public String getSubtotalLabel() {
        return kind == Kind.SUBTOTAL ? SUBTOTAL_PREFIX + groupValue : null;
    }

    /** 小计行所汇总分组的原始值 */
    public String getGroupValue() {
        return groupValue;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof PivotRow)) {
            return false;
        }
        PivotRow that = (PivotRow) o;
        return kind == that.kind
                && subtotalLevel == that.subtotalLevel
                && rowValues.equals(that.rowValues)
                && cells.equals(that.cells)
                && present.equals(that.present);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, rowValues, cells, present, subtotalLevel);
    }

    @Override
    public String toString() {
        return kind + rowValues.toString() + cells;
    }
}
