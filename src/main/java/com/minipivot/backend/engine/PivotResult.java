package com.minipivot.backend.engine;

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.minipivot.backend.aggregator.AggregationSpec;
import com.minipivot.backend.aggregator.CellStats;
import com.minipivot.backend.estimate.ColumnLimitInfo;
import com.minipivot.backend.layout.HeaderCell;
import com.minipivot.backend.layout.RowSpanInfo;
import com.minipivot.backend.pivot.PivotRow;

/**
 * 完整的透视结果，交给渲染方使用。整体构造完成后才对外可见，不存在部分结果。
 */
public final class PivotResult {

    private final List<PivotRow> table;
    private final PivotRow grandTotal;
    private final List<String> rowGroups;
    private final List<String> colGroups;
    private final List<String> leafCols;
    private final List<List<HeaderCell>> headerRows;
    private final List<List<RowSpanInfo>> rowSpans;
    private final Map<String, AggregationSpec> colAggInfo;
    private final ColumnLimitInfo columnLimitInfo;
    private final long elapsedNanos;
    /** 存在总计且有行分组时才需要渲染单独的总计行 */
    private final boolean hasGrandTotal;
    private final boolean hasOnlyRows;

    PivotResult(List<PivotRow> table,
                PivotRow grandTotal,
                List<String> rowGroups,
                List<String> colGroups,
                List<String> leafCols,
                List<List<HeaderCell>> headerRows,
                List<List<RowSpanInfo>> rowSpans,
                Map<String, AggregationSpec> colAggInfo,
                ColumnLimitInfo columnLimitInfo,
                long elapsedNanos) {
        this.table = ImmutableList.copyOf(table);
        this.grandTotal = grandTotal;
        this.rowGroups = ImmutableList.copyOf(rowGroups);
        this.colGroups = ImmutableList.copyOf(colGroups);
        this.leafCols = ImmutableList.copyOf(leafCols);
        this.headerRows = ImmutableList.copyOf(headerRows);
        this.rowSpans = ImmutableList.copyOf(rowSpans);
        this.colAggInfo = ImmutableMap.copyOf(colAggInfo);
        this.columnLimitInfo = columnLimitInfo;
        this.elapsedNanos = elapsedNanos;
        this.hasGrandTotal = grandTotal != null && !rowGroups.isEmpty();
        this.hasOnlyRows = !rowGroups.isEmpty() && leafCols.isEmpty();
    }

    public List<PivotRow> getTable() {
        return table;
    }

    /** 表为空或仅列分组（无值字段）时为 null */
    public PivotRow getGrandTotal() {
        return grandTotal;
    }

    public List<String> getRowGroups() {
        return rowGroups;
    }

    public List<String> getColGroups() {
        return colGroups;
    }

    public List<String> getLeafCols() {
        return leafCols;
    }

    public List<List<HeaderCell>> getHeaderRows() {
        return headerRows;
    }

    public List<List<RowSpanInfo>> getRowSpans() {
        return rowSpans;
    }

    public Map<String, AggregationSpec> getColAggInfo() {
        return colAggInfo;
    }

    /** 未启用列裁剪时为 null */
    public ColumnLimitInfo getColumnLimitInfo() {
        return columnLimitInfo;
    }

    public long getElapsedNanos() {
        return elapsedNanos;
    }

    public boolean isHasGrandTotal() {
        return hasGrandTotal;
    }

    public boolean isHasOnlyRows() {
        return hasOnlyRows;
    }

    /**
     * 按列键上的聚合函数读取单元格展示值。
     *
     * @return 展示值；单元格为空、列键未知或无有效数值时返回 null
     */
    public Double valueOf(PivotRow row, String colKey) {
        AggregationSpec spec = colAggInfo.get(colKey);
        CellStats stats = row.cell(colKey);
        if(spec == null || stats == null) {
            return null;
        }
        return spec.getFunc().read(stats);
    }
}
