package com.minipivot.backend.engine;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.minipivot.backend.aggregator.AggregationSpec;
import com.minipivot.common.Error;

/**
 * 一次透视请求：行分组字段（外层在前）、列分组字段与值项。不可变，可作为缓存键。
 */
public final class PivotRequest {

    public static final PivotRequest EMPTY = new PivotRequest(List.of(), List.of(), List.of());

    private final List<String> rowFields;
    private final List<String> columnFields;
    private final List<AggregationSpec> values;

    private PivotRequest(List<String> rowFields, List<String> columnFields, List<AggregationSpec> values) {
        this.rowFields = ImmutableList.copyOf(rowFields);
        this.columnFields = ImmutableList.copyOf(columnFields);
        this.values = ImmutableList.copyOf(values);
    }

    public static PivotRequest of(List<String> rowFields, List<String> columnFields, List<AggregationSpec> values) {
        return new PivotRequest(
                Objects.requireNonNull(rowFields, "rowFields"),
                Objects.requireNonNull(columnFields, "columnFields"),
                Objects.requireNonNull(values, "values"));
    }

    /**
     * 校验字段名非空且同一分组内不重复。行、列之间重复不做限制。
     */
    public void validate() throws Exception {
        checkGroupFields(rowFields);
        checkGroupFields(columnFields);
        for (AggregationSpec spec : values) {
            if(spec.getField().isBlank()) {
                throw Error.InvalidValueFieldException;
            }
        }
    }

    private static void checkGroupFields(List<String> fields) throws Exception {
        Set<String> seen = new HashSet<>();
        for (String f : fields) {
            if(f.isBlank()) {
                throw Error.InvalidGroupFieldException;
            }
            if(!seen.add(f)) {
                throw Error.DuplicateGroupFieldException;
            }
        }
    }

    public List<String> getRowFields() {
        return rowFields;
    }

    public List<String> getColumnFields() {
        return columnFields;
    }

    public List<AggregationSpec> getValues() {
        return values;
    }

    public boolean hasValues() {
        return !values.isEmpty();
    }

    /** 三个区域都为空时不做透视，展示原始数据 */
    public boolean isEmpty() {
        return rowFields.isEmpty() && columnFields.isEmpty() && values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof PivotRequest)) {
            return false;
        }
        PivotRequest that = (PivotRequest) o;
        return rowFields.equals(that.rowFields)
                && columnFields.equals(that.columnFields)
                && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowFields, columnFields, values);
    }

    @Override
    public String toString() {
        return "PivotRequest{rows=" + rowFields + ", columns=" + columnFields + ", values=" + values + "}";
    }
}
