package com.minipivot.backend.aggregator;

import java.util.Objects;

import com.minipivot.common.Error;

/**
 * 值区域中的一项：字段 + 聚合函数。
 */
public final class AggregationSpec {

    private final String field;
    private final AggregateFunc func;

    public AggregationSpec(String field, AggregateFunc func) {
        this.field = Objects.requireNonNull(field, "field");
        this.func = Objects.requireNonNull(func, "func");
    }

    public static AggregationSpec of(String field, AggregateFunc func) {
        return new AggregationSpec(field, func);
    }

    /**
     * 解析客户端传入的字段与聚合函数名。
     */
    public static AggregationSpec parse(String field, String aggregator) throws Exception {
        if(field == null || field.isBlank()) {
            throw Error.InvalidValueFieldException;
        }
        return new AggregationSpec(field, AggregateFunc.from(aggregator));
    }

    public String getField() {
        return field;
    }

    public AggregateFunc getFunc() {
        return func;
    }

    /** 列键中的聚合标签，如 sales(sum) */
    public String label() {
        return field + "(" + func.tag() + ")";
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof AggregationSpec)) {
            return false;
        }
        AggregationSpec that = (AggregationSpec) o;
        return field.equals(that.field) && func == that.func;
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, func);
    }

    @Override
    public String toString() {
        return label();
    }
}
