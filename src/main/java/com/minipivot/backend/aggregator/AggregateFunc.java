package com.minipivot.backend.aggregator;

import java.util.Locale;

import com.minipivot.common.Error;

/**
 * 透视表支持的聚合函数。
 * <p>
 * 所有函数共享同一份 {@link CellStats}，展示值在读取时派生，
 * 因此 AVG 永远是 sum / validCount，而不是“平均值的平均值”。
 */
public enum AggregateFunc {
    SUM(true) {
        @Override
        public Double read(CellStats stats) {
            return stats.getSum();
        }
    },
    AVG(true) {
        @Override
        public Double read(CellStats stats) {
            return stats.average();
        }
    },
    COUNT(false) {
        @Override
        public Double read(CellStats stats) {
            return (double) stats.getRawCount();
        }
    },
    MIN(true) {
        @Override
        public Double read(CellStats stats) {
            return stats.getMin();
        }
    },
    MAX(true) {
        @Override
        public Double read(CellStats stats) {
            return stats.getMax();
        }
    };

    private final boolean requiresNumeric;

    AggregateFunc(boolean requiresNumeric) {
        this.requiresNumeric = requiresNumeric;
    }

    /** 非数值字段只允许 COUNT */
    public boolean requiresNumeric() {
        return requiresNumeric;
    }

    /**
     * 从单元格统计中读取本函数的展示值。
     *
     * @return 统计值；无有效数值时返回 null（渲染为 "—"，而不是 0）
     */
    public abstract Double read(CellStats stats);

    /** 列键中的小写标签，如 sum、avg */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AggregateFunc from(String s) throws Exception {
        if(s == null) {
            throw Error.InvalidAggregatorException;
        }
        try {
            return AggregateFunc.valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw Error.InvalidAggregatorException;
        }
    }
}
