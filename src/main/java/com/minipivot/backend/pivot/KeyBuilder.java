package com.minipivot.backend.pivot;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Splitter;
import com.minipivot.backend.record.Record;
import com.minipivot.backend.utils.Numbers;

/**
 * 组合键构造：行分组与列分组共用。
 * <p>
 * 多个字段值以 {@link #SEPARATOR} 拼接，缺失或 null 值渲染为 {@link #MISSING}。
 */
public final class KeyBuilder {

    public static final String SEPARATOR = "|||";
    public static final String MISSING = "N/A";
    /** 没有行分组字段时唯一的行键 */
    public static final String TOTAL_ROW = "TOTAL";

    private static final Splitter SPLITTER = Splitter.on(SEPARATOR);

    private KeyBuilder() {
    }

    public static String rowKey(List<String> rowFields, Record record) {
        if(rowFields.isEmpty()) {
            return TOTAL_ROW;
        }
        return build(rowFields, record);
    }

    /** 列分组为空时返回空串，透视表退化为仅值列 */
    public static String columnKey(List<String> colFields, Record record) {
        if(colFields.isEmpty()) {
            return "";
        }
        return build(colFields, record);
    }

    private static String build(List<String> fields, Record record) {
        // 单字段无需拼接
        if(fields.size() == 1) {
            return stringify(record.get(fields.get(0)));
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < fields.size(); i++) {
            if(i > 0) {
                sb.append(SEPARATOR);
            }
            sb.append(stringify(record.get(fields.get(i))));
        }
        return sb.toString();
    }

    /**
     * 列键 = 列分组键 + 分隔符 + 聚合标签；无列分组时只有聚合标签。
     */
    public static String withAggregation(String colKeyBase, boolean hasColumnFields, String aggLabel) {
        return hasColumnFields ? colKeyBase + SEPARATOR + aggLabel : aggLabel;
    }

    /**
     * 按位置拆分组合键，最多 {@code parts} 段，多出的分隔符留在最后一段。
     */
    public static List<String> split(String key, int parts) {
        if(parts <= 0) {
            return new ArrayList<>();
        }
        return new ArrayList<>(SPLITTER.limit(parts).splitToList(key));
    }

    public static String stringify(Object value) {
        if(value == null) {
            return MISSING;
        }
        if(value instanceof Number) {
            return Numbers.format((Number) value);
        }
        return value.toString();
    }
}
