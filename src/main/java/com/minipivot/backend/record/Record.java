package com.minipivot.backend.record;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.minipivot.common.Error;

/**
 * 一条输入记录：字段名 -> 值，值只允许 String / Number / Boolean / null。
 * 记录不声明 schema，字段顺序即插入顺序。
 */
public final class Record {

    private final Map<String, Object> values;

    private Record(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * 校验并拷贝字段映射。
     *
     * @throws Exception 字段名为空或值类型不受支持时抛出 {@link Error#InvalidValueException}
     */
    public static Record of(Map<String, ?> source) throws Exception {
        Objects.requireNonNull(source, "source must not be null");
        Map<String, Object> copy = new LinkedHashMap<>(source.size() * 2);
        for (Map.Entry<String, ?> e : source.entrySet()) {
            if(e.getKey() == null) {
                throw Error.InvalidValueException;
            }
            copy.put(e.getKey(), normalize(e.getValue()));
        }
        return new Record(copy);
    }

    private static Object normalize(Object value) throws Exception {
        if(value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if(value instanceof Double || value instanceof Float
                || value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte
                || value instanceof BigDecimal || value instanceof BigInteger) {
            return value;
        }
        throw Error.InvalidValueException;
    }

    /** 字段值，字段不存在时返回 null */
    public Object get(String field) {
        return values.get(field);
    }

    public boolean has(String field) {
        return values.containsKey(field);
    }

    public Set<String> fields() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof Record)) {
            return false;
        }
        return values.equals(((Record) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
