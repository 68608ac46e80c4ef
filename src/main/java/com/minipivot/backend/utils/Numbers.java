package com.minipivot.backend.utils;

import java.math.BigDecimal;

import com.google.common.primitives.Doubles;

/**
 * 记录值到 double 的数值转换。
 */
public final class Numbers {

    private Numbers() {
    }

    /**
     * 将记录值转换为有限 double。
     * <ul>
     *     <li>Number：取 doubleValue</li>
     *     <li>Boolean：true = 1，false = 0</li>
     *     <li>String：去除首尾空白后按十进制解析，空白串为 0</li>
     *     <li>null：0</li>
     *     <li>其它：无效</li>
     * </ul>
     *
     * @return 转换结果；NaN、±Infinity 或无法解析时返回 null
     */
    public static Double coerce(Object value) {
        double d;
        if(value == null) {
            return 0d;
        } else if(value instanceof Number) {
            d = ((Number) value).doubleValue();
        } else if(value instanceof Boolean) {
            d = ((Boolean) value) ? 1d : 0d;
        } else if(value instanceof String) {
            String s = ((String) value).trim();
            if(s.isEmpty()) {
                return 0d;
            }
            Double parsed = Doubles.tryParse(s);
            if(parsed == null) {
                return null;
            }
            d = parsed;
        } else {
            return null;
        }
        return Double.isFinite(d) ? d : null;
    }

    /**
     * 宽松的数值判定，允许千分位逗号（如 "1,200.5"），用于字段类型推断。
     * null 与空白串不算数值。
     */
    public static boolean looksNumeric(Object value) {
        if(value == null) {
            return false;
        }
        if(value instanceof String) {
            String s = ((String) value).replace(",", "").trim();
            return !s.isEmpty() && coerce(s) != null;
        }
        return coerce(value) != null;
    }

    /**
     * 数值的展示文本：整数值的浮点数不带小数部分（10.0 -> "10"）。
     */
    public static String format(Number n) {
        if(n instanceof BigDecimal) {
            BigDecimal stripped = ((BigDecimal) n).stripTrailingZeros();
            return stripped.signum() == 0 ? "0" : stripped.toPlainString();
        }
        if(n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            if(Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return Double.toString(d);
        }
        return n.toString();
    }
}
