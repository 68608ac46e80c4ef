package com.minipivot.backend;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.minipivot.backend.record.Dataset;
import com.minipivot.backend.record.Record;

/**
 * 测试用的记录构造工具
 */
public final class Fixtures {

    private Fixtures() {
    }

    /** rec("region", "East", "sales", 10) */
    public static Record rec(Object... kv) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            map.put((String) kv[i], kv[i + 1]);
        }
        try {
            return Record.of(map);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }

    public static Dataset dataset(Record... records) {
        return Dataset.of(List.of(records));
    }

    /** 三条销售记录：East/A/10，East/B/20，West/A/5 */
    public static List<Record> sales() {
        return List.of(
                rec("region", "East", "product", "A", "sales", 10),
                rec("region", "East", "product", "B", "sales", 20),
                rec("region", "West", "product", "A", "sales", 5));
    }

    /** 三层分组数据：region / product / year，sales 取 2 的幂便于核对 */
    public static List<Record> threeLevel() {
        return List.of(
                rec("region", "West", "product", "B", "year", "2021", "sales", 32),
                rec("region", "East", "product", "A", "year", "2020", "sales", 1),
                rec("region", "East", "product", "A", "year", "2021", "sales", 2),
                rec("region", "East", "product", "B", "year", "2020", "sales", 4),
                rec("region", "West", "product", "A", "year", "2020", "sales", 8),
                rec("region", "West", "product", "B", "year", "2020", "sales", 16));
    }

    /** n 条记录，列组合按 i % combos 循环，组合键为 r{c/50} / p{c%50} */
    public static List<Record> cycling(int n, int combos) {
        List<Record> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            int c = i % combos;
            out.add(rec("region", "r" + (c / 50), "product", "p" + (c % 50), "sales", i));
        }
        return out;
    }
}
