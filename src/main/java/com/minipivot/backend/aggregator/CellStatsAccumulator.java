package com.minipivot.backend.aggregator;

import java.util.Collection;

import com.minipivot.backend.record.Record;
import com.minipivot.backend.utils.Numbers;

/**
 * 单元格统计累加器，每条记录调用一次 {@link #accept(Record)}。
 * <p>
 * 无法转换为有限数值的值不是错误：只计入 rawCount，不参与 validCount/sum/min/max。
 * 记录中缺少该字段同样只计入 rawCount；字段存在但为 null 或空白串时按 0 计。
 */
public class CellStatsAccumulator {

    private final String field;
    private long rawCount = 0;
    private long validCount = 0;
    private double sum = 0;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;

    public CellStatsAccumulator(String field) {
        this.field = field;
    }

    public void accept(Record record) {
        if(!record.has(field)) {
            rawCount++;
            return;
        }
        acceptValue(record.get(field));
    }

    public void acceptValue(Object value) {
        rawCount++;
        Double d = Numbers.coerce(value);
        if(d == null) {
            return;
        }
        validCount++;
        sum += d;
        if(d < min) {
            min = d;
        }
        if(d > max) {
            max = d;
        }
    }

    public String field() {
        return field;
    }

    public CellStats toStats() {
        if(validCount == 0) {
            return new CellStats(rawCount, 0, null, null, null);
        }
        return new CellStats(rawCount, validCount, sum, min, max);
    }

    /**
     * 对一组记录的某个字段直接计算统计。
     */
    public static CellStats computeStats(Collection<Record> records, String field) {
        CellStatsAccumulator acc = new CellStatsAccumulator(field);
        for (Record r : records) {
            acc.accept(r);
        }
        return acc.toStats();
    }

    /**
     * 合并多个子统计：计数与求和相加，min/max 只取 validCount &gt; 0 的子项。
     * null 子项视为空单元格，直接跳过。
     */
    public static CellStats merge(Iterable<CellStats> parts) {
        long totalRaw = 0;
        long totalValid = 0;
        double totalSum = 0;
        double minVal = Double.POSITIVE_INFINITY;
        double maxVal = Double.NEGATIVE_INFINITY;
        for (CellStats s : parts) {
            if(s == null) {
                continue;
            }
            totalRaw += s.getRawCount();
            totalValid += s.getValidCount();
            if(s.hasValid()) {
                totalSum += s.getSum();
                minVal = Math.min(minVal, s.getMin());
                maxVal = Math.max(maxVal, s.getMax());
            }
        }
        if(totalValid == 0) {
            return new CellStats(totalRaw, 0, null, null, null);
        }
        return new CellStats(totalRaw, totalValid, totalSum, minVal, maxVal);
    }
}
