package com.minipivot.backend.aggregator;

import java.util.Objects;

/**
 * 单元格统计：{rawCount, validCount, sum, min, max}。
 * <p>
 * 不变式：validCount &lt;= rawCount；sum/min/max 为 null 当且仅当 validCount = 0。
 * 平均值不存储，读取时由 {@link #average()} 派生。
 */
public final class CellStats {

    public static final CellStats EMPTY = new CellStats(0, 0, null, null, null);

    private final long rawCount;
    private final long validCount;
    private final Double sum;
    private final Double min;
    private final Double max;

    CellStats(long rawCount, long validCount, Double sum, Double min, Double max) {
        if(validCount < 0 || validCount > rawCount) {
            throw new IllegalArgumentException("validCount out of range: " + validCount + "/" + rawCount);
        }
        boolean hasValid = validCount > 0;
        if(hasValid != (sum != null) || hasValid != (min != null) || hasValid != (max != null)) {
            throw new IllegalArgumentException("sum/min/max must be present iff validCount > 0");
        }
        this.rawCount = rawCount;
        this.validCount = validCount;
        this.sum = sum;
        this.min = min;
        this.max = max;
    }

    public long getRawCount() {
        return rawCount;
    }

    public long getValidCount() {
        return validCount;
    }

    public Double getSum() {
        return sum;
    }

    public Double getMin() {
        return min;
    }

    public Double getMax() {
        return max;
    }

    public boolean hasValid() {
        return validCount > 0;
    }

    /** sum / validCount，validCount 为 0 时返回 null */
    public Double average() {
        if(validCount == 0) {
            return null;
        }
        return sum / validCount;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof CellStats)) {
            return false;
        }
        CellStats that = (CellStats) o;
        return rawCount == that.rawCount
                && validCount == that.validCount
                && Objects.equals(sum, that.sum)
                && Objects.equals(min, that.min)
                && Objects.equals(max, that.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rawCount, validCount, sum, min, max);
    }

    @Override
    public String toString() {
        return "CellStats{raw=" + rawCount + ", valid=" + validCount
                + ", sum=" + sum + ", min=" + min + ", max=" + max + "}";
    }
}
