package com.minipivot.backend.estimate;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.minipivot.backend.Fixtures;
import com.minipivot.backend.aggregator.AggregateFunc;
import com.minipivot.backend.aggregator.AggregationSpec;

import static org.junit.jupiter.api.Assertions.*;

public class CardinalityEstimatorTest {

    private static final List<String> COLS = List.of("region", "product");
    private static final List<AggregationSpec> SUM = List.of(AggregationSpec.of("sales", AggregateFunc.SUM));
    private static final List<AggregationSpec> SUM_AND_COUNT = List.of(
            AggregationSpec.of("sales", AggregateFunc.SUM),
            AggregationSpec.of("sales", AggregateFunc.COUNT));

    private final CardinalityEstimator estimator = new CardinalityEstimator();

    @Test
    public void testExactWhenDataFitsInSample() {
        PivotEstimation e = estimator.estimate(Fixtures.cycling(100, 20), COLS, SUM_AND_COUNT);
        assertEquals(20, e.getUniqueColumnCombinations());
        assertEquals(40, e.getEstimatedColumns());
        assertFalse(e.isShouldWarn());
    }

    @Test
    public void testExtrapolatesBeyondSample() {
        // 15000 条记录、2000 个组合：采样在去重数超过 1000 时停止，再按 15000 / 10000 外推
        PivotEstimation e = estimator.estimate(Fixtures.cycling(15_000, 2_000), COLS, SUM);
        assertTrue(e.isShouldWarn());
        assertEquals(1502, e.getUniqueColumnCombinations());
        assertEquals(1502, e.getEstimatedColumns());
    }

    @Test
    public void testWarnsOnValueMultiplier() {
        // 600 个组合 x 2 个值项 = 1200 列
        PivotEstimation e = estimator.estimate(Fixtures.cycling(600, 600), COLS, SUM_AND_COUNT);
        assertEquals(600, e.getUniqueColumnCombinations());
        assertEquals(1200, e.getEstimatedColumns());
        assertTrue(e.isShouldWarn());
    }

    @Test
    public void testThresholdIsExclusive() {
        PivotEstimation e = new CardinalityEstimator(20, 10_000).estimate(Fixtures.cycling(40, 20), COLS, SUM);
        assertEquals(20, e.getEstimatedColumns());
        assertFalse(e.isShouldWarn());
    }

    @Test
    public void testPresenceOnlyCountsCombinations() {
        PivotEstimation e = estimator.estimate(Fixtures.cycling(50, 10), COLS, List.of());
        assertEquals(10, e.getEstimatedColumns());
    }

    @Test
    public void testNoColumnFields() {
        PivotEstimation e = estimator.estimate(Fixtures.cycling(50_000, 5_000), List.of(), SUM_AND_COUNT);
        assertEquals(2, e.getEstimatedColumns());
        assertEquals(0, e.getUniqueColumnCombinations());
        assertFalse(e.isShouldWarn());
    }

    @Test
    public void testNoRecords() {
        PivotEstimation e = estimator.estimate(List.of(), COLS, SUM);
        assertFalse(e.isShouldWarn());
        assertEquals(0, e.getUniqueColumnCombinations());
    }

    @Test
    public void testRejectsNonPositiveSettings() {
        assertThrows(IllegalArgumentException.class, () -> new CardinalityEstimator(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new CardinalityEstimator(10, 0));
    }
}
