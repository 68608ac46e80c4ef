package com.minipivot.backend.pivot;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.minipivot.backend.Fixtures;
import com.minipivot.backend.aggregator.AggregateFunc;
import com.minipivot.backend.aggregator.AggregationSpec;
import com.minipivot.backend.aggregator.CellStats;
import com.minipivot.backend.aggregator.CellStatsAccumulator;
import com.minipivot.backend.record.Record;

import static org.junit.jupiter.api.Assertions.*;

public class SubtotalBuilderTest {

    private static final List<AggregationSpec> SUM_SALES = List.of(AggregationSpec.of("sales", AggregateFunc.SUM));
    private static final List<String> THREE_LEVELS = List.of("region", "product", "year");

    private static List<PivotRow> subtotaled(List<Record> records, List<String> rowFields) {
        AggregateResult r = Aggregator.aggregate(records, rowFields, List.of(), SUM_SALES);
        return SubtotalBuilder.insertSubtotals(r.getTable(), rowFields, r.getColKeys());
    }

    @Test
    public void testTwoLevels() {
        List<PivotRow> table = subtotaled(Fixtures.sales(), List.of("region", "product"));

        assertEquals(4, table.size());
        assertEquals(List.of("East", "A"), table.get(0).getRowValues());
        assertEquals(List.of("East", "B"), table.get(1).getRowValues());

        PivotRow totalEast = table.get(2);
        assertTrue(totalEast.isSubtotal());
        assertEquals(0, totalEast.getSubtotalLevel());
        assertEquals("Total East", totalEast.getSubtotalLabel());
        assertEquals(Arrays.asList("Total East", null), totalEast.getRowValues());
        assertEquals(30d, totalEast.cell("sales(sum)").getSum());

        // West 只有一行，不插入小计
        assertEquals(List.of("West", "A"), table.get(3).getRowValues());
        assertTrue(table.get(3).isData());
    }

    @Test
    public void testSingleLevelHasNoSubtotals() {
        List<PivotRow> table = subtotaled(Fixtures.sales(), List.of("region"));
        assertEquals(2, table.size());
        assertTrue(table.stream().allMatch(PivotRow::isData));
    }

    @Test
    public void testGroupsInLexicographicOrder() {
        // threeLevel 中 West 先出现
        List<PivotRow> table = subtotaled(Fixtures.threeLevel(), THREE_LEVELS);
        List<String> labels = table.stream()
                .map(r -> r.isSubtotal() ? r.getSubtotalLabel() : String.join("/", r.getRowValues()))
                .collect(Collectors.toList());
        assertEquals(List.of(
                "East/A/2020",
                "East/A/2021",
                "Total A",
                "East/B/2020",
                "Total East",
                "West/A/2020",
                "West/B/2020",
                "West/B/2021",
                "Total B",
                "Total West"), labels);
    }

    @Test
    public void testNestedSubtotalsDoNotDoubleCount() {
        List<PivotRow> table = subtotaled(Fixtures.threeLevel(), THREE_LEVELS);

        PivotRow totalA = table.get(2);
        assertEquals(1, totalA.getSubtotalLevel());
        assertEquals(Arrays.asList("East", "Total A", null), totalA.getRowValues());
        assertEquals(3d, totalA.cell("sales(sum)").getSum());

        PivotRow totalEast = table.get(4);
        assertEquals(0, totalEast.getSubtotalLevel());
        CellStats east = totalEast.cell("sales(sum)");
        assertEquals(7d, east.getSum());
        assertEquals(3, east.getRawCount());
        assertEquals(1d, east.getMin());
        assertEquals(4d, east.getMax());

        PivotRow totalB = table.get(8);
        assertEquals(Arrays.asList("West", "Total B", null), totalB.getRowValues());
        assertEquals(48d, totalB.cell("sales(sum)").getSum());

        PivotRow totalWest = table.get(9);
        assertEquals(56d, totalWest.cell("sales(sum)").getSum());
        assertEquals(3, totalWest.cell("sales(sum)").getRawCount());
    }

    @Test
    public void testLevelZeroSubtotalEqualsDirectStats() {
        List<Record> records = Fixtures.threeLevel();
        List<PivotRow> table = subtotaled(records, THREE_LEVELS);
        for (PivotRow row : table) {
            if (!row.isSubtotal() || row.getSubtotalLevel() != 0) {
                continue;
            }
            List<Record> group = records.stream()
                    .filter(r -> row.getGroupValue().equals(r.get("region")))
                    .collect(Collectors.toList());
            assertEquals(CellStatsAccumulator.computeStats(group, "sales"), row.cell("sales(sum)"));
        }
    }

    @Test
    public void testSubtotalColumnEmptyWhenNoChildHasIt() {
        List<Record> records = List.of(
                Fixtures.rec("region", "East", "product", "A", "kind", "x", "sales", 1),
                Fixtures.rec("region", "East", "product", "B", "kind", "x", "sales", 2),
                Fixtures.rec("region", "West", "product", "A", "kind", "y", "sales", 3));
        List<String> rowFields = List.of("region", "product");
        AggregateResult r = Aggregator.aggregate(records, rowFields, List.of("kind"), SUM_SALES);
        List<PivotRow> table = SubtotalBuilder.insertSubtotals(r.getTable(), rowFields, r.getColKeys());
        PivotRow totalEast = table.get(2);
        assertEquals(3d, totalEast.cell("x|||sales(sum)").getSum());
        assertNull(totalEast.cell("y|||sales(sum)"));
    }

    @Test
    public void testNoRowFields() {
        AggregateResult r = Aggregator.aggregate(Fixtures.sales(), List.of(), List.of(), SUM_SALES);
        assertSame(r.getTable(), SubtotalBuilder.insertSubtotals(r.getTable(), List.of(), r.getColKeys()));
    }
}
