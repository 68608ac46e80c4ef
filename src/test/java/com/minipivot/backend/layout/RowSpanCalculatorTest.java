package com.minipivot.backend.layout;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.minipivot.backend.Fixtures;
import com.minipivot.backend.aggregator.AggregateFunc;
import com.minipivot.backend.aggregator.AggregationSpec;
import com.minipivot.backend.pivot.AggregateResult;
import com.minipivot.backend.pivot.Aggregator;
import com.minipivot.backend.pivot.PivotRow;
import com.minipivot.backend.pivot.SubtotalBuilder;
import com.minipivot.backend.record.Record;

import static org.junit.jupiter.api.Assertions.*;

public class RowSpanCalculatorTest {

    private static List<PivotRow> table(List<Record> records, List<String> rowFields) {
        AggregateResult r = Aggregator.aggregate(records, rowFields, List.of(),
                List.of(AggregationSpec.of("sales", AggregateFunc.SUM)));
        return SubtotalBuilder.insertSubtotals(r.getTable(), rowFields, r.getColKeys());
    }

    private static int[] spansAt(List<List<RowSpanInfo>> spans, int level) {
        return spans.stream().mapToInt(row -> row.get(level).getSpan()).toArray();
    }

    @Test
    public void testTwoLevelsWithSubtotal() {
        List<String> rowFields = List.of("region", "product");
        // [East,A] [East,B] Total East [West,A]
        List<List<RowSpanInfo>> spans = RowSpanCalculator.compute(table(Fixtures.sales(), rowFields), rowFields);

        assertArrayEquals(new int[]{2, 0, 1, 1}, spansAt(spans, 0));
        assertArrayEquals(new int[]{1, 1, 0, 1}, spansAt(spans, 1));

        RowSpanInfo subtotal = spans.get(2).get(0);
        assertTrue(subtotal.isSubtotal());
        assertEquals(0, subtotal.getLevel());
        assertFalse(spans.get(0).get(0).isSubtotal());
    }

    @Test
    public void testSubtotalBreaksRuns() {
        List<String> rowFields = List.of("region", "product", "year");
        List<PivotRow> rows = table(Fixtures.threeLevel(), rowFields);
        List<List<RowSpanInfo>> spans = RowSpanCalculator.compute(rows, rowFields);

        // East/A/2020, East/A/2021, Total A, East/B/2020, Total East, West/A/2020, West/B/2020, West/B/2021, Total B, Total West
        assertArrayEquals(new int[]{2, 0, 0, 1, 1, 3, 0, 0, 0, 1}, spansAt(spans, 0));
        assertArrayEquals(new int[]{2, 0, 1, 1, 0, 1, 2, 0, 1, 0}, spansAt(spans, 1));
        assertArrayEquals(new int[]{1, 1, 0, 1, 0, 1, 1, 1, 0, 0}, spansAt(spans, 2));
    }

    @Test
    public void testEachDataRowCoveredExactlyOnce() {
        List<String> rowFields = List.of("region", "product", "year");
        List<PivotRow> rows = table(Fixtures.threeLevel(), rowFields);
        List<List<RowSpanInfo>> spans = RowSpanCalculator.compute(rows, rowFields);

        for (int lvl = 0; lvl < rowFields.size(); lvl++) {
            int[] covered = new int[rows.size()];
            for (int i = 0; i < rows.size(); i++) {
                if(!rows.get(i).isData()) {
                    continue;
                }
                int span = spans.get(i).get(lvl).getSpan();
                for (int k = i; k < i + span; k++) {
                    assertTrue(rows.get(k).isData(), "span crosses a subtotal row at " + k);
                    for (int p = 0; p <= lvl; p++) {
                        assertEquals(rows.get(i).value(p), rows.get(k).value(p));
                    }
                    covered[k]++;
                }
            }
            for (int i = 0; i < rows.size(); i++) {
                assertEquals(rows.get(i).isData() ? 1 : 0, covered[i], "level " + lvl + " row " + i);
            }
        }
    }

    @Test
    public void testNoRowFieldsOrRows() {
        assertTrue(RowSpanCalculator.compute(table(Fixtures.sales(), List.of()), List.of()).isEmpty());
        assertTrue(RowSpanCalculator.compute(List.of(), List.of("region")).isEmpty());
    }
}
