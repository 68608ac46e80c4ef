package com.minipivot.backend.pivot;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.minipivot.backend.record.Record;

import static com.minipivot.backend.Fixtures.rec;
import static org.junit.jupiter.api.Assertions.*;

public class KeyBuilderTest {

    private final Record record = rec("region", "East", "product", null, "qty", 10.0, "price", 2.5, "ok", true);

    @Test
    public void testEmptyFieldLists() {
        assertEquals("TOTAL", KeyBuilder.rowKey(List.of(), record));
        assertEquals("", KeyBuilder.columnKey(List.of(), record));
    }

    @Test
    public void testSingleField() {
        assertEquals("East", KeyBuilder.rowKey(List.of("region"), record));
        assertEquals("N/A", KeyBuilder.rowKey(List.of("product"), record));
        assertEquals("N/A", KeyBuilder.rowKey(List.of("missing"), record));
    }

    @Test
    public void testCompositeKey() {
        assertEquals("East|||N/A|||10|||2.5|||true",
                KeyBuilder.columnKey(List.of("region", "product", "qty", "price", "ok"), record));
    }

    @Test
    public void testWithAggregation() {
        assertEquals("East|||sales(sum)", KeyBuilder.withAggregation("East", true, "sales(sum)"));
        assertEquals("sales(sum)", KeyBuilder.withAggregation("", false, "sales(sum)"));
    }

    @Test
    public void testSplit() {
        assertEquals(List.of("East", "A"), KeyBuilder.split("East|||A", 2));
        assertEquals(List.of("East", "A|||sales(sum)"), KeyBuilder.split("East|||A|||sales(sum)", 2));
        assertEquals(List.of("TOTAL"), KeyBuilder.split("TOTAL", 1));
        assertTrue(KeyBuilder.split("TOTAL", 0).isEmpty());
    }
}
