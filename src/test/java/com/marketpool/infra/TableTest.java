package com.marketpool.infra;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TableTest {

    private static Map<String, Object> row(String column, Object value) {
        Map<String, Object> row = new HashMap<>();
        row.put(column, value);
        return row;
    }

    @Test
    void testStringListCopiesElements() {
        List<String> labels = Table.stringList(row("outcomes", Arrays.asList("Yes", 7L, null)), "outcomes");

        assertEquals(Arrays.asList("Yes", "7", null), labels);
        assertNull(Table.stringList(row("outcomes", null), "outcomes"));
    }

    @Test
    void testDoubleListConvertsNumbersAndKeepsNulls() {
        List<Double> values = Table.doubleList(row("p", Arrays.asList(1, 0.25f, null)), "p");

        assertEquals(Arrays.asList(1.0, 0.25, null), values);
        assertNull(Table.doubleList(row("p", null), "p"));
    }

    @Test
    void testWrongCellShapesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Table.doubleList(row("p", "0.5"), "p"));
        assertThrows(IllegalArgumentException.class, () -> Table.doubleList(row("p", List.of("x")), "p"));
        assertThrows(IllegalArgumentException.class, () -> Table.stringList(row("outcomes", 3), "outcomes"));
    }
}
