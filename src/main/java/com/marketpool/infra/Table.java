package com.marketpool.infra;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * In-memory tabular payload: typed columns plus rows keyed by column name.
 * Cells may be null.
 */
@Value
public class Table {

    List<Column> columns;
    List<Map<String, Object>> rows;

    public Table(List<Column> columns, List<Map<String, Object>> rows) {
        this.columns = List.copyOf(columns);
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public int size() {
        return rows.size();
    }

    /**
     * String list cell of {@code row}; null when the cell is null.
     *
     * @throws IllegalArgumentException if the cell is not a list
     */
    public static List<String> stringList(Map<String, Object> row, String column) {
        List<?> cell = listCell(row, column);
        if (cell == null) {
            return null;
        }
        List<String> out = new ArrayList<>(cell.size());
        for (Object item : cell) {
            out.add(item == null ? null : item.toString());
        }
        return out;
    }

    /**
     * Numeric list cell of {@code row}; null when the cell is null. Null
     * elements are kept.
     *
     * @throws IllegalArgumentException if the cell is not a list or holds a non-number
     */
    public static List<Double> doubleList(Map<String, Object> row, String column) {
        List<?> cell = listCell(row, column);
        if (cell == null) {
            return null;
        }
        List<Double> out = new ArrayList<>(cell.size());
        for (Object item : cell) {
            if (item == null) {
                out.add(null);
            } else if (item instanceof Number) {
                out.add(((Number) item).doubleValue());
            } else {
                throw new IllegalArgumentException("Column " + column + " holds a non-numeric element: " + item);
            }
        }
        return out;
    }

    private static List<?> listCell(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null || value instanceof List) {
            return (List<?>) value;
        }
        throw new IllegalArgumentException("Column " + column + " is not a list: " + value.getClass().getSimpleName());
    }

    @Value
    public static class Column {
        String name;
        ColumnType type;

        public static Column of(String name, ColumnType type) {
            return new Column(name, type);
        }
    }
}
