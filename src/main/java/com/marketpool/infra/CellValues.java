package com.marketpool.infra;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Coerces decoded cell values to the Java type of their column.
 */
final class CellValues {

    private CellValues() {
    }

    static Object coerce(Object value, ColumnType type) {
        if (value == null) {
            return null;
        }
        switch (type) {
            case STRING:
                return value.toString();
            case LONG:
                return value instanceof Number ? ((Number) value).longValue() : Long.parseLong(value.toString().trim());
            case DOUBLE:
                return value instanceof Number ? ((Number) value).doubleValue()
                        : Double.parseDouble(value.toString().trim());
            case BOOLEAN:
                return value instanceof Boolean ? value : Boolean.parseBoolean(value.toString().trim());
            case STRING_LIST:
                return toList(value, false);
            case DOUBLE_LIST:
                return toList(value, true);
            default:
                throw new IllegalArgumentException("Unsupported column type: " + type);
        }
    }

    private static List<Object> toList(Object value, boolean numeric) {
        Collection<?> items;
        if (value instanceof double[]) {
            List<Object> out = new ArrayList<>();
            for (double d : (double[]) value) {
                out.add(d);
            }
            return out;
        } else if (value instanceof Collection) {
            items = (Collection<?>) value;
        } else {
            throw new IllegalArgumentException("Expected a list cell, got " + value.getClass().getSimpleName());
        }
        List<Object> out = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item == null) {
                out.add(null);
            } else if (numeric) {
                out.add(item instanceof Number ? ((Number) item).doubleValue() : Double.parseDouble(item.toString()));
            } else {
                out.add(item.toString());
            }
        }
        return out;
    }
}
