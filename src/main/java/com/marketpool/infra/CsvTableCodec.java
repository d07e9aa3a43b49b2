package com.marketpool.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Delimited-text codec with a header row. List cells are written as JSON arrays,
 * null cells as empty fields.
 */
public class CsvTableCodec implements TableCodec {

    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public CsvTableCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public byte[] encode(Table table) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (CSVWriter writer = new CSVWriter(new OutputStreamWriter(buffer, StandardCharsets.UTF_8))) {
            List<Table.Column> columns = table.getColumns();
            String[] header = columns.stream().map(Table.Column::getName).toArray(String[]::new);
            writer.writeNext(header);
            for (Map<String, Object> row : table.getRows()) {
                String[] line = new String[columns.size()];
                for (int i = 0; i < columns.size(); i++) {
                    Table.Column column = columns.get(i);
                    line[i] = render(CellValues.coerce(row.get(column.getName()), column.getType()));
                }
                writer.writeNext(line);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write csv payload", e);
        }
        return buffer.toByteArray();
    }

    @Override
    public Table decode(byte[] data, List<Table.Column> schema) {
        List<String[]> lines;
        try (CSVReader reader = new CSVReaderBuilder(
                new InputStreamReader(new ByteArrayInputStream(data), StandardCharsets.UTF_8)).build()) {
            lines = reader.readAll();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read csv payload", e);
        } catch (CsvException e) {
            throw new IllegalArgumentException("Malformed csv payload at line " + e.getLineNumber(), e);
        }
        if (lines.isEmpty()) {
            return new Table(schema, List.of());
        }

        Map<String, Integer> positions = new HashMap<>();
        String[] header = lines.get(0);
        for (int i = 0; i < header.length; i++) {
            positions.put(header[i].trim(), i);
        }

        List<Map<String, Object>> rows = new ArrayList<>(lines.size() - 1);
        for (String[] line : lines.subList(1, lines.size())) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (Table.Column column : schema) {
                Integer index = positions.get(column.getName());
                String cell = index == null || index >= line.length ? null : line[index];
                row.put(column.getName(), parse(cell, column.getType()));
            }
            rows.add(row);
        }
        return new Table(schema, rows);
    }

    private String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof List) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Cannot render list cell", e);
            }
        }
        return value.toString();
    }

    private Object parse(String cell, ColumnType type) {
        if (cell == null || cell.isEmpty()) {
            return null;
        }
        if (type == ColumnType.STRING_LIST || type == ColumnType.DOUBLE_LIST) {
            try {
                return CellValues.coerce(objectMapper.readValue(cell, LIST_TYPE), type);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Malformed list cell: " + cell, e);
            }
        }
        return CellValues.coerce(cell, type);
    }
}
