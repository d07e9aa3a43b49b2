package com.marketpool.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CsvTableCodecTest {

    private final CsvTableCodec codec = new CsvTableCodec(new ObjectMapper());

    @Test
    void testQuotesCommasAndListsSurvive() {
        List<Table.Column> schema = List.of(
                Table.Column.of("question", ColumnType.STRING),
                Table.Column.of("outcomes", ColumnType.STRING_LIST),
                Table.Column.of("resolved", ColumnType.BOOLEAN));
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("question", "Will \"A, B\" win?\nMaybe");
        row.put("outcomes", List.of("Yes, surely", "No"));
        row.put("resolved", true);

        Table back = codec.decode(codec.encode(new Table(schema, List.of(row))), schema);

        assertEquals(row, back.getRows().get(0));
    }

    @Test
    void testColumnsMatchedByHeaderName() {
        String csv = "extra,volume,id\nx,12.5,m_1\n";
        List<Table.Column> schema = List.of(
                Table.Column.of("id", ColumnType.STRING),
                Table.Column.of("volume", ColumnType.DOUBLE),
                Table.Column.of("missing", ColumnType.LONG));

        Table table = codec.decode(csv.getBytes(StandardCharsets.UTF_8), schema);

        Map<String, Object> row = table.getRows().get(0);
        assertEquals("m_1", row.get("id"));
        assertEquals(12.5, row.get("volume"));
        assertNull(row.get("missing"));
        assertFalse(row.containsKey("extra"));
    }
}
