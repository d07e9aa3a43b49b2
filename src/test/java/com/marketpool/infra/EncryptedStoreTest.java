package com.marketpool.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketpool.error.ConfigurationException;
import com.marketpool.error.CryptoException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EncryptedStoreTest {

    private static final List<Table.Column> SCHEMA = List.of(
            Table.Column.of("name", ColumnType.STRING),
            Table.Column.of("count", ColumnType.LONG),
            Table.Column.of("scores", ColumnType.DOUBLE_LIST));

    private final ObjectMapper mapper = new ObjectMapper();

    private Table sampleTable() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("name", "alpha");
        first.put("count", 3L);
        first.put("scores", Arrays.asList(0.25, null));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("name", "beta");
        second.put("count", null);
        second.put("scores", List.of());
        return new Table(SCHEMA, List.of(first, second));
    }

    @Test
    void testMissingKeyFailsBeforeAnyIo(@TempDir Path dir) {
        EncryptedStore store = new EncryptedStore("", mapper);
        Path target = dir.resolve("out");

        assertFalse(store.isConfigured());
        assertThrows(ConfigurationException.class, () -> store.encrypt(new byte[] {1}));
        assertThrows(ConfigurationException.class,
                () -> store.writeTable(target, "markets", sampleTable(), TableFormat.CSV));
        assertFalse(Files.exists(target));
        assertThrows(ConfigurationException.class,
                () -> store.readTable(dir.resolve("missing.csv.encrypted"), TableFormat.CSV, SCHEMA));
    }

    @Test
    void testCsvTableRoundTripThroughFile(@TempDir Path dir) {
        EncryptedStore store = new EncryptedStore(FernetKey.generate(), mapper);

        Path written = store.writeTable(dir, "markets", sampleTable(), TableFormat.CSV);
        Table back = store.readTable(written, TableFormat.CSV, SCHEMA);

        assertEquals("markets.csv.encrypted", written.getFileName().toString());
        assertEquals(2, back.size());
        assertEquals("alpha", back.getRows().get(0).get("name"));
        assertEquals(3L, back.getRows().get(0).get("count"));
        assertEquals(Arrays.asList(0.25, null), back.getRows().get(0).get("scores"));
        assertNull(back.getRows().get(1).get("count"));
    }

    @Test
    void testArtifactIsNotPlaintext(@TempDir Path dir) throws Exception {
        EncryptedStore store = new EncryptedStore(FernetKey.generate(), mapper);

        Path written = store.writeTable(dir, "markets", sampleTable(), TableFormat.CSV);

        assertFalse(Files.readString(written).contains("alpha"));
    }

    @Test
    void testWrongKeyIsFatal(@TempDir Path dir) {
        Path written = new EncryptedStore(FernetKey.generate(), mapper)
                .writeTable(dir, "markets", sampleTable(), TableFormat.CSV);
        EncryptedStore otherKey = new EncryptedStore(FernetKey.generate(), mapper);

        assertThrows(CryptoException.class, () -> otherKey.readTable(written, TableFormat.CSV, SCHEMA));
    }
}
