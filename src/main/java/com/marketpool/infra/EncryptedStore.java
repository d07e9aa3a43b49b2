package com.marketpool.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketpool.error.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Encrypts artifacts that leave the process. The key comes from configuration
 * once; every operation checks it before touching files or payloads.
 */
@Slf4j
@Component
public class EncryptedStore {

    static final String KEY_ENV = "MOOTLIB_ENCRYPTION_KEY";

    private final FernetCipher cipher; // null when no key is configured
    private final TableCodec parquetCodec;
    private final TableCodec csvCodec;

    @Autowired
    public EncryptedStore(@Value("${marketpool.encryption-key:}") String encryptionKey, ObjectMapper objectMapper) {
        this(encryptionKey == null || encryptionKey.isBlank() ? null : new FernetCipher(FernetKey.parse(encryptionKey)),
                new ParquetTableCodec(), new CsvTableCodec(objectMapper));
    }

    EncryptedStore(FernetCipher cipher, TableCodec parquetCodec, TableCodec csvCodec) {
        this.cipher = cipher;
        this.parquetCodec = parquetCodec;
        this.csvCodec = csvCodec;
        if (cipher == null) {
            log.warn("No encryption key configured; encrypted artifacts are unavailable until {} is set", KEY_ENV);
        }
    }

    public boolean isConfigured() {
        return cipher != null;
    }

    public byte[] encrypt(byte[] payload) {
        return requireCipher().encrypt(payload);
    }

    public byte[] decrypt(byte[] ciphertext) {
        return requireCipher().decrypt(ciphertext);
    }

    public byte[] encryptTable(Table table, TableFormat format) {
        FernetCipher active = requireCipher();
        return active.encrypt(codec(format).encode(table));
    }

    public Table decryptTable(byte[] ciphertext, TableFormat format, List<Table.Column> schema) {
        FernetCipher active = requireCipher();
        return codec(format).decode(active.decrypt(ciphertext), schema);
    }

    /**
     * Writes {@code <dir>/<name>.<format>.encrypted} and returns its path.
     */
    public Path writeTable(Path directory, String baseName, Table table, TableFormat format) {
        requireCipher();
        Path target = directory.resolve(format.encryptedFileName(baseName));
        byte[] ciphertext = encryptTable(table, format);
        try {
            Files.createDirectories(directory);
            Files.write(target, ciphertext);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
        log.info("Wrote encrypted {} artifact {} ({} rows, {} bytes)", format.extension(), target, table.size(),
                ciphertext.length);
        return target;
    }

    public Table readTable(Path source, TableFormat format, List<Table.Column> schema) {
        requireCipher();
        byte[] ciphertext;
        try {
            ciphertext = Files.readAllBytes(source);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + source, e);
        }
        return decryptTable(ciphertext, format, schema);
    }

    private TableCodec codec(TableFormat format) {
        return format == TableFormat.PARQUET ? parquetCodec : csvCodec;
    }

    private FernetCipher requireCipher() {
        if (cipher == null) {
            throw ConfigurationException.missing("Encryption key", KEY_ENV);
        }
        return cipher;
    }
}
