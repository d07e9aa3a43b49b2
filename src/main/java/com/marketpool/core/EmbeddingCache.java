package com.marketpool.core;

import com.marketpool.domain.CacheEntry;
import com.marketpool.domain.TextHasher;
import com.marketpool.error.CacheIoException;
import com.marketpool.error.ProviderContractException;
import com.marketpool.infra.ColumnType;
import com.marketpool.infra.EmbeddingProvider;
import com.marketpool.infra.EncryptedStore;
import com.marketpool.infra.ParquetTableCodec;
import com.marketpool.infra.ReleaseArtifactLocator;
import com.marketpool.infra.RemoteArtifactFetcher;
import com.marketpool.infra.Table;
import com.marketpool.infra.TableCodec;
import com.marketpool.infra.TableFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Content-addressed text embeddings. Each trimmed text is sent to the provider
 * at most once; its vector is then kept forever in a local parquet file.
 * <p>
 * Single writer only: every update rewrites the whole file, without atomic rename.
 */
@Slf4j
@Service
public class EmbeddingCache {

    static final String ARTIFACT_NAME = "embeddings";
    static final List<Table.Column> SCHEMA = List.of(
            Table.Column.of("text_hash", ColumnType.STRING),
            Table.Column.of("text", ColumnType.STRING),
            Table.Column.of("embedding", ColumnType.DOUBLE_LIST));

    private final EmbeddingProvider provider;
    private final EncryptedStore encryptedStore;
    private final RemoteArtifactFetcher remoteFetcher;
    private final ReleaseArtifactLocator releaseLocator;
    private final TableCodec localCodec;
    private final Path cachePath;
    private final int chunkSize;

    // insertion-ordered, first write wins
    private final Map<String, CacheEntry> entries = new LinkedHashMap<>();

    @Autowired
    public EmbeddingCache(EmbeddingProvider provider, EncryptedStore encryptedStore,
            RemoteArtifactFetcher remoteFetcher, ReleaseArtifactLocator releaseLocator,
            @Value("${marketpool.embedding.cache-path:data/embeddings_cache/embeddings.parquet}") String cachePath,
            @Value("${marketpool.embedding.chunk-size:1024}") int chunkSize,
            @Value("${marketpool.embedding.use-remote:true}") boolean useRemote) {
        this(provider, encryptedStore, remoteFetcher, releaseLocator, new ParquetTableCodec(), Paths.get(cachePath),
                chunkSize, useRemote);
    }

    EmbeddingCache(EmbeddingProvider provider, EncryptedStore encryptedStore, RemoteArtifactFetcher remoteFetcher,
            ReleaseArtifactLocator releaseLocator, TableCodec localCodec, Path cachePath, int chunkSize,
            boolean useRemote) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunk size must be positive: " + chunkSize);
        }
        this.provider = provider;
        this.encryptedStore = encryptedStore;
        this.remoteFetcher = remoteFetcher;
        this.releaseLocator = releaseLocator;
        this.localCodec = localCodec;
        this.cachePath = cachePath;
        this.chunkSize = chunkSize;
        bootstrap(useRemote);
    }

    /**
     * Vectors for {@code texts}, in input order. Misses are computed in chunks
     * and persisted before returning.
     *
     * @throws ProviderContractException if the provider answers with the wrong shape
     */
    public synchronized List<double[]> get(List<String> texts) {
        List<String> hashes = new ArrayList<>(texts.size());
        Map<String, String> misses = new LinkedHashMap<>();
        for (String text : texts) {
            String normalized = TextHasher.normalize(text);
            String hash = TextHasher.hash(normalized);
            hashes.add(hash);
            if (!entries.containsKey(hash)) {
                misses.putIfAbsent(hash, normalized);
            }
        }
        log.info("Embedding lookup: {} texts, {} cached, {} to compute", texts.size(),
                texts.size() - countMissing(hashes, misses), misses.size());

        if (!misses.isEmpty()) {
            try {
                compute(new ArrayList<>(misses.values()));
            } finally {
                persist();
            }
        }

        List<double[]> out = new ArrayList<>(hashes.size());
        for (String hash : hashes) {
            out.add(entries.get(hash).getEmbedding());
        }
        return out;
    }

    public double[] get(String text) {
        return get(List.of(text)).get(0);
    }

    public synchronized boolean contains(String text) {
        return entries.containsKey(TextHasher.hash(text));
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Writes the whole cache as an encrypted parquet artifact for publishing.
     */
    public synchronized Path exportEncrypted(Path directory) {
        return encryptedStore.writeTable(directory, ARTIFACT_NAME, toTable(), TableFormat.PARQUET);
    }

    private void compute(List<String> pending) {
        for (int from = 0; from < pending.size(); from += chunkSize) {
            List<String> chunk = pending.subList(from, Math.min(from + chunkSize, pending.size()));
            List<double[]> vectors = provider.embed(chunk);
            if (vectors == null || vectors.size() != chunk.size()) {
                throw new ProviderContractException("Provider returned " + (vectors == null ? 0 : vectors.size())
                        + " vectors for " + chunk.size() + " texts");
            }
            for (double[] vector : vectors) {
                if (vector == null || vector.length != provider.dimension()) {
                    throw new ProviderContractException("Provider returned a vector of dimension "
                            + (vector == null ? 0 : vector.length) + ", expected " + provider.dimension());
                }
            }
            for (int i = 0; i < chunk.size(); i++) {
                CacheEntry entry = CacheEntry.of(chunk.get(i), vectors.get(i));
                entries.putIfAbsent(entry.getTextHash(), entry);
            }
        }
    }

    private void bootstrap(boolean useRemote) {
        try {
            loadLocal();
            log.info("Loaded {} cached embeddings from {}", entries.size(), cachePath);
            return;
        } catch (CacheIoException e) {
            log.info("No usable local embedding cache: {}", e.getMessage());
        }
        if (!useRemote) {
            return;
        }

        String fileName = TableFormat.PARQUET.encryptedFileName(ARTIFACT_NAME);
        try {
            String url = releaseLocator.releaseFileUrl(fileName);
            Table table = encryptedStore.decryptTable(remoteFetcher.download(url), TableFormat.PARQUET, SCHEMA);
            entries.clear();
            addRows(table);
            log.info("Bootstrapped {} embeddings from {}", entries.size(), url);
        } catch (RuntimeException e) {
            entries.clear();
            log.warn("Remote embedding cache unavailable, starting empty: {}", e.toString());
            return;
        }
        persist();
    }

    private void loadLocal() {
        if (!Files.isRegularFile(cachePath)) {
            throw new CacheIoException("No cache file at " + cachePath);
        }
        try {
            addRows(localCodec.decode(Files.readAllBytes(cachePath), SCHEMA));
        } catch (IOException | RuntimeException e) {
            entries.clear();
            throw new CacheIoException("Unreadable cache file " + cachePath, e);
        }
    }

    private void addRows(Table table) {
        for (Map<String, Object> row : table.getRows()) {
            Object text = row.get("text");
            List<Double> vector = Table.doubleList(row, "embedding");
            if (text == null || vector == null) {
                throw new IllegalArgumentException("Cache row without text or embedding");
            }
            double[] embedding = new double[vector.size()];
            for (int i = 0; i < embedding.length; i++) {
                Double value = vector.get(i);
                if (value == null) {
                    throw new IllegalArgumentException("Cache row for \"" + text + "\" has a missing vector element");
                }
                embedding[i] = value;
            }
            Object hash = row.get("text_hash");
            CacheEntry entry = hash == null
                    ? CacheEntry.of(text.toString(), embedding)
                    : new CacheEntry(hash.toString(), text.toString(), embedding);
            entries.putIfAbsent(entry.getTextHash(), entry);
        }
    }

    private void persist() {
        try {
            Path parent = cachePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(cachePath, localCodec.encode(toTable()));
            log.info("Persisted {} embeddings to {}", entries.size(), cachePath);
        } catch (IOException | UncheckedIOException e) {
            throw new CacheIoException("Failed to write cache file " + cachePath, e);
        }
    }

    private Table toTable() {
        List<Map<String, Object>> rows = new ArrayList<>(entries.size());
        for (CacheEntry entry : entries.values()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("text_hash", entry.getTextHash());
            row.put("text", entry.getText());
            row.put("embedding", entry.getEmbedding());
            rows.add(row);
        }
        return new Table(SCHEMA, rows);
    }

    private static int countMissing(List<String> hashes, Map<String, String> misses) {
        int n = 0;
        for (String hash : hashes) {
            if (misses.containsKey(hash)) {
                n++;
            }
        }
        return n;
    }
}
