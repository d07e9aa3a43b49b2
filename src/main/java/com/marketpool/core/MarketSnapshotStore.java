package com.marketpool.core;

import com.marketpool.domain.FlexibleTimestampParser;
import com.marketpool.domain.PooledMarket;
import com.marketpool.error.CacheIoException;
import com.marketpool.error.MarketParseException;
import com.marketpool.infra.ColumnType;
import com.marketpool.infra.EncryptedStore;
import com.marketpool.infra.Table;
import com.marketpool.infra.TableFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Encrypted market snapshot: {@code markets.<format>.encrypted}. The platform
 * back-reference is never written.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarketSnapshotStore {

    static final String ARTIFACT_NAME = "markets";
    static final List<Table.Column> SCHEMA = List.of(
            Table.Column.of("id", ColumnType.STRING),
            Table.Column.of("question", ColumnType.STRING),
            Table.Column.of("outcomes", ColumnType.STRING_LIST),
            Table.Column.of("outcome_probabilities", ColumnType.DOUBLE_LIST),
            Table.Column.of("formatted_outcomes", ColumnType.STRING),
            Table.Column.of("url", ColumnType.STRING),
            Table.Column.of("published_at", ColumnType.STRING),
            Table.Column.of("source_platform", ColumnType.STRING),
            Table.Column.of("volume", ColumnType.DOUBLE),
            Table.Column.of("n_forecasters", ColumnType.LONG),
            Table.Column.of("comments_count", ColumnType.LONG),
            Table.Column.of("original_market_type", ColumnType.STRING),
            Table.Column.of("is_resolved", ColumnType.BOOLEAN));

    private final EncryptedStore encryptedStore;

    public Path save(List<PooledMarket> markets, Path directory, TableFormat format) {
        return encryptedStore.writeTable(directory, ARTIFACT_NAME, toTable(markets), format);
    }

    /**
     * Loads the parquet artifact, or the csv one when parquet is missing or
     * unreadable. A decryption failure on an existing artifact is rethrown.
     */
    public List<PooledMarket> load(Path directory) {
        Path parquet = directory.resolve(TableFormat.PARQUET.encryptedFileName(ARTIFACT_NAME));
        if (Files.isRegularFile(parquet)) {
            try {
                return load(parquet, TableFormat.PARQUET);
            } catch (UncheckedIOException | IllegalArgumentException | MarketParseException e) {
                log.warn("Parquet snapshot {} unreadable, trying csv: {}", parquet, e.getMessage());
            }
        }
        Path csv = directory.resolve(TableFormat.CSV.encryptedFileName(ARTIFACT_NAME));
        if (Files.isRegularFile(csv)) {
            return load(csv, TableFormat.CSV);
        }
        throw new CacheIoException("No market snapshot in " + directory);
    }

    public List<PooledMarket> load(Path artifact, TableFormat format) {
        List<PooledMarket> markets = fromTable(encryptedStore.readTable(artifact, format, SCHEMA));
        log.info("Loaded {} markets from {}", markets.size(), artifact);
        return markets;
    }

    static Table toTable(List<PooledMarket> markets) {
        List<Map<String, Object>> rows = new ArrayList<>(markets.size());
        for (PooledMarket market : markets) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", market.getId());
            row.put("question", market.getQuestion());
            row.put("outcomes", market.getOutcomes());
            row.put("outcome_probabilities", market.getOutcomeProbabilities());
            row.put("formatted_outcomes", market.getFormattedOutcomes());
            row.put("url", market.getUrl());
            row.put("published_at", market.getPublishedAt() == null ? null : market.getPublishedAt().toString());
            row.put("source_platform", market.getSourcePlatform());
            row.put("volume", market.getVolume());
            row.put("n_forecasters", market.getForecasterCount());
            row.put("comments_count", market.getCommentCount());
            row.put("original_market_type", market.getMarketType());
            row.put("is_resolved", market.getResolved());
            rows.add(row);
        }
        return new Table(SCHEMA, rows);
    }

    static List<PooledMarket> fromTable(Table table) {
        List<PooledMarket> markets = new ArrayList<>(table.size());
        for (Map<String, Object> row : table.getRows()) {
            markets.add(PooledMarket.builder()
                    .id((String) row.get("id"))
                    .question((String) row.get("question"))
                    .outcomes(Table.stringList(row, "outcomes"))
                    .outcomeProbabilities(Table.doubleList(row, "outcome_probabilities"))
                    .url((String) row.get("url"))
                    .publishedAt(FlexibleTimestampParser.parse(row.get("published_at")))
                    .sourcePlatform((String) row.get("source_platform"))
                    .volume((Double) row.get("volume"))
                    .forecasterCount(toInteger(row.get("n_forecasters")))
                    .commentCount(toInteger(row.get("comments_count")))
                    .marketType((String) row.get("original_market_type"))
                    .resolved((Boolean) row.get("is_resolved"))
                    .build());
        }
        return markets;
    }

    private static Integer toInteger(Object value) {
        return value == null ? null : ((Number) value).intValue();
    }
}
