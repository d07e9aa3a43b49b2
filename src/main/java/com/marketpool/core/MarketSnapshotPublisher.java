package com.marketpool.core;

import com.marketpool.domain.MarketFilter;
import com.marketpool.domain.PooledMarket;
import com.marketpool.error.ConfigurationException;
import com.marketpool.error.CryptoException;
import com.marketpool.infra.TableFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One publish cycle: fetch all sources, write the encrypted market snapshot,
 * embed every question and export the encrypted embedding cache.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "marketpool.publish", name = "enabled", havingValue = "true")
public class MarketSnapshotPublisher {

    private final FetchOrchestrator orchestrator;
    private final MarketSnapshotStore snapshotStore;
    private final EmbeddingCache embeddingCache;
    private final Path outputDirectory;
    private final TableFormat format;
    private final MarketFilter scheduledFilter;

    public MarketSnapshotPublisher(FetchOrchestrator orchestrator, MarketSnapshotStore snapshotStore,
            EmbeddingCache embeddingCache, MarketFilter scheduledFilter,
            @Value("${marketpool.publish.output-dir:data/release}") String outputDirectory,
            @Value("${marketpool.publish.format:parquet}") String format) {
        this.orchestrator = orchestrator;
        this.snapshotStore = snapshotStore;
        this.embeddingCache = embeddingCache;
        this.outputDirectory = Paths.get(outputDirectory);
        this.format = TableFormat.fromExtension(format);
        this.scheduledFilter = scheduledFilter;
    }

    public enum CycleState {
        FETCHING,
        WRITING_SNAPSHOT,
        EMBEDDING,
        EXPORTING_CACHE,
        COMPLETED,
        FAILED
    }

    @Scheduled(fixedDelayString = "${marketpool.publish.interval-ms:21600000}")
    public void scheduledPublish() {
        publish(scheduledFilter);
    }

    /**
     * Source and embedding failures end the cycle as {@link CycleState#FAILED};
     * missing secrets and decryption failures are rethrown.
     */
    public CycleState publish(MarketFilter filter) {
        log.info("--- START PUBLISH CYCLE ---");
        CycleState state = CycleState.FETCHING;
        try {
            List<PooledMarket> markets = orchestrator.fetchAll(filter);
            if (markets.isEmpty()) {
                log.warn("[PUBLISH] No source returned markets, keeping the previous artifacts");
                return CycleState.FAILED;
            }

            state = CycleState.WRITING_SNAPSHOT;
            Path snapshot = snapshotStore.save(markets, outputDirectory, format);
            log.info("[PUBLISH] State: {} | {} markets -> {}", state, markets.size(), snapshot);

            state = CycleState.EMBEDDING;
            List<String> questions = markets.stream().map(PooledMarket::getQuestion).collect(Collectors.toList());
            embeddingCache.get(questions);
            log.info("[PUBLISH] State: {} | cache holds {} embeddings", state, embeddingCache.size());

            state = CycleState.EXPORTING_CACHE;
            Path cache = embeddingCache.exportEncrypted(outputDirectory);
            log.info("[PUBLISH] State: {} | -> {}", state, cache);

            log.info("--- PUBLISH CYCLE COMPLETED ---");
            return CycleState.COMPLETED;
        } catch (ConfigurationException | CryptoException e) {
            log.error("[PUBLISH] Cannot continue during state {}: {}", state, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("[PUBLISH] Failed during state {}", state, e);
            return CycleState.FAILED;
        }
    }
}
