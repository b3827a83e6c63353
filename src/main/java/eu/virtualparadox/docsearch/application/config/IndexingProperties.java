package eu.virtualparadox.docsearch.application.config;

import eu.virtualparadox.docsearch.rag.resilience.BackoffPolicy;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Tuning knobs of the indexing pipeline: chunk geometry, embedding batching and the
 * timeout/retry envelope of every embedding and vector-store call.
 */
@Slf4j
@Configuration
@ConfigurationProperties(prefix = "docsearch")
@Getter @Setter
public class IndexingProperties {

    private static final int MIN_CHUNK_SIZE = 100;
    private static final int MAX_CHUNK_SIZE = 8000;
    private static final int LARGE_CHUNK_WARNING = 6000;

    private Chunking chunking = new Chunking();
    private Embedding embedding = new Embedding();
    private Store store = new Store();

    @PostConstruct
    public void validate() {
        if (chunking.maxChunkSize < MIN_CHUNK_SIZE || chunking.maxChunkSize > MAX_CHUNK_SIZE) {
            throw new IllegalStateException("docsearch.chunking.max-chunk-size must be within ["
                    + MIN_CHUNK_SIZE + ", " + MAX_CHUNK_SIZE + "], was " + chunking.maxChunkSize);
        }
        if (chunking.chunkOverlap <= 0 || chunking.chunkOverlap >= chunking.maxChunkSize) {
            throw new IllegalStateException("docsearch.chunking.chunk-overlap must be positive and less than max-chunk-size");
        }
        if (chunking.maxChunkSize > LARGE_CHUNK_WARNING) {
            log.warn("Chunk size {} may exceed the embedding model context window", chunking.maxChunkSize);
        }
        if (embedding.batchSize <= 0 || embedding.maxWorkers <= 0) {
            throw new IllegalStateException("docsearch.embedding.batch-size and max-workers must be positive");
        }
        embedding.retry.toBackoffPolicy();
    }

    @Getter @Setter
    public static class Chunking {
        /** MAX_CHUNK_SIZE: upper bound of characters per chunk. */
        private int maxChunkSize = 1000;
        /** CHUNK_OVERLAP: characters shared by consecutive chunks. */
        private int chunkOverlap = 200;
        /** How far back from the hard cut the chunker looks for a natural boundary. */
        private int boundaryLookback = 200;
    }

    @Getter @Setter
    public static class Embedding {
        /** EMBEDDING_BATCH_SIZE. */
        private int batchSize = 32;
        /** MAX_WORKERS: concurrent embedding batches. */
        private int maxWorkers = 4;
        private Duration callTimeout = Duration.ofSeconds(30);
        private Retry retry = new Retry();
    }

    @Getter @Setter
    public static class Store {
        private Duration callTimeout = Duration.ofSeconds(10);
        private Retry retry = new Retry();
    }

    @Getter @Setter
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialInterval = Duration.ofMillis(200);
        private double multiplier = 2.0;
        private Duration maxInterval = Duration.ofSeconds(5);
        private double randomization = 0.2;

        public BackoffPolicy toBackoffPolicy() {
            return new BackoffPolicy(maxAttempts, initialInterval, multiplier, maxInterval, randomization);
        }
    }
}
