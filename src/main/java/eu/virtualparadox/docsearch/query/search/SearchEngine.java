package eu.virtualparadox.docsearch.query.search;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import eu.virtualparadox.docsearch.application.config.SearchProperties;
import eu.virtualparadox.docsearch.exception.EmbeddingException;
import eu.virtualparadox.docsearch.exception.SearchException;
import eu.virtualparadox.docsearch.exception.VectorStoreException;
import eu.virtualparadox.docsearch.ingest.model.Document;
import eu.virtualparadox.docsearch.rag.embed.EmbeddingBatcher;
import eu.virtualparadox.docsearch.rag.store.ChunkMetadata;
import eu.virtualparadox.docsearch.rag.store.VectorStore;
import eu.virtualparadox.docsearch.rag.store.VectorStoreCandidate;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static eu.virtualparadox.docsearch.query.search.SearchResult.*;

/**
 * Provides semantic query capabilities over the vector store.
 * <p>
 * Steps:
 * <ol>
 *   <li>Validate the request and fill in configured defaults</li>
 *   <li>Embed the query with {@link EmbeddingBatcher#embedOne}</li>
 *   <li>Fetch {@code max(limit, min(limit * overfetch, maxCandidates))} candidates</li>
 *   <li>Re-rank with {@link ResultPostProcessor} (when enabled)</li>
 *   <li>Drop results under the threshold or of other file types, sort, truncate to {@code limit}</li>
 * </ol>
 * Unfiltered queries are cached for a short time; indexing invalidates the cache.
 * A failing embedding or store call raises {@link SearchException}, never an empty list.
 */
@Slf4j
@Service
public class SearchEngine {

    private static final Comparator<SearchResult> BY_SCORE_DESC =
            Comparator.comparingDouble(SearchResult::score).reversed();

    private final EmbeddingBatcher embeddingBatcher;
    private final VectorStore vectorStore;
    private final ResultPostProcessor postProcessor;
    private final SearchProperties properties;
    private final Cache<String, List<SearchResult>> cache;

    public SearchEngine(final EmbeddingBatcher embeddingBatcher,
                        final VectorStore vectorStore,
                        final ResultPostProcessor postProcessor,
                        final SearchProperties properties) {
        this.embeddingBatcher = embeddingBatcher;
        this.vectorStore = vectorStore;
        this.postProcessor = postProcessor;
        this.properties = properties;
        this.cache = properties.getCacheSize() == 0 ? null : Caffeine.newBuilder()
                .maximumSize(properties.getCacheSize())
                .expireAfterWrite(properties.getCacheTtl())
                .build();
    }

    /**
     * Executes a semantic search.
     *
     * @param request query and limits
     * @return at most {@code limit} results with {@code score >= threshold}, by descending score
     * @throws SearchException if the request is invalid or the embedding or store call failed
     */
    public List<SearchResult> search(final SearchRequest request) {
        if (request == null || StringUtils.isBlank(request.query())) {
            throw new SearchException(SearchException.EReason.INVALID_QUERY, "Query must not be blank");
        }
        final String query = request.query().strip();
        final int limit = request.limit() == null ? properties.getDefaultLimit() : request.limit();
        final double threshold = request.scoreThreshold() == null
                ? properties.getSimilarityThreshold()
                : request.scoreThreshold();
        if (limit < 1 || limit > properties.getMaxCandidates()) {
            throw new SearchException(SearchException.EReason.INVALID_QUERY,
                    "limit must be within [1, " + properties.getMaxCandidates() + "], was " + limit);
        }
        if (threshold < 0.0 || threshold > 1.0) {
            throw new SearchException(SearchException.EReason.INVALID_QUERY,
                    "score threshold must be within [0, 1], was " + threshold);
        }
        final Set<String> fileTypes = normalize(request.fileTypes());

        final String cacheKey = cache != null && fileTypes.isEmpty() ? query + ":" + limit + ":" + threshold : null;
        if (cacheKey != null) {
            final List<SearchResult> cached = cache.getIfPresent(cacheKey);
            if (cached != null) {
                log.debug("Cache hit for query '{}'", StringUtils.abbreviate(query, 50));
                return cached;
            }
        }

        final long start = System.nanoTime();
        final float[] queryVector;
        try {
            queryVector = embeddingBatcher.embedOne(query);
        } catch (EmbeddingException e) {
            log.error("Query embedding failed for '{}'", StringUtils.abbreviate(query, 50), e);
            throw new SearchException(SearchException.EReason.EMBEDDING_FAILED, "Failed to embed query", e);
        }
        final long embedded = System.nanoTime();

        final int topK = Math.max(limit, Math.min(limit * properties.getOverfetchFactor(), properties.getMaxCandidates()));
        final List<VectorStoreCandidate> candidates;
        try {
            candidates = vectorStore.search(queryVector, topK, fileTypes);
        } catch (VectorStoreException e) {
            log.error("Vector search failed for '{}'", StringUtils.abbreviate(query, 50), e);
            throw new SearchException(SearchException.EReason.VECTOR_STORE_FAILED, "Vector search failed", e);
        }
        final long searched = System.nanoTime();

        List<SearchResult> results = candidates.stream().map(SearchEngine::toResult).toList();
        if (properties.isPostProcessing()) {
            results = postProcessor.process(results, query);
        }

        final List<SearchResult> filtered = new ArrayList<>();
        for (final SearchResult result : results) {
            if (result.score() >= threshold && (fileTypes.isEmpty() || fileTypes.contains(result.fileType()))) {
                filtered.add(result);
            }
        }
        filtered.sort(BY_SCORE_DESC);
        final List<SearchResult> top = List.copyOf(filtered.subList(0, Math.min(limit, filtered.size())));
        final long finished = System.nanoTime();

        log.info("Search '{}': {} candidates, {} results (embedding {}ms, search {}ms, post-processing {}ms)",
                StringUtils.abbreviate(query, 50), candidates.size(), top.size(),
                millis(start, embedded), millis(embedded, searched), millis(searched, finished));

        if (cacheKey != null && !top.isEmpty()) {
            cache.put(cacheKey, top);
        }
        return top;
    }

    /**
     * Drops cached results; called whenever the index changes.
     */
    public void invalidateCache() {
        if (cache != null) {
            cache.invalidateAll();
        }
    }

    private static SearchResult toResult(final VectorStoreCandidate candidate) {
        final ChunkMetadata m = candidate.metadata();
        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(META_DOCUMENT_ID, m.documentId());
        metadata.put(META_FILE_TYPE, m.fileType());
        metadata.put(META_SEQUENCE_INDEX, m.sequenceIndex());
        metadata.put(META_START_OFFSET, m.startOffset());
        metadata.put(META_END_OFFSET, m.endOffset());
        final double score = Math.max(0.0, Math.min(1.0, candidate.score()));
        return new SearchResult(candidate.id(), m.sourceFile(), m.text(), score, metadata);
    }

    private static Set<String> normalize(final Set<String> fileTypes) {
        if (fileTypes == null) {
            return Set.of();
        }
        return fileTypes.stream()
                .map(Document::normalizeFileType)
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    private static long millis(final long fromNanos, final long toNanos) {
        return (toNanos - fromNanos) / 1_000_000;
    }
}
