package eu.virtualparadox.docsearch.service;

import eu.virtualparadox.docsearch.application.config.ApplicationConfig;
import eu.virtualparadox.docsearch.exception.ExtractionException;
import eu.virtualparadox.docsearch.ingest.extractor.DocumentLoader;
import eu.virtualparadox.docsearch.ingest.lifecycle.IndexProgressTracker;
import eu.virtualparadox.docsearch.ingest.lifecycle.ProgressStatus;
import eu.virtualparadox.docsearch.ingest.model.Document;
import eu.virtualparadox.docsearch.query.analysis.QueryAnalysis;
import eu.virtualparadox.docsearch.query.analysis.QueryAnalyzer;
import eu.virtualparadox.docsearch.query.search.SearchEngine;
import eu.virtualparadox.docsearch.query.search.SearchRequest;
import eu.virtualparadox.docsearch.query.search.SearchResult;
import eu.virtualparadox.docsearch.rag.embed.EmbeddingBatcher;
import eu.virtualparadox.docsearch.rag.index.IndexOptions;
import eu.virtualparadox.docsearch.rag.index.IndexStats;
import eu.virtualparadox.docsearch.rag.index.IndexingOrchestrator;
import eu.virtualparadox.docsearch.rag.manifest.IndexManifest;
import eu.virtualparadox.docsearch.rag.manifest.ManifestStats;
import eu.virtualparadox.docsearch.rag.store.VectorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Entry point of the document search core, consumed by an outer API layer.
 * <p>
 * Every operation that changes the index also drops cached search results.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentSearchService {

    private final ApplicationConfig config;
    private final DocumentLoader documentLoader;
    private final IndexingOrchestrator orchestrator;
    private final SearchEngine searchEngine;
    private final QueryAnalyzer queryAnalyzer;
    private final IndexManifest manifest;
    private final VectorStore vectorStore;
    private final EmbeddingBatcher embeddingBatcher;
    private final IndexProgressTracker progressTracker;

    public IndexStats index(final List<Document> documents, final IndexOptions options) {
        try {
            return orchestrator.index(documents, options);
        } finally {
            searchEngine.invalidateCache();
        }
    }

    /**
     * Extracts and indexes every supported file under {@code directory}.
     *
     * @param directory directory to scan, {@code null} for {@code docsearch.documents}
     * @param options   run options
     * @return extraction outcome and run statistics
     */
    public DirectoryIndexReport indexDirectory(final Path directory, final IndexOptions options) {
        final Path root = directory == null ? config.getDocuments() : directory;
        final DocumentLoader.LoadResult loaded = documentLoader.loadDirectory(root);
        final List<Path> skipped = loaded.failures().stream().map(ExtractionException::getPath).toList();
        if (!skipped.isEmpty()) {
            log.warn("{} of {} documents under {} could not be extracted", skipped.size(),
                    loaded.documents().size() + skipped.size(), root);
        }

        final IndexStats stats = index(loaded.documents(), options);
        return new DirectoryIndexReport(root, loaded.documents().size() + skipped.size(),
                skipped.size(), skipped, stats);
    }

    /**
     * @return number of chunks removed
     */
    public int removeDocument(final String documentId) {
        try {
            return orchestrator.removeDocument(documentId);
        } finally {
            searchEngine.invalidateCache();
        }
    }

    public List<SearchResult> search(final SearchRequest request) {
        return searchEngine.search(request);
    }

    public QueryAnalysis analyze(final String query) {
        return queryAnalyzer.analyze(query);
    }

    public SystemStats stats() {
        final ManifestStats manifestStats = manifest.stats();
        return new SystemStats(manifestStats.documentsIndexed(), manifestStats.chunksIndexed(),
                manifestStats.lastIndexedAt(), vectorStore.count(), embeddingBatcher.modelId());
    }

    public ProgressStatus progress() {
        return progressTracker.getProgressStatus();
    }

    public void clearSearchCache() {
        searchEngine.invalidateCache();
        log.info("Search cache cleared");
    }
}
