package eu.virtualparadox.docsearch.application.config;

import eu.virtualparadox.docsearch.application.executor.VectorStoreCallExecutor;
import eu.virtualparadox.docsearch.rag.resilience.GuardedCall;
import eu.virtualparadox.docsearch.rag.store.LuceneVectorStore;
import eu.virtualparadox.docsearch.rag.store.ResilientVectorStore;
import eu.virtualparadox.docsearch.rag.store.VectorStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Creates and manages Lucene resources (Directory, Analyzer, IndexWriter, SearcherManager) and
 * the vector store built on them.
 * <p>Resources are opened against the on-disk index under {@code docsearch.index} and closed on shutdown.</p>
 */
@Configuration
@Slf4j
public class LuceneConfig {

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;
    private Analyzer analyzer;

    @Bean
    public Directory luceneDirectory(final ApplicationConfig props) throws IOException {
        final Path indexPath = props.getIndex();
        Files.createDirectories(indexPath);
        this.directory = FSDirectory.open(indexPath);
        return this.directory;
    }

    /**
     * Shared analyzer; also tokenizes queries for complexity analysis.
     */
    @Bean
    public Analyzer analyzer() {
        this.analyzer = new StandardAnalyzer();
        return this.analyzer;
    }

    @Bean
    public IndexWriter indexWriter(final Directory dir, final Analyzer analyzer) throws IOException {
        final IndexWriterConfig cfg = new IndexWriterConfig(analyzer)
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        this.indexWriter = new IndexWriter(dir, cfg);
        return this.indexWriter;
    }

    @Bean
    public SearcherManager searcherManager(final IndexWriter writer) throws IOException {
        this.searcherManager = new SearcherManager(writer, null);
        return this.searcherManager;
    }

    @Bean
    public LuceneVectorStore luceneVectorStore(final IndexWriter writer, final SearcherManager searcherManager) {
        return new LuceneVectorStore(writer, searcherManager);
    }

    /**
     * The store every component talks to: Lucene behind a timeout and retry envelope.
     * Timed-out Lucene calls are not interrupted, an interrupt during NIO closes the index files.
     */
    @Bean
    @Primary
    public VectorStore vectorStore(final LuceneVectorStore luceneVectorStore,
                                   final VectorStoreCallExecutor callExecutor,
                                   final IndexingProperties properties) {
        final GuardedCall guardedCall = new GuardedCall("vector-store",
                properties.getStore().getRetry().toBackoffPolicy(),
                properties.getStore().getCallTimeout(),
                callExecutor,
                ResilientVectorStore::isTransient,
                false);
        return new ResilientVectorStore(luceneVectorStore, guardedCall);
    }

    /**
     * Closes the Lucene resources in reverse order of creation.
     */
    @PreDestroy
    public void close() {
        closeQuietly(searcherManager, "SearcherManager");
        closeQuietly(indexWriter, "IndexWriter");
        closeQuietly(analyzer, "Analyzer");
        closeQuietly(directory, "Directory");
    }

    private static void closeQuietly(final Closeable resource, final String name) {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        } catch (IOException | RuntimeException e) {
            log.error("Unable to close {}", name, e);
        }
    }
}
