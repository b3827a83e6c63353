package eu.virtualparadox.docsearch.application.runner;

import eu.virtualparadox.docsearch.rag.index.IndexOptions;
import eu.virtualparadox.docsearch.service.DirectoryIndexReport;
import eu.virtualparadox.docsearch.service.DocumentSearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Indexes {@code docsearch.documents} once the application has started.
 * Pass {@code --force-reindex} to re-embed every chunk.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "docsearch", name = "index-on-startup", havingValue = "true")
public class StartupIndexRunner implements ApplicationRunner {

    private final DocumentSearchService documentSearchService;

    @Override
    public void run(final ApplicationArguments args) {
        final IndexOptions options = args.containsOption("force-reindex") ? IndexOptions.force() : IndexOptions.defaults();
        final DirectoryIndexReport report = documentSearchService.indexDirectory(null, options);
        log.info("Startup indexing of {}: {} files found, {} skipped, {}",
                report.directory(), report.documentsFound(), report.documentsSkipped(), report.stats());
    }
}
