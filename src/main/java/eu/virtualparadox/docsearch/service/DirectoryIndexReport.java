package eu.virtualparadox.docsearch.service;

import eu.virtualparadox.docsearch.rag.index.IndexStats;

import java.nio.file.Path;
import java.util.List;

/**
 * @param directory        scanned directory
 * @param documentsFound   supported files discovered
 * @param documentsSkipped files whose text could not be extracted
 * @param skippedFiles     paths of the skipped files
 * @param stats            statistics of the indexing run over the extracted documents
 */
public record DirectoryIndexReport(Path directory,
                                   int documentsFound,
                                   int documentsSkipped,
                                   List<Path> skippedFiles,
                                   IndexStats stats) {
}
