package eu.virtualparadox.docsearch.ingest.extractor;

import eu.virtualparadox.docsearch.exception.ExtractionException;
import eu.virtualparadox.docsearch.ingest.cleaner.TextCleaner;
import eu.virtualparadox.docsearch.ingest.model.Document;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Discovers supported files under a directory and turns them into cleaned {@link Document}s.
 * <p>
 * The document id is the path relative to the scanned root with {@code /} separators, so the
 * same file keeps its id across runs. A file whose extraction fails is reported in
 * {@link LoadResult#failures()} and skipped; it never aborts the scan.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentLoader {

    private final List<TextExtractor> extractors;
    private final TextCleaner textCleaner;

    /**
     * Outcome of a directory scan.
     *
     * @param documents successfully extracted documents, ordered by path
     * @param failures  files that could not be extracted
     */
    public record LoadResult(List<Document> documents, List<ExtractionException> failures) {
    }

    /**
     * Recursively loads every supported file under {@code root}.
     *
     * @param root directory to scan
     * @return loaded documents and extraction failures
     * @throws IllegalArgumentException if {@code root} is not a directory
     */
    public LoadResult loadDirectory(final Path root) {
        if (root == null || !Files.isDirectory(root)) {
            throw new IllegalArgumentException("Documents path is not a directory: " + root);
        }

        final List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(p -> findExtractor(fileTypeOf(p)).isPresent())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + root, e);
        }
        log.info("Discovered {} supported documents under {}", files.size(), root);

        final List<Document> documents = new ArrayList<>(files.size());
        final List<ExtractionException> failures = new ArrayList<>();
        for (final Path file : files) {
            try {
                documents.add(load(root, file));
            } catch (ExtractionException e) {
                log.warn("Skipping {}: {}", file, e.getMessage());
                failures.add(e);
            }
        }
        return new LoadResult(Collections.unmodifiableList(documents), Collections.unmodifiableList(failures));
    }

    /**
     * Loads a single file.
     *
     * @param root base directory used to derive the document id
     * @param file file under {@code root}
     * @return the cleaned document
     * @throws ExtractionException if no extractor supports the file or extraction fails
     */
    public Document load(final Path root, final Path file) {
        final String fileType = fileTypeOf(file);
        final TextExtractor extractor = findExtractor(fileType)
                .orElseThrow(() -> new ExtractionException(file, "Unsupported file format", null));

        final String text = textCleaner.cleanText(extractor.extract(file));
        final String id = root.relativize(file).toString().replace('\\', '/');
        return new Document(id, file, fileType, text, lastModified(file));
    }

    private Optional<TextExtractor> findExtractor(final String fileType) {
        return extractors.stream().filter(e -> e.supports(fileType)).findFirst();
    }

    private static String fileTypeOf(final Path path) {
        final String name = path.getFileName().toString();
        final int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : Document.normalizeFileType(name.substring(dot));
    }

    private static Instant lastModified(final Path file) {
        try {
            return Files.getLastModifiedTime(file).toInstant();
        } catch (IOException e) {
            throw new ExtractionException(file, "Failed to read file attributes", e);
        }
    }
}
