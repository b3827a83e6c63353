package eu.virtualparadox.docsearch.rag.index;

import eu.virtualparadox.docsearch.ingest.model.Document;
import eu.virtualparadox.docsearch.util.CancellationSignal;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Options of an indexing run.
 *
 * @param forceReindex    re-embed every chunk of the affected documents regardless of the manifest
 * @param fileTypesFilter extensions to process (case-insensitive, leading dot optional); empty means all
 * @param cancellation    stops the run between embedding batches
 */
public record IndexOptions(boolean forceReindex, Set<String> fileTypesFilter, CancellationSignal cancellation) {

    public IndexOptions {
        fileTypesFilter = fileTypesFilter == null
                ? Set.of()
                : fileTypesFilter.stream()
                        .map(Document::normalizeFileType)
                        .filter(t -> !t.isEmpty())
                        .collect(Collectors.toUnmodifiableSet());
        cancellation = cancellation == null ? CancellationSignal.create() : cancellation;
    }

    public static IndexOptions defaults() {
        return new IndexOptions(false, Set.of(), null);
    }

    public static IndexOptions force() {
        return new IndexOptions(true, Set.of(), null);
    }

    public IndexOptions withFileTypes(final Set<String> fileTypes) {
        return new IndexOptions(forceReindex, fileTypes, cancellation);
    }

    public IndexOptions withCancellation(final CancellationSignal signal) {
        return new IndexOptions(forceReindex, fileTypesFilter, signal);
    }

    public boolean accepts(final Document document) {
        return fileTypesFilter.isEmpty() || fileTypesFilter.contains(document.fileType());
    }
}
