package eu.virtualparadox.docsearch.ingest.chunker;

/**
 * Immutable half-open span {@code [start, end)} pointing into the source text.
 */
final class ChunkSpan {

    final int start;
    final int end;

    ChunkSpan(final int start, final int end) {
        this.start = start;
        this.end = end;
    }
}
