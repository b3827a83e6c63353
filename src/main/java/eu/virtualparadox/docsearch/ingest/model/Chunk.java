package eu.virtualparadox.docsearch.ingest.model;

/**
 * Overlapping slice of a document's text; the unit of embedding and retrieval.
 * {@code text} equals {@code rawText.substring(startOffset, endOffset)} of the parent document.
 *
 * @param documentId    parent document identifier
 * @param sequenceIndex zero-based position within the document
 * @param text          chunk text
 * @param startOffset   inclusive start offset into the document text
 * @param endOffset     exclusive end offset into the document text
 * @param fingerprint   content hash of {@code text}
 */
public record Chunk(String documentId,
                    int sequenceIndex,
                    String text,
                    int startOffset,
                    int endOffset,
                    String fingerprint) {

    public int length() {
        return endOffset - startOffset;
    }
}
