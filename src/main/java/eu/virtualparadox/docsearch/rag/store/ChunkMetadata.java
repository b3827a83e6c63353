package eu.virtualparadox.docsearch.rag.store;

import eu.virtualparadox.docsearch.ingest.model.Chunk;
import eu.virtualparadox.docsearch.ingest.model.Document;

/**
 * Payload stored next to each vector.
 *
 * @param documentId    owning document
 * @param sourceFile    file the chunk was extracted from
 * @param fileType      normalized extension of the source file
 * @param sequenceIndex position of the chunk within the document
 * @param startOffset   inclusive start offset in the document text
 * @param endOffset     exclusive end offset in the document text
 * @param text          the chunk text
 */
public record ChunkMetadata(String documentId,
                            String sourceFile,
                            String fileType,
                            int sequenceIndex,
                            int startOffset,
                            int endOffset,
                            String text) {

    public static ChunkMetadata of(final Document document, final Chunk chunk) {
        return new ChunkMetadata(
                document.id(),
                document.sourcePath().toString(),
                document.fileType(),
                chunk.sequenceIndex(),
                chunk.startOffset(),
                chunk.endOffset(),
                chunk.text());
    }
}
