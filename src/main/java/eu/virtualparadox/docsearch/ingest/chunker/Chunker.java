package eu.virtualparadox.docsearch.ingest.chunker;

import eu.virtualparadox.docsearch.ingest.fingerprint.ContentFingerprinter;
import eu.virtualparadox.docsearch.ingest.model.Chunk;
import eu.virtualparadox.docsearch.ingest.model.Document;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Boundary-aware sliding-window {@code Chunker} producing overlapping chunks for embedding.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Window:</strong> a chunk starting at {@code start} may extend to the hard cut
 *       {@code min(start + maxSize, length)}.</li>
 *   <li><strong>Boundary search:</strong> unless the hard cut is the end of the text, the chunker
 *       looks back at most {@code boundaryLookback} characters for a natural end, in priority
 *       order: paragraph break ({@code \n\n}), sentence end ({@code .}, {@code !} or {@code ?}
 *       followed by whitespace), any whitespace. The chunk ends right after the boundary.
 *       Without a boundary the hard cut is used, so a run of text without whitespace is split
 *       on exact character counts.</li>
 *   <li><strong>Exact overlap:</strong> the next chunk starts {@code overlap} characters before
 *       the previous chunk's end, so the tail of every chunk equals the head of its successor.
 *       The boundary search never ends a chunk at or before {@code start + overlap}, which
 *       guarantees progress.</li>
 * </ul>
 *
 * <h2>Offsets</h2>
 * Chunk text is exactly {@code rawText.substring(startOffset, endOffset)}; nothing is trimmed
 * or re-joined, and {@code endOffset - startOffset <= maxSize} always holds.
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * Stateless after construction. For a given document and parameters the output is
 * byte-identical across calls.
 */
@Component
public class Chunker {

    private static final String PARAGRAPH_BREAK = "\n\n";

    private final ContentFingerprinter fingerprinter;
    private final int defaultMaxSize;
    private final int defaultOverlap;
    private final int boundaryLookback;

    /**
     * Constructs a {@code Chunker}.
     *
     * @param fingerprinter    computes the identity of each produced chunk
     * @param defaultMaxSize   MAX_CHUNK_SIZE used by {@link #chunk(Document)}
     * @param defaultOverlap   CHUNK_OVERLAP used by {@link #chunk(Document)}
     * @param boundaryLookback characters before the hard cut searched for a natural boundary ({@code >= 0})
     * @throws IllegalArgumentException if constraints are violated
     */
    public Chunker(final ContentFingerprinter fingerprinter,
                   @Value("${docsearch.chunking.max-chunk-size:1000}") final int defaultMaxSize,
                   @Value("${docsearch.chunking.chunk-overlap:200}") final int defaultOverlap,
                   @Value("${docsearch.chunking.boundary-lookback:200}") final int boundaryLookback) {
        validateGeometry(defaultMaxSize, defaultOverlap);
        if (boundaryLookback < 0) {
            throw new IllegalArgumentException("boundaryLookback must be non-negative");
        }
        this.fingerprinter = fingerprinter;
        this.defaultMaxSize = defaultMaxSize;
        this.defaultOverlap = defaultOverlap;
        this.boundaryLookback = boundaryLookback;
    }

    /**
     * Chunks a document with the configured size and overlap.
     *
     * @param document the document to split
     * @return ordered chunks, empty for blank text
     */
    public List<Chunk> chunk(final Document document) {
        return chunk(document, defaultMaxSize, defaultOverlap);
    }

    /**
     * Splits {@code document.rawText()} into overlapping chunks.
     *
     * @param document the document to split (non-null)
     * @param maxSize  maximum characters per chunk ({@code > 0})
     * @param overlap  characters shared by consecutive chunks ({@code 0 < overlap < maxSize})
     * @return ordered chunks with {@code sequenceIndex} 0..n-1, empty for blank text
     * @throws IllegalArgumentException if the parameters are invalid
     */
    public List<Chunk> chunk(final Document document, final int maxSize, final int overlap) {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        validateGeometry(maxSize, overlap);

        final String text = document.rawText();
        final List<Chunk> result = new ArrayList<>();
        if (text.isBlank()) {
            return result;
        }

        int seq = 0;
        for (final ChunkSpan span : spans(text, maxSize, overlap)) {
            final String chunkText = text.substring(span.start, span.end);
            result.add(new Chunk(document.id(), seq++, chunkText, span.start, span.end,
                    fingerprinter.fingerprint(chunkText)));
        }
        return result;
    }

    /**
     * Computes the window spans covering {@code text}.
     */
    private List<ChunkSpan> spans(final String text, final int maxSize, final int overlap) {
        final List<ChunkSpan> spans = new ArrayList<>();
        final int length = text.length();

        int start = 0;
        while (true) {
            final int hardEnd = Math.min(start + maxSize, length);
            if (hardEnd == length) {
                spans.add(new ChunkSpan(start, length));
                return spans;
            }

            // Earliest acceptable end: keeps the next start strictly after this one.
            final int floor = Math.max(hardEnd - boundaryLookback, start + overlap + 1);
            final int end = findBoundary(text, floor, hardEnd);

            spans.add(new ChunkSpan(start, end));
            start = end - overlap;
        }
    }

    /**
     * Finds the best chunk end within {@code [floor, hardEnd]}.
     *
     * @return a boundary position, or {@code hardEnd} if the window holds none
     */
    private static int findBoundary(final String text, final int floor, final int hardEnd) {
        if (floor > hardEnd) {
            return hardEnd;
        }

        final int paragraph = text.lastIndexOf(PARAGRAPH_BREAK, hardEnd - PARAGRAPH_BREAK.length());
        if (paragraph >= 0 && paragraph + PARAGRAPH_BREAK.length() >= floor) {
            return paragraph + PARAGRAPH_BREAK.length();
        }

        // Sentence end: terminal punctuation followed by whitespace, chunk ends after the whitespace.
        for (int end = hardEnd; end >= floor && end >= 2; end--) {
            final char punct = text.charAt(end - 2);
            if ((punct == '.' || punct == '!' || punct == '?') && Character.isWhitespace(text.charAt(end - 1))) {
                return end;
            }
        }

        // Word boundary: the hard cut itself qualifies when the next character is whitespace.
        if (Character.isWhitespace(text.charAt(hardEnd))) {
            return hardEnd;
        }
        for (int end = hardEnd; end >= floor && end >= 1; end--) {
            if (Character.isWhitespace(text.charAt(end - 1))) {
                return end;
            }
        }
        return hardEnd;
    }

    private static void validateGeometry(final int maxSize, final int overlap) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        if (overlap <= 0 || overlap >= maxSize) {
            throw new IllegalArgumentException("overlap must be positive and less than maxSize");
        }
    }
}
