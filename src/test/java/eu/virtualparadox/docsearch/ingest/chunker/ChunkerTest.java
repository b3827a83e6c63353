package eu.virtualparadox.docsearch.ingest.chunker;

import eu.virtualparadox.docsearch.ingest.fingerprint.ContentFingerprinter;
import eu.virtualparadox.docsearch.ingest.model.Chunk;
import eu.virtualparadox.docsearch.ingest.model.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkerTest {

    private static final int MAX = 1000;
    private static final int OVERLAP = 200;

    private final ContentFingerprinter fingerprinter = new ContentFingerprinter();
    private final Chunker chunker = new Chunker(fingerprinter, MAX, OVERLAP, 200);

    // ---------- Helpers ----------

    private static Document doc(final String text) {
        return new Document("doc-1", Path.of("doc-1.txt"), "txt", text, Instant.EPOCH);
    }

    /**
     * Build a text of N sentences of random lower-case words.
     */
    private static String buildSentences(final int count) {
        final Random rnd = new Random(123);
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            final int words = 5 + rnd.nextInt(10);
            for (int w = 0; w < words; w++) {
                final int len = 2 + rnd.nextInt(8);
                for (int c = 0; c < len; c++) {
                    sb.append((char) ('a' + rnd.nextInt(26)));
                }
                sb.append(w == words - 1 ? ". " : " ");
            }
            if (i % 7 == 6) {
                sb.append("\n\n");
            }
        }
        return sb.toString().trim();
    }

    private static void assertExactOverlap(final List<Chunk> chunks, final int overlap) {
        for (int i = 0; i + 1 < chunks.size(); i++) {
            final String tail = chunks.get(i).text().substring(chunks.get(i).text().length() - overlap);
            final String head = chunks.get(i + 1).text().substring(0, overlap);
            assertThat(head).as("overlap between chunk %d and %d", i, i + 1).isEqualTo(tail);
            assertThat(chunks.get(i + 1).startOffset()).isEqualTo(chunks.get(i).endOffset() - overlap);
        }
    }

    // ---------- Tests ----------

    @Test
    @DisplayName("2500 characters without boundaries split into [0,1000) [800,1800) [1600,2500)")
    void testHardSplitExample() {
        final List<Chunk> chunks = chunker.chunk(doc("x".repeat(2500)), 1000, 200);

        assertThat(chunks).hasSize(3);
        assertThat(chunks).extracting(Chunk::startOffset).containsExactly(0, 800, 1600);
        assertThat(chunks).extracting(Chunk::endOffset).containsExactly(1000, 1800, 2500);
        assertThat(chunks).extracting(Chunk::sequenceIndex).containsExactly(0, 1, 2);
    }

    @Test
    void testBlankTextYieldsNoChunks() {
        assertThat(chunker.chunk(doc(""))).isEmpty();
        assertThat(chunker.chunk(doc("   \n\n\t "))).isEmpty();
    }

    @Test
    void testShortTextIsSingleChunk() {
        final List<Chunk> chunks = chunker.chunk(doc("A short document."));

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).text()).isEqualTo("A short document.");
        assertThat(chunks.get(0).startOffset()).isZero();
        assertThat(chunks.get(0).endOffset()).isEqualTo(17);
    }

    @Test
    void testChunksRespectSizeAndOffsets() {
        final String text = buildSentences(400);
        final List<Chunk> chunks = chunker.chunk(doc(text));

        assertThat(chunks.size()).isGreaterThan(5);
        assertThat(chunks.get(0).startOffset()).isZero();
        assertThat(chunks.get(chunks.size() - 1).endOffset()).isEqualTo(text.length());
        for (final Chunk c : chunks) {
            assertThat(c.length()).isLessThanOrEqualTo(MAX);
            assertThat(c.text()).isEqualTo(text.substring(c.startOffset(), c.endOffset()));
            assertThat(c.fingerprint()).isEqualTo(fingerprinter.fingerprint(c.text()));
            assertThat(c.documentId()).isEqualTo("doc-1");
        }
        assertExactOverlap(chunks, OVERLAP);
    }

    @Test
    void testChunksPreferNaturalBoundaries() {
        final String text = buildSentences(400);
        final List<Chunk> chunks = chunker.chunk(doc(text));

        // every chunk but the last ends at a word boundary, never mid-word
        for (int i = 0; i + 1 < chunks.size(); i++) {
            final int end = chunks.get(i).endOffset();
            final boolean boundary = Character.isWhitespace(text.charAt(end - 1))
                    || Character.isWhitespace(text.charAt(end));
            assertThat(boundary).as("chunk %d ends at a boundary", i).isTrue();
        }
    }

    @Test
    void testParagraphBreakWinsOverSentenceEnd() {
        final String first = "word ".repeat(170) + "end.\n\n";
        final String text = first + "Next sentence here. " + "more ".repeat(100);
        final List<Chunk> chunks = chunker.chunk(doc(text), 1000, 200);

        assertThat(chunks.get(0).endOffset()).isEqualTo(first.length());
    }

    @Test
    void testChunkingIsDeterministic() {
        final String text = buildSentences(250);

        assertThat(chunker.chunk(doc(text))).isEqualTo(chunker.chunk(doc(text)));
    }

    @Test
    void testIdenticalTextHasIdenticalFingerprintAcrossDocuments() {
        final Document a = new Document("a", Path.of("a.txt"), "txt", "same text", Instant.EPOCH);
        final Document b = new Document("b", Path.of("b.pdf"), "pdf", "same text", Instant.EPOCH);

        assertThat(chunker.chunk(a).get(0).fingerprint()).isEqualTo(chunker.chunk(b).get(0).fingerprint());
    }

    @Test
    void testInvalidGeometryIsRejected() {
        final Document d = doc("text");

        assertThatThrownBy(() -> chunker.chunk(d, 100, 100)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> chunker.chunk(d, 100, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> chunker.chunk(d, 0, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Chunker(fingerprinter, 100, 200, 10)).isInstanceOf(IllegalArgumentException.class);
    }
}
