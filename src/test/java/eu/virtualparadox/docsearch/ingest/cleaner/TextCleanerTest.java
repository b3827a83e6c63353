package eu.virtualparadox.docsearch.ingest.cleaner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TextCleaner}.
 *
 * These tests cover newline and paragraph handling, control chars, non-breaking spaces,
 * zero-width spaces, soft hyphens, format chars, and whitespace normalization.
 */
class TextCleanerTest {

    private TextCleaner cleaner;

    @BeforeEach
    void setUp() {
        cleaner = new TextCleaner();
    }

    @Test
    void testSimpleTextIsUnchanged() {
        assertThat(cleaner.cleanText("Dragons are dangerous creatures.")).isEqualTo("Dragons are dangerous creatures.");
    }

    @Test
    void testNullAndBlankBecomeEmpty() {
        assertThat(cleaner.cleanText(null)).isEmpty();
        assertThat(cleaner.cleanText(" \n\t \n ")).isEmpty();
    }

    @Test
    void testLineBreaksAreReplacedWithSpaces() {
        assertThat(cleaner.cleanText("volcanic\neruptions")).isEqualTo("volcanic eruptions");
    }

    @Test
    void testBlankLinesKeepParagraphs() {
        assertThat(cleaner.cleanText("line1\r\n\r\nline2")).isEqualTo("line1\n\nline2");
        assertThat(cleaner.cleanText("para one\n \n\n\npara\ntwo")).isEqualTo("para one\n\npara two");
    }

    @Test
    void testControlCharactersAreRemoved() {
        assertThat(cleaner.cleanText("valid\u0007text")).isEqualTo("validtext");
    }

    @Test
    void testZeroWidthVariantsAreHandled() {
        assertThat(cleaner.cleanText("word1\u200Bword2")).isEqualTo("word1 word2");
        assertThat(cleaner.cleanText("word1\u200Cword2")).isEqualTo("word1 word2");
        assertThat(cleaner.cleanText("word1\u200Dword2")).isEqualTo("word1 word2");
        assertThat(cleaner.cleanText("word1\uFEFFword2")).isEqualTo("word1 word2");
        assertThat(cleaner.cleanText("word1\u00A0word2")).isEqualTo("word1 word2");
    }

    @Test
    void testSoftHyphenIsRemoved() {
        assertThat(cleaner.cleanText("Tat\u00ADyana")).isEqualTo("Tatyana");
    }

    @Test
    void testOtherFormatCharactersBecomeSpaces() {
        // U+202C POP DIRECTIONAL FORMATTING is a common PDF artifact
        assertThat(cleaner.cleanText("word1\u202Cword2")).isEqualTo("word1 word2");
    }

    @Test
    void testMultipleSpacesAreCollapsedAndTrimmed() {
        assertThat(cleaner.cleanText("  word1    word2   word3  ")).isEqualTo("word1 word2 word3");
    }

    @Test
    void testCyrillicAndDiacriticsSurvive() {
        assertThat(cleaner.cleanText("Довідка  про\nзаробітну плату, café"))
                .isEqualTo("Довідка про заробітну плату, café");
    }

    @Test
    void testDecomposedTextIsComposed() {
        // "e" + COMBINING ACUTE ACCENT
        assertThat(cleaner.cleanText("cafe\u0301")).isEqualTo("caf\u00E9");
    }
}
