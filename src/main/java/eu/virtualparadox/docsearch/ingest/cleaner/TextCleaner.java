package eu.virtualparadox.docsearch.ingest.cleaner;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Normalizes extracted text before chunking.
 * <p>
 * Paragraphs (runs of text separated by at least one blank line) survive as {@code "\n\n"} so
 * the chunker can prefer them as boundaries. Inside a paragraph line breaks become spaces,
 * invisible and control characters are dropped and whitespace runs collapse to one space.
 * Diacritics are kept; the result is NFC-normalized so that equal text hashes equally.
 */
@Component
public class TextCleaner {

    private static final Pattern BLANK_LINE = Pattern.compile("\\n[ \\t\\u00A0]*\\n");
    private static final String PARAGRAPH_SEPARATOR = "\n\n";

    /**
     * Cleans extracted text.
     *
     * @param input raw text, may be {@code null}
     * @return cleaned text, empty for {@code null} or blank input
     */
    public String cleanText(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }

        final String unified = Normalizer.normalize(input, Normalizer.Form.NFC)
                .replace("\r\n", "\n")
                .replace('\r', '\n');

        final StringJoiner joiner = new StringJoiner(PARAGRAPH_SEPARATOR);
        for (final String paragraph : BLANK_LINE.split(unified)) {
            final String cleaned = cleanParagraph(paragraph);
            if (!cleaned.isEmpty()) {
                joiner.add(cleaned);
            }
        }
        return joiner.toString();
    }

    private String cleanParagraph(final String paragraph) {
        return paragraph
                // line breaks -> space
                .replaceAll("[\\n\\t]+", " ")
                // zero-width and similar -> SPACE
                .replaceAll("[\\u200B\\u200C\\u200D\\uFEFF]", " ")
                // non-breaking space -> SPACE
                .replace("\u00A0", " ")
                // soft hyphen (0xAD) -> remove
                .replace("\u00AD", "")
                // other format chars -> SPACE
                .replaceAll("\\p{Cf}", " ")
                // control chars -> remove
                .replaceAll("\\p{Cc}", "")
                // collapse multiple whitespace -> single space
                .replaceAll("\\s+", " ")
                .trim();
    }
}
