package eu.virtualparadox.docsearch.query.search;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static eu.virtualparadox.docsearch.query.search.SearchResult.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ResultPostProcessorTest {

    private final ResultPostProcessor processor = new ResultPostProcessor();

    private static String filler(final int words) {
        return IntStream.range(0, words).mapToObj(i -> "filler" + i).collect(Collectors.joining(" "));
    }

    private static SearchResult result(final String id, final String file, final String text, final double score) {
        return new SearchResult(id, file, text, score, Map.of(META_FILE_TYPE, "txt"));
    }

    @Test
    void testKeywordBoostIsProportionalToMatchedQueryWords() {
        final SearchResult input = result("1", "a.txt", "Lucene keeps the INDEX " + filler(10), 0.5);

        final SearchResult out = processor.process(List.of(input), "lucene vector index").get(0);

        assertThat(out.score()).isCloseTo(0.5 + 2.0 / 3.0 * 0.1, within(1e-9));
        assertThat(out.metadata())
                .containsEntry(META_KEYWORD_MATCHES, List.of("index", "lucene"))
                .containsEntry(META_ORIGINAL_SCORE, 0.5)
                .containsEntry(META_TEXT_LENGTH_WORDS, 14)
                .containsEntry(META_FILE_TYPE, "txt");
    }

    @Test
    void testBoostedScoreIsCapped() {
        final SearchResult out = processor.process(
                List.of(result("1", "a.txt", "exact match " + filler(10), 0.99)), "exact match").get(0);

        assertThat(out.score()).isEqualTo(1.0);
    }

    @Test
    void testLengthNormalization() {
        final List<SearchResult> out = processor.process(List.of(
                result("short", "a.txt", "only three words", 0.8),
                result("long", "b.txt", filler(501), 0.8),
                result("normal", "c.txt", filler(50), 0.8)), "unrelated");

        assertThat(out).extracting(SearchResult::vectorStoreId).containsExactly("normal", "long", "short");
        assertThat(out.get(0).score()).isCloseTo(0.8, within(1e-9));
        assertThat(out.get(1).score()).isCloseTo(0.76, within(1e-9));
        assertThat(out.get(2).score()).isCloseTo(0.72, within(1e-9));
        assertThat(out.get(0).metadata()).doesNotContainKey(META_KEYWORD_MATCHES);
    }

    @Test
    void testDiversityPenaltyAfterPerFileQuota() {
        final String text = filler(20);
        final List<SearchResult> out = processor.process(List.of(
                result("a1", "a.txt", text, 0.9),
                result("a2", "a.txt", text, 0.85),
                result("b1", "b.txt", text, 0.75)), "unrelated");

        assertThat(out).extracting(SearchResult::vectorStoreId).containsExactly("a1", "b1", "a2");
        assertThat(out.get(2).score()).isCloseTo(0.85 * 0.8, within(1e-9));
        assertThat(out.get(2).metadata()).containsEntry(META_DIVERSITY_PENALTY, true);
        assertThat(out.get(0).metadata()).doesNotContainKey(META_DIVERSITY_PENALTY);
    }

    @Test
    void testTiesKeepInputOrder() {
        final String text = filler(20);
        final List<SearchResult> out = processor.process(List.of(
                result("x", "a.txt", text, 0.7),
                result("y", "b.txt", text, 0.7),
                result("z", "c.txt", text, 0.7)), "unrelated");

        assertThat(out).extracting(SearchResult::vectorStoreId).containsExactly("x", "y", "z");
    }

    @Test
    void testEmptyInput() {
        assertThat(processor.process(List.of(), "anything")).isEmpty();
    }
}
