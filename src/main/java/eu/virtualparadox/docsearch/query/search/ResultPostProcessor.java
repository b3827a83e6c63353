package eu.virtualparadox.docsearch.query.search;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static eu.virtualparadox.docsearch.query.search.SearchResult.*;

/**
 * Re-ranks vector-similarity candidates:
 * <ol>
 *   <li><b>Keyword boost</b>: up to {@code +0.1}, proportional to the share of query words
 *       occurring verbatim in the chunk</li>
 *   <li><b>Length normalization</b>: {@code ×0.9} under 10 words, {@code ×0.95} over 500 words</li>
 *   <li><b>Document diversity</b>: once a source file contributed {@code max(1, n / 3)} results,
 *       its further results are scored {@code ×0.8}</li>
 * </ol>
 * Scores stay within {@code [0, 1]}; the output is sorted by descending score, ties keep input order.
 */
@Component
public class ResultPostProcessor {

    private static final double MAX_KEYWORD_BOOST = 0.1;
    private static final int SHORT_TEXT_WORDS = 10;
    private static final int LONG_TEXT_WORDS = 500;
    private static final double SHORT_TEXT_FACTOR = 0.9;
    private static final double LONG_TEXT_FACTOR = 0.95;
    private static final double DIVERSITY_FACTOR = 0.8;

    private static final Comparator<SearchResult> BY_SCORE_DESC =
            Comparator.comparingDouble(SearchResult::score).reversed();

    public List<SearchResult> process(final List<SearchResult> results, final String query) {
        if (results.isEmpty()) {
            return results;
        }

        final Set<String> queryWords = words(query);
        final List<SearchResult> enhanced = new ArrayList<>(results.size());
        for (final SearchResult result : results) {
            enhanced.add(enhance(result, queryWords));
        }
        enhanced.sort(BY_SCORE_DESC);

        final int maxPerFile = Math.max(1, results.size() / 3);
        final Map<String, Integer> fileCounts = new HashMap<>();
        final List<SearchResult> diverse = new ArrayList<>(enhanced.size());
        for (final SearchResult result : enhanced) {
            final int count = fileCounts.merge(result.sourceFile(), 1, Integer::sum);
            if (count <= maxPerFile) {
                diverse.add(result);
            } else {
                final Map<String, Object> metadata = new LinkedHashMap<>(result.metadata());
                metadata.put(META_DIVERSITY_PENALTY, true);
                diverse.add(result.withScore(result.score() * DIVERSITY_FACTOR, metadata));
            }
        }

        diverse.sort(BY_SCORE_DESC);
        return diverse;
    }

    private static SearchResult enhance(final SearchResult result, final Set<String> queryWords) {
        final Map<String, Object> metadata = new LinkedHashMap<>(result.metadata());
        double score = result.score();

        final Set<String> common = new TreeSet<>(words(result.text()));
        common.retainAll(queryWords);
        if (!common.isEmpty()) {
            final double boost = Math.min(MAX_KEYWORD_BOOST, (double) common.size() / queryWords.size() * MAX_KEYWORD_BOOST);
            score = Math.min(1.0, score + boost);
            metadata.put(META_KEYWORD_MATCHES, List.copyOf(common));
            metadata.put(META_KEYWORD_BOOST, boost);
        }

        final int length = wordCount(result.text());
        if (length < SHORT_TEXT_WORDS) {
            score *= SHORT_TEXT_FACTOR;
        } else if (length > LONG_TEXT_WORDS) {
            score *= LONG_TEXT_FACTOR;
        }

        metadata.put(META_ORIGINAL_SCORE, result.score());
        metadata.put(META_TEXT_LENGTH_WORDS, length);
        return result.withScore(Math.max(0.0, Math.min(1.0, score)), metadata);
    }

    private static Set<String> words(final String text) {
        final Set<String> words = new HashSet<>();
        for (final String word : text.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    private static int wordCount(final String text) {
        final String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
