package eu.virtualparadox.docsearch.query.analysis;

import java.util.List;

/**
 * Lexical profile of a query with advice for tuning the search.
 *
 * @param query               the analyzed query, stripped
 * @param queryLength         characters in {@code query}
 * @param tokenCount          tokens produced by the analyzer
 * @param estimatedComplexity ordinal complexity estimate
 * @param keywords            distinct tokens of at least three characters, in query order
 * @param phrases             quoted multi-word phrases
 * @param language            {@code uk}, {@code ru}, {@code en} or {@code unknown}
 * @param recommendations     human-readable advice, possibly empty
 */
public record QueryAnalysis(String query,
                            int queryLength,
                            int tokenCount,
                            EQueryComplexity estimatedComplexity,
                            List<String> keywords,
                            List<String> phrases,
                            String language,
                            List<String> recommendations) {
}
