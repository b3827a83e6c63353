package eu.virtualparadox.docsearch.query.search;

import java.util.Set;

/**
 * @param query          free-text query
 * @param limit          maximum results, {@code null} for the configured default
 * @param scoreThreshold minimum score, {@code null} for the configured default
 * @param fileTypes      restricts results to these file types; {@code null} or empty means all
 */
public record SearchRequest(String query, Integer limit, Double scoreThreshold, Set<String> fileTypes) {

    public static SearchRequest of(final String query) {
        return new SearchRequest(query, null, null, null);
    }
}
