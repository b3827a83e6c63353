package eu.virtualparadox.docsearch.application.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "docsearch.search")
@Getter @Setter
public class SearchProperties {

    /** SIMILARITY_THRESHOLD: default minimum score of a returned result. */
    private double similarityThreshold = 0.5;

    /** DEFAULT_LIMIT: default number of returned results. */
    private int defaultLimit = 10;

    /** Candidates requested from the store per requested result. */
    private int overfetchFactor = 3;

    /** Upper bound of candidates requested from the store. */
    private int maxCandidates = 300;

    /** Keyword boost, length normalization and per-file diversity. */
    private boolean postProcessing = true;

    /** Lifetime of a cached unfiltered query result. */
    private Duration cacheTtl = Duration.ofMinutes(5);

    /** Cached query results; 0 disables the cache. */
    private int cacheSize = 100;

    @PostConstruct
    public void validate() {
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalStateException("docsearch.search.similarity-threshold must be within [0, 1]");
        }
        if (defaultLimit < 1 || defaultLimit > 100) {
            throw new IllegalStateException("docsearch.search.default-limit must be within [1, 100]");
        }
        if (overfetchFactor < 1 || maxCandidates < 1) {
            throw new IllegalStateException("docsearch.search.overfetch-factor and max-candidates must be positive");
        }
        if (cacheSize < 0 || cacheTtl == null || cacheTtl.isNegative()) {
            throw new IllegalStateException("docsearch.search.cache-size and cache-ttl must not be negative");
        }
    }
}
