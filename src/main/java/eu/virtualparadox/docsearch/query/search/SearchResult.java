package eu.virtualparadox.docsearch.query.search;

import java.util.Map;

/**
 * @param vectorStoreId identifier of the matched chunk in the vector store
 * @param sourceFile    file the chunk was extracted from
 * @param text          chunk text
 * @param score         relevance in {@code [0, 1]}, higher = better
 * @param metadata      chunk position and ranking annotations
 */
public record SearchResult(String vectorStoreId,
                           String sourceFile,
                           String text,
                           double score,
                           Map<String, Object> metadata) {

    public static final String META_DOCUMENT_ID = "document_id";
    public static final String META_FILE_TYPE = "file_type";
    public static final String META_SEQUENCE_INDEX = "sequence_index";
    public static final String META_START_OFFSET = "start_offset";
    public static final String META_END_OFFSET = "end_offset";
    public static final String META_ORIGINAL_SCORE = "original_score";
    public static final String META_KEYWORD_MATCHES = "keyword_matches";
    public static final String META_KEYWORD_BOOST = "keyword_boost";
    public static final String META_TEXT_LENGTH_WORDS = "text_length_words";
    public static final String META_DIVERSITY_PENALTY = "diversity_penalty";

    public SearchResult {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public SearchResult withScore(final double newScore, final Map<String, Object> newMetadata) {
        return new SearchResult(vectorStoreId, sourceFile, text, newScore, newMetadata);
    }

    public String fileType() {
        final Object type = metadata.get(META_FILE_TYPE);
        return type == null ? "" : type.toString();
    }
}
