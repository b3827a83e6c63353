package eu.virtualparadox.docsearch.query.analysis;

import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Estimates query complexity from lexical signals and suggests search tuning.
 * <p>
 * Signals, one point each unless noted:
 * <ul>
 *   <li>token count: 4–10 tokens one point, more than 10 two points</li>
 *   <li>at least one quoted multi-word phrase</li>
 *   <li>rare-term ratio of at least 30%: long tokens (8+ characters) that are not common words</li>
 * </ul>
 * No points is {@link EQueryComplexity#LOW}, three or more is {@link EQueryComplexity#HIGH}.
 * Stateless; does not touch the index.
 */
@Component
@RequiredArgsConstructor
public class QueryAnalyzer {

    static final int MIN_TOKENS = 3;
    static final int MAX_TOKENS = 10;

    static final String ADVICE_WIDEN = "Try a more detailed query with more specific terms for better results";
    static final String ADVICE_RAISE_THRESHOLD = "Increase score_threshold for more precise results";
    static final String ADVICE_SPLIT = "Consider breaking the query into multiple queries; long queries reduce precision";
    static final String ADVICE_PHRASES = "Quoted phrases are matched by meaning, not literally";
    static final String ADVICE_LOWER_THRESHOLD = "Lower score_threshold if results are sparse";

    private static final int RARE_TERM_LENGTH = 8;
    private static final double RARE_TERM_RATIO = 0.3;
    private static final int MIN_KEYWORD_LENGTH = 3;
    private static final Pattern QUOTED = Pattern.compile("[\"«„“]([^\"«»„“”]+)[\"»“”]");
    private static final Set<String> COMMON_LONG_WORDS = Set.of(
            "document", "documents", "information", "question", "questions", "something", "anything",
            "everything", "following", "different", "important", "regarding", "including",
            "документ", "документи", "документів", "інформація", "інформації", "питання", "наприклад",
            "документы", "информация", "информации", "например");

    private final Analyzer analyzer;

    /**
     * @param query raw query text
     * @return the analysis; a blank query yields zero tokens and {@link EQueryComplexity#LOW}
     */
    public QueryAnalysis analyze(final String query) {
        final String text = StringUtils.strip(StringUtils.defaultString(query));
        final List<String> tokens = tokenize(text);
        final List<String> phrases = phrases(text);

        final long rare = tokens.stream()
                .filter(t -> t.length() >= RARE_TERM_LENGTH && !COMMON_LONG_WORDS.contains(t))
                .count();
        final double rareRatio = tokens.isEmpty() ? 0.0 : (double) rare / tokens.size();

        int points = 0;
        if (tokens.size() > MAX_TOKENS) {
            points += 2;
        } else if (tokens.size() > MIN_TOKENS) {
            points += 1;
        }
        if (!phrases.isEmpty()) {
            points++;
        }
        if (rareRatio >= RARE_TERM_RATIO) {
            points++;
        }
        final EQueryComplexity complexity = points == 0
                ? EQueryComplexity.LOW
                : points >= 3 ? EQueryComplexity.HIGH : EQueryComplexity.MEDIUM;

        final List<String> recommendations = new ArrayList<>();
        if (tokens.size() < MIN_TOKENS) {
            recommendations.add(ADVICE_WIDEN);
            recommendations.add(ADVICE_RAISE_THRESHOLD);
        }
        if (tokens.size() > MAX_TOKENS) {
            recommendations.add(ADVICE_SPLIT);
        }
        if (!phrases.isEmpty()) {
            recommendations.add(ADVICE_PHRASES);
        }
        if (complexity == EQueryComplexity.HIGH) {
            recommendations.add(ADVICE_LOWER_THRESHOLD);
        }

        return new QueryAnalysis(text, text.length(), tokens.size(), complexity,
                keywords(tokens), phrases, detectLanguage(text), List.copyOf(recommendations));
    }

    private List<String> tokenize(final String text) {
        final List<String> tokens = new ArrayList<>();
        if (text.isEmpty()) {
            return tokens;
        }
        try (TokenStream stream = analyzer.tokenStream("query", text)) {
            final CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(term.toString());
            }
            stream.end();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to tokenize query", e);
        }
        return tokens;
    }

    private static List<String> phrases(final String text) {
        final List<String> phrases = new ArrayList<>();
        final Matcher matcher = QUOTED.matcher(text);
        while (matcher.find()) {
            final String phrase = matcher.group(1).strip();
            if (phrase.contains(" ")) {
                phrases.add(phrase);
            }
        }
        return List.copyOf(phrases);
    }

    private static List<String> keywords(final List<String> tokens) {
        final Set<String> keywords = new LinkedHashSet<>();
        for (final String token : tokens) {
            if (token.length() >= MIN_KEYWORD_LENGTH) {
                keywords.add(token);
            }
        }
        return List.copyOf(keywords);
    }

    static String detectLanguage(final String text) {
        final String lower = text.toLowerCase(Locale.ROOT);
        if (StringUtils.containsAny(lower, 'і', 'ї', 'є', 'ґ')) {
            return "uk";
        }
        if (StringUtils.containsAny(lower, 'ы', 'э', 'ъ', 'ё')) {
            return "ru";
        }
        boolean latin = false;
        for (int i = 0; i < lower.length(); i++) {
            final char c = lower.charAt(i);
            if (Character.isLetter(c)) {
                if (Character.UnicodeScript.of(c) != Character.UnicodeScript.LATIN) {
                    return "unknown";
                }
                latin = true;
            }
        }
        return latin ? "en" : "unknown";
    }
}
