package com.trendsentinel.core.series;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Extracts ranking keywords from metric labels.
 *
 * <p>
 * Labels are lower-cased and split on whitespace, underscores and hyphens.
 * Tokens of at most three characters and stop-words are discarded; the rest
 * are ranked by frequency (ties keep first-appearance order) and the top
 * {@value #MAX_KEYWORDS} are returned.
 * </p>
 *
 * @since 1.0.0
 */
public final class KeywordExtractor {

    static final int MAX_KEYWORDS = 10;

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "with", "this", "that", "from", "have", "will");

    private KeywordExtractor() {
        // utility class
    }

    public static List<String> extract(String label) {
        return label == null ? List.of() : extract(List.of(label));
    }

    public static List<String> extract(List<String> labels) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String label : labels) {
            if (label == null) {
                continue;
            }
            for (String word : label.toLowerCase(Locale.ROOT).split("[\\s_-]+")) {
                if (word.length() > 3 && !STOP_WORDS.contains(word)) {
                    counts.merge(word, 1, Integer::sum);
                }
            }
        }
        // stable sort keeps first-appearance order among equal counts
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(MAX_KEYWORDS)
                .map(Map.Entry::getKey)
                .toList();
    }
}
