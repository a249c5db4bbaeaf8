package com.knowledge.resolution.similarity;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Token blocking: one key per significant word of the mention.
 * Words are lower-cased and stripped of non-word characters; words of two characters
 * or fewer and common stop words ("the", "inc", "university", ...) are dropped because
 * they would put unrelated mentions into the same block.
 *
 * <p>"Arsenal FC" yields {@code tok:arsenal}; "The Gunners" yields {@code tok:gunners}.</p>
 */
public class DefaultBlockingKeyStrategy implements BlockingKeyStrategy {

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "of", "in", "on", "at", "for", "to", "a", "an",
            "inc", "incorporated", "corp", "corporation", "llc", "ltd", "limited",
            "co", "company", "group", "association", "department",
            "university", "school", "college", "institute"
    );

    @Override
    public Set<String> generateKeys(String mention) {
        Set<String> keys = new LinkedHashSet<>();
        if (mention == null || mention.isBlank()) {
            return keys;
        }

        for (String raw : mention.toLowerCase(Locale.ROOT).trim().split("\\s+")) {
            String token = raw.replaceAll("[^\\p{L}\\p{N}_]", "");
            if (token.length() > 2 && !STOP_WORDS.contains(token)) {
                keys.add("tok:" + token);
            }
        }
        return keys;
    }
}
