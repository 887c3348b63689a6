package dev.ebullient.sagakeeper.merge;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical comparison keys for free-text entity names.
 * <p>
 * Matching is exact on the canonical key: capitalization, spacing and a leading
 * article collapse to one entity, genuinely different names never do.
 */
public final class NameResolver {

    private static final String[] ARTICLES = { "the ", "a ", "an " };
    private static final String UNNAMED = "unnamed ";

    private NameResolver() {
    }

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String key = name.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
        for (String article : ARTICLES) {
            if (key.startsWith(article)) {
                key = key.substring(article.length());
                break;
            }
        }
        if (key.startsWith(UNNAMED)) {
            key = key.substring(UNNAMED.length());
        }
        return key.trim();
    }

    /**
     * Find the first candidate whose name has the same canonical key.
     *
     * @param candidates entity ID to current name, in preference order
     * @return the matching entity ID
     */
    public static Optional<String> findMatch(String name, Map<String, String> candidates) {
        String key = normalize(name);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        for (Map.Entry<String, String> e : candidates.entrySet()) {
            if (key.equals(normalize(e.getValue()))) {
                return Optional.of(e.getKey());
            }
        }
        return Optional.empty();
    }
}
