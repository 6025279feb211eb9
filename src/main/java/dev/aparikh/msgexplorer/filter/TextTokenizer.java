package dev.aparikh.msgexplorer.filter;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Tokenization shared by text-search filters, search keys and keyword
 * autocomplete. Input is trimmed, lowercased with {@link Locale#ROOT} and split
 * on runs of whitespace. Changing this changes which autocomplete suggestions
 * line up with search results.
 */
public final class TextTokenizer {

    private TextTokenizer() {
    }

    public static String normalize(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }

    public static List<String> tokenize(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(normalized.split("\\s+"))
                .filter(token -> !token.isEmpty())
                .toList();
    }

    /**
     * Case-insensitive prefix test used for search keys.
     */
    public static boolean startsWith(Object value, String searchKey) {
        if (value == null) {
            return false;
        }
        return normalize(value.toString()).startsWith(normalize(searchKey));
    }
}
