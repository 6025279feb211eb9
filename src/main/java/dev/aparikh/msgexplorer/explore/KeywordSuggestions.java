package dev.aparikh.msgexplorer.explore;

import java.util.List;

/**
 * Autocomplete completions for a partially typed keyword query.
 */
public record KeywordSuggestions(
        long dataset,
        String q,
        List<String> keywords
) {
}
