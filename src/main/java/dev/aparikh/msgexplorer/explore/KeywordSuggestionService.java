package dev.aparikh.msgexplorer.explore;

import dev.aparikh.msgexplorer.config.EngineProperties;
import dev.aparikh.msgexplorer.datatable.QueryResolver;
import dev.aparikh.msgexplorer.distribution.DistributionEntry;
import dev.aparikh.msgexplorer.distribution.DistributionStore;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

/**
 * Completes the last token of a keyword query from the precomputed
 * distribution of the {@code words} dimension, most frequent first.
 */
@Service
public class KeywordSuggestionService {

    static final String KEYWORD_DIMENSION = "words";

    private final QueryResolver resolver;
    private final DistributionStore distributionStore;
    private final EngineProperties properties;

    public KeywordSuggestionService(QueryResolver resolver, DistributionStore distributionStore,
                                    EngineProperties properties) {
        this.resolver = resolver;
        this.distributionStore = distributionStore;
        this.properties = properties;
    }

    /**
     * @param q partial query; the text before its last token is kept as typed and
     *          prepended to every completion. A trailing space completes a new token.
     */
    public KeywordSuggestions suggest(long datasetId, String q) {
        resolver.requireDataset(datasetId);

        String lead = "";
        String prefix = "";
        if (q != null && !q.isBlank()) {
            String[] tokens = q.trim().split("\\s+");
            if (Character.isWhitespace(q.charAt(q.length() - 1))) {
                lead = String.join(" ", tokens);
            } else {
                lead = String.join(" ", Arrays.copyOf(tokens, tokens.length - 1));
                prefix = tokens[tokens.length - 1];
            }
        }

        String leading = lead.isEmpty() ? "" : lead + " ";
        List<String> keywords = distributionStore
                .page(datasetId, KEYWORD_DIMENSION, prefix, 1, properties.getKeywordLimit())
                .entries().stream()
                .map(DistributionEntry::level)
                .map(level -> leading + level)
                .toList();
        return new KeywordSuggestions(datasetId, q, keywords);
    }
}
