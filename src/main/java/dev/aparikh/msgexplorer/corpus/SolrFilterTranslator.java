package dev.aparikh.msgexplorer.corpus;

import dev.aparikh.msgexplorer.filter.Filter;
import dev.aparikh.msgexplorer.filter.FilterSet;
import dev.aparikh.msgexplorer.filter.LevelsFilter;
import dev.aparikh.msgexplorer.filter.RangeFilter;
import dev.aparikh.msgexplorer.filter.TimeWindowFilter;
import org.apache.solr.client.solrj.util.ClientUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Translates filters into Solr filter queries where Solr evaluates them exactly
 * like {@link Filter#test}. Text-search filters are not pushed down because
 * Solr string fields compare case-sensitively; the corpus applies them in memory.
 */
class SolrFilterTranslator {

    /**
     * Filter queries narrowing a scan to a superset of the messages matching {@code filterSet}.
     */
    List<String> filterQueries(FilterSet filterSet) {
        List<String> queries = new ArrayList<>();
        for (Filter filter : filterSet.filters()) {
            translate(filter).ifPresent(queries::add);
        }
        excludeQuery(filterSet.excludes()).ifPresent(queries::add);
        return queries;
    }

    Optional<String> translate(Filter filter) {
        String field = filter.dimension().field();
        if (filter instanceof LevelsFilter levels) {
            List<String> terms = levels.levels().stream()
                    .sorted()
                    .map(level -> field + ":\"" + ClientUtils.escapeQueryChars(level) + "\"")
                    .toList();
            return Optional.of(terms.size() == 1 ? terms.get(0) : "(" + String.join(" OR ", terms) + ")");
        }
        if (filter instanceof RangeFilter range) {
            // continuous fields are indexed as longs; whole-number bounds select the same values
            return Optional.of(field + ":[" + bound(range.min(), RoundingMode.CEILING)
                    + " TO " + bound(range.max(), RoundingMode.FLOOR) + "]");
        }
        if (filter instanceof TimeWindowFilter window) {
            return Optional.of(field + ":[" + bound(window.minTime()) + " TO " + bound(window.maxTime()) + "]");
        }
        return Optional.empty();
    }

    /**
     * Excludes remove messages matching all of them, so they can only be pushed
     * down when every one of them translates.
     */
    private Optional<String> excludeQuery(List<Filter> excludes) {
        if (excludes.isEmpty()) {
            return Optional.empty();
        }
        List<String> clauses = new ArrayList<>();
        for (Filter exclude : excludes) {
            Optional<String> clause = translate(exclude);
            if (clause.isEmpty()) {
                return Optional.empty();
            }
            clauses.add("(" + clause.get() + ")");
        }
        return Optional.of("*:* -(" + String.join(" AND ", clauses) + ")");
    }

    private static String bound(BigDecimal value, RoundingMode rounding) {
        return value == null ? "*" : value.setScale(0, rounding).toPlainString();
    }

    private static String bound(Instant value) {
        return value == null ? "*" : value.toString(); // ISO-8601 with Z accepted by Solr
    }
}
