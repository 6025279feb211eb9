package dev.aparikh.msgexplorer.corpus;

import org.apache.solr.common.SolrDocument;

import java.time.Instant;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Objects;

/**
 * Field accessors that tolerate the shapes SolrJ hands back (single values,
 * multi-valued collections, {@link Date} or ISO strings for dates).
 */
public final class SolrDocuments {

    private SolrDocuments() {
    }

    public static String getString(SolrDocument d, String fieldName) {
        Object value = d.getFieldValue(fieldName);
        if (value == null) return null;
        if (value instanceof String) return (String) value;
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty() ? null : String.valueOf(collection.iterator().next());
        }
        return String.valueOf(value);
    }

    public static List<String> getStrings(SolrDocument d, String fieldName) {
        Collection<Object> values = d.getFieldValues(fieldName);
        if (values == null) return List.of();
        return values.stream()
                .filter(Objects::nonNull)
                .map(Object::toString)
                .toList();
    }

    public static Long getLong(SolrDocument d, String fieldName) {
        Object value = d.getFieldValue(fieldName);
        if (value == null) return null;
        if (value instanceof Number number) return number.longValue();
        return Long.parseLong(value.toString());
    }

    public static Instant getInstant(SolrDocument d, String fieldName) {
        Object value = d.getFieldValue(fieldName);
        if (value instanceof Date date) {
            return date.toInstant();
        } else if (value instanceof String s) {
            return Instant.parse(s);
        }
        return null;
    }
}
