package dev.aparikh.msgexplorer.group;

import dev.aparikh.msgexplorer.filter.FilterSpec;

import java.util.List;

/**
 * A saved sub-selection of a dataset. Keywords use the keyword expression
 * syntax ({@code "soup ladies,food,NOT job"}) over the {@code words} dimension;
 * include types narrow by {@code message_type}.
 */
public record Group(
        long id,
        long datasetId,
        String name,
        String keywords,
        List<String> includeTypes
) {
    public static final String FIELD_ID = "id";
    public static final String FIELD_DATASET = "dataset_id";
    public static final String FIELD_NAME = "name";
    public static final String FIELD_KEYWORDS = "keywords";
    public static final String FIELD_INCLUDE_TYPES = "include_types";
    public static final String FIELD_DELETED = "deleted";

    static final String TYPE_DIMENSION = "message_type";

    public Group {
        includeTypes = includeTypes == null ? List.of() : List.copyOf(includeTypes);
    }

    /**
     * Include types as filters; empty when every type is included. Keywords are
     * compiled by {@code QueryResolver#compileKeywords}.
     */
    public List<FilterSpec> filterSpecs() {
        if (includeTypes.isEmpty()) {
            return List.of();
        }
        return List.of(FilterSpec.levels(TYPE_DIMENSION, includeTypes));
    }
}
