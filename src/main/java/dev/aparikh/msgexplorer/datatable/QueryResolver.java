package dev.aparikh.msgexplorer.datatable;

import dev.aparikh.msgexplorer.config.EngineProperties;
import dev.aparikh.msgexplorer.corpus.DatasetCatalog;
import dev.aparikh.msgexplorer.dimension.CategoricalDimension;
import dev.aparikh.msgexplorer.dimension.Dimension;
import dev.aparikh.msgexplorer.dimension.DimensionRegistry;
import dev.aparikh.msgexplorer.error.QueryValidationException;
import dev.aparikh.msgexplorer.error.ReferenceNotFoundException;
import dev.aparikh.msgexplorer.filter.Filter;
import dev.aparikh.msgexplorer.filter.FilterSet;
import dev.aparikh.msgexplorer.filter.FilterSpec;
import dev.aparikh.msgexplorer.group.Group;
import dev.aparikh.msgexplorer.group.GroupCatalog;
import dev.aparikh.msgexplorer.model.Dataset;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns raw queries into {@link ResolvedQuery} instances. Shape checks run
 * first and touch nothing but the dimension registry; dataset and group
 * references are looked up afterwards. The corpus is never read here.
 */
@Component
public class QueryResolver {

    static final int MAX_DIMENSIONS = 2;
    static final String KEYWORD_DIMENSION = "words";

    private static final Map<String, Measure> MEASURES = Arrays.stream(StandardMeasure.values())
            .collect(Collectors.toUnmodifiableMap(Measure::key, Function.identity()));

    private final DimensionRegistry registry;
    private final DatasetCatalog datasetCatalog;
    private final GroupCatalog groupCatalog;
    private final EngineProperties properties;

    public QueryResolver(DimensionRegistry registry, DatasetCatalog datasetCatalog,
                         GroupCatalog groupCatalog, EngineProperties properties) {
        this.registry = registry;
        this.datasetCatalog = datasetCatalog;
        this.groupCatalog = groupCatalog;
        this.properties = properties;
    }

    public ResolvedQuery resolve(DataTableQuery query) {
        List<Dimension> dimensions = resolveDimensions(query.dimensions());
        FilterSet filterSet = new FilterSet(
                compile(query.filters(), "filters"),
                compile(query.excludes(), "excludes"));
        Measure measure = resolveMeasure(query.measure());
        DisplayMode mode = DisplayMode.fromKey(query.mode());
        Paging paging = Paging.of(query.page(), query.pageSize(), properties.getDefaultPageSize());

        requireDataset(query.datasetId());
        List<ResolvedGroup> groups = resolveGroups(query.datasetId(), query.groupIds());

        return new ResolvedQuery(query.datasetId(), dimensions, filterSet, measure, mode,
                groups, query.searchKey(), paging);
    }

    /**
     * Compiles filter specs, reporting errors as {@code field[index]...}.
     */
    public List<Filter> compile(List<FilterSpec> specs, String field) {
        List<Filter> filters = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            String path = field + "[" + i + "]";
            FilterSpec spec = specs.get(i);
            if (spec == null) {
                throw new QueryValidationException(path, "Filter must not be null");
            }
            Dimension dimension = registry.resolve(spec.dimension(), path + ".dimension");
            filters.add(dimension.compileFilter(spec, path));
        }
        return filters;
    }

    /**
     * Compiles a keyword expression over the {@code words} dimension; empty when
     * it selects everything.
     */
    public List<Filter> compileKeywords(String keywords, String path) {
        Dimension dimension = registry.resolve(KEYWORD_DIMENSION, path);
        if (!(dimension instanceof CategoricalDimension words)) {
            throw new IllegalStateException("Keyword dimension '" + KEYWORD_DIMENSION + "' is not categorical");
        }
        return words.compileKeywords(keywords).stream().toList();
    }

    public Dataset requireDataset(long datasetId) {
        return datasetCatalog.find(datasetId)
                .orElseThrow(() -> ReferenceNotFoundException.dataset(datasetId));
    }

    public List<ResolvedGroup> resolveGroups(long datasetId, List<Long> groupIds) {
        List<ResolvedGroup> groups = new ArrayList<>(groupIds.size());
        for (int i = 0; i < groupIds.size(); i++) {
            Long groupId = groupIds.get(i);
            if (groupId == null) {
                throw new QueryValidationException("groups[" + i + "]", "Group id must not be null");
            }
            Group group = groupCatalog.find(datasetId, groupId)
                    .orElseThrow(() -> ReferenceNotFoundException.group(datasetId, groupId));
            String path = "groups[" + i + "]";
            List<Filter> filters = new ArrayList<>(compile(group.filterSpecs(), path));
            filters.addAll(compileKeywords(group.keywords(), path + ".keywords"));
            groups.add(new ResolvedGroup(group.id(), group.name(), filters));
        }
        return groups;
    }

    private List<Dimension> resolveDimensions(List<String> keys) {
        if (keys.isEmpty() || keys.size() > MAX_DIMENSIONS) {
            throw new QueryValidationException("dimensions",
                    "Between 1 and " + MAX_DIMENSIONS + " dimensions are required, got " + keys.size());
        }
        Set<String> seen = new HashSet<>();
        List<Dimension> dimensions = new ArrayList<>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            Dimension dimension = registry.resolve(keys.get(i), "dimensions[" + i + "]");
            if (!seen.add(dimension.key())) {
                throw new QueryValidationException("dimensions[" + i + "]",
                        "Dimension '" + dimension.key() + "' is requested twice");
            }
            dimensions.add(dimension);
        }
        return dimensions;
    }

    private Measure resolveMeasure(String key) {
        if (key == null || key.isBlank()) {
            return StandardMeasure.COUNT;
        }
        Measure measure = MEASURES.get(key.trim());
        if (measure == null) {
            throw new QueryValidationException("measure", "Unknown measure '" + key + "'");
        }
        return measure;
    }
}
