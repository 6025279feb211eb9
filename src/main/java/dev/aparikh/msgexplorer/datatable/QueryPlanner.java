package dev.aparikh.msgexplorer.datatable;

import dev.aparikh.msgexplorer.config.EngineProperties;
import dev.aparikh.msgexplorer.dimension.Dimension;
import dev.aparikh.msgexplorer.dimension.DimensionKind;
import dev.aparikh.msgexplorer.distribution.DistributionEntry;
import dev.aparikh.msgexplorer.distribution.DistributionPage;
import dev.aparikh.msgexplorer.distribution.DistributionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes each query to the distribution store when it holds an exact answer,
 * otherwise to the {@link AggregationEngine}.
 */
@Component
public class QueryPlanner {

    private static final Logger LOG = LoggerFactory.getLogger(QueryPlanner.class);

    private final AggregationEngine engine;
    private final Optional<DistributionStore> distributionStore;
    private final ResultAssembler assembler;
    private final EngineProperties properties;

    public QueryPlanner(AggregationEngine engine, Optional<DistributionStore> distributionStore,
                        ResultAssembler assembler, EngineProperties properties) {
        this.engine = engine;
        this.distributionStore = distributionStore;
        this.assembler = assembler;
        this.properties = properties;
    }

    /**
     * Decides the execution path. The fast path requires no filters, excludes or
     * groups, a single categorical dimension, the count measure, and a store
     * that has entries for the dimension. Search key and mode do not matter.
     */
    public ExecutionPath choose(ResolvedQuery query) {
        if (!properties.isFastPathEnabled() || distributionStore.isEmpty()) {
            return ExecutionPath.GENERAL_PATH;
        }
        if (!query.filterSet().isEmpty() || !query.groups().isEmpty() || query.dimensions().size() != 1) {
            return ExecutionPath.GENERAL_PATH;
        }
        Dimension dimension = query.dimensions().get(0);
        if (dimension.kind() != DimensionKind.CATEGORICAL || query.measure() != StandardMeasure.COUNT) {
            return ExecutionPath.GENERAL_PATH;
        }
        if (!distributionStore.get().covers(query.datasetId(), dimension.key())) {
            LOG.debug("No precomputed distribution for {} in dataset {}", dimension.key(), query.datasetId());
            return ExecutionPath.GENERAL_PATH;
        }
        return ExecutionPath.FAST_PATH;
    }

    public DataTableResult execute(ResolvedQuery query) {
        ExecutionPath path = choose(query);
        LOG.debug("Serving dataset {} dimensions {} via {}", query.datasetId(), query.dimensions(), path);
        AggregateTable table = path == ExecutionPath.FAST_PATH
                ? fromDistribution(query)
                : engine.aggregate(query);
        return assembler.assemble(query, table);
    }

    private AggregateTable fromDistribution(ResolvedQuery query) {
        Dimension dimension = query.dimensions().get(0);
        DistributionPage page = distributionStore.get().page(
                query.datasetId(),
                dimension.key(),
                query.searchKey(),
                query.paging().page(),
                query.paging().pageSize());
        List<TableCell> cells = page.entries().stream()
                .map(entry -> new TableCell(Collections.<String, Object>singletonMap(dimension.key(), entry.level()),
                        entry.count(), null))
                .toList();
        List<Object> domain = page.entries().stream()
                .map(DistributionEntry::level)
                .map(Object.class::cast)
                .toList();
        return new AggregateTable(cells, Map.of(dimension.key(), domain), page.totalLevels());
    }
}
