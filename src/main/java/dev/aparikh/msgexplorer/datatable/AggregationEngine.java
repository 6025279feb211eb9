package dev.aparikh.msgexplorer.datatable;

import dev.aparikh.msgexplorer.config.EngineProperties;
import dev.aparikh.msgexplorer.corpus.MessageCorpus;
import dev.aparikh.msgexplorer.dimension.Bucketer;
import dev.aparikh.msgexplorer.dimension.BucketingOptions;
import dev.aparikh.msgexplorer.dimension.Dimension;
import dev.aparikh.msgexplorer.dimension.DimensionKind;
import dev.aparikh.msgexplorer.filter.TextTokenizer;
import dev.aparikh.msgexplorer.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * General execution path: scans the working set and builds the full cell table
 * in memory, then computes domains and cuts the requested page.
 */
@Component
public class AggregationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationEngine.class);

    private final MessageCorpus corpus;
    private final EngineProperties properties;

    public AggregationEngine(MessageCorpus corpus, EngineProperties properties) {
        this.corpus = corpus;
        this.properties = properties;
    }

    AggregateTable aggregate(ResolvedQuery query) {
        List<Message> workingSet = corpus.itemsMatching(query.datasetId(), query.filterSet())
                .collectList()
                .block();
        if (workingSet == null) {
            workingSet = List.of();
        }

        BucketingOptions options = new BucketingOptions(
                properties.getTimeGranularity(),
                properties.getMaxBins(),
                query.mode() == DisplayMode.SCATTER);
        List<Bucketer> bucketers = new ArrayList<>(query.dimensions().size());
        for (Dimension dimension : query.dimensions()) {
            bucketers.add(dimension.bucketer(workingSet, options));
        }

        List<Cell> cells = new ArrayList<>();
        if (query.groups().isEmpty()) {
            accumulate(workingSet, bucketers, query.measure())
                    .forEach((key, acc) -> cells.add(new Cell(null, key, acc.value())));
        } else {
            for (ResolvedGroup group : query.groups()) {
                List<Message> scoped = workingSet.stream().filter(group).toList();
                accumulate(scoped, bucketers, query.measure())
                        .forEach((key, acc) -> cells.add(new Cell(group.id(), key, acc.value())));
            }
        }

        List<Cell> result = cells;
        if (query.hasSearchKey()) {
            result = applySearchKey(result, query);
        }
        if (query.mode() == DisplayMode.CUMULATIVE) {
            result = cumulative(result, query.dimensions());
        }

        Map<String, List<Object>> domains = domains(result, query.dimensions());
        List<TableCell> page = query.paging().slice(result).stream()
                .map(cell -> cell.toTableCell(query.dimensions()))
                .toList();

        LOG.debug("Aggregated {} messages of dataset {} into {} cells", workingSet.size(), query.datasetId(), result.size());
        return new AggregateTable(page, domains, result.size());
    }

    /**
     * Accumulates the measure per cell key. Large working sets are split across
     * threads; partial maps are combined with {@link Measure.Accumulator#merge}.
     */
    private TreeMap<CellKey, Measure.Accumulator> accumulate(List<Message> messages, List<Bucketer> bucketers,
                                                              Measure measure) {
        Stream<Message> stream = messages.size() >= properties.getParallelThreshold()
                ? messages.parallelStream()
                : messages.stream();
        return stream.collect(
                TreeMap::new,
                (map, message) -> {
                    for (CellKey key : cellKeys(message, bucketers)) {
                        map.computeIfAbsent(key, k -> measure.newAccumulator()).add(message);
                    }
                },
                (left, right) -> right.forEach((key, acc) -> left.merge(key, acc, Measure.Accumulator::merge)));
    }

    /**
     * Cross product of the message's buckets along every dimension.
     */
    private static List<CellKey> cellKeys(Message message, List<Bucketer> bucketers) {
        List<List<Object>> partial = new ArrayList<>();
        partial.add(List.of());
        for (Bucketer bucketer : bucketers) {
            List<List<Object>> next = new ArrayList<>();
            for (List<Object> prefix : partial) {
                for (Object bucket : bucketer.buckets(message)) {
                    List<Object> extended = new ArrayList<>(prefix);
                    extended.add(bucket);
                    next.add(extended);
                }
            }
            partial = next;
        }
        return partial.stream().map(CellKey::new).toList();
    }

    /**
     * Keeps cells whose first categorical dimension starts with the search key.
     */
    private static List<Cell> applySearchKey(List<Cell> cells, ResolvedQuery query) {
        int index = indexOf(query.dimensions(), DimensionKind.CATEGORICAL);
        if (index < 0) {
            LOG.debug("Ignoring search key, no categorical dimension in {}", query.dimensions());
            return cells;
        }
        return cells.stream()
                .filter(cell -> TextTokenizer.startsWith(cell.key().get(index), query.searchKey()))
                .toList();
    }

    /**
     * Replaces each value by the running total along the temporal dimension
     * within its series. Cells are sorted by key within a group, so for a fixed
     * series they are already in ascending time order.
     */
    private static List<Cell> cumulative(List<Cell> cells, List<Dimension> dimensions) {
        int index = indexOf(dimensions, DimensionKind.TEMPORAL);
        if (index < 0) {
            LOG.debug("Cumulative mode without a temporal dimension in {}", dimensions);
            return cells;
        }
        Map<List<Object>, Long> running = new HashMap<>();
        List<Cell> result = new ArrayList<>(cells.size());
        for (Cell cell : cells) {
            List<Object> series = new ArrayList<>(cell.key().without(index));
            series.add(cell.groupId());
            long total = running.merge(series, cell.value(), Long::sum);
            result.add(new Cell(cell.groupId(), cell.key(), total));
        }
        return result;
    }

    private static Map<String, List<Object>> domains(List<Cell> cells, List<Dimension> dimensions) {
        Map<String, List<Object>> domains = new LinkedHashMap<>();
        for (int i = 0; i < dimensions.size(); i++) {
            int index = i;
            List<Object> domain = new ArrayList<>(cells.stream()
                    .map(cell -> cell.key().get(index))
                    .collect(() -> new TreeMap<Object, Boolean>(CellKey.BUCKET_ORDER),
                            (map, value) -> map.put(value, Boolean.TRUE),
                            TreeMap::putAll)
                    .keySet());
            domains.put(dimensions.get(i).key(), domain);
        }
        return domains;
    }

    private static int indexOf(List<Dimension> dimensions, DimensionKind kind) {
        for (int i = 0; i < dimensions.size(); i++) {
            if (dimensions.get(i).kind() == kind) {
                return i;
            }
        }
        return -1;
    }

    private record Cell(Long groupId, CellKey key, long value) {

        TableCell toTableCell(List<Dimension> dimensions) {
            Map<String, Object> levels = new LinkedHashMap<>();
            for (int i = 0; i < dimensions.size(); i++) {
                levels.put(dimensions.get(i).key(), key.get(i));
            }
            return new TableCell(levels, value, groupId);
        }
    }
}
