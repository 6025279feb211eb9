package dev.aparikh.msgexplorer.datatable;

import dev.aparikh.msgexplorer.config.EngineProperties;
import dev.aparikh.msgexplorer.dimension.DimensionRegistry;
import dev.aparikh.msgexplorer.distribution.DistributionEntry;
import dev.aparikh.msgexplorer.distribution.DistributionPage;
import dev.aparikh.msgexplorer.distribution.DistributionStore;
import dev.aparikh.msgexplorer.filter.FilterSpec;
import dev.aparikh.msgexplorer.group.Group;
import dev.aparikh.msgexplorer.testing.InMemoryMessageCorpus;
import dev.aparikh.msgexplorer.testing.TestCatalogs;
import dev.aparikh.msgexplorer.testing.TestMessages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueryPlannerTest {

    @Mock
    private DistributionStore distributionStore;

    private EngineProperties properties;
    private InMemoryMessageCorpus corpus;
    private QueryResolver resolver;
    private QueryPlanner planner;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        corpus = new InMemoryMessageCorpus(TestMessages.sampleCorpus());
        resolver = new QueryResolver(new DimensionRegistry(), TestCatalogs.datasets(1L),
                TestCatalogs.groups(new Group(7L, 1L, "Soup", "soup", List.of())), properties);
        planner = plannerWith(Optional.of(distributionStore));
    }

    private QueryPlanner plannerWith(Optional<DistributionStore> store) {
        return new QueryPlanner(new AggregationEngine(corpus, properties), store, new ResultAssembler(), properties);
    }

    @Test
    void singleCategoricalDimensionCoveredByTheStoreUsesFastPath() {
        when(distributionStore.covers(1L, "message_type")).thenReturn(true);

        assertThat(planner.choose(resolve(query().dimensions("message_type"))))
                .isEqualTo(ExecutionPath.FAST_PATH);
    }

    @Test
    void searchKeyAndModeDoNotAffectEligibility() {
        when(distributionStore.covers(1L, "hashtags")).thenReturn(true);

        assertThat(planner.choose(resolve(query().dimensions("hashtags").searchKey("so").mode("cumulative"))))
                .isEqualTo(ExecutionPath.FAST_PATH);
    }

    @Test
    void filtersForceGeneralPath() {
        assertThat(planner.choose(resolve(query().dimensions("message_type")
                .filters(FilterSpec.value("language", "en")))))
                .isEqualTo(ExecutionPath.GENERAL_PATH);
        verifyNoInteractions(distributionStore);
    }

    @Test
    void excludesForceGeneralPath() {
        assertThat(planner.choose(resolve(query().dimensions("message_type")
                .excludes(FilterSpec.value("language", "en")))))
                .isEqualTo(ExecutionPath.GENERAL_PATH);
    }

    @Test
    void groupsForceGeneralPath() {
        assertThat(planner.choose(resolve(query().dimensions("message_type").groups(7L))))
                .isEqualTo(ExecutionPath.GENERAL_PATH);
    }

    @Test
    void twoDimensionsForceGeneralPath() {
        assertThat(planner.choose(resolve(query().dimensions("message_type", "language"))))
                .isEqualTo(ExecutionPath.GENERAL_PATH);
    }

    @Test
    void nonCategoricalDimensionsForceGeneralPath() {
        assertThat(planner.choose(resolve(query().dimensions("time")))).isEqualTo(ExecutionPath.GENERAL_PATH);
        assertThat(planner.choose(resolve(query().dimensions("retweet_count")))).isEqualTo(ExecutionPath.GENERAL_PATH);
    }

    @Test
    void nonCountMeasureForcesGeneralPath() {
        assertThat(planner.choose(resolve(query().dimensions("message_type").measure("distinct_senders"))))
                .isEqualTo(ExecutionPath.GENERAL_PATH);
    }

    @Test
    void uncoveredDimensionFallsBackToGeneralPath() {
        when(distributionStore.covers(1L, "language")).thenReturn(false);

        assertThat(planner.choose(resolve(query().dimensions("language"))))
                .isEqualTo(ExecutionPath.GENERAL_PATH);
    }

    @Test
    void disabledFastPathUsesGeneralPath() {
        properties.setFastPathEnabled(false);

        assertThat(planner.choose(resolve(query().dimensions("message_type"))))
                .isEqualTo(ExecutionPath.GENERAL_PATH);
        verifyNoInteractions(distributionStore);
    }

    @Test
    void missingStoreUsesGeneralPath() {
        QueryPlanner withoutStore = plannerWith(Optional.empty());

        assertThat(withoutStore.choose(resolve(query().dimensions("message_type"))))
                .isEqualTo(ExecutionPath.GENERAL_PATH);
    }

    @Test
    void fastPathServesRankedLevelsFromTheStore() {
        when(distributionStore.covers(1L, "message_type")).thenReturn(true);
        when(distributionStore.page(1L, "message_type", null, 1, 100)).thenReturn(new DistributionPage(List.of(
                new DistributionEntry("tweet", 2L),
                new DistributionEntry("reply", 1L),
                new DistributionEntry("retweet", 1L)), 3L));

        DataTableResult result = planner.execute(resolve(query().dimensions("message_type")));

        assertThat(result.table()).extracting(c -> c.level("message_type")).containsExactly("tweet", "reply", "retweet");
        assertThat(result.domains().get("message_type")).containsExactly("tweet", "reply", "retweet");
        assertThat(result.totalCells()).isEqualTo(3);
        assertThat(result.domainLabels().get("message_type")).containsEntry("tweet", "Tweet");
        assertThat(corpus.scans()).isZero();
    }

    @Test
    void fastPathPassesSearchKeyAndPagingToTheStore() {
        when(distributionStore.covers(1L, "hashtags")).thenReturn(true);
        when(distributionStore.page(1L, "hashtags", "so", 2, 5)).thenReturn(new DistributionPage(List.of(), 3L));

        DataTableResult result = planner.execute(resolve(query().dimensions("hashtags").searchKey("so").page(2).pageSize(5)));

        verify(distributionStore).page(1L, "hashtags", "so", 2, 5);
        assertThat(result.table()).isEmpty();
        assertThat(result.domains()).containsOnlyKeys("hashtags");
        assertThat(result.page()).isEqualTo(2);
        assertThat(result.pageSize()).isEqualTo(5);
    }

    @Test
    void fastAndGeneralPathsAgreeWhenTheStoreIsCurrent() {
        when(distributionStore.covers(1L, "message_type")).thenReturn(true);
        when(distributionStore.page(1L, "message_type", null, 1, 100)).thenReturn(new DistributionPage(List.of(
                new DistributionEntry("tweet", 2L),
                new DistributionEntry("reply", 1L),
                new DistributionEntry("retweet", 1L)), 3L));
        ResolvedQuery query = resolve(query().dimensions("message_type"));

        DataTableResult fast = planner.execute(query);
        DataTableResult general = plannerWith(Optional.empty()).execute(query);

        assertThat(fast.table()).containsExactlyInAnyOrderElementsOf(general.table());
        assertThat(fast.domains().get("message_type"))
                .containsExactlyInAnyOrderElementsOf(general.domains().get("message_type"));
        assertThat(fast.totalCells()).isEqualTo(general.totalCells());
    }

    private DataTableQuery.Builder query() {
        return new DataTableQuery.Builder(1L);
    }

    private ResolvedQuery resolve(DataTableQuery.Builder builder) {
        return resolver.resolve(builder.build());
    }
}
