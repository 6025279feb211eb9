package dev.aparikh.msgexplorer.dimension;

import dev.aparikh.msgexplorer.error.QueryValidationException;
import dev.aparikh.msgexplorer.filter.Filter;
import dev.aparikh.msgexplorer.filter.FilterSpec;
import dev.aparikh.msgexplorer.model.Message;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static dev.aparikh.msgexplorer.testing.TestMessages.message;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemporalDimensionTest {

    private final TemporalDimension time = new TemporalDimension("time", Message.FIELD_TIME, Message::time);

    @Test
    void bucketsByConfiguredGranularity() {
        Bucketer bucketer = time.bucketer(List.of(), new BucketingOptions(TimeGranularity.HOUR, 50, false));

        assertThat(bucketer.buckets(message("m").time("2015-02-25T10:15:00Z").build()))
                .containsExactly(Instant.parse("2015-02-25T10:00:00Z"));
        assertThat(bucketer.buckets(message("m").build())).containsExactly((Object) null);
    }

    @Test
    void autoGranularityFollowsTheWorkingSetSpan() {
        List<Message> workingSet = List.of(
                message("a").time("2015-02-25T10:15:00Z").build(),
                message("b").time("2015-02-25T12:40:00Z").build());

        Bucketer bucketer = time.bucketer(workingSet, new BucketingOptions(TimeGranularity.AUTO, 50, false));

        assertThat(bucketer.buckets(workingSet.get(1))).containsExactly(Instant.parse("2015-02-25T12:00:00Z"));
    }

    @Test
    void compilesInclusiveTimeWindows() {
        Filter filter = time.compileFilter(FilterSpec.timeWindow("time",
                Instant.parse("2015-02-25T00:00:00Z"), Instant.parse("2015-02-25T23:59:59Z")), "filters[0]");

        assertThat(filter.test(message("m").time("2015-02-25T00:00:00Z").build())).isTrue();
        assertThat(filter.test(message("m").time("2015-02-25T23:59:59Z").build())).isTrue();
        assertThat(filter.test(message("m").time("2015-02-26T00:00:00Z").build())).isFalse();
        assertThat(filter.test(message("m").build())).isFalse();
    }

    @Test
    void openEndedWindowsAreAllowed() {
        Filter filter = time.compileFilter(FilterSpec.timeWindow("time", null, Instant.parse("2015-02-25T00:00:00Z")),
                "filters[0]");

        assertThat(filter.test(message("m").time("2010-01-01T00:00:00Z").build())).isTrue();
    }

    @Test
    void rejectsInvertedWindow() {
        assertThatThrownBy(() -> time.compileFilter(FilterSpec.timeWindow("time",
                Instant.parse("2015-02-26T00:00:00Z"), Instant.parse("2015-02-25T00:00:00Z")), "filters[0]"))
                .isInstanceOf(QueryValidationException.class)
                .hasFieldOrPropertyWithValue("field", "filters[0].min_time");
    }

    @Test
    void rejectsWindowWithoutBounds() {
        assertThatThrownBy(() -> time.compileFilter(FilterSpec.timeWindow("time", null, null), "filters[0]"))
                .isInstanceOf(QueryValidationException.class)
                .hasFieldOrPropertyWithValue("field", "filters[0]");
    }

    @Test
    void rejectsLevels() {
        assertThatThrownBy(() -> time.compileFilter(FilterSpec.levels("time", List.of("2015")), "filters[0]"))
                .isInstanceOf(QueryValidationException.class)
                .hasFieldOrPropertyWithValue("field", "filters[0].levels");
    }
}
