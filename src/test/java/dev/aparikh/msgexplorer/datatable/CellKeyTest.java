package dev.aparikh.msgexplorer.datatable;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CellKeyTest {

    @Test
    void sortsNullFirstThenNaturalOrderPerPosition() {
        List<CellKey> keys = new ArrayList<>(List.of(
                CellKey.of("tweet", "en"),
                CellKey.of("reply", "es"),
                CellKey.of(null, "en"),
                CellKey.of("reply", null)));

        Collections.sort(keys);

        assertThat(keys).containsExactly(
                CellKey.of(null, "en"),
                CellKey.of("reply", null),
                CellKey.of("reply", "es"),
                CellKey.of("tweet", "en"));
    }

    @Test
    void bucketOrderComparesNumericAndTemporalBucketsByValue() {
        List<Object> numbers = new ArrayList<>(Arrays.asList(10L, null, 2L, 100L));
        List<Object> times = new ArrayList<>(List.of(
                Instant.parse("2015-02-26T00:00:00Z"), Instant.parse("2015-02-25T00:00:00Z")));

        numbers.sort(CellKey.BUCKET_ORDER);
        times.sort(CellKey.BUCKET_ORDER);

        assertThat(numbers).containsExactly(null, 2L, 10L, 100L);
        assertThat(times).containsExactly(
                Instant.parse("2015-02-25T00:00:00Z"), Instant.parse("2015-02-26T00:00:00Z"));
    }

    @Test
    void withoutDropsOnePosition() {
        assertThat(CellKey.of(1L, "en").without(0)).containsExactly("en");
    }
}
