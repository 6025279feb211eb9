package dev.aparikh.msgexplorer.group;

import dev.aparikh.msgexplorer.filter.FilterSpec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GroupTest {

    @Test
    void includeTypesBecomeALevelsFilter() {
        Group group = new Group(7L, 1L, "Soup", "soup lad", List.of("tweet"));

        assertThat(group.filterSpecs()).containsExactly(FilterSpec.levels("message_type", List.of("tweet")));
    }

    @Test
    void groupWithoutTypesHasNoFilterSpecs() {
        assertThat(new Group(8L, 1L, "All", "soup,NOT lunch", null).filterSpecs()).isEmpty();
    }
}
