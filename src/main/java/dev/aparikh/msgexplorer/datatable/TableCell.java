package dev.aparikh.msgexplorer.datatable;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row of the result table: a value per requested dimension, keyed by the
 * dimension key, plus the measure value and the originating group if any.
 */
public final class TableCell {

    private final Map<String, Object> levels;
    private final long value;
    private final Long groupId;

    public TableCell(Map<String, Object> levels, long value, Long groupId) {
        this.levels = Collections.unmodifiableMap(new LinkedHashMap<>(levels));
        this.value = value;
        this.groupId = groupId;
    }

    @JsonAnyGetter
    public Map<String, Object> getLevels() {
        return levels;
    }

    public Object level(String dimension) {
        return levels.get(dimension);
    }

    @JsonProperty("value")
    public long getValue() {
        return value;
    }

    @JsonProperty("group_id")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public Long getGroupId() {
        return groupId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableCell other)) return false;
        return value == other.value
                && levels.equals(other.levels)
                && Objects.equals(groupId, other.groupId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(levels, value, groupId);
    }

    @Override
    public String toString() {
        return "TableCell" + levels + "=" + value + (groupId == null ? "" : "@group" + groupId);
    }
}
