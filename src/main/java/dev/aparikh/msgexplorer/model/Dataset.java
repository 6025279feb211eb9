package dev.aparikh.msgexplorer.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Catalog entry for one message corpus.
 */
public record Dataset(
        long id,
        String name,
        String description,
        @JsonProperty("message_count") long messageCount,
        @JsonProperty("start_time") Instant startTime,
        @JsonProperty("end_time") Instant endTime
) {
    public static final String FIELD_ID = "id";
    public static final String FIELD_NAME = "name";
    public static final String FIELD_DESCRIPTION = "description";
    public static final String FIELD_MESSAGE_COUNT = "message_count";
    public static final String FIELD_START_TIME = "start_time";
    public static final String FIELD_END_TIME = "end_time";
}
