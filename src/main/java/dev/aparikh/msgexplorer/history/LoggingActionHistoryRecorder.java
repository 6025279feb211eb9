package dev.aparikh.msgexplorer.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes one JSON line per action to the {@code msgvis.history} logger, leaving
 * storage to the logging backend.
 */
@Component
public class LoggingActionHistoryRecorder implements ActionHistoryRecorder {

    static final String LOGGER_NAME = "msgvis.history";

    private static final Logger HISTORY = LoggerFactory.getLogger(LOGGER_NAME);
    private static final Logger LOG = LoggerFactory.getLogger(LoggingActionHistoryRecorder.class);

    private final ObjectMapper objectMapper;

    public LoggingActionHistoryRecorder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void record(ActionContext context, String type, Object contents) {
        if (!HISTORY.isInfoEnabled()) {
            return;
        }
        HISTORY.info("actor={} type={} at={} contents={}", context.actor(), type, context.at(), toJson(contents));
    }

    String toJson(Object contents) {
        try {
            return objectMapper.writeValueAsString(contents);
        } catch (JsonProcessingException e) {
            LOG.warn("Could not serialize history contents of type {}: {}",
                    contents == null ? null : contents.getClass().getSimpleName(), e.getMessage());
            return String.valueOf(contents);
        }
    }
}
