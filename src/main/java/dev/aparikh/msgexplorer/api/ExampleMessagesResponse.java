package dev.aparikh.msgexplorer.api;

import dev.aparikh.msgexplorer.model.Message;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Response DTO for example messages.
 */
@Schema(description = "Example messages response")
public record ExampleMessagesResponse(
        Long dataset,
        List<FilterRequest> filters,
        List<FilterRequest> focus,
        List<FilterRequest> excludes,
        List<Long> groups,

        @Schema(description = "Sample of matching messages")
        List<Message> messages
) {
}
