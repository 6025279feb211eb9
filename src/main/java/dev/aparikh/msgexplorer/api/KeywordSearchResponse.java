package dev.aparikh.msgexplorer.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.aparikh.msgexplorer.model.Message;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Response DTO for keyword message search.
 */
@Schema(description = "Keyword search response")
public record KeywordSearchResponse(
        Long dataset,
        String keywords,

        @JsonProperty("types_list")
        List<String> typesList,

        @Schema(description = "Matching messages in corpus order")
        List<Message> messages
) {
}
