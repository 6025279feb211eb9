package dev.aparikh.msgexplorer.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request DTO for keyword message search.
 */
@Schema(description = "Keyword search request")
public record KeywordSearchRequest(
        @NotNull
        @Schema(description = "Dataset id", example = "1",
                requiredMode = Schema.RequiredMode.REQUIRED)
        Long dataset,

        @Schema(description = "Comma-separated alternatives; a clause starting with NOT excludes",
                example = "soup ladies,food,NOT job")
        String keywords,

        @JsonProperty("types_list")
        @Schema(description = "Message types to keep", example = "[\"tweet\", \"reply\"]")
        List<String> typesList
) {
}
