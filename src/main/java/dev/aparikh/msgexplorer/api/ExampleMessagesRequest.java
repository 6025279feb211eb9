package dev.aparikh.msgexplorer.api;

import dev.aparikh.msgexplorer.explore.ExampleMessagesQuery;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request DTO for example messages of a slice of the data.
 */
@Schema(description = "Example messages request")
public record ExampleMessagesRequest(
        @NotNull
        @Schema(description = "Dataset id", example = "1",
                requiredMode = Schema.RequiredMode.REQUIRED)
        Long dataset,

        @Valid
        @Schema(description = "Filters of the current view")
        List<FilterRequest> filters,

        @Valid
        @Schema(description = "Filters selecting the focused cell")
        List<FilterRequest> focus,

        @Valid
        @Schema(description = "Excludes of the current view")
        List<FilterRequest> excludes,

        @Schema(description = "Restrict to messages of any of these groups", example = "[3]")
        List<Long> groups
) {

    public ExampleMessagesQuery toQuery() {
        return new ExampleMessagesQuery(
                dataset,
                FilterRequest.toFilterSpecs(filters),
                FilterRequest.toFilterSpecs(focus),
                FilterRequest.toFilterSpecs(excludes),
                groups
        );
    }
}
