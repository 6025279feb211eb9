package dev.aparikh.msgexplorer.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.aparikh.msgexplorer.datatable.DataTableQuery;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request DTO for the data table API.
 */
@Schema(description = "Data table request")
public record DataTableRequest(
        @NotNull
        @Schema(description = "Dataset id", example = "1",
                requiredMode = Schema.RequiredMode.REQUIRED)
        Long dataset,

        @NotNull
        @Schema(description = "One or two dimension keys to cross-tabulate",
                example = "[\"time\"]",
                requiredMode = Schema.RequiredMode.REQUIRED)
        List<String> dimensions,

        @Valid
        @Schema(description = "Filters, all of which must match")
        List<FilterRequest> filters,

        @Valid
        @JsonAlias("exclude")
        @Schema(description = "Excludes; messages matching all of them are removed")
        List<FilterRequest> excludes,

        @Schema(description = "Measure per cell", example = "count", defaultValue = "count")
        String measure,

        @Schema(description = "Display mode: default, cumulative or scatter", example = "cumulative")
        String mode,

        @Schema(description = "Group ids; one row set is returned per group", example = "[3, 7]")
        List<Long> groups,

        @JsonProperty("search_key")
        @Schema(description = "Case-insensitive prefix on the first categorical dimension", example = "soup")
        String searchKey,

        @Schema(description = "Page number (1-based)", example = "1", defaultValue = "1")
        Integer page,

        @JsonProperty("page_size")
        @Schema(description = "Number of cells per page", example = "100", defaultValue = "100")
        Integer pageSize
) {

    public DataTableQuery toQuery() {
        return new DataTableQuery(
                dataset,
                dimensions,
                FilterRequest.toFilterSpecs(filters),
                FilterRequest.toFilterSpecs(excludes),
                measure,
                mode,
                groups,
                searchKey,
                page,
                pageSize
        );
    }
}
