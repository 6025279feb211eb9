package dev.aparikh.msgexplorer.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.aparikh.msgexplorer.datatable.DataTableResult;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Response DTO for the data table API: the request echoed back with the result added.
 */
@Schema(description = "Data table response")
public record DataTableResponse(
        Long dataset,
        List<String> dimensions,
        List<FilterRequest> filters,
        List<FilterRequest> excludes,
        String measure,
        String mode,
        List<Long> groups,
        @JsonProperty("search_key") String searchKey,
        Integer page,
        @JsonProperty("page_size") Integer pageSize,

        @Schema(description = "Table of cells, domains and domain labels")
        DataTableResult result
) {

    public static DataTableResponse of(DataTableRequest request, DataTableResult result) {
        return new DataTableResponse(
                request.dataset(),
                request.dimensions(),
                request.filters() == null ? List.of() : request.filters(),
                request.excludes() == null ? List.of() : request.excludes(),
                request.measure(),
                request.mode(),
                request.groups() == null ? List.of() : request.groups(),
                request.searchKey(),
                request.page(),
                request.pageSize(),
                result
        );
    }
}
