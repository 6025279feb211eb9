package dev.aparikh.msgexplorer.datatable;

import dev.aparikh.msgexplorer.api.DataTableRequest;
import dev.aparikh.msgexplorer.api.DataTableResponse;
import dev.aparikh.msgexplorer.api.ErrorResponse;
import dev.aparikh.msgexplorer.history.ActionContext;
import dev.aparikh.msgexplorer.history.ActionHistoryRecorder;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.security.Principal;

/**
 * REST Controller for dimension cross-tabulation.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Data Table", description = "Aggregate messages over one or two dimensions")
public class DataTableController {

    static final String ACTION_TYPE = "data-table";

    private final DataTableService dataTableService;
    private final ActionHistoryRecorder history;

    public DataTableController(DataTableService dataTableService, ActionHistoryRecorder history) {
        this.dataTableService = dataTableService;
        this.history = history;
    }

    @PostMapping(value = "/table", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Build a data table",
            description = "Counts messages of a dataset per combination of levels of one or two dimensions. " +
                    "Filters narrow the messages, excludes remove messages matching all of them, " +
                    "groups split the table into one row set per group. " +
                    "Use 'page' and 'page_size' for pagination (defaults: page=1, page_size=100); " +
                    "domains always describe the whole table."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Table built successfully",
                    content = @Content(schema = @Schema(implementation = DataTableResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Invalid dimensions, filters, measure or mode",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "404",
                    description = "Unknown dataset or group",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "500",
                    description = "Internal server error during aggregation",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<DataTableResponse> dataTable(
            @Parameter(description = "Data table request", required = true)
            @Valid @RequestBody DataTableRequest request,
            Principal principal) {

        history.record(ActionContext.of(principal), ACTION_TYPE, request);

        DataTableResult result = dataTableService.aggregate(request.toQuery());
        return ResponseEntity.ok(DataTableResponse.of(request, result));
    }
}
