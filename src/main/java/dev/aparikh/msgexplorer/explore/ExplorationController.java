package dev.aparikh.msgexplorer.explore;

import dev.aparikh.msgexplorer.api.DimensionDescriptor;
import dev.aparikh.msgexplorer.api.ErrorResponse;
import dev.aparikh.msgexplorer.api.ExampleMessagesRequest;
import dev.aparikh.msgexplorer.api.ExampleMessagesResponse;
import dev.aparikh.msgexplorer.api.KeywordSearchRequest;
import dev.aparikh.msgexplorer.api.KeywordSearchResponse;
import dev.aparikh.msgexplorer.datatable.QueryResolver;
import dev.aparikh.msgexplorer.dimension.DimensionRegistry;
import dev.aparikh.msgexplorer.history.ActionContext;
import dev.aparikh.msgexplorer.history.ActionHistoryRecorder;
import dev.aparikh.msgexplorer.model.Dataset;
import dev.aparikh.msgexplorer.model.Message;
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
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.security.Principal;
import java.util.List;
import java.util.Map;

/**
 * REST Controller for browsing a dataset: sample messages, keyword
 * autocomplete, dataset details and the dimension catalog.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Exploration", description = "Example messages, keyword suggestions, datasets and dimensions")
public class ExplorationController {

    static final String EXAMPLE_MESSAGES_ACTION = "example-messages";
    static final String KEYWORDS_ACTION = "auto-complete:get-list";
    static final String SEARCH_ACTION = "search";
    static final String DATASET_ACTION = "dataset:get";

    private final ExampleMessageService exampleMessageService;
    private final KeywordSuggestionService keywordSuggestionService;
    private final KeywordSearchService keywordSearchService;
    private final QueryResolver resolver;
    private final DimensionRegistry registry;
    private final ActionHistoryRecorder history;

    public ExplorationController(ExampleMessageService exampleMessageService,
                                 KeywordSuggestionService keywordSuggestionService,
                                 KeywordSearchService keywordSearchService,
                                 QueryResolver resolver,
                                 DimensionRegistry registry,
                                 ActionHistoryRecorder history) {
        this.exampleMessageService = exampleMessageService;
        this.keywordSuggestionService = keywordSuggestionService;
        this.keywordSearchService = keywordSearchService;
        this.resolver = resolver;
        this.registry = registry;
        this.history = history;
    }

    @PostMapping(value = "/messages", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Example messages",
            description = "Returns a small sample of messages matching the filters and the focus, " +
                    "minus the excludes, in corpus order."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Sample retrieved successfully",
                    content = @Content(schema = @Schema(implementation = ExampleMessagesResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Invalid filters",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "404",
                    description = "Unknown dataset or group",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<ExampleMessagesResponse> exampleMessages(
            @Parameter(description = "Slice of the dataset to sample", required = true)
            @Valid @RequestBody ExampleMessagesRequest request,
            Principal principal) {

        history.record(ActionContext.of(principal), EXAMPLE_MESSAGES_ACTION, request);

        List<Message> messages = exampleMessageService.examples(request.toQuery());
        ExampleMessagesResponse response = new ExampleMessagesResponse(
                request.dataset(),
                request.filters() == null ? List.of() : request.filters(),
                request.focus() == null ? List.of() : request.focus(),
                request.excludes() == null ? List.of() : request.excludes(),
                request.groups() == null ? List.of() : request.groups(),
                messages
        );
        return ResponseEntity.ok(response);
    }

    @PostMapping(value = "/search", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Keyword message search",
            description = "Returns messages whose words match the keyword expression, in corpus order. " +
                    "Commas separate alternatives, a clause starting with NOT excludes."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Messages retrieved successfully",
                    content = @Content(schema = @Schema(implementation = KeywordSearchResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Invalid request",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "404",
                    description = "Unknown dataset",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<KeywordSearchResponse> search(
            @Parameter(description = "Keyword expression and message types", required = true)
            @Valid @RequestBody KeywordSearchRequest request,
            Principal principal) {

        history.record(ActionContext.of(principal), SEARCH_ACTION, request);

        List<String> types = request.typesList() == null ? List.of() : request.typesList();
        List<Message> messages = keywordSearchService.search(request.dataset(), request.keywords(), types);
        return ResponseEntity.ok(new KeywordSearchResponse(request.dataset(), request.keywords(), types, messages));
    }

    @GetMapping(value = "/keywords", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Keyword suggestions",
            description = "Completes the last token of a partial keyword query with the most frequent words of the dataset."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Suggestions retrieved successfully",
                    content = @Content(schema = @Schema(implementation = KeywordSuggestions.class))
            ),
            @ApiResponse(
                    responseCode = "404",
                    description = "Unknown dataset",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<KeywordSuggestions> keywords(
            @Parameter(description = "Dataset id", required = true) @RequestParam long dataset,
            @Parameter(description = "Partial keyword query") @RequestParam(required = false, defaultValue = "") String q,
            Principal principal) {
        history.record(ActionContext.of(principal), KEYWORDS_ACTION, Map.of("dataset", dataset, "q", q));
        return ResponseEntity.ok(keywordSuggestionService.suggest(dataset, q));
    }

    @GetMapping(value = "/dataset", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Dataset details", description = "Catalog record of a dataset.")
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Dataset found",
                    content = @Content(schema = @Schema(implementation = Dataset.class))
            ),
            @ApiResponse(
                    responseCode = "404",
                    description = "Unknown dataset",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<Dataset> dataset(
            @Parameter(description = "Dataset id", required = true) @RequestParam long id,
            Principal principal) {
        history.record(ActionContext.of(principal), DATASET_ACTION, Map.of("id", id));
        return ResponseEntity.ok(resolver.requireDataset(id));
    }

    @GetMapping(value = "/dimensions", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Dimension catalog", description = "All dimensions available for tables and filters.")
    public ResponseEntity<List<DimensionDescriptor>> dimensions() {
        List<DimensionDescriptor> dimensions = registry.all().stream()
                .map(DimensionDescriptor::of)
                .toList();
        return ResponseEntity.ok(dimensions);
    }
}
