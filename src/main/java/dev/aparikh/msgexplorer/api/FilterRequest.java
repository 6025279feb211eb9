package dev.aparikh.msgexplorer.api;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.aparikh.msgexplorer.filter.FilterSpec;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Filter as sent by clients. Which fields are allowed depends on the kind of
 * the dimension; the engine rejects mismatched shapes.
 */
@Schema(description = "Filter on one dimension")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FilterRequest(
        @NotBlank
        @Schema(description = "Dimension key", example = "time",
                requiredMode = Schema.RequiredMode.REQUIRED)
        String dimension,

        @Schema(description = "Inclusive lower bound for continuous dimensions", example = "10")
        BigDecimal min,

        @Schema(description = "Inclusive upper bound for continuous dimensions", example = "100")
        BigDecimal max,

        @JsonProperty("min_time")
        @Schema(description = "Inclusive start for temporal dimensions", example = "2015-02-25T00:00:00Z")
        @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss'Z'", timezone = "UTC")
        Instant minTime,

        @JsonProperty("max_time")
        @Schema(description = "Inclusive end for temporal dimensions", example = "2015-02-28T23:59:59Z")
        @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss'Z'", timezone = "UTC")
        Instant maxTime,

        @Schema(description = "Accepted levels for categorical dimensions", example = "[\"tweet\", \"reply\"]")
        List<String> levels,

        @Schema(description = "Single accepted level for categorical dimensions", example = "retweet")
        String value,

        @Schema(description = "Whitespace-separated search tokens for categorical dimensions", example = "soup lad")
        String text
) {

    public FilterSpec toFilterSpec() {
        return new FilterSpec(dimension, min, max, minTime, maxTime, levels, value, text);
    }

    static List<FilterSpec> toFilterSpecs(List<FilterRequest> requests) {
        if (requests == null) return List.of();
        return requests.stream().map(FilterRequest::toFilterSpec).toList();
    }
}
