package dev.aparikh.msgexplorer.api;

import dev.aparikh.msgexplorer.dimension.Dimension;
import dev.aparikh.msgexplorer.dimension.DimensionKind;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(description = "Dimension available for analysis")
public record DimensionDescriptor(
        @Schema(description = "Dimension key", example = "message_type")
        String key,

        @Schema(description = "Dimension kind", example = "categorical")
        DimensionKind kind,

        @Schema(description = "Display labels by level")
        Map<String, String> labels
) {

    public static DimensionDescriptor of(Dimension dimension) {
        return new DimensionDescriptor(dimension.key(), dimension.kind(), dimension.labels());
    }
}
