package com.example.facelandmarker.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Face landmark normalized to the image size")
public record LandmarkPoint(
        @Schema(description = "Horizontal position, 0 at the left edge and 1 at the right edge", example = "0.51")
        float x,
        @Schema(description = "Vertical position, 0 at the top edge and 1 at the bottom edge", example = "0.43")
        float y,
        @Schema(description = "Depth relative to the head center, on roughly the same scale as x")
        float z) {
}
