package com.example.facelandmarker.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Face landmarker service state")
public record LandmarkerHealthResponse(
        @Schema(description = "Whether detection is enabled via configuration")
        boolean enabled,
        @Schema(description = "Configured model asset path")
        String modelPath,
        @Schema(description = "Whether the model has been loaded")
        boolean modelLoaded) {
}
