package com.example.facelandmarker.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Facial expression coefficient")
public record BlendshapeScore(
        @Schema(description = "Blendshape name", example = "jawOpen")
        String name,
        @Schema(description = "Coefficient between 0 and 1", example = "0.12")
        float score) {
}
