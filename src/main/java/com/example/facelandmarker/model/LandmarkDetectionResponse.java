package com.example.facelandmarker.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Response for a face landmark detection request")
public record LandmarkDetectionResponse(
        @Schema(description = "Number of faces found", example = "1")
        int faceCount,
        @Schema(description = "Detected faces; empty when the image contains no face")
        List<DetectedFace> faces,
        @Schema(description = "Time spent in detection in milliseconds", example = "42")
        long inferenceTimeMs) {
}
