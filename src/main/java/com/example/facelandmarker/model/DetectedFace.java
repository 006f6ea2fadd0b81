package com.example.facelandmarker.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Landmarks and optional blendshapes of one detected face")
public record DetectedFace(
        @Schema(description = "Position of the face in the result, ordered by detection")
        int index,
        @Schema(description = "Face mesh landmarks, 478 for the standard model")
        List<LandmarkPoint> landmarks,
        @Schema(description = "Blendshape scores; empty unless blendshapes are enabled")
        List<BlendshapeScore> blendshapes,
        @Schema(description = "Row-major 4x4 facial transformation matrix; empty unless enabled")
        List<Float> transformationMatrix) {
}
