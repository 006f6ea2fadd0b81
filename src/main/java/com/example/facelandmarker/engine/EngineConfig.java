package com.example.facelandmarker.engine;

import com.example.facelandmarker.vision.core.RunningMode;

import java.nio.file.Path;
import java.util.Objects;

public record EngineConfig(
        Path modelAssetPath,
        RunningMode runningMode,
        int numFaces,
        float minFaceDetectionConfidence,
        float minFacePresenceConfidence,
        float minTrackingConfidence,
        boolean outputFaceBlendshapes,
        boolean outputFacialTransformationMatrixes,
        int numThreads) {

    public EngineConfig {
        Objects.requireNonNull(modelAssetPath, "modelAssetPath");
        Objects.requireNonNull(runningMode, "runningMode");
    }
}
