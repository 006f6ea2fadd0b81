package com.example.facelandmarker.engine;

import com.example.facelandmarker.components.containers.Classifications;
import com.example.facelandmarker.components.containers.NormalizedLandmark;
import com.example.facelandmarker.components.containers.TransformMatrix;

import java.util.List;
import java.util.stream.Collectors;

public record EngineOutput(
        List<List<NormalizedLandmark>> faceLandmarks,
        List<Classifications> faceBlendshapes,
        List<TransformMatrix> facialTransformationMatrixes) {

    public EngineOutput {
        faceLandmarks = List.copyOf(faceLandmarks.stream()
                .map(List::copyOf)
                .collect(Collectors.toList()));
        faceBlendshapes = List.copyOf(faceBlendshapes);
        facialTransformationMatrixes = List.copyOf(facialTransformationMatrixes);
    }

    public static EngineOutput empty() {
        return new EngineOutput(List.of(), List.of(), List.of());
    }
}
