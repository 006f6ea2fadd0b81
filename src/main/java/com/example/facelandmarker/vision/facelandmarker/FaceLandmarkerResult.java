package com.example.facelandmarker.vision.facelandmarker;

import com.example.facelandmarker.components.containers.Classifications;
import com.example.facelandmarker.components.containers.NormalizedLandmark;
import com.example.facelandmarker.components.containers.TransformMatrix;

import java.util.List;
import java.util.stream.Collectors;

public record FaceLandmarkerResult(
        List<List<NormalizedLandmark>> faceLandmarks,
        List<Classifications> faceBlendshapes,
        List<TransformMatrix> facialTransformationMatrixes,
        long timestampMs) {

    public FaceLandmarkerResult {
        faceLandmarks = List.copyOf(faceLandmarks.stream()
                .map(List::copyOf)
                .collect(Collectors.toList()));
        faceBlendshapes = List.copyOf(faceBlendshapes);
        facialTransformationMatrixes = List.copyOf(facialTransformationMatrixes);
    }

    public int faceCount() {
        return faceLandmarks.size();
    }
}
