package com.example.facelandmarker.components.containers;

public record NormalizedLandmark(float x, float y, float z) {

    public static NormalizedLandmark of(float x, float y) {
        return new NormalizedLandmark(x, y, 0f);
    }
}
