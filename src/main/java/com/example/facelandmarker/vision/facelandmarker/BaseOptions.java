package com.example.facelandmarker.vision.facelandmarker;

public record BaseOptions(String modelAssetPath, int numThreads) {

    public BaseOptions {
        modelAssetPath = modelAssetPath == null ? "" : modelAssetPath;
        if (numThreads < 0) {
            throw new IllegalArgumentException("numThreads must not be negative");
        }
    }

    public static BaseOptions ofModelAssetPath(String modelAssetPath) {
        return new BaseOptions(modelAssetPath, 0);
    }
}
