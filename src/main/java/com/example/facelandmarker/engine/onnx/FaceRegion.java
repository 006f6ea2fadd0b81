package com.example.facelandmarker.engine.onnx;

record FaceRegion(float centerX, float centerY, float size, float angleDegrees, float score) {

    static FaceRegion wholeImage(int width, int height) {
        return new FaceRegion(width / 2f, height / 2f, Math.max(width, height), 0f, 1f);
    }
}
