package com.example.facelandmarker.engine;

import com.example.facelandmarker.vision.core.ImageProcessingOptions;
import com.example.facelandmarker.vision.core.VisionImage;

import java.util.Objects;

public record EngineRequest(VisionImage image, ImageProcessingOptions processingOptions, long timestampMs) {

    public EngineRequest {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(processingOptions, "processingOptions");
    }
}
