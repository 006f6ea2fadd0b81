package com.example.facelandmarker.vision.core;

import java.util.Objects;

public record ImageProcessingOptions(RegionOfInterest regionOfInterest, ImageOrientation orientation) {

    public ImageProcessingOptions {
        Objects.requireNonNull(regionOfInterest, "regionOfInterest");
        Objects.requireNonNull(orientation, "orientation");
    }

    public static ImageProcessingOptions wholeImage(ImageOrientation orientation) {
        return new ImageProcessingOptions(RegionOfInterest.WHOLE_IMAGE, orientation);
    }
}
