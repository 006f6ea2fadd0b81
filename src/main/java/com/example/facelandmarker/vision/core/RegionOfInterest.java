package com.example.facelandmarker.vision.core;

public record RegionOfInterest(float left, float top, float right, float bottom) {

    public static final RegionOfInterest WHOLE_IMAGE = new RegionOfInterest(0f, 0f, 1f, 1f);

    public RegionOfInterest {
        if (left < 0f || top < 0f || right > 1f || bottom > 1f || left >= right || top >= bottom) {
            throw new IllegalArgumentException("Region of interest must be a non-empty rectangle inside [0, 1]");
        }
    }

    public boolean isWholeImage() {
        return equals(WHOLE_IMAGE);
    }
}
