package com.example.facelandmarker.vision.core;

/**
 * Orientation of the stored pixels relative to the upright scene. Rotation is clockwise and is
 * applied before the optional horizontal mirror.
 */
public enum ImageOrientation {

    UP(0, false),
    RIGHT(90, false),
    DOWN(180, false),
    LEFT(270, false),
    UP_MIRRORED(0, true),
    RIGHT_MIRRORED(90, true),
    DOWN_MIRRORED(180, true),
    LEFT_MIRRORED(270, true);

    private final int rotationDegrees;
    private final boolean mirrored;

    ImageOrientation(int rotationDegrees, boolean mirrored) {
        this.rotationDegrees = rotationDegrees;
        this.mirrored = mirrored;
    }

    public int rotationDegrees() {
        return rotationDegrees;
    }

    public boolean isMirrored() {
        return mirrored;
    }
}
