package com.example.facelandmarker.vision.core;

public enum PixelFormat {

    BGRA_8888(4, true),
    RGBA_8888(4, true),
    ARGB_8888(4, false),
    RGB_888(3, false),
    GRAY_8(1, false);

    private final int bytesPerPixel;
    private final boolean acceptedForBuffers;

    PixelFormat(int bytesPerPixel, boolean acceptedForBuffers) {
        this.bytesPerPixel = bytesPerPixel;
        this.acceptedForBuffers = acceptedForBuffers;
    }

    public int bytesPerPixel() {
        return bytesPerPixel;
    }

    public boolean isAcceptedForBuffers() {
        return acceptedForBuffers;
    }
}
