package com.example.facelandmarker.vision.core;

public enum ImageSourceType {
    IMAGE,
    PIXEL_BUFFER,
    SAMPLE_BUFFER
}
