package com.example.facelandmarker.vision.core;

public enum RunningMode {

    IMAGE("Image"),
    VIDEO("Video"),
    LIVE_STREAM("Live Stream");

    private final String displayName;

    RunningMode(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
