package com.example.facelandmarker.engine;

public class EngineException extends Exception {

    public enum Stage {
        LOAD,
        INPUT,
        RUN
    }

    private final Stage stage;

    public EngineException(Stage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public EngineException(Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public Stage getStage() {
        return stage;
    }
}
