package com.example.facelandmarker.tasks;

import java.util.Objects;

public record TaskError(TaskErrorCode code, String message, Throwable cause) {

    public TaskError {
        Objects.requireNonNull(code, "code");
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Task error message must not be blank");
        }
    }

    public static TaskError of(TaskErrorCode code, String message) {
        return new TaskError(code, message, null);
    }

    public TaskException toException() {
        return new TaskException(this);
    }
}
