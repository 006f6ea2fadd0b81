package com.example.facelandmarker.tasks;

public class TaskException extends RuntimeException {

    private final TaskError error;

    public TaskException(TaskError error) {
        super(error.message(), error.cause());
        this.error = error;
    }

    public TaskError getError() {
        return error;
    }

    public TaskErrorCode getCode() {
        return error.code();
    }
}
