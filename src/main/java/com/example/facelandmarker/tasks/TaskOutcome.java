package com.example.facelandmarker.tasks;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of a fallible task operation. Holds either a value or a {@link TaskError}; never both and
 * never neither. Operations that succeed without producing anything use {@code TaskOutcome<Void>}
 * through {@link #done()}.
 *
 * @param <T> type of the success value
 */
public final class TaskOutcome<T> {

    private static final TaskOutcome<Void> DONE = new TaskOutcome<>(null, null, true);

    private final T value;
    private final TaskError error;
    private final boolean success;

    private TaskOutcome(T value, TaskError error, boolean success) {
        this.value = value;
        this.error = error;
        this.success = success;
    }

    public static <T> TaskOutcome<T> success(T value) {
        return new TaskOutcome<>(Objects.requireNonNull(value, "value"), null, true);
    }

    public static TaskOutcome<Void> done() {
        return DONE;
    }

    public static <T> TaskOutcome<T> failure(TaskError error) {
        return new TaskOutcome<>(null, Objects.requireNonNull(error, "error"), false);
    }

    public static <T> TaskOutcome<T> failure(TaskErrorCode code, String message) {
        return failure(TaskError.of(code, message));
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public Optional<TaskError> error() {
        return Optional.ofNullable(error);
    }

    public T orElseThrow() {
        if (!success) {
            throw error.toException();
        }
        return value;
    }

    public TaskError errorOrThrow() {
        if (success) {
            throw new NoSuchElementException("Outcome is a success");
        }
        return error;
    }

    @Override
    public String toString() {
        return success ? "TaskOutcome[success=" + value + "]" : "TaskOutcome[failure=" + error.code() + ": " + error.message() + "]";
    }
}
