package com.example.facelandmarker.tasks;

import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskOutcomeTest {

    @Test
    void successHoldsValueAndNoError() {
        TaskOutcome<String> outcome = TaskOutcome.success("landmarks");

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.value()).contains("landmarks");
        assertThat(outcome.error()).isEmpty();
        assertThat(outcome.orElseThrow()).isEqualTo("landmarks");
        assertThatThrownBy(outcome::errorOrThrow).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void failureHoldsErrorAndNoValue() {
        TaskOutcome<String> outcome = TaskOutcome.failure(TaskErrorCode.SEQUENCING, "timestamp went backwards");

        assertThat(outcome.isFailure()).isTrue();
        assertThat(outcome.value()).isEmpty();
        assertThat(outcome.errorOrThrow().code()).isEqualTo(TaskErrorCode.SEQUENCING);
        assertThatThrownBy(outcome::orElseThrow)
                .isInstanceOf(TaskException.class)
                .hasMessage("timestamp went backwards");
    }

    @Test
    void doneIsSuccessWithoutValue() {
        TaskOutcome<Void> outcome = TaskOutcome.done();

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.value()).isEmpty();
        assertThat(outcome.error()).isEmpty();
    }

    @Test
    void rejectsMissingParts() {
        assertThatThrownBy(() -> TaskOutcome.success(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> TaskError.of(TaskErrorCode.INVALID_INPUT, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void exceptionExposesError() {
        TaskError error = TaskError.of(TaskErrorCode.INVALID_MODE, "wrong mode");

        TaskException exception = error.toException();

        assertThat(exception.getError()).isSameAs(error);
        assertThat(exception.getCode()).isEqualTo(TaskErrorCode.INVALID_MODE);
    }
}
