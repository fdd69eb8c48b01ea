package com.example.ingest.domain.model;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Outcome of one extraction step (a page, a table pass, an OCR call, a decode attempt).
 * Strategies return this instead of letting a sub-unit exception escape, and merge the failure
 * reason into the metadata of the enclosing result.
 *
 * @param value   produced value when the step succeeded, otherwise {@code null}
 * @param failure failure description when the step failed, otherwise {@code null}
 * @param <T>     value type
 */
public record StepOutcome<T>(T value, String failure) {

    /**
     * @param value value produced by the step
     * @param <T>   value type
     * @return successful outcome
     */
    public static <T> StepOutcome<T> success(T value) {
        return new StepOutcome<>(value, null);
    }

    /**
     * @param reason human readable reason, never {@code null}
     * @param <T>    value type
     * @return failed outcome
     */
    public static <T> StepOutcome<T> failure(String reason) {
        return new StepOutcome<>(null, Objects.requireNonNull(reason, "reason"));
    }

    /**
     * Builds a failure from a caught exception, falling back to the exception type when the
     * library supplied no message.
     *
     * @param error caught exception
     * @param <T>   value type
     * @return failed outcome
     */
    public static <T> StepOutcome<T> failure(Throwable error) {
        return failure(describe(error));
    }

    public boolean succeeded() {
        return failure == null;
    }

    /**
     * Runs the consumer for a successful value.
     *
     * @param action consumer receiving the value
     * @return this outcome for chaining
     */
    public StepOutcome<T> ifSucceeded(Consumer<T> action) {
        if (succeeded()) {
            action.accept(value);
        }
        return this;
    }

    /**
     * Runs the consumer with the failure reason.
     *
     * @param action consumer receiving the failure reason
     * @return this outcome for chaining
     */
    public StepOutcome<T> ifFailed(Consumer<String> action) {
        if (!succeeded()) {
            action.accept(failure);
        }
        return this;
    }

    /**
     * Converts an exception into a short message suitable for metadata.
     *
     * @param error exception to describe
     * @return the exception message or its simple class name
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }
}
