package com.wastewrangler.shared.schedule;

import java.util.Optional;

/**
 * Outcome of a scheduling component call: a value plus the error that ended
 * or disqualified the call, if any.
 *
 * For incremental operations the value is the number of committed units and
 * an error may accompany a non-zero value (the batch stopped early).
 */
public record SchedulingResult<T>(T value, SchedulingError error) {

    public static <T> SchedulingResult<T> success(T value) {
        return new SchedulingResult<>(value, null);
    }

    public static <T> SchedulingResult<T> failure(SchedulingError error, T fallback) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new SchedulingResult<>(fallback, error);
    }

    public static <T> SchedulingResult<T> failure(SchedulingError error) {
        return failure(error, null);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<SchedulingError> errorKind() {
        return Optional.ofNullable(error);
    }
}
