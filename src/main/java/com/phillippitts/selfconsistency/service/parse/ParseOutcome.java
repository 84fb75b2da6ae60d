package com.phillippitts.selfconsistency.service.parse;

import java.util.Objects;

/**
 * Either a parsed value or the reason parsing failed.
 */
public record ParseOutcome<T>(T value, String error) {

    public static <T> ParseOutcome<T> success(T value) {
        return new ParseOutcome<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> ParseOutcome<T> failure(String error) {
        return new ParseOutcome<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }
}
