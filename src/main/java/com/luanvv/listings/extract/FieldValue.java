package com.luanvv.listings.extract;

import java.util.function.Function;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of one extraction rule: a value, or the reason there is none plus the raw text
 * that failed to parse.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FieldValue<T> {
    T value;
    String raw;
    String problem;

    public static <T> FieldValue<T> of(T value) {
        return new FieldValue<>(value, null, null);
    }

    public static <T> FieldValue<T> missing(String problem) {
        return new FieldValue<>(null, null, problem);
    }

    public static <T> FieldValue<T> invalid(String raw, String problem) {
        return new FieldValue<>(null, raw, problem);
    }

    public boolean isPresent() {
        return problem == null;
    }

    public <R> FieldValue<R> flatMap(Function<T, FieldValue<R>> next) {
        return isPresent() ? next.apply(value) : new FieldValue<>(null, raw, problem);
    }
}
