package com.hcltech.asyncnode.controller;

/**
 * An event-time stamped value: the unit that flows into and out of the processing function.
 */
public record Timestamped<T>(long timestamp, T value) {

    public static <T> Timestamped<T> of(long timestamp, T value) {
        return new Timestamped<>(timestamp, value);
    }

    public <U> Timestamped<U> withValue(U newValue) {
        return new Timestamped<>(timestamp, newValue);
    }
}
