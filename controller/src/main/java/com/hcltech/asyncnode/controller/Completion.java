package com.hcltech.asyncnode.controller;

import java.util.List;
import java.util.Objects;

/**
 * The resolution of one asynchronous operation, ready to be emitted for its group.
 * Immutable; created on whichever thread resolved the operation.
 */
public final class Completion<H, Out> {
    private final CompletionGroup<H> group;
    private final List<Timestamped<Out>> outputs;
    private final Throwable error;

    public static <H, Out> Completion<H, Out> success(CompletionGroup<H> group, List<Timestamped<Out>> outputs) {
        return new Completion<>(group, outputs == null ? List.of() : outputs, null);
    }

    public static <H, Out> Completion<H, Out> failure(CompletionGroup<H> group, Throwable error) {
        return new Completion<>(group, null, Objects.requireNonNull(error, "error"));
    }

    private Completion(CompletionGroup<H> group, List<Timestamped<Out>> outputs, Throwable error) {
        this.group = Objects.requireNonNull(group, "group");
        this.outputs = outputs;
        this.error = error;
    }

    public boolean isSuccess() { return error == null; }

    public CompletionGroup<H> group() { return group; }

    /** Only meaningful when {@link #isSuccess()}. */
    public List<Timestamped<Out>> outputs() { return outputs; }

    /** Only meaningful when not {@link #isSuccess()}. */
    public Throwable error() { return error; }

    @Override
    public String toString() {
        return isSuccess()
                ? "Completion.success(" + group + ", " + outputs.size() + " outputs)"
                : "Completion.failure(" + group + ", " + error + ")";
    }
}
