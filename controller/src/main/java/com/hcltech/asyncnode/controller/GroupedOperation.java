package com.hcltech.asyncnode.controller;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * One fanned-out asynchronous operation together with the group its result is reported against.
 */
public record GroupedOperation<H, Out>(CompletionGroup<H> group,
                                       CompletionStage<List<Timestamped<Out>>> operation) {

    public GroupedOperation {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(operation, "operation");
    }

    public static <H, Out> GroupedOperation<H, Out> of(CompletionGroup<H> group,
                                                       CompletionStage<List<Timestamped<Out>>> operation) {
        return new GroupedOperation<>(group, operation);
    }

    /** Already resolved with these outputs. */
    public static <H, Out> GroupedOperation<H, Out> completed(CompletionGroup<H> group, List<Timestamped<Out>> outputs) {
        return new GroupedOperation<>(group, CompletableFuture.completedFuture(outputs));
    }

    /** Already resolved with this failure. */
    public static <H, Out> GroupedOperation<H, Out> failed(CompletionGroup<H> group, Throwable error) {
        return new GroupedOperation<>(group, CompletableFuture.failedFuture(error));
    }
}
