package com.hcltech.asyncnode.controller;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * User-supplied logic run by {@link AsyncInvocationController}.
 * <p>
 * The result is doubly asynchronous: the outer stage yields the fan-out (which groups exist),
 * each inner stage yields the outputs for one group. Use completed stages wherever the work is
 * already done; the controller then never tracks them as pending.
 * <p>
 * Both methods are called on the invoking thread. The stages they return may be completed from any thread.
 *
 * @param <H>   opaque source handle used for acknowledgment
 * @param <In>  decoded input value
 * @param <Out> output value
 */
@FunctionalInterface
public interface AsyncProcessingFunction<H, In, Out> {

    CompletionStage<List<GroupedOperation<H, Out>>> apply(H handle, Timestamped<In> input);

    /** Called on every periodic tick. By default there is nothing to do. */
    default CompletionStage<List<GroupedOperation<H, Out>>> tick() {
        return CompletableFuture.completedFuture(List.of());
    }
}
