package com.hcltech.asyncnode.controller;

import java.util.List;

/**
 * Downstream of the controller. Called exactly once per completion group, always on the invoking thread.
 */
public interface EmissionSink<H, Out> {

    void onSuccess(CompletionGroup<H> group, List<Timestamped<Out>> outputs);

    void onFailure(CompletionGroup<H> group, Throwable error);
}
