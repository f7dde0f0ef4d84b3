package com.hcltech.asyncnode.controller;

import java.util.Arrays;
import java.util.List;

/**
 * The source handles that one asynchronous result is reported against.
 * One input may fan out into many groups; a tick may produce groups with any handles, or none.
 */
public record CompletionGroup<H>(List<H> handles) {

    public CompletionGroup {
        handles = List.copyOf(handles);
    }

    @SafeVarargs
    public static <H> CompletionGroup<H> of(H... handles) {
        return new CompletionGroup<>(Arrays.asList(handles));
    }

    public static <H> CompletionGroup<H> empty() {
        return new CompletionGroup<>(List.of());
    }

    public int size() {
        return handles.size();
    }

    public boolean isEmpty() {
        return handles.isEmpty();
    }
}
