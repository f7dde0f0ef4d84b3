package com.hcltech.asyncnode.controller;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Multi-producer, single-consumer buffer of completions.
 * <p>
 * Any thread may {@link #offer}; only the invoking thread calls {@link #drainAll()}, which swaps the
 * buffer out under the lock. Everything offered before a drain starts is returned by it, in arrival order.
 */
public final class CompletionQueue<H, Out> {
    private final Object lock = new Object();
    private List<Completion<H, Out>> entries = new ArrayList<>();

    public void offer(Completion<H, Out> completion) {
        Objects.requireNonNull(completion, "completion");
        synchronized (lock) {
            entries.add(completion);
        }
    }

    public List<Completion<H, Out>> drainAll() {
        synchronized (lock) {
            if (entries.isEmpty()) return List.of();
            List<Completion<H, Out>> drained = entries;
            entries = new ArrayList<>();
            return drained;
        }
    }

    /** Puts completions back ahead of anything offered since they were drained. Invoking thread only. */
    public void requeueFirst(List<Completion<H, Out>> undelivered) {
        if (undelivered.isEmpty()) return;
        synchronized (lock) {
            List<Completion<H, Out>> merged = new ArrayList<>(undelivered.size() + entries.size());
            merged.addAll(undelivered);
            merged.addAll(entries);
            entries = merged;
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }
}
