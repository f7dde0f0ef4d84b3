package com.hcltech.asyncnode.controller;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Operations that were still unresolved when they were registered, oldest first.
 * <p>
 * Owned by the invoking thread: {@link #track}, {@link #removeCompleted} and {@link #oldestExcess}
 * must only be called from it. Entries resolve concurrently and stay until the next
 * {@link #removeCompleted()}.
 * <p>
 * Operations discovered on another thread (the fan-out of an outer result that resolved late) go
 * through {@link #trackFromAnyThread}; they join the set at the next {@link #removeCompleted()}.
 */
public final class PendingOperations {
    private final ArrayDeque<CompletableFuture<?>> pending = new ArrayDeque<>();
    private final ConcurrentLinkedQueue<CompletableFuture<?>> handOff = new ConcurrentLinkedQueue<>();

    /** @return true if the operation was unresolved and is now tracked */
    public boolean track(CompletableFuture<?> operation) {
        if (operation.isDone()) return false;
        pending.addLast(operation);
        return true;
    }

    /** Thread-safe. */
    public void trackFromAnyThread(CompletableFuture<?> operation) {
        if (!operation.isDone()) handOff.offer(operation);
    }

    /**
     * Folds in hand-offs, then drops every resolved entry.
     *
     * @return the number of entries dropped
     */
    public int removeCompleted() {
        CompletableFuture<?> late;
        while ((late = handOff.poll()) != null) {
            pending.addLast(late);
        }
        int before = pending.size();
        pending.removeIf(CompletableFuture::isDone);
        return before - pending.size();
    }

    /**
     * The oldest entries beyond {@code max}, oldest first. They remain tracked.
     */
    public List<CompletableFuture<?>> oldestExcess(int max) {
        int excess = pending.size() - max;
        if (excess <= 0) return List.of();
        List<CompletableFuture<?>> result = new ArrayList<>(excess);
        Iterator<CompletableFuture<?>> it = pending.iterator();
        for (int i = 0; i < excess; i++) {
            result.add(it.next());
        }
        return result;
    }

    public int size() {
        return pending.size();
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }
}
