package com.hcltech.asyncnode.controller;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class PendingOperationsTest {

    @Test
    void resolvedOperationsAreNotTracked() {
        PendingOperations p = new PendingOperations();
        assertFalse(p.track(CompletableFuture.completedFuture("done")));
        assertTrue(p.isEmpty());
    }

    @Test
    void removeCompletedDropsOnlyResolvedEntries() {
        PendingOperations p = new PendingOperations();
        CompletableFuture<String> a = new CompletableFuture<>();
        CompletableFuture<String> b = new CompletableFuture<>();
        CompletableFuture<String> c = new CompletableFuture<>();
        p.track(a);
        p.track(b);
        p.track(c);

        b.complete("b");
        c.completeExceptionally(new RuntimeException());

        assertEquals(2, p.removeCompleted());
        assertEquals(1, p.size());
        assertEquals(List.of(a), p.oldestExcess(0));
    }

    @Test
    void oldestExcessIsFifoAndLeavesEntriesTracked() {
        PendingOperations p = new PendingOperations();
        CompletableFuture<String> a = new CompletableFuture<>();
        CompletableFuture<String> b = new CompletableFuture<>();
        CompletableFuture<String> c = new CompletableFuture<>();
        p.track(a);
        p.track(b);
        p.track(c);

        assertEquals(List.of(a), p.oldestExcess(2));
        assertEquals(List.of(a, b), p.oldestExcess(1));
        assertEquals(List.of(), p.oldestExcess(3));
        assertEquals(List.of(), p.oldestExcess(10));
        assertEquals(3, p.size());
    }

    @Test
    void handOffsJoinAtTheNextRemovePass() throws Exception {
        PendingOperations p = new PendingOperations();
        CompletableFuture<String> late = new CompletableFuture<>();
        CompletableFuture<String> lateButDone = new CompletableFuture<>();

        Thread t = new Thread(() -> {
            p.trackFromAnyThread(late);
            p.trackFromAnyThread(lateButDone);
        });
        t.start();
        t.join();
        assertEquals(0, p.size());

        lateButDone.complete("x");
        assertEquals(1, p.removeCompleted());
        assertEquals(1, p.size());
        assertEquals(List.of(late), p.oldestExcess(0));
    }
}
