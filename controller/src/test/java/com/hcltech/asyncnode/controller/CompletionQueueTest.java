package com.hcltech.asyncnode.controller;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CompletionQueueTest {

    @Test
    void drainReturnsEntriesInArrivalOrderAndEmptiesTheQueue() {
        CompletionQueue<String, String> q = new CompletionQueue<>();
        q.offer(Completion.success(CompletionGroup.of("a"), List.of()));
        q.offer(Completion.failure(CompletionGroup.of("b"), new RuntimeException()));

        List<Completion<String, String>> drained = q.drainAll();

        assertEquals(2, drained.size());
        assertEquals(CompletionGroup.of("a"), drained.get(0).group());
        assertFalse(drained.get(1).isSuccess());
        assertEquals(0, q.size());
        assertTrue(q.drainAll().isEmpty());
    }

    @Test
    void concurrentProducersLoseNothing() throws Exception {
        CompletionQueue<Integer, String> q = new CompletionQueue<>();
        int producers = 8;
        int perProducer = 5_000;
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(producers);
        for (int p = 0; p < producers; p++) {
            int base = p * perProducer;
            pool.execute(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perProducer; i++) {
                        q.offer(Completion.success(CompletionGroup.of(base + i), List.of()));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        Set<Integer> seen = new HashSet<>();
        start.countDown();
        while (!done.await(1, TimeUnit.MILLISECONDS)) {
            for (var c : q.drainAll()) assertTrue(seen.add(c.group().handles().get(0)), "duplicate");
        }
        for (var c : q.drainAll()) assertTrue(seen.add(c.group().handles().get(0)), "duplicate");
        pool.shutdownNow();

        assertEquals(producers * perProducer, seen.size());
    }

    @Test
    void completionRejectsMissingError() {
        assertThrows(NullPointerException.class, () -> Completion.failure(CompletionGroup.of("a"), null));
        assertEquals(List.of(), Completion.<String, String>success(CompletionGroup.of("a"), null).outputs());
    }

    @Test
    void requeuedCompletionsComeBeforeNewerOnes() {
        CompletionQueue<String, String> q = new CompletionQueue<>();
        q.offer(Completion.success(CompletionGroup.of("a"), List.of()));
        q.offer(Completion.success(CompletionGroup.of("b"), List.of()));
        var drained = q.drainAll();
        q.offer(Completion.success(CompletionGroup.of("c"), List.of()));

        q.requeueFirst(drained.subList(1, 2));

        var again = q.drainAll();
        assertEquals(List.of(CompletionGroup.of("b"), CompletionGroup.of("c")),
                again.stream().map(Completion::group).toList());
    }
}
