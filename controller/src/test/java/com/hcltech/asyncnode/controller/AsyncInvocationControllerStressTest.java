package com.hcltech.asyncnode.controller;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.LockSupport;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Many inputs, each fanning out into several operations that resolve on a pool in random order.
 * Every group must reach the sink exactly once, always on the invoking thread.
 */
class AsyncInvocationControllerStressTest {

    private static final int RECORDS = 2_000;
    private static final int FANOUT = 4;

    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void everyGroupIsEmittedExactlyOnce() {
        RecordingSink<String, String> sink = new RecordingSink<>();
        AsyncProcessingFunction<String, String, String> fn = (handle, in) -> {
            List<GroupedOperation<String, String>> ops = new ArrayList<>(FANOUT);
            for (int i = 0; i < FANOUT; i++) {
                String key = handle + "#" + i;
                boolean fail = i == 3 && handle.hashCode() % 7 == 0;
                ops.add(GroupedOperation.of(CompletionGroup.of(key), CompletableFuture.supplyAsync(() -> {
                    LockSupport.parkNanos(ThreadLocalRandom.current().nextInt(50_000));
                    if (fail) throw new IllegalStateException("failed " + key);
                    return List.of(Timestamped.of(in.timestamp(), key));
                }, pool)));
            }
            return CompletableFuture.completedFuture(ops);
        };
        var controller = new AsyncInvocationController<>(
                AsyncInvocationControllerTest.DECODER, fn, sink,
                AsyncNodeConfig.defaults().withMaxWaitingOperations(32).withMaxWaitTime(Duration.ofSeconds(5)));

        Thread invoking = Thread.currentThread();
        for (int r = 0; r < RECORDS; r++) {
            controller.invoke(Signal.ofRaw("r" + r, r + ":v"));
            assertTrue(controller.pendingCount() <= 32 + FANOUT, "forced drains keep the backlog bounded");
        }
        long deadline = System.nanoTime() + Duration.ofSeconds(30).toNanos();
        while (sink.emissions() < RECORDS * FANOUT && System.nanoTime() < deadline) {
            controller.invoke(Signal.tick());
            LockSupport.parkNanos(1_000_000);
        }

        assertEquals(RECORDS * FANOUT, sink.emissions());
        Set<String> seen = new HashSet<>();
        for (CompletionGroup<String> g : sink.succeeded) assertTrue(seen.add(g.handles().get(0)), "duplicate " + g);
        for (CompletionGroup<String> g : sink.failed) assertTrue(seen.add(g.handles().get(0)), "duplicate " + g);
        assertEquals(RECORDS * FANOUT, seen.size());
        assertTrue(sink.threads.stream().allMatch(t -> t == invoking));

        // the last drain can see a completion whose operation was still tracked at the start of the pass
        controller.invoke(Signal.tick());
        assertEquals(0, controller.pendingCount());
        assertEquals(RECORDS * FANOUT, sink.emissions());
    }
}
