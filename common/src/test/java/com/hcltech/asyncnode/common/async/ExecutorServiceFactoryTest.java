package com.hcltech.asyncnode.common.async;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExecutorServiceFactoryTest {

    @Test
    void fixedPoolUsesNamedDaemonThreads() throws Exception {
        ExecutorServiceFactory f = ExecutorServiceFactory.fixed();
        assertEquals("fixed", f.name());
        ExecutorService pool = f.create(2, "io");
        try {
            Thread t = CompletableFuture.supplyAsync(Thread::currentThread, pool).get(5, TimeUnit.SECONDS);
            assertTrue(t.isDaemon());
            assertTrue(t.getName().startsWith("io-"));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void nullPrefixFallsBackToPool() throws Exception {
        ExecutorService pool = ExecutorServiceFactory.fixed().create(0, null);
        try {
            String name = CompletableFuture.supplyAsync(() -> Thread.currentThread().getName(), pool).get(5, TimeUnit.SECONDS);
            assertEquals("pool-1", name);
        } finally {
            pool.shutdownNow();
        }
    }
}
