package com.hcltech.asyncnode.controller;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class AsyncNodeConfigTest {

    @Test
    void defaults() {
        AsyncNodeConfig c = AsyncNodeConfig.defaults();
        assertEquals(10, c.maxWaitingOperations());
        assertEquals(Duration.ofSeconds(60), c.maxWaitTime());
        assertFalse(c.anchorOutputs());
        assertTrue(c.hasDependants());
        assertEquals(Duration.ofSeconds(1), c.tickInterval());
    }

    @Test
    void fromPropertiesOverridesAndFallsBack() {
        Properties p = new Properties();
        p.setProperty("asyncnode.maxWaitingOperations", "3");
        p.setProperty("asyncnode.maxWaitTimeMillis", " 250 ");
        p.setProperty("asyncnode.anchorOutputs", "true");
        p.setProperty("asyncnode.tickIntervalMillis", "");

        AsyncNodeConfig c = AsyncNodeConfig.fromProperties(p);

        assertEquals(3, c.maxWaitingOperations());
        assertEquals(Duration.ofMillis(250), c.maxWaitTime());
        assertTrue(c.anchorOutputs());
        assertTrue(c.hasDependants());
        assertEquals(AsyncNodeConfig.DEFAULT_TICK_INTERVAL, c.tickInterval());
    }

    @Test
    void loadReadsClasspathResource() {
        AsyncNodeConfig c = AsyncNodeConfig.load();
        assertEquals(4, c.maxWaitingOperations());
        assertEquals(Duration.ofMillis(500), c.maxWaitTime());
        assertFalse(c.hasDependants());
        assertEquals(Duration.ofMillis(200), c.tickInterval());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> AsyncNodeConfig.defaults().withMaxWaitingOperations(0));
        assertThrows(IllegalArgumentException.class, () -> AsyncNodeConfig.defaults().withMaxWaitTime(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> AsyncNodeConfig.defaults().withTickInterval(Duration.ofMillis(-1)));
        assertThrows(NullPointerException.class, () -> AsyncNodeConfig.defaults().withMaxWaitTime(null));
    }
}
