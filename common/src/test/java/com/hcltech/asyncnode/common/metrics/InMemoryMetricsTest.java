package com.hcltech.asyncnode.common.metrics;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMetricsTest {

    @Test
    void countsAndRecordsHistograms() {
        InMemoryMetrics m = new InMemoryMetrics();
        m.increment("a");
        m.increment("a");
        m.histogram("h", 3);
        m.histogram("h", 5);

        assertEquals(2, m.counter("a"));
        assertEquals(0, m.counter("missing"));
        assertEquals(List.of(3L, 5L), m.histogramValues("h"));
    }

    @Test
    void nullMetricsIgnoresEverything() {
        assertDoesNotThrow(() -> {
            Metrics.nullMetrics.increment("x");
            Metrics.nullMetrics.histogram("x", 1);
        });
    }
}
