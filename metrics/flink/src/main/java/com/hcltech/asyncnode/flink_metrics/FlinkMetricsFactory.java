package com.hcltech.asyncnode.flink_metrics;

import org.apache.flink.metrics.MeterView;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

import java.io.Serializable;
import java.util.Objects;

/**
 * Settings for {@link FlinkMetrics}, carried by an operator and applied to its metric group in
 * {@code open()}. Metrics land under {@code node.<nodeName>} of the operator's group.
 *
 * @param histogramWindow number of most recent values each histogram keeps
 * @param meterSeconds    time span of each counter's rate meter; 0 disables meters
 */
public record FlinkMetricsFactory(String nodeName, int maxNames, int histogramWindow, int meterSeconds)
        implements Serializable {

    public FlinkMetricsFactory {
        Objects.requireNonNull(nodeName, "nodeName");
        if (maxNames <= 0) throw new IllegalArgumentException("maxNames must be > 0");
        if (histogramWindow <= 0) throw new IllegalArgumentException("histogramWindow must be > 0");
        if (meterSeconds < 0) throw new IllegalArgumentException("meterSeconds must be >= 0");
    }

    public static FlinkMetricsFactory forNode(String nodeName) {
        return new FlinkMetricsFactory(nodeName, 64, 1024, 0);
    }

    public FlinkMetricsFactory withMeters(int seconds) {
        return new FlinkMetricsFactory(nodeName, maxNames, histogramWindow, seconds);
    }

    public FlinkMetrics create(MetricGroup operatorGroup) {
        return new FlinkMetrics(
                operatorGroup.addGroup("node", nodeName),
                maxNames,
                () -> new DescriptiveStatisticsHistogram(histogramWindow),
                meterSeconds == 0 ? null : counter -> new MeterView(counter, meterSeconds));
    }
}
