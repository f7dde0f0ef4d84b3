package com.hcltech.asyncnode.flink_metrics;

import com.hcltech.asyncnode.common.metrics.Metrics;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Gauge;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.Meter;
import org.apache.flink.metrics.MetricGroup;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.function.IntSupplier;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * {@link Metrics} on a Flink {@link MetricGroup}.
 * <p>
 * Dotted names become nested groups, so {@code asyncnode.backpressure.timeout} is the counter
 * {@code timeout} in group {@code asyncnode} / {@code backpressure} and reporters see the same
 * hierarchy the controller uses. Counters can carry a {@code <name>PerSecond} meter. Metrics are
 * registered on first use and the number of distinct names is capped.
 */
public final class FlinkMetrics implements Metrics {
    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9_-]+(\\.[A-Za-z0-9_-]+)*");

    private final MetricGroup root;
    private final int maxNames;
    private final Supplier<Histogram> histogramFactory;
    private final Function<Counter, Meter> meterFactory; // null: no meters

    private final ConcurrentMap<String, MetricGroup> groups = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();
    private final Set<String> names = ConcurrentHashMap.newKeySet();

    public FlinkMetrics(MetricGroup root, int maxNames,
                        Supplier<Histogram> histogramFactory,
                        Function<Counter, Meter> meterFactory) {
        if (maxNames <= 0) throw new IllegalArgumentException("maxNames must be > 0");
        this.root = Objects.requireNonNull(root, "root");
        this.maxNames = maxNames;
        this.histogramFactory = Objects.requireNonNull(histogramFactory, "histogramFactory");
        this.meterFactory = meterFactory;
    }

    @Override
    public void increment(String name) {
        counters.computeIfAbsent(name, this::newCounter).inc();
    }

    @Override
    public void histogram(String name, long value) {
        histograms.computeIfAbsent(name, this::newHistogram).update(value);
    }

    /** Registers a gauge read by the reporter thread; {@code value} must be safe to call from it. */
    public void gauge(String name, IntSupplier value) {
        admit(name);
        groupOf(name).gauge(leafOf(name), (Gauge<Integer>) value::getAsInt);
    }

    private Counter newCounter(String name) {
        admit(name);
        MetricGroup group = groupOf(name);
        String leaf = leafOf(name);
        Counter counter = group.counter(leaf);
        if (meterFactory != null) {
            group.meter(leaf + "PerSecond", meterFactory.apply(counter));
        }
        return counter;
    }

    private Histogram newHistogram(String name) {
        admit(name);
        return groupOf(name).histogram(leafOf(name), histogramFactory.get());
    }

    private void admit(String name) {
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Bad metric name: " + name);
        }
        if (names.add(name) && names.size() > maxNames) {
            names.remove(name);
            throw new IllegalStateException("Too many distinct metric names (> " + maxNames + "), rejected " + name);
        }
    }

    private MetricGroup groupOf(String name) {
        int dot = name.lastIndexOf('.');
        if (dot < 0) return root;
        return groups.computeIfAbsent(name.substring(0, dot), path -> {
            MetricGroup group = root;
            for (String part : path.split("\\.")) {
                group = group.addGroup(part);
            }
            return group;
        });
    }

    private static String leafOf(String name) {
        return name.substring(name.lastIndexOf('.') + 1);
    }
}
