package com.hcltech.asyncnode.flinkadapters;

import com.hcltech.asyncnode.common.async.ExecutorServiceFactory;
import com.hcltech.asyncnode.common.codec.Codec;
import com.hcltech.asyncnode.common.metrics.Metrics;
import com.hcltech.asyncnode.controller.AnchoringEmissionSink;
import com.hcltech.asyncnode.controller.AsyncInvocationController;
import com.hcltech.asyncnode.controller.AsyncNodeConfig;
import com.hcltech.asyncnode.controller.Signal;
import com.hcltech.asyncnode.controller.Timestamped;
import com.hcltech.asyncnode.controller.TimestampedCodec;
import com.hcltech.asyncnode.flink_metrics.FlinkMetricsFactory;
import com.hcltech.asyncnode.flink_metrics.FlinkMetrics;
import org.apache.flink.api.common.operators.ProcessingTimeService;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.streaming.api.operators.AbstractStreamOperator;
import org.apache.flink.streaming.api.operators.OneInputStreamOperator;
import org.apache.flink.streaming.runtime.streamrecord.StreamRecord;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Hosts one {@link AsyncInvocationController} per subtask.
 * <p>
 * Flink calls {@code processElement} and timer callbacks on the single mailbox thread, which gives the
 * controller its one-invocation-at-a-time guarantee. Each element is a record signal; a processing-time
 * timer every {@link AsyncNodeConfig#tickInterval()} is the tick that flushes completions while input is idle.
 * Outputs keep the timestamp they were produced with; failed inputs go to {@link #FAILURES}.
 */
public class AsyncNodeOperator<Raw, In, Out>
        extends AbstractStreamOperator<Out>
        implements OneInputStreamOperator<Raw, Out>,
        ProcessingTimeService.ProcessingTimeCallback {

    private static final Logger log = LoggerFactory.getLogger(AsyncNodeOperator.class);

    public static final OutputTag<AsyncNodeFailure> FAILURES =
            new OutputTag<>("asyncnode-failures", TypeInformation.of(AsyncNodeFailure.class));

    private static final long FINISH_POLL_MILLIS = 5;

    private final AsyncNodeDefn<Raw, In, Out> defn;
    private final AsyncNodeConfig config;
    private final FlinkMetricsFactory metricsFactory; // null: no metrics

    private transient ExecutorService ioPool;
    private transient Metrics metrics;
    private transient AsyncInvocationController<InputHandle, Timestamped<Raw>, In, Out> controller;
    private transient long sequence;
    private transient volatile int lastPending; // for the gauge; the pending set itself is mailbox-thread only

    public AsyncNodeOperator(AsyncNodeDefn<Raw, In, Out> defn, AsyncNodeConfig config) {
        this(defn, config, null);
    }

    public AsyncNodeOperator(AsyncNodeDefn<Raw, In, Out> defn, AsyncNodeConfig config, FlinkMetricsFactory metricsFactory) {
        this.defn = Objects.requireNonNull(defn, "defn");
        this.config = Objects.requireNonNull(config, "config");
        this.metricsFactory = metricsFactory;
    }

    @Override
    public void open() throws Exception {
        super.open();
        int subTask = getRuntimeContext().getTaskInfo().getIndexOfThisSubtask();

        FlinkMetrics flinkMetrics = metricsFactory == null ? null : metricsFactory.create(getMetricGroup());
        this.metrics = flinkMetrics == null ? Metrics.nullMetrics : flinkMetrics;
        this.ioPool = ExecutorServiceFactory.fixed().create(defn.ioThreads(), "asyncnode-io-" + subTask);

        var sink = new AnchoringEmissionSink<InputHandle, Out, Timestamped<Out>>(
                new FlinkHostCollector<>(output, metrics), Codec.identity(),
                config.anchorOutputs(), config.hasDependants(), metrics);
        this.controller = new AsyncInvocationController<>(
                TimestampedCodec.lift(defn.decoder()), defn.createFunction(ioPool), sink, config, metrics);
        this.sequence = 0;
        if (flinkMetrics != null) {
            flinkMetrics.gauge("asyncnode.pending", () -> lastPending);
            flinkMetrics.gauge("asyncnode.queued", controller::queuedCount);
        }

        ProcessingTimeService pts = getProcessingTimeService();
        pts.registerTimer(pts.getCurrentProcessingTime() + config.tickInterval().toMillis(), this);
        log.info("AsyncNodeOperator subtask {} opened with {}", subTask, config);
    }

    @Override
    public void processElement(StreamRecord<Raw> element) throws Exception {
        InputHandle handle = new InputHandle(sequence++,
                element.hasTimestamp() ? element.getTimestamp() : InputHandle.NO_TIMESTAMP);
        controller.invoke(Signal.record(handle, new StreamRecordValue<>(element)));
        lastPending = controller.pendingCount();
    }

    @Override
    public void onProcessingTime(long timestamp) throws Exception {
        controller.invoke(Signal.tick());
        lastPending = controller.pendingCount();
        getProcessingTimeService().registerTimer(timestamp + config.tickInterval().toMillis(), this);
    }

    /**
     * End of a bounded input: keeps ticking until nothing is pending or queued, waiting at most
     * {@code maxWaitTime} in total. Whatever is still unresolved after that is lost, and logged.
     */
    @Override
    public void finish() throws Exception {
        long deadline = System.nanoTime() + config.maxWaitTime().toNanos();
        controller.invoke(Signal.tick());
        while ((controller.pendingCount() > 0 || controller.queuedCount() > 0) && System.nanoTime() < deadline) {
            Thread.sleep(FINISH_POLL_MILLIS);
            controller.invoke(Signal.tick());
        }
        lastPending = controller.pendingCount();
        if (lastPending > 0) {
            log.warn("Input finished with {} operations unresolved after {} ms", lastPending, config.maxWaitTime().toMillis());
        }
        super.finish();
    }

    @Override
    public void close() throws Exception {
        try {
            if (controller != null && controller.pendingCount() > 0) {
                log.warn("Closing with {} operations still pending", controller.pendingCount());
            }
        } finally {
            if (ioPool != null) ioPool.shutdownNow();
            super.close();
        }
    }

    int pendingCount() {
        return controller.pendingCount();
    }
}
