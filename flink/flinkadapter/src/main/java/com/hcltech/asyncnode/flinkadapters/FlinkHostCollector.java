package com.hcltech.asyncnode.flinkadapters;

import com.hcltech.asyncnode.common.metrics.Metrics;
import com.hcltech.asyncnode.controller.HostCollector;
import com.hcltech.asyncnode.controller.Timestamped;
import org.apache.flink.streaming.api.operators.Output;
import org.apache.flink.streaming.runtime.streamrecord.StreamRecord;

import java.util.List;

/**
 * {@link HostCollector} over a Flink operator {@link Output}.
 * <p>
 * Flink has no per-record acknowledgment or lineage: anchors are ignored and acks are only counted.
 * Failed inputs go to {@link AsyncNodeOperator#FAILURES}.
 */
final class FlinkHostCollector<Out> implements HostCollector<InputHandle, Timestamped<Out>> {
    private final Output<StreamRecord<Out>> output;
    private final Metrics metrics;

    FlinkHostCollector(Output<StreamRecord<Out>> output, Metrics metrics) {
        this.output = output;
        this.metrics = metrics == null ? Metrics.nullMetrics : metrics;
    }

    @Override
    public void emit(List<InputHandle> anchors, Timestamped<Out> value) {
        output.collect(value.timestamp() == InputHandle.NO_TIMESTAMP
                ? new StreamRecord<>(value.value())
                : new StreamRecord<>(value.value(), value.timestamp()));
    }

    @Override
    public void ack(InputHandle handle) {
        metrics.increment("asyncnode.flink.acked");
    }

    @Override
    public void fail(InputHandle handle, Throwable error) {
        metrics.increment("asyncnode.flink.failed");
        AsyncNodeFailure failure = AsyncNodeFailure.of(handle, error);
        output.collect(AsyncNodeOperator.FAILURES, handle.hasTimestamp()
                ? new StreamRecord<>(failure, handle.timestamp())
                : new StreamRecord<>(failure));
    }

    @Override
    public void reportError(Throwable error) {
        metrics.increment("asyncnode.flink.errors");
    }
}
