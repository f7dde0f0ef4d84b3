package com.hcltech.asyncnode.controller;

import com.hcltech.asyncnode.common.codec.Codec;
import com.hcltech.asyncnode.common.errorsor.ErrorsOr;
import com.hcltech.asyncnode.common.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link EmissionSink} for hosts that track inputs: outputs are encoded and emitted (anchored to the
 * group's handles when configured), then every handle in the group is acked. A failed group fails
 * every handle and reports the error once.
 * <p>
 * Outputs of a group are encoded before any is emitted; one bad output fails the whole group, whether
 * the encoder returns an error or throws.
 */
public final class AnchoringEmissionSink<H, Out, RawOut> implements EmissionSink<H, Out> {
    private static final Logger log = LoggerFactory.getLogger(AnchoringEmissionSink.class);

    private final HostCollector<H, RawOut> collector;
    private final Codec<Timestamped<Out>, RawOut> encoder;
    private final boolean anchorOutputs;
    private final boolean hasDependants;
    private final Metrics metrics;

    public AnchoringEmissionSink(HostCollector<H, RawOut> collector,
                                 Codec<Timestamped<Out>, RawOut> encoder,
                                 AsyncNodeConfig config) {
        this(collector, encoder, config.anchorOutputs(), config.hasDependants(), Metrics.nullMetrics);
    }

    public AnchoringEmissionSink(HostCollector<H, RawOut> collector,
                                 Codec<Timestamped<Out>, RawOut> encoder,
                                 boolean anchorOutputs,
                                 boolean hasDependants,
                                 Metrics metrics) {
        this.collector = Objects.requireNonNull(collector, "collector");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.anchorOutputs = anchorOutputs;
        this.hasDependants = hasDependants;
        this.metrics = metrics == null ? Metrics.nullMetrics : metrics;
    }

    @Override
    public void onSuccess(CompletionGroup<H> group, List<Timestamped<Out>> outputs) {
        int emitted = 0;
        if (hasDependants) {
            List<RawOut> encoded = new ArrayList<>(outputs.size());
            for (Timestamped<Out> output : outputs) {
                ErrorsOr<RawOut> eo = ErrorsOr.trying(() -> encoder.encode(output)).flatMap(e -> e);
                if (eo.isError()) {
                    metrics.increment("asyncnode.sink.encode.failed");
                    onFailure(group, new EncodeException(eo.getErrors()));
                    return;
                }
                encoded.add(eo.valueOrThrow());
            }
            List<H> anchors = anchorOutputs ? group.handles() : List.of();
            for (RawOut value : encoded) {
                collector.emit(anchors, value);
            }
            emitted = encoded.size();
        }
        // always ack on completion
        for (H handle : group.handles()) {
            collector.ack(handle);
        }
        metrics.increment("asyncnode.sink.acked.groups");
        log.debug("acked {} inputs, emitted {} outputs", group.size(), emitted);
    }

    @Override
    public void onFailure(CompletionGroup<H> group, Throwable error) {
        for (H handle : group.handles()) {
            collector.fail(handle, error);
        }
        collector.reportError(error);
        metrics.increment("asyncnode.sink.failed.groups");
        log.error("{} inputs failed", group.size(), error);
    }
}
