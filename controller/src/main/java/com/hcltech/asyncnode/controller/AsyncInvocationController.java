package com.hcltech.asyncnode.controller;

import com.hcltech.asyncnode.common.codec.Codec;
import com.hcltech.asyncnode.common.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs an {@link AsyncProcessingFunction} inside a host that calls {@link #invoke(Signal)} from one
 * thread at a time, while the operations it starts complete on other threads.
 * <p>
 * Completions are only ever queued by the completing threads. They reach the {@link EmissionSink} in
 * {@link #drainAndEmit()}, which runs at the end of every invocation, ticks included. That is the only
 * place emission happens, so the sink sees a single writer.
 * <p>
 * Dispatch failures (the outer stage failing) are fatal: a failure completion for the triggering group is
 * queued and emitted first, then a {@link DispatchException} is thrown. If the outer stage fails after
 * {@code invoke} returned, the exception is thrown by the next {@code invoke}.
 *
 * @param <H>   opaque source handle
 * @param <Raw> raw input as delivered by the host
 * @param <In>  decoded input
 * @param <Out> output
 */
public final class AsyncInvocationController<H, Raw, In, Out> {
    private static final Logger log = LoggerFactory.getLogger(AsyncInvocationController.class);

    private final Codec<Timestamped<In>, Raw> decoder;
    private final AsyncProcessingFunction<H, In, Out> function;
    private final EmissionSink<H, Out> sink;
    private final AsyncNodeConfig config;
    private final Metrics metrics;

    private final PendingOperations pending = new PendingOperations();
    private final CompletionQueue<H, Out> completions = new CompletionQueue<>();
    private final BackpressureEnforcer enforcer;
    private final AtomicReference<Throwable> lateDispatchFailure = new AtomicReference<>();

    public AsyncInvocationController(Codec<Timestamped<In>, Raw> decoder,
                                     AsyncProcessingFunction<H, In, Out> function,
                                     EmissionSink<H, Out> sink,
                                     AsyncNodeConfig config) {
        this(decoder, function, sink, config, Metrics.nullMetrics);
    }

    public AsyncInvocationController(Codec<Timestamped<In>, Raw> decoder,
                                     AsyncProcessingFunction<H, In, Out> function,
                                     EmissionSink<H, Out> sink,
                                     AsyncNodeConfig config,
                                     Metrics metrics) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.function = Objects.requireNonNull(function, "function");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = metrics == null ? Metrics.nullMetrics : metrics;
        this.enforcer = new BackpressureEnforcer(pending, config.maxWaitingOperations(), config.maxWaitTime(), this.metrics);
    }

    /**
     * Host entry point. Not thread-safe: one call at a time per instance.
     *
     * @throws DecodeException   the record could not be decoded; nothing was dispatched or drained
     * @throws DispatchException the processing function failed outright (now or, late, on an earlier call)
     */
    public void invoke(Signal<H, Raw> signal) {
        Objects.requireNonNull(signal, "signal");
        rethrowLateDispatchFailure();

        final CompletionGroup<H> triggering;
        final CompletableFuture<List<GroupedOperation<H, Out>>> outer;
        if (signal instanceof Signal.RecordSignal<H, Raw> rec) {
            metrics.increment("asyncnode.invoke.record");
            Timestamped<In> input = decode(rec.value());
            triggering = CompletionGroup.of(rec.handle());
            outer = dispatch(() -> function.apply(rec.handle(), input));
        } else {
            metrics.increment("asyncnode.invoke.tick");
            triggering = CompletionGroup.empty();
            outer = dispatch(function::tick);
        }

        DispatchException failure = null;
        try {
            failure = handleDispatch(triggering, outer);
        } finally {
            // always, even on tick: earlier operations may have resolved since the last call
            drainAndEmitKeeping(failure);
        }
        if (failure != null) throw failure;
    }

    /**
     * Forces the backlog down to the threshold, then emits everything queued so far in arrival order.
     * Invoking thread only.
     */
    public void drainAndEmit() {
        enforcer.forceDrain();
        List<Completion<H, Out>> batch = completions.drainAll();
        metrics.histogram("asyncnode.pending.size", pending.size());
        if (batch.isEmpty()) return;

        metrics.histogram("asyncnode.drain.n", batch.size());
        for (int i = 0; i < batch.size(); i++) {
            Completion<H, Out> c = batch.get(i);
            try {
                emit(c);
            } catch (RuntimeException e) {
                // the completion that threw is not retried; later ones wait for the next drain
                completions.requeueFirst(batch.subList(i + 1, batch.size()));
                metrics.increment("asyncnode.emit.threw");
                log.error("Emission sink threw for {}, {} completions kept for the next drain",
                        c.group(), batch.size() - i - 1, e);
                throw e;
            }
        }
    }

    private void emit(Completion<H, Out> c) {
        if (c.isSuccess()) {
            sink.onSuccess(c.group(), c.outputs());
            metrics.increment("asyncnode.emit.success");
        } else {
            sink.onFailure(c.group(), c.error());
            metrics.increment("asyncnode.emit.failure");
        }
    }

    /** A pending dispatch failure wins over an emission failure, which is attached to it as suppressed. */
    private void drainAndEmitKeeping(DispatchException failure) {
        try {
            drainAndEmit();
        } catch (RuntimeException e) {
            if (failure == null) throw e;
            failure.addSuppressed(e);
        }
    }

    /** Operations tracked as unresolved. Invoking thread only. */
    public int pendingCount() {
        return pending.size();
    }

    /** Completions waiting for the next drain. */
    public int queuedCount() {
        return completions.size();
    }

    public AsyncNodeConfig config() {
        return config;
    }

    private Timestamped<In> decode(ReleasableValue<Raw> value) {
        Raw raw = value.consume();
        return decoder.decode(raw).valueOrThrow(errors -> {
            metrics.increment("asyncnode.decode.failed");
            return new DecodeException(errors);
        });
    }

    private CompletableFuture<List<GroupedOperation<H, Out>>> dispatch(
            Supplier<CompletionStage<List<GroupedOperation<H, Out>>>> call) {
        try {
            CompletionStage<List<GroupedOperation<H, Out>>> stage = call.get();
            if (stage == null) {
                return CompletableFuture.failedFuture(new NullPointerException("Processing function returned null"));
            }
            return stage.toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private DispatchException handleDispatch(CompletionGroup<H> triggering,
                                             CompletableFuture<List<GroupedOperation<H, Out>>> outer) {
        if (!outer.isDone()) {
            pending.track(outer.whenComplete((ops, error) -> {
                if (error != null) onLateDispatchFailure(triggering, unwrap(error));
                else register(ops, false);
            }));
            return null;
        }
        Throwable error = outer.handle((ops, e) -> e).join();
        if (error == null) {
            register(outer.join(), true);
            return null;
        }
        Throwable cause = unwrap(error);
        metrics.increment("asyncnode.dispatch.failed");
        log.error("Dispatch failed for {}", triggering, cause);
        completions.offer(Completion.failure(triggering, cause));
        return new DispatchException("Dispatch failed for " + triggering, cause);
    }

    /** May run on any thread when {@code onInvokingThread} is false. */
    private void register(List<GroupedOperation<H, Out>> ops, boolean onInvokingThread) {
        if (ops == null || ops.isEmpty()) return;
        int added = 0;
        for (GroupedOperation<H, Out> op : ops) {
            CompletionGroup<H> group = op.group();
            // track the stage that queues the completion: it resolves only once the completion is queued
            CompletableFuture<?> queued = op.operation().toCompletableFuture()
                    .whenComplete((outs, error) -> completions.offer(error == null
                            ? Completion.success(group, outs)
                            : Completion.failure(group, unwrap(error))));
            if (!queued.isDone()) {
                if (onInvokingThread) pending.track(queued);
                else pending.trackFromAnyThread(queued);
                added++;
            }
        }
        metrics.histogram("asyncnode.dispatch.fanout", ops.size());
        if (onInvokingThread && pending.size() > config.maxWaitingOperations()) {
            // large key expansion; maxWaitingOperations may be too low
            log.debug("Exceeded maxWaitingOperations({}), put {} operations", config.maxWaitingOperations(), added);
        }
    }

    private void onLateDispatchFailure(CompletionGroup<H> triggering, Throwable cause) {
        metrics.increment("asyncnode.dispatch.failed");
        log.error("Dispatch failed late for {}", triggering, cause);
        completions.offer(Completion.failure(triggering, cause));
        lateDispatchFailure.compareAndSet(null, cause);
    }

    private void rethrowLateDispatchFailure() {
        Throwable late = lateDispatchFailure.getAndSet(null);
        if (late == null) return;
        DispatchException failure = new DispatchException("Dispatch failed on an earlier invocation", late);
        drainAndEmitKeeping(failure);
        throw failure;
    }

    static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
