package com.hcltech.asyncnode.controller;

import java.util.List;

/**
 * The host's output and acknowledgment port, as used by {@link AnchoringEmissionSink}.
 */
public interface HostCollector<H, RawOut> {

    /** Emit one output. {@code anchors} is empty for unanchored emission. */
    void emit(List<H> anchors, RawOut value);

    void ack(H handle);

    void fail(H handle, Throwable error);

    void reportError(Throwable error);
}
