package com.hcltech.asyncnode.controller;

/**
 * A raw input value owned by the host. {@link #consume()} hands it over exactly once and drops the
 * host's reference, so the host does not keep the payload alive after decoding.
 */
public interface ReleasableValue<Raw> {

    /**
     * @return the raw value
     * @throws IllegalStateException if already consumed
     */
    Raw consume();

    boolean isConsumed();
}
