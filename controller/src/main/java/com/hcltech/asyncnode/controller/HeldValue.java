package com.hcltech.asyncnode.controller;

/** In-memory {@link ReleasableValue}. Not thread-safe: owned by the invoking thread. */
public final class HeldValue<Raw> implements ReleasableValue<Raw> {
    private Raw value;
    private boolean consumed;

    public HeldValue(Raw value) {
        this.value = value;
    }

    @Override
    public Raw consume() {
        if (consumed) throw new IllegalStateException("Value already consumed");
        consumed = true;
        Raw result = value;
        value = null;
        return result;
    }

    @Override
    public boolean isConsumed() {
        return consumed;
    }
}
