package com.hcltech.asyncnode.controller;

import java.util.Objects;

/**
 * What the host hands to {@link AsyncInvocationController#invoke(Signal)}: either one input record or a tick.
 */
public sealed interface Signal<H, Raw> permits Signal.RecordSignal, Signal.TickSignal {

    /** Stream id the host reserves for periodic ticks. */
    String TICK_STREAM_ID = "__tick";

    static <H, Raw> Signal<H, Raw> record(H handle, ReleasableValue<Raw> value) {
        return new RecordSignal<>(handle, value);
    }

    static <H, Raw> Signal<H, Raw> ofRaw(H handle, Raw raw) {
        return new RecordSignal<>(handle, new HeldValue<>(raw));
    }

    static <H, Raw> Signal<H, Raw> tick() {
        return TickSignal.instance();
    }

    /** Maps a host stream id to a signal: the reserved tick stream yields a tick, anything else a record. */
    static <H, Raw> Signal<H, Raw> fromStream(String streamId, H handle, ReleasableValue<Raw> value) {
        return TICK_STREAM_ID.equals(streamId) ? tick() : record(handle, value);
    }

    record RecordSignal<H, Raw>(H handle, ReleasableValue<Raw> value) implements Signal<H, Raw> {
        public RecordSignal {
            Objects.requireNonNull(handle, "handle");
            Objects.requireNonNull(value, "value");
        }
    }

    final class TickSignal<H, Raw> implements Signal<H, Raw> {
        private static final TickSignal<?, ?> INSTANCE = new TickSignal<>();

        private TickSignal() {
        }

        @SuppressWarnings("unchecked")
        static <H, Raw> TickSignal<H, Raw> instance() {
            return (TickSignal<H, Raw>) INSTANCE;
        }

        @Override
        public String toString() {
            return "Tick";
        }
    }
}
