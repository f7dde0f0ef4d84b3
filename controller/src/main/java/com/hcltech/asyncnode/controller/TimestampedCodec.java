package com.hcltech.asyncnode.controller;

import com.hcltech.asyncnode.common.codec.Codec;
import com.hcltech.asyncnode.common.errorsor.ErrorsOr;

import java.util.Objects;

/**
 * Lifts a value codec to timestamped values; the timestamp passes through untouched.
 * For hosts that carry event time next to the payload rather than inside it.
 */
public final class TimestampedCodec<T, R> implements Codec<Timestamped<T>, Timestamped<R>> {
    private final Codec<T, R> valueCodec;

    private TimestampedCodec(Codec<T, R> valueCodec) {
        this.valueCodec = Objects.requireNonNull(valueCodec, "valueCodec");
    }

    public static <T, R> Codec<Timestamped<T>, Timestamped<R>> lift(Codec<T, R> valueCodec) {
        return new TimestampedCodec<>(valueCodec);
    }

    @Override
    public ErrorsOr<Timestamped<R>> encode(Timestamped<T> from) {
        return valueCodec.encode(from.value()).map(r -> Timestamped.of(from.timestamp(), r));
    }

    @Override
    public ErrorsOr<Timestamped<T>> decode(Timestamped<R> to) {
        if (to == null) return ErrorsOr.error("Nothing to decode");
        return valueCodec.decode(to.value()).map(t -> Timestamped.of(to.timestamp(), t));
    }
}
