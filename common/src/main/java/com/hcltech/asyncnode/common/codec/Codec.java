package com.hcltech.asyncnode.common.codec;

import com.hcltech.asyncnode.common.errorsor.ErrorsOr;

/**
 * Two-way conversion between a domain type and its wire form.
 * Failures are returned as {@link ErrorsOr} errors, never thrown.
 */
public interface Codec<From, To> {

    ErrorsOr<To> encode(From from);

    ErrorsOr<From> decode(To to);

    default Codec<To, From> invert() {
        return new Codec<To, From>() {
            @Override
            public ErrorsOr<From> encode(To p) {
                return Codec.this.decode(p);
            }

            @Override
            public ErrorsOr<To> decode(From from) {
                return Codec.this.encode(from);
            }
        };
    }

    static <T> Codec<T, String> clazzCodec(Class<T> klass) {
        return JsonCodec.of(klass);
    }

    /** Identity codec, for hosts whose wire form is already the domain type. Null is an error both ways. */
    static <T> Codec<T, T> identity() {
        return new Codec<>() {
            @Override
            public ErrorsOr<T> encode(T t) {
                return t == null ? ErrorsOr.error("Cannot encode null") : ErrorsOr.lift(t);
            }

            @Override
            public ErrorsOr<T> decode(T t) {
                return t == null ? ErrorsOr.error("Cannot decode null") : ErrorsOr.lift(t);
            }
        };
    }
}
