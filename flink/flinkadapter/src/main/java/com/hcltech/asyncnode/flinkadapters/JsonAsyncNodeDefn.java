package com.hcltech.asyncnode.flinkadapters;

import com.hcltech.asyncnode.common.codec.Codec;
import com.hcltech.asyncnode.common.codec.JsonCodec;

import java.util.Objects;

/**
 * Base for nodes fed JSON strings, typically straight from a Kafka source.
 */
public abstract class JsonAsyncNodeDefn<In, Out> implements AsyncNodeDefn<String, In, Out> {
    private final JsonCodec<In> decoder;

    protected JsonAsyncNodeDefn(Class<In> inputType) {
        this(JsonCodec.of(inputType));
    }

    protected JsonAsyncNodeDefn(JsonCodec<In> decoder) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    @Override
    public Codec<In, String> decoder() {
        return decoder;
    }
}
