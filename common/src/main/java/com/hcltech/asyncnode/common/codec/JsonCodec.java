package com.hcltech.asyncnode.common.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hcltech.asyncnode.common.errorsor.ErrorsOr;

import java.io.Serializable;
import java.util.Objects;

/**
 * JSON text codec for one class, for string-typed wire records (Kafka values, test fixtures).
 * <p>
 * Serializable so it can sit inside a job definition that is shipped to the workers; the
 * {@link ObjectMapper} is not shipped and is built on first use. Unknown properties are ignored
 * unless {@link #strict()} is used.
 */
public final class JsonCodec<T> implements Codec<T, String>, Serializable {
    private final Class<T> type;
    private final boolean failOnUnknownProperties;
    private transient ObjectMapper mapper;

    private JsonCodec(Class<T> type, boolean failOnUnknownProperties) {
        this.type = Objects.requireNonNull(type, "type");
        this.failOnUnknownProperties = failOnUnknownProperties;
    }

    public static <T> JsonCodec<T> of(Class<T> type) {
        return new JsonCodec<>(type, false);
    }

    /** A copy that rejects properties {@code T} does not declare. */
    public JsonCodec<T> strict() {
        return new JsonCodec<>(type, true);
    }

    public Class<T> type() {
        return type;
    }

    @Override
    public ErrorsOr<String> encode(T value) {
        if (value == null) return ErrorsOr.error("Cannot encode null " + type.getSimpleName() + " as JSON");
        try {
            return ErrorsOr.lift(mapper().writeValueAsString(value));
        } catch (JsonProcessingException e) {
            return ErrorsOr.error("Cannot encode " + type.getSimpleName() + " as JSON: " + e.getOriginalMessage());
        }
    }

    @Override
    public ErrorsOr<T> decode(String json) {
        if (json == null) return ErrorsOr.error("Cannot decode " + type.getSimpleName() + " from null");
        try {
            T value = mapper().readValue(json, type);
            if (value == null) return ErrorsOr.error("Cannot decode " + type.getSimpleName() + " from JSON null");
            return ErrorsOr.lift(value);
        } catch (JsonProcessingException e) {
            return ErrorsOr.error("Cannot decode " + type.getSimpleName() + " from JSON: " + e.getOriginalMessage());
        }
    }

    private ObjectMapper mapper() {
        if (mapper == null) {
            mapper = new ObjectMapper()
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, failOnUnknownProperties);
        }
        return mapper;
    }

    @Override
    public String toString() {
        return "JsonCodec(" + type.getSimpleName() + (failOnUnknownProperties ? ", strict" : "") + ")";
    }
}
