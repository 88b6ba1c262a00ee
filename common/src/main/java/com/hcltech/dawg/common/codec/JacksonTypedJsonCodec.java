package com.hcltech.dawg.common.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.hcltech.dawg.common.errorsor.ErrorsOr;

import java.util.Objects;

public final class JacksonTypedJsonCodec<T> implements Codec<T, String> {
    private final ObjectMapper mapper;
    private final Class<T> klass;

    public JacksonTypedJsonCodec(Class<T> klass) {
        this(new ObjectMapper(), klass, false);
    }

    public JacksonTypedJsonCodec(Class<T> klass, boolean pretty) {
        this(new ObjectMapper(), klass, pretty);
    }

    public JacksonTypedJsonCodec(ObjectMapper baseMapper, Class<T> klass, boolean pretty) {
        this.mapper = Objects.requireNonNull(baseMapper).copy();
        this.mapper.findAndRegisterModules();
        this.mapper.configure(SerializationFeature.INDENT_OUTPUT, pretty);
        this.klass = Objects.requireNonNull(klass);
    }

    @Override
    public ErrorsOr<String> encode(T value) {
        try {
            return ErrorsOr.lift(mapper.writeValueAsString(value));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to encode " + klass.getSimpleName() + " to JSON: " + e.getMessage());
        }
    }

    @Override
    public ErrorsOr<T> decode(String json) {
        if (json == null) return ErrorsOr.error("Failed to decode " + klass.getSimpleName() + " from JSON: input was null");
        try {
            return ErrorsOr.lift(mapper.readValue(json, klass));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to decode " + klass.getSimpleName() + " from JSON: " + e.getMessage());
        }
    }
}
