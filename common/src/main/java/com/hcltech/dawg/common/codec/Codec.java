package com.hcltech.dawg.common.codec;

import com.hcltech.dawg.common.errorsor.ErrorsOr;

/**
 * Two-way conversion where either direction can fail without throwing.
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
        return new JacksonTypedJsonCodec<>(klass);
    }

    static <T> Codec<T, String> prettyClazzCodec(Class<T> klass) {
        return new JacksonTypedJsonCodec<>(klass, true);
    }
}
