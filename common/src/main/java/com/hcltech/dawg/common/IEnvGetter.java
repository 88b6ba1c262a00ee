package com.hcltech.dawg.common;

import java.util.Locale;

/**
 * Abstraction for reading environment variables.
 * <p>
 * Used to avoid direct calls to {@link System#getenv(String)} in code,
 * so that unit tests can provide their own environment source.
 */
@FunctionalInterface
public interface IEnvGetter {
    /**
     * Default implementation backed by {@link System#getenv(String)}.
     */
    IEnvGetter env = System::getenv;

    /**
     * Returns the value of the given environment variable, or {@code null} if unset.
     */
    String get(String name);

    /**
     * Maps a dotted property key to its environment variable name: {@code dawg.words.file -> DAWG_WORDS_FILE}.
     */
    static String envName(String propertyKey) {
        return propertyKey.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
    }

    static String getStringOr(IEnvGetter env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }
}
