package com.hcltech.dawg.tools;

import com.hcltech.dawg.common.errorsor.ErrorsOr;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/** One word per line of a classpath resource. */
public final class ClasspathWordSource implements WordSource {
    private final String resourceName;

    public ClasspathWordSource(String resourceName) {
        this.resourceName = Objects.requireNonNull(resourceName, "resourceName");
        if (resourceName.isBlank()) throw new IllegalArgumentException("resourceName cannot be blank");
    }

    @Override
    public ErrorsOr<List<String>> lines() {
        InputStream is = tryLoad(resourceName);
        if (is == null) return ErrorsOr.error("Word resource not found on classpath: " + resourceName);
        return ErrorsOr.trying("Failed to read words from resource " + resourceName, () -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return WordSource.cleanLines(reader.lines().toList());
            }
        });
    }

    private static InputStream tryLoad(String resourceName) {
        String normalized = resourceName.startsWith("/") ? resourceName.substring(1) : resourceName;
        ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        InputStream is = (ctx != null) ? ctx.getResourceAsStream(normalized) : null;
        if (is != null) return is;
        return ClasspathWordSource.class.getClassLoader().getResourceAsStream(normalized);
    }

    @Override
    public String toString() {
        return "ClasspathWordSource(" + resourceName + ")";
    }
}
