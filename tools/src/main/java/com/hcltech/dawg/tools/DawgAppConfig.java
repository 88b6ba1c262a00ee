package com.hcltech.dawg.tools;

import com.hcltech.dawg.common.IEnvGetter;
import com.hcltech.dawg.dag.GraphExporter;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Properties;

/**
 * Settings for {@link DawgApp}. Values come from {@code application.properties} on the classpath;
 * any key can be overridden by an environment variable of the same name upper-cased with dots
 * replaced by underscores ({@code dawg.words.file} → {@code DAWG_WORDS_FILE}).
 *
 * @param wordsFile     file to read words from; takes precedence over {@code wordsResource}
 * @param wordsResource classpath resource to read words from
 * @param outputFile    where the exported graph JSON is written
 * @param maxExportNodes node limit for the export
 * @param progressEvery log insertion progress every this many words, 0 for never
 * @param prettyJson    indent the written JSON
 */
public record DawgAppConfig(
        Optional<Path> wordsFile,
        Optional<String> wordsResource,
        Path outputFile,
        int maxExportNodes,
        int progressEvery,
        boolean prettyJson
) {
    public static final String WORDS_FILE = "dawg.words.file";
    public static final String WORDS_RESOURCE = "dawg.words.resource";
    public static final String OUTPUT_FILE = "dawg.output.file";
    public static final String MAX_EXPORT_NODES = "dawg.export.max.nodes";
    public static final String PROGRESS_EVERY = "dawg.progress.every";
    public static final String PRETTY_JSON = "dawg.output.pretty";

    public DawgAppConfig {
        if (outputFile == null) throw new IllegalArgumentException("outputFile is required");
        if (maxExportNodes < 1) throw new IllegalArgumentException("maxExportNodes must be positive but was " + maxExportNodes);
        if (progressEvery < 0) throw new IllegalArgumentException("progressEvery cannot be negative but was " + progressEvery);
        if (wordsFile.isEmpty() && wordsResource.isEmpty())
            throw new IllegalArgumentException("One of " + WORDS_FILE + " or " + WORDS_RESOURCE + " must be set");
    }

    public WordSource wordSource() {
        return wordsFile.<WordSource>map(FileWordSource::new)
                .orElseGet(() -> new ClasspathWordSource(wordsResource.get()));
    }

    public static DawgAppConfig load() {
        return from(loadApplicationProperties(), IEnvGetter.env);
    }

    public static DawgAppConfig from(Properties app, IEnvGetter env) {
        return new DawgAppConfig(
                Optional.ofNullable(get(WORDS_FILE, app, env, null)).map(Path::of),
                Optional.ofNullable(get(WORDS_RESOURCE, app, env, null)),
                Path.of(get(OUTPUT_FILE, app, env, "dawg_graph.json")),
                getInt(MAX_EXPORT_NODES, app, env, GraphExporter.DEFAULT_MAX_NODES),
                getInt(PROGRESS_EVERY, app, env, 10_000),
                Boolean.parseBoolean(get(PRETTY_JSON, app, env, "true")));
    }

    public static Properties loadApplicationProperties() {
        Properties defaults = new Properties();
        try (InputStream is = DawgAppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (is != null) defaults.load(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load application.properties", e);
        }
        return defaults;
    }

    static String get(String key, Properties app, IEnvGetter env, String defaultValue) {
        String fromProperties = app.getProperty(key);
        String fallback = (fromProperties != null && !fromProperties.isBlank()) ? fromProperties.trim() : defaultValue;
        return IEnvGetter.getStringOr(env, IEnvGetter.envName(key), fallback);
    }

    static int getInt(String key, Properties app, IEnvGetter env, int defaultValue) {
        String value = get(key, app, env, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for " + key + " = '" + value + "'", e);
        }
    }
}
