package com.hcltech.dawg.tools;

import com.hcltech.dawg.common.errorsor.ErrorsOr;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/** One word per line of a UTF-8 file. Blank lines are skipped. */
public final class FileWordSource implements WordSource {
    private final Path path;

    public FileWordSource(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    @Override
    public ErrorsOr<List<String>> lines() {
        if (!Files.isRegularFile(path)) return ErrorsOr.error("Word file not found: " + path);
        return ErrorsOr.trying("Failed to read words from " + path,
                () -> WordSource.cleanLines(Files.readAllLines(path, StandardCharsets.UTF_8)));
    }

    @Override
    public String toString() {
        return "FileWordSource(" + path + ")";
    }
}
