package com.hcltech.dawg.tools;

import com.hcltech.dawg.common.codec.Codec;
import com.hcltech.dawg.common.errorsor.ErrorsOr;
import com.hcltech.dawg.dag.GraphExport;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes and reads the {@code {nodes, links}} JSON the browser visualizer loads.
 */
public final class GraphJsonCodec implements Codec<GraphExport, String> {
    private final Codec<GraphExport, String> json;

    public GraphJsonCodec(boolean pretty) {
        this.json = pretty ? Codec.prettyClazzCodec(GraphExport.class) : Codec.clazzCodec(GraphExport.class);
    }

    @Override
    public ErrorsOr<String> encode(GraphExport export) {
        return json.encode(export);
    }

    @Override
    public ErrorsOr<GraphExport> decode(String text) {
        return json.decode(text);
    }

    public ErrorsOr<Path> write(GraphExport export, Path path) {
        return encode(export).mapTry("Failed to write graph to " + path, text -> {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            return Files.writeString(path, text, StandardCharsets.UTF_8);
        });
    }

    public ErrorsOr<GraphExport> read(Path path) {
        return ErrorsOr.trying("Failed to read graph from " + path, () -> Files.readString(path, StandardCharsets.UTF_8))
                .flatMap(this::decode);
    }
}
