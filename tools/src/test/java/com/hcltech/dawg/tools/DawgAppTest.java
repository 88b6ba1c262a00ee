package com.hcltech.dawg.tools;

import com.hcltech.dawg.common.errorsor.ErrorsOr;
import com.hcltech.dawg.dag.GraphExport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DawgAppTest {

    @TempDir
    Path dir;

    private DawgAppConfig config(Path words, Path out, int maxNodes) {
        return new DawgAppConfig(Optional.of(words), Optional.empty(), out, maxNodes, 2, false);
    }

    @Test
    void buildsAndWritesTheGraph() throws Exception {
        Path words = Files.writeString(dir.resolve("words.csv"), "eat\nSeat\n\nheat\neat\n");
        Path out = dir.resolve("graph.json");

        assertEquals(0, DawgApp.run(config(words, out, 5000)));

        GraphExport export = new GraphJsonCodec(false).read(out).valueOrThrow();
        assertEquals(List.of("eat", "heat", "seat"), export.words());
        assertFalse(export.truncated());
    }

    @Test
    void truncatesToTheConfiguredLimit() throws Exception {
        Path words = Files.writeString(dir.resolve("words.csv"), "alpha\nbeta\ngamma\n");
        Path out = dir.resolve("graph.json");

        assertEquals(0, DawgApp.run(config(words, out, 3)));

        GraphExport export = new GraphJsonCodec(false).read(out).valueOrThrow();
        assertTrue(export.truncated());
        assertEquals(3, export.nodes().size());
    }

    @Test
    void missingWordFileFails() {
        assertEquals(1, DawgApp.run(config(dir.resolve("none.csv"), dir.resolve("graph.json"), 10)));
        assertFalse(Files.exists(dir.resolve("graph.json")));
    }

    @Test
    void buildUsesEveryWordTheSourceSupplies() {
        WordSource source = mock(WordSource.class);
        when(source.lines()).thenReturn(ErrorsOr.lift(List.of("top", "tops", "stop")));

        GraphExport export = source.lines().flatMap(w -> DawgApp.build(w, config(dir, dir, 100))).valueOrThrow();

        assertEquals(List.of("stop", "top", "tops"), export.words());
        verify(source, times(1)).lines();
    }

    @Test
    void emptyWordListFailsValidation() {
        var result = DawgApp.build(List.of(), config(dir, dir, 100));
        assertTrue(result.isError());
        assertTrue(result.getErrors().get(0).startsWith("Graph failed validation"));
    }
}
