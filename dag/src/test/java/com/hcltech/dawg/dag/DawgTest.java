package com.hcltech.dawg.dag;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hcltech.dawg.dag.TestWordFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class DawgTest {

    @Test
    void fullPipeline() {
        Dawg dawg = new Dawg();
        InsertSummary summary = dawg.insertAll(List.of("tap", "taps", "top", "tops", "Top", ""));
        assertEquals(new InsertSummary(4, 1, List.of("word 6: Word is empty: ''")), summary);

        MinimizationResult minimized = dawg.canonicalize();
        assertTrue(minimized.nodesAfter() < minimized.nodesBefore());

        dawg.assignLevels();
        assertTrue(dawg.validate().ok());

        GraphExport export = dawg.export();
        assertEquals(List.of("tap", "taps", "top", "tops"), export.words());
        assertEquals(dawg.words(), export.words());
    }

    @Test
    void statsCountLiveNodesEdgesAndWords() {
        Dawg dawg = minimized("eat", "seat");
        // root, sink, s, e, a, t; edges root-e, root-s, s-e, e-a, a-t, t-end
        assertEquals(new GraphStats(6, 6, 2), dawg.stats());
    }

    @Test
    void suffixSharingOutperformsThePlainTrie() {
        List<String> words = randomWords(2024, 1000, "abcdefg", 8);
        Dawg dawg = trie(words.toArray(String[]::new));
        int trieNodes = dawg.graph().liveCount();
        dawg.canonicalize();
        assertTrue(dawg.graph().liveCount() < trieNodes);
        assertNoDuplicateKeys(dawg.graph());
        assertTrue(dawg.validate().ok());
    }
}
