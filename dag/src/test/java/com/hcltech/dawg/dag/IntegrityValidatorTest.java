package com.hcltech.dawg.dag;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hcltech.dawg.dag.TestWordFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class IntegrityValidatorTest {

    @Test
    void builtGraphsAreSound() {
        Dawg dawg = minimized(randomWords(21, 300, "abcde", 6));
        ValidationResult result = dawg.validate();
        assertTrue(result.ok());
        assertEquals(0, result.deadEndCount());
        assertTrue(result.sinkReachable());
        assertEquals(dawg.graph().liveCount(), result.visited());
    }

    @Test
    void rawTrieIsSoundToo() {
        assertTrue(trie("cat", "car", "cats").validate().ok());
    }

    @Test
    void nodeWithNoOutgoingEdgeIsADeadEnd() {
        WordGraph g = trie("cat").graph();
        int stray = g.addChild(walk(g, "ca").id(), 'p', 3);
        ValidationResult result = new IntegrityValidator(g).validate();
        assertFalse(result.ok());
        assertEquals(List.of(stray), result.deadEnds());
        assertTrue(result.sinkReachable());
    }

    @Test
    void edgeToDiscardedNodeIsDangling() {
        WordGraph g = trie("cat", "dog").graph();
        g.discard(walk(g, "do").id());
        ValidationResult result = new IntegrityValidator(g).validate();
        assertFalse(result.ok());
        assertEquals(1, result.danglingEdges());
    }

    @Test
    void emptyGraphHasUnreachableSink() {
        ValidationResult result = new Dawg().validate();
        assertFalse(result.ok());
        assertFalse(result.sinkReachable());
        assertEquals(List.of(0), result.deadEnds());
    }

    @Test
    void validationDoesNotMutate() {
        Dawg dawg = minimized("eat", "seat", "sea");
        List<Edge> edges = dawg.graph().edges();
        dawg.validate();
        dawg.validate();
        assertEquals(edges, dawg.graph().edges());
    }
}
