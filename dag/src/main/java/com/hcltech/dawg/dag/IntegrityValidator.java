package com.hcltech.dawg.dag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Walks the live graph from the root and reports paths that can never reach the sink.
 * Read only; a broken graph is reported, not thrown.
 */
public final class IntegrityValidator {
    private static final Logger log = LoggerFactory.getLogger(IntegrityValidator.class);

    private final WordGraph graph;

    public IntegrityValidator(WordGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    public ValidationResult validate() {
        BitSet visited = new BitSet();
        Deque<Integer> q = new ArrayDeque<>();
        List<Integer> deadEnds = new ArrayList<>();
        int dangling = 0;
        boolean sinkReachable = false;

        visited.set(graph.root());
        q.add(graph.root());
        while (!q.isEmpty()) {
            GraphNode n = graph.node(q.poll());
            if (n.id() == graph.sink()) {
                sinkReachable = true;
                continue;
            }
            if (n.isLeaf()) deadEnds.add(n.id());
            for (int child : n.children().values()) {
                if (!graph.isLive(child)) {
                    dangling++;
                } else if (!visited.get(child)) {
                    visited.set(child);
                    q.add(child);
                }
            }
        }

        ValidationResult result = new ValidationResult(sinkReachable, deadEnds, dangling, visited.cardinality());
        if (!result.ok())
            log.warn("Integrity check failed: sinkReachable={} deadEnds={} danglingEdges={}",
                    sinkReachable, deadEnds, dangling);
        return result;
    }
}
