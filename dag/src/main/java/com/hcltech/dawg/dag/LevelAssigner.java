package com.hcltech.dawg.dag;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Longest-path-from-root levels, for layout only. Kahn's algorithm: every live node is dequeued
 * once, after all of its incoming edges have relaxed its level.
 */
public final class LevelAssigner {
    private final WordGraph graph;

    public LevelAssigner(WordGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    /** @throws IllegalStateException if the live edges contain a cycle */
    public void assignLevels() {
        List<GraphNode> nodes = graph.liveNodes();
        Map<Integer, Integer> indeg = new LinkedHashMap<>();
        for (GraphNode n : nodes) {
            indeg.put(n.id(), 0);
            n.level(0);
        }
        for (GraphNode n : nodes)
            for (int child : n.children().values())
                if (graph.isLive(child)) indeg.merge(child, 1, Integer::sum);

        Deque<Integer> q = new ArrayDeque<>();
        for (var en : indeg.entrySet()) if (en.getValue() == 0) q.add(en.getKey());

        int placed = 0;
        while (!q.isEmpty()) {
            GraphNode n = graph.node(q.poll());
            placed++;
            for (int child : n.children().values()) {
                if (!graph.isLive(child)) continue;
                GraphNode c = graph.node(child);
                c.level(Math.max(c.level(), n.level() + 1));
                if (indeg.merge(child, -1, Integer::sum) == 0) q.add(child);
            }
        }

        if (placed != nodes.size()) {
            Set<Integer> stuck = new LinkedHashSet<>();
            for (var en : indeg.entrySet()) if (en.getValue() > 0) stuck.add(en.getKey());
            throw new IllegalStateException("Cycle detected among nodes: " + stuck);
        }
    }

    /**
     * Live node ids grouped by level; index i holds the nodes on level i.
     *
     * @throws IllegalStateException if levels have not been assigned
     */
    public List<Set<Integer>> nodesByLevel() {
        List<Set<Integer>> levels = new ArrayList<>();
        for (GraphNode n : graph.liveNodes()) {
            if (n.level() < 0) throw new IllegalStateException("Levels have not been assigned (node " + n.id() + ")");
            while (levels.size() <= n.level()) levels.add(new LinkedHashSet<>());
            levels.get(n.level()).add(n.id());
        }
        return levels;
    }
}
