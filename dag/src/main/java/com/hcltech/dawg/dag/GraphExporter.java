package com.hcltech.dawg.dag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Breadth-first projection of the live graph into a {@link GraphExport}. Ids are handed out in
 * discovery order starting with the root at 0, so truncating to the first {@code maxNodes} ids
 * keeps a connected top of the graph.
 */
public final class GraphExporter {
    private static final Logger log = LoggerFactory.getLogger(GraphExporter.class);

    public static final int DEFAULT_MAX_NODES = 5000;

    private final WordGraph graph;

    public GraphExporter(WordGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    public GraphExport export() {
        return export(DEFAULT_MAX_NODES);
    }

    public GraphExport export(int maxNodes) {
        if (maxNodes < 1) throw new IllegalArgumentException("maxNodes must be positive but was " + maxNodes);

        Map<Integer, Integer> ids = new HashMap<>();
        List<ExportNode> nodes = new ArrayList<>();
        List<ExportLink> links = new ArrayList<>();
        Deque<Integer> q = new ArrayDeque<>();

        discover(graph.root(), ids, nodes, q);
        while (!q.isEmpty()) {
            GraphNode n = graph.node(q.poll());
            int source = ids.get(n.id());
            for (Map.Entry<Integer, Integer> e : n.children().entrySet()) {
                int child = e.getValue();
                if (!graph.isLive(child)) continue;
                Integer target = ids.get(child);
                if (target == null) target = discover(child, ids, nodes, q);
                links.add(new ExportLink(source, target, Labels.edgeName(e.getKey())));
            }
        }

        int total = nodes.size();
        if (total <= maxNodes) return new GraphExport(nodes, links, total, false);

        List<ExportLink> kept = links.stream()
                .filter(l -> l.source() < maxNodes && l.target() < maxNodes)
                .toList();
        log.warn("Graph has {} nodes, exporting the first {} and {} of {} links",
                total, maxNodes, kept.size(), links.size());
        return new GraphExport(nodes.subList(0, maxNodes), kept, total, true);
    }

    private int discover(int nodeId, Map<Integer, Integer> ids, List<ExportNode> nodes, Deque<Integer> q) {
        int id = nodes.size();
        ids.put(nodeId, id);
        GraphNode n = graph.node(nodeId);
        nodes.add(new ExportNode(id, n.name(), n.level()));
        q.add(nodeId);
        return id;
    }
}
