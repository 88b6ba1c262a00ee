package com.hcltech.dawg.dag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merges nodes with identical {@link CanonicalKey}s, turning the trie into a minimal DAWG.
 * <p>
 * Nodes are visited deepest first. A node's children were created deeper than the node itself,
 * so by the time a node's key is computed every child already points at its representative,
 * and a shallow key (label + child ids) is enough to detect equivalent subtrees.
 * <p>
 * The registry is rebuilt on every call, so calling {@link #canonicalize()} again recomputes
 * everything from the current graph and merges nothing new.
 */
public final class DagMinimizer {
    private static final Logger log = LoggerFactory.getLogger(DagMinimizer.class);

    private static final Comparator<GraphNode> DEEPEST_FIRST =
            Comparator.comparingInt(GraphNode::depth).reversed().thenComparingInt(GraphNode::id);

    private final WordGraph graph;
    private Map<CanonicalKey, Integer> registry = Map.of();

    public DagMinimizer(WordGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    /**
     * Merges every redundant node into its representative and seals the graph.
     *
     * @throws DawgInvariantException if a non-root node has no recorded parents
     */
    public MinimizationResult canonicalize() {
        int before = graph.liveCount();
        Map<CanonicalKey, Integer> keys = new HashMap<>();
        keys.put(CanonicalKey.SINK, graph.sink());

        List<GraphNode> order = graph.liveNodes().stream()
                .filter(n -> n.id() != graph.sink())
                .sorted(DEEPEST_FIRST)
                .toList();

        int merged = 0;
        for (GraphNode node : order) {
            if (node.id() != graph.root() && node.parents().isEmpty())
                throw new DawgInvariantException("Node has no parents: " + node);
            Integer representative = keys.putIfAbsent(CanonicalKey.of(node), node.id());
            if (representative != null && representative != node.id()) {
                mergeInto(node, graph.node(representative));
                merged++;
            }
        }
        graph.seal();
        registry = keys;

        MinimizationResult result = new MinimizationResult(before, graph.liveCount(), merged);
        log.info("Canonicalized: {} nodes -> {} nodes ({} merged)", result.nodesBefore(), result.nodesAfter(), merged);
        return result;
    }

    /** Canonical key to representative id, as left by the last {@link #canonicalize()}. */
    public Map<CanonicalKey, Integer> registry() {
        return Collections.unmodifiableMap(registry);
    }

    private void mergeInto(GraphNode duplicate, GraphNode representative) {
        for (int parentId : List.copyOf(duplicate.parents())) {
            int rewritten = graph.node(parentId).redirect(duplicate.id(), representative.id());
            if (rewritten == 0)
                throw new DawgInvariantException("Parent " + parentId + " has no edge to " + duplicate);
            representative.addParent(parentId);
        }
        for (int childId : duplicate.children().values())
            graph.node(childId).removeParent(duplicate.id());
        graph.discard(duplicate.id());
        log.debug("Merged {} into {}", duplicate.id(), representative.id());
    }
}
