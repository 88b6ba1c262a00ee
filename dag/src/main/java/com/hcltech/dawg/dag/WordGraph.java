package com.hcltech.dawg.dag;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;

/**
 * Arena of {@link GraphNode}s addressed by stable int ids, plus the set of ids still live.
 * <p>
 * Ids are never reused: a node discarded by minimization keeps its slot but leaves the live set.
 * Not thread safe; a graph is owned by one builder for the duration of a build.
 */
public final class WordGraph {
    private final List<GraphNode> arena = new ArrayList<>();
    private final BitSet live = new BitSet();
    private final int root;
    private final int sink;
    private boolean sealed;

    public WordGraph() {
        this.root = newNode(Labels.ROOT, 0);
        this.sink = newNode(Labels.SINK, 0);
    }

    public int root() { return root; }

    public int sink() { return sink; }

    public GraphNode node(int id) {
        if (id < 0 || id >= arena.size())
            throw new IllegalArgumentException("No node with id " + id + " (arena size " + arena.size() + ")");
        return arena.get(id);
    }

    public boolean isLive(int id) { return live.get(id); }

    public int liveCount() { return live.cardinality(); }

    /** Live nodes in id order. */
    public List<GraphNode> liveNodes() {
        List<GraphNode> result = new ArrayList<>(live.cardinality());
        for (int id = live.nextSetBit(0); id >= 0; id = live.nextSetBit(id + 1)) result.add(arena.get(id));
        return result;
    }

    /** Every edge whose source is live, in source id then label order. */
    public List<Edge> edges() {
        List<Edge> result = new ArrayList<>();
        for (GraphNode n : liveNodes())
            for (Map.Entry<Integer, Integer> e : n.children().entrySet())
                result.add(new Edge(n.id(), e.getValue(), e.getKey()));
        return result;
    }

    public int edgeCount() {
        int count = 0;
        for (GraphNode n : liveNodes()) count += n.children().size();
        return count;
    }

    /** True once the graph has been canonicalized; no more words may be inserted. */
    public boolean isSealed() { return sealed; }

    void seal() { sealed = true; }

    int addChild(int parentId, int edgeLabel, int depth) {
        GraphNode parent = node(parentId);
        int childId = newNode(edgeLabel, depth);
        parent.putChild(edgeLabel, childId);
        arena.get(childId).addParent(parentId);
        return childId;
    }

    /** Attaches the terminator edge to the sink. Returns false if it was already there. */
    boolean linkTerminator(int nodeId) {
        GraphNode node = node(nodeId);
        Integer previous = node.putChild(Labels.TERMINATOR, sink);
        arena.get(sink).addParent(nodeId);
        return previous == null;
    }

    void discard(int id) {
        if (id == root || id == sink) throw new DawgInvariantException("Attempted to discard " + node(id));
        live.clear(id);
    }

    private int newNode(int label, int depth) {
        int id = arena.size();
        arena.add(new GraphNode(id, label, depth));
        live.set(id);
        return id;
    }
}
