package com.hcltech.dawg.dag;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shallow structural fingerprint of a node: its label plus its (edge label, child id) pairs in
 * label order. Two nodes with equal keys are interchangeable provided their children are already
 * canonical, which the minimizer's processing order guarantees.
 */
public record CanonicalKey(int label, List<ChildRef> children) {

    public record ChildRef(int edgeLabel, int child) {}

    /** The sink's key. No other node has the sink label, so nothing else can collide with it. */
    public static final CanonicalKey SINK = new CanonicalKey(Labels.SINK, List.of());

    public CanonicalKey {
        children = List.copyOf(children);
    }

    public static CanonicalKey of(GraphNode node) {
        if (node.label() == Labels.SINK) return SINK;
        List<ChildRef> refs = new ArrayList<>(node.children().size());
        for (Map.Entry<Integer, Integer> e : node.children().entrySet())
            refs.add(new ChildRef(e.getKey(), e.getValue()));
        return new CanonicalKey(node.label(), refs);
    }
}
