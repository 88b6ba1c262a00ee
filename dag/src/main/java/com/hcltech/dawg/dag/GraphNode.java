package com.hcltech.dawg.dag;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * A vertex in the {@link WordGraph} arena. Children and parents are arena ids, never references.
 * <p>
 * Children are kept sorted by edge label so that anything derived from them (canonical keys,
 * exports, word enumeration) is deterministic regardless of insertion order.
 */
public final class GraphNode {
    private final int id;
    private final int label;
    private final int depth;
    private final NavigableMap<Integer, Integer> children = new TreeMap<>();
    private final Set<Integer> parents = new LinkedHashSet<>();
    private int level = -1;

    GraphNode(int id, int label, int depth) {
        this.id = id;
        this.label = label;
        this.depth = depth;
    }

    public int id() { return id; }

    public int label() { return label; }

    /** Length of the path this node was created on. Fixed for the node's lifetime. */
    public int depth() { return depth; }

    /** Longest path from the root, or -1 before levels have been assigned. */
    public int level() { return level; }

    /** Edge label to child id, sorted by label. */
    public Map<Integer, Integer> children() { return Collections.unmodifiableMap(children); }

    public Set<Integer> parents() { return Collections.unmodifiableSet(parents); }

    public Integer child(int edgeLabel) { return children.get(edgeLabel); }

    public boolean isLeaf() { return children.isEmpty(); }

    public String name() { return Labels.nodeName(label); }

    void level(int level) { this.level = level; }

    /** @return the previous child under this label, or null */
    Integer putChild(int edgeLabel, int childId) {
        return children.put(edgeLabel, childId);
    }

    /** Points every edge that targets {@code from} at {@code to} instead. Returns the number of edges rewritten. */
    int redirect(int from, int to) {
        int rewritten = 0;
        for (Map.Entry<Integer, Integer> e : children.entrySet()) {
            if (e.getValue() == from) {
                e.setValue(to);
                rewritten++;
            }
        }
        return rewritten;
    }

    boolean addParent(int parentId) { return parents.add(parentId); }

    boolean removeParent(int parentId) { return parents.remove(parentId); }

    @Override
    public String toString() {
        return "GraphNode(" + id + ", '" + name() + "', depth=" + depth + ", children=" + children + ")";
    }
}
