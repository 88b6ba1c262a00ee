package com.hcltech.dawg.dag;

import com.hcltech.dawg.common.errorsor.ErrorsOr;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Membership queries and word enumeration over the live graph. Works on the raw trie and on the
 * minimized graph alike.
 */
public final class WordEnumerator {
    private final WordGraph graph;

    public WordEnumerator(WordGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    /** The word is normalised first; malformed words are never members. */
    public boolean contains(String word) {
        ErrorsOr<String> normalised = WordNormaliser.normalise(word);
        if (normalised.isError()) return false;
        int current = graph.root();
        for (int codePoint : normalised.valueOrThrow().codePoints().toArray()) {
            Integer next = graph.node(current).child(codePoint);
            if (next == null) return false;
            current = next;
        }
        Integer end = graph.node(current).child(Labels.TERMINATOR);
        return end != null && end == graph.sink();
    }

    /** Every word spelled by a root to sink path, in code point order. */
    public List<String> words() {
        return suffixes(graph.root());
    }

    /** Strings spelled from {@code node} (exclusive) to the sink. The sink's only suffix is "". */
    public List<String> suffixes(int node) {
        List<String> out = new ArrayList<>();
        forward(node, new StringBuilder(), out);
        return out;
    }

    /** Strings spelled from the root to {@code node} (inclusive of its character). The root's only prefix is "". */
    public List<String> prefixes(int node) {
        TreeSet<String> out = new TreeSet<>();
        backward(node, "", out);
        return new ArrayList<>(out);
    }

    /** Every word whose path passes through {@code node}, sorted and distinct. */
    public List<String> wordsThrough(int node) {
        requireLive(node);
        TreeSet<String> out = new TreeSet<>();
        List<String> suffixes = suffixes(node);
        for (String prefix : prefixes(node))
            for (String suffix : suffixes) out.add(prefix + suffix);
        return new ArrayList<>(out);
    }

    /** Number of root to sink paths, counted without enumerating them. */
    public long wordCount() {
        return count(graph.root(), new HashMap<>());
    }

    private long count(int node, Map<Integer, Long> memo) {
        if (node == graph.sink()) return 1;
        Long known = memo.get(node);
        if (known != null) return known;
        long total = 0;
        for (int child : graph.node(node).children().values()) total += count(child, memo);
        memo.put(node, total);
        return total;
    }

    private void forward(int node, StringBuilder prefix, List<String> out) {
        requireLive(node);
        if (node == graph.sink()) {
            out.add(prefix.toString());
            return;
        }
        for (Map.Entry<Integer, Integer> e : graph.node(node).children().entrySet()) {
            int mark = prefix.length();
            if (e.getKey() != Labels.TERMINATOR) prefix.appendCodePoint(e.getKey());
            forward(e.getValue(), prefix, out);
            prefix.setLength(mark);
        }
    }

    private void backward(int node, String suffix, TreeSet<String> out) {
        requireLive(node);
        if (node == graph.root()) {
            out.add(suffix);
            return;
        }
        GraphNode n = graph.node(node);
        String spelled = node == graph.sink() ? suffix : n.name() + suffix;
        for (int parent : n.parents()) backward(parent, spelled, out);
    }

    private void requireLive(int node) {
        if (!graph.isLive(node)) throw new IllegalArgumentException("Node " + node + " is not live");
    }
}
