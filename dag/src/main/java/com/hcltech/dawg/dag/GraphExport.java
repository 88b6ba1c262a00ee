package com.hcltech.dawg.dag;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Node/link projection of the graph for the browser visualizer. Ids are only meaningful within
 * one export. When {@code truncated} is set, {@code totalNodes} is the number of nodes before the
 * cut and every link still refers to exported nodes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"nodes", "links", "totalNodes", "truncated"})
public record GraphExport(List<ExportNode> nodes, List<ExportLink> links, int totalNodes, boolean truncated) {
    public static final int ROOT_ID = 0;

    public GraphExport {
        nodes = List.copyOf(nodes);
        links = List.copyOf(links);
    }

    /**
     * Regenerates the words spelled by root to {@code END} paths in this export, sorted. A
     * truncated export yields only the words whose whole path survived the cut.
     */
    public List<String> words() {
        Map<Integer, List<ExportLink>> outgoing = new HashMap<>();
        for (ExportLink l : links) outgoing.computeIfAbsent(l.source(), k -> new ArrayList<>()).add(l);
        TreeSet<String> words = new TreeSet<>();
        if (!nodes.isEmpty()) collect(ROOT_ID, new StringBuilder(), outgoing, words);
        return new ArrayList<>(words);
    }

    private static void collect(int node, StringBuilder prefix, Map<Integer, List<ExportLink>> outgoing, TreeSet<String> words) {
        for (ExportLink l : outgoing.getOrDefault(node, List.of())) {
            if (Labels.TERMINATOR_NAME.equals(l.label())) {
                words.add(prefix.toString());
            } else {
                int mark = prefix.length();
                prefix.append(l.label());
                collect(l.target(), prefix, outgoing, words);
                prefix.setLength(mark);
            }
        }
    }
}
