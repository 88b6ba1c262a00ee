package com.hcltech.dawg.dag;

import java.util.List;

/**
 * Diagnostic outcome of {@link IntegrityValidator#validate()}.
 *
 * @param deadEnds     ids of reachable non-sink nodes with no outgoing edge
 * @param danglingEdges number of reachable edges that target a discarded node
 * @param visited      number of nodes reached from the root
 */
public record ValidationResult(boolean sinkReachable, List<Integer> deadEnds, int danglingEdges, int visited) {
    public ValidationResult {
        deadEnds = List.copyOf(deadEnds);
    }

    public boolean ok() {
        return sinkReachable && deadEnds.isEmpty() && danglingEdges == 0;
    }

    public int deadEndCount() {
        return deadEnds.size();
    }
}
