package com.hcltech.dawg.dag;

public record MinimizationResult(int nodesBefore, int nodesAfter, int merged) {
}
