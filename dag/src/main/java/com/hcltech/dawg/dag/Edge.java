package com.hcltech.dawg.dag;

/** A live edge: source → target under an edge label. */
public record Edge(int source, int target, int label) {
}
