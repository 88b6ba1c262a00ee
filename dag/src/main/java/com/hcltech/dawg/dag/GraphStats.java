package com.hcltech.dawg.dag;

public record GraphStats(int liveNodes, int edges, long words) {
}
