package com.hcltech.dawg.dag;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"source", "target", "label"})
public record ExportLink(int source, int target, String label) {
}
