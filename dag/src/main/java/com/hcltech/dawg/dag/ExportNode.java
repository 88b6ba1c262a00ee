package com.hcltech.dawg.dag;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** An exported vertex. {@code name} is the node's character, {@code ROOT} or {@code END}. */
@JsonPropertyOrder({"id", "name", "level"})
public record ExportNode(int id, String name, int level) {
}
