package com.hcltech.dawg.dag;

/**
 * Node and edge labels are Unicode code points. Negative values are reserved markers.
 */
public final class Labels {
    private Labels() {}

    /** Edge label linking a word's last node to the sink. */
    public static final int TERMINATOR = -1;
    /** Node label of the root. */
    public static final int ROOT = -2;
    /** Node label of the shared end node. */
    public static final int SINK = -3;

    public static final String ROOT_NAME = "ROOT";
    public static final String SINK_NAME = "END";
    public static final String TERMINATOR_NAME = "<END>";

    public static String nodeName(int label) {
        if (label == ROOT) return ROOT_NAME;
        if (label == SINK) return SINK_NAME;
        return new String(Character.toChars(label));
    }

    public static String edgeName(int label) {
        return label == TERMINATOR ? TERMINATOR_NAME : new String(Character.toChars(label));
    }
}
