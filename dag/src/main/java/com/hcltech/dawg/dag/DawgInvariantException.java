package com.hcltech.dawg.dag;

/** The graph is in a state the builder can never produce. Not recoverable. */
public class DawgInvariantException extends IllegalStateException {
    public DawgInvariantException(String message) {
        super(message);
    }
}
