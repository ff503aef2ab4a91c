package com.callplane.applicationd.discovery;

/**
 * Lifecycle of a {@link NodeWatchLoop}.
 */
public enum WatchState {
    /**
     * Loading the initial node set, retried until the catalog answers.
     */
    PRIMING,
    /**
     * Long-polling the catalog for changes.
     */
    POLLING,
    STOPPED
}
