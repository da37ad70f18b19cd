package com.codescribe.tracer;

/**
 * Limits applied to one traced execution.
 *
 * @param timeoutMillis          wall-clock budget for the run
 * @param maxEvents              line events recorded before the run is aborted
 * @param renderDepth            object graph depth rendered for a variable, deeper values show the type name
 * @param maxCollectionElements  elements rendered per collection, array or map before truncating
 */
public record TracerConfig(long timeoutMillis, int maxEvents, int renderDepth, int maxCollectionElements) {

    public TracerConfig {
        if (timeoutMillis <= 0) throw new IllegalArgumentException("timeoutMillis must be positive");
        if (maxEvents <= 0) throw new IllegalArgumentException("maxEvents must be positive");
        if (renderDepth < 0) throw new IllegalArgumentException("renderDepth must not be negative");
        if (maxCollectionElements < 0) throw new IllegalArgumentException("maxCollectionElements must not be negative");
    }

    public static TracerConfig defaults() {
        return new TracerConfig(5_000, 10_000, 2, 10);
    }
}
