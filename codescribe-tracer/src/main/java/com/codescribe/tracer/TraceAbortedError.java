package com.codescribe.tracer;

/**
 * Thrown into traced code once its run has been aborted.
 * An Error so that ordinary {@code catch (Exception e)} blocks in user code cannot swallow it.
 */
public class TraceAbortedError extends Error {

    public TraceAbortedError(String reason) {
        super(reason, null, false, false);
    }
}
