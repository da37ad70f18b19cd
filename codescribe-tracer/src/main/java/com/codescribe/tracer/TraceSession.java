package com.codescribe.tracer;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-run state: recorded events, captured output and the abort flag.
 *
 * Events are appended by the worker thread only. The coordinating thread reads them after the worker
 * finished, or after a timeout while the worker may still be running, hence the lock.
 */
final class TraceSession {

    private final TracerConfig config;
    private final long deadlineNanos;
    private final List<TraceEvent> events = new ArrayList<>();
    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(captured, true, StandardCharsets.UTF_8);

    private volatile String abortReason;
    private volatile Throwable failure;

    // Only touched by the worker thread.
    private boolean rendering;

    TraceSession(TracerConfig config) {
        this.config = config;
        this.deadlineNanos = System.nanoTime() + config.timeoutMillis() * 1_000_000L;
    }

    void onLine(String origin, int line, String[] names, Object[] values) {
        String reason = abortReason;
        if (reason != null) throw new TraceAbortedError(reason);
        // toString() of traced objects is itself instrumented
        if (rendering) return;

        synchronized (events) {
            if (events.size() >= config.maxEvents()) {
                throw abort("Trace exceeded the limit of " + config.maxEvents() + " line events");
            }
        }
        if (System.nanoTime() - deadlineNanos > 0) {
            throw abort("Trace exceeded the time budget of " + config.timeoutMillis() + " ms");
        }

        Map<String, String> vars = new LinkedHashMap<>();
        rendering = true;
        try {
            for (int i = 0; i < names.length; i++) {
                vars.put(names[i], ValueRenderer.render(values[i], config));
            }
        } finally {
            rendering = false;
        }
        TraceEvent.Origin kind = "driver".equals(origin) ? TraceEvent.Origin.DRIVER : TraceEvent.Origin.SOURCE;
        synchronized (events) {
            events.add(new TraceEvent(kind, line, vars));
        }
    }

    TraceAbortedError abort(String reason) {
        if (abortReason == null) {
            abortReason = reason;
        }
        return new TraceAbortedError(abortReason);
    }

    void fail(Throwable t) {
        failure = t;
    }

    boolean isAborted() { return abortReason != null; }
    String abortReason() { return abortReason; }
    Throwable failure()  { return failure; }
    PrintStream out()    { return out; }

    List<TraceEvent> events() {
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    String capturedOutput() {
        out.flush();
        return captured.toString(StandardCharsets.UTF_8);
    }
}
