package com.codescribe.tracer;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of one traced execution. A failed result still carries the events recorded before the failure.
 */
public record TraceResult(boolean succeeded, List<TraceEvent> events, String output, String error) {

    static final String FAILURE_PREFIX = "Trace execution failed: ";

    public TraceResult {
        events = List.copyOf(events);
        output = output == null ? "" : output;
    }

    public static TraceResult succeeded(List<TraceEvent> events, String output) {
        return new TraceResult(true, events, output, null);
    }

    public static TraceResult failed(List<TraceEvent> events, String output, String error) {
        return new TraceResult(false, events, output, error);
    }

    /**
     * Text log: one line per event followed by captured output, or a single failure line.
     */
    public String render() {
        if (!succeeded) {
            return FAILURE_PREFIX + error;
        }
        String log = events.stream().map(TraceEvent::render).collect(Collectors.joining("\n"));
        if (!output.isEmpty()) {
            log += "\n\nstdout:\n" + output.strip();
        }
        return log;
    }
}
