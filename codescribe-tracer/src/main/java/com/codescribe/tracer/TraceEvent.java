package com.codescribe.tracer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Snapshot of the visible locals taken just before a line executes.
 * Variables keep declaration (slot) order.
 */
public record TraceEvent(Origin origin, int line, Map<String, String> variables) {

    public enum Origin {
        SOURCE, DRIVER
    }

    public TraceEvent {
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public String render() {
        String prefix = origin == Origin.DRIVER ? "Driver line " : "Line ";
        String vars = variables.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining(", ", "{", "}"));
        return prefix + line + ": " + vars;
    }
}
