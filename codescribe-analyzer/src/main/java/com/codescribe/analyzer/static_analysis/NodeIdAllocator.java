package com.codescribe.analyzer.static_analysis;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns arbitrary labels into diagram-safe identifiers that are unique within one graph build.
 *
 * {@link #sanitize} is a pure function. {@link #allocate} remembers every label it has seen, so the same
 * label always gets the same id, and two labels that sanitize alike get {@code _2}, {@code _3}, ...
 * suffixes in allocation order. Use one allocator per graph.
 */
public class NodeIdAllocator {

    private static final Pattern NON_WORD = Pattern.compile("\\W+", Pattern.UNICODE_CHARACTER_CLASS);

    private final Map<String, String> idsByLabel = new HashMap<>();
    private final Set<String> used = new HashSet<>();

    public static String sanitize(String label) {
        String sanitized = NON_WORD.matcher(label).replaceAll("_");
        if (!sanitized.isEmpty() && Character.isDigit(sanitized.codePointAt(0))) {
            sanitized = "n_" + sanitized;
        }
        return sanitized.isEmpty() ? "node" : sanitized;
    }

    public String allocate(String label) {
        String existing = idsByLabel.get(label);
        if (existing != null) return existing;

        String base = sanitize(label);
        String id = base;
        int suffix = 1;
        while (used.contains(id)) {
            suffix++;
            id = base + "_" + suffix;
        }
        used.add(id);
        idsByLabel.put(label, id);
        return id;
    }
}
