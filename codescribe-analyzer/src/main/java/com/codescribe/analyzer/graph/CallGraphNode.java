package com.codescribe.analyzer.graph;

import com.google.gson.annotations.SerializedName;

/**
 * One call graph vertex.
 *
 * @param key       qualified identity used by edges: {@code name} in single-file mode,
 *                  {@code path:name} or {@code external::text} in project mode
 * @param diagramId sanitized identifier used in the Mermaid and DOT output
 * @param label     display text
 * @param file      owning file, {@code external} for external nodes, null for single-file definitions
 * @param function  bare method name or callee text
 */
public record CallGraphNode(
        @SerializedName("id")         String key,
        @SerializedName("diagram_id") String diagramId,
        @SerializedName("label")      String label,
        @SerializedName("file")       String file,
        @SerializedName("function")   String function,
        @SerializedName("type")       NodeKind kind
) {
    public static final String EXTERNAL_FILE = "external";
}
