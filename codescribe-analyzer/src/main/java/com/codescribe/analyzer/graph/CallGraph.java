package com.codescribe.analyzer.graph;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * Result of one call graph build. Never mutated after construction.
 *
 * A graph that failed to parse, or in which no function was found, has no nodes and carries an
 * {@code error} or {@code message}; {@link DiagramRenderer} still renders a placeholder node for it.
 */
public record CallGraph(
        @SerializedName("mode")     String mode,
        @SerializedName("nodes")    List<CallGraphNode> nodes,
        @SerializedName("edges")    List<CallEdge> edges,
        @SerializedName("metadata") GraphMetadata metadata,
        @SerializedName("error")    String error,
        @SerializedName("message")  String message
) {
    public static final String SINGLE = "single";
    public static final String PROJECT = "project";

    public CallGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public static CallGraph failed(String mode, int files, String error) {
        return new CallGraph(mode, List.of(), List.of(), new GraphMetadata(files, 0, 0, 0, null), error, null);
    }

    public static CallGraph empty(String mode, int files, String message) {
        return new CallGraph(mode, List.of(), List.of(), new GraphMetadata(files, 0, 0, 0, null), null, message);
    }

    public boolean isProject() {
        return PROJECT.equals(mode);
    }

    public CallGraph withQueryCount(int count) {
        return new CallGraph(mode, nodes, edges, metadata.withSqlQueries(count), error, message);
    }
}
