package com.codescribe.analyzer.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link CallGraph} as Mermaid flowchart text and as Graphviz DOT text.
 * Both formats use the node diagram ids, so the two outputs of one graph always agree.
 * Output is a pure function of the graph: identical graphs give byte-identical text.
 */
public final class DiagramRenderer {

    static final String PLACEHOLDER_ID = "placeholder";
    static final String NO_FUNCTIONS = "No functions detected";
    static final String PARSE_FAILED = "Source could not be parsed";

    private DiagramRenderer() {}

    public static String mermaid(CallGraph graph) {
        List<String> lines = new ArrayList<>();
        lines.add(graph.isProject() ? "graph LR" : "graph TD");
        if (graph.nodes().isEmpty()) {
            lines.add(PLACEHOLDER_ID + "[\"" + placeholderLabel(graph) + "\"]");
            return String.join("\n", lines);
        }
        for (CallGraphNode node : graph.nodes()) {
            lines.add(node.diagramId() + "[\"" + node.label().replace('"', '\'') + "\"]");
        }
        Map<String, String> ids = idsByKey(graph);
        for (CallEdge edge : graph.edges()) {
            String src = ids.get(edge.caller());
            String dst = ids.get(edge.callee());
            if (src != null && dst != null) {
                lines.add(src + " --> " + dst);
            }
        }
        return String.join("\n", lines);
    }

    public static String dot(CallGraph graph) {
        List<String> lines = new ArrayList<>();
        lines.add("digraph \"Function Call Graph\" {");
        if (graph.isProject()) {
            lines.add("    rankdir=LR;");
        }
        if (graph.nodes().isEmpty()) {
            lines.add("    " + quote(PLACEHOLDER_ID) + " [label=" + quote(placeholderLabel(graph)) + "];");
        }
        for (CallGraphNode node : graph.nodes()) {
            lines.add("    " + quote(node.diagramId()) + " [label=" + quote(node.label()) + "];");
        }
        Map<String, String> ids = idsByKey(graph);
        for (CallEdge edge : graph.edges()) {
            String src = ids.get(edge.caller());
            String dst = ids.get(edge.callee());
            if (src != null && dst != null) {
                lines.add("    " + quote(src) + " -> " + quote(dst) + ";");
            }
        }
        lines.add("}");
        return String.join("\n", lines);
    }

    private static String placeholderLabel(CallGraph graph) {
        return graph.error() != null ? PARSE_FAILED : NO_FUNCTIONS;
    }

    private static Map<String, String> idsByKey(CallGraph graph) {
        Map<String, String> ids = new HashMap<>();
        for (CallGraphNode node : graph.nodes()) {
            ids.put(node.key(), node.diagramId());
        }
        return ids;
    }

    private static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
