package com.codescribe.analyzer.static_analysis;

import com.codescribe.analyzer.graph.CallEdge;
import com.codescribe.analyzer.graph.CallGraph;
import com.codescribe.analyzer.graph.CallGraphNode;
import com.codescribe.analyzer.graph.GraphMetadata;
import com.codescribe.analyzer.graph.NodeKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds the call graph of a single source unit.
 *
 * Nodes are every method/constructor name plus every callee text, so a callee that is never defined
 * still shows up as a leaf. Nodes are ordered by label and edges by (caller, callee), and ids are
 * allocated in node order, which makes the rendered diagrams stable across runs.
 */
public class CallGraphBuilder {

    static final String NO_FUNCTIONS_MESSAGE = "No functions detected.";

    private final JavaSourceParser parser = new JavaSourceParser();

    /** Never throws for bad input: a parse failure yields an empty graph carrying the error. */
    public CallGraph build(String source) {
        JavaSourceParser.ParsedSource parsed;
        try {
            parsed = parser.parse(source);
        } catch (JavaSourceParser.SourceParseException e) {
            return CallGraph.failed(CallGraph.SINGLE, 1, "Failed to parse code: " + e.getMessage());
        }

        EnclosingFunctionVisitor visitor = new EnclosingFunctionVisitor();
        parsed.unit().accept(visitor, null);

        Map<String, SortedSet<String>> adjacency = new TreeMap<>();
        visitor.getCalls().forEach((function, callees) -> {
            SortedSet<String> targets = new TreeSet<>();
            callees.forEach(c -> targets.add(c.text()));
            adjacency.put(function, targets);
        });

        Set<String> universe = new TreeSet<>(adjacency.keySet());
        adjacency.values().forEach(universe::addAll);
        if (universe.isEmpty()) {
            return CallGraph.empty(CallGraph.SINGLE, 1, NO_FUNCTIONS_MESSAGE);
        }

        NodeIdAllocator ids = new NodeIdAllocator();
        List<CallGraphNode> nodes = new ArrayList<>();
        int defined = 0;
        for (String label : universe) {
            boolean isDefined = adjacency.containsKey(label);
            if (isDefined) defined++;
            nodes.add(new CallGraphNode(
                label,
                ids.allocate(label),
                label,
                isDefined ? null : CallGraphNode.EXTERNAL_FILE,
                label,
                isDefined ? NodeKind.DEFINED : NodeKind.EXTERNAL));
        }

        List<CallEdge> edges = new ArrayList<>();
        adjacency.forEach((caller, callees) -> callees.forEach(callee -> edges.add(new CallEdge(caller, callee))));

        GraphMetadata metadata = new GraphMetadata(1, defined, nodes.size() - defined, edges.size(), null);
        return new CallGraph(CallGraph.SINGLE, nodes, edges, metadata, null, null);
    }
}
