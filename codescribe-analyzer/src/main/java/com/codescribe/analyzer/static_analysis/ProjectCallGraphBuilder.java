package com.codescribe.analyzer.static_analysis;

import com.codescribe.analyzer.graph.CallEdge;
import com.codescribe.analyzer.graph.CallGraph;
import com.codescribe.analyzer.graph.CallGraphNode;
import com.codescribe.analyzer.graph.GraphMetadata;
import com.codescribe.analyzer.graph.NodeKind;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.CallableDeclaration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds one call graph across many source units.
 *
 * Pass 1 records every method and constructor of a named type as a defined node keyed {@code path:name}
 * (anonymous and local class bodies count as part of their enclosing member) and indexes
 * bare names to keys. Pass 2 walks the same trees and resolves each call by its invoked name against
 * that index. Resolution is textual and best effort: a name defined in several files gets an edge to
 * every one of them, and a name defined nowhere becomes a single shared external node.
 */
public class ProjectCallGraphBuilder {

    public static final String RESOLUTION_NOTE =
        "Calls are resolved by method name only; same-named methods in different files all receive an edge.";

    private static final String EXTERNAL_PREFIX = "external::";

    private final JavaSourceParser parser = new JavaSourceParser();

    private record Definition(String path, String name) {}

    public CallGraph build(List<SourceUnit> units) {
        // 1. Definition pass
        Map<String, CompilationUnit> parsed = new LinkedHashMap<>();
        Map<String, Definition> definitions = new TreeMap<>();
        Map<String, SortedSet<String>> keysByName = new TreeMap<>();

        for (SourceUnit unit : units) {
            CompilationUnit cu;
            try {
                cu = parser.parse(unit.text()).unit();
            } catch (JavaSourceParser.SourceParseException e) {
                System.err.println("[codescribe] Warning: skipping " + unit.path() + ": " + firstLine(e.getMessage()));
                continue;
            }
            parsed.put(unit.path(), cu);
            List<CallableDeclaration> members = cu.findAll(CallableDeclaration.class, EnclosingFunctionVisitor::isTypeMember);
            for (CallableDeclaration<?> callable : members) {
                String name = callable.getNameAsString();
                String key = qualify(unit.path(), name);
                definitions.put(key, new Definition(unit.path(), name));
                keysByName.computeIfAbsent(name, k -> new TreeSet<>()).add(key);
            }
        }

        // 2. Reference pass
        Set<CallEdge> edges = new TreeSet<>();
        Map<String, String> externals = new TreeMap<>();
        for (Map.Entry<String, CompilationUnit> entry : parsed.entrySet()) {
            String path = entry.getKey();
            EnclosingFunctionVisitor visitor = new EnclosingFunctionVisitor(name -> qualify(path, name), true);
            entry.getValue().accept(visitor, null);

            visitor.getCalls().forEach((caller, callees) -> {
                for (Callee callee : callees) {
                    SortedSet<String> targets = keysByName.get(callee.name());
                    if (targets != null) {
                        targets.forEach(target -> edges.add(new CallEdge(caller, target)));
                    } else {
                        String externalKey = EXTERNAL_PREFIX + callee.text();
                        externals.putIfAbsent(externalKey, callee.text());
                        edges.add(new CallEdge(caller, externalKey));
                    }
                }
            });
        }

        // 3. Nodes in key order, ids allocated in the same order
        Map<String, CallGraphNode> nodes = new TreeMap<>();
        definitions.forEach((key, def) ->
            nodes.put(key, new CallGraphNode(key, null, key, def.path(), def.name(), NodeKind.DEFINED)));
        externals.forEach((key, text) ->
            nodes.put(key, new CallGraphNode(key, null, text, CallGraphNode.EXTERNAL_FILE, text, NodeKind.EXTERNAL)));

        NodeIdAllocator ids = new NodeIdAllocator();
        List<CallGraphNode> ordered = new ArrayList<>();
        for (CallGraphNode node : nodes.values()) {
            ordered.add(new CallGraphNode(node.key(), ids.allocate(node.key()), node.label(),
                node.file(), node.function(), node.kind()));
        }

        System.err.println("[codescribe] Project graph: " + definitions.size() + " defined, "
            + externals.size() + " external, " + edges.size() + " edges");
        GraphMetadata metadata = new GraphMetadata(units.size(), definitions.size(), externals.size(), edges.size(), null);
        String message = ordered.isEmpty() ? CallGraphBuilder.NO_FUNCTIONS_MESSAGE : null;
        return new CallGraph(CallGraph.PROJECT, ordered, new ArrayList<>(edges), metadata, null, message);
    }

    static String qualify(String path, String name) {
        return path + ":" + name;
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return newline < 0 ? text : text.substring(0, newline);
    }
}
