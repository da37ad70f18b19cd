package com.codescribe.analyzer;

import com.codescribe.analyzer.graph.CallEdge;
import com.codescribe.analyzer.graph.CallGraph;
import com.codescribe.analyzer.graph.CallGraphNode;
import com.codescribe.analyzer.graph.DiagramRenderer;
import com.codescribe.analyzer.graph.NodeKind;
import com.codescribe.analyzer.static_analysis.ProjectCallGraphBuilder;
import com.codescribe.analyzer.static_analysis.ProjectSourceCollector;
import com.codescribe.analyzer.static_analysis.SourceUnit;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Project graph tests: small in-memory units plus the inventory-app fixture.
 */
class ProjectCallGraphBuilderTest {

    private static final Path FIXTURE_ROOT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/inventory-app");

    private static final String PKG = "src/main/java/com/example/inventory/";

    private static CallGraph fixtureGraph;

    private final ProjectCallGraphBuilder builder = new ProjectCallGraphBuilder();

    @BeforeAll
    static void buildFixtureGraph() {
        List<SourceUnit> units = new ProjectSourceCollector().collect(FIXTURE_ROOT);
        fixtureGraph = new ProjectCallGraphBuilder().build(units);
    }

    @Test
    void crossFileCallResolvesToDefinition() {
        CallGraph graph = builder.build(List.of(
            new SourceUnit("a/Main.java", "class Main { void run() { new Util().help(); } }"),
            new SourceUnit("b/Util.java", "class Util { void help() {} }")));

        assertTrue(graph.edges().contains(new CallEdge("a/Main.java:run", "b/Util.java:help")));
        CallGraphNode help = node(graph, "b/Util.java:help").orElseThrow();
        assertEquals(NodeKind.DEFINED, help.kind());
        assertEquals("b/Util.java", help.file());
        assertEquals("help", help.function());
        assertEquals(CallGraph.PROJECT, graph.mode());
    }

    @Test
    void unresolvedCallBecomesOneSharedExternalNode() {
        CallGraph graph = builder.build(List.of(
            new SourceUnit("A.java", "class A { void a() { Math.max(1, 2); } }"),
            new SourceUnit("B.java", "class B { void b() { Math.max(3, 4); } }")));

        List<CallGraphNode> externals = graph.nodes().stream()
            .filter(n -> n.kind() == NodeKind.EXTERNAL)
            .toList();
        assertEquals(1, externals.size(), externals.toString());
        assertEquals("external::Math.max", externals.get(0).key());
        assertEquals("Math.max", externals.get(0).label());
    }

    @Test
    void sharedExternalHasEdgesFromBothCallers() {
        CallGraph graph = builder.build(List.of(
            new SourceUnit("A.java", "class A { void a() { log(); } }"),
            new SourceUnit("B.java", "class B { void b() { log(); } }")));

        CallGraphNode log = node(graph, "external::log").orElseThrow();
        assertEquals("log", log.label());
        assertEquals("external", log.file());
        assertTrue(graph.edges().contains(new CallEdge("A.java:a", "external::log")));
        assertTrue(graph.edges().contains(new CallEdge("B.java:b", "external::log")));
        assertEquals(1, graph.metadata().externalNodes());
    }

    @Test
    void ambiguousNameFansOutToEveryDefinition() {
        CallGraph graph = builder.build(List.of(
            new SourceUnit("A.java", "class A { void save() {} }"),
            new SourceUnit("B.java", "class B { void save() {} }"),
            new SourceUnit("C.java", "class C { void go(A a) { a.save(); } }")));

        assertTrue(graph.edges().contains(new CallEdge("C.java:go", "A.java:save")));
        assertTrue(graph.edges().contains(new CallEdge("C.java:go", "B.java:save")));
    }

    @Test
    void anonymousClassCallsBelongToEnclosingMethod() {
        CallGraph graph = builder.build(List.of(
            new SourceUnit("A.java",
                "class A { void go() { Runnable r = new Runnable() { public void run() { helper(); } }; r.run(); } }"),
            new SourceUnit("B.java", "class B { void run() {} void helper() {} }")));

        assertFalse(node(graph, "A.java:run").isPresent());
        assertTrue(node(graph, "B.java:run").isPresent());
        assertTrue(graph.edges().contains(new CallEdge("A.java:go", "B.java:helper")));
        assertTrue(graph.edges().contains(new CallEdge("A.java:go", "B.java:run")));
        assertEquals(3, graph.metadata().definedFunctions());
    }

    @Test
    void unparsableFileIsSkipped() {
        CallGraph graph = builder.build(List.of(
            new SourceUnit("Bad.java", "class Bad { void ( }"),
            new SourceUnit("Good.java", "class Good { void ok() {} }")));

        assertNull(graph.error());
        assertEquals(2, graph.metadata().files());
        assertEquals(1, graph.metadata().definedFunctions());
        assertTrue(node(graph, "Good.java:ok").isPresent());
    }

    @Test
    void noUnitsGivesEmptyGraphWithMessage() {
        CallGraph graph = builder.build(List.of());
        assertTrue(graph.nodes().isEmpty());
        assertEquals("No functions detected.", graph.message());
        assertTrue(DiagramRenderer.mermaid(graph).startsWith("graph LR\n"));
    }

    @Test
    void diagramIdsAreUnique() {
        Set<String> ids = fixtureGraph.nodes().stream().map(CallGraphNode::diagramId).collect(Collectors.toSet());
        assertEquals(fixtureGraph.nodes().size(), ids.size());
    }

    // --- inventory-app fixture ---

    @Test
    void fixtureDefinesEveryMethodAndConstructor() {
        assertEquals(4, fixtureGraph.metadata().files());
        assertEquals(12, fixtureGraph.metadata().definedFunctions());
        assertTrue(node(fixtureGraph, PKG + "InventoryService.java:InventoryService").isPresent());
        assertTrue(node(fixtureGraph, PKG + "StockRepository.java:log").isPresent());
    }

    @Test
    void fixtureCrossFileEdges() {
        assertTrue(fixtureGraph.edges().contains(new CallEdge(
            PKG + "InventoryService.java:restock", PKG + "StockRepository.java:updateQuantity")));
        assertTrue(fixtureGraph.edges().contains(new CallEdge(
            PKG + "PriceCalculator.java:total", PKG + "StockRepository.java:findPrice")));
    }

    @Test
    void fixtureSameNamedTotalReceivesBothEdges() {
        String report = PKG + "InventoryService.java:report";
        assertTrue(fixtureGraph.edges().contains(new CallEdge(report, PKG + "PriceCalculator.java:total")));
        assertTrue(fixtureGraph.edges().contains(new CallEdge(report, PKG + "ReportPrinter.java:total")));
    }

    @Test
    void fixturePrintlnIsSharedExternal() {
        String println = "external::System.out.println";
        assertTrue(node(fixtureGraph, println).isPresent());
        assertTrue(fixtureGraph.edges().contains(new CallEdge(PKG + "StockRepository.java:log", println)));
        assertTrue(fixtureGraph.edges().contains(new CallEdge(PKG + "ReportPrinter.java:total", println)));
    }

    @Test
    void fixtureDotUsesLeftToRight() {
        String dot = DiagramRenderer.dot(fixtureGraph);
        assertTrue(dot.startsWith("digraph \"Function Call Graph\" {\n    rankdir=LR;\n"), dot);
        assertTrue(dot.endsWith("}"));
    }

    private static Optional<CallGraphNode> node(CallGraph graph, String key) {
        return graph.nodes().stream().filter(n -> n.key().equals(key)).findFirst();
    }
}
