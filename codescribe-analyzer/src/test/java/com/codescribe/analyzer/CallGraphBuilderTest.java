package com.codescribe.analyzer;

import com.codescribe.analyzer.graph.CallEdge;
import com.codescribe.analyzer.graph.CallGraph;
import com.codescribe.analyzer.graph.CallGraphNode;
import com.codescribe.analyzer.graph.DiagramRenderer;
import com.codescribe.analyzer.graph.NodeKind;
import com.codescribe.analyzer.static_analysis.CallGraphBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CallGraphBuilderTest {

    private static final String DEMO = """
        class Demo {
            void main() {
                helper();
                System.out.println("x");
            }
            void helper() {
                compute(2);
            }
            int compute(int x) {
                return x * 2;
            }
        }
        """;

    private final CallGraphBuilder builder = new CallGraphBuilder();

    @Test
    void nodesCoverDefinitionsAndCallees() {
        CallGraph graph = builder.build(DEMO);

        assertEquals(List.of("System.out.println", "compute", "helper", "main"),
            graph.nodes().stream().map(CallGraphNode::label).toList());
        assertEquals(3, graph.metadata().definedFunctions());
        assertEquals(1, graph.metadata().externalNodes());
        assertNull(graph.error());
        assertEquals(CallGraph.SINGLE, graph.mode());
    }

    @Test
    void edgesAreSortedByCallerThenCallee() {
        CallGraph graph = builder.build(DEMO);

        assertEquals(List.of(
            new CallEdge("helper", "compute"),
            new CallEdge("main", "System.out.println"),
            new CallEdge("main", "helper")
        ), graph.edges());
        assertEquals(3, graph.metadata().edges());
    }

    @Test
    void calleeWithoutDefinitionIsExternal() {
        CallGraph graph = builder.build(DEMO);
        CallGraphNode println = graph.nodes().get(0);
        assertEquals(NodeKind.EXTERNAL, println.kind());
        assertEquals("external", println.file());
        assertEquals("System_out_println", println.diagramId());

        CallGraphNode main = graph.nodes().get(3);
        assertEquals(NodeKind.DEFINED, main.kind());
        assertNull(main.file());
    }

    @Test
    void mermaidOutputIsExact() {
        String expected = String.join("\n",
            "graph TD",
            "System_out_println[\"System.out.println\"]",
            "compute[\"compute\"]",
            "helper[\"helper\"]",
            "main[\"main\"]",
            "helper --> compute",
            "main --> System_out_println",
            "main --> helper");
        assertEquals(expected, DiagramRenderer.mermaid(builder.build(DEMO)));
    }

    @Test
    void repeatedBuildsRenderIdentically() {
        assertEquals(DiagramRenderer.mermaid(builder.build(DEMO)), DiagramRenderer.mermaid(builder.build(DEMO)));
        assertEquals(DiagramRenderer.dot(builder.build(DEMO)), DiagramRenderer.dot(builder.build(DEMO)));
    }

    @Test
    void repeatedCallIsOneEdge() {
        CallGraph graph = builder.build("""
            class A {
                void run() { step(); step(); step(); }
                void step() {}
            }
            """);
        assertEquals(List.of(new CallEdge("run", "step")), graph.edges());
    }

    @Test
    void bareMethodsParseWithoutClass() {
        CallGraph graph = builder.build("void a() { b(); }\nvoid b() {}\n");
        assertNull(graph.error());
        assertEquals(List.of(new CallEdge("a", "b")), graph.edges());
    }

    @Test
    void constructorsAndObjectCreationAreCaptured() {
        CallGraph graph = builder.build("""
            class Shop {
                Shop() { init(); }
                void init() { Cart c = new Cart(); c.clear(); }
            }
            """);
        Set<String> labels = graph.nodes().stream().map(CallGraphNode::label).collect(Collectors.toSet());
        assertEquals(Set.of("Shop", "init", "Cart", "c.clear"), labels);
        assertTrue(graph.edges().contains(new CallEdge("Shop", "init")));
        assertTrue(graph.edges().contains(new CallEdge("init", "Cart")));
    }

    @Test
    void lambdaCallsBelongToEnclosingMethod() {
        CallGraph graph = builder.build("""
            class A {
                void each(java.util.List<String> xs) { xs.forEach(x -> handle(x)); }
                void handle(String x) {}
            }
            """);
        assertTrue(graph.edges().contains(new CallEdge("each", "handle")));
        assertTrue(graph.edges().contains(new CallEdge("each", "xs.forEach")));
    }

    @Test
    void fieldInitializerCallsAreIgnored() {
        CallGraph graph = builder.build("class A { int x = compute(); }");
        assertTrue(graph.nodes().isEmpty());
        assertEquals("No functions detected.", graph.message());
    }

    @Test
    void emptySourceHasNoFunctions() {
        CallGraph graph = builder.build("");
        assertTrue(graph.nodes().isEmpty());
        assertEquals("No functions detected.", graph.message());
        assertEquals("graph TD\nplaceholder[\"No functions detected\"]", DiagramRenderer.mermaid(graph));
    }

    @Test
    void unparsableSourceReportsError() {
        CallGraph graph = builder.build("int broken( {");
        assertNotNull(graph.error());
        assertTrue(graph.error().startsWith("Failed to parse code: "), graph.error());
        assertTrue(graph.nodes().isEmpty());
        assertEquals("graph TD\nplaceholder[\"Source could not be parsed\"]", DiagramRenderer.mermaid(graph));
    }
}
