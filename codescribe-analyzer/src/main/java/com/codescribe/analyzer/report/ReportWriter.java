package com.codescribe.analyzer.report;

import com.codescribe.analyzer.graph.CallGraph;
import com.codescribe.analyzer.graph.DiagramRenderer;
import com.codescribe.tracer.TraceEvent;
import com.codescribe.tracer.TraceResult;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Writes analysis results into an output directory.
 *
 * JSON goes through Gson with pretty printing; diagrams and trace logs are written as plain UTF-8 text.
 * Every write also refreshes {@code metadata.json} with the command that produced the directory.
 */
public class ReportWriter {

    public static final String TOOL_VERSION = "0.1.0";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private final Path outputDir;

    public ReportWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    public static class ReportWriteException extends RuntimeException {
        public ReportWriteException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Writes {@code call_graph.json}, {@code call_graph.mmd} and {@code call_graph.dot}.
     *
     * @param resolutionNote caveat recorded in the JSON next to the graph, may be null
     */
    public void writeGraph(CallGraph graph, String resolutionNote) {
        writeJson("call_graph.json", new GraphReport(graph, resolutionNote));
        writeText("call_graph.mmd", DiagramRenderer.mermaid(graph) + "\n");
        writeText("call_graph.dot", DiagramRenderer.dot(graph) + "\n");
    }

    /** Writes {@code queries.json}: either a flat list, or one list per file in project mode. */
    public void writeQueries(Object queries) {
        writeJson("queries.json", queries);
    }

    /** Writes the text log to {@code trace.log} and the structured events to {@code trace.json}. */
    public void writeTrace(TraceResult result) {
        writeText("trace.log", result.render() + "\n");
        List<EventReport> events = result.events().stream()
            .map(e -> new EventReport(e.origin() == TraceEvent.Origin.DRIVER ? "driver" : "source", e.line(), e.variables()))
            .toList();
        writeJson("trace.json", new TraceReport(result.succeeded(), result.error(), events, result.output()));
    }

    /** Writes {@code function.txt}. */
    public void writeFunction(String source) {
        writeText("function.txt", source.endsWith("\n") ? source : source + "\n");
    }

    public void writeMetadata(String command) {
        writeJson("metadata.json", new Metadata(command, "java", TOOL_VERSION, Instant.now().toString()));
    }

    public Path outputDir() {
        return outputDir;
    }

    private void writeJson(String fileName, Object value) {
        Path path = prepare(fileName);
        try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(value, w);
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write " + fileName + ": " + e.getMessage(), e);
        }
        System.err.println("[codescribe] " + fileName + " written: " + path);
    }

    private void writeText(String fileName, String text) {
        Path path = prepare(fileName);
        try {
            Files.writeString(path, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write " + fileName + ": " + e.getMessage(), e);
        }
        System.err.println("[codescribe] " + fileName + " written: " + path);
    }

    private Path prepare(String fileName) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new ReportWriteException("Could not create output directory: " + outputDir, e);
        }
        return outputDir.resolve(fileName);
    }

    private record GraphReport(
            @SerializedName("graph")      CallGraph graph,
            @SerializedName("resolution") String resolution
    ) {}

    private record EventReport(
            @SerializedName("origin")    String origin,
            @SerializedName("line")      int line,
            @SerializedName("variables") Map<String, String> variables
    ) {}

    private record TraceReport(
            @SerializedName("succeeded") boolean succeeded,
            @SerializedName("error")     String error,
            @SerializedName("events")    List<EventReport> events,
            @SerializedName("stdout")    String stdout
    ) {}

    private record Metadata(
            @SerializedName("command")      String command,
            @SerializedName("language")     String language,
            @SerializedName("tool_version") String toolVersion,
            @SerializedName("timestamp")    String timestamp
    ) {}
}
