package com.codescribe.analyzer;

import com.codescribe.analyzer.archive.ArchiveSafetyGuard;
import com.codescribe.analyzer.config.AnalyzerSettings;
import com.codescribe.analyzer.config.SettingsReader;
import com.codescribe.analyzer.graph.CallGraph;
import com.codescribe.analyzer.queries.EmbeddedQueryExtractor;
import com.codescribe.analyzer.report.ReportWriter;
import com.codescribe.analyzer.static_analysis.CallGraphBuilder;
import com.codescribe.analyzer.static_analysis.FunctionIsolator;
import com.codescribe.analyzer.static_analysis.ProjectCallGraphBuilder;
import com.codescribe.analyzer.static_analysis.ProjectSourceCollector;
import com.codescribe.analyzer.static_analysis.SourceUnit;
import com.codescribe.tracer.ExecutionTracer;
import com.codescribe.tracer.TraceResult;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Command line entry point.
 *
 * Usage:
 *   java -jar codescribe-analyzer.jar graph   --source <file> --output <dir>
 *   java -jar codescribe-analyzer.jar project (--root <dir> | --archive <zip>) --output <dir>
 *   java -jar codescribe-analyzer.jar queries --source <file> --output <dir>
 *   java -jar codescribe-analyzer.jar trace   --source <file> [--driver <file>] [--settings <json>] --output <dir>
 *   java -jar codescribe-analyzer.jar isolate --source <file> --function <name> --output <dir>
 */
public class AnalyzerMain {

    private static final String USAGE =
        "Usage: java -jar codescribe-analyzer.jar <graph|project|queries|trace|isolate> [flags] --output <dir>";

    private static final Map<String, Set<String>> FLAGS = Map.of(
        "graph",   Set.of("--source", "--output"),
        "project", Set.of("--root", "--archive", "--output"),
        "queries", Set.of("--source", "--output"),
        "trace",   Set.of("--source", "--driver", "--settings", "--output"),
        "isolate", Set.of("--source", "--function", "--output")
    );

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[codescribe] ERROR: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[codescribe] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        String command = args[0];
        Set<String> allowed = FLAGS.get(command);
        if (allowed == null) {
            throw new UsageException("Unknown subcommand: " + command);
        }

        Map<String, String> flags = new HashMap<>();
        for (int i = 1; i < args.length; i++) {
            String flag = args[i];
            if (!allowed.contains(flag)) {
                throw new UsageException("Unknown flag for " + command + ": " + flag);
            }
            flags.put(flag, requireNext(args, i++, flag));
        }
        if (!flags.containsKey("--output")) throw new UsageException("--output is required");

        ReportWriter writer = new ReportWriter(Paths.get(flags.get("--output")));
        switch (command) {
            case "graph"   -> graph(flags, writer);
            case "project" -> project(flags, writer);
            case "queries" -> queries(flags, writer);
            case "trace"   -> trace(flags, writer);
            case "isolate" -> isolate(flags, writer);
            default -> throw new UsageException("Unknown subcommand: " + command);
        }
        writer.writeMetadata(command);
        System.err.println("[codescribe] Done.");
    }

    private static void graph(Map<String, String> flags, ReportWriter writer) {
        Path source = requirePath(flags, "--source");
        System.err.println("[codescribe] Building call graph for: " + source);
        CallGraph graph = new CallGraphBuilder().build(read(source));
        if (graph.error() != null) {
            System.err.println("[codescribe] Warning: " + graph.error());
        }
        writer.writeGraph(graph, null);
    }

    private static void project(Map<String, String> flags, ReportWriter writer) {
        boolean hasRoot = flags.containsKey("--root");
        boolean hasArchive = flags.containsKey("--archive");
        if (hasRoot == hasArchive) {
            throw new UsageException("project needs exactly one of --root or --archive");
        }
        if (hasRoot) {
            analyzeProject(requirePath(flags, "--root"), writer);
            return;
        }

        Path archive = requirePath(flags, "--archive");
        Path workDir;
        try {
            workDir = Files.createTempDirectory("codescribe-upload-");
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create a working directory for " + archive, e);
        }
        try {
            System.err.println("[codescribe] Extracting archive: " + archive);
            new ArchiveSafetyGuard().extract(archive, workDir);
            analyzeProject(workDir, writer);
        } finally {
            deleteTree(workDir);
        }
    }

    private static void analyzeProject(Path root, ReportWriter writer) {
        System.err.println("[codescribe] Collecting sources under: " + root);
        List<SourceUnit> units = new ProjectSourceCollector().collect(root);
        System.err.println("[codescribe] Found " + units.size() + " source files");

        CallGraph graph = new ProjectCallGraphBuilder().build(units);

        EmbeddedQueryExtractor extractor = new EmbeddedQueryExtractor();
        Map<String, List<String>> queriesByFile = new LinkedHashMap<>();
        int total = 0;
        for (SourceUnit unit : units) {
            List<String> found = extractor.extract(unit.text());
            if (!found.isEmpty()) {
                queriesByFile.put(unit.path(), found);
                total += found.size();
            }
        }

        writer.writeGraph(graph.withQueryCount(total), ProjectCallGraphBuilder.RESOLUTION_NOTE);
        writer.writeQueries(queriesByFile);
    }

    private static void queries(Map<String, String> flags, ReportWriter writer) {
        Path source = requirePath(flags, "--source");
        List<String> found = new EmbeddedQueryExtractor().extract(read(source));
        System.err.println("[codescribe] Found " + found.size() + " embedded queries in " + source);
        writer.writeQueries(found);
    }

    private static void trace(Map<String, String> flags, ReportWriter writer) {
        Path source = requirePath(flags, "--source");
        String driver = flags.containsKey("--driver") ? read(Paths.get(flags.get("--driver"))) : null;
        AnalyzerSettings settings = flags.containsKey("--settings")
            ? new SettingsReader().read(Paths.get(flags.get("--settings")))
            : AnalyzerSettings.defaults();

        System.err.println("[codescribe] Tracing: " + source);
        TraceResult result = new ExecutionTracer(settings.toTracerConfig()).trace(read(source), driver);
        if (!result.succeeded()) {
            System.err.println("[codescribe] Warning: trace failed: " + result.error());
        } else {
            System.err.println("[codescribe] Trace complete: " + result.events().size() + " line events");
        }
        writer.writeTrace(result);
    }

    private static void isolate(Map<String, String> flags, ReportWriter writer) {
        Path source = requirePath(flags, "--source");
        if (!flags.containsKey("--function")) throw new UsageException("--function is required");
        String name = flags.get("--function");
        String text = new FunctionIsolator().isolate(read(source), name)
            .orElseThrow(() -> new IllegalArgumentException("No method or constructor named " + name + " in " + source));
        writer.writeFunction(text);
    }

    private static Path requirePath(Map<String, String> flags, String flag) {
        String value = flags.get(flag);
        if (value == null) throw new UsageException(flag + " is required");
        return Paths.get(value);
    }

    private static String read(Path file) {
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + file + ": " + e, e);
        }
    }

    private static void deleteTree(Path root) {
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            System.err.println("[codescribe] Warning: could not clean up " + root + ": " + e.getMessage());
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
