package com.codescribe.tracer;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileManager;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Compiles the traced source, and the optional driver, with the Java Compiler API without touching disk.
 *
 * The driver is a block of statements. It is wrapped into {@value #DRIVER_CLASS}.{@value #DRIVER_METHOD}()
 * on its first line so that reported driver line numbers match the text the caller supplied.
 */
public class InMemoryCompiler {

    public static final String DRIVER_CLASS = "__TraceDriver";
    public static final String DRIVER_METHOD = "__run";

    private static final List<String> OPTIONS = List.of("-g", "-proc:none", "-nowarn", "-encoding", "UTF-8");

    private final JavaCompiler compiler;

    public InMemoryCompiler() {
        this.compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            throw new IllegalStateException("No Java compiler available. Are you running on a JDK (not a JRE)?");
        }
    }

    /**
     * @return binary class name to class file bytes, sorted by name
     * @throws CompilationException when either unit fails to compile
     */
    public Map<String, byte[]> compile(String source, String driver) {
        List<JavaFileObject> units = new ArrayList<>();
        units.add(new SourceText("Source", source));
        if (driver != null && !driver.isBlank()) {
            units.add(new SourceText(DRIVER_CLASS, wrapDriver(driver)));
        }

        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        Map<String, byte[]> classes = new TreeMap<>();
        StandardJavaFileManager standard =
            compiler.getStandardFileManager(diagnostics, Locale.ROOT, StandardCharsets.UTF_8);

        boolean ok;
        try (CapturingFileManager fileManager = new CapturingFileManager(standard, classes)) {
            ok = compiler.getTask(null, fileManager, diagnostics, OPTIONS, null, units).call();
        } catch (IOException e) {
            throw new CompilationException("Could not close compiler file manager: " + e.getMessage());
        }

        if (!ok) {
            String errors = diagnostics.getDiagnostics().stream()
                .filter(d -> d.getKind() == Diagnostic.Kind.ERROR)
                .map(InMemoryCompiler::describe)
                .collect(Collectors.joining("; "));
            throw new CompilationException(errors.isEmpty() ? "compilation failed" : errors);
        }
        return classes;
    }

    static String wrapDriver(String driver) {
        return "public class " + DRIVER_CLASS + " { public static void " + DRIVER_METHOD
            + "() throws Throwable { " + driver + "\n}}";
    }

    private static String describe(Diagnostic<? extends JavaFileObject> d) {
        String message = d.getMessage(Locale.ROOT);
        if (d.getSource() != null && d.getLineNumber() != Diagnostic.NOPOS) {
            String label = d.getSource().getName().endsWith(DRIVER_CLASS + ".java") ? "driver" : "source";
            return label + " line " + d.getLineNumber() + ": " + message;
        }
        return message;
    }

    /** Source held in memory. Accepts any public class name, the file name is synthetic. */
    private static final class SourceText extends SimpleJavaFileObject {
        private final String code;

        SourceText(String name, String code) {
            super(URI.create("string:///" + name + Kind.SOURCE.extension), Kind.SOURCE);
            this.code = code;
        }

        @Override
        public CharSequence getCharContent(boolean ignoreEncodingErrors) {
            return code;
        }

        @Override
        public boolean isNameCompatible(String simpleName, Kind kind) {
            return kind == Kind.SOURCE;
        }
    }

    private static final class ClassBytes extends SimpleJavaFileObject {
        private final String className;
        private final Map<String, byte[]> sink;

        ClassBytes(String className, Map<String, byte[]> sink) {
            super(URI.create("mem:///" + className.replace('.', '/') + Kind.CLASS.extension), Kind.CLASS);
            this.className = className;
            this.sink = sink;
        }

        @Override
        public OutputStream openOutputStream() {
            return new ByteArrayOutputStream() {
                @Override
                public void close() throws IOException {
                    super.close();
                    sink.put(className, toByteArray());
                }
            };
        }
    }

    private static final class CapturingFileManager extends ForwardingJavaFileManager<StandardJavaFileManager> {
        private final Map<String, byte[]> sink;

        CapturingFileManager(StandardJavaFileManager delegate, Map<String, byte[]> sink) {
            super(delegate);
            this.sink = sink;
        }

        @Override
        public JavaFileObject getJavaFileForOutput(
                JavaFileManager.Location location, String className, JavaFileObject.Kind kind, FileObject sibling) {
            return new ClassBytes(className, sink);
        }
    }

    public static class CompilationException extends RuntimeException {
        public CompilationException(String msg) { super(msg); }
    }
}
