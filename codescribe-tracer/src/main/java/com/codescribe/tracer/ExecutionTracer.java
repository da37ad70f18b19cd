package com.codescribe.tracer;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs user source under line-level instrumentation and returns the recorded variable states.
 *
 * Pipeline: compile in memory, instrument and sandbox-check the bytecode, define the classes in a
 * fresh {@link SandboxClassLoader}, then invoke the entry point on a dedicated worker thread bounded
 * by the configured time and event budgets. Every failure ends up in the returned {@link TraceResult}.
 *
 * Instances are stateless apart from their configuration and may be shared between threads.
 */
public class ExecutionTracer {

    private static final long ABORT_GRACE_MILLIS = 200;
    private static final AtomicInteger WORKER_SEQ = new AtomicInteger();

    private final TracerConfig config;
    private final InMemoryCompiler compiler;
    private final LineHookInstrumenter instrumenter = new LineHookInstrumenter();

    public ExecutionTracer() {
        this(TracerConfig.defaults());
    }

    public ExecutionTracer(TracerConfig config) {
        this.config = config;
        this.compiler = new InMemoryCompiler();
    }

    public TracerConfig config() {
        return config;
    }

    /**
     * @param source full compilation unit to trace
     * @param driver optional statements run after loading the source, may be null or blank
     */
    public TraceResult trace(String source, String driver) {
        boolean hasDriver = driver != null && !driver.isBlank();
        Map<String, byte[]> instrumented;
        try {
            instrumented = instrumenter.instrument(compiler.compile(source, driver));
        } catch (InMemoryCompiler.CompilationException e) {
            return TraceResult.failed(List.of(), "", "compilation error: " + e.getMessage());
        } catch (LineHookInstrumenter.SandboxViolationException e) {
            return TraceResult.failed(List.of(), "", "sandbox violation: " + e.getMessage());
        }

        SandboxClassLoader loader = new SandboxClassLoader(instrumented, ExecutionTracer.class.getClassLoader());
        Method entry;
        try {
            entry = hasDriver ? driverEntry(loader) : mainEntry(loader, instrumented);
        } catch (ReflectiveOperationException | LinkageError e) {
            return TraceResult.failed(List.of(), "", e.toString());
        }
        if (entry == null) {
            return TraceResult.succeeded(List.of(), "");
        }

        TraceSession session = new TraceSession(config);
        Thread worker = new Thread(() -> runEntry(entry, session),
            "codescribe-trace-" + WORKER_SEQ.incrementAndGet());
        worker.setDaemon(true);
        worker.start();
        try {
            worker.join(config.timeoutMillis());
            if (worker.isAlive()) {
                session.abort("Trace exceeded the time budget of " + config.timeoutMillis() + " ms");
                worker.interrupt();
                worker.join(ABORT_GRACE_MILLIS);
                if (worker.isAlive()) {
                    System.err.println("[codescribe] Warning: " + worker.getName() + " did not stop after abort");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            session.abort("Trace interrupted");
            worker.interrupt();
        }

        List<TraceEvent> events = session.events();
        String output = session.capturedOutput();
        if (session.isAborted()) {
            return TraceResult.failed(events, output, session.abortReason());
        }
        if (session.failure() != null) {
            return TraceResult.failed(events, output, session.failure().toString());
        }
        return TraceResult.succeeded(events, output);
    }

    private static void runEntry(Method entry, TraceSession session) {
        LineHook.attach(session);
        try {
            Object[] args = entry.getParameterCount() == 1 ? new Object[]{new String[0]} : new Object[0];
            entry.invoke(null, args);
        } catch (InvocationTargetException e) {
            session.fail(e.getCause());
        } catch (IllegalAccessException | LinkageError e) {
            session.fail(e);
        } finally {
            LineHook.detach();
        }
    }

    private static Method driverEntry(ClassLoader loader) throws ReflectiveOperationException {
        Class<?> driver = loader.loadClass(InMemoryCompiler.DRIVER_CLASS);
        return driver.getMethod(InMemoryCompiler.DRIVER_METHOD);
    }

    /** First class, by name, that declares {@code public static void main(String[])}. */
    private static Method mainEntry(ClassLoader loader, Map<String, byte[]> classes) throws ClassNotFoundException {
        for (String name : classes.keySet()) {
            if (name.equals(InMemoryCompiler.DRIVER_CLASS)) continue;
            Class<?> cls = loader.loadClass(name);
            Method main;
            try {
                main = cls.getDeclaredMethod("main", String[].class);
            } catch (NoSuchMethodException e) {
                continue;
            }
            int mods = main.getModifiers();
            if (Modifier.isStatic(mods) && Modifier.isPublic(mods) && main.getReturnType() == void.class) {
                main.setAccessible(true);
                return main;
            }
        }
        return null;
    }
}
