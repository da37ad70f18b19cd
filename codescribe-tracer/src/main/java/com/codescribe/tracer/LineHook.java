package com.codescribe.tracer;

import java.io.OutputStream;
import java.io.PrintStream;

/**
 * Static entry points called from instrumented user code.
 *
 * Each worker thread running a trace attaches its {@link TraceSession} for the duration of the run,
 * so traces on different threads never observe each other. Calls made on a thread without a session
 * (a pool thread reached through a library callback, for example) are ignored.
 *
 * Public because instrumented classes live in another class loader and runtime package.
 */
public final class LineHook {

    private LineHook() {}

    static final String INTERNAL_NAME = "com/codescribe/tracer/LineHook";
    static final String ON_LINE_DESCRIPTOR = "(Ljava/lang/String;I[Ljava/lang/String;[Ljava/lang/Object;)V";
    static final String STREAM_DESCRIPTOR = "()Ljava/io/PrintStream;";
    static final String CHECK_ABORT_DESCRIPTOR = "()V";

    private static final ThreadLocal<TraceSession> current = new ThreadLocal<>();

    private static final PrintStream DISCARD = new PrintStream(OutputStream.nullOutputStream());

    static void attach(TraceSession session) {
        if (current.get() != null) {
            throw new IllegalStateException("A trace session is already attached to " + Thread.currentThread().getName());
        }
        current.set(session);
    }

    static void detach() {
        current.remove();
    }

    static TraceSession session() {
        return current.get();
    }

    public static void onLine(String origin, int line, String[] names, Object[] values) {
        TraceSession session = current.get();
        if (session == null) return;
        session.onLine(origin, line, names, values);
    }

    /** Called on entry to every exception handler. Rethrows the abort if the run was aborted meanwhile. */
    public static void checkAbort() {
        TraceSession session = current.get();
        if (session != null && session.isAborted()) {
            throw new TraceAbortedError(session.abortReason());
        }
    }

    /** Replacement for {@code System.out} inside traced code. */
    public static PrintStream stdout() {
        TraceSession session = current.get();
        return session != null ? session.out() : DISCARD;
    }

    /** Replacement for {@code System.err} inside traced code. Shares the capture buffer with stdout. */
    public static PrintStream stderr() {
        return stdout();
    }
}
