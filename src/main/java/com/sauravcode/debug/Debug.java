package com.sauravcode.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub shared by the lexer, parser, interpreter and CLI.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - No-op until a sink is installed, so tracing costs one volatile read
 */
public final class Debug {

    // NOOP must be initialised before INSTANCE, whose constructor reads it
    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // intentionally empty
    };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    /** True once a real sink is installed; callers use it to skip building expensive messages. */
    public boolean enabled() {
        return sinkRef.get() != NOOP;
    }

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sinkRef.get().log(level, tag, message, error);
    }
}
