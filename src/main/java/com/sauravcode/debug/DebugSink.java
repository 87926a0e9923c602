package com.sauravcode.debug;

import java.io.PrintStream;

/** Pluggable debug output target (stderr, a test buffer, a file, ...). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);

    /**
     * Sink writing one line per record to {@code out}, dropping records below {@code minLevel}.
     * The CLI installs one of these on stderr for {@code --debug}.
     */
    static DebugSink stream(PrintStream out, DebugLevel minLevel) {
        return (level, tag, message, error) -> {
            if (!level.atLeast(minLevel)) return;
            out.println("[" + level + "] " + tag + ": " + message);
            if (error != null) error.printStackTrace(out);
        };
    }
}
