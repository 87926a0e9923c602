package com.sauravcode.debug;

/** Severity levels understood by {@link Debug} and every {@link DebugSink}. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public boolean atLeast(DebugLevel other) {
        return compareTo(other) >= 0;
    }
}
