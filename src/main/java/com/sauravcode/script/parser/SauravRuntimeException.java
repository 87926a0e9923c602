package com.sauravcode.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runtime failure of a sauravcode program: type mismatch, undefined name, bad index,
 * division by zero, built-in misuse or an exceeded safety limit. Catchable by
 * {@code try}/{@code catch}.
 */
public class SauravRuntimeException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final List<String> scriptTrace = new ArrayList<>();

    public SauravRuntimeException(String message) {
        super(message);
    }

    public SauravRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Text bound to the catch variable of a {@code try}/{@code catch}. */
    public Value catchValue() {
        return Value.string(getMessage());
    }

    /** User-function calls the error unwound through, innermost first. */
    public List<String> getScriptTrace() {
        return Collections.unmodifiableList(scriptTrace);
    }

    void addScriptFrame(String frame) {
        scriptTrace.add(frame);
    }
}
