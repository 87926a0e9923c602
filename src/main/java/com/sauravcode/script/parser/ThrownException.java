package com.sauravcode.script.parser;

/** Raised by a {@code throw} statement; carries the thrown value. */
public class ThrownException extends SauravRuntimeException {
    private static final long serialVersionUID = 1L;

    private final transient Value value;

    public ThrownException(Value value) {
        super(ValueFormatter.format(value));
        this.value = value;
    }

    public Value getValue() { return value; }
}
