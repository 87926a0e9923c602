package com.sauravcode.script.parser;

/**
 * Outcome of executing a statement. A {@code RETURN} completion stops the enclosing
 * block and is consumed at the nearest user-function call.
 */
public final class Completion {
    public enum Kind { NORMAL, RETURN }

    private static final Completion NORMAL = new Completion(Kind.NORMAL, Value.unit());

    public final Kind kind;
    public final Value value;

    private Completion(Kind kind, Value value) {
        this.kind = kind;
        this.value = value;
    }

    public static Completion normal() { return NORMAL; }

    public static Completion returning(Value value) {
        return new Completion(Kind.RETURN, value);
    }

    public boolean isReturn() { return kind == Kind.RETURN; }
}
