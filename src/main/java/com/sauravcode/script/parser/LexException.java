package com.sauravcode.script.parser;

/** A character (or unterminated literal) that matches no token pattern. */
public class LexException extends SauravSyntaxException {
    private static final long serialVersionUID = 1L;

    private final char offending;

    public LexException(char offending, int line, int column) {
        super("Unexpected character '" + offending + "' on line " + line, line, column);
        this.offending = offending;
    }

    public LexException(String message, char offending, int line, int column) {
        super(message, line, column);
        this.offending = offending;
    }

    public char getOffending() { return offending; }
}
