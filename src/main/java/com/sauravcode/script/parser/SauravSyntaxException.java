package com.sauravcode.script.parser;

/**
 * Load-time failure from the lexer or parser. Never visible to a sauravcode
 * {@code try}/{@code catch}: only {@link SauravRuntimeException} is.
 */
public class SauravSyntaxException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    public SauravSyntaxException(String message, int line, int column) {
        super("[line " + line + "] " + message);
        this.line = line;
        this.column = column;
    }

    public SauravSyntaxException(String message, Token token) {
        this(message, token.line, token.column);
    }

    public int getLine() { return line; }

    public int getColumn() { return column; }
}
