package com.sauravcode.script.parser;

import java.util.Objects;

public class Token {
    public final TokenType type;
    public final String lexeme;
    public final int line;
    public final int column;

    public Token(TokenType type, String lexeme, int line, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.line = line;
        this.column = column;
    }

    public boolean is(TokenType type, String lexeme) {
        return this.type == type && this.lexeme.equals(lexeme);
    }

    public boolean isKeyword(String word) {
        return is(TokenType.KEYWORD, word);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token other = (Token) o;
        return type == other.type && line == other.line && column == other.column && lexeme.equals(other.lexeme);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, lexeme, line, column);
    }

    @Override
    public String toString() {
        return type + " '" + lexeme + "' at " + line + ":" + column;
    }
}
