package com.sauravcode.script.parser;

public enum TokenType {
    // Literals
    NUMBER, STRING, FSTRING,

    // Operators
    ASSIGN, EQ, NEQ, LT, GT, LTE, GTE, OP,

    // Punctuation
    LPAREN, RPAREN, LBRACKET, RBRACKET, LBRACE, RBRACE, COMMA, COLON, DOT,

    KEYWORD, IDENT,

    // Layout
    NEWLINE, INDENT, DEDENT,

    EOF
}
