package com.sauravcode.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.sauravcode.script.parser.Expr.ExprInterface;

/**
 * Splits an FSTRING token into literal text and embedded expressions.
 *
 * {@code {{} and {@code }}} are literal braces. Each {@code {...}} region is matched
 * depth-aware, then tokenized and parsed as exactly one expression.
 */
final class FStringParser {

    private FStringParser() {}

    static Expr.FStringLiteral parse(Token token) {
        String body = Parser.stripQuotes(token.lexeme, 2);
        List<ExprInterface> parts = new ArrayList<>();
        StringBuilder text = new StringBuilder();

        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '{' && i + 1 < body.length() && body.charAt(i + 1) == '{') {
                text.append('{');
                i += 2;
            } else if (c == '}' && i + 1 < body.length() && body.charAt(i + 1) == '}') {
                text.append('}');
                i += 2;
            } else if (c == '{') {
                int close = matchingBrace(body, i, token);
                String source = body.substring(i + 1, close);
                if (source.trim().isEmpty()) {
                    throw new SauravSyntaxException("Empty expression in f-string", token);
                }
                flushText(text, parts);
                parts.add(embedded(source, token));
                i = close + 1;
            } else if (c == '}') {
                throw new SauravSyntaxException("Unmatched '}' in f-string", token);
            } else {
                text.append(c);
                i++;
            }
        }
        flushText(text, parts);
        return new Expr.FStringLiteral(parts);
    }

    private static int matchingBrace(String body, int open, Token token) {
        int depth = 0;
        for (int j = open; j < body.length(); j++) {
            char c = body.charAt(j);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) return j;
            }
        }
        throw new SauravSyntaxException("Unmatched '{' in f-string", token);
    }

    private static ExprInterface embedded(String source, Token token) {
        List<Token> tokens;
        try {
            tokens = Lexer.tokenize(source);
        } catch (LexException e) {
            throw new SauravSyntaxException("Invalid expression in f-string: " + e.getMessage(), token);
        }
        return new Parser(tokens).parseStandaloneExpression("f-string");
    }

    private static void flushText(StringBuilder text, List<ExprInterface> parts) {
        if (text.length() == 0) return;
        parts.add(new Expr.StringLiteral(Lexer.unescape(text.toString())));
        text.setLength(0);
    }
}
