package com.sauravcode.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.sauravcode.debug.Debug;

/**
 * Turns sauravcode source into tokens, synthesizing INDENT/DEDENT from leading
 * whitespace the way Python does.
 *
 * Matching priority matters: two-character operators are tried before their
 * one-character prefixes and keywords before identifiers.
 */
public class Lexer {
    private static final String TAG = "Lexer";
    private static final int TAB_WIDTH = 4;

    private static final Set<String> keywords;
    static {
        Set<String> set = new HashSet<>();
        Collections.addAll(set,
                "function", "return", "class", "int", "float", "bool", "string",
                "if", "else", "for", "in", "while", "try", "catch", "throw", "print",
                "true", "false", "and", "or", "not",
                // collection names are reserved but have no meaning yet
                "list", "set", "map", "stack", "queue",
                "append", "len", "pop");
        keywords = Collections.unmodifiableSet(set);
    }

    /** Annotation keywords the parser drops when they start a statement. */
    public static final Set<String> TYPE_KEYWORDS = Set.of("int", "float", "bool", "string");

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int bracketDepth = 0;

    public Lexer(String source) {
        this.source = source;
    }

    public static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    public List<Token> tokenize() {
        indents.push(0);
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        while (indents.peek() > 0) {
            int popped = indents.pop();
            tokens.add(new Token(TokenType.DEDENT, Integer.toString(popped), line, current - lineStart + 1));
        }
        tokens.add(new Token(TokenType.EOF, "", line, current - lineStart + 1));
        if (Debug.get().enabled()) {
            Debug.get().t(TAG, "produced " + tokens.size() + " tokens over " + line + " line(s)");
        }
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': bracketDepth++; addToken(TokenType.LPAREN); break;
            case ')': closeBracket(); addToken(TokenType.RPAREN); break;
            case '[': bracketDepth++; addToken(TokenType.LBRACKET); break;
            case ']': closeBracket(); addToken(TokenType.RBRACKET); break;
            case '{': bracketDepth++; addToken(TokenType.LBRACE); break;
            case '}': closeBracket(); addToken(TokenType.RBRACE); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case '.': addToken(TokenType.DOT); break;
            case '+': case '-': case '*': case '/': case '%':
                addToken(TokenType.OP);
                break;
            case '=': addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN); break;
            case '<': addToken(match('=') ? TokenType.LTE : TokenType.LT); break;
            case '>': addToken(match('=') ? TokenType.GTE : TokenType.GT); break;
            case '!':
                if (match('=')) addToken(TokenType.NEQ);
                else throw new LexException(c, line, start - lineStart + 1);
                break;
            case '#':
                while (!isAtEnd() && peek() != '\n') advance();
                break;
            case ' ': case '\t': case '\r':
                break;
            case '\n':
                newline();
                break;
            case '"':
                string(TokenType.STRING);
                break;
            default:
                if (c == 'f' && peek() == '"') {
                    advance();
                    string(TokenType.FSTRING);
                } else if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw new LexException(c, line, start - lineStart + 1);
                }
        }
    }

    private void closeBracket() {
        if (bracketDepth > 0) bracketDepth--;
    }

    private void newline() {
        if (bracketDepth > 0) {
            // line breaks inside (), [] and {} are plain whitespace
            line++;
            lineStart = current;
            return;
        }
        tokens.add(new Token(TokenType.NEWLINE, "\n", line, start - lineStart + 1));
        line++;
        lineStart = current;

        int width = nextIndentWidth();
        if (width < 0) return;
        if (width > indents.peek()) {
            indents.push(width);
            tokens.add(new Token(TokenType.INDENT, Integer.toString(width), line, 1));
        }
        while (width < indents.peek()) {
            int popped = indents.pop();
            tokens.add(new Token(TokenType.DEDENT, Integer.toString(popped), line, 1));
        }
    }

    /**
     * Indentation width of the next line that carries code, or -1 when only blank
     * and comment lines remain. Nothing is consumed.
     */
    private int nextIndentWidth() {
        int pos = current;
        while (pos < source.length()) {
            int width = 0;
            while (pos < source.length() && (source.charAt(pos) == ' ' || source.charAt(pos) == '\t')) {
                width += source.charAt(pos) == '\t' ? TAB_WIDTH : 1;
                pos++;
            }
            if (pos >= source.length()) return -1;
            char c = source.charAt(pos);
            if (c == '\r' || c == '\n' || c == '#') {
                while (pos < source.length() && source.charAt(pos) != '\n') pos++;
                pos++;
                continue;
            }
            return width;
        }
        return -1;
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        if (!keywords.contains(text)) {
            addToken(TokenType.IDENT);
            return;
        }
        if (text.equals("else")) {
            // "else if" is a single keyword when both words sit on the same line
            int pos = current;
            while (pos < source.length() && (source.charAt(pos) == ' ' || source.charAt(pos) == '\t')) pos++;
            if (pos > current && source.startsWith("if", pos)
                    && (pos + 2 >= source.length() || !isAlphaNumeric(source.charAt(pos + 2)))) {
                current = pos + 2;
                tokens.add(new Token(TokenType.KEYWORD, "else if", line, start - lineStart + 1));
                return;
            }
        }
        addToken(TokenType.KEYWORD);
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.') {
            advance();
            while (isDigit(peek())) advance();
        }
        addToken(TokenType.NUMBER);
    }

    private void string(TokenType type) {
        while (!isAtEnd() && peek() != '"' && peek() != '\n') {
            if (peek() == '\\' && current + 1 < source.length() && source.charAt(current + 1) != '\n') {
                advance();
            }
            advance();
        }
        if (isAtEnd() || peek() == '\n') {
            throw new LexException("Unterminated string literal on line " + line, '"', line, start - lineStart + 1);
        }
        advance();
        addToken(type);
    }

    /** Resolves backslash escapes in the body of a string literal. */
    static String unescape(String raw) {
        if (raw.indexOf('\\') < 0) return raw;
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c != '\\' || i + 1 >= raw.length()) {
                sb.append(c);
                continue;
            }
            char next = raw.charAt(++i);
            switch (next) {
                case 'n': sb.append('\n'); break;
                case 't': sb.append('\t'); break;
                case 'r': sb.append('\r'); break;
                case '0': sb.append('\0'); break;
                case '\\': sb.append('\\'); break;
                case '"': sb.append('"'); break;
                default: sb.append('\\').append(next);
            }
        }
        return sb.toString();
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }

    private static boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenType type) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, line, start - lineStart + 1));
    }
}
