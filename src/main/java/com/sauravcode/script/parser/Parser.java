package com.sauravcode.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.sauravcode.debug.Debug;
import com.sauravcode.script.parser.Expr.ExprInterface;
import com.sauravcode.script.parser.Statement.ElseIf;
import com.sauravcode.script.parser.Statement.Stmt;

/**
 * Recursive-descent parser for sauravcode.
 *
 * Blocks are delimited by the INDENT/DEDENT tokens the {@link Lexer} synthesizes.
 * Calls take space-separated arguments: {@code add 1 2} rather than {@code add(1, 2)}.
 */
public class Parser {
    private static final String TAG = "Parser";

    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type != TokenType.EOF) {
            List<Token> terminated = new ArrayList<>(tokens);
            Token last = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
            terminated.add(new Token(TokenType.EOF, "", last == null ? 1 : last.line, last == null ? 1 : last.column));
            tokens = terminated;
        }
        this.tokens = tokens;
    }

    public static List<Stmt> parse(List<Token> tokens) {
        return new Parser(tokens).parse();
    }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!isAtEnd()) {
            Stmt stmt = statement();
            if (stmt != null) statements.add(stmt);
        }
        if (Debug.get().enabled()) {
            Debug.get().t(TAG, "parsed " + statements.size() + " top-level statement(s)");
        }
        return statements;
    }

    /**
     * Parses a single expression that must span the whole token list; used for the
     * embedded regions of f-strings.
     */
    ExprInterface parseStandaloneExpression(String context) {
        ExprInterface expr = fullExpression();
        while (check(TokenType.NEWLINE)) advance();
        if (!isAtEnd()) {
            throw error(peek(), "Unexpected " + describe(peek()) + " after expression in " + context);
        }
        return expr;
    }

    // -------------------------
    // Statements
    // -------------------------

    /** One statement, or null for a line that produces none (blank line, stray layout token). */
    private Stmt statement() {
        Token token = peek();

        if (token.type == TokenType.NEWLINE || token.type == TokenType.INDENT || token.type == TokenType.DEDENT) {
            advance();
            return null;
        }

        if (token.type == TokenType.KEYWORD) {
            if (Lexer.TYPE_KEYWORDS.contains(token.lexeme)) {
                // annotations are parsed and dropped: "int x = 5" is "x = 5"
                advance();
                return null;
            }
            switch (token.lexeme) {
                case "function": return functionDefinition();
                case "if":       return ifStatement();
                case "while":    return whileStatement();
                case "for":      return forStatement();
                case "try":      return tryStatement();
                case "return":   return returnStatement();
                case "print": {
                    Token keyword = advance();
                    return new Statement.Print(keyword, fullExpression());
                }
                case "throw": {
                    Token keyword = advance();
                    return new Statement.Throw(keyword, fullExpression());
                }
                case "append": {
                    advance();
                    Token listName = consume(TokenType.IDENT, "list name after 'append'");
                    return new Statement.Append(listName, fullExpression());
                }
                default:
                    break;
            }
        }

        if (token.type == TokenType.IDENT) {
            Token name = advance();
            if (match(TokenType.ASSIGN)) {
                return new Statement.Assignment(name, fullExpression());
            }
            if (match(TokenType.LBRACKET)) {
                ExprInterface index = fullExpression();
                consume(TokenType.RBRACKET, "']' after index");
                consume(TokenType.ASSIGN, "'=' after indexed target");
                return new Statement.IndexedAssignment(name, index, fullExpression());
            }
            return new Statement.CallStmt(callArguments(name));
        }

        throw error(token, "Unknown statement starting with " + describe(token));
    }

    private Stmt functionDefinition() {
        advance();
        Token name = consume(TokenType.IDENT, "function name");
        List<Token> params = new ArrayList<>();
        while (check(TokenType.IDENT)) {
            params.add(advance());
        }
        List<Stmt> body = block();
        return new Statement.FunctionDef(name, params, body);
    }

    private Stmt ifStatement() {
        advance();
        ExprInterface condition = fullExpression();
        List<Stmt> body = block();

        List<ElseIf> elseIfs = new ArrayList<>();
        List<Stmt> elseBody = null;
        skipNewlines();
        while (checkKeyword("else if")) {
            advance();
            ExprInterface elseIfCondition = fullExpression();
            elseIfs.add(new ElseIf(elseIfCondition, block()));
            skipNewlines();
        }
        if (checkKeyword("else")) {
            advance();
            elseBody = block();
        }
        return new Statement.If(condition, body, elseIfs, elseBody);
    }

    private Stmt whileStatement() {
        Token keyword = advance();
        ExprInterface condition = fullExpression();
        return new Statement.While(keyword, condition, block());
    }

    private Stmt forStatement() {
        advance();
        Token var = consume(TokenType.IDENT, "loop variable after 'for'");
        // bounds are atoms, so "for i a b" reads "a b" as a call; write "for i (a) (b)"
        ExprInterface start = atom();
        ExprInterface end = atom();
        return new Statement.ForRange(var, start, end, block());
    }

    private Stmt tryStatement() {
        advance();
        List<Stmt> body = block();
        skipNewlines();
        if (!checkKeyword("catch")) {
            throw error(peek(), "Expected 'catch' after try block, got " + describe(peek()));
        }
        advance();
        Token catchVar = consume(TokenType.IDENT, "error variable after 'catch'");
        return new Statement.TryCatch(body, catchVar, block());
    }

    private Stmt returnStatement() {
        Token keyword = advance();
        ExprInterface value = null;
        if (!check(TokenType.NEWLINE) && !check(TokenType.DEDENT) && !isAtEnd()) {
            value = fullExpression();
        }
        return new Statement.Return(keyword, value);
    }

    /** NEWLINE INDENT statement* DEDENT */
    private List<Stmt> block() {
        consume(TokenType.NEWLINE, "newline before block");
        skipNewlines();
        consume(TokenType.INDENT, "indented block");
        List<Stmt> statements = new ArrayList<>();
        while (!check(TokenType.DEDENT) && !isAtEnd()) {
            Stmt stmt = statement();
            if (stmt != null) statements.add(stmt);
        }
        if (!isAtEnd()) advance();
        return statements;
    }

    // -------------------------
    // Expressions
    // -------------------------

    private ExprInterface fullExpression() {
        return or();
    }

    private ExprInterface or() {
        ExprInterface expr = and();
        while (checkKeyword("or")) {
            Token operator = advance();
            expr = new Expr.Logical(expr, operator, and());
        }
        return expr;
    }

    private ExprInterface and() {
        ExprInterface expr = comparison();
        while (checkKeyword("and")) {
            Token operator = advance();
            expr = new Expr.Logical(expr, operator, comparison());
        }
        return expr;
    }

    private ExprInterface comparison() {
        ExprInterface expr = additive();
        if (match(TokenType.EQ, TokenType.NEQ, TokenType.LT, TokenType.GT, TokenType.LTE, TokenType.GTE)) {
            Token operator = previous();
            expr = new Expr.Compare(expr, operator, additive());
        }
        return expr;
    }

    private ExprInterface additive() {
        ExprInterface expr = multiplicative();
        while (checkOperator("+") || checkOperator("-")) {
            Token operator = advance();
            expr = new Expr.BinaryOp(expr, operator, multiplicative());
        }
        return expr;
    }

    private ExprInterface multiplicative() {
        ExprInterface expr = unary();
        while (checkOperator("*") || checkOperator("/") || checkOperator("%")) {
            Token operator = advance();
            expr = new Expr.BinaryOp(expr, operator, unary());
        }
        return expr;
    }

    private ExprInterface unary() {
        if (checkKeyword("not") || checkOperator("-")) {
            Token operator = advance();
            return new Expr.Unary(operator, unary());
        }
        return postfix();
    }

    private ExprInterface postfix() {
        ExprInterface expr = atom();
        while (check(TokenType.LBRACKET)) {
            Token bracket = advance();
            ExprInterface index = fullExpression();
            consume(TokenType.RBRACKET, "']' after index");
            expr = new Expr.Index(expr, index, bracket);
        }
        return expr;
    }

    private ExprInterface atom() {
        Token token = peek();
        switch (token.type) {
            case NUMBER:
                advance();
                return new Expr.NumberLiteral(Double.parseDouble(token.lexeme));
            case STRING:
                advance();
                return new Expr.StringLiteral(Lexer.unescape(stripQuotes(token.lexeme, 1)));
            case FSTRING:
                advance();
                return FStringParser.parse(token);
            case LPAREN: {
                advance();
                ExprInterface expr = fullExpression();
                consume(TokenType.RPAREN, "')' after expression");
                return expr;
            }
            case LBRACKET:
                return listLiteral();
            case LBRACE:
                return mapLiteral();
            case IDENT: {
                advance();
                if (startsCallArgument(peek())) return callArguments(token);
                return new Expr.Identifier(token);
            }
            case KEYWORD:
                if (token.lexeme.equals("true") || token.lexeme.equals("false")) {
                    advance();
                    return new Expr.BoolLiteral(token.lexeme.equals("true"));
                }
                if (token.lexeme.equals("len")) {
                    advance();
                    return new Expr.Len(token, atom());
                }
                break;
            default:
                break;
        }
        throw error(token, "Unexpected " + describe(token) + " in expression");
    }

    /**
     * Space-separated arguments after a callee name, each one an atom. An argument of
     * {@code not} negates the atom that follows it.
     */
    private Expr.FunctionCall callArguments(Token name) {
        List<ExprInterface> args = new ArrayList<>();
        while (startsCallArgument(peek()) || check(TokenType.LBRACKET)) {
            if (checkKeyword("not")) {
                Token operator = advance();
                args.add(new Expr.Unary(operator, atom()));
            } else {
                args.add(atom());
            }
        }
        return new Expr.FunctionCall(name, args);
    }

    /** Tokens that turn a preceding identifier into a call. {@code [} is indexing instead. */
    private static boolean startsCallArgument(Token token) {
        switch (token.type) {
            case NUMBER:
            case STRING:
            case FSTRING:
            case IDENT:
            case LPAREN:
                return true;
            case KEYWORD:
                switch (token.lexeme) {
                    case "true":
                    case "false":
                    case "not":
                    case "len":
                        return true;
                    default:
                        return false;
                }
            default:
                return false;
        }
    }

    private ExprInterface listLiteral() {
        consume(TokenType.LBRACKET, "'['");
        List<ExprInterface> elements = new ArrayList<>();
        while (!check(TokenType.RBRACKET)) {
            if (isAtEnd()) throw error(peek(), "Expected ']' to close list, got end of input");
            elements.add(fullExpression());
            match(TokenType.COMMA);
        }
        advance();
        return new Expr.ListLiteral(elements);
    }

    private ExprInterface mapLiteral() {
        consume(TokenType.LBRACE, "'{'");
        List<Expr.MapEntry> entries = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            ExprInterface key = fullExpression();
            consume(TokenType.COLON, "':' after map key");
            ExprInterface value = fullExpression();
            entries.add(new Expr.MapEntry(key, value));
            if (!match(TokenType.COMMA)) break;
        }
        consume(TokenType.RBRACE, "'}' to close map");
        return new Expr.MapLiteral(entries);
    }

    // -------------------------
    // Token helpers
    // -------------------------

    static String stripQuotes(String lexeme, int prefixLength) {
        return lexeme.substring(prefixLength, lexeme.length() - 1);
    }

    private void skipNewlines() {
        while (check(TokenType.NEWLINE)) advance();
    }

    private boolean checkKeyword(String word) {
        return peek().isKeyword(word);
    }

    private boolean checkOperator(String op) {
        return peek().is(TokenType.OP, op);
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String expected) {
        if (check(type)) return advance();
        throw error(peek(), "Expected " + expected + ", got " + describe(peek()));
    }

    private boolean check(TokenType type) {
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private static String describe(Token token) {
        switch (token.type) {
            case EOF:     return "end of input";
            case NEWLINE: return "end of line";
            case INDENT:  return "indent";
            case DEDENT:  return "dedent";
            default:      return token.type + " '" + token.lexeme + "'";
        }
    }

    private SauravSyntaxException error(Token token, String message) {
        return new SauravSyntaxException(message, token);
    }
}
