import org.junit.jupiter.api.Test;

import com.sauravcode.script.parser.LexException;
import com.sauravcode.script.parser.Lexer;
import com.sauravcode.script.parser.Token;
import com.sauravcode.script.parser.TokenType;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SauravLexerTest {

    private static List<TokenType> types(String source) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : Lexer.tokenize(source)) out.add(t.type);
        return out;
    }

    private static long count(List<Token> tokens, TokenType type) {
        return tokens.stream().filter(t -> t.type == type).count();
    }

    @Test
    void simpleAssignment_tokenKinds() {
        assertEquals(
                List.of(TokenType.IDENT, TokenType.ASSIGN, TokenType.NUMBER, TokenType.NEWLINE, TokenType.EOF),
                types("x = 5\n"));
    }

    @Test
    void twoCharacterOperators_winOverPrefixes() {
        assertEquals(
                List.of(TokenType.IDENT, TokenType.EQ, TokenType.IDENT, TokenType.LTE, TokenType.NUMBER,
                        TokenType.GTE, TokenType.NUMBER, TokenType.NEQ, TokenType.NUMBER, TokenType.EOF),
                types("a == b <= 1 >= 2 != 3"));
    }

    @Test
    void keywordsWinOverIdentifiers_butOnlyAtWordBoundary() {
        List<Token> tokens = Lexer.tokenize("print printer");
        assertTrue(tokens.get(0).isKeyword("print"));
        assertEquals(TokenType.IDENT, tokens.get(1).type);
        assertEquals("printer", tokens.get(1).lexeme);
    }

    @Test
    void indentation_producesIndentAndDedent() {
        List<Token> tokens = Lexer.tokenize(String.join("\n",
                "if x",
                "    y = 1",
                "z = 2",
                ""));
        assertEquals(1, count(tokens, TokenType.INDENT));
        assertEquals(1, count(tokens, TokenType.DEDENT));
        assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).type);
    }

    @Test
    void nestedBlocks_closeAtEndOfInput() {
        List<Token> tokens = Lexer.tokenize(String.join("\n",
                "while a",
                "    if b",
                "        c = 1"));
        assertEquals(2, count(tokens, TokenType.INDENT));
        assertEquals(2, count(tokens, TokenType.DEDENT));
        assertEquals(TokenType.DEDENT, tokens.get(tokens.size() - 2).type);
    }

    @Test
    void commentOnlyLine_doesNotChangeIndentation() {
        List<Token> tokens = Lexer.tokenize(String.join("\n",
                "if x",
                "    a = 1",
                "# unindented note",
                "",
                "    b = 2",
                ""));
        assertEquals(1, count(tokens, TokenType.INDENT));
        assertEquals(1, count(tokens, TokenType.DEDENT));

        int bIndex = -1;
        int dedentIndex = -1;
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).lexeme.equals("b")) bIndex = i;
            if (tokens.get(i).type == TokenType.DEDENT) dedentIndex = i;
        }
        assertTrue(bIndex > 0 && dedentIndex > bIndex, "dedent must come after the second statement");
    }

    @Test
    void tabsCountAsFourSpaces() {
        List<Token> tokens = Lexer.tokenize("if x\n\ty = 1\n    z = 2\n");
        assertEquals(1, count(tokens, TokenType.INDENT));
    }

    @Test
    void newlinesInsideBrackets_areWhitespace() {
        assertEquals(
                List.of(TokenType.IDENT, TokenType.ASSIGN, TokenType.LBRACKET, TokenType.NUMBER, TokenType.COMMA,
                        TokenType.NUMBER, TokenType.RBRACKET, TokenType.NEWLINE, TokenType.EOF),
                types("xs = [1,\n      2]\n"));
    }

    @Test
    void elseIf_isOneKeyword() {
        List<Token> tokens = Lexer.tokenize("else if x");
        assertTrue(tokens.get(0).isKeyword("else if"));
        assertEquals("x", tokens.get(1).lexeme);
    }

    @Test
    void fString_isSingleTokenWithRawText() {
        List<Token> tokens = Lexer.tokenize("f\"Hello {name}\"\n");
        assertEquals(TokenType.FSTRING, tokens.get(0).type);
        assertEquals("f\"Hello {name}\"", tokens.get(0).lexeme);
    }

    @Test
    void stringWithEscapedQuote_staysOneToken() {
        List<Token> tokens = Lexer.tokenize("s = \"say \\\"hi\\\"\"\n");
        assertEquals(TokenType.STRING, tokens.get(2).type);
        assertEquals(TokenType.NEWLINE, tokens.get(3).type);
    }

    @Test
    void positions_areOneBased() {
        List<Token> tokens = Lexer.tokenize("x = 1\n  \ny = 22");
        Token y = tokens.stream().filter(t -> t.lexeme.equals("y")).findFirst().orElseThrow();
        assertEquals(3, y.line);
        assertEquals(1, y.column);
        Token num = tokens.stream().filter(t -> t.lexeme.equals("22")).findFirst().orElseThrow();
        assertEquals(5, num.column);
    }

    @Test
    void unknownCharacter_isLexException() {
        LexException ex = assertThrows(LexException.class, () -> Lexer.tokenize("x = 1\ny = 5 @ 2\n"));
        assertEquals('@', ex.getOffending());
        assertEquals(2, ex.getLine());
        assertTrue(ex.getMessage().contains("Unexpected character"));
    }

    @Test
    void unterminatedString_isLexException() {
        LexException ex = assertThrows(LexException.class, () -> Lexer.tokenize("s = \"oops\nprint s\n"));
        assertTrue(ex.getMessage().contains("Unterminated string"));
    }

    @Test
    void commentsAreDropped() {
        assertEquals(
                List.of(TokenType.IDENT, TokenType.ASSIGN, TokenType.NUMBER, TokenType.NEWLINE, TokenType.EOF),
                types("x = 1 # the answer\n"));
    }

    @Test
    void tokenizingTwice_isDeterministic() {
        String src = "function f a\n    return a * 2\nprint f 21\n";
        assertEquals(Lexer.tokenize(src), Lexer.tokenize(src));
    }
}
