import org.junit.jupiter.api.Test;

import com.sauravcode.script.SauravScript;
import com.sauravcode.script.parser.Expr;
import com.sauravcode.script.parser.Lexer;
import com.sauravcode.script.parser.Parser;
import com.sauravcode.script.parser.SauravSyntaxException;
import com.sauravcode.script.parser.Statement;
import com.sauravcode.script.parser.Statement.Stmt;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SauravParserTest {

    private static List<Stmt> parse(String... lines) {
        return Parser.parse(Lexer.tokenize(String.join("\n", lines) + "\n"));
    }

    private static Expr.ExprInterface printed(Stmt stmt) {
        assertTrue(stmt instanceof Statement.Print, "expected a print statement, got " + stmt.getClass().getSimpleName());
        return ((Statement.Print) stmt).expression;
    }

    @Test
    void topLevelStatementKinds() {
        List<Stmt> program = parse(
                "x = 1",
                "xs[0] = 2",
                "function f a b",
                "    return a",
                "print x",
                "append xs 3",
                "throw \"e\"",
                "f 1 2");

        assertEquals(7, program.size());
        assertTrue(program.get(0) instanceof Statement.Assignment);
        assertTrue(program.get(1) instanceof Statement.IndexedAssignment);
        assertTrue(program.get(2) instanceof Statement.FunctionDef);
        assertTrue(program.get(3) instanceof Statement.Print);
        assertTrue(program.get(4) instanceof Statement.Append);
        assertTrue(program.get(5) instanceof Statement.Throw);
        assertTrue(program.get(6) instanceof Statement.CallStmt);
    }

    @Test
    void functionDefinition_collectsParamsAndBody() {
        Statement.FunctionDef fn = (Statement.FunctionDef) parse(
                "function add a b",
                "    total = a + b",
                "    return total").get(0);

        assertEquals("add", fn.name.lexeme);
        assertEquals(2, fn.params.size());
        assertEquals("b", fn.params.get(1).lexeme);
        assertEquals(2, fn.body.size());
        assertTrue(fn.body.get(1) instanceof Statement.Return);
    }

    @Test
    void bareReturn_hasNoValue() {
        Statement.FunctionDef fn = (Statement.FunctionDef) parse(
                "function f",
                "    return").get(0);
        assertNull(((Statement.Return) fn.body.get(0)).value);
    }

    @Test
    void ifElseIfElse_chain() {
        Statement.If stmt = (Statement.If) parse(
                "if x == 1",
                "    print 1",
                "else if x == 2",
                "    print 2",
                "else if x == 3",
                "    print 3",
                "else",
                "    print 0").get(0);

        assertEquals(2, stmt.elseIfs.size());
        assertNotNull(stmt.elseBody);
        assertEquals(1, stmt.elseBody.size());
    }

    @Test
    void precedence_multiplicationBindsTighterThanAddition() {
        Expr.BinaryOp sum = (Expr.BinaryOp) printed(parse("print 1 + 2 * 3").get(0));
        assertEquals("+", sum.operator.lexeme);
        assertTrue(sum.right instanceof Expr.BinaryOp);
        assertEquals("*", ((Expr.BinaryOp) sum.right).operator.lexeme);
    }

    @Test
    void precedence_comparisonBindsTighterThanAnd() {
        Expr.Logical and = (Expr.Logical) printed(parse("print a and b == c").get(0));
        assertEquals("and", and.operator.lexeme);
        assertTrue(and.left instanceof Expr.Identifier);
        assertTrue(and.right instanceof Expr.Compare);
    }

    @Test
    void identifierFollowedByValue_isCallWithSpaceSeparatedArgs() {
        Expr.FunctionCall call = (Expr.FunctionCall) printed(parse("print add 1 \"two\" x").get(0));
        assertEquals("add", call.name.lexeme);
        assertEquals(3, call.arguments.size());
        assertTrue(call.arguments.get(0) instanceof Expr.NumberLiteral);
        assertTrue(call.arguments.get(1) instanceof Expr.StringLiteral);
    }

    @Test
    void identifierNotFollowedByValue_isReference() {
        Expr.BinaryOp sum = (Expr.BinaryOp) printed(parse("print x + 1").get(0));
        assertTrue(sum.left instanceof Expr.Identifier);
    }

    @Test
    void identifierArgument_swallowsFollowingArguments() {
        // "has_key m "k"" reads as has_key(m("k")); parenthesize to pass m itself
        Expr.FunctionCall call = (Expr.FunctionCall) printed(parse("print has_key m \"k\"").get(0));
        assertEquals(1, call.arguments.size());
        Expr.FunctionCall inner = (Expr.FunctionCall) call.arguments.get(0);
        assertEquals("m", inner.name.lexeme);

        Expr.FunctionCall grouped = (Expr.FunctionCall) printed(parse("print has_key (m) \"k\"").get(0));
        assertEquals(2, grouped.arguments.size());
        assertTrue(grouped.arguments.get(0) instanceof Expr.Identifier);
    }

    @Test
    void identifierBeforeBracket_isIndexedNotCalled() {
        Expr.Index index = (Expr.Index) printed(parse("print xs[0][1]").get(0));
        assertTrue(index.target instanceof Expr.Index);
        assertTrue(((Expr.Index) index.target).target instanceof Expr.Identifier);
    }

    @Test
    void notArgument_negatesFollowingAtom() {
        Expr.FunctionCall call = (Expr.FunctionCall) printed(parse("print f not x").get(0));
        assertEquals(1, call.arguments.size());
        Expr.Unary neg = (Expr.Unary) call.arguments.get(0);
        assertEquals("not", neg.operator.lexeme);
    }

    @Test
    void listArgument_afterIdentifierCall() {
        Expr.FunctionCall call = (Expr.FunctionCall) printed(parse("print join \", \" [1, 2]").get(0));
        assertEquals(2, call.arguments.size());
        assertTrue(call.arguments.get(1) instanceof Expr.ListLiteral);
    }

    @Test
    void listCommas_areOptional() {
        Expr.ListLiteral list = (Expr.ListLiteral) printed(parse("print [1 2, 3]").get(0));
        assertEquals(3, list.elements.size());
    }

    @Test
    void mapLiteral_keepsSourceOrder() {
        Expr.MapLiteral map = (Expr.MapLiteral) printed(parse("print {\"b\": 1, \"a\": 2}").get(0));
        assertEquals(2, map.entries.size());
        assertEquals("b", ((Expr.StringLiteral) map.entries.get(0).key).value);
    }

    @Test
    void typeAnnotations_areDiscarded() {
        List<Stmt> program = parse("int x = 5", "string s = \"a\"");
        assertEquals(2, program.size());
        assertEquals("x", ((Statement.Assignment) program.get(0)).name.lexeme);
    }

    @Test
    void stringEscapes_areResolved() {
        Expr.StringLiteral s = (Expr.StringLiteral) printed(parse("print \"a\\tb\\n\\q\"").get(0));
        assertEquals("a\tb\n\\q", s.value);
    }

    @Test
    void forBounds_areAtoms() {
        Statement.ForRange loop = (Statement.ForRange) parse(
                "for i 0 (n + 1)",
                "    print i").get(0);
        assertTrue(loop.start instanceof Expr.NumberLiteral);
        assertTrue(loop.end instanceof Expr.BinaryOp);

        // "a b" is read as the call a(b), leaving no end bound
        assertThrows(SauravSyntaxException.class, () -> parse(
                "for i a b",
                "    print i"));
    }

    @Test
    void tryWithoutCatch_isSyntaxError() {
        SauravSyntaxException ex = assertThrows(SauravSyntaxException.class, () -> parse(
                "try",
                "    x = 1",
                "print x"));
        assertTrue(ex.getMessage().contains("catch"));
    }

    @Test
    void missingBlock_reportsExpectedAndActual() {
        SauravSyntaxException ex = assertThrows(SauravSyntaxException.class, () -> parse(
                "if x",
                "print 1"));
        assertTrue(ex.getMessage().contains("Expected indented block"), ex.getMessage());
        assertEquals(2, ex.getLine());
    }

    @Test
    void unknownStatement_isSyntaxError() {
        SauravSyntaxException ex = assertThrows(SauravSyntaxException.class, () -> parse("5 + 3"));
        assertTrue(ex.getMessage().contains("Unknown statement"));
    }

    @Test
    void danglingOperator_isSyntaxError() {
        assertThrows(SauravSyntaxException.class, () -> parse("x = 1 +"));
    }

    @Test
    void parsingTwice_givesSameShape() {
        String src = String.join("\n",
                "function fib n",
                "    if n < 2",
                "        return n",
                "    return fib (n - 1) + fib (n - 2)",
                "print fib 10",
                "");
        List<Stmt> first = SauravScript.parse(src);
        List<Stmt> second = SauravScript.parse(src);

        assertEquals(first.size(), second.size());
        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).getClass(), second.get(i).getClass());
        }
        Statement.FunctionDef a = (Statement.FunctionDef) first.get(0);
        Statement.FunctionDef b = (Statement.FunctionDef) second.get(0);
        assertEquals(a.name, b.name);
        assertEquals(a.params, b.params);
        assertEquals(a.body.size(), b.body.size());
    }
}
