import org.junit.jupiter.api.Test;

import com.sauravcode.script.SauravScript;
import com.sauravcode.script.parser.SauravRuntimeException;
import com.sauravcode.script.parser.SauravSyntaxException;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class SauravFStringTest {

    private static String run(String... lines) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        SauravScript engine = new SauravScript();
        engine.setOutput(new PrintStream(buf, true, StandardCharsets.UTF_8));
        engine.run(String.join("\n", lines) + "\n");
        return buf.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    @Test
    void interpolatesVariables() {
        assertEquals("Hello, World! You are 30.\n", run(
                "name = \"World\"",
                "age = 30",
                "print f\"Hello, {name}! You are {age}.\""));
    }

    @Test
    void interpolatesExpressions() {
        assertEquals("sum=5 half=2.5 ok=true\n", run(
                "a = 2",
                "b = 3",
                "print f\"sum={a + b} half={(a + b) / 2} ok={a < b}\""));
    }

    @Test
    void interpolatesCallsAndLen() {
        assertEquals("HI has 3 items\n", run(
                "s = \"hi\"",
                "items = [1, 2, 3]",
                "print f\"{upper s} has {len items} items\""));
    }

    @Test
    void collectionsRenderLikePrint() {
        assertEquals("xs=[\"a\", 1]\n", run(
                "xs = [\"a\", 1]",
                "print f\"xs={xs}\""));
    }

    @Test
    void doubledBraces_areLiteral() {
        assertEquals("{x} = 7\n", run(
                "x = 7",
                "print f\"{{x}} = {x}\""));
    }

    @Test
    void plainFString_isJustText() {
        assertEquals("no holes\n", run("print f\"no holes\""));
    }

    @Test
    void valueIsAString() {
        assertEquals("string\n", run("n = 1", "print type_of f\"{n}\""));
    }

    @Test
    void emptyExpression_isSyntaxError() {
        SauravSyntaxException ex = assertThrows(SauravSyntaxException.class, () -> run("print f\"a {} b\""));
        assertTrue(ex.getMessage().contains("Empty expression in f-string"), ex.getMessage());
    }

    @Test
    void unmatchedBraces_areSyntaxErrors() {
        SauravSyntaxException open = assertThrows(SauravSyntaxException.class, () -> run("print f\"a {x\""));
        assertTrue(open.getMessage().contains("Unmatched '{' in f-string"), open.getMessage());

        SauravSyntaxException close = assertThrows(SauravSyntaxException.class, () -> run("print f\"a } b\""));
        assertTrue(close.getMessage().contains("Unmatched '}' in f-string"), close.getMessage());
    }

    @Test
    void trailingTokensInside_areSyntaxErrors() {
        SauravSyntaxException ex = assertThrows(SauravSyntaxException.class, () -> run("print f\"{1 2}\""));
        assertTrue(ex.getMessage().contains("after expression in f-string"), ex.getMessage());
    }

    @Test
    void undefinedNameInside_isRuntimeError() {
        SauravRuntimeException ex = assertThrows(SauravRuntimeException.class, () -> run("print f\"{missing}\""));
        assertEquals("Name 'missing' is not defined.", ex.getMessage());
    }
}
