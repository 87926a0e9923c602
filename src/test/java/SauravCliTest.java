import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.sauravcode.script.SauravCli;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class SauravCliTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();

    private int cli(String... args) {
        return SauravCli.run(args,
                new PrintStream(outBuf, true, StandardCharsets.UTF_8),
                new PrintStream(errBuf, true, StandardCharsets.UTF_8));
    }

    private String out() { return outBuf.toString(StandardCharsets.UTF_8).replace("\r\n", "\n"); }

    private String err() { return errBuf.toString(StandardCharsets.UTF_8).replace("\r\n", "\n"); }

    private String script(String name, String... lines) throws IOException {
        Path p = dir.resolve(name);
        Files.writeString(p, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
        return p.toString();
    }

    @Test
    void runsScript() throws IOException {
        String file = script("hello.srv",
                "function greet who",
                "    return \"Hello, \" + who",
                "print greet \"CLI\"");

        assertEquals(SauravCli.EXIT_OK, cli(file));
        assertEquals("Hello, CLI\n", out());
        assertEquals("", err());
    }

    @Test
    void runtimeError_exitsOne() throws IOException {
        String file = script("bad.srv", "print 1", "x = 1 / 0", "print 2");

        assertEquals(SauravCli.EXIT_RUNTIME_ERROR, cli(file));
        assertEquals("1\n", out());
        assertTrue(err().contains("Runtime error: Division by zero"), err());
    }

    @Test
    void uncaughtThrow_exitsOne() throws IOException {
        String file = script("throw.srv", "throw \"boom\"");

        assertEquals(SauravCli.EXIT_RUNTIME_ERROR, cli(file));
        assertTrue(err().contains("Uncaught error: boom"), err());
    }

    @Test
    void syntaxError_exitsFourBeforeRunning() throws IOException {
        String file = script("syntax.srv", "print \"before\"", "x = (1 + 2");

        assertEquals(SauravCli.EXIT_SYNTAX_ERROR, cli(file));
        assertEquals("", out());
        assertTrue(err().startsWith("Syntax error: "), err());
    }

    @Test
    void missingFile_exitsThree() {
        assertEquals(SauravCli.EXIT_UNREADABLE, cli(dir.resolve("nope.srv").toString()));
        assertTrue(err().contains("Failed to read script file"), err());
    }

    @Test
    void usageErrors_exitTwo() throws IOException {
        String file = script("ok.srv", "print 1");

        assertEquals(SauravCli.EXIT_USAGE, cli());
        assertEquals(SauravCli.EXIT_USAGE, cli("--bogus", file));
        assertEquals(SauravCli.EXIT_USAGE, cli(file, file));
        assertEquals(SauravCli.EXIT_USAGE, cli("--max-depth"));
        assertEquals(SauravCli.EXIT_USAGE, cli("--max-depth", "abc", file));
        assertEquals(SauravCli.EXIT_USAGE, cli("--max-depth", "0", file));
        assertEquals(SauravCli.EXIT_USAGE, cli("--max-loops", "-5", file));
        assertTrue(err().contains("Usage:"), err());
        assertEquals("", out());
    }

    @Test
    void limitOptions_applyToRun() throws IOException {
        String file = script("loop.srv",
                "n = 0",
                "while true",
                "    n = n + 1");

        assertEquals(SauravCli.EXIT_RUNTIME_ERROR, cli("--max-loops", "10", file));
        assertTrue(err().contains("Maximum loop iterations exceeded (10)"), err());
    }

    @Test
    void oversizedRange_exitsOneWithMessage() throws IOException {
        String file = script("range.srv", "r = range (0 - 9000000000000000000) 9000000000000000000");

        assertEquals(SauravCli.EXIT_RUNTIME_ERROR, cli(file));
        assertTrue(err().contains("Runtime error: range of"), err());
    }

    @Test
    void hostStackExhaustion_exitsOne() throws IOException {
        String file = script("deep.srv",
                "function down n",
                "    return down (n + 1)",
                "down 0");

        assertEquals(SauravCli.EXIT_RUNTIME_ERROR, cli("--max-depth", "100000000", file));
        assertTrue(err().contains("Runtime error: host stack exhausted"), err());
    }

    @Test
    void dumpEnv_printsJsonAfterOutput() throws IOException {
        String file = script("dump.srv",
                "function add a b",
                "    return a + b",
                "total = add 1 2",
                "print total");

        assertEquals(SauravCli.EXIT_OK, cli("--dump-env", file));
        String text = out();
        assertTrue(text.startsWith("3\n"), text);
        assertTrue(text.contains("\"total\" : 3"), text);
        assertTrue(text.contains("\"add\""), text);
    }

    @Test
    void debugFlag_tracesToStderr() throws IOException {
        String file = script("trace.srv",
                "function f x",
                "    return x",
                "print f 1");

        assertEquals(SauravCli.EXIT_OK, cli("--debug", file));
        assertEquals("1\n", out());
        assertTrue(err().contains("[DEBUG]"), err());
        assertTrue(err().contains("defined function f/1"), err());
    }
}
