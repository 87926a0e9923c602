package com.sauravcode.script;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.sauravcode.debug.Debug;
import com.sauravcode.debug.DebugLevel;
import com.sauravcode.debug.DebugSink;
import com.sauravcode.script.parser.Interpreter;
import com.sauravcode.script.parser.SauravRuntimeException;
import com.sauravcode.script.parser.SauravSyntaxException;
import com.sauravcode.script.parser.ThrownException;

/**
 * Batch runner: {@code SauravCli [options] <file.srv>}.
 *
 * Options:
 *   --max-depth N   user-function call depth limit (default 500)
 *   --max-loops N   per-loop iteration limit (default 1000000)
 *   --debug         trace the lexer, parser and interpreter to stderr
 *   --dump-env      print the final variables and functions as JSON
 */
public final class SauravCli {

    public static final int EXIT_OK = 0;
    public static final int EXIT_RUNTIME_ERROR = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_UNREADABLE = 3;
    public static final int EXIT_SYNTAX_ERROR = 4;

    private static final String USAGE =
            "Usage: SauravCli [--max-depth N] [--max-loops N] [--debug] [--dump-env] <script-file>";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        final SauravScript engine = new SauravScript();
        engine.setOutput(out);

        String file = null;
        boolean debug = false;
        boolean dumpEnv = false;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--debug":
                    debug = true;
                    break;
                case "--dump-env":
                    dumpEnv = true;
                    break;
                case "--max-depth":
                case "--max-loops": {
                    if (i + 1 >= args.length) return usage(err, a + " needs a value");
                    try {
                        int n = Integer.parseInt(args[++i]);
                        if (a.equals("--max-depth")) engine.setMaxCallDepth(n);
                        else engine.setMaxLoopIterations(n);
                    } catch (IllegalArgumentException e) {
                        // NumberFormatException is an IllegalArgumentException too
                        return usage(err, "bad value for " + a + ": " + args[i]);
                    }
                    break;
                }
                default:
                    if (a.startsWith("--")) return usage(err, "unknown option " + a);
                    if (file != null) return usage(err, "only one script file may be given");
                    file = a;
            }
        }
        if (file == null) return usage(err, null);

        if (debug) Debug.get().setSink(DebugSink.stream(err, DebugLevel.DEBUG));
        try {
            return execute(engine, Path.of(file), dumpEnv, out, err);
        } finally {
            if (debug) Debug.get().setSink(null);
        }
    }

    private static int execute(SauravScript engine, Path scriptPath, boolean dumpEnv, PrintStream out, PrintStream err) {
        final String script;
        try {
            script = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to read script file: " + scriptPath + " (" + e.getMessage() + ")");
            return EXIT_UNREADABLE;
        }

        Interpreter interpreter;
        try {
            interpreter = engine.run(script);
        } catch (SauravSyntaxException e) {
            err.println("Syntax error: " + e.getMessage());
            return EXIT_SYNTAX_ERROR;
        } catch (ThrownException e) {
            err.println("Uncaught error: " + e.getMessage());
            return EXIT_RUNTIME_ERROR;
        } catch (SauravRuntimeException e) {
            err.println("Runtime error: " + e.getMessage());
            return EXIT_RUNTIME_ERROR;
        } catch (StackOverflowError e) {
            err.println("Runtime error: host stack exhausted; lower --max-depth");
            return EXIT_RUNTIME_ERROR;
        } catch (RuntimeException e) {
            Debug.get().e("SauravCli", "internal failure", e);
            err.println("Internal error: " + e);
            return EXIT_RUNTIME_ERROR;
        }

        if (dumpEnv) {
            try {
                out.println(EnvironmentDump.toJson(interpreter));
            } catch (JsonProcessingException e) {
                err.println("Failed to render environment: " + e.getOriginalMessage());
                return EXIT_RUNTIME_ERROR;
            }
        }
        out.flush();
        return EXIT_OK;
    }

    private static int usage(PrintStream err, String problem) {
        if (problem != null) err.println(problem);
        err.println(USAGE);
        return EXIT_USAGE;
    }

    private SauravCli() {}
}
