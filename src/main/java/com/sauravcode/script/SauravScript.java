package com.sauravcode.script;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.sauravcode.debug.Debug;
import com.sauravcode.script.parser.Interpreter;
import com.sauravcode.script.parser.Lexer;
import com.sauravcode.script.parser.Parser;
import com.sauravcode.script.parser.SauravRuntimeException;
import com.sauravcode.script.parser.Statement.CallStmt;
import com.sauravcode.script.parser.Statement.Stmt;
import com.sauravcode.script.parser.Token;
import com.sauravcode.script.parser.Value;
import com.sauravcode.script.plugins.MapPlugin;
import com.sauravcode.script.plugins.MathPlugin;
import com.sauravcode.script.plugins.StringPlugin;
import com.sauravcode.script.plugins.UtilityPlugin;

/**
 * Core sauravcode engine.
 *
 * - Python-like indentation blocks, no braces or semicolons
 * - Types: number (double), bool, string, list, map, none
 * - Function calls take space-separated arguments: {@code add 1 2}
 *     - Built-ins (registered via registerFunction, the standard set by default)
 *     - User-defined functions ({@code function add a b}), which shadow built-ins
 * - Control flow: if / else if / else, while, for, try / catch, throw, return
 * - Safety limits: call depth and loop iterations, both configurable
 *
 * A run is single-threaded; an engine may be reused for many runs.
 */
public class SauravScript {
    private static final String TAG = "SauravScript";

    public static final int DEFAULT_MAX_CALL_DEPTH = 500;
    public static final int DEFAULT_MAX_LOOP_ITERATIONS = 1_000_000;

    /** Functional interface for built-in functions. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<String, BuiltinFunction>();
    private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;
    private int maxLoopIterations = DEFAULT_MAX_LOOP_ITERATIONS;
    private PrintStream out = System.out;
    private BufferedReader in;

    public SauravScript() {
        StringPlugin.register(this);
        MathPlugin.register(this);
        UtilityPlugin.register(this);
        MapPlugin.register(this);
    }

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("max call depth must be positive, got " + depth);
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    public void setMaxLoopIterations(int iterations) {
        if (iterations < 0) throw new IllegalArgumentException("max loop iterations must not be negative, got " + iterations);
        this.maxLoopIterations = iterations;
    }

    public int getMaxLoopIterations() { return maxLoopIterations; }

    /** Target of {@code print} and of the {@code input} prompt. */
    public void setOutput(PrintStream out) { this.out = out == null ? System.out : out; }

    public PrintStream getOutput() { return out; }

    /** Source of {@code input} lines. Defaults to stdin, opened on first use. */
    public void setInput(BufferedReader in) { this.in = in; }

    public BufferedReader getInput() {
        if (in == null) {
            in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }
        return in;
    }

    public void registerFunction(String name, BuiltinFunction fn) { functions.put(name, fn); }

    public boolean hasBuiltin(String name) { return functions.containsKey(name); }

    public Set<String> builtinNames() { return Collections.unmodifiableSet(functions.keySet()); }

    // ===================== PIPELINE =====================

    public static List<Token> tokenize(String source) {
        return Lexer.tokenize(source);
    }

    public static List<Stmt> parse(String source) {
        return Parser.parse(Lexer.tokenize(source));
    }

    /**
     * A fresh session with empty variable and function tables, bound to this engine's
     * built-ins, limits and output. Limits are read now; later setter calls do not
     * affect an interpreter already handed out.
     */
    public Interpreter newInterpreter() {
        return new Interpreter(functions, maxCallDepth, maxLoopIterations, out);
    }

    /** Runs a whole program in a fresh session and returns that session for inspection. */
    public Interpreter run(String source) {
        Interpreter interpreter = newInterpreter();
        List<Stmt> program = parse(source);
        Debug.get().d(TAG, "running " + program.size() + " statement(s)");
        try {
            interpreter.execute(program);
        } catch (SauravRuntimeException e) {
            reportUncaught(e);
            throw e;
        }
        return interpreter;
    }

    /**
     * Runs more source in an existing session, the way an interactive shell feeds it
     * input. When the last statement is a bare call its value is returned so the caller
     * can echo it; otherwise the result is null.
     */
    public Value execute(String source, Interpreter interpreter) {
        List<Stmt> program = parse(source);
        if (program.isEmpty()) return null;

        Stmt last = program.get(program.size() - 1);
        try {
            interpreter.execute(program.subList(0, program.size() - 1));
            if (last instanceof CallStmt) {
                return interpreter.evaluate(((CallStmt) last).call);
            }
            interpreter.execute(Collections.singletonList(last));
            return null;
        } catch (SauravRuntimeException e) {
            reportUncaught(e);
            throw e;
        }
    }

    private static void reportUncaught(SauravRuntimeException e) {
        if (!Debug.get().enabled()) return;
        List<String> frames = e.getScriptTrace();
        Debug.get().e(TAG, "uncaught " + e.getClass().getSimpleName() + ": " + e.getMessage()
                + (frames.isEmpty() ? "" : " in " + frames));
    }
}
