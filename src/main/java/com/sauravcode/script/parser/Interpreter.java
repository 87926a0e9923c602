package com.sauravcode.script.parser;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.sauravcode.debug.Debug;
import com.sauravcode.script.SauravScript.BuiltinFunction;
import com.sauravcode.script.parser.Expr.BinaryOp;
import com.sauravcode.script.parser.Expr.BoolLiteral;
import com.sauravcode.script.parser.Expr.Compare;
import com.sauravcode.script.parser.Expr.ExprInterface;
import com.sauravcode.script.parser.Expr.ExprVisitor;
import com.sauravcode.script.parser.Expr.FStringLiteral;
import com.sauravcode.script.parser.Expr.FunctionCall;
import com.sauravcode.script.parser.Expr.Identifier;
import com.sauravcode.script.parser.Expr.Index;
import com.sauravcode.script.parser.Expr.Len;
import com.sauravcode.script.parser.Expr.ListLiteral;
import com.sauravcode.script.parser.Expr.Logical;
import com.sauravcode.script.parser.Expr.MapLiteral;
import com.sauravcode.script.parser.Expr.NumberLiteral;
import com.sauravcode.script.parser.Expr.StringLiteral;
import com.sauravcode.script.parser.Expr.Unary;
import com.sauravcode.script.parser.Statement.Append;
import com.sauravcode.script.parser.Statement.Assignment;
import com.sauravcode.script.parser.Statement.CallStmt;
import com.sauravcode.script.parser.Statement.ElseIf;
import com.sauravcode.script.parser.Statement.ForRange;
import com.sauravcode.script.parser.Statement.FunctionDef;
import com.sauravcode.script.parser.Statement.If;
import com.sauravcode.script.parser.Statement.IndexedAssignment;
import com.sauravcode.script.parser.Statement.Print;
import com.sauravcode.script.parser.Statement.Return;
import com.sauravcode.script.parser.Statement.Stmt;
import com.sauravcode.script.parser.Statement.StmtVisitor;
import com.sauravcode.script.parser.Statement.Throw;
import com.sauravcode.script.parser.Statement.TryCatch;
import com.sauravcode.script.parser.Statement.While;

/**
 * Tree-walking evaluator. Statements produce a {@link Completion}; expressions produce a
 * {@link Value}. Errors surface as {@link SauravRuntimeException} (or its
 * {@link ThrownException} subclass) and unwind to the nearest {@code try} or out of the run.
 *
 * One interpreter is one session: its variable and function tables live as long as it does.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor<Completion> {
    private static final String TAG = "Interpreter";

    private final Environment env = new Environment();
    private final Map<String, BuiltinFunction> builtins;
    private final Deque<CallFrame> callStack = new ArrayDeque<CallFrame>();
    private final int maxDepth;
    private final int maxLoopIterations;
    private final PrintStream out;

    public Interpreter(Map<String, BuiltinFunction> builtins, int maxDepth, int maxLoopIterations, PrintStream out) {
        this.builtins = builtins;
        this.maxDepth = maxDepth;
        this.maxLoopIterations = maxLoopIterations;
        this.out = out;
    }

    public Environment environment() {
        return env;
    }

    public int getMaxDepth() { return maxDepth; }

    public int getMaxLoopIterations() { return maxLoopIterations; }

    /** Number of user-function calls currently active. */
    public int callDepth() {
        return callStack.size();
    }

    // -------------------------
    // Entry points
    // -------------------------

    /** Executes one top-level statement. A RETURN completion is handed back to the caller. */
    public Completion interpret(Stmt stmt) {
        return stmt.accept(this);
    }

    public Value evaluate(ExprInterface expr) {
        return expr.accept(this);
    }

    /** Runs a whole program; a {@code return} reaching this level is an error. */
    public void execute(List<Stmt> program) {
        for (Stmt stmt : program) {
            Completion completion = interpret(stmt);
            if (completion.isReturn()) {
                throw new SauravRuntimeException("'return' outside of a function");
            }
        }
    }

    Completion executeBlock(List<Stmt> statements) {
        for (Stmt stmt : statements) {
            Completion completion = stmt.accept(this);
            if (completion.isReturn()) return completion;
        }
        return Completion.normal();
    }

    // -------------------------
    // Call scope
    // -------------------------

    /**
     * Entered for every user-function call. Pushes the frame and enforces the depth limit
     * before anything else happens, then snapshots the variable table. Closing pops the
     * frame and restores the snapshot, whatever way the call ended.
     */
    final class CallScope implements AutoCloseable {
        private final CallFrame frame;
        private final Map<String, Value> saved;

        CallScope(String functionName, int line) {
            frame = new CallFrame(functionName, line);
            callStack.push(frame);
            if (callStack.size() > maxDepth) {
                callStack.pop();
                throw new SauravRuntimeException("Maximum recursion depth exceeded (" + maxDepth + ")");
            }
            saved = env.snapshot();
        }

        @Override
        public void close() {
            env.restore(saved);
            callStack.pop();
        }
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public Completion visitAssignmentStmt(Assignment stmt) {
        env.assign(stmt.name.lexeme, evaluate(stmt.value));
        return Completion.normal();
    }

    @Override
    public Completion visitIndexedAssignmentStmt(IndexedAssignment stmt) {
        String name = stmt.name.lexeme;
        if (!env.contains(name)) {
            throw new SauravRuntimeException("Name '" + name + "' is not defined.");
        }
        Value target = env.get(name);
        Value index = evaluate(stmt.index);
        Value value = evaluate(stmt.value);

        switch (target.getType()) {
            case LIST: {
                List<Value> items = target.asList();
                int i = listIndex(index, items.size());
                items.set(i, value);
                break;
            }
            case MAP:
                target.asMap().put(requireKey(index), value);
                break;
            default:
                throw new SauravRuntimeException("'" + name + "' is not a list or map");
        }
        return Completion.normal();
    }

    @Override
    public Completion visitFunctionStmt(FunctionDef stmt) {
        env.defineFunction(new UserFunction(stmt.name.lexeme, stmt.params, stmt.body));
        Debug.get().d(TAG, "defined function " + stmt.name.lexeme + "/" + stmt.params.size());
        return Completion.normal();
    }

    @Override
    public Completion visitReturnStmt(Return stmt) {
        Value value = stmt.value == null ? Value.unit() : evaluate(stmt.value);
        return Completion.returning(value);
    }

    @Override
    public Completion visitPrintStmt(Print stmt) {
        out.println(ValueFormatter.format(evaluate(stmt.expression)));
        return Completion.normal();
    }

    @Override
    public Completion visitIfStmt(If stmt) {
        if (evaluate(stmt.condition).isTruthy()) {
            return executeBlock(stmt.body);
        }
        for (ElseIf branch : stmt.elseIfs) {
            if (evaluate(branch.condition).isTruthy()) {
                return executeBlock(branch.body);
            }
        }
        if (stmt.elseBody != null) {
            return executeBlock(stmt.elseBody);
        }
        return Completion.normal();
    }

    @Override
    public Completion visitWhileStmt(While stmt) {
        long iterations = 0;
        while (evaluate(stmt.condition).isTruthy()) {
            iterations++;
            if (iterations > maxLoopIterations) {
                throw new SauravRuntimeException("Maximum loop iterations exceeded (" + maxLoopIterations + ")");
            }
            Completion completion = executeBlock(stmt.body);
            if (completion.isReturn()) return completion;
        }
        return Completion.normal();
    }

    @Override
    public Completion visitForStmt(ForRange stmt) {
        double startBound = evaluate(stmt.start).asNumber();
        double endBound = evaluate(stmt.end).asNumber();
        // width is taken on doubles so bounds past the long range cannot wrap around
        double width = Math.abs(truncate(endBound) - truncate(startBound));
        if (!(width <= maxLoopIterations)) {
            throw new SauravRuntimeException("Maximum loop iterations exceeded (" + maxLoopIterations + ")");
        }
        long start = (long) startBound;
        long end = (long) endBound;
        String var = stmt.var.lexeme;
        for (long i = start; i < end; i++) {
            env.assign(var, Value.number(i));
            Completion completion = executeBlock(stmt.body);
            if (completion.isReturn()) return completion;
        }
        return Completion.normal();
    }

    @Override
    public Completion visitTryStmt(TryCatch stmt) {
        try {
            return executeBlock(stmt.body);
        } catch (SauravRuntimeException e) {
            Debug.get().d(TAG, "caught into '" + stmt.catchVar.lexeme + "': " + e.getMessage());
            env.assign(stmt.catchVar.lexeme, e.catchValue());
            return executeBlock(stmt.handler);
        }
    }

    @Override
    public Completion visitThrowStmt(Throw stmt) {
        throw new ThrownException(evaluate(stmt.value));
    }

    @Override
    public Completion visitAppendStmt(Append stmt) {
        String name = stmt.listName.lexeme;
        Value target = env.get(name);
        if (target == null || target.getType() != Value.Type.LIST) {
            throw new SauravRuntimeException("'" + name + "' is not a list");
        }
        target.asList().add(evaluate(stmt.value));
        return Completion.normal();
    }

    @Override
    public Completion visitCallStmt(CallStmt stmt) {
        evaluate(stmt.call);
        return Completion.normal();
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Value visitNumberExpr(NumberLiteral expr) {
        return Value.number(expr.value);
    }

    @Override
    public Value visitStringExpr(StringLiteral expr) {
        return Value.string(expr.value);
    }

    @Override
    public Value visitBoolExpr(BoolLiteral expr) {
        return Value.bool(expr.value);
    }

    @Override
    public Value visitIdentifierExpr(Identifier expr) {
        String name = expr.name.lexeme;
        Value value = env.get(name);
        if (value != null) return value;
        // a bare function name evaluates to the name itself
        if (env.hasFunction(name)) return Value.string(name);
        throw new SauravRuntimeException("Name '" + name + "' is not defined.");
    }

    @Override
    public Value visitBinaryExpr(BinaryOp expr) {
        Value left = evaluate(expr.left);
        Value right = evaluate(expr.right);
        String op = expr.operator.lexeme;

        switch (op) {
            case "+":
                if (isNumber(left) && isNumber(right)) {
                    return Value.number(left.asNumber() + right.asNumber());
                }
                if (left.getType() == Value.Type.STRING && right.getType() == Value.Type.STRING) {
                    return Value.string(left.asString() + right.asString());
                }
                if (left.getType() == Value.Type.LIST && right.getType() == Value.Type.LIST) {
                    List<Value> joined = new ArrayList<>(left.asList());
                    joined.addAll(right.asList());
                    return Value.list(joined);
                }
                throw unsupported(op, left, right);
            case "-":
                requireNumbers(op, left, right);
                return Value.number(left.asNumber() - right.asNumber());
            case "*":
                if (isNumber(left) && isNumber(right)) {
                    return Value.number(left.asNumber() * right.asNumber());
                }
                if (left.getType() == Value.Type.STRING && isNumber(right)) {
                    return Value.string(repeat(left.asString(), right.asNumber()));
                }
                if (left.getType() == Value.Type.LIST && isNumber(right)) {
                    return Value.list(repeat(left.asList(), right.asNumber()));
                }
                throw unsupported(op, left, right);
            case "/":
                requireNumbers(op, left, right);
                if (right.asNumber() == 0.0) throw new SauravRuntimeException("Division by zero");
                return Value.number(left.asNumber() / right.asNumber());
            case "%": {
                requireNumbers(op, left, right);
                double divisor = right.asNumber();
                if (divisor == 0.0) throw new SauravRuntimeException("Modulo by zero");
                double r = left.asNumber() % divisor;
                // floored: the result takes the divisor's sign
                if (r != 0.0 && (r < 0) != (divisor < 0)) r += divisor;
                return Value.number(r);
            }
            default:
                throw new SauravRuntimeException("Unknown operator: " + op);
        }
    }

    @Override
    public Value visitCompareExpr(Compare expr) {
        Value left = evaluate(expr.left);
        Value right = evaluate(expr.right);
        String op = expr.operator.lexeme;

        if (op.equals("==")) return Value.bool(left.equals(right));
        if (op.equals("!=")) return Value.bool(!left.equals(right));

        int cmp;
        if (isNumber(left) && isNumber(right)) {
            double a = left.asNumber();
            double b = right.asNumber();
            // NaN is unordered: every ordering test is false
            if (Double.isNaN(a) || Double.isNaN(b)) return Value.bool(false);
            cmp = Double.compare(a == 0.0 ? 0.0 : a, b == 0.0 ? 0.0 : b);
        } else if (left.getType() == Value.Type.STRING && right.getType() == Value.Type.STRING) {
            cmp = left.asString().compareTo(right.asString());
        } else {
            throw new SauravRuntimeException("Cannot compare " + left.typeName() + " and " + right.typeName() + " with " + op);
        }

        switch (op) {
            case "<":  return Value.bool(cmp < 0);
            case ">":  return Value.bool(cmp > 0);
            case "<=": return Value.bool(cmp <= 0);
            case ">=": return Value.bool(cmp >= 0);
            default:   throw new SauravRuntimeException("Unknown comparison: " + op);
        }
    }

    @Override
    public Value visitLogicalExpr(Logical expr) {
        boolean left = evaluate(expr.left).isTruthy();
        if (expr.operator.lexeme.equals("or")) {
            if (left) return Value.bool(true);
        } else {
            if (!left) return Value.bool(false);
        }
        return Value.bool(evaluate(expr.right).isTruthy());
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value operand = evaluate(expr.operand);
        if (expr.operator.lexeme.equals("not")) {
            return Value.bool(!operand.isTruthy());
        }
        if (!isNumber(operand)) {
            throw new SauravRuntimeException("Unary '-' expects a number, got " + operand.typeName());
        }
        return Value.number(-operand.asNumber());
    }

    @Override
    public Value visitListExpr(ListLiteral expr) {
        List<Value> items = new ArrayList<>(expr.elements.size());
        for (ExprInterface element : expr.elements) items.add(evaluate(element));
        return Value.list(items);
    }

    @Override
    public Value visitMapExpr(MapLiteral expr) {
        Map<Value, Value> entries = new LinkedHashMap<>();
        for (Expr.MapEntry entry : expr.entries) {
            Value key = requireKey(evaluate(entry.key));
            entries.put(key, evaluate(entry.value));
        }
        return Value.map(entries);
    }

    @Override
    public Value visitIndexExpr(Index expr) {
        Value target = evaluate(expr.target);
        Value index = evaluate(expr.index);

        switch (target.getType()) {
            case LIST: {
                List<Value> items = target.asList();
                return items.get(listIndex(index, items.size()));
            }
            case STRING: {
                String s = target.asString();
                int i = listIndex(index, s.length());
                return Value.string(String.valueOf(s.charAt(i)));
            }
            case MAP: {
                Value found = target.asMap().get(index);
                if (found == null) {
                    throw new SauravRuntimeException("Key '" + ValueFormatter.format(index) + "' not found");
                }
                return found;
            }
            default:
                throw new SauravRuntimeException("Cannot index into " + target.typeName());
        }
    }

    @Override
    public Value visitLenExpr(Len expr) {
        Value v = evaluate(expr.operand);
        switch (v.getType()) {
            case STRING: return Value.number(v.asString().length());
            case LIST:   return Value.number(v.asList().size());
            case MAP:    return Value.number(v.asMap().size());
            default:     throw new SauravRuntimeException("Cannot get length of " + v.typeName());
        }
    }

    @Override
    public Value visitFStringExpr(FStringLiteral expr) {
        StringBuilder sb = new StringBuilder();
        for (ExprInterface part : expr.parts) {
            sb.append(ValueFormatter.format(evaluate(part)));
        }
        return Value.string(sb.toString());
    }

    @Override
    public Value visitCallExpr(FunctionCall expr) {
        String name = expr.name.lexeme;

        UserFunction fn = env.getFunction(name);
        if (fn != null) {
            try (CallScope scope = new CallScope(name, expr.name.line)) {
                try {
                    List<Value> args = evaluateArguments(expr.arguments);
                    return fn.call(this, args);
                } catch (SauravRuntimeException e) {
                    e.addScriptFrame(scope.frame.toString());
                    throw e;
                }
            }
        }

        BuiltinFunction builtin = builtins.get(name);
        if (builtin == null) {
            throw new SauravRuntimeException("Function " + name + " is not defined.");
        }
        List<Value> args = evaluateArguments(expr.arguments);
        try {
            return builtin.call(args);
        } catch (SauravRuntimeException e) {
            throw e;
        } catch (RuntimeException e) {
            // host failures inside a built-in stay catchable by the script
            Debug.get().e(TAG, "built-in " + name + " failed", e);
            throw new SauravRuntimeException(name + " failed: " + e, e);
        }
    }

    private List<Value> evaluateArguments(List<ExprInterface> arguments) {
        List<Value> values = new ArrayList<>(arguments.size());
        for (ExprInterface arg : arguments) values.add(evaluate(arg));
        return values;
    }

    // -------------------------
    // Helpers
    // -------------------------

    private static double truncate(double d) {
        return d < 0 ? Math.ceil(d) : Math.floor(d);
    }

    private static boolean isNumber(Value v) {
        return v.getType() == Value.Type.NUMBER;
    }

    private static void requireNumbers(String op, Value left, Value right) {
        if (!isNumber(left) || !isNumber(right)) throw unsupported(op, left, right);
    }

    private static SauravRuntimeException unsupported(String op, Value left, Value right) {
        return new SauravRuntimeException(
                "Unsupported operand types for " + op + ": " + left.typeName() + " and " + right.typeName());
    }

    /** Truncates a numeric index toward zero and bounds-checks it against {@code size}. */
    private static int listIndex(Value index, int size) {
        if (!isNumber(index)) {
            throw new SauravRuntimeException("Index must be a number, got " + index.typeName());
        }
        double d = index.asNumber();
        long i = (long) d;
        if (i < 0 || i >= size) {
            throw new SauravRuntimeException("Index " + ValueFormatter.formatNumber(i) + " out of bounds (size " + size + ")");
        }
        return (int) i;
    }

    private static Value requireKey(Value key) {
        if (!key.isHashable()) {
            throw new SauravRuntimeException("Map keys must be numbers, strings or bools, got " + key.typeName());
        }
        return key;
    }

    private static String repeat(String s, double times) {
        long n = (long) times;
        if (n <= 0 || s.isEmpty()) return "";
        if (n * s.length() > Integer.MAX_VALUE - 8) {
            throw new SauravRuntimeException("Repeated string is too large");
        }
        return s.repeat((int) n);
    }

    private static List<Value> repeat(List<Value> items, double times) {
        long n = (long) times;
        List<Value> result = new ArrayList<>();
        if (n <= 0 || items.isEmpty()) return result;
        if (n * items.size() > Integer.MAX_VALUE - 8) {
            throw new SauravRuntimeException("Repeated list is too large");
        }
        for (long i = 0; i < n; i++) result.addAll(items);
        return result;
    }
}
