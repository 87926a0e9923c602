package com.sauravcode.script.plugins;

import static com.sauravcode.script.plugins.PluginArgs.list;
import static com.sauravcode.script.plugins.PluginArgs.num;
import static com.sauravcode.script.plugins.PluginArgs.requireArgs;

import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import com.sauravcode.script.SauravScript;
import com.sauravcode.script.parser.SauravRuntimeException;
import com.sauravcode.script.parser.Value;
import com.sauravcode.script.parser.ValueFormatter;

/**
 * UtilityPlugin
 *
 * Conversions, console input, sequences and ordering:
 *
 *   print type_of 42
 *   n = to_number "3.14"
 *   name = input "Name? "
 *   evens = range 0 10 2
 *   sorted = sort [3, 1, 2]
 *
 * {@code input} reads from the engine's configured reader at call time, so a host may
 * swap stdin for a test fixture after registration.
 */
public final class UtilityPlugin {

    private static final Pattern NUMBER_TEXT = Pattern.compile(
            "[+-]?((\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?|inf|infinity|nan)",
            Pattern.CASE_INSENSITIVE);

    private UtilityPlugin() {}

    public static void register(SauravScript engine) {

        engine.registerFunction("type_of", args -> {
            requireArgs("type_of", args, 1);
            return Value.string(args.get(0).typeName());
        });

        engine.registerFunction("to_string", args -> {
            requireArgs("to_string", args, 1);
            return Value.string(ValueFormatter.format(args.get(0)));
        });

        engine.registerFunction("to_number", args -> {
            requireArgs("to_number", args, 1);
            Value v = args.get(0);
            switch (v.getType()) {
                case NUMBER:
                    return v;
                case BOOL:
                    return Value.number(v.asBool() ? 1 : 0);
                case STRING:
                    return Value.number(parseNumber(v.asString()));
                default:
                    throw new SauravRuntimeException("Cannot convert " + v.typeName() + " to number");
            }
        });

        engine.registerFunction("input", args -> {
            requireArgs("input", args, 0, 1);
            PrintStream out = engine.getOutput();
            if (!args.isEmpty()) {
                out.print(ValueFormatter.format(args.get(0)));
                out.flush();
            }
            try {
                String line = engine.getInput().readLine();
                return Value.string(line == null ? "" : line);
            } catch (IOException e) {
                throw new SauravRuntimeException("input failed: " + e.getMessage(), e);
            }
        });

        engine.registerFunction("range", args -> {
            requireArgs("range", args, 1, 3);
            double start = 0;
            double stop;
            double step = 1;
            if (args.size() == 1) {
                stop = whole(num("range", args.get(0)));
            } else {
                start = whole(num("range", args.get(0)));
                stop = whole(num("range", args.get(1)));
                if (args.size() == 3) step = whole(num("range", args.get(2)));
            }
            if (step == 0) throw new SauravRuntimeException("range step must not be zero");

            // counted in doubles: long arithmetic overflows for bounds near the long range
            double span = (stop - start) / step;
            double count = span > 0 ? Math.ceil(span) : 0;
            if (count > engine.getMaxLoopIterations()) {
                throw new SauravRuntimeException("range of " + ValueFormatter.formatNumber(count)
                        + " elements exceeds the limit (" + engine.getMaxLoopIterations() + ")");
            }

            int n = (int) count;
            List<Value> items = new ArrayList<>(n);
            for (int i = 0; i < n; i++) items.add(Value.number(start + i * step));
            return Value.list(items);
        });

        engine.registerFunction("reverse", args -> {
            requireArgs("reverse", args, 1);
            Value v = args.get(0);
            if (v.getType() == Value.Type.STRING) {
                return Value.string(new StringBuilder(v.asString()).reverse().toString());
            }
            if (v.getType() == Value.Type.LIST) {
                List<Value> copy = new ArrayList<>(v.asList());
                Collections.reverse(copy);
                return Value.list(copy);
            }
            throw new SauravRuntimeException("reverse expects a list or string");
        });

        engine.registerFunction("sort", args -> {
            requireArgs("sort", args, 1);
            List<Value> copy = new ArrayList<>(list("sort", args.get(0)));
            if (copy.isEmpty()) return Value.list(copy);

            Value.Type type = copy.get(0).getType();
            for (Value item : copy) {
                if (item.getType() != type || (type != Value.Type.NUMBER && type != Value.Type.STRING)) {
                    throw new SauravRuntimeException("sort expects a list of numbers or a list of strings");
                }
            }
            if (type == Value.Type.NUMBER) {
                copy.sort((a, b) -> Double.compare(a.asNumber(), b.asNumber()));
            } else {
                copy.sort((a, b) -> a.asString().compareTo(b.asString()));
            }
            return Value.list(copy);
        });
    }

    /** Drops the fractional part, toward zero. */
    private static double whole(double d) {
        return d < 0 ? Math.ceil(d) : Math.floor(d);
    }

    private static double parseNumber(String text) {
        String trimmed = text.strip();
        if (!NUMBER_TEXT.matcher(trimmed).matches()) {
            throw new SauravRuntimeException("Cannot convert '" + text + "' to number");
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        boolean negative = lower.startsWith("-");
        String unsigned = (negative || lower.startsWith("+")) ? lower.substring(1) : lower;
        if (unsigned.equals("nan")) return Double.NaN;
        if (unsigned.equals("inf") || unsigned.equals("infinity")) {
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return Double.parseDouble(trimmed);
    }
}
