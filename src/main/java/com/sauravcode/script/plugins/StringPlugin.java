package com.sauravcode.script.plugins;

import static com.sauravcode.script.plugins.PluginArgs.num;
import static com.sauravcode.script.plugins.PluginArgs.requireArgs;
import static com.sauravcode.script.plugins.PluginArgs.str;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.sauravcode.script.SauravScript;
import com.sauravcode.script.parser.SauravRuntimeException;
import com.sauravcode.script.parser.Value;
import com.sauravcode.script.parser.ValueFormatter;

/**
 * StringPlugin
 *
 * Text built-ins. Arguments follow the space-separated call style:
 *
 *   parts = split "a-b-c" "-"
 *   print join ", " parts
 *   print substring "hello world" 0 5
 */
public final class StringPlugin {

    private StringPlugin() {}

    public static void register(SauravScript engine) {

        engine.registerFunction("upper", args -> {
            requireArgs("upper", args, 1);
            return Value.string(str("upper", args.get(0)).toUpperCase(Locale.ROOT));
        });

        engine.registerFunction("lower", args -> {
            requireArgs("lower", args, 1);
            return Value.string(str("lower", args.get(0)).toLowerCase(Locale.ROOT));
        });

        engine.registerFunction("trim", args -> {
            requireArgs("trim", args, 1);
            return Value.string(str("trim", args.get(0)).strip());
        });

        engine.registerFunction("replace", args -> {
            requireArgs("replace", args, 3);
            String s = str("replace", args.get(0));
            return Value.string(s.replace(str("replace", args.get(1)), str("replace", args.get(2))));
        });

        engine.registerFunction("split", args -> {
            requireArgs("split", args, 2);
            String s = str("split", args.get(0));
            String sep = str("split", args.get(1));
            if (sep.isEmpty()) throw new SauravRuntimeException("split separator must not be empty");

            List<Value> parts = new ArrayList<>();
            int from = 0;
            int at;
            while ((at = s.indexOf(sep, from)) >= 0) {
                parts.add(Value.string(s.substring(from, at)));
                from = at + sep.length();
            }
            parts.add(Value.string(s.substring(from)));
            return Value.list(parts);
        });

        engine.registerFunction("join", args -> {
            requireArgs("join", args, 2);
            String sep = str("join", args.get(0));
            if (args.get(1).getType() != Value.Type.LIST) {
                throw new SauravRuntimeException("join expects a separator and a list");
            }
            StringBuilder sb = new StringBuilder();
            List<Value> items = args.get(1).asList();
            for (int i = 0; i < items.size(); i++) {
                if (i > 0) sb.append(sep);
                sb.append(ValueFormatter.format(items.get(i)));
            }
            return Value.string(sb.toString());
        });

        engine.registerFunction("contains", args -> {
            requireArgs("contains", args, 2);
            Value haystack = args.get(0);
            Value needle = args.get(1);
            switch (haystack.getType()) {
                case STRING:
                    return Value.bool(haystack.asString().contains(str("contains", needle)));
                case LIST:
                    return Value.bool(haystack.asList().contains(needle));
                case MAP:
                    return Value.bool(haystack.asMap().containsKey(needle));
                default:
                    throw new SauravRuntimeException("contains expects a string, list or map");
            }
        });

        engine.registerFunction("starts_with", args -> {
            requireArgs("starts_with", args, 2);
            return Value.bool(str("starts_with", args.get(0)).startsWith(str("starts_with", args.get(1))));
        });

        engine.registerFunction("ends_with", args -> {
            requireArgs("ends_with", args, 2);
            return Value.bool(str("ends_with", args.get(0)).endsWith(str("ends_with", args.get(1))));
        });

        engine.registerFunction("substring", args -> {
            requireArgs("substring", args, 3);
            String s = str("substring", args.get(0));
            int start = sliceBound((long) num("substring", args.get(1)), s.length());
            int end = sliceBound((long) num("substring", args.get(2)), s.length());
            return Value.string(start >= end ? "" : s.substring(start, end));
        });

        engine.registerFunction("index_of", args -> {
            requireArgs("index_of", args, 2);
            Value target = args.get(0);
            if (target.getType() == Value.Type.STRING) {
                return Value.number(target.asString().indexOf(str("index_of", args.get(1))));
            }
            if (target.getType() == Value.Type.LIST) {
                return Value.number(target.asList().indexOf(args.get(1)));
            }
            throw new SauravRuntimeException("index_of expects a string or list");
        });

        engine.registerFunction("char_at", args -> {
            requireArgs("char_at", args, 2);
            String s = str("char_at", args.get(0));
            long i = (long) num("char_at", args.get(1));
            if (i < 0 || i >= s.length()) {
                throw new SauravRuntimeException("char_at index " + i + " out of bounds (length " + s.length() + ")");
            }
            return Value.string(String.valueOf(s.charAt((int) i)));
        });
    }

    /** Slice-style bound: negative counts from the end, then clamped to {@code [0, length]}. */
    private static int sliceBound(long i, int length) {
        if (i < 0) i += length;
        if (i < 0) return 0;
        return (int) Math.min(i, length);
    }
}
