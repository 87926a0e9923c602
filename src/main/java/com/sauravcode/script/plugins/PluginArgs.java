package com.sauravcode.script.plugins;

import java.util.List;
import java.util.Map;

import com.sauravcode.script.parser.SauravRuntimeException;
import com.sauravcode.script.parser.Value;

/** Argument checks shared by the built-in plugins. */
final class PluginArgs {

    private PluginArgs() {}

    static void requireArgs(String fn, List<Value> args, int n) {
        if (args.size() != n) {
            throw new SauravRuntimeException(fn + " expects " + n + (n == 1 ? " argument" : " arguments") + ", got " + args.size());
        }
    }

    static void requireArgs(String fn, List<Value> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            throw new SauravRuntimeException(fn + " expects " + min + " to " + max + " arguments, got " + args.size());
        }
    }

    static String str(String fn, Value v) {
        if (v.getType() != Value.Type.STRING) throw new SauravRuntimeException(fn + " expects a string");
        return v.asString();
    }

    static double num(String fn, Value v) {
        if (v.getType() != Value.Type.NUMBER) throw new SauravRuntimeException(fn + " expects a number");
        return v.asNumber();
    }

    static List<Value> list(String fn, Value v) {
        if (v.getType() != Value.Type.LIST) throw new SauravRuntimeException(fn + " expects a list");
        return v.asList();
    }

    static Map<Value, Value> map(String fn, Value v) {
        if (v.getType() != Value.Type.MAP) throw new SauravRuntimeException(fn + " expects a map");
        return v.asMap();
    }
}
