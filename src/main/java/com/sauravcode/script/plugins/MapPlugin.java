package com.sauravcode.script.plugins;

import static com.sauravcode.script.plugins.PluginArgs.map;
import static com.sauravcode.script.plugins.PluginArgs.requireArgs;

import java.util.ArrayList;

import com.sauravcode.script.SauravScript;
import com.sauravcode.script.parser.Value;

/** Map built-ins: {@code keys}, {@code values}, {@code has_key}. Results follow insertion order. */
public final class MapPlugin {

    private MapPlugin() {}

    public static void register(SauravScript engine) {

        engine.registerFunction("keys", args -> {
            requireArgs("keys", args, 1);
            return Value.list(new ArrayList<>(map("keys", args.get(0)).keySet()));
        });

        engine.registerFunction("values", args -> {
            requireArgs("values", args, 1);
            return Value.list(new ArrayList<>(map("values", args.get(0)).values()));
        });

        engine.registerFunction("has_key", args -> {
            requireArgs("has_key", args, 2);
            return Value.bool(map("has_key", args.get(0)).containsKey(args.get(1)));
        });
    }
}
