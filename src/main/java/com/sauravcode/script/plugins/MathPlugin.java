package com.sauravcode.script.plugins;

import static com.sauravcode.script.plugins.PluginArgs.num;
import static com.sauravcode.script.plugins.PluginArgs.requireArgs;

import java.math.BigDecimal;
import java.math.RoundingMode;

import com.sauravcode.script.SauravScript;
import com.sauravcode.script.parser.SauravRuntimeException;
import com.sauravcode.script.parser.Value;

/**
 * MathPlugin
 *
 * Numeric built-ins:
 *
 *   print abs (-42)
 *   print round 3.14159 2
 *   print power 2 10
 */
public final class MathPlugin {

    private static final int MAX_INTEGER_DIGITS = 309;

    private MathPlugin() {}

    public static void register(SauravScript engine) {

        engine.registerFunction("abs", args -> {
            requireArgs("abs", args, 1);
            return Value.number(Math.abs(num("abs", args.get(0))));
        });

        engine.registerFunction("round", args -> {
            requireArgs("round", args, 1, 2);
            double x = num("round", args.get(0));
            if (args.size() == 1) {
                // rint rounds half to even
                return Value.number(Math.rint(x));
            }
            double places = num("round", args.get(1));
            if (Double.isNaN(x) || Double.isInfinite(x)) return Value.number(x);
            BigDecimal exact = new BigDecimal(x);
            // a double has at most 1074 fractional digits and stays below 1e309
            if (places >= exact.scale()) return Value.number(x);
            if (places < -MAX_INTEGER_DIGITS) return Value.number(0.0);
            return Value.number(exact.setScale((int) places, RoundingMode.HALF_EVEN).doubleValue());
        });

        engine.registerFunction("floor", args -> {
            requireArgs("floor", args, 1);
            return Value.number(Math.floor(num("floor", args.get(0))));
        });

        engine.registerFunction("ceil", args -> {
            requireArgs("ceil", args, 1);
            return Value.number(Math.ceil(num("ceil", args.get(0))));
        });

        engine.registerFunction("sqrt", args -> {
            requireArgs("sqrt", args, 1);
            double x = num("sqrt", args.get(0));
            if (x < 0) throw new SauravRuntimeException("sqrt of negative number");
            return Value.number(Math.sqrt(x));
        });

        engine.registerFunction("power", args -> {
            requireArgs("power", args, 2);
            return Value.number(Math.pow(num("power", args.get(0)), num("power", args.get(1))));
        });
    }
}
