package com.sauravcode.script.parser;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Text rendering of runtime values, shared by {@code print}, f-strings, {@code to_string}
 * and {@code join}.
 *
 * Top-level strings render raw; strings nested in a list or map render double-quoted.
 */
public final class ValueFormatter {

    private ValueFormatter() {}

    /** Rendering used by {@code print}: strings unquoted. */
    public static String format(Value v) {
        if (v.getType() == Value.Type.STRING) return v.asString();
        return repr(v);
    }

    /** Rendering used for collection elements: strings quoted. */
    public static String repr(Value v) {
        switch (v.getType()) {
            case NUMBER: return formatNumber(v.asNumber());
            case BOOL:   return v.asBool() ? "true" : "false";
            case STRING: return '"' + v.asString() + '"';
            case LIST:   return formatList(v.asList());
            case MAP:    return formatMap(v.asMap());
            default:     return "none";
        }
    }

    /**
     * Integer-valued numbers print without a fractional part; everything else prints its
     * shortest decimal form, switching to {@code 1.5e-07} style below 1e-4.
     */
    public static String formatNumber(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == Math.rint(d)) {
            if (Math.abs(d) < 1e15) return Long.toString((long) d);
            return new BigDecimal(d).toBigInteger().toString();
        }

        BigDecimal bd = new BigDecimal(Double.toString(d)).stripTrailingZeros();
        int exponent = bd.precision() - bd.scale() - 1;
        if (exponent >= -4) return bd.toPlainString();

        String digits = bd.unscaledValue().abs().toString();
        StringBuilder sb = new StringBuilder();
        if (d < 0) sb.append('-');
        sb.append(digits.charAt(0));
        if (digits.length() > 1) sb.append('.').append(digits, 1, digits.length());
        sb.append("e-");
        int magnitude = -exponent;
        if (magnitude < 10) sb.append('0');
        sb.append(magnitude);
        return sb.toString();
    }

    private static String formatList(List<Value> items) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(repr(items.get(i)));
        }
        return sb.append(']').toString();
    }

    private static String formatMap(Map<Value, Value> entries) {
        StringBuilder sb = new StringBuilder("{");
        Iterator<Map.Entry<Value, Value>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Value, Value> e = it.next();
            sb.append(repr(e.getKey())).append(": ").append(repr(e.getValue()));
            if (it.hasNext()) sb.append(", ");
        }
        return sb.append('}').toString();
    }
}
