package com.sauravcode.script.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Value {
    public enum Type { NUMBER, BOOL, STRING, LIST, MAP, UNIT }

    private static final Value UNIT = new Value(Type.UNIT, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) { return new Value(Type.STRING, s); }
    public static Value list(List<Value> items) { return new Value(Type.LIST, items); }
    public static Value map(Map<Value, Value> entries) { return new Value(Type.MAP, entries); }
    public static Value unit() { return UNIT; }

    public static Value emptyList() { return list(new ArrayList<>()); }
    public static Value emptyMap() { return map(new LinkedHashMap<>()); }

    public Type getType() { return type; }

    public boolean isUnit() { return type == Type.UNIT; }

    /** Name reported by {@code type_of} and in error messages. */
    public String typeName() {
        switch (type) {
            case NUMBER: return "number";
            case BOOL:   return "bool";
            case STRING: return "string";
            case LIST:   return "list";
            case MAP:    return "map";
            default:     return "unknown";
        }
    }

    public double asNumber() {
        if (type != Type.NUMBER) throw new SauravRuntimeException("Expected number, got " + typeName());
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new SauravRuntimeException("Expected bool, got " + typeName());
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new SauravRuntimeException("Expected string, got " + typeName());
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        if (type != Type.LIST) throw new SauravRuntimeException("Expected list, got " + typeName());
        return (List<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<Value, Value> asMap() {
        if (type != Type.MAP) throw new SauravRuntimeException("Expected map, got " + typeName());
        return (Map<Value, Value>) value;
    }

    /** Numbers, strings and bools may key a map; lists, maps and unit may not. */
    public boolean isHashable() {
        return type == Type.NUMBER || type == Type.STRING || type == Type.BOOL;
    }

    public boolean isTruthy() {
        switch (type) {
            case BOOL:   return (boolean) value;
            case NUMBER: return (double) value != 0.0;
            case STRING: return !((String) value).isEmpty();
            case LIST:
            case MAP:    return true;
            default:     return false;
        }
    }

    /**
     * Value equality: same type and equal payload. Numbers compare with IEEE {@code ==},
     * so {@code 0.0} equals {@code -0.0}; lists and maps compare element-wise.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        switch (type) {
            case NUMBER: return (double) value == (double) other.value;
            case UNIT:   return true;
            default:     return value.equals(other.value);
        }
    }

    @Override
    public int hashCode() {
        switch (type) {
            case NUMBER: {
                double d = (double) value;
                // -0.0 and 0.0 are equal, so they must hash alike
                return Double.hashCode(d == 0.0 ? 0.0 : d);
            }
            case UNIT: return 0;
            default:   return type.hashCode() * 31 + value.hashCode();
        }
    }

    @Override
    public String toString() {
        return ValueFormatter.repr(this);
    }
}
