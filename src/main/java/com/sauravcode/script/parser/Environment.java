package com.sauravcode.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The two tables of an interpreter session: user functions and variables.
 *
 * There is a single variable table. A call snapshots it, lets the callee read and
 * overwrite the caller's variables, then puts the snapshot back, so a callee sees its
 * caller's names but its assignments never outlive the call.
 */
public class Environment {
    private final Map<String, UserFunction> functions = new LinkedHashMap<>();
    private Map<String, Value> variables = new LinkedHashMap<>();

    public Value get(String name) {
        return variables.get(name);
    }

    public boolean contains(String name) {
        return variables.containsKey(name);
    }

    public void assign(String name, Value value) {
        variables.put(name, value);
    }

    public void defineFunction(UserFunction fn) {
        functions.put(fn.name, fn);
    }

    public UserFunction getFunction(String name) {
        return functions.get(name);
    }

    public boolean hasFunction(String name) {
        return functions.containsKey(name);
    }

    /** Read-only live view of the variable table. */
    public Map<String, Value> variables() {
        return Collections.unmodifiableMap(variables);
    }

    /** Read-only live view of the function table. */
    public Map<String, UserFunction> functions() {
        return Collections.unmodifiableMap(functions);
    }

    /** Shallow copy: the value objects themselves (lists, maps) stay shared. */
    Map<String, Value> snapshot() {
        return new LinkedHashMap<>(variables);
    }

    void restore(Map<String, Value> snapshot) {
        variables = snapshot;
    }
}
