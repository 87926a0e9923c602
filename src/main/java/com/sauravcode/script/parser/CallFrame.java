package com.sauravcode.script.parser;

public class CallFrame {
    final String functionName;
    final int line;

    CallFrame(String functionName, int line) {
        this.functionName = functionName;
        this.line = line;
    }

    @Override
    public String toString() {
        return functionName + " (line " + line + ")";
    }
}
