package com.sauravcode.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.sauravcode.script.parser.Statement.Stmt;

public class UserFunction {
    final String name;
    final List<Token> params;
    final List<Stmt> body;

    UserFunction(String name, List<Token> params, List<Stmt> body) {
        this.name = name;
        this.params = params;
        this.body = body;
    }

    public String getName() { return name; }

    public List<String> getParameterNames() {
        List<String> names = new ArrayList<>();
        for (Token p : params) names.add(p.lexeme);
        return Collections.unmodifiableList(names);
    }

    /**
     * Binds arguments by position and runs the body. Extra arguments are ignored and
     * missing trailing parameters stay unbound. The caller owns the {@link Interpreter.CallScope}
     * that restores the variable table afterwards.
     */
    Value call(Interpreter interpreter, List<Value> args) {
        int bound = Math.min(params.size(), args.size());
        for (int i = 0; i < bound; i++) {
            interpreter.environment().assign(params.get(i).lexeme, args.get(i));
        }

        Completion completion = interpreter.executeBlock(body);
        return completion.isReturn() ? completion.value : Value.unit();
    }
}
