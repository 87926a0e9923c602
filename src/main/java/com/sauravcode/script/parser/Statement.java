package com.sauravcode.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        <R> R accept(StmtVisitor<R> visitor);
    }

    public interface StmtVisitor<R> {
        R visitAssignmentStmt(Assignment stmt);
        R visitIndexedAssignmentStmt(IndexedAssignment stmt);
        R visitFunctionStmt(FunctionDef stmt);
        R visitReturnStmt(Return stmt);
        R visitPrintStmt(Print stmt);
        R visitIfStmt(If stmt);
        R visitWhileStmt(While stmt);
        R visitForStmt(ForRange stmt);
        R visitTryStmt(TryCatch stmt);
        R visitThrowStmt(Throw stmt);
        R visitAppendStmt(Append stmt);
        R visitCallStmt(CallStmt stmt);
    }

    public static final class Assignment implements Stmt {
        public final Token name;
        public final Expr.ExprInterface value;

        Assignment(Token name, Expr.ExprInterface value) {
            this.name = name;
            this.value = value;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitAssignmentStmt(this); }
    }

    /** {@code name[index] = value} on a list or map held by {@code name}. */
    public static final class IndexedAssignment implements Stmt {
        public final Token name;
        public final Expr.ExprInterface index;
        public final Expr.ExprInterface value;

        IndexedAssignment(Token name, Expr.ExprInterface index, Expr.ExprInterface value) {
            this.name = name;
            this.index = index;
            this.value = value;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIndexedAssignmentStmt(this); }
    }

    public static final class FunctionDef implements Stmt {
        public final Token name;
        public final List<Token> params;
        public final List<Stmt> body;

        FunctionDef(Token name, List<Token> params, List<Stmt> body) {
            this.name = name;
            this.params = params;
            this.body = body;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitFunctionStmt(this); }
    }

    public static final class Return implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface value; // may be null

        Return(Token keyword, Expr.ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitReturnStmt(this); }
    }

    public static final class Print implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface expression;

        Print(Token keyword, Expr.ExprInterface expression) {
            this.keyword = keyword;
            this.expression = expression;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitPrintStmt(this); }
    }

    /** An {@code else if} arm of an {@link If}. */
    public static final class ElseIf {
        public final Expr.ExprInterface condition;
        public final List<Stmt> body;

        ElseIf(Expr.ExprInterface condition, List<Stmt> body) {
            this.condition = condition;
            this.body = body;
        }
    }

    public static final class If implements Stmt {
        public final Expr.ExprInterface condition;
        public final List<Stmt> body;
        public final List<ElseIf> elseIfs;
        public final List<Stmt> elseBody; // may be null

        If(Expr.ExprInterface condition, List<Stmt> body, List<ElseIf> elseIfs, List<Stmt> elseBody) {
            this.condition = condition;
            this.body = body;
            this.elseIfs = elseIfs;
            this.elseBody = elseBody;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIfStmt(this); }
    }

    public static final class While implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface condition;
        public final List<Stmt> body;

        While(Token keyword, Expr.ExprInterface condition, List<Stmt> body) {
            this.keyword = keyword;
            this.condition = condition;
            this.body = body;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitWhileStmt(this); }
    }

    /** {@code for var start end}: counts from start up to, not including, end. */
    public static final class ForRange implements Stmt {
        public final Token var;
        public final Expr.ExprInterface start;
        public final Expr.ExprInterface end;
        public final List<Stmt> body;

        ForRange(Token var, Expr.ExprInterface start, Expr.ExprInterface end, List<Stmt> body) {
            this.var = var;
            this.start = start;
            this.end = end;
            this.body = body;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitForStmt(this); }
    }

    public static final class TryCatch implements Stmt {
        public final List<Stmt> body;
        public final Token catchVar;
        public final List<Stmt> handler;

        TryCatch(List<Stmt> body, Token catchVar, List<Stmt> handler) {
            this.body = body;
            this.catchVar = catchVar;
            this.handler = handler;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitTryStmt(this); }
    }

    public static final class Throw implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface value;

        Throw(Token keyword, Expr.ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitThrowStmt(this); }
    }

    public static final class Append implements Stmt {
        public final Token listName;
        public final Expr.ExprInterface value;

        Append(Token listName, Expr.ExprInterface value) {
            this.listName = listName;
            this.value = value;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitAppendStmt(this); }
    }

    /** A bare call used as a statement; REPL callers echo its result. */
    public static final class CallStmt implements Stmt {
        public final Expr.FunctionCall call;

        CallStmt(Expr.FunctionCall call) {
            this.call = call;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitCallStmt(this); }
    }
}
