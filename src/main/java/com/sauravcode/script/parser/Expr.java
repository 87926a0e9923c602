package com.sauravcode.script.parser;

import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitNumberExpr(NumberLiteral expr);
        R visitStringExpr(StringLiteral expr);
        R visitBoolExpr(BoolLiteral expr);
        R visitIdentifierExpr(Identifier expr);
        R visitBinaryExpr(BinaryOp expr);
        R visitCompareExpr(Compare expr);
        R visitLogicalExpr(Logical expr);
        R visitUnaryExpr(Unary expr);
        R visitListExpr(ListLiteral expr);
        R visitMapExpr(MapLiteral expr);
        R visitIndexExpr(Index expr);
        R visitLenExpr(Len expr);
        R visitFStringExpr(FStringLiteral expr);
        R visitCallExpr(FunctionCall expr);
    }

    // -------------------------
    // Literals
    // -------------------------

    public static final class NumberLiteral implements ExprInterface {
        public final double value;

        public NumberLiteral(double value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNumberExpr(this);
        }
    }

    public static final class StringLiteral implements ExprInterface {
        public final String value;

        public StringLiteral(String value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitStringExpr(this);
        }
    }

    public static final class BoolLiteral implements ExprInterface {
        public final boolean value;

        public BoolLiteral(boolean value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBoolExpr(this);
        }
    }

    public static final class ListLiteral implements ExprInterface {
        public final List<ExprInterface> elements;

        public ListLiteral(List<ExprInterface> elements) {
            this.elements = elements;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitListExpr(this);
        }
    }

    /** One {@code key: value} pair of a map literal; keys are arbitrary expressions. */
    public static final class MapEntry {
        public final ExprInterface key;
        public final ExprInterface value;

        public MapEntry(ExprInterface key, ExprInterface value) {
            this.key = key;
            this.value = value;
        }
    }

    public static final class MapLiteral implements ExprInterface {
        public final List<MapEntry> entries; // source order

        public MapLiteral(List<MapEntry> entries) {
            this.entries = entries;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMapExpr(this);
        }
    }

    /**
     * Interpolated string. Literal text segments are {@link StringLiteral} parts; every
     * other part is an embedded expression, in source order.
     */
    public static final class FStringLiteral implements ExprInterface {
        public final List<ExprInterface> parts;

        public FStringLiteral(List<ExprInterface> parts) {
            this.parts = parts;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFStringExpr(this);
        }
    }

    // -------------------------
    // Names and operators
    // -------------------------

    public static final class Identifier implements ExprInterface {
        public final Token name;

        public Identifier(Token name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIdentifierExpr(this);
        }
    }

    /** Arithmetic: {@code + - * / %}. */
    public static final class BinaryOp implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public BinaryOp(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    /** Comparison: {@code == != < > <= >=}. Never chained. */
    public static final class Compare implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Compare(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCompareExpr(this);
        }
    }

    /** {@code and} / {@code or}, short-circuiting. */
    public static final class Logical implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Logical(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }

    /** {@code not} or numeric negation. */
    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface operand;

        public Unary(Token operator, ExprInterface operand) {
            this.operator = operator;
            this.operand = operand;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    public static final class Index implements ExprInterface {
        public final ExprInterface target;
        public final ExprInterface index;
        public final Token bracket;

        public Index(ExprInterface target, ExprInterface index, Token bracket) {
            this.target = target;
            this.index = index;
            this.bracket = bracket;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }
    }

    public static final class Len implements ExprInterface {
        public final Token keyword;
        public final ExprInterface operand;

        public Len(Token keyword, ExprInterface operand) {
            this.keyword = keyword;
            this.operand = operand;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLenExpr(this);
        }
    }

    // -------------------------
    // Calls
    // -------------------------

    /** {@code name arg1 arg2 ...}: space-separated arguments, no parentheses or commas. */
    public static final class FunctionCall implements ExprInterface {
        public final Token name;
        public final List<ExprInterface> arguments;

        public FunctionCall(Token name, List<ExprInterface> arguments) {
            this.name = name;
            this.arguments = arguments;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }
}
