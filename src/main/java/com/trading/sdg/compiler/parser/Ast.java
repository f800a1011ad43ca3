package com.trading.sdg.compiler.parser;

import java.util.List;

/**
 * Syntax tree of a strategy script. Every node carries its 1-based source line.
 */
public final class Ast {

    private Ast() {
    }

    public interface Expr {
        int line();
    }

    public interface Stmt {
        int line();
    }

    /** Whole script. */
    public record Module(List<Stmt> body) {
    }

    // ── Statements ──────────────────────────────────────────────────

    /** {@code a = expr} or {@code a, b = expr}. */
    public record Assign(List<String> targets, boolean tuple, Expr value, int line) implements Stmt {
    }

    /** Bare expression, typically a sink call. */
    public record ExprStmt(Expr value, int line) implements Stmt {
    }

    // ── Expressions ─────────────────────────────────────────────────

    /** Integer ({@link Long}), float ({@link Double}), string, boolean or {@code None} (null). */
    public record Constant(Object value, int line) implements Expr {
    }

    public record Name(String id, int line) implements Expr {
    }

    public record Attribute(Expr value, String attr, int line) implements Expr {
    }

    public record Keyword(String name, Expr value) {
    }

    public record Call(Expr func, List<Expr> args, List<Keyword> keywords, int line) implements Expr {
    }

    public record Subscript(Expr value, Expr index, int line) implements Expr {
    }

    public enum BinaryOperator {
        ADD, SUB, MUL, DIV, MOD, POW, BIT_AND, BIT_OR
    }

    public record BinOp(Expr left, BinaryOperator op, Expr right, int line) implements Expr {
    }

    public enum UnaryOperator {
        NEG, POS, NOT, INVERT
    }

    public record UnaryOp(UnaryOperator op, Expr operand, int line) implements Expr {
    }

    /** {@code and} / {@code or} over two or more operands. */
    public record BoolOp(boolean and, List<Expr> values, int line) implements Expr {
    }

    public enum CompareOperator {
        LT, GT, LTE, GTE, EQ, NEQ
    }

    /** Comparison chain; the compiler only accepts a single operator. */
    public record Compare(Expr left, List<CompareOperator> ops, List<Expr> comparators, int line) implements Expr {
    }

    /** {@code body if test else orElse}. */
    public record IfExp(Expr test, Expr body, Expr orElse, int line) implements Expr {
    }

    public record ListExpr(List<Expr> elements, int line) implements Expr {
    }

    public record TupleExpr(List<Expr> elements, int line) implements Expr {
    }

    public record DictExpr(List<Expr> keys, List<Expr> values, int line) implements Expr {
    }
}
