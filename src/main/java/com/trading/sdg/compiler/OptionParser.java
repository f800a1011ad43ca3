package com.trading.sdg.compiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trading.sdg.api.OperationMetadata;
import com.trading.sdg.api.OptionDefinition;
import com.trading.sdg.api.OptionValue;
import com.trading.sdg.compiler.parser.Ast;

/**
 * Turns constructor keyword arguments into typed option values. Dict and list
 * values become schema JSON; variables inside a schema are written as
 * {@code "<node_id>#<handle>"} references.
 */
final class OptionParser {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final CompilationContext ctx;

    OptionParser(CompilationContext ctx) {
        this.ctx = ctx;
    }

    OptionValue parse(Ast.Expr expr, OptionDefinition def, OperationMetadata meta) {
        String where = "option '" + def.id() + "' of '" + meta.getType() + "'";
        OptionValue value;
        if (def.kind() == OptionValue.Kind.SCHEMA) {
            value = OptionValue.schema(toJson(toPlain(expr, where), where, expr.line()));
        } else {
            Object raw = constantValue(expr, where);
            value = switch (def.kind()) {
                case INTEGER -> {
                    if (raw instanceof Long l)
                        yield OptionValue.integer(l);
                    if (raw instanceof Double d && d == Math.rint(d))
                        yield OptionValue.integer(d.longValue());
                    throw invalid(where, "expected an integer but got " + describe(raw), expr.line());
                }
                case DECIMAL -> {
                    if (raw instanceof Number n)
                        yield OptionValue.decimal(n.doubleValue());
                    throw invalid(where, "expected a number but got " + describe(raw), expr.line());
                }
                case BOOLEAN -> {
                    if (raw instanceof Boolean b)
                        yield OptionValue.bool(b);
                    throw invalid(where, "expected True or False but got " + describe(raw), expr.line());
                }
                case STRING, SELECT -> {
                    if (raw instanceof String s)
                        yield def.kind() == OptionValue.Kind.STRING ? OptionValue.string(s) : OptionValue.select(s);
                    throw invalid(where, "expected a string but got " + describe(raw), expr.line());
                }
                case SCHEMA -> throw new IllegalStateException("unreachable");
            };
        }
        String err = def.check(value);
        if (err != null)
            throw invalid(where, err, expr.line());
        return value;
    }

    /** Literal value of an expression: a constant, a negated number or a variable bound to a literal. */
    private Object constantValue(Ast.Expr expr, String where) {
        if (expr instanceof Ast.Constant c) {
            if (c.value() == null)
                throw invalid(where, "None is not a valid option value", expr.line());
            return c.value();
        }
        if (expr instanceof Ast.UnaryOp u && u.op() == Ast.UnaryOperator.NEG
                && u.operand() instanceof Ast.Constant c) {
            if (c.value() instanceof Long l)
                return -l;
            if (c.value() instanceof Double d)
                return -d;
        }
        if (expr instanceof Ast.Name n) {
            CompilationContext.Binding b = ctx.binding(n.id());
            if (b != null && b.kind() == CompilationContext.Binding.Kind.LITERAL && !b.literal().isNull())
                return b.literal().value();
            // Bare identifiers stand for select values, e.g. agg=mean
            if (b == null)
                return n.id();
        }
        throw invalid(where, "option values must be constants", expr.line());
    }

    private Object toPlain(Ast.Expr expr, String where) {
        if (expr instanceof Ast.DictExpr d) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (int i = 0; i < d.keys().size(); i++) {
                if (!(d.keys().get(i) instanceof Ast.Constant k) || !(k.value() instanceof String key))
                    throw invalid(where, "dict keys must be strings", expr.line());
                out.put(key, toPlain(d.values().get(i), where));
            }
            return out;
        }
        if (expr instanceof Ast.ListExpr l)
            return plainList(l.elements(), where);
        if (expr instanceof Ast.TupleExpr t)
            return plainList(t.elements(), where);
        if (expr instanceof Ast.Constant c)
            return c.value();
        if (expr instanceof Ast.Name n) {
            CompilationContext.Binding b = ctx.binding(n.id());
            if (b == null)
                return n.id();
            return switch (b.kind()) {
                case LITERAL -> b.literal().value();
                case HANDLE -> b.nodeId() + "#" + b.handle();
                case NODE -> {
                    var outputs = ctx.metadata(ctx.node(b.nodeId()).getType(), expr.line()).getOutputs();
                    if (outputs.size() != 1)
                        throw invalid(where, "'" + n.id() + "' has several outputs; select one", expr.line());
                    yield b.nodeId() + "#" + outputs.get(0).id();
                }
            };
        }
        if (expr instanceof Ast.Attribute a && a.value() instanceof Ast.Name n) {
            CompilationContext.Binding b = ctx.binding(n.id());
            if (b != null && b.kind() == CompilationContext.Binding.Kind.NODE)
                return b.nodeId() + "#" + a.attr();
        }
        return constantValue(expr, where);
    }

    private List<Object> plainList(List<Ast.Expr> elements, String where) {
        List<Object> out = new ArrayList<>(elements.size());
        for (Ast.Expr e : elements)
            out.add(toPlain(e, where));
        return out;
    }

    private static String toJson(Object plain, String where, int line) {
        try {
            return JSON.writeValueAsString(plain);
        } catch (JsonProcessingException e) {
            throw invalid(where, "cannot serialize value: " + e.getOriginalMessage(), line);
        }
    }

    private static String describe(Object raw) {
        if (raw instanceof String s)
            return "'" + s + "'";
        return String.valueOf(raw);
    }

    private static CompileException invalid(String where, String detail, int line) {
        return new CompileException(CompileErrorKind.INVALID_OPTION_VALUE, "Invalid value for " + where + ": " + detail,
                line);
    }
}
