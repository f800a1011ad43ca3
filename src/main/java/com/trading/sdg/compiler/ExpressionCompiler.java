package com.trading.sdg.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

import com.trading.sdg.api.Constant;
import com.trading.sdg.api.DataType;
import com.trading.sdg.api.IOSlot;
import com.trading.sdg.api.InputValue;
import com.trading.sdg.api.Node;
import com.trading.sdg.api.OperationMetadata;
import com.trading.sdg.api.OptionDefinition;
import com.trading.sdg.api.OptionValue;
import com.trading.sdg.api.Session;
import com.trading.sdg.api.Timeframe;
import com.trading.sdg.compiler.parser.Ast;

/**
 * Lowers expressions to {@link InputValue}s, creating nodes for calls and
 * operators on the way. Literals stay inline as {@link InputValue.Literal}.
 * <p>
 * A constructor call is a chain {@code op(options)(inputs)...}: keyword
 * arguments of the first call are options (or the special {@code timeframe}
 * and {@code session} parameters), later calls feed inputs. Operations without
 * options also accept their inputs positionally in the first call.
 */
final class ExpressionCompiler {

    static final String RESULT = "result";

    private final CompilationContext ctx;
    private final TypeChecker types;
    private final OptionParser options;

    ExpressionCompiler(CompilationContext ctx) {
        this.ctx = ctx;
        this.types = new TypeChecker(ctx.registry(), ctx::node);
        this.options = new OptionParser(ctx);
    }

    TypeChecker types() {
        return types;
    }

    InputValue visit(Ast.Expr expr) {
        if (expr instanceof Ast.Constant c)
            return InputValue.literal(constant(c));
        if (expr instanceof Ast.Name n)
            return visitName(n);
        if (expr instanceof Ast.Attribute a)
            return visitAttribute(a);
        if (expr instanceof Ast.Call c)
            return visitCall(c);
        if (expr instanceof Ast.BinOp b)
            return visitBinOp(b);
        if (expr instanceof Ast.UnaryOp u)
            return visitUnaryOp(u);
        if (expr instanceof Ast.BoolOp b)
            return visitBoolOp(b);
        if (expr instanceof Ast.Compare c)
            return visitCompare(c);
        if (expr instanceof Ast.IfExp i)
            return visitIfExp(i);
        if (expr instanceof Ast.Subscript s)
            return visitSubscript(s);
        throw new CompileException(CompileErrorKind.DISALLOWED_CONSTRUCT,
                "Disallowed construct: list, tuple and dict literals are only allowed as option values", expr.line());
    }

    static Constant constant(Ast.Constant c) {
        Object v = c.value();
        if (v == null)
            return Constant.nullOf(DataType.ANY);
        if (v instanceof Long l)
            return Constant.integer(l);
        if (v instanceof Double d)
            return Constant.decimal(d);
        if (v instanceof Boolean b)
            return Constant.bool(b);
        return Constant.string((String) v);
    }

    // ── Names and handles ───────────────────────────────────────────

    private InputValue visitName(Ast.Name n) {
        CompilationContext.Binding b = ctx.binding(n.id());
        if (b == null)
            throw new CompileException(CompileErrorKind.UNBOUND_VARIABLE, "Unknown variable '" + n.id() + "'",
                    n.line());
        return switch (b.kind()) {
            case LITERAL -> InputValue.literal(b.literal());
            case HANDLE -> InputValue.ref(b.nodeId(), b.handle());
            case NODE -> InputValue.ref(b.nodeId(), singleOutput(b.nodeId(), n.id(), n.line()));
        };
    }

    private String singleOutput(String nodeId, String label, int line) {
        OperationMetadata meta = ctx.metadata(ctx.node(nodeId).getType(), line);
        List<IOSlot> outs = meta.getOutputs();
        if (outs.size() == 1)
            return outs.get(0).id();
        if (outs.isEmpty())
            throw new CompileException(CompileErrorKind.UNKNOWN_OUTPUT,
                    "'" + label + "' (" + meta.getType() + ") has no outputs", line);
        throw new CompileException(CompileErrorKind.UNKNOWN_OUTPUT, "'" + label + "' (" + meta.getType()
                + ") has " + outs.size() + " outputs " + handles(outs) + "; select one, e.g. " + label + "."
                + outs.get(0).id(), line);
    }

    private InputValue visitAttribute(Ast.Attribute a) {
        String nodeId;
        if (a.value() instanceof Ast.Name n) {
            CompilationContext.Binding b = ctx.binding(n.id());
            if (b == null)
                throw new CompileException(CompileErrorKind.UNBOUND_VARIABLE, "Unknown variable '" + n.id() + "'",
                        a.line());
            if (b.kind() != CompilationContext.Binding.Kind.NODE)
                throw new CompileException(CompileErrorKind.UNKNOWN_OUTPUT,
                        "'" + n.id() + "' is a single value and has no output '" + a.attr() + "'", a.line());
            nodeId = b.nodeId();
        } else if (a.value() instanceof Ast.Call c && isConstructorCall(c)) {
            nodeId = construct(c, ctx::uniqueId).getId();
        } else {
            throw new CompileException(CompileErrorKind.SYNTAX_ERROR,
                    "Output handles can only be selected from a variable or a call", a.line());
        }
        OperationMetadata meta = ctx.metadata(ctx.node(nodeId).getType(), a.line());
        if (meta.output(a.attr()).isEmpty())
            throw new CompileException(CompileErrorKind.UNKNOWN_OUTPUT, "Unknown output handle '" + a.attr()
                    + "' for '" + nodeId + "' (" + meta.getType() + "); outputs are " + handles(meta.getOutputs()),
                    a.line());
        return InputValue.ref(nodeId, a.attr());
    }

    private static String handles(List<IOSlot> slots) {
        List<String> ids = new ArrayList<>(slots.size());
        for (IOSlot s : slots)
            ids.add(s.id());
        return ids.toString();
    }

    // ── Calls ───────────────────────────────────────────────────────

    static boolean isConstructorCall(Ast.Expr expr) {
        Ast.Expr cur = expr;
        if (!(cur instanceof Ast.Call))
            return false;
        while (cur instanceof Ast.Call c)
            cur = c.func();
        return cur instanceof Ast.Name;
    }

    static String constructorName(Ast.Call call) {
        Ast.Expr cur = call;
        while (cur instanceof Ast.Call c)
            cur = c.func();
        return ((Ast.Name) cur).id();
    }

    private InputValue visitCall(Ast.Call call) {
        if (!isConstructorCall(call))
            throw new CompileException(CompileErrorKind.SYNTAX_ERROR,
                    "Right-hand side must be a constructor call such as ema(period=10)(src.c)", call.line());
        OperationMetadata meta = ctx.metadata(constructorName(call), call.line());
        if (meta.isSink())
            throw new CompileException(CompileErrorKind.DISALLOWED_CONSTRUCT,
                    "'" + meta.getType() + "' has no outputs and must be used as a statement", call.line());
        Node node = construct(call, ctx::uniqueId);
        return InputValue.ref(node.getId(), singleOutput(node.getId(), meta.getType(), call.line()));
    }

    /** Naming strategy for a constructed node, given its operation type. */
    @FunctionalInterface
    interface IdChooser {
        String idFor(String type);
    }

    /**
     * Creates the node of a constructor call chain, parses its options and
     * wires every feed step.
     */
    Node construct(Ast.Call call, IdChooser ids) {
        List<Ast.Call> chain = new ArrayList<>();
        Ast.Expr cur = call;
        while (cur instanceof Ast.Call c) {
            chain.add(c);
            cur = c.func();
        }
        Collections.reverse(chain);
        String type = ((Ast.Name) cur).id();
        OperationMetadata meta = ctx.metadata(type, call.line());
        Ast.Call first = chain.get(0);

        Node node = ctx.addNode(ids.idFor(type), type, call.line());

        List<Ast.Keyword> inputKwargs = new ArrayList<>();
        for (Ast.Keyword kw : first.keywords()) {
            switch (kw.name()) {
                case "timeframe" -> node.setTimeframe(timeframe(kw.value()));
                case "session" -> node.setSession(session(kw.value()));
                default -> {
                    var def = meta.option(kw.name());
                    if (def.isPresent())
                        node.option(kw.name(), options.parse(kw.value(), def.get(), meta));
                    else if (meta.input(IOSlot.normalizeHandle(kw.name())).isPresent())
                        inputKwargs.add(kw);
                    else
                        throw CompileException.forNode(CompileErrorKind.UNKNOWN_OPTION, "Unknown option '"
                                + kw.name() + "' for component '" + type + "'", node.getId(), type, kw.name(),
                                first.line());
                }
            }
        }
        for (OptionDefinition def : meta.getOptions()) {
            if (node.getOptions().containsKey(def.id()))
                continue;
            if (def.defaultValue() != null)
                node.option(def.id(), def.defaultValue());
            else if (def.required())
                throw CompileException.forNode(CompileErrorKind.MISSING_REQUIRED_OPTION, "Missing required option '"
                        + def.id() + "' for node '" + node.getId() + "' (type: " + type + ")", node.getId(), type,
                        def.id(), call.line());
        }

        if (!first.args().isEmpty() && !meta.getOptions().isEmpty())
            throw CompileException.forNode(CompileErrorKind.ARGUMENT_COUNT, "Positional constructor arguments not "
                    + "supported for '" + type + "'; pass options by keyword and inputs in a second call, e.g. "
                    + type + "(" + meta.getOptions().get(0).id() + "=...)(x)", node.getId(), type, null,
                    first.line());
        wire(node, meta, first.args(), inputKwargs, first.line());
        for (int i = 1; i < chain.size(); i++)
            wire(node, meta, chain.get(i).args(), chain.get(i).keywords(), chain.get(i).line());
        return node;
    }

    private Timeframe timeframe(Ast.Expr value) {
        String text = specialParameter(value, "timeframe");
        try {
            return Timeframe.parse(text);
        } catch (IllegalArgumentException e) {
            throw new CompileException(CompileErrorKind.INVALID_TIMEFRAME, e.getMessage(), value.line());
        }
    }

    private Session session(Ast.Expr value) {
        String text = specialParameter(value, "session");
        try {
            return Session.parse(text);
        } catch (IllegalArgumentException e) {
            throw new CompileException(CompileErrorKind.INVALID_SESSION_RANGE, e.getMessage(), value.line());
        }
    }

    private String specialParameter(Ast.Expr value, String key) {
        if (value instanceof Ast.Constant c && c.value() instanceof String s)
            return s;
        if (value instanceof Ast.Name n && ctx.binding(n.id()) == null)
            return n.id();
        if (value instanceof Ast.Name n && ctx.binding(n.id()).kind() == CompilationContext.Binding.Kind.LITERAL
                && ctx.binding(n.id()).literal().value() instanceof String s)
            return s;
        throw new CompileException(CompileErrorKind.SYNTAX_ERROR, "Parameter '" + key + "' must be a string",
                value.line());
    }

    // ── Wiring ──────────────────────────────────────────────────────

    void wire(Node node, OperationMetadata meta, List<Ast.Expr> args, List<Ast.Keyword> kwargs, int line) {
        for (Ast.Keyword kw : kwargs) {
            String handle = IOSlot.normalizeHandle(kw.name());
            IOSlot slot = meta.input(handle).orElseThrow(() -> CompileException.forNode(
                    CompileErrorKind.UNKNOWN_INPUT, "Unknown input handle '" + kw.name() + "' for '" + node.getId()
                            + "'", node.getId(), meta.getType(), kw.name(), line));
            connect(node, meta, slot, kw.value(), line);
        }
        if (args.isEmpty())
            return;
        List<IOSlot> inputs = meta.getInputs();
        if (inputs.isEmpty())
            throw CompileException.forNode(CompileErrorKind.ARGUMENT_COUNT,
                    "'" + meta.getType() + "' takes no inputs", node.getId(), meta.getType(), null, line);
        boolean variadic = inputs.get(inputs.size() - 1).allowMultiple();
        if (args.size() > inputs.size() && !variadic)
            throw CompileException.forNode(CompileErrorKind.ARGUMENT_COUNT, "Too many positional inputs for '"
                    + node.getId() + "': expected at most " + inputs.size() + ", got " + args.size(), node.getId(),
                    meta.getType(), null, line);
        for (int i = 0; i < args.size(); i++) {
            IOSlot slot = i < inputs.size() ? inputs.get(i) : inputs.get(inputs.size() - 1);
            connect(node, meta, slot, args.get(i), line);
        }
    }

    private void connect(Node node, OperationMetadata meta, IOSlot slot, Ast.Expr expr, int line) {
        if (slot.allowMultiple() && (expr instanceof Ast.ListExpr || expr instanceof Ast.TupleExpr)) {
            List<Ast.Expr> elements = expr instanceof Ast.ListExpr l ? l.elements()
                    : ((Ast.TupleExpr) expr).elements();
            for (Ast.Expr e : elements)
                connect(node, meta, slot, e, line);
            return;
        }
        InputValue value = visit(expr);
        connectValue(node, slot, value, () -> "Cannot use type " + types.typeOf(value) + " for input '" + slot.id()
                + "' of '" + meta.getType() + "' (expects " + slot.type() + ")", line);
    }

    private void connectValue(Node node, IOSlot slot, InputValue value, Supplier<String> error, int line) {
        List<InputValue> existing = node.getInputs().get(slot.id());
        if (!slot.allowMultiple() && existing != null && !existing.isEmpty())
            throw CompileException.forNode(CompileErrorKind.ARGUMENT_COUNT, "Input '" + slot.id() + "' of '"
                    + node.getId() + "' is already connected", node.getId(), node.getType(), slot.id(), line);
        node.input(slot.id(), types.coerce(value, slot.type(), this::castNode, error, line));
    }

    private Node castNode(String base, String type) {
        String id = ctx.uniqueId(base);
        return ctx.addNode(id, type, 0);
    }

    // ── Operators ───────────────────────────────────────────────────

    /** Builds {@code type(SLOT0=left, SLOT1=right)} with typed coercion. */
    private InputValue binary(String type, Ast.Expr left, Ast.Expr right, String what, int line) {
        OperationMetadata meta = ctx.metadata(type, line);
        Node node = ctx.addNode(ctx.uniqueId(type), type, line);
        InputValue l = visit(left);
        InputValue r = visit(right);
        return binaryNode(node, meta, l, r, what, line);
    }

    private InputValue binaryNode(Node node, OperationMetadata meta, InputValue l, InputValue r, String what,
            int line) {
        IOSlot s0 = meta.input("SLOT0").orElseThrow();
        IOSlot s1 = meta.input("SLOT1").orElseThrow();
        connectValue(node, s0, l, () -> "Cannot use type " + types.typeOf(l) + " in " + what, line);
        connectValue(node, s1, r, () -> "Cannot use type " + types.typeOf(r) + " in " + what, line);
        return InputValue.ref(node.getId(), RESULT);
    }

    private InputValue visitBinOp(Ast.BinOp b) {
        return switch (b.op()) {
            case ADD -> binary("add", b.left(), b.right(), "arithmetic operation (+)", b.line());
            case SUB -> binary("sub", b.left(), b.right(), "arithmetic operation (-)", b.line());
            case MUL -> binary("mul", b.left(), b.right(), "arithmetic operation (*)", b.line());
            case DIV -> binary("div", b.left(), b.right(), "arithmetic operation (/)", b.line());
            case MOD -> binary("modulo", b.left(), b.right(), "arithmetic operation (%)", b.line());
            case POW -> binary("power_op", b.left(), b.right(), "arithmetic operation (**)", b.line());
            case BIT_AND -> binary("logical_and", b.left(), b.right(), "boolean operation (and/or)", b.line());
            case BIT_OR -> binary("logical_or", b.left(), b.right(), "boolean operation (and/or)", b.line());
        };
    }

    private InputValue visitUnaryOp(Ast.UnaryOp u) {
        switch (u.op()) {
            case POS:
                return visit(u.operand());
            case NEG: {
                if (u.operand() instanceof Ast.Constant c && c.value() instanceof Long l)
                    return InputValue.literal(Constant.integer(-l));
                if (u.operand() instanceof Ast.Constant c && c.value() instanceof Double d)
                    return InputValue.literal(Constant.decimal(-d));
                OperationMetadata meta = ctx.metadata("mul", u.line());
                Node node = ctx.addNode(ctx.uniqueId("mul"), "mul", u.line());
                InputValue operand = visit(u.operand());
                return binaryNode(node, meta, operand, InputValue.literal(Constant.integer(-1)),
                        "arithmetic operation (unary -)", u.line());
            }
            default: {
                OperationMetadata meta = ctx.metadata("logical_not", u.line());
                Node node = ctx.addNode(ctx.uniqueId("logical_not"), "logical_not", u.line());
                InputValue operand = visit(u.operand());
                connectValue(node, meta.input("SLOT").orElseThrow(), operand,
                        () -> "Cannot use type " + types.typeOf(operand) + " in boolean operation (not)", u.line());
                return InputValue.ref(node.getId(), RESULT);
            }
        }
    }

    private InputValue visitBoolOp(Ast.BoolOp b) {
        String type = b.and() ? "logical_and" : "logical_or";
        OperationMetadata meta = ctx.metadata(type, b.line());
        InputValue acc = visit(b.values().get(0));
        for (int i = 1; i < b.values().size(); i++) {
            Node node = ctx.addNode(ctx.uniqueId(type), type, b.line());
            InputValue next = visit(b.values().get(i));
            acc = binaryNode(node, meta, acc, next, "boolean operation (and/or)", b.line());
        }
        return acc;
    }

    private InputValue visitCompare(Ast.Compare c) {
        if (c.ops().size() != 1)
            throw new CompileException(CompileErrorKind.DISALLOWED_CONSTRUCT,
                    "Disallowed construct: chained comparisons are not supported; combine comparisons with 'and'",
                    c.line());
        String type = switch (c.ops().get(0)) {
            case LT -> "lt";
            case GT -> "gt";
            case LTE -> "lte";
            case GTE -> "gte";
            case EQ -> "eq";
            case NEQ -> "neq";
        };
        return binary(type, c.left(), c.comparators().get(0), "comparison (" + type + ")", c.line());
    }

    private InputValue visitIfExp(Ast.IfExp e) {
        Node node = ctx.addNode(ctx.uniqueId("ifexp"), "boolean_select_number", e.line());
        InputValue cond = visit(e.test());
        InputValue whenTrue = visit(e.body());
        InputValue whenFalse = visit(e.orElse());
        DataType t = types.typeOf(whenTrue);
        if (t == DataType.ANY)
            t = types.typeOf(whenFalse);
        String type = "boolean_select_" + t.kindSuffix();
        node.setType(type);
        OperationMetadata meta = ctx.metadata(type, e.line());
        connectValue(node, meta.input("condition").orElseThrow(), cond,
                () -> "Cannot use type " + types.typeOf(cond) + " as a condition", e.line());
        node.input("true", whenTrue);
        node.input("false", whenFalse);
        return InputValue.ref(node.getId(), RESULT);
    }

    private InputValue visitSubscript(Ast.Subscript s) {
        long period;
        if (s.index() instanceof Ast.Constant c && c.value() instanceof Long l)
            period = l;
        else if (s.index() instanceof Ast.UnaryOp u && u.op() == Ast.UnaryOperator.NEG
                && u.operand() instanceof Ast.Constant c && c.value() instanceof Long l)
            period = -l;
        else
            throw new CompileException(CompileErrorKind.SYNTAX_ERROR, "Subscript index must be a constant integer",
                    s.line());
        if (period == 0)
            throw new CompileException(CompileErrorKind.SYNTAX_ERROR, "Lag period must be a non-zero integer",
                    s.line());
        Node node = ctx.addNode(ctx.uniqueId("lag"), "lag_number", s.line());
        InputValue value = visit(s.value());
        String type = "lag_" + types.typeOf(value).kindSuffix();
        node.setType(type);
        OperationMetadata meta = ctx.metadata(type, s.line());
        node.option("period", OptionValue.integer(period));
        connectValue(node, meta.input("SLOT").orElseThrow(), value,
                () -> "Cannot lag a value of type " + types.typeOf(value), s.line());
        return InputValue.ref(node.getId(), RESULT);
    }
}
