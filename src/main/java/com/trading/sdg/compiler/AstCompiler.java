package com.trading.sdg.compiler;

import java.util.List;

import com.trading.sdg.api.IOSlot;
import com.trading.sdg.api.InputValue;
import com.trading.sdg.api.Node;
import com.trading.sdg.api.OperationMetadata;
import com.trading.sdg.compiler.parser.Ast;

/**
 * Walks the statements of a parsed script and builds its nodes.
 * <p>
 * {@code x = op(...)(...)} creates a node with id {@code x}. Any other
 * assignment binds the variable to an output handle or a literal without
 * creating a node of its own. A tuple target binds one variable per output of a
 * multi-output operation.
 */
final class AstCompiler {

    private final CompilationContext ctx;
    private final ExpressionCompiler expressions;

    AstCompiler(CompilationContext ctx) {
        this.ctx = ctx;
        this.expressions = new ExpressionCompiler(ctx);
    }

    ExpressionCompiler expressions() {
        return expressions;
    }

    void compile(Ast.Module module) {
        for (Ast.Stmt stmt : module.body()) {
            if (stmt instanceof Ast.Assign a)
                assign(a);
            else
                expressionStatement((Ast.ExprStmt) stmt);
        }
    }

    private void assign(Ast.Assign a) {
        if (a.tuple()) {
            tupleAssign(a);
            return;
        }
        String name = a.targets().get(0);
        if (ExpressionCompiler.isConstructorCall(a.value())) {
            ctx.checkUnbound(name, a.line());
            Ast.Call call = (Ast.Call) a.value();
            String id = "_".equals(name) ? null : name;
            Node node = expressions.construct(call, type -> id != null ? id : ctx.uniqueId("node"));
            ctx.bind(name, CompilationContext.Binding.node(node.getId()), a.line());
            return;
        }
        if (ctx.binding(name) != null)
            throw new CompileException(CompileErrorKind.VARIABLE_REBOUND, "Variable '" + name + "' already bound",
                    a.line());
        InputValue value = expressions.visit(a.value());
        if (value instanceof InputValue.Literal l)
            ctx.bind(name, CompilationContext.Binding.literal(l.value()), a.line());
        else {
            InputValue.NodeReference r = (InputValue.NodeReference) value;
            ctx.bind(name, CompilationContext.Binding.handle(r.nodeId(), r.handle()), a.line());
        }
    }

    private void tupleAssign(Ast.Assign a) {
        if (!ExpressionCompiler.isConstructorCall(a.value()))
            throw new CompileException(CompileErrorKind.SYNTAX_ERROR,
                    "Tuple assignment requires a constructor call on the right-hand side", a.line());
        for (String name : a.targets())
            ctx.checkUnbound(name, a.line());
        Ast.Call call = (Ast.Call) a.value();
        OperationMetadata meta = ctx.metadata(ExpressionCompiler.constructorName(call), a.line());
        List<IOSlot> outputs = meta.getOutputs();
        if (outputs.size() != a.targets().size())
            throw new CompileException(CompileErrorKind.UNKNOWN_OUTPUT, "'" + meta.getType() + "' has "
                    + outputs.size() + " outputs but " + a.targets().size() + " names were given", a.line());
        Node node = expressions.construct(call, type -> ctx.uniqueId("node"));
        for (int i = 0; i < outputs.size(); i++)
            ctx.bind(a.targets().get(i), CompilationContext.Binding.handle(node.getId(), outputs.get(i).id()),
                    a.line());
    }

    private void expressionStatement(Ast.ExprStmt s) {
        if (!ExpressionCompiler.isConstructorCall(s.value()))
            throw new CompileException(CompileErrorKind.DISALLOWED_CONSTRUCT,
                    "Disallowed construct: a statement must be an assignment or a call", s.line());
        expressions.construct((Ast.Call) s.value(), type -> ctx.uniqueId("node"));
    }
}
