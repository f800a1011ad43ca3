package com.trading.sdg.compiler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.trading.sdg.api.MetadataRegistry;
import com.trading.sdg.api.Node;
import com.trading.sdg.compiler.parser.Ast;
import com.trading.sdg.compiler.parser.Parser;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles strategy scripts into validated, deduplicated node graphs.
 * <p>
 * Pipeline: parse, build nodes, common-subexpression elimination, alias
 * specialization, orphan pruning, cycle check, timeframe resolution,
 * validation and, optionally, scalar inlining. The registry is shared
 * read-only, so one compiler may serve several threads.
 */
@Log4j2
public final class StrategyCompiler {

    private final MetadataRegistry registry;
    private final List<SpecialNodeValidator> validators;

    public StrategyCompiler(MetadataRegistry registry) {
        this(registry, List.of(new BooleanSelectValidator()));
    }

    public StrategyCompiler(MetadataRegistry registry, List<SpecialNodeValidator> validators) {
        this.registry = registry;
        this.validators = List.copyOf(validators);
    }

    public MetadataRegistry registry() {
        return registry;
    }

    public CompileOutcome compile(String source) {
        return compile(source, CompileOptions.DEFAULT);
    }

    /** Never throws for script errors; see {@link CompileOutcome}. */
    public CompileOutcome compile(String source, CompileOptions options) {
        try {
            return CompileOutcome.success(compileOrThrow(source, options));
        } catch (CompileException e) {
            log.debug("Compilation failed: {}", e.error());
            return CompileOutcome.failure(e.error());
        }
    }

    public CompilationResult compileOrThrow(String source) {
        return compileOrThrow(source, CompileOptions.DEFAULT);
    }

    /**
     * @throws CompileException on the first error.
     */
    public CompilationResult compileOrThrow(String source, CompileOptions options) {
        long t0 = System.nanoTime();
        Ast.Module module = Parser.parse(source);
        CompilationContext ctx = new CompilationContext(registry);
        new AstCompiler(ctx).compile(module);
        CompilationResult result = finish(ctx.nodeList(), ctx.usedIds(), options);
        log.debug("Compiled {} statement(s) into {} node(s) in {} us", module.body().size(), result.size(),
                (System.nanoTime() - t0) / 1000);
        return result;
    }

    /**
     * Runs the post-construction passes over an existing node list, for
     * example one read back with {@code GraphSerializer}. Nodes are copied.
     */
    public CompileOutcome optimize(List<Node> nodes, CompileOptions options) {
        List<Node> copies = new ArrayList<>(nodes.size());
        for (Node n : nodes)
            copies.add(n.copy());
        try {
            return CompileOutcome.success(finish(copies, null, options));
        } catch (CompileException e) {
            return CompileOutcome.failure(e.error());
        }
    }

    private CompilationResult finish(List<Node> nodes, Set<String> usedIds, CompileOptions options) {
        Map<String, Node> live = new HashMap<>();
        TypeChecker types = new TypeChecker(registry, live::get);
        for (Node n : nodes)
            live.put(n.getId(), n);

        CseOptimizer.Result cse = new CseOptimizer(registry).optimize(nodes, usedIds);
        List<Node> current = new ArrayList<>(cse.nodes());
        cse.redirects().keySet().forEach(live::remove);

        new AliasSpecializer(registry, types).specialize(current);
        current = new OrphanPruner(registry).prune(current, options.skipSinkValidation(), usedIds);
        current = NodeOrdering.sort(current);
        live.clear();
        for (Node n : current)
            live.put(n.getId(), n);

        NodeValidator validator = new NodeValidator(registry, validators, types::typeOf);
        validator.validateInputs(current);
        new TimeframeResolver(registry).resolve(current, options.skipSinkValidation());
        validator.validateAll(current);

        if (options.inlineScalars())
            current = new ScalarInliningPass().inline(current);
        return new CompilationResult(current);
    }
}
