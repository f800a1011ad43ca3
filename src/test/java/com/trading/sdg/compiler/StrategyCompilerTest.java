package com.trading.sdg.compiler;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.trading.sdg.api.InputValue;
import com.trading.sdg.api.MetadataRegistry;
import com.trading.sdg.api.Node;
import com.trading.sdg.api.Timeframe;
import com.trading.sdg.io.MetadataLoader;

public class StrategyCompilerTest {

    private StrategyCompiler compiler;

    @Before
    public void setUp() {
        MetadataRegistry registry = new MetadataLoader().loadBuiltins();
        compiler = new StrategyCompiler(registry);
    }

    private CompileError failure(String source) {
        CompileOutcome outcome = compiler.compile(source);
        assertFalse("Expected failure for:\n" + source, outcome.isSuccess());
        return outcome.error();
    }

    @Test
    public void testMovingAverageCrossover() {
        CompilationResult r = compiler.compileOrThrow(String.join("\n",
                "src = market_data_source(timeframe=\"1D\")",
                "fast = ema(period=10)(src.c)",
                "slow = ema(period=20)(src.c)",
                "trade_signal_executor()(enter_long=fast > slow, exit_long=fast < slow)"));

        assertEquals(6, r.size());
        Node fast = r.node("fast").orElseThrow();
        assertEquals("ema", fast.getType());
        assertEquals(List.of(InputValue.ref("src", "c")), fast.getInputs().get("SLOT"));
        assertEquals(Timeframe.ONE_DAY, fast.getTimeframe());

        Node gt = r.nodesOfType("gt").get(0);
        assertEquals(InputValue.ref("fast", "result"), gt.getInputs().get("SLOT0").get(0));
        assertEquals(InputValue.ref("slow", "result"), gt.getInputs().get("SLOT1").get(0));
        for (Node n : r.nodes())
            assertEquals(n.getId(), Timeframe.ONE_DAY, n.getTimeframe());
    }

    @Test
    public void testCompileOutcomeCarriesNoPartialResult() {
        CompileOutcome outcome = compiler.compile("x = ema()(1)");
        assertFalse(outcome.isSuccess());
        try {
            outcome.result();
            fail("A failed outcome has no result");
        } catch (IllegalStateException expected) {
            assertTrue(expected.getMessage().contains("Compilation failed"));
        }
    }

    @Test
    public void testLiteralBooleanOperationWithoutSink() {
        CompilationResult r = compiler.compileOrThrow("result = 1 and True",
                CompileOptions.DEFAULT.withSkipSinkValidation(true));
        assertEquals(1, r.size());
        Node and = r.node("logical_and_0").orElseThrow();
        assertEquals("logical_and", and.getType());
        assertNull(and.getTimeframe());
    }

    @Test
    public void testStringCannotBeUsedAsBoolean() {
        CompileError e = failure("result = \"hello\" and True\ntrade_signal_executor()(enter_long=result)");
        assertEquals(CompileErrorKind.INVALID_TYPE_CAST, e.kind());
        assertTrue(e.message(), e.message().contains("Cannot use type String"));
    }

    @Test
    public void testNumericInputToBooleanSlotInsertsCast() {
        CompilationResult r = compiler.compileOrThrow(String.join("\n",
                "src = market_data_source(timeframe=\"1H\")",
                "trade_signal_executor()(enter_long=src.c)"));
        List<Node> casts = r.nodesOfType("static_cast_to_boolean");
        assertEquals(1, casts.size());
        assertEquals(InputValue.ref("src", "c"), casts.get(0).getInputs().get("SLOT").get(0));
        Node exec = r.nodesOfType("trade_signal_executor").get(0);
        assertEquals(casts.get(0).getId(), ((InputValue.NodeReference) exec.getInputs().get("enter_long").get(0))
                .nodeId());
    }

    @Test
    public void testMissingTimeframe() {
        CompileError e = failure(String.join("\n",
                "src = market_data_source()",
                "trade_signal_executor()(enter_long=src.c > 1)"));
        assertEquals(CompileErrorKind.MISSING_TIMEFRAME, e.kind());
        assertEquals("src", e.nodeId());
        assertTrue(e.message(), e.message().contains("requires a 'timeframe' parameter"));
    }

    @Test
    public void testExecutorWithoutInputs() {
        CompileError e = failure(String.join("\n",
                "src = market_data_source(timeframe=\"1D\")",
                "trade_signal_executor()()"));
        assertEquals(CompileErrorKind.MISSING_REQUIRED_INPUT, e.kind());
        assertEquals("trade_signal_executor", e.nodeType());
        assertTrue(e.message(), e.message().contains("At least one input is required"));
    }

    @Test
    public void testMissingRequiredOption() {
        CompileError e = failure(String.join("\n",
                "src = market_data_source(timeframe=\"1D\")",
                "x = ema()(src.c)",
                "trade_signal_executor()(enter_long=x > 1)"));
        assertEquals(CompileErrorKind.MISSING_REQUIRED_OPTION, e.kind());
        assertEquals("period", e.field());
        assertEquals(2, e.line());
    }

    @Test
    public void testUnknownComponent() {
        CompileError e = failure("x = does_not_exist()");
        assertEquals(CompileErrorKind.UNKNOWN_OPERATION_TYPE, e.kind());
        assertTrue(e.message().contains("does_not_exist"));
    }

    @Test
    public void testUnknownOption() {
        CompileError e = failure("src = market_data_source(timeframe=\"1D\", colour=\"red\")");
        assertEquals(CompileErrorKind.UNKNOWN_OPTION, e.kind());
        assertEquals("colour", e.field());
    }

    @Test
    public void testRebindingIsRejected() {
        CompileError e = failure("x = 1\nx = 2");
        assertEquals(CompileErrorKind.VARIABLE_REBOUND, e.kind());
    }

    @Test
    public void testUnboundVariable() {
        CompileError e = failure("trade_signal_executor()(enter_long=missing)");
        assertEquals(CompileErrorKind.UNBOUND_VARIABLE, e.kind());
    }

    @Test
    public void testChainedComparisonRejected() {
        CompileError e = failure(String.join("\n",
                "src = market_data_source(timeframe=\"1D\")",
                "trade_signal_executor()(enter_long=1 < src.c < 5)"));
        assertEquals(CompileErrorKind.DISALLOWED_CONSTRUCT, e.kind());
    }

    @Test
    public void testScriptWithoutSink() {
        CompileError e = failure("src = market_data_source(timeframe=\"1D\")\nx = ema(period=3)(src.c)");
        assertEquals(CompileErrorKind.NO_OUTPUT, e.kind());
        assertTrue(compiler.compile("src = market_data_source(timeframe=\"1D\")",
                CompileOptions.DEFAULT.withSkipSinkValidation(true)).isSuccess());
    }

    @Test
    public void testOrphansArePruned() {
        CompilationResult r = compiler.compileOrThrow(String.join("\n",
                "src = market_data_source(timeframe=\"1D\")",
                "unused = sma(period=50)(src.c)",
                "trade_signal_executor()(enter_long=src.c > src.o)"));
        assertFalse(r.node("unused").isPresent());
        assertTrue(r.node("src").isPresent());
    }

    @Test
    public void testTupleAssignmentForMultiOutput() {
        CompilationResult r = compiler.compileOrThrow(String.join("\n",
                "src = market_data_source(timeframe=\"1D\")",
                "lower, mid, upper = bbands(period=20)(src.c)",
                "trade_signal_executor()(enter_long=src.c < lower, exit_long=src.c > upper)"));
        Node bb = r.nodesOfType("bbands").get(0);
        assertEquals(2.0, bb.getOptions().get("stddev").asDouble(), 0.0);
        Node lt = r.nodesOfType("lt").get(0);
        assertEquals(InputValue.ref(bb.getId(), "bbands_lower"), lt.getInputs().get("SLOT1").get(0));
    }

    @Test
    public void testTupleArityMismatch() {
        CompileError e = failure(String.join("\n",
                "src = market_data_source(timeframe=\"1D\")",
                "lower, upper = bbands(period=20)(src.c)"));
        assertEquals(CompileErrorKind.UNKNOWN_OUTPUT, e.kind());
    }

    @Test
    public void testMultiOutputNeedsHandle() {
        CompileError e = failure(String.join("\n",
                "src = market_data_source(timeframe=\"1D\")",
                "trade_signal_executor()(enter_long=src > 1)"));
        assertEquals(CompileErrorKind.UNKNOWN_OUTPUT, e.kind());
        assertTrue(e.message(), e.message().contains("src.o"));
    }

    @Test
    public void testLagAndTernary() {
        CompilationResult r = compiler.compileOrThrow(String.join("\n",
                "src = market_data_source(timeframe=\"1D\")",
                "prev = src.c[1]",
                "level = src.c if src.c > prev else prev",
                "trade_signal_executor()(enter_long=level > 100)"));
        Node lag = r.nodesOfType("lag_number").get(0);
        assertEquals(1L, lag.getOptions().get("period").asLong());
        assertEquals(1, r.nodesOfType("boolean_select_number").size());
    }

    @Test
    public void testZeroLagRejected() {
        CompileError e = failure(String.join("\n",
                "src = market_data_source(timeframe=\"1D\")",
                "prev = src.c[0]"));
        assertEquals(CompileErrorKind.SYNTAX_ERROR, e.kind());
    }

    @Test
    public void testDuplicateIndicatorsAreMerged() {
        CompilationResult r = compiler.compileOrThrow(String.join("\n",
                "src = market_data_source(timeframe=\"1D\")",
                "a = ema(period=10)(src.c)",
                "b = ema(period=10)(src.c)",
                "trade_signal_executor()(enter_long=a > b)"));
        assertEquals(1, r.nodesOfType("ema").size());
        Node gt = r.nodesOfType("gt").get(0);
        assertEquals(gt.getInputs().get("SLOT0"), gt.getInputs().get("SLOT1"));
    }

    @Test
    public void testCompilationIsDeterministic() {
        String src = String.join("\n",
                "src = market_data_source(timeframe=\"1D\")",
                "x = sma(period=5)(src.c) + ema(period=5)(src.c) * 2",
                "trade_signal_executor()(enter_long=x > src.c)");
        assertEquals(compiler.compileOrThrow(src), compiler.compileOrThrow(src));
    }

    @Test
    public void testScalarInlining() {
        String src = String.join("\n",
                "src = market_data_source(timeframe=\"1D\")",
                "threshold = number(value=1.5)",
                "trade_signal_executor()(enter_long=src.c > threshold)");
        CompilationResult plain = compiler.compileOrThrow(src);
        assertEquals(1, plain.nodesOfType("number").size());

        CompilationResult inlined = compiler.compileOrThrow(src, CompileOptions.DEFAULT.withInlineScalars(true));
        assertTrue(inlined.nodesOfType("number").isEmpty());
        InputValue v = inlined.nodesOfType("gt").get(0).getInputs().get("SLOT1").get(0);
        assertFalse(v.isReference());
        assertEquals(1.5, ((InputValue.Literal) v).value().value());
    }

    @Test
    public void testSessionIsANodeAttribute() {
        CompilationResult r = compiler.compileOrThrow(String.join("\n",
                "src = market_data_source(timeframe=\"15Min\", session=\"London\")",
                "trade_signal_executor()(enter_long=src.c > src.o)"));
        Node src = r.node("src").orElseThrow();
        assertEquals("London", src.getSession().name());
        assertFalse(src.getOptions().containsKey("session"));
    }

    @Test
    public void testInvalidSessionRange() {
        CompileError e = failure("src = market_data_source(timeframe=\"15Min\", session=\"16:00-09:30\")");
        assertEquals(CompileErrorKind.INVALID_SESSION_RANGE, e.kind());
    }

    @Test
    public void testAliasesAreTypedAndNeverMerged() {
        CompilationResult r = compiler.compileOrThrow(String.join("\n",
                "src = market_data_source(timeframe=\"1D\")",
                "up = src.c > 100",
                "flag = alias()(up)",
                "again = alias()(up)",
                "trade_signal_executor()(enter_long=flag, exit_long=again)"));

        assertEquals("alias_boolean", r.node("flag").orElseThrow().getType());
        assertEquals("alias_boolean", r.node("again").orElseThrow().getType());
        assertEquals(2, r.nodesOfType("alias_boolean").size());
    }
}
