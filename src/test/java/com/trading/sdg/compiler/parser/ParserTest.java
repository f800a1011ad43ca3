package com.trading.sdg.compiler.parser;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

import com.trading.sdg.compiler.CompileErrorKind;
import com.trading.sdg.compiler.CompileException;

public class ParserTest {

    @Test
    public void testConstructorChain() {
        Ast.Module m = Parser.parse("fast = ema(period=10)(src.c)\n");
        assertEquals(1, m.body().size());
        Ast.Assign a = (Ast.Assign) m.body().get(0);
        assertEquals(List.of("fast"), a.targets());
        assertFalse(a.tuple());

        Ast.Call feed = (Ast.Call) a.value();
        assertEquals(1, feed.args().size());
        Ast.Attribute arg = (Ast.Attribute) feed.args().get(0);
        assertEquals("c", arg.attr());

        Ast.Call ctor = (Ast.Call) feed.func();
        assertEquals("ema", ((Ast.Name) ctor.func()).id());
        assertEquals("period", ctor.keywords().get(0).name());
        assertEquals(10L, ((Ast.Constant) ctor.keywords().get(0).value()).value());
    }

    @Test
    public void testTupleTargets() {
        Ast.Module m = Parser.parse("lower, mid, upper = bbands(period=20)(x)");
        Ast.Assign a = (Ast.Assign) m.body().get(0);
        assertTrue(a.tuple());
        assertEquals(List.of("lower", "mid", "upper"), a.targets());
    }

    @Test
    public void testCommentsAndBlankLines() {
        Ast.Module m = Parser.parse("# header\n\nx = 1  # one\n\ny = 2.5\n");
        assertEquals(2, m.body().size());
        Ast.Assign y = (Ast.Assign) m.body().get(1);
        assertEquals(2.5, ((Ast.Constant) y.value()).value());
        assertEquals(5, y.line());
    }

    @Test
    public void testOperatorPrecedence() {
        Ast.Module m = Parser.parse("x = a + b * c");
        Ast.BinOp add = (Ast.BinOp) ((Ast.Assign) m.body().get(0)).value();
        assertEquals(Ast.BinaryOperator.ADD, add.op());
        assertEquals(Ast.BinaryOperator.MUL, ((Ast.BinOp) add.right()).op());
    }

    @Test
    public void testBooleanAndConditional() {
        Ast.Module m = Parser.parse("x = a if c > 1 and not d else b");
        Ast.IfExp e = (Ast.IfExp) ((Ast.Assign) m.body().get(0)).value();
        Ast.BoolOp test = (Ast.BoolOp) e.test();
        assertTrue(test.and());
        assertEquals(2, test.values().size());
        assertTrue(test.values().get(0) instanceof Ast.Compare);
        assertEquals(Ast.UnaryOperator.NOT, ((Ast.UnaryOp) test.values().get(1)).op());
    }

    @Test
    public void testBooleanAndNoneConstants() {
        Ast.Module m = Parser.parse("a = True\nb = False\nc = None");
        assertEquals(Boolean.TRUE, ((Ast.Constant) ((Ast.Assign) m.body().get(0)).value()).value());
        assertEquals(Boolean.FALSE, ((Ast.Constant) ((Ast.Assign) m.body().get(1)).value()).value());
        assertNull(((Ast.Constant) ((Ast.Assign) m.body().get(2)).value()).value());
    }

    @Test
    public void testSubscript() {
        Ast.Module m = Parser.parse("prev = close[1]");
        Ast.Subscript s = (Ast.Subscript) ((Ast.Assign) m.body().get(0)).value();
        assertEquals("close", ((Ast.Name) s.value()).id());
        assertEquals(1L, ((Ast.Constant) s.index()).value());
    }

    @Test
    public void testDisallowedStatements() {
        for (String src : new String[] { "import os", "def f(x):\n    return x", "for i in x:\n    pass",
                "while x:\n    pass" }) {
            try {
                Parser.parse(src);
                fail("Should reject: " + src);
            } catch (CompileException e) {
                assertEquals(CompileErrorKind.DISALLOWED_CONSTRUCT, e.kind());
            }
        }
    }

    @Test
    public void testLambdaRejected() {
        try {
            Parser.parse("f = lambda x: x");
            fail("lambda should be rejected");
        } catch (CompileException e) {
            assertEquals(CompileErrorKind.DISALLOWED_CONSTRUCT, e.kind());
        }
    }

    @Test
    public void testChainedAssignmentRejected() {
        try {
            Parser.parse("a = b = 1");
            fail("chained assignment should be rejected");
        } catch (CompileException e) {
            assertEquals(CompileErrorKind.SYNTAX_ERROR, e.kind());
        }
    }

    @Test
    public void testUnterminatedCall() {
        try {
            Parser.parse("x = ema(period=10");
            fail("Should fail on missing ')'");
        } catch (CompileException e) {
            assertEquals(CompileErrorKind.SYNTAX_ERROR, e.kind());
            assertEquals(1, e.error().line());
        }
    }
}
