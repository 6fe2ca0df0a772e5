package org.dynflow.parse;

import org.dynflow.ast.*;
import org.dynflow.ast.Module;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestParser {

    @Test
    public void testAssignments() {
        Module m = Parser.parse("""
                a = b = 1
                x, y = 1, 2
                s += x
                n: int = 3
                k: int
                """);
        assertEquals(5, m.body.size());

        Stmt.Assign chain = (Stmt.Assign) m.body.get(0);
        assertEquals(2, chain.targets.size());
        assertEquals(ExprContext.STORE, ((Expr.Name) chain.targets.get(0)).ctx);

        Stmt.Assign unpack = (Stmt.Assign) m.body.get(1);
        Expr.TupleExpr target = (Expr.TupleExpr) unpack.targets.get(0);
        assertEquals(ExprContext.STORE, target.ctx);
        assertEquals(2, target.elts.size());

        Stmt.AugAssign aug = (Stmt.AugAssign) m.body.get(2);
        assertEquals(Operator.ADD, aug.op);
        assertEquals(3, aug.line);

        assertNotNull(((Stmt.AnnAssign) m.body.get(3)).value);
        assertNull(((Stmt.AnnAssign) m.body.get(4)).value);
    }

    @Test
    public void testCompoundStatements() {
        Module m = Parser.parse("""
                def f(a, b=2):
                    for x in range(a):
                        if x > b:
                            break
                        elif x == 0:
                            continue
                        else:
                            pass
                    while a:
                        a -= 1
                    with nullcontext(1) as c:
                        return c
                """);
        Stmt.FunctionDef def = (Stmt.FunctionDef) m.body.get(0);
        assertEquals("f", def.name);
        assertEquals(2, def.params.size());
        assertNull(def.params.get(0).defaultValue);
        assertNotNull(def.params.get(1).defaultValue);

        Stmt.For loop = (Stmt.For) def.body.get(0);
        assertEquals(2, loop.line);
        Stmt.If branch = (Stmt.If) loop.body.get(0);
        Stmt.If elif = (Stmt.If) branch.orelse.get(0);
        assertEquals(5, elif.line);
        assertInstanceOf(Stmt.Pass.class, elif.orelse.get(0));

        Stmt.With with = (Stmt.With) def.body.get(2);
        assertEquals(ExprContext.STORE, ((Expr.Name) with.items.get(0).optionalVars).ctx);
    }

    @Test
    public void testSemicolonsAndInlineSuites() {
        Module m = Parser.parse("a = 1; b = 2\nif a: c = 3; d = 4\n");
        assertEquals(3, m.body.size());
        Stmt.If s = (Stmt.If) m.body.get(2);
        assertEquals(2, s.body.size());
        assertEquals(2, s.body.get(1).line);
    }

    @Test
    public void testExpressions() {
        Module m = Parser.parse("r = -x ** 2 if a < b <= c and not d else {1: [2, 3][0:1], 'k': (4,)}\n");
        Stmt.Assign a = (Stmt.Assign) m.body.get(0);
        Expr.IfExp ifExp = (Expr.IfExp) a.value;
        Expr.UnaryOp neg = (Expr.UnaryOp) ifExp.body;
        assertEquals(UnaryOperator.NEG, neg.op);
        assertEquals(Operator.POW, ((Expr.BinOp) neg.operand).op);

        Expr.BoolOp and = (Expr.BoolOp) ifExp.test;
        Expr.Compare cmp = (Expr.Compare) and.values.get(0);
        assertEquals(List.of(CmpOperator.LT, CmpOperator.LTE), cmp.ops);

        Expr.DictExpr dict = (Expr.DictExpr) ifExp.orelse;
        assertEquals(2, dict.keys.size());
        Expr.Subscript sub = (Expr.Subscript) dict.values.get(0);
        assertInstanceOf(Expr.Slice.class, sub.index);
    }

    @Test
    public void testCallArguments() {
        Module m = Parser.parse("print(a, b, sep='-', end='')\n");
        Expr.Call call = (Expr.Call) ((Stmt.ExprStmt) m.body.get(0)).value;
        assertEquals(2, call.args.size());
        assertEquals("sep", call.keywords.get(0).arg);
        assertThrows(ParseError.class, () -> Parser.parse("f(a=1, b)\n"));
    }

    @Test
    public void testNameLinesInMultiLineStatement() {
        Module m = Parser.parse("total = f(a,\n          b)\n");
        List<Integer> lines = new ArrayList<>();
        m.walk(n -> {
            if (n instanceof Expr.Name name && name.id.equals("b")) lines.add(name.line);
        });
        assertEquals(List.of(2), lines);
        assertEquals(1, m.body.get(0).line);
    }

    @Test
    public void testSyntaxErrors() {
        assertEquals("'break' outside loop",
                assertThrows(ParseError.class, () -> Parser.parse("break\n")).getProblem());
        assertEquals("'return' outside function",
                assertThrows(ParseError.class, () -> Parser.parse("return 1\n")).getProblem());
        assertThrows(ParseError.class, () -> Parser.parse("def f(a, a):\n    pass\n"));
        assertThrows(ParseError.class, () -> Parser.parse("def f(a=1, b):\n    pass\n"));
        assertThrows(ParseError.class, () -> Parser.parse("1 = x\n"));
        assertThrows(ParseError.class, () -> Parser.parse("f() = 1\n"));
        assertThrows(ParseError.class, () -> Parser.parse("import os\n"));
        assertThrows(ParseError.class, () -> Parser.parse("if x:\npass\n"));
        ParseError e = assertThrows(ParseError.class, () -> Parser.parse("x = 1\ny = = 2\n"));
        assertEquals(2, e.getLine());
    }

    @Test
    public void testEmptySource() {
        assertTrue(Parser.parse("").body.isEmpty());
        assertTrue(Parser.parse("# only a comment\n\n").body.isEmpty());
        assertEquals("<program>", Parser.parse("").sourceName);
        assertEquals("f.py", Parser.parse("", "f.py").sourceName);
    }
}
