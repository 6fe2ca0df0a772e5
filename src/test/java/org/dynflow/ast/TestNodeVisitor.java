package org.dynflow.ast;

import org.dynflow.parse.Parser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestNodeVisitor {

    @Test
    public void testWalkIsPreOrderInSourceOrder() {
        Module m = Parser.parse("x = a + b\n");
        List<String> names = new ArrayList<>();
        m.walk(n -> {
            if (n instanceof Expr.Name name) names.add(name.id);
        });
        assertEquals(List.of("x", "a", "b"), names);
    }

    @Test
    public void testVisitorDispatch() {
        Module m = Parser.parse("""
                def f(p=d):
                    for i in r:
                        q = i
                """);
        List<String> visited = new ArrayList<>();
        new NodeVisitor() {
            @Override
            public void visitFor(Stmt.For node) {
                visited.add("for@" + node.line);
                genericVisit(node);
            }

            @Override
            public void visitName(Expr.Name node) {
                visited.add(node.id + ":" + node.ctx);
            }
        }.visit(m);
        assertEquals(List.of("d:LOAD", "for@2", "i:STORE", "r:LOAD", "q:STORE", "i:LOAD"), visited);
    }
}
