package org.dynflow.analysis;

import org.dynflow.ast.*;
import org.dynflow.ast.Module;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 静态扫描整棵语法树，得到每一行的 {@link LineClassification}。
 * <p>
 * 名字按它自身所在的行归属；赋值、for、with 以及增量赋值额外把 assigned / rhs 记到语句所在的行。
 */
public class LineClassifier extends NodeVisitor {

    private final Map<Integer, Set<String>> used = new HashMap<>();
    private final Map<Integer, Set<String>> assigned = new HashMap<>();
    private final Map<Integer, Set<String>> rhs = new HashMap<>();

    private LineClassifier() {
    }

    /**
     * @return 行号到分类结果的不可变映射，按行号排序；没有任何名字的行不出现
     */
    public static Map<Integer, LineClassification> classify(Module program) {
        LineClassifier c = new LineClassifier();
        c.visit(program);

        Set<Integer> lines = new LinkedHashSet<>(c.used.keySet());
        lines.addAll(c.assigned.keySet());
        lines.addAll(c.rhs.keySet());

        Map<Integer, LineClassification> out = new TreeMap<>();
        for (int line : lines) {
            out.put(line, LineClassification.of(
                    c.used.getOrDefault(line, Set.of()),
                    c.assigned.getOrDefault(line, Set.of()),
                    c.rhs.getOrDefault(line, Set.of())));
        }
        return Collections.unmodifiableMap(out);
    }

    private static Set<String> names(Node node, ExprContext ctx) {
        Set<String> out = new LinkedHashSet<>();
        if (node == null) return out;
        node.walk(n -> {
            if (n instanceof Expr.Name name && name.ctx == ctx) {
                out.add(name.id);
            }
        });
        return out;
    }

    private static Set<String> at(Map<Integer, Set<String>> table, int line) {
        return table.computeIfAbsent(line, k -> new LinkedHashSet<>());
    }

    @Override
    public void visitAssign(Stmt.Assign node) {
        for (Expr target : node.targets) {
            at(assigned, node.line).addAll(names(target, ExprContext.STORE));
        }
        at(rhs, node.line).addAll(names(node.value, ExprContext.LOAD));
        genericVisit(node);
    }

    @Override
    public void visitAnnAssign(Stmt.AnnAssign node) {
        // 只有注解时没有 rhs，目标仍由 visitName 记为 assigned，依赖被清空
        if (node.value != null) {
            at(assigned, node.line).addAll(names(node.target, ExprContext.STORE));
            at(rhs, node.line).addAll(names(node.value, ExprContext.LOAD));
        }
        genericVisit(node);
    }

    @Override
    public void visitAugAssign(Stmt.AugAssign node) {
        at(assigned, node.line).addAll(names(node.target, ExprContext.STORE));
        at(rhs, node.line).addAll(names(node.value, ExprContext.LOAD));
        // s += x 同时读取 s
        node.target.walk(n -> {
            if (n instanceof Expr.Name name) at(rhs, node.line).add(name.id);
        });
        genericVisit(node);
    }

    @Override
    public void visitFor(Stmt.For node) {
        at(assigned, node.line).addAll(names(node.target, ExprContext.STORE));
        at(rhs, node.line).addAll(names(node.iter, ExprContext.LOAD));
        genericVisit(node);
    }

    @Override
    public void visitWith(Stmt.With node) {
        for (Stmt.WithItem item : node.items) {
            if (item.optionalVars != null) {
                at(assigned, node.line).addAll(names(item.optionalVars, ExprContext.STORE));
            }
            at(rhs, node.line).addAll(names(item.contextExpr, ExprContext.LOAD));
        }
        genericVisit(node);
    }

    @Override
    public void visitName(Expr.Name node) {
        if (node.ctx == ExprContext.LOAD) {
            at(used, node.line).add(node.id);
        } else if (node.ctx == ExprContext.STORE) {
            at(assigned, node.line).add(node.id);
        }
    }
}
