package org.dynflow.interp;

import org.dynflow.ast.Expr;
import org.dynflow.ast.ExprContext;
import org.dynflow.ast.NodeVisitor;
import org.dynflow.ast.Stmt;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 确定函数体内哪些名字是局部变量：形参、任何被绑定（赋值、for 目标、with 目标、del、嵌套 def）的名字，
 * 减去 global 声明的名字。嵌套函数的函数体不计入。
 */
class LocalNameCollector extends NodeVisitor {

    private final Set<String> bound = new LinkedHashSet<>();
    private final Set<String> globals = new LinkedHashSet<>();

    static LocalNameCollector of(Stmt.FunctionDef def) {
        LocalNameCollector c = new LocalNameCollector();
        for (Stmt.Param p : def.params) {
            c.bound.add(p.name);
        }
        for (Stmt s : def.body) {
            s.accept(c);
        }
        c.bound.removeAll(c.globals);
        return c;
    }

    Set<String> localNames() {
        return Set.copyOf(bound);
    }

    Set<String> globalNames() {
        return Set.copyOf(globals);
    }

    @Override
    public void visitName(Expr.Name node) {
        if (node.ctx != ExprContext.LOAD) {
            bound.add(node.id);
        }
    }

    @Override
    public void visitGlobal(Stmt.Global node) {
        globals.addAll(node.names);
    }

    @Override
    public void visitFunctionDef(Stmt.FunctionDef node) {
        // 嵌套函数只绑定函数名；默认值在外层求值
        bound.add(node.name);
        for (Stmt.Param p : node.params) {
            if (p.defaultValue != null) p.defaultValue.accept(this);
        }
    }
}
