package org.dynflow.ast;

import java.util.List;

import static org.dynflow.ast.Expr.nodes;

/**
 * 语句节点。line 为语句起始行，也就是解释器触发 line 事件时使用的行号。
 */
public abstract class Stmt extends Node {

    protected Stmt(int line, int column) {
        super(line, column);
    }

    /**
     * 单独成句的表达式，例如函数调用
     */
    public static final class ExprStmt extends Stmt {
        public final Expr value;

        public ExprStmt(int line, int column, Expr value) {
            super(line, column);
            this.value = value;
        }

        @Override
        public List<Node> children() {
            return nodes(value);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitExprStmt(this);
        }
    }

    /**
     * t1 = t2 = ... = value
     */
    public static final class Assign extends Stmt {
        public final List<Expr> targets;
        public final Expr value;

        public Assign(int line, int column, List<Expr> targets, Expr value) {
            super(line, column);
            this.targets = List.copyOf(targets);
            this.value = value;
        }

        @Override
        public List<Node> children() {
            return nodes(targets, value);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitAssign(this);
        }
    }

    /**
     * target: annotation [= value]，value 可为 null
     */
    public static final class AnnAssign extends Stmt {
        public final Expr target;
        public final Expr annotation;
        public final Expr value;

        public AnnAssign(int line, int column, Expr target, Expr annotation, Expr value) {
            super(line, column);
            this.target = target;
            this.annotation = annotation;
            this.value = value;
        }

        @Override
        public List<Node> children() {
            return nodes(target, annotation, value);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitAnnAssign(this);
        }
    }

    /**
     * target op= value
     */
    public static final class AugAssign extends Stmt {
        public final Expr target;
        public final Operator op;
        public final Expr value;

        public AugAssign(int line, int column, Expr target, Operator op, Expr value) {
            super(line, column);
            this.target = target;
            this.op = op;
            this.value = value;
        }

        @Override
        public List<Node> children() {
            return nodes(target, value);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitAugAssign(this);
        }
    }

    /**
     * if / elif / else；elif 表示为 orelse 中唯一的一个 If
     */
    public static final class If extends Stmt {
        public final Expr test;
        public final List<Stmt> body;
        public final List<Stmt> orelse;

        public If(int line, int column, Expr test, List<Stmt> body, List<Stmt> orelse) {
            super(line, column);
            this.test = test;
            this.body = List.copyOf(body);
            this.orelse = List.copyOf(orelse);
        }

        @Override
        public List<Node> children() {
            return nodes(test, body, orelse);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitIf(this);
        }
    }

    public static final class While extends Stmt {
        public final Expr test;
        public final List<Stmt> body;
        public final List<Stmt> orelse;

        public While(int line, int column, Expr test, List<Stmt> body, List<Stmt> orelse) {
            super(line, column);
            this.test = test;
            this.body = List.copyOf(body);
            this.orelse = List.copyOf(orelse);
        }

        @Override
        public List<Node> children() {
            return nodes(test, body, orelse);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitWhile(this);
        }
    }

    /**
     * for target in iter
     */
    public static final class For extends Stmt {
        public final Expr target;
        public final Expr iter;
        public final List<Stmt> body;
        public final List<Stmt> orelse;

        public For(int line, int column, Expr target, Expr iter, List<Stmt> body, List<Stmt> orelse) {
            super(line, column);
            this.target = target;
            this.iter = iter;
            this.body = List.copyOf(body);
            this.orelse = List.copyOf(orelse);
        }

        @Override
        public List<Node> children() {
            return nodes(target, iter, body, orelse);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitFor(this);
        }
    }

    public static final class With extends Stmt {
        public final List<WithItem> items;
        public final List<Stmt> body;

        public With(int line, int column, List<WithItem> items, List<Stmt> body) {
            super(line, column);
            this.items = List.copyOf(items);
            this.body = List.copyOf(body);
        }

        @Override
        public List<Node> children() {
            return nodes(items, body);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitWith(this);
        }
    }

    /**
     * with 语句中的一项：contextExpr [as optionalVars]
     */
    public static final class WithItem extends Node {
        public final Expr contextExpr;
        public final Expr optionalVars;

        public WithItem(int line, int column, Expr contextExpr, Expr optionalVars) {
            super(line, column);
            this.contextExpr = contextExpr;
            this.optionalVars = optionalVars;
        }

        @Override
        public List<Node> children() {
            return nodes(contextExpr, optionalVars);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitWithItem(this);
        }
    }

    public static final class FunctionDef extends Stmt {
        public final String name;
        public final List<Param> params;
        public final List<Stmt> body;

        public FunctionDef(int line, int column, String name, List<Param> params, List<Stmt> body) {
            super(line, column);
            this.name = name;
            this.params = List.copyOf(params);
            this.body = List.copyOf(body);
        }

        @Override
        public List<Node> children() {
            return nodes(params, body);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitFunctionDef(this);
        }
    }

    /**
     * 形参，defaultValue 可为 null。形参名不是 {@link Expr.Name}，因此不会被当作某一行的赋值目标。
     */
    public static final class Param extends Node {
        public final String name;
        public final Expr defaultValue;

        public Param(int line, int column, String name, Expr defaultValue) {
            super(line, column);
            this.name = name;
            this.defaultValue = defaultValue;
        }

        @Override
        public List<Node> children() {
            return nodes(defaultValue);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitParam(this);
        }
    }

    public static final class Return extends Stmt {
        public final Expr value;

        public Return(int line, int column, Expr value) {
            super(line, column);
            this.value = value;
        }

        @Override
        public List<Node> children() {
            return nodes(value);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitReturn(this);
        }
    }

    public static final class Global extends Stmt {
        public final List<String> names;

        public Global(int line, int column, List<String> names) {
            super(line, column);
            this.names = List.copyOf(names);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitGlobal(this);
        }
    }

    public static final class Assert extends Stmt {
        public final Expr test;
        public final Expr msg;

        public Assert(int line, int column, Expr test, Expr msg) {
            super(line, column);
            this.test = test;
            this.msg = msg;
        }

        @Override
        public List<Node> children() {
            return nodes(test, msg);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitAssert(this);
        }
    }

    public static final class Raise extends Stmt {
        public final Expr exc;

        public Raise(int line, int column, Expr exc) {
            super(line, column);
            this.exc = exc;
        }

        @Override
        public List<Node> children() {
            return nodes(exc);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitRaise(this);
        }
    }

    public static final class Delete extends Stmt {
        public final List<Expr> targets;

        public Delete(int line, int column, List<Expr> targets) {
            super(line, column);
            this.targets = List.copyOf(targets);
        }

        @Override
        public List<Node> children() {
            return nodes(targets);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitDelete(this);
        }
    }

    public static final class Pass extends Stmt {
        public Pass(int line, int column) {
            super(line, column);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitPass(this);
        }
    }

    public static final class Break extends Stmt {
        public Break(int line, int column) {
            super(line, column);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitBreak(this);
        }
    }

    public static final class Continue extends Stmt {
        public Continue(int line, int column) {
            super(line, column);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitContinue(this);
        }
    }
}
