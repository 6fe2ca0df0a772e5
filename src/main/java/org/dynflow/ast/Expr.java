package org.dynflow.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 表达式节点。具体种类以静态内部类给出，字段全部不可变。
 */
public abstract class Expr extends Node {

    protected Expr(int line, int column) {
        super(line, column);
    }

    static List<Node> nodes(Object... parts) {
        List<Node> out = new ArrayList<>();
        for (Object p : parts) {
            if (p instanceof Node n) {
                out.add(n);
            } else if (p instanceof Collection<?> c) {
                for (Object o : c) {
                    if (o != null) out.add((Node) o);
                }
            }
        }
        return out;
    }

    /**
     * 变量名引用
     */
    public static final class Name extends Expr {
        public final String id;
        public final ExprContext ctx;

        public Name(int line, int column, String id, ExprContext ctx) {
            super(line, column);
            this.id = id;
            this.ctx = ctx;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitName(this);
        }
    }

    /**
     * 字面量：Long、Double、String、Boolean 或 null（None）
     */
    public static final class Constant extends Expr {
        public final Object value;

        public Constant(int line, int column, Object value) {
            super(line, column);
            this.value = value;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitConstant(this);
        }
    }

    public static final class BinOp extends Expr {
        public final Expr left;
        public final Operator op;
        public final Expr right;

        public BinOp(int line, int column, Expr left, Operator op, Expr right) {
            super(line, column);
            this.left = left;
            this.op = op;
            this.right = right;
        }

        @Override
        public List<Node> children() {
            return nodes(left, right);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitBinOp(this);
        }
    }

    public static final class UnaryOp extends Expr {
        public final UnaryOperator op;
        public final Expr operand;

        public UnaryOp(int line, int column, UnaryOperator op, Expr operand) {
            super(line, column);
            this.op = op;
            this.operand = operand;
        }

        @Override
        public List<Node> children() {
            return nodes(operand);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitUnaryOp(this);
        }
    }

    /**
     * and / or，values 至少两个
     */
    public static final class BoolOp extends Expr {
        public final BoolOperator op;
        public final List<Expr> values;

        public BoolOp(int line, int column, BoolOperator op, List<Expr> values) {
            super(line, column);
            this.op = op;
            this.values = List.copyOf(values);
        }

        @Override
        public List<Node> children() {
            return nodes(values);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitBoolOp(this);
        }
    }

    /**
     * 链式比较 a &lt; b &lt;= c：ops 与 comparators 一一对应
     */
    public static final class Compare extends Expr {
        public final Expr left;
        public final List<CmpOperator> ops;
        public final List<Expr> comparators;

        public Compare(int line, int column, Expr left, List<CmpOperator> ops, List<Expr> comparators) {
            super(line, column);
            this.left = left;
            this.ops = List.copyOf(ops);
            this.comparators = List.copyOf(comparators);
        }

        @Override
        public List<Node> children() {
            return nodes(left, comparators);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitCompare(this);
        }
    }

    public static final class Call extends Expr {
        public final Expr func;
        public final List<Expr> args;
        public final List<Keyword> keywords;

        public Call(int line, int column, Expr func, List<Expr> args, List<Keyword> keywords) {
            super(line, column);
            this.func = func;
            this.args = List.copyOf(args);
            this.keywords = List.copyOf(keywords);
        }

        @Override
        public List<Node> children() {
            return nodes(func, args, keywords);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitCall(this);
        }
    }

    /**
     * 调用中的关键字参数 name=value
     */
    public static final class Keyword extends Node {
        public final String arg;
        public final Expr value;

        public Keyword(int line, int column, String arg, Expr value) {
            super(line, column);
            this.arg = arg;
            this.value = value;
        }

        @Override
        public List<Node> children() {
            return nodes(value);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitKeyword(this);
        }
    }

    public static final class Attribute extends Expr {
        public final Expr value;
        public final String attr;
        public final ExprContext ctx;

        public Attribute(int line, int column, Expr value, String attr, ExprContext ctx) {
            super(line, column);
            this.value = value;
            this.attr = attr;
            this.ctx = ctx;
        }

        @Override
        public List<Node> children() {
            return nodes(value);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitAttribute(this);
        }
    }

    /**
     * value[index]；index 可以是 {@link Slice}
     */
    public static final class Subscript extends Expr {
        public final Expr value;
        public final Expr index;
        public final ExprContext ctx;

        public Subscript(int line, int column, Expr value, Expr index, ExprContext ctx) {
            super(line, column);
            this.value = value;
            this.index = index;
            this.ctx = ctx;
        }

        @Override
        public List<Node> children() {
            return nodes(value, index);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitSubscript(this);
        }
    }

    /**
     * lower:upper:step，三部分都可以缺省（为 null）
     */
    public static final class Slice extends Expr {
        public final Expr lower;
        public final Expr upper;
        public final Expr step;

        public Slice(int line, int column, Expr lower, Expr upper, Expr step) {
            super(line, column);
            this.lower = lower;
            this.upper = upper;
            this.step = step;
        }

        @Override
        public List<Node> children() {
            return nodes(lower, upper, step);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitSlice(this);
        }
    }

    public static final class ListExpr extends Expr {
        public final List<Expr> elts;
        public final ExprContext ctx;

        public ListExpr(int line, int column, List<Expr> elts, ExprContext ctx) {
            super(line, column);
            this.elts = List.copyOf(elts);
            this.ctx = ctx;
        }

        @Override
        public List<Node> children() {
            return nodes(elts);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitList(this);
        }
    }

    public static final class TupleExpr extends Expr {
        public final List<Expr> elts;
        public final ExprContext ctx;

        public TupleExpr(int line, int column, List<Expr> elts, ExprContext ctx) {
            super(line, column);
            this.elts = List.copyOf(elts);
            this.ctx = ctx;
        }

        @Override
        public List<Node> children() {
            return nodes(elts);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitTuple(this);
        }
    }

    public static final class SetExpr extends Expr {
        public final List<Expr> elts;

        public SetExpr(int line, int column, List<Expr> elts) {
            super(line, column);
            this.elts = List.copyOf(elts);
        }

        @Override
        public List<Node> children() {
            return nodes(elts);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitSet(this);
        }
    }

    public static final class DictExpr extends Expr {
        public final List<Expr> keys;
        public final List<Expr> values;

        public DictExpr(int line, int column, List<Expr> keys, List<Expr> values) {
            super(line, column);
            this.keys = List.copyOf(keys);
            this.values = List.copyOf(values);
        }

        @Override
        public List<Node> children() {
            List<Node> out = new ArrayList<>();
            for (int i = 0; i < keys.size(); i++) {
                out.add(keys.get(i));
                out.add(values.get(i));
            }
            return out;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitDict(this);
        }
    }

    /**
     * body if test else orelse
     */
    public static final class IfExp extends Expr {
        public final Expr test;
        public final Expr body;
        public final Expr orelse;

        public IfExp(int line, int column, Expr test, Expr body, Expr orelse) {
            super(line, column);
            this.test = test;
            this.body = body;
            this.orelse = orelse;
        }

        @Override
        public List<Node> children() {
            return nodes(test, body, orelse);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitIfExp(this);
        }
    }
}
