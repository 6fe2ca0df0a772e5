package org.dynflow.ast;

/**
 * 语法树访问者。每种节点一个 visit 方法，默认实现都是 {@link #genericVisit(Node)}：依次访问所有子节点。
 * 子类只需覆盖关心的节点种类，需要继续向下遍历时自行调用 genericVisit。
 */
public abstract class NodeVisitor {

    public void visit(Node node) {
        node.accept(this);
    }

    public void genericVisit(Node node) {
        for (Node child : node.children()) {
            child.accept(this);
        }
    }

    public void visitModule(Module node) {
        genericVisit(node);
    }

    public void visitName(Expr.Name node) {
        genericVisit(node);
    }

    public void visitConstant(Expr.Constant node) {
        genericVisit(node);
    }

    public void visitBinOp(Expr.BinOp node) {
        genericVisit(node);
    }

    public void visitUnaryOp(Expr.UnaryOp node) {
        genericVisit(node);
    }

    public void visitBoolOp(Expr.BoolOp node) {
        genericVisit(node);
    }

    public void visitCompare(Expr.Compare node) {
        genericVisit(node);
    }

    public void visitCall(Expr.Call node) {
        genericVisit(node);
    }

    public void visitKeyword(Expr.Keyword node) {
        genericVisit(node);
    }

    public void visitAttribute(Expr.Attribute node) {
        genericVisit(node);
    }

    public void visitSubscript(Expr.Subscript node) {
        genericVisit(node);
    }

    public void visitSlice(Expr.Slice node) {
        genericVisit(node);
    }

    public void visitList(Expr.ListExpr node) {
        genericVisit(node);
    }

    public void visitTuple(Expr.TupleExpr node) {
        genericVisit(node);
    }

    public void visitSet(Expr.SetExpr node) {
        genericVisit(node);
    }

    public void visitDict(Expr.DictExpr node) {
        genericVisit(node);
    }

    public void visitIfExp(Expr.IfExp node) {
        genericVisit(node);
    }

    public void visitExprStmt(Stmt.ExprStmt node) {
        genericVisit(node);
    }

    public void visitAssign(Stmt.Assign node) {
        genericVisit(node);
    }

    public void visitAnnAssign(Stmt.AnnAssign node) {
        genericVisit(node);
    }

    public void visitAugAssign(Stmt.AugAssign node) {
        genericVisit(node);
    }

    public void visitIf(Stmt.If node) {
        genericVisit(node);
    }

    public void visitWhile(Stmt.While node) {
        genericVisit(node);
    }

    public void visitFor(Stmt.For node) {
        genericVisit(node);
    }

    public void visitWith(Stmt.With node) {
        genericVisit(node);
    }

    public void visitWithItem(Stmt.WithItem node) {
        genericVisit(node);
    }

    public void visitFunctionDef(Stmt.FunctionDef node) {
        genericVisit(node);
    }

    public void visitParam(Stmt.Param node) {
        genericVisit(node);
    }

    public void visitReturn(Stmt.Return node) {
        genericVisit(node);
    }

    public void visitGlobal(Stmt.Global node) {
        genericVisit(node);
    }

    public void visitAssert(Stmt.Assert node) {
        genericVisit(node);
    }

    public void visitRaise(Stmt.Raise node) {
        genericVisit(node);
    }

    public void visitDelete(Stmt.Delete node) {
        genericVisit(node);
    }

    public void visitPass(Stmt.Pass node) {
        genericVisit(node);
    }

    public void visitBreak(Stmt.Break node) {
        genericVisit(node);
    }

    public void visitContinue(Stmt.Continue node) {
        genericVisit(node);
    }
}
