package org.dynflow.parse;

import org.dynflow.ast.*;
import org.dynflow.ast.Module;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 递归下降解析器：词法单元序列 → {@link Module}。
 * <p>
 * 任何语法问题都以 {@link ParseError} 抛出，不做错误恢复，也不返回部分结果。
 */
public class Parser {

    private static final Map<String, Operator> AUG_OPS = Map.of(
            "+=", Operator.ADD, "-=", Operator.SUB, "*=", Operator.MULT, "/=", Operator.DIV,
            "//=", Operator.FLOOR_DIV, "%=", Operator.MOD, "**=", Operator.POW);

    private static final Map<String, CmpOperator> CMP_OPS = Map.of(
            "==", CmpOperator.EQ, "!=", CmpOperator.NOT_EQ, "<", CmpOperator.LT, "<=", CmpOperator.LTE,
            ">", CmpOperator.GT, ">=", CmpOperator.GTE);

    private final List<Token> tokens;
    private final String sourceName;
    private int pos = 0;
    private int loopDepth = 0;
    private int functionDepth = 0;

    public Parser(List<Token> tokens, String sourceName) {
        this.tokens = tokens;
        this.sourceName = sourceName;
    }

    /**
     * 解析整段源码
     *
     * @param source     源码文本
     * @param sourceName 源码名称（文件名），解释器据此区分被分析程序自己的代码
     */
    public static Module parse(String source, String sourceName) {
        return new Parser(Lexer.tokenize(source), sourceName).parseModule();
    }

    public static Module parse(String source) {
        return parse(source, "<program>");
    }

    public Module parseModule() {
        List<Stmt> body = new ArrayList<>();
        while (peek().type() != TokenType.END) {
            if (peek().type() == TokenType.NEWLINE) {
                next();
                continue;
            }
            statement(body);
        }
        return new Module(sourceName, body);
    }

    // ---------------------------------------------------------------- 语句

    /**
     * 解析一条逻辑行（复合语句或以分号分隔的若干简单语句），追加到 out
     */
    private void statement(List<Stmt> out) {
        Token t = peek();
        if (t.type() == TokenType.INDENT) {
            throw error(t, "unexpected indent");
        }
        if (t.type() == TokenType.KEYWORD) {
            switch (t.text()) {
                case "if" -> {
                    out.add(ifStatement());
                    return;
                }
                case "while" -> {
                    out.add(whileStatement());
                    return;
                }
                case "for" -> {
                    out.add(forStatement());
                    return;
                }
                case "with" -> {
                    out.add(withStatement());
                    return;
                }
                case "def" -> {
                    out.add(functionDef());
                    return;
                }
                case "class", "import", "from", "try", "except", "finally", "lambda", "yield", "nonlocal",
                     "async", "await" -> throw error(t, "unsupported syntax '" + t.text() + "'");
                default -> {
                }
            }
        }
        simpleStatements(out);
    }

    private void simpleStatements(List<Stmt> out) {
        out.add(smallStatement());
        while (peek().isOp(";")) {
            next();
            if (peek().type() == TokenType.NEWLINE) break;
            out.add(smallStatement());
        }
        expect(TokenType.NEWLINE, "end of line");
    }

    private Stmt smallStatement() {
        Token t = peek();
        if (t.type() == TokenType.KEYWORD) {
            switch (t.text()) {
                case "pass" -> {
                    next();
                    return new Stmt.Pass(t.line(), t.column());
                }
                case "break" -> {
                    next();
                    if (loopDepth == 0) throw error(t, "'break' outside loop");
                    return new Stmt.Break(t.line(), t.column());
                }
                case "continue" -> {
                    next();
                    if (loopDepth == 0) throw error(t, "'continue' not properly in loop");
                    return new Stmt.Continue(t.line(), t.column());
                }
                case "return" -> {
                    next();
                    if (functionDepth == 0) throw error(t, "'return' outside function");
                    Expr value = atEndOfSimpleStatement() ? null : testList();
                    return new Stmt.Return(t.line(), t.column(), value);
                }
                case "global" -> {
                    next();
                    List<String> names = new ArrayList<>();
                    names.add(expect(TokenType.NAME, "name").text());
                    while (peek().isOp(",")) {
                        next();
                        names.add(expect(TokenType.NAME, "name").text());
                    }
                    return new Stmt.Global(t.line(), t.column(), names);
                }
                case "assert" -> {
                    next();
                    Expr test = test();
                    Expr msg = null;
                    if (peek().isOp(",")) {
                        next();
                        msg = test();
                    }
                    return new Stmt.Assert(t.line(), t.column(), test, msg);
                }
                case "raise" -> {
                    next();
                    Expr exc = atEndOfSimpleStatement() ? null : test();
                    return new Stmt.Raise(t.line(), t.column(), exc);
                }
                case "del" -> {
                    next();
                    List<Expr> targets = new ArrayList<>();
                    targets.add(toTarget(expr(), ExprContext.DEL));
                    while (peek().isOp(",")) {
                        next();
                        if (atEndOfSimpleStatement()) break;
                        targets.add(toTarget(expr(), ExprContext.DEL));
                    }
                    return new Stmt.Delete(t.line(), t.column(), targets);
                }
                default -> {
                }
            }
        }
        return expressionStatement();
    }

    private Stmt expressionStatement() {
        Token start = peek();
        Expr first = testList();
        Token t = peek();
        if (t.type() == TokenType.OP && AUG_OPS.containsKey(t.text())) {
            next();
            checkSingleTarget(first, t);
            Expr value = testList();
            return new Stmt.AugAssign(start.line(), start.column(), toTarget(first, ExprContext.STORE),
                    AUG_OPS.get(t.text()), value);
        }
        if (t.isOp(":")) {
            next();
            checkSingleTarget(first, t);
            Expr annotation = test();
            Expr value = null;
            if (peek().isOp("=")) {
                next();
                value = testList();
            }
            return new Stmt.AnnAssign(start.line(), start.column(), toTarget(first, ExprContext.STORE),
                    annotation, value);
        }
        if (t.isOp("=")) {
            List<Expr> chain = new ArrayList<>();
            chain.add(first);
            while (peek().isOp("=")) {
                next();
                chain.add(testList());
            }
            Expr value = chain.remove(chain.size() - 1);
            List<Expr> targets = new ArrayList<>();
            for (Expr e : chain) {
                targets.add(toTarget(e, ExprContext.STORE));
            }
            return new Stmt.Assign(start.line(), start.column(), targets, value);
        }
        return new Stmt.ExprStmt(start.line(), start.column(), first);
    }

    private void checkSingleTarget(Expr target, Token at) {
        if (!(target instanceof Expr.Name || target instanceof Expr.Attribute || target instanceof Expr.Subscript)) {
            throw error(at, "illegal target for " + (at.isOp(":") ? "annotation" : "augmented assignment"));
        }
    }

    private Stmt ifStatement() {
        Token t = next(); // if / elif
        Expr test = test();
        List<Stmt> body = block();
        List<Stmt> orelse = new ArrayList<>();
        if (peek().isKeyword("elif")) {
            orelse.add(ifStatement());
        } else if (peek().isKeyword("else")) {
            next();
            orelse = block();
        }
        return new Stmt.If(t.line(), t.column(), test, body, orelse);
    }

    private Stmt whileStatement() {
        Token t = next();
        Expr test = test();
        loopDepth++;
        List<Stmt> body = block();
        loopDepth--;
        List<Stmt> orelse = List.of();
        if (peek().isKeyword("else")) {
            next();
            orelse = block();
        }
        return new Stmt.While(t.line(), t.column(), test, body, orelse);
    }

    private Stmt forStatement() {
        Token t = next();
        Expr target = toTarget(exprList(), ExprContext.STORE);
        expectKeyword("in");
        Expr iter = testList();
        loopDepth++;
        List<Stmt> body = block();
        loopDepth--;
        List<Stmt> orelse = List.of();
        if (peek().isKeyword("else")) {
            next();
            orelse = block();
        }
        return new Stmt.For(t.line(), t.column(), target, iter, body, orelse);
    }

    private Stmt withStatement() {
        Token t = next();
        List<Stmt.WithItem> items = new ArrayList<>();
        do {
            if (!items.isEmpty()) next();
            Token start = peek();
            Expr ctx = test();
            Expr vars = null;
            if (peek().isKeyword("as")) {
                next();
                vars = toTarget(expr(), ExprContext.STORE);
            }
            items.add(new Stmt.WithItem(start.line(), start.column(), ctx, vars));
        } while (peek().isOp(","));
        return new Stmt.With(t.line(), t.column(), items, block());
    }

    private Stmt functionDef() {
        Token t = next();
        String name = expect(TokenType.NAME, "function name").text();
        expectOp("(");
        List<Stmt.Param> params = new ArrayList<>();
        boolean seenDefault = false;
        while (!peek().isOp(")")) {
            Token p = expect(TokenType.NAME, "parameter name");
            for (Stmt.Param existing : params) {
                if (existing.name.equals(p.text())) {
                    throw error(p, "duplicate argument '" + p.text() + "' in function definition");
                }
            }
            if (peek().isOp(":")) {
                next();
                test(); // 形参注解不参与执行
            }
            Expr defaultValue = null;
            if (peek().isOp("=")) {
                next();
                defaultValue = test();
                seenDefault = true;
            } else if (seenDefault) {
                throw error(p, "non-default argument follows default argument");
            }
            params.add(new Stmt.Param(p.line(), p.column(), p.text(), defaultValue));
            if (!peek().isOp(",")) break;
            next();
        }
        expectOp(")");
        if (peek().isOp("->")) {
            next();
            test();
        }
        int savedLoops = loopDepth;
        loopDepth = 0;
        functionDepth++;
        List<Stmt> body = block();
        functionDepth--;
        loopDepth = savedLoops;
        return new Stmt.FunctionDef(t.line(), t.column(), name, params, body);
    }

    /**
     * ':' 之后的语句块：要么同一行的简单语句，要么换行后缩进的一组语句
     */
    private List<Stmt> block() {
        expectOp(":");
        List<Stmt> body = new ArrayList<>();
        if (peek().type() != TokenType.NEWLINE) {
            simpleStatements(body);
            return body;
        }
        next();
        expect(TokenType.INDENT, "an indented block");
        while (peek().type() != TokenType.DEDENT && peek().type() != TokenType.END) {
            statement(body);
        }
        if (peek().type() == TokenType.DEDENT) next();
        return body;
    }

    private boolean atEndOfSimpleStatement() {
        Token t = peek();
        return t.type() == TokenType.NEWLINE || t.isOp(";");
    }

    // ---------------------------------------------------------------- 赋值目标

    private Expr toTarget(Expr e, ExprContext ctx) {
        if (e instanceof Expr.Name n) {
            if (n.id.equals("__debug__")) throw new ParseError(n.line, n.column, "cannot assign to __debug__");
            return new Expr.Name(n.line, n.column, n.id, ctx);
        }
        if (e instanceof Expr.TupleExpr tuple) {
            return new Expr.TupleExpr(tuple.line, tuple.column, targets(tuple.elts, ctx), ctx);
        }
        if (e instanceof Expr.ListExpr list) {
            return new Expr.ListExpr(list.line, list.column, targets(list.elts, ctx), ctx);
        }
        if (e instanceof Expr.Attribute a) {
            return new Expr.Attribute(a.line, a.column, a.value, a.attr, ctx);
        }
        if (e instanceof Expr.Subscript s) {
            return new Expr.Subscript(s.line, s.column, s.value, s.index, ctx);
        }
        String what = ctx == ExprContext.DEL ? "delete" : "assign to";
        throw new ParseError(e.line, e.column, "cannot " + what + " " + describe(e));
    }

    private List<Expr> targets(List<Expr> elts, ExprContext ctx) {
        List<Expr> out = new ArrayList<>();
        for (Expr e : elts) {
            out.add(toTarget(e, ctx));
        }
        return out;
    }

    private static String describe(Expr e) {
        if (e instanceof Expr.Constant) return "literal";
        if (e instanceof Expr.Call) return "function call";
        if (e instanceof Expr.Compare) return "comparison";
        if (e instanceof Expr.IfExp) return "conditional expression";
        return "expression";
    }

    // ---------------------------------------------------------------- 表达式

    /**
     * test (',' test)* [','] ，出现逗号时构成元组
     */
    private Expr testList() {
        Token start = peek();
        Expr first = test();
        if (!peek().isOp(",")) return first;
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (peek().isOp(",")) {
            next();
            if (!startsExpression(peek())) break;
            elts.add(test());
        }
        return new Expr.TupleExpr(start.line(), start.column(), elts, ExprContext.LOAD);
    }

    /**
     * for 目标使用的表达式列表，不能吃掉 'in'
     */
    private Expr exprList() {
        Token start = peek();
        Expr first = expr();
        if (!peek().isOp(",")) return first;
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (peek().isOp(",")) {
            next();
            if (!startsExpression(peek())) break;
            elts.add(expr());
        }
        return new Expr.TupleExpr(start.line(), start.column(), elts, ExprContext.LOAD);
    }

    private Expr test() {
        Token start = peek();
        Expr body = orTest();
        if (peek().isKeyword("if")) {
            next();
            Expr cond = orTest();
            expectKeyword("else");
            Expr orelse = test();
            return new Expr.IfExp(start.line(), start.column(), cond, body, orelse);
        }
        return body;
    }

    private Expr orTest() {
        Token start = peek();
        Expr first = andTest();
        if (!peek().isKeyword("or")) return first;
        List<Expr> values = new ArrayList<>();
        values.add(first);
        while (peek().isKeyword("or")) {
            next();
            values.add(andTest());
        }
        return new Expr.BoolOp(start.line(), start.column(), BoolOperator.OR, values);
    }

    private Expr andTest() {
        Token start = peek();
        Expr first = notTest();
        if (!peek().isKeyword("and")) return first;
        List<Expr> values = new ArrayList<>();
        values.add(first);
        while (peek().isKeyword("and")) {
            next();
            values.add(notTest());
        }
        return new Expr.BoolOp(start.line(), start.column(), BoolOperator.AND, values);
    }

    private Expr notTest() {
        Token t = peek();
        if (t.isKeyword("not")) {
            next();
            return new Expr.UnaryOp(t.line(), t.column(), UnaryOperator.NOT, notTest());
        }
        return comparison();
    }

    private Expr comparison() {
        Token start = peek();
        Expr left = expr();
        List<CmpOperator> ops = new ArrayList<>();
        List<Expr> comparators = new ArrayList<>();
        while (true) {
            CmpOperator op = comparisonOperator();
            if (op == null) break;
            ops.add(op);
            comparators.add(expr());
        }
        if (ops.isEmpty()) return left;
        return new Expr.Compare(start.line(), start.column(), left, ops, comparators);
    }

    private CmpOperator comparisonOperator() {
        Token t = peek();
        if (t.type() == TokenType.OP && CMP_OPS.containsKey(t.text())) {
            next();
            return CMP_OPS.get(t.text());
        }
        if (t.isKeyword("in")) {
            next();
            return CmpOperator.IN;
        }
        if (t.isKeyword("not") && peekAt(1).isKeyword("in")) {
            next();
            next();
            return CmpOperator.NOT_IN;
        }
        if (t.isKeyword("is")) {
            next();
            if (peek().isKeyword("not")) {
                next();
                return CmpOperator.IS_NOT;
            }
            return CmpOperator.IS;
        }
        return null;
    }

    /**
     * 算术表达式（加减）
     */
    private Expr expr() {
        Token start = peek();
        Expr left = term();
        while (peek().isOp("+") || peek().isOp("-")) {
            Operator op = next().text().equals("+") ? Operator.ADD : Operator.SUB;
            left = new Expr.BinOp(start.line(), start.column(), left, op, term());
        }
        return left;
    }

    private Expr term() {
        Token start = peek();
        Expr left = factor();
        while (true) {
            Token t = peek();
            Operator op;
            if (t.isOp("*")) op = Operator.MULT;
            else if (t.isOp("/")) op = Operator.DIV;
            else if (t.isOp("//")) op = Operator.FLOOR_DIV;
            else if (t.isOp("%")) op = Operator.MOD;
            else break;
            next();
            left = new Expr.BinOp(start.line(), start.column(), left, op, factor());
        }
        return left;
    }

    private Expr factor() {
        Token t = peek();
        if (t.isOp("-") || t.isOp("+")) {
            next();
            UnaryOperator op = t.text().equals("-") ? UnaryOperator.NEG : UnaryOperator.POS;
            return new Expr.UnaryOp(t.line(), t.column(), op, factor());
        }
        return power();
    }

    private Expr power() {
        Token start = peek();
        Expr base = atomExpr();
        if (peek().isOp("**")) {
            next();
            // 右结合，且指数部分允许一元负号
            return new Expr.BinOp(start.line(), start.column(), base, Operator.POW, factor());
        }
        return base;
    }

    private Expr atomExpr() {
        Expr e = atom();
        while (true) {
            Token t = peek();
            if (t.isOp("(")) {
                next();
                e = callArguments(e);
            } else if (t.isOp("[")) {
                next();
                Expr index = subscriptList();
                expectOp("]");
                e = new Expr.Subscript(e.line, e.column, e, index, ExprContext.LOAD);
            } else if (t.isOp(".")) {
                next();
                Token attr = expect(TokenType.NAME, "attribute name");
                e = new Expr.Attribute(e.line, e.column, e, attr.text(), ExprContext.LOAD);
            } else {
                return e;
            }
        }
    }

    private Expr callArguments(Expr func) {
        List<Expr> args = new ArrayList<>();
        List<Expr.Keyword> keywords = new ArrayList<>();
        while (!peek().isOp(")")) {
            Token t = peek();
            if (t.type() == TokenType.NAME && peekAt(1).isOp("=")) {
                next();
                next();
                for (Expr.Keyword k : keywords) {
                    if (k.arg.equals(t.text())) throw error(t, "keyword argument repeated: " + t.text());
                }
                keywords.add(new Expr.Keyword(t.line(), t.column(), t.text(), test()));
            } else {
                if (!keywords.isEmpty()) throw error(t, "positional argument follows keyword argument");
                args.add(test());
            }
            if (!peek().isOp(",")) break;
            next();
        }
        expectOp(")");
        return new Expr.Call(func.line, func.column, func, args, keywords);
    }

    private Expr subscriptList() {
        Token start = peek();
        Expr first = subscript();
        if (!peek().isOp(",")) return first;
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (peek().isOp(",")) {
            next();
            if (peek().isOp("]")) break;
            elts.add(subscript());
        }
        return new Expr.TupleExpr(start.line(), start.column(), elts, ExprContext.LOAD);
    }

    private Expr subscript() {
        Token start = peek();
        Expr lower = null;
        if (!start.isOp(":")) {
            lower = test();
            if (!peek().isOp(":")) return lower;
        }
        next(); // ':'
        Expr upper = null;
        Expr step = null;
        if (!peek().isOp("]") && !peek().isOp(",") && !peek().isOp(":")) {
            upper = test();
        }
        if (peek().isOp(":")) {
            next();
            if (!peek().isOp("]") && !peek().isOp(",")) {
                step = test();
            }
        }
        return new Expr.Slice(start.line(), start.column(), lower, upper, step);
    }

    private Expr atom() {
        Token t = next();
        switch (t.type()) {
            case NAME:
                return new Expr.Name(t.line(), t.column(), t.text(), ExprContext.LOAD);
            case INT:
            case FLOAT:
                return new Expr.Constant(t.line(), t.column(), t.value());
            case STRING: {
                StringBuilder sb = new StringBuilder((String) t.value());
                // 相邻字符串字面量自动拼接
                while (peek().type() == TokenType.STRING) {
                    sb.append((String) next().value());
                }
                return new Expr.Constant(t.line(), t.column(), sb.toString());
            }
            case KEYWORD:
                switch (t.text()) {
                    case "True":
                        return new Expr.Constant(t.line(), t.column(), Boolean.TRUE);
                    case "False":
                        return new Expr.Constant(t.line(), t.column(), Boolean.FALSE);
                    case "None":
                        return new Expr.Constant(t.line(), t.column(), null);
                    case "lambda":
                    case "yield":
                    case "await":
                        throw error(t, "unsupported syntax '" + t.text() + "'");
                    default:
                        throw error(t, "invalid syntax");
                }
            case OP:
                if (t.isOp("(")) return parenthesized(t);
                if (t.isOp("[")) return listDisplay(t);
                if (t.isOp("{")) return dictOrSetDisplay(t);
                throw error(t, "invalid syntax");
            default:
                throw error(t, "invalid syntax");
        }
    }

    private Expr parenthesized(Token open) {
        if (peek().isOp(")")) {
            next();
            return new Expr.TupleExpr(open.line(), open.column(), List.of(), ExprContext.LOAD);
        }
        Expr first = test();
        if (peek().isOp(")")) {
            next();
            return first;
        }
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (peek().isOp(",")) {
            next();
            if (peek().isOp(")")) break;
            elts.add(test());
        }
        expectOp(")");
        return new Expr.TupleExpr(open.line(), open.column(), elts, ExprContext.LOAD);
    }

    private Expr listDisplay(Token open) {
        List<Expr> elts = new ArrayList<>();
        while (!peek().isOp("]")) {
            elts.add(test());
            if (!peek().isOp(",")) break;
            next();
        }
        expectOp("]");
        return new Expr.ListExpr(open.line(), open.column(), elts, ExprContext.LOAD);
    }

    private Expr dictOrSetDisplay(Token open) {
        if (peek().isOp("}")) {
            next();
            return new Expr.DictExpr(open.line(), open.column(), List.of(), List.of());
        }
        Expr first = test();
        if (peek().isOp(":")) {
            List<Expr> keys = new ArrayList<>();
            List<Expr> values = new ArrayList<>();
            next();
            keys.add(first);
            values.add(test());
            while (peek().isOp(",")) {
                next();
                if (peek().isOp("}")) break;
                keys.add(test());
                expectOp(":");
                values.add(test());
            }
            expectOp("}");
            return new Expr.DictExpr(open.line(), open.column(), keys, values);
        }
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (peek().isOp(",")) {
            next();
            if (peek().isOp("}")) break;
            elts.add(test());
        }
        expectOp("}");
        return new Expr.SetExpr(open.line(), open.column(), elts);
    }

    private static boolean startsExpression(Token t) {
        return switch (t.type()) {
            case NAME, INT, FLOAT, STRING -> true;
            case KEYWORD -> t.text().equals("not") || t.text().equals("True") || t.text().equals("False")
                    || t.text().equals("None");
            case OP -> t.isOp("(") || t.isOp("[") || t.isOp("{") || t.isOp("-") || t.isOp("+");
            default -> false;
        };
    }

    // ---------------------------------------------------------------- 工具方法

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int ahead) {
        int p = Math.min(pos + ahead, tokens.size() - 1);
        return tokens.get(p);
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.type() != TokenType.END) pos++;
        return t;
    }

    private Token expect(TokenType type, String what) {
        Token t = peek();
        if (t.type() != type) {
            throw error(t, "expected " + what + " but found " + t);
        }
        return next();
    }

    private void expectOp(String op) {
        Token t = peek();
        if (!t.isOp(op)) {
            throw error(t, "expected '" + op + "' but found " + t);
        }
        next();
    }

    private void expectKeyword(String kw) {
        Token t = peek();
        if (!t.isKeyword(kw)) {
            throw error(t, "expected '" + kw + "' but found " + t);
        }
        next();
    }

    private static ParseError error(Token t, String message) {
        return new ParseError(t.line(), t.column(), message);
    }
}
