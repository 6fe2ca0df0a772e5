package org.dynflow.interp;

import org.dynflow.ast.*;
import org.dynflow.ast.Module;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 语法树解释器。
 * <p>
 * 逐条执行语句，并在每一行开始执行前调用 {@link LineHook#onLine(Frame, int)}：
 * 同一个 Frame 内行号发生变化时触发一次；循环回到头部（向后跳转）时即使行号相同也会再次触发。
 * for 循环头在每次取下一个元素前触发（包括最后一次取空），while 循环头在每次测试条件前触发。
 * <p>
 * 一个 Interpreter 对应一次运行，不可重复使用，也不是线程安全的。
 */
public class Interpreter {

    private static final Logger LOGGER = LoggerFactory.getLogger(Interpreter.class);

    private final LineHook hook;
    private final int maxLineEvents;
    private final int maxCallDepth;
    private final Map<String, Object> builtins;

    private long lineEvents = 0;
    private long nextInvocationId = Frame.MODULE_INVOCATION + 1;
    private int callDepth = 0;

    /**
     * @param hook          行回调，可为 null
     * @param out           被分析程序 print 的输出目标
     * @param maxLineEvents line 事件数上限，超过后以 ExecutionLimitError 终止程序
     * @param maxCallDepth  函数调用深度上限，超过后以 RecursionError 终止程序
     */
    public Interpreter(LineHook hook, PrintStream out, int maxLineEvents, int maxCallDepth) {
        this.hook = hook;
        this.maxLineEvents = maxLineEvents;
        this.maxCallDepth = maxCallDepth;
        this.builtins = Builtins.create(this, out);
    }

    /**
     * 内置名字表，在运行开始前就已固定
     */
    public Set<String> builtinNames() {
        return builtins.keySet();
    }

    /**
     * 执行整个模块。程序自身的错误以 {@link ProgramError} 抛出，此前已经触发的回调不受影响。
     *
     * @return 执行结束时的全局变量表
     */
    public Map<String, Object> run(Module module) {
        Map<String, Object> globals = new LinkedHashMap<>();
        Frame frame = Frame.module(module.sourceName, globals);
        LOGGER.debug("开始执行 {}", module.sourceName);
        if (hook != null) hook.onCall(frame);
        try {
            execBlock(module.body, frame);
        } catch (ProgramError e) {
            throw e.atLine(frame.currentLine);
        } catch (StackOverflowError e) {
            throw new ProgramError("RecursionError", "maximum recursion depth exceeded", frame.currentLine);
        } finally {
            if (hook != null) hook.onReturn(frame);
        }
        LOGGER.debug("执行结束，共 {} 次 line 事件", lineEvents);
        return Collections.unmodifiableMap(globals);
    }

    // ---------------------------------------------------------------- 控制流信号

    private static final class BreakSignal extends RuntimeException {
        static final BreakSignal INSTANCE = new BreakSignal();

        private BreakSignal() {
            super(null, null, false, false);
        }
    }

    private static final class ContinueSignal extends RuntimeException {
        static final ContinueSignal INSTANCE = new ContinueSignal();

        private ContinueSignal() {
            super(null, null, false, false);
        }
    }

    private static final class ReturnSignal extends RuntimeException {
        final transient Object value;

        ReturnSignal(Object value) {
            super(null, null, false, false);
            this.value = value;
        }
    }

    // ---------------------------------------------------------------- 语句

    private void traceLine(Frame frame, int line, boolean jumpedBack) {
        if (!jumpedBack && line == frame.lastLine) return;
        frame.lastLine = line;
        frame.currentLine = line;
        if (++lineEvents > maxLineEvents) {
            throw new ProgramError("ExecutionLimitError", "more than " + maxLineEvents + " line events", line);
        }
        if (hook != null) hook.onLine(frame, line);
    }

    private void execBlock(List<Stmt> body, Frame frame) {
        for (Stmt s : body) {
            exec(s, frame);
        }
    }

    private void exec(Stmt s, Frame frame) {
        if (s instanceof Stmt.For f) {
            execFor(f, frame);
            return;
        }
        if (s instanceof Stmt.While w) {
            execWhile(w, frame);
            return;
        }
        if (s instanceof Stmt.Global) {
            // global 只是声明，不产生可执行的行
            return;
        }
        traceLine(frame, s.line, false);

        if (s instanceof Stmt.ExprStmt e) {
            eval(e.value, frame);
        } else if (s instanceof Stmt.Assign a) {
            Object value = eval(a.value, frame);
            for (Expr target : a.targets) {
                assign(target, value, frame);
            }
        } else if (s instanceof Stmt.AugAssign a) {
            execAugAssign(a, frame);
        } else if (s instanceof Stmt.AnnAssign a) {
            if (a.value != null) {
                assign(a.target, eval(a.value, frame), frame);
            }
        } else if (s instanceof Stmt.If i) {
            if (Values.truthy(eval(i.test, frame))) {
                execBlock(i.body, frame);
            } else {
                execBlock(i.orelse, frame);
            }
        } else if (s instanceof Stmt.With w) {
            execWith(w, 0, frame);
        } else if (s instanceof Stmt.FunctionDef def) {
            storeName(def.name, defineFunction(def, frame), frame);
        } else if (s instanceof Stmt.Return r) {
            throw new ReturnSignal(r.value == null ? null : eval(r.value, frame));
        } else if (s instanceof Stmt.Assert a) {
            if (!Values.truthy(eval(a.test, frame))) {
                String msg = a.msg == null ? "" : Values.str(eval(a.msg, frame));
                throw new ProgramError("AssertionError", msg, s.line);
            }
        } else if (s instanceof Stmt.Raise r) {
            execRaise(r, frame);
        } else if (s instanceof Stmt.Delete d) {
            for (Expr target : d.targets) {
                delete(target, frame);
            }
        } else if (s instanceof Stmt.Break) {
            throw BreakSignal.INSTANCE;
        } else if (s instanceof Stmt.Continue) {
            throw ContinueSignal.INSTANCE;
        } else if (!(s instanceof Stmt.Pass)) {
            throw new IllegalStateException("unknown statement " + s);
        }
    }

    private void execFor(Stmt.For f, Frame frame) {
        traceLine(frame, f.line, false);
        Iterator<Object> it = Values.iterate(eval(f.iter, frame));
        boolean first = true;
        while (true) {
            if (!first) traceLine(frame, f.line, true);
            first = false;
            if (!it.hasNext()) break;
            assign(f.target, it.next(), frame);
            try {
                execBlock(f.body, frame);
            } catch (BreakSignal b) {
                return;
            } catch (ContinueSignal c) {
                // 进入下一轮
            }
        }
        execBlock(f.orelse, frame);
    }

    private void execWhile(Stmt.While w, Frame frame) {
        boolean first = true;
        while (true) {
            traceLine(frame, w.line, !first);
            first = false;
            if (!Values.truthy(eval(w.test, frame))) break;
            try {
                execBlock(w.body, frame);
            } catch (BreakSignal b) {
                return;
            } catch (ContinueSignal c) {
                // 进入下一轮
            }
        }
        execBlock(w.orelse, frame);
    }

    private void execAugAssign(Stmt.AugAssign a, Frame frame) {
        if (a.target instanceof Expr.Name n) {
            Object current = loadName(n.id, frame);
            storeName(n.id, inPlace(a.op, current, eval(a.value, frame)), frame);
        } else if (a.target instanceof Expr.Subscript s) {
            Object container = eval(s.value, frame);
            Object index = evalIndex(s.index, frame);
            Object current = Values.getItem(container, index);
            Values.setItem(container, index, inPlace(a.op, current, eval(a.value, frame)));
        } else {
            Expr.Attribute attr = (Expr.Attribute) a.target;
            Object owner = eval(attr.value, frame);
            throw new ProgramError("AttributeError",
                    "'" + Values.typeName(owner) + "' object attribute '" + attr.attr + "' is read-only");
        }
    }

    /**
     * list += iterable 原地扩展，其他情况与普通二元运算相同
     */
    private static Object inPlace(Operator op, Object current, Object value) {
        if (op == Operator.ADD && current instanceof List<?> list) {
            Values.mutableList(list).addAll(Values.toList(value));
            return list;
        }
        return Values.binary(op, current, value);
    }

    private void execWith(Stmt.With w, int index, Frame frame) {
        if (index == w.items.size()) {
            execBlock(w.body, frame);
            return;
        }
        Stmt.WithItem item = w.items.get(index);
        Object value = eval(item.contextExpr, frame);
        if (!(value instanceof ContextManager cm)) {
            throw ProgramError.typeError("'" + Values.typeName(value)
                    + "' object does not support the context manager protocol");
        }
        Object entered = cm.enter();
        boolean failed = false;
        try {
            if (item.optionalVars != null) {
                assign(item.optionalVars, entered, frame);
            }
            execWith(w, index + 1, frame);
        } catch (ProgramError e) {
            failed = true;
            if (!cm.exit(e.atLine(frame.currentLine))) throw e;
        } finally {
            // break / continue / return 同样要退出上下文
            if (!failed) cm.exit(null);
        }
    }

    private void execRaise(Stmt.Raise r, Frame frame) {
        if (r.exc == null) {
            throw new ProgramError("RuntimeError", "No active exception to reraise", r.line);
        }
        Object exc = eval(r.exc, frame);
        if (exc instanceof ExceptionValue ev) {
            throw new ProgramError(ev.type(), ev.message(), r.line);
        }
        if (exc instanceof BuiltinFunction f && Builtins.EXCEPTION_TYPES.contains(f.name())) {
            throw new ProgramError(f.name(), "", r.line);
        }
        throw ProgramError.typeError("exceptions must derive from BaseException").atLine(r.line);
    }

    private FunctionValue defineFunction(Stmt.FunctionDef def, Frame frame) {
        List<Object> defaults = new ArrayList<>();
        for (Stmt.Param p : def.params) {
            if (p.defaultValue != null) defaults.add(eval(p.defaultValue, frame));
        }
        LocalNameCollector names = LocalNameCollector.of(def);
        Frame enclosing = frame.isModuleLevel() ? null : frame;
        return new FunctionValue(def, frame.sourceName(), defaults, frame.globalStore(), enclosing,
                names.localNames(), names.globalNames());
    }

    // ---------------------------------------------------------------- 名字

    private Object loadName(String name, Frame frame) {
        if (!frame.isModuleLevel() && frame.isLocalName(name)) {
            Map<String, Object> locals = frame.localStore();
            if (locals.containsKey(name)) return locals.get(name);
            throw new ProgramError("UnboundLocalError",
                    "cannot access local variable '" + name + "' where it is not associated with a value");
        }
        if (!frame.isModuleLevel() && !frame.isDeclaredGlobal(name)) {
            for (Frame f = frame.enclosing(); f != null; f = f.enclosing()) {
                if (f.isLocalName(name) && f.localStore().containsKey(name)) {
                    return f.localStore().get(name);
                }
            }
        }
        Map<String, Object> globals = frame.globalStore();
        if (globals.containsKey(name)) return globals.get(name);
        if (builtins.containsKey(name)) return builtins.get(name);
        throw new ProgramError("NameError", "name '" + name + "' is not defined");
    }

    private void storeName(String name, Object value, Frame frame) {
        if (frame.isModuleLevel() || frame.isDeclaredGlobal(name)) {
            frame.globalStore().put(name, value);
        } else {
            frame.localStore().put(name, value);
        }
    }

    private void assign(Expr target, Object value, Frame frame) {
        if (target instanceof Expr.Name n) {
            storeName(n.id, value, frame);
        } else if (target instanceof Expr.TupleExpr || target instanceof Expr.ListExpr) {
            List<Expr> elts = target instanceof Expr.TupleExpr t ? t.elts : ((Expr.ListExpr) target).elts;
            List<Object> items = Values.toList(value);
            if (items.size() != elts.size()) {
                if (items.size() > elts.size()) {
                    throw ProgramError.valueError("too many values to unpack (expected " + elts.size() + ")");
                }
                throw ProgramError.valueError("not enough values to unpack (expected " + elts.size()
                        + ", got " + items.size() + ")");
            }
            for (int i = 0; i < elts.size(); i++) {
                assign(elts.get(i), items.get(i), frame);
            }
        } else if (target instanceof Expr.Subscript s) {
            Object container = eval(s.value, frame);
            Values.setItem(container, evalIndex(s.index, frame), value);
        } else if (target instanceof Expr.Attribute a) {
            Object owner = eval(a.value, frame);
            throw new ProgramError("AttributeError",
                    "'" + Values.typeName(owner) + "' object has no attribute '" + a.attr + "'");
        } else {
            throw new IllegalStateException("invalid assignment target " + target);
        }
    }

    private void delete(Expr target, Frame frame) {
        if (target instanceof Expr.Name n) {
            Map<String, Object> store = frame.isModuleLevel() || frame.isDeclaredGlobal(n.id)
                    ? frame.globalStore() : frame.localStore();
            if (!store.containsKey(n.id)) {
                throw new ProgramError("NameError", "name '" + n.id + "' is not defined");
            }
            store.remove(n.id);
        } else if (target instanceof Expr.Subscript s) {
            Values.delItem(eval(s.value, frame), evalIndex(s.index, frame));
        } else if (target instanceof Expr.TupleExpr t) {
            for (Expr e : t.elts) delete(e, frame);
        } else if (target instanceof Expr.ListExpr l) {
            for (Expr e : l.elts) delete(e, frame);
        } else {
            throw ProgramError.typeError("cannot delete " + target);
        }
    }

    // ---------------------------------------------------------------- 表达式

    private Object eval(Expr e, Frame frame) {
        // 跨行的表达式求值进入新的一行时同样产生 line 事件
        traceLine(frame, e.line, false);
        if (e instanceof Expr.Constant c) {
            return c.value;
        }
        if (e instanceof Expr.Name n) {
            return loadName(n.id, frame);
        }
        if (e instanceof Expr.BinOp b) {
            Object left = eval(b.left, frame);
            return Values.binary(b.op, left, eval(b.right, frame));
        }
        if (e instanceof Expr.UnaryOp u) {
            Object v = eval(u.operand, frame);
            return switch (u.op) {
                case NEG -> Values.negate(v);
                case POS -> Values.plus(v);
                case NOT -> !Values.truthy(v);
            };
        }
        if (e instanceof Expr.BoolOp b) {
            Object v = null;
            for (Expr operand : b.values) {
                v = eval(operand, frame);
                boolean t = Values.truthy(v);
                if (b.op == BoolOperator.AND ? !t : t) return v;
            }
            return v;
        }
        if (e instanceof Expr.Compare c) {
            Object left = eval(c.left, frame);
            for (int i = 0; i < c.ops.size(); i++) {
                Object right = eval(c.comparators.get(i), frame);
                if (!Values.compare(c.ops.get(i), left, right)) return false;
                left = right;
            }
            return true;
        }
        if (e instanceof Expr.IfExp i) {
            return Values.truthy(eval(i.test, frame)) ? eval(i.body, frame) : eval(i.orelse, frame);
        }
        if (e instanceof Expr.Call call) {
            return evalCall(call, frame);
        }
        if (e instanceof Expr.Attribute a) {
            Object owner = eval(a.value, frame);
            if (Methods.has(owner, a.attr)) return new BoundMethod(owner, a.attr);
            throw new ProgramError("AttributeError",
                    "'" + Values.typeName(owner) + "' object has no attribute '" + a.attr + "'");
        }
        if (e instanceof Expr.Subscript s) {
            Object container = eval(s.value, frame);
            return Values.getItem(container, evalIndex(s.index, frame));
        }
        if (e instanceof Expr.ListExpr l) {
            List<Object> out = new ArrayList<>();
            for (Expr elt : l.elts) out.add(eval(elt, frame));
            return out;
        }
        if (e instanceof Expr.TupleExpr t) {
            List<Object> out = new ArrayList<>();
            for (Expr elt : t.elts) out.add(eval(elt, frame));
            return Tuple.of(out);
        }
        if (e instanceof Expr.SetExpr s) {
            Set<Object> out = new LinkedHashSet<>();
            for (Expr elt : s.elts) out.add(Values.key(eval(elt, frame)));
            return out;
        }
        if (e instanceof Expr.DictExpr d) {
            Map<Object, Object> out = new LinkedHashMap<>();
            for (int i = 0; i < d.keys.size(); i++) {
                Object k = Values.key(eval(d.keys.get(i), frame));
                out.put(k, eval(d.values.get(i), frame));
            }
            return out;
        }
        if (e instanceof Expr.Slice) {
            throw new ProgramError("SyntaxError", "slice outside of subscript");
        }
        throw new IllegalStateException("unknown expression " + e);
    }

    private Object evalIndex(Expr index, Frame frame) {
        if (index instanceof Expr.Slice s) {
            return new SliceValue(
                    s.lower == null ? null : eval(s.lower, frame),
                    s.upper == null ? null : eval(s.upper, frame),
                    s.step == null ? null : eval(s.step, frame));
        }
        return eval(index, frame);
    }

    private Object evalCall(Expr.Call call, Frame frame) {
        Object fn = eval(call.func, frame);
        List<Object> args = new ArrayList<>();
        for (Expr a : call.args) args.add(eval(a, frame));
        Map<String, Object> kwargs = new LinkedHashMap<>();
        for (Expr.Keyword k : call.keywords) kwargs.put(k.arg, eval(k.value, frame));
        return callValue(fn, args, kwargs);
    }

    /**
     * 调用任意可调用的脚本值；内置函数（例如 sorted 的 key）也经由这里回调用户函数
     */
    Object callValue(Object fn, List<Object> args, Map<String, Object> kwargs) {
        if (fn instanceof FunctionValue f) return callFunction(f, args, kwargs);
        if (fn instanceof BuiltinFunction b) return b.call(args, kwargs);
        if (fn instanceof BoundMethod m) return Methods.call(this, m.self(), m.name(), args, kwargs);
        throw ProgramError.typeError("'" + Values.typeName(fn) + "' object is not callable");
    }

    private Object callFunction(FunctionValue f, List<Object> args, Map<String, Object> kwargs) {
        List<Stmt.Param> params = f.def().params;
        if (args.size() > params.size()) {
            throw ProgramError.typeError(f.name() + "() takes " + params.size() + " positional argument(s) but "
                    + args.size() + " were given");
        }
        Map<String, Object> locals = new HashMap<>();
        for (int i = 0; i < args.size(); i++) {
            locals.put(params.get(i).name, args.get(i));
        }
        for (Map.Entry<String, Object> kw : kwargs.entrySet()) {
            boolean known = params.stream().anyMatch(p -> p.name.equals(kw.getKey()));
            if (!known) {
                throw ProgramError.typeError(f.name() + "() got an unexpected keyword argument '" + kw.getKey() + "'");
            }
            if (locals.containsKey(kw.getKey())) {
                throw ProgramError.typeError(f.name() + "() got multiple values for argument '" + kw.getKey() + "'");
            }
            locals.put(kw.getKey(), kw.getValue());
        }
        int firstDefault = params.size() - f.defaults().size();
        for (int i = 0; i < params.size(); i++) {
            String name = params.get(i).name;
            if (locals.containsKey(name)) continue;
            if (i < firstDefault) {
                throw ProgramError.typeError(f.name() + "() missing required argument: '" + name + "'");
            }
            locals.put(name, f.defaults().get(i - firstDefault));
        }

        if (callDepth >= maxCallDepth) {
            throw new ProgramError("RecursionError", "maximum recursion depth exceeded");
        }
        Frame frame = Frame.call(nextInvocationId++, f, locals);
        callDepth++;
        if (hook != null) hook.onCall(frame);
        try {
            execBlock(f.def().body, frame);
            return null;
        } catch (ReturnSignal r) {
            return r.value;
        } catch (ProgramError e) {
            throw e.atLine(frame.currentLine);
        } finally {
            callDepth--;
            if (hook != null) hook.onReturn(frame);
        }
    }

    List<Object> sorted(List<Object> items, Object key, boolean reverse) {
        List<Object> keys = new ArrayList<>();
        for (Object item : items) {
            keys.add(key == null ? item : callValue(key, Collections.singletonList(item), Map.of()));
        }
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) order.add(i);
        Comparator<Integer> cmp = (x, y) -> Methods.natural().compare(keys.get(x), keys.get(y));
        // List.sort 是稳定排序，reverse 时同样保持相等元素的原有顺序
        order.sort(reverse ? (x, y) -> cmp.compare(y, x) : cmp);
        List<Object> out = new ArrayList<>();
        for (int i : order) out.add(items.get(i));
        return out;
    }
}
