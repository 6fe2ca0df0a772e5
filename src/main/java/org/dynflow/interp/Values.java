package org.dynflow.interp;

import org.dynflow.ast.CmpOperator;
import org.dynflow.ast.Operator;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * 脚本值的公共操作：类型名、真值、字符串表示、算术、比较、迭代和下标。
 * <p>
 * 值的 Java 表示：int → Long，float → Double，bool → Boolean，None → null，str → String，
 * list → List，tuple → {@link Tuple}，dict → Map，set → Set，range → {@link RangeValue}。
 */
public final class Values {

    private Values() {
    }

    public static String typeName(Object v) {
        if (v == null) return "NoneType";
        if (v instanceof Boolean) return "bool";
        if (v instanceof Long) return "int";
        if (v instanceof Double) return "float";
        if (v instanceof String) return "str";
        if (v instanceof List<?>) return "list";
        if (v instanceof Tuple) return "tuple";
        if (v instanceof Map<?, ?>) return "dict";
        if (v instanceof Set<?>) return "set";
        if (v instanceof RangeValue) return "range";
        if (v instanceof FunctionValue) return "function";
        if (v instanceof BuiltinFunction) return "builtin_function_or_method";
        if (v instanceof BoundMethod) return "builtin_function_or_method";
        if (v instanceof ExceptionValue e) return e.type();
        if (v instanceof ContextManager) return "context_manager";
        return v.getClass().getSimpleName();
    }

    public static boolean truthy(Object v) {
        if (v == null) return false;
        if (v instanceof Boolean b) return b;
        if (v instanceof Long l) return l != 0;
        if (v instanceof Double d) return d != 0.0;
        if (v instanceof String s) return !s.isEmpty();
        if (v instanceof Collection<?> c) return !c.isEmpty();
        if (v instanceof Map<?, ?> m) return !m.isEmpty();
        if (v instanceof Tuple t) return t.size() > 0;
        if (v instanceof RangeValue r) return r.length() > 0;
        return true;
    }

    // ---------------------------------------------------------------- 字符串表示

    public static String str(Object v) {
        if (v instanceof String s) return s;
        if (v instanceof ExceptionValue e) return e.message();
        return repr(v);
    }

    public static String repr(Object v) {
        if (v == null) return "None";
        if (v instanceof Boolean b) return b ? "True" : "False";
        if (v instanceof Long) return v.toString();
        if (v instanceof Double d) return reprFloat(d);
        if (v instanceof String s) return reprString(s);
        if (v instanceof List<?> list) return join("[", list, "]");
        if (v instanceof Tuple t) {
            return t.size() == 1 ? "(" + repr(t.get(0)) + ",)" : join("(", t.asList(), ")");
        }
        if (v instanceof Map<?, ?> m) {
            StringBuilder sb = new StringBuilder("{");
            boolean first = true;
            for (Map.Entry<?, ?> e : m.entrySet()) {
                if (!first) sb.append(", ");
                first = false;
                sb.append(repr(e.getKey())).append(": ").append(repr(e.getValue()));
            }
            return sb.append('}').toString();
        }
        if (v instanceof Set<?> s) return s.isEmpty() ? "set()" : join("{", s, "}");
        return v.toString();
    }

    private static String join(String open, Collection<?> items, String close) {
        StringBuilder sb = new StringBuilder(open);
        boolean first = true;
        for (Object o : items) {
            if (!first) sb.append(", ");
            first = false;
            sb.append(repr(o));
        }
        return sb.append(close).toString();
    }

    static String reprFloat(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        double abs = Math.abs(d);
        String s = Double.toString(d);
        if (abs != 0 && (abs >= 1e16 || abs < 1e-4)) {
            // 1.0E16 → 1e+16，1.5E-5 → 1.5e-05
            int e = s.indexOf('E');
            String mantissa = s.substring(0, e);
            if (mantissa.endsWith(".0")) mantissa = mantissa.substring(0, mantissa.length() - 2);
            int exp = Integer.parseInt(s.substring(e + 1));
            String expText = String.format("%02d", Math.abs(exp));
            return mantissa + "e" + (exp < 0 ? "-" : "+") + expText;
        }
        if (s.contains("E")) {
            // Java 在 1e-3 以下、1e7 以上使用科学计数法，这一区间按普通小数显示
            String plain = new BigDecimal(s).stripTrailingZeros().toPlainString();
            return plain.contains(".") ? plain : plain + ".0";
        }
        return s;
    }

    static String reprString(String s) {
        char quote = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder sb = new StringBuilder().append(quote);
        for (char c : s.toCharArray()) {
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '\\' -> sb.append("\\\\");
                default -> {
                    if (c == quote) sb.append('\\');
                    sb.append(c);
                }
            }
        }
        return sb.append(quote).toString();
    }

    // ---------------------------------------------------------------- 相等与哈希

    public static boolean eq(Object a, Object b) {
        if (isNumber(a) && isNumber(b)) {
            if (a instanceof Double || b instanceof Double) return toDouble(a) == toDouble(b);
            return toLong(a) == toLong(b);
        }
        if (a instanceof List<?> la && b instanceof List<?> lb) {
            if (la.size() != lb.size()) return false;
            for (int i = 0; i < la.size(); i++) {
                if (!eq(la.get(i), lb.get(i))) return false;
            }
            return true;
        }
        return Objects.equals(a, b);
    }

    static int hash(Object v) {
        if (v instanceof Boolean b) return Long.hashCode(b ? 1 : 0);
        if (v instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) return Long.hashCode(d.longValue());
        return Objects.hashCode(v);
    }

    /**
     * dict / set 的键：True 与 1、1.0 与 1 视为同一个键
     */
    static Object key(Object v) {
        if (v instanceof List<?> || v instanceof Map<?, ?> || v instanceof Set<?>) {
            throw ProgramError.typeError("unhashable type: '" + typeName(v) + "'");
        }
        if (v instanceof Boolean b) return b ? 1L : 0L;
        if (v instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)
                && Math.abs(d) < 9.0e15) return d.longValue();
        return v;
    }

    // ---------------------------------------------------------------- 数值

    static boolean isNumber(Object v) {
        return v instanceof Long || v instanceof Double || v instanceof Boolean;
    }

    static boolean isInteger(Object v) {
        return v instanceof Long || v instanceof Boolean;
    }

    static long toLong(Object v) {
        if (v instanceof Long l) return l;
        if (v instanceof Boolean b) return b ? 1 : 0;
        throw ProgramError.typeError("'" + typeName(v) + "' object cannot be interpreted as an integer");
    }

    static double toDouble(Object v) {
        if (v instanceof Double d) return d;
        return toLong(v);
    }

    public static Object binary(Operator op, Object a, Object b) {
        switch (op) {
            case ADD:
                if (isNumber(a) && isNumber(b)) {
                    if (isInteger(a) && isInteger(b)) return exact(() -> Math.addExact(toLong(a), toLong(b)));
                    return toDouble(a) + toDouble(b);
                }
                if (a instanceof String sa && b instanceof String sb) return sa + sb;
                if (a instanceof List<?> la && b instanceof List<?> lb) {
                    List<Object> out = new ArrayList<>(la);
                    out.addAll(lb);
                    return out;
                }
                if (a instanceof Tuple ta && b instanceof Tuple tb) {
                    List<Object> out = new ArrayList<>(ta.asList());
                    out.addAll(tb.asList());
                    return Tuple.of(out);
                }
                break;
            case SUB:
                if (isNumber(a) && isNumber(b)) {
                    if (isInteger(a) && isInteger(b)) return exact(() -> Math.subtractExact(toLong(a), toLong(b)));
                    return toDouble(a) - toDouble(b);
                }
                if (a instanceof Set<?> sa && b instanceof Set<?> sb) {
                    Set<Object> out = new LinkedHashSet<>(sa);
                    out.removeAll(sb);
                    return out;
                }
                break;
            case MULT:
                if (isNumber(a) && isNumber(b)) {
                    if (isInteger(a) && isInteger(b)) return exact(() -> Math.multiplyExact(toLong(a), toLong(b)));
                    return toDouble(a) * toDouble(b);
                }
                if (isInteger(b) && (a instanceof String || a instanceof List<?> || a instanceof Tuple)) {
                    return repeat(a, toLong(b));
                }
                if (isInteger(a) && (b instanceof String || b instanceof List<?> || b instanceof Tuple)) {
                    return repeat(b, toLong(a));
                }
                break;
            case DIV:
                if (isNumber(a) && isNumber(b)) {
                    if (toDouble(b) == 0) throw new ProgramError("ZeroDivisionError", "division by zero");
                    return toDouble(a) / toDouble(b);
                }
                break;
            case FLOOR_DIV:
                if (isNumber(a) && isNumber(b)) {
                    if (toDouble(b) == 0) throw new ProgramError("ZeroDivisionError", "integer division or modulo by zero");
                    if (isInteger(a) && isInteger(b)) return Math.floorDiv(toLong(a), toLong(b));
                    return Math.floor(toDouble(a) / toDouble(b));
                }
                break;
            case MOD:
                if (isNumber(a) && isNumber(b)) {
                    if (toDouble(b) == 0) throw new ProgramError("ZeroDivisionError", "integer division or modulo by zero");
                    if (isInteger(a) && isInteger(b)) return Math.floorMod(toLong(a), toLong(b));
                    double x = toDouble(a);
                    double y = toDouble(b);
                    return x - y * Math.floor(x / y);
                }
                break;
            case POW:
                if (isNumber(a) && isNumber(b)) {
                    if (isInteger(a) && isInteger(b) && toLong(b) >= 0) return intPow(toLong(a), toLong(b));
                    if (toDouble(a) == 0 && toDouble(b) < 0) {
                        throw new ProgramError("ZeroDivisionError", "0.0 cannot be raised to a negative power");
                    }
                    return Math.pow(toDouble(a), toDouble(b));
                }
                break;
            default:
                break;
        }
        throw ProgramError.typeError("unsupported operand type(s) for " + op.symbol + ": '"
                + typeName(a) + "' and '" + typeName(b) + "'");
    }

    private interface LongOp {
        long apply();
    }

    private static Object exact(LongOp op) {
        try {
            return op.apply();
        } catch (ArithmeticException e) {
            throw new ProgramError("OverflowError", "integer result out of range");
        }
    }

    private static long intPow(long base, long exp) {
        long result = 1;
        long b = base;
        long e = exp;
        try {
            while (e > 0) {
                if ((e & 1) == 1) result = Math.multiplyExact(result, b);
                e >>= 1;
                if (e > 0) b = Math.multiplyExact(b, b);
            }
        } catch (ArithmeticException ex) {
            throw new ProgramError("OverflowError", "integer result out of range");
        }
        return result;
    }

    private static Object repeat(Object seq, long n) {
        if (seq instanceof String s) return n <= 0 ? "" : s.repeat((int) n);
        List<Object> src = seq instanceof Tuple t ? t.asList() : new ArrayList<>((List<?>) seq);
        List<Object> out = new ArrayList<>();
        for (long i = 0; i < n; i++) out.addAll(src);
        return seq instanceof Tuple ? Tuple.of(out) : out;
    }

    public static Object negate(Object v) {
        if (isInteger(v)) return exact(() -> Math.negateExact(toLong(v)));
        if (v instanceof Double d) return -d;
        throw ProgramError.typeError("bad operand type for unary -: '" + typeName(v) + "'");
    }

    public static Object plus(Object v) {
        if (isInteger(v)) return toLong(v);
        if (v instanceof Double) return v;
        throw ProgramError.typeError("bad operand type for unary +: '" + typeName(v) + "'");
    }

    // ---------------------------------------------------------------- 比较

    public static boolean compare(CmpOperator op, Object a, Object b) {
        return switch (op) {
            case EQ -> eq(a, b);
            case NOT_EQ -> !eq(a, b);
            case LT -> order(a, b, "<") < 0;
            case LTE -> order(a, b, "<=") <= 0;
            case GT -> order(a, b, ">") > 0;
            case GTE -> order(a, b, ">=") >= 0;
            case IN -> contains(b, a);
            case NOT_IN -> !contains(b, a);
            case IS -> identical(a, b);
            case IS_NOT -> !identical(a, b);
        };
    }

    private static boolean identical(Object a, Object b) {
        if (a == null || b == null) return a == b;
        if (a instanceof Boolean || a instanceof Long || a instanceof String) return a.equals(b);
        return a == b;
    }

    static int order(Object a, Object b, String symbol) {
        if (isNumber(a) && isNumber(b)) {
            if (isInteger(a) && isInteger(b)) return Long.compare(toLong(a), toLong(b));
            return Double.compare(toDouble(a), toDouble(b));
        }
        if (a instanceof String sa && b instanceof String sb) return sa.compareTo(sb);
        if (a instanceof List<?> la && b instanceof List<?> lb) return orderSequences(la, lb, symbol);
        if (a instanceof Tuple ta && b instanceof Tuple tb) return orderSequences(ta.asList(), tb.asList(), symbol);
        throw ProgramError.typeError("'" + symbol + "' not supported between instances of '"
                + typeName(a) + "' and '" + typeName(b) + "'");
    }

    private static int orderSequences(List<?> a, List<?> b, String symbol) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            if (!eq(a.get(i), b.get(i))) return order(a.get(i), b.get(i), symbol);
        }
        return Integer.compare(a.size(), b.size());
    }

    public static boolean contains(Object container, Object item) {
        if (container instanceof String s) {
            if (!(item instanceof String sub)) {
                throw ProgramError.typeError("'in <string>' requires string as left operand, not " + typeName(item));
            }
            return s.contains(sub);
        }
        if (container instanceof Map<?, ?> m) return m.containsKey(key(item));
        if (container instanceof Set<?> s) return s.contains(key(item));
        if (container instanceof RangeValue r) return isInteger(item) && r.contains(toLong(item));
        if (container instanceof List<?> || container instanceof Tuple) {
            Iterator<Object> it = iterate(container);
            while (it.hasNext()) {
                if (eq(it.next(), item)) return true;
            }
            return false;
        }
        throw ProgramError.typeError("argument of type '" + typeName(container) + "' is not iterable");
    }

    // ---------------------------------------------------------------- 迭代

    /**
     * 迭代 list 时按下标读取，循环体内修改列表不会触发 ConcurrentModificationException
     */
    public static Iterator<Object> iterate(Object v) {
        if (v instanceof List<?> list) {
            return new Iterator<>() {
                private int i = 0;

                @Override
                public boolean hasNext() {
                    return i < list.size();
                }

                @Override
                public Object next() {
                    if (i >= list.size()) throw new NoSuchElementException();
                    return list.get(i++);
                }
            };
        }
        if (v instanceof Tuple t) return t.asList().iterator();
        if (v instanceof String s) {
            List<Object> chars = new ArrayList<>();
            s.codePoints().forEach(cp -> chars.add(new String(Character.toChars(cp))));
            return chars.iterator();
        }
        if (v instanceof Map<?, ?> m) return new ArrayList<Object>(m.keySet()).iterator();
        if (v instanceof Set<?> s) return new ArrayList<Object>(s).iterator();
        if (v instanceof RangeValue r) return r.iterator();
        throw ProgramError.typeError("'" + typeName(v) + "' object is not iterable");
    }

    // 脚本创建的 list / dict / set 元素类型都是 Object，写入时按 Object 视图访问
    static List<Object> mutableList(List<?> list) {
        return (List<Object>) list;
    }

    static Map<Object, Object> mutableDict(Map<?, ?> map) {
        return (Map<Object, Object>) map;
    }

    static Set<Object> mutableSet(Set<?> set) {
        return (Set<Object>) set;
    }

    public static List<Object> toList(Object v) {
        List<Object> out = new ArrayList<>();
        iterate(v).forEachRemaining(out::add);
        return out;
    }

    public static long length(Object v) {
        if (v instanceof String s) return s.codePointCount(0, s.length());
        if (v instanceof Collection<?> c) return c.size();
        if (v instanceof Map<?, ?> m) return m.size();
        if (v instanceof Tuple t) return t.size();
        if (v instanceof RangeValue r) return r.length();
        throw ProgramError.typeError("object of type '" + typeName(v) + "' has no len()");
    }

    // ---------------------------------------------------------------- 下标

    public static Object getItem(Object container, Object index) {
        if (container instanceof Map<?, ?> m) {
            Object k = key(index);
            if (!m.containsKey(k)) throw new ProgramError("KeyError", repr(index));
            return m.get(k);
        }
        if (index instanceof SliceValue slice) {
            return slice(container, slice);
        }
        if (container instanceof List<?> list) return list.get(normalize(index, list.size(), "list"));
        if (container instanceof Tuple t) return t.get(normalize(index, t.size(), "tuple"));
        if (container instanceof String s) {
            int i = normalize(index, s.length(), "string");
            return String.valueOf(s.charAt(i));
        }
        if (container instanceof RangeValue r) {
            return r.get(normalize(index, (int) r.length(), "range object"));
        }
        throw ProgramError.typeError("'" + typeName(container) + "' object is not subscriptable");
    }

    public static void setItem(Object container, Object index, Object value) {
        if (container instanceof Map<?, ?> m) {
            mutableDict(m).put(key(index), value);
            return;
        }
        if (container instanceof List<?> list) {
            if (index instanceof SliceValue) {
                throw ProgramError.typeError("slice assignment is not supported");
            }
            mutableList(list).set(normalize(index, list.size(), "list assignment"), value);
            return;
        }
        throw ProgramError.typeError("'" + typeName(container) + "' object does not support item assignment");
    }

    public static void delItem(Object container, Object index) {
        if (container instanceof Map<?, ?> m) {
            Object k = key(index);
            if (!m.containsKey(k)) throw new ProgramError("KeyError", repr(index));
            m.remove(k);
            return;
        }
        if (container instanceof List<?> list && !(index instanceof SliceValue)) {
            list.remove(normalize(index, list.size(), "list assignment"));
            return;
        }
        throw ProgramError.typeError("'" + typeName(container) + "' object doesn't support item deletion");
    }

    private static int normalize(Object index, int size, String what) {
        if (!isInteger(index)) {
            throw ProgramError.typeError(what + " indices must be integers, not " + typeName(index));
        }
        long i = toLong(index);
        if (i < 0) i += size;
        if (i < 0 || i >= size) throw ProgramError.indexError(what + " index out of range");
        return (int) i;
    }

    private static Object slice(Object container, SliceValue slice) {
        List<Object> items;
        if (container instanceof List<?> list) items = new ArrayList<>(list);
        else if (container instanceof Tuple t) items = t.asList();
        else if (container instanceof String s) items = toList(s);
        else throw ProgramError.typeError("'" + typeName(container) + "' object is not subscriptable");

        int n = items.size();
        long step = slice.step() == null ? 1 : toLong(slice.step());
        if (step == 0) throw ProgramError.valueError("slice step cannot be zero");
        long start;
        long stop;
        if (step > 0) {
            start = slice.lower() == null ? 0 : clamp(toLong(slice.lower()), n, 0, n);
            stop = slice.upper() == null ? n : clamp(toLong(slice.upper()), n, 0, n);
        } else {
            start = slice.lower() == null ? n - 1 : clamp(toLong(slice.lower()), n, -1, n - 1);
            stop = slice.upper() == null ? -1 : clamp(toLong(slice.upper()), n, -1, n - 1);
        }
        List<Object> out = new ArrayList<>();
        for (long i = start; step > 0 ? i < stop : i > stop; i += step) {
            out.add(items.get((int) i));
        }
        if (container instanceof String) {
            StringBuilder sb = new StringBuilder();
            out.forEach(o -> sb.append((String) o));
            return sb.toString();
        }
        return container instanceof Tuple ? Tuple.of(out) : out;
    }

    private static long clamp(long i, int n, long min, long max) {
        if (i < 0) i += n;
        return Math.max(min, Math.min(max, i));
    }
}
