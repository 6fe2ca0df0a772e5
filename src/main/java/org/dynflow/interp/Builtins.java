package org.dynflow.interp;

import java.io.PrintStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 内置函数表。每次运行新建一份，print 的输出写到该次运行指定的 PrintStream。
 */
final class Builtins {

    static final List<String> EXCEPTION_TYPES = List.of(
            "Exception", "ValueError", "TypeError", "KeyError", "IndexError", "ZeroDivisionError",
            "RuntimeError", "AssertionError", "NameError", "AttributeError");

    private final Interpreter interp;
    private final PrintStream out;
    private final Map<String, Object> table = new LinkedHashMap<>();

    private Builtins(Interpreter interp, PrintStream out) {
        this.interp = interp;
        this.out = out;
    }

    static Map<String, Object> create(Interpreter interp, PrintStream out) {
        Builtins b = new Builtins(interp, out);
        b.register();
        return Collections.unmodifiableMap(b.table);
    }

    private void define(String name, BuiltinFunction.Impl impl) {
        table.put(name, new BuiltinFunction(name, impl));
    }

    private void register() {
        define("print", (args, kw) -> {
            String sep = kw.containsKey("sep") ? Values.str(kw.get("sep")) : " ";
            String end = kw.containsKey("end") ? Values.str(kw.get("end")) : "\n";
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(sep);
                sb.append(Values.str(args.get(i)));
            }
            out.print(sb.append(end));
            return null;
        });
        define("len", (args, kw) -> {
            Methods.arity("len", args, 1, 1);
            return Values.length(args.get(0));
        });
        define("range", (args, kw) -> {
            Methods.arity("range", args, 1, 3);
            if (args.size() == 1) return new RangeValue(0, Values.toLong(args.get(0)), 1);
            long step = args.size() == 3 ? Values.toLong(args.get(2)) : 1;
            return new RangeValue(Values.toLong(args.get(0)), Values.toLong(args.get(1)), step);
        });
        define("abs", (args, kw) -> {
            Methods.arity("abs", args, 1, 1);
            Object v = args.get(0);
            if (v instanceof Double d) return Math.abs(d);
            long l = Values.toLong(v);
            return l < 0 ? Values.negate(l) : l;
        });
        define("min", (args, kw) -> extreme("min", args, kw, -1));
        define("max", (args, kw) -> extreme("max", args, kw, 1));
        define("sum", (args, kw) -> {
            Methods.arity("sum", args, 1, 2);
            Object total = args.size() > 1 ? args.get(1) : kw.getOrDefault("start", 0L);
            Iterator<Object> it = Values.iterate(args.get(0));
            while (it.hasNext()) {
                total = Values.binary(org.dynflow.ast.Operator.ADD, total, it.next());
            }
            return total;
        });
        define("int", (args, kw) -> {
            Methods.arity("int", args, 0, 1);
            if (args.isEmpty()) return 0L;
            Object v = args.get(0);
            if (v instanceof Double d) {
                if (d.isNaN() || d.isInfinite()) throw ProgramError.valueError("cannot convert float " + Values.repr(d) + " to integer");
                return (long) (double) d;
            }
            if (v instanceof String s) {
                try {
                    return Long.parseLong(s.strip().replace("_", ""));
                } catch (NumberFormatException e) {
                    throw ProgramError.valueError("invalid literal for int() with base 10: " + Values.repr(s));
                }
            }
            return Values.toLong(v);
        });
        define("float", (args, kw) -> {
            Methods.arity("float", args, 0, 1);
            if (args.isEmpty()) return 0.0;
            Object v = args.get(0);
            if (v instanceof String s) {
                String t = s.strip().toLowerCase();
                switch (t) {
                    case "inf", "+inf", "infinity" -> {
                        return Double.POSITIVE_INFINITY;
                    }
                    case "-inf", "-infinity" -> {
                        return Double.NEGATIVE_INFINITY;
                    }
                    case "nan" -> {
                        return Double.NaN;
                    }
                    default -> {
                    }
                }
                try {
                    return Double.parseDouble(t);
                } catch (NumberFormatException e) {
                    throw ProgramError.valueError("could not convert string to float: " + Values.repr(s));
                }
            }
            return Values.toDouble(v);
        });
        define("str", (args, kw) -> {
            Methods.arity("str", args, 0, 1);
            return args.isEmpty() ? "" : Values.str(args.get(0));
        });
        define("repr", (args, kw) -> {
            Methods.arity("repr", args, 1, 1);
            return Values.repr(args.get(0));
        });
        define("bool", (args, kw) -> {
            Methods.arity("bool", args, 0, 1);
            return !args.isEmpty() && Values.truthy(args.get(0));
        });
        define("list", (args, kw) -> {
            Methods.arity("list", args, 0, 1);
            return args.isEmpty() ? new ArrayList<>() : Values.toList(args.get(0));
        });
        define("tuple", (args, kw) -> {
            Methods.arity("tuple", args, 0, 1);
            return args.isEmpty() ? Tuple.EMPTY : Tuple.of(Values.toList(args.get(0)));
        });
        define("set", (args, kw) -> {
            Methods.arity("set", args, 0, 1);
            Set<Object> s = new LinkedHashSet<>();
            if (!args.isEmpty()) Values.iterate(args.get(0)).forEachRemaining(o -> s.add(Values.key(o)));
            return s;
        });
        define("dict", (args, kw) -> {
            Methods.arity("dict", args, 0, 1);
            Map<Object, Object> d = new LinkedHashMap<>();
            if (!args.isEmpty()) {
                if (args.get(0) instanceof Map<?, ?> m) {
                    d.putAll(m);
                } else {
                    for (Object pair : Values.toList(args.get(0))) {
                        List<Object> kv = Values.toList(pair);
                        if (kv.size() != 2) {
                            throw ProgramError.valueError("dictionary update sequence element has length "
                                    + kv.size() + "; 2 is required");
                        }
                        d.put(Values.key(kv.get(0)), kv.get(1));
                    }
                }
            }
            kw.forEach(d::put);
            return d;
        });
        define("sorted", (args, kw) -> {
            Methods.arity("sorted", args, 1, 1);
            return interp.sorted(Values.toList(args.get(0)), kw.get("key"), Values.truthy(kw.get("reverse")));
        });
        define("reversed", (args, kw) -> {
            Methods.arity("reversed", args, 1, 1);
            List<Object> items = Values.toList(args.get(0));
            Collections.reverse(items);
            return items;
        });
        define("enumerate", (args, kw) -> {
            Methods.arity("enumerate", args, 1, 2);
            long i = args.size() > 1 ? Values.toLong(args.get(1)) : Values.toLong(kw.getOrDefault("start", 0L));
            List<Object> out = new ArrayList<>();
            for (Object o : Values.toList(args.get(0))) {
                out.add(Tuple.of(i++, o));
            }
            return out;
        });
        define("zip", (args, kw) -> {
            List<List<Object>> lists = new ArrayList<>();
            int n = Integer.MAX_VALUE;
            for (Object a : args) {
                List<Object> l = Values.toList(a);
                lists.add(l);
                n = Math.min(n, l.size());
            }
            List<Object> out = new ArrayList<>();
            for (int i = 0; !lists.isEmpty() && i < n; i++) {
                List<Object> row = new ArrayList<>();
                for (List<Object> l : lists) row.add(l.get(i));
                out.add(Tuple.of(row));
            }
            return out;
        });
        define("round", (args, kw) -> {
            Methods.arity("round", args, 1, 2);
            Object v = args.get(0);
            if (args.size() == 1 || args.get(1) == null) {
                if (Values.isInteger(v)) return Values.toLong(v);
                return (long) Math.rint(Values.toDouble(v));
            }
            int digits = (int) Values.toLong(args.get(1));
            if (Values.isInteger(v)) return Values.toLong(v);
            return new BigDecimal(Values.toDouble(v)).setScale(digits, RoundingMode.HALF_EVEN).doubleValue();
        });
        define("isinstance", (args, kw) -> {
            Methods.arity("isinstance", args, 2, 2);
            List<Object> types = args.get(1) instanceof Tuple t ? t.asList() : Collections.singletonList(args.get(1));
            String actual = Values.typeName(args.get(0));
            for (Object t : types) {
                if (!(t instanceof BuiltinFunction f)) {
                    throw ProgramError.typeError("isinstance() arg 2 must be a type or tuple of types");
                }
                if (f.name().equals(actual) || (f.name().equals("int") && actual.equals("bool"))) return true;
            }
            return false;
        });
        define("type", (args, kw) -> {
            Methods.arity("type", args, 1, 1);
            String name = Values.typeName(args.get(0));
            Object type = table.get(name);
            return type != null ? type : "<class '" + name + "'>";
        });
        define("nullcontext", (args, kw) -> {
            Methods.arity("nullcontext", args, 0, 1);
            Object value = args.isEmpty() ? null : args.get(0);
            return new ContextManager() {
                @Override
                public Object enter() {
                    return value;
                }

                @Override
                public boolean exit(ProgramError error) {
                    return false;
                }

                @Override
                public String toString() {
                    return "<nullcontext>";
                }
            };
        });
        define("suppress", (args, kw) -> {
            List<String> types = new ArrayList<>();
            for (Object a : args) {
                if (!(a instanceof BuiltinFunction f) || !EXCEPTION_TYPES.contains(f.name())) {
                    throw ProgramError.typeError("suppress() arguments must be exception types");
                }
                types.add(f.name());
            }
            return new ContextManager() {
                @Override
                public Object enter() {
                    return null;
                }

                @Override
                public boolean exit(ProgramError error) {
                    return error != null && (types.contains("Exception") || types.contains(error.getType()));
                }

                @Override
                public String toString() {
                    return "<suppress>";
                }
            };
        });
        for (String type : EXCEPTION_TYPES) {
            define(type, (args, kw) -> new ExceptionValue(type, args.isEmpty() ? "" : Values.str(args.get(0))));
        }
    }

    private Object extreme(String name, List<Object> args, Map<String, Object> kw, int sign) {
        if (args.isEmpty()) {
            throw ProgramError.typeError(name + " expected at least 1 argument, got 0");
        }
        List<Object> items = args.size() == 1 ? Values.toList(args.get(0)) : args;
        if (items.isEmpty()) {
            if (kw.containsKey("default")) return kw.get("default");
            throw ProgramError.valueError(name + "() arg is an empty sequence");
        }
        Object key = kw.get("key");
        Object best = items.get(0);
        Object bestKey = key == null ? best : interp.callValue(key, Collections.singletonList(best), Map.of());
        for (int i = 1; i < items.size(); i++) {
            Object candidate = items.get(i);
            Object k = key == null ? candidate : interp.callValue(key, Collections.singletonList(candidate), Map.of());
            if (Values.order(k, bestKey, sign > 0 ? ">" : "<") * sign > 0) {
                best = candidate;
                bestKey = k;
            }
        }
        return best;
    }
}
