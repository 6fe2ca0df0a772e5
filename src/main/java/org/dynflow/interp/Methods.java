package org.dynflow.interp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * list / dict / str / set 上的内置方法
 */
final class Methods {

    private static final Set<String> LIST_METHODS = Set.of(
            "append", "extend", "pop", "insert", "remove", "index", "count", "reverse", "sort", "copy", "clear");
    private static final Set<String> DICT_METHODS = Set.of(
            "keys", "values", "items", "get", "pop", "update", "setdefault", "copy", "clear");
    private static final Set<String> STR_METHODS = Set.of(
            "upper", "lower", "strip", "lstrip", "rstrip", "split", "join", "replace", "startswith", "endswith",
            "find", "format", "count", "isdigit");
    private static final Set<String> SET_METHODS = Set.of("add", "remove", "discard", "copy", "clear");

    private Methods() {
    }

    static boolean has(Object self, String name) {
        if (self instanceof List<?>) return LIST_METHODS.contains(name);
        if (self instanceof Map<?, ?>) return DICT_METHODS.contains(name);
        if (self instanceof String) return STR_METHODS.contains(name);
        if (self instanceof Set<?>) return SET_METHODS.contains(name);
        return false;
    }

    static Object call(Interpreter interp, Object self, String name, List<Object> args, Map<String, Object> kwargs) {
        if (self instanceof List<?> l) return listMethod(interp, Values.mutableList(l), name, args, kwargs);
        if (self instanceof Map<?, ?> m) return dictMethod(Values.mutableDict(m), name, args);
        if (self instanceof String s) return strMethod(s, name, args);
        if (self instanceof Set<?> s) return setMethod(Values.mutableSet(s), name, args);
        throw new ProgramError("AttributeError",
                "'" + Values.typeName(self) + "' object has no attribute '" + name + "'");
    }

    private static Object listMethod(Interpreter interp, List<Object> self, String name, List<Object> args,
                                     Map<String, Object> kwargs) {
        switch (name) {
            case "append":
                arity(name, args, 1, 1);
                self.add(args.get(0));
                return null;
            case "extend":
                arity(name, args, 1, 1);
                self.addAll(Values.toList(args.get(0)));
                return null;
            case "pop": {
                arity(name, args, 0, 1);
                if (self.isEmpty()) throw ProgramError.indexError("pop from empty list");
                long i = args.isEmpty() ? self.size() - 1 : Values.toLong(args.get(0));
                if (i < 0) i += self.size();
                if (i < 0 || i >= self.size()) throw ProgramError.indexError("pop index out of range");
                return self.remove((int) i);
            }
            case "insert": {
                arity(name, args, 2, 2);
                long i = Values.toLong(args.get(0));
                if (i < 0) i = Math.max(0, i + self.size());
                self.add((int) Math.min(i, self.size()), args.get(1));
                return null;
            }
            case "remove":
                arity(name, args, 1, 1);
                for (int i = 0; i < self.size(); i++) {
                    if (Values.eq(self.get(i), args.get(0))) {
                        self.remove(i);
                        return null;
                    }
                }
                throw ProgramError.valueError("list.remove(x): x not in list");
            case "index":
                arity(name, args, 1, 1);
                for (int i = 0; i < self.size(); i++) {
                    if (Values.eq(self.get(i), args.get(0))) return (long) i;
                }
                throw ProgramError.valueError(Values.repr(args.get(0)) + " is not in list");
            case "count":
                arity(name, args, 1, 1);
                return self.stream().filter(o -> Values.eq(o, args.get(0))).count();
            case "reverse":
                arity(name, args, 0, 0);
                Collections.reverse(self);
                return null;
            case "sort": {
                arity(name, args, 0, 0);
                List<Object> sorted = interp.sorted(self, kwargs.get("key"), Values.truthy(kwargs.get("reverse")));
                self.clear();
                self.addAll(sorted);
                return null;
            }
            case "copy":
                arity(name, args, 0, 0);
                return new ArrayList<>(self);
            case "clear":
                arity(name, args, 0, 0);
                self.clear();
                return null;
            default:
                throw noAttribute(self, name);
        }
    }

    private static Object dictMethod(Map<Object, Object> self, String name, List<Object> args) {
        switch (name) {
            case "keys":
                arity(name, args, 0, 0);
                return new ArrayList<>(self.keySet());
            case "values":
                arity(name, args, 0, 0);
                return new ArrayList<>(self.values());
            case "items": {
                arity(name, args, 0, 0);
                List<Object> items = new ArrayList<>();
                self.forEach((k, v) -> items.add(Tuple.of(k, v)));
                return items;
            }
            case "get": {
                arity(name, args, 1, 2);
                Object k = Values.key(args.get(0));
                if (self.containsKey(k)) return self.get(k);
                return args.size() > 1 ? args.get(1) : null;
            }
            case "pop": {
                arity(name, args, 1, 2);
                Object k = Values.key(args.get(0));
                if (self.containsKey(k)) return self.remove(k);
                if (args.size() > 1) return args.get(1);
                throw new ProgramError("KeyError", Values.repr(args.get(0)));
            }
            case "update": {
                arity(name, args, 1, 1);
                if (!(args.get(0) instanceof Map<?, ?> other)) {
                    throw ProgramError.typeError("update() argument must be a dict");
                }
                self.putAll(other);
                return null;
            }
            case "setdefault": {
                arity(name, args, 1, 2);
                Object k = Values.key(args.get(0));
                if (!self.containsKey(k)) self.put(k, args.size() > 1 ? args.get(1) : null);
                return self.get(k);
            }
            case "copy":
                arity(name, args, 0, 0);
                return new LinkedHashMap<>(self);
            case "clear":
                arity(name, args, 0, 0);
                self.clear();
                return null;
            default:
                throw noAttribute(self, name);
        }
    }

    private static Object strMethod(String self, String name, List<Object> args) {
        switch (name) {
            case "upper":
                return self.toUpperCase();
            case "lower":
                return self.toLowerCase();
            case "strip":
                return self.strip();
            case "lstrip":
                return self.stripLeading();
            case "rstrip":
                return self.stripTrailing();
            case "isdigit":
                return !self.isEmpty() && self.chars().allMatch(Character::isDigit);
            case "split": {
                arity(name, args, 0, 1);
                List<Object> parts = new ArrayList<>();
                if (args.isEmpty() || args.get(0) == null) {
                    for (String p : self.strip().split("\\s+")) {
                        if (!p.isEmpty()) parts.add(p);
                    }
                    return parts;
                }
                String sep = str(args.get(0), name);
                if (sep.isEmpty()) throw ProgramError.valueError("empty separator");
                int from = 0;
                int at;
                while ((at = self.indexOf(sep, from)) >= 0) {
                    parts.add(self.substring(from, at));
                    from = at + sep.length();
                }
                parts.add(self.substring(from));
                return parts;
            }
            case "join": {
                arity(name, args, 1, 1);
                StringBuilder sb = new StringBuilder();
                boolean first = true;
                for (Object o : Values.toList(args.get(0))) {
                    if (!first) sb.append(self);
                    first = false;
                    sb.append(str(o, name));
                }
                return sb.toString();
            }
            case "replace":
                arity(name, args, 2, 2);
                return self.replace(str(args.get(0), name), str(args.get(1), name));
            case "startswith":
                arity(name, args, 1, 1);
                return self.startsWith(str(args.get(0), name));
            case "endswith":
                arity(name, args, 1, 1);
                return self.endsWith(str(args.get(0), name));
            case "find":
                arity(name, args, 1, 1);
                return (long) self.indexOf(str(args.get(0), name));
            case "count": {
                arity(name, args, 1, 1);
                String sub = str(args.get(0), name);
                if (sub.isEmpty()) return (long) self.length() + 1;
                long n = 0;
                int from = 0;
                int at;
                while ((at = self.indexOf(sub, from)) >= 0) {
                    n++;
                    from = at + sub.length();
                }
                return n;
            }
            case "format":
                return format(self, args);
            default:
                throw noAttribute(self, name);
        }
    }

    private static Object setMethod(Set<Object> self, String name, List<Object> args) {
        switch (name) {
            case "add":
                arity(name, args, 1, 1);
                self.add(Values.key(args.get(0)));
                return null;
            case "remove":
                arity(name, args, 1, 1);
                if (!self.remove(Values.key(args.get(0)))) {
                    throw new ProgramError("KeyError", Values.repr(args.get(0)));
                }
                return null;
            case "discard":
                arity(name, args, 1, 1);
                self.remove(Values.key(args.get(0)));
                return null;
            case "copy":
                return new LinkedHashSet<>(self);
            case "clear":
                self.clear();
                return null;
            default:
                throw noAttribute(self, name);
        }
    }

    /**
     * 只支持 {} 与 {0} 形式的占位符
     */
    private static String format(String template, List<Object> args) {
        StringBuilder sb = new StringBuilder();
        int auto = 0;
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '{' && i + 1 < template.length() && template.charAt(i + 1) == '{') {
                sb.append('{');
                i += 2;
            } else if (c == '}' && i + 1 < template.length() && template.charAt(i + 1) == '}') {
                sb.append('}');
                i += 2;
            } else if (c == '{') {
                int close = template.indexOf('}', i);
                if (close < 0) throw ProgramError.valueError("Single '{' encountered in format string");
                String field = template.substring(i + 1, close).trim();
                if (!field.chars().allMatch(Character::isDigit)) {
                    throw new ProgramError("KeyError", Values.repr(field));
                }
                int index = field.isEmpty() ? auto++ : Integer.parseInt(field);
                if (index >= args.size()) {
                    throw ProgramError.indexError("Replacement index " + index + " out of range for positional args tuple");
                }
                sb.append(Values.str(args.get(index)));
                i = close + 1;
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    private static String str(Object v, String method) {
        if (v instanceof String s) return s;
        throw ProgramError.typeError(method + "() argument must be str, not " + Values.typeName(v));
    }

    static void arity(String name, List<Object> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            String expected = min == max ? String.valueOf(min) : min + " to " + max;
            throw ProgramError.typeError(name + "() takes " + expected + " positional argument(s) but "
                    + args.size() + " were given");
        }
    }

    private static ProgramError noAttribute(Object self, String name) {
        return new ProgramError("AttributeError",
                "'" + Values.typeName(self) + "' object has no attribute '" + name + "'");
    }

    static Comparator<Object> natural() {
        return (a, b) -> Values.order(a, b, "<");
    }
}
