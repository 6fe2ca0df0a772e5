package org.dynflow.analysis;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * 两级依赖存储：变量名 → 依赖集合。
 * <p>
 * 模块作用域读写全局存储；调用作用域总是写入自己的局部存储，读取时先查局部，再查全局，都没有则为空集。
 */
public class ScopeStore {

    private final Map<String, Set<String>> globals = new HashMap<>();
    private final Map<Long, Map<String, Set<String>>> locals = new HashMap<>();

    public Set<String> get(Scope scope, String name) {
        if (scope instanceof Scope.CallScope call) {
            Map<String, Set<String>> local = locals.get(call.invocationId());
            if (local != null && local.containsKey(name)) {
                return local.get(name);
            }
        }
        return globals.getOrDefault(name, Set.of());
    }

    public void set(Scope scope, String name, Set<String> deps) {
        Set<String> copy = Set.copyOf(deps);
        if (scope instanceof Scope.CallScope call) {
            locals.computeIfAbsent(call.invocationId(), k -> new HashMap<>()).put(name, copy);
        } else {
            globals.put(name, copy);
        }
    }

    /**
     * 从 scope 看是否存在该名字的条目，用来判断一个名字是否已被程序自己绑定过
     */
    public boolean hasEntry(Scope scope, String name) {
        if (scope instanceof Scope.CallScope call) {
            Map<String, Set<String>> local = locals.get(call.invocationId());
            if (local != null && local.containsKey(name)) return true;
        }
        return globals.containsKey(name);
    }

    /**
     * 调用结束后丢弃它的局部存储；模块作用域不受影响
     */
    public void discard(Scope scope) {
        if (scope instanceof Scope.CallScope call) {
            locals.remove(call.invocationId());
        }
    }

    int activeCalls() {
        return locals.size();
    }
}
