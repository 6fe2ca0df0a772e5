package org.dynflow.analysis;

import java.util.Set;
import java.util.TreeSet;
import java.util.function.BiPredicate;

/**
 * 赋值时的依赖更新规则：每个被赋值的名字得到右侧名字本身及其当前依赖的并集。
 */
public class DependencyPropagator {

    private final ScopeStore store;
    private final BiPredicate<Scope, String> isBuiltin;

    /**
     * @param isBuiltin 判断某个名字在给定作用域下是否是内置名字，内置名字不参与依赖计算
     */
    public DependencyPropagator(ScopeStore store, BiPredicate<Scope, String> isBuiltin) {
        this.store = store;
        this.isBuiltin = isBuiltin;
    }

    public Set<String> propagate(Scope scope, Set<String> assigned, Set<String> rhs) {
        Set<String> union = new TreeSet<>();
        for (String name : rhs) {
            if (isBuiltin.test(scope, name)) continue;
            union.addAll(store.get(scope, name));
            union.add(name);
        }
        for (String target : assigned) {
            store.set(scope, target, union);
        }
        return union;
    }
}
