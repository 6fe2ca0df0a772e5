package org.dynflow.analysis;

/**
 * 依赖存储的作用域：模块顶层，或者某一次函数调用。
 */
public sealed interface Scope permits Scope.ModuleScope, Scope.CallScope {

    Scope MODULE = ModuleScope.INSTANCE;

    static Scope call(long invocationId) {
        return new CallScope(invocationId);
    }

    /**
     * 模块顶层，局部与全局是同一个存储
     */
    enum ModuleScope implements Scope {
        INSTANCE
    }

    /**
     * 一次函数调用，invocationId 在一次运行内唯一
     */
    record CallScope(long invocationId) implements Scope {
    }
}
