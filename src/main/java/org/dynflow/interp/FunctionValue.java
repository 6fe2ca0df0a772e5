package org.dynflow.interp;

import org.dynflow.ast.Stmt;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 用户定义的函数。defaults 在 def 执行时求值，与 params 尾部对齐。
 *
 * @param enclosing 定义该函数时所在的函数调用 Frame，模块顶层定义时为 null
 */
public record FunctionValue(Stmt.FunctionDef def,
                            String sourceName,
                            List<Object> defaults,
                            Map<String, Object> globals,
                            Frame enclosing,
                            Set<String> localNames,
                            Set<String> globalNames) {

    public String name() {
        return def.name;
    }

    @Override
    public String toString() {
        return "<function " + def.name + ">";
    }

    @Override
    public boolean equals(Object o) {
        return this == o;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }
}
