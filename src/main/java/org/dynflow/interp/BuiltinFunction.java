package org.dynflow.interp;

import java.util.List;
import java.util.Map;

/**
 * 由宿主（Java）实现的内置函数
 */
public record BuiltinFunction(String name, Impl impl) {

    @FunctionalInterface
    public interface Impl {
        Object call(List<Object> args, Map<String, Object> kwargs);
    }

    public Object call(List<Object> args, Map<String, Object> kwargs) {
        return impl.call(args, kwargs);
    }

    @Override
    public String toString() {
        return "<built-in function " + name + ">";
    }
}
