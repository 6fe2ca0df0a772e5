package org.dynflow.interp;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * 一次调用（invocation）的运行时上下文：模块顶层或某次函数调用。
 * <p>
 * 模块顶层的 locals 与 globals 是同一个 Map；函数调用拥有自己的 locals。
 * 每个 Frame 在一次运行内有唯一的 invocationId，模块顶层固定为 0。
 */
public final class Frame {

    public static final long MODULE_INVOCATION = 0L;

    private final long invocationId;
    private final String sourceName;
    private final FunctionValue function;
    private final Frame enclosing;
    private final Map<String, Object> locals;
    private final Map<String, Object> globals;

    // line 事件的去重状态
    int lastLine = -1;
    int currentLine = -1;

    private Frame(long invocationId, String sourceName, FunctionValue function, Frame enclosing,
                  Map<String, Object> locals, Map<String, Object> globals) {
        this.invocationId = invocationId;
        this.sourceName = sourceName;
        this.function = function;
        this.enclosing = enclosing;
        this.locals = locals;
        this.globals = globals;
    }

    static Frame module(String sourceName, Map<String, Object> globals) {
        return new Frame(MODULE_INVOCATION, sourceName, null, null, globals, globals);
    }

    static Frame call(long invocationId, FunctionValue function, Map<String, Object> locals) {
        return new Frame(invocationId, function.sourceName(), function, function.enclosing(), locals,
                function.globals());
    }

    public long invocationId() {
        return invocationId;
    }

    public boolean isModuleLevel() {
        return function == null;
    }

    /**
     * 该 Frame 所执行代码的来源名称
     */
    public String sourceName() {
        return sourceName;
    }

    /**
     * 正在执行的函数名，模块顶层为 {@code <module>}
     */
    public String functionName() {
        return function == null ? "<module>" : function.name();
    }

    public Map<String, Object> locals() {
        return Collections.unmodifiableMap(locals);
    }

    public Map<String, Object> globals() {
        return Collections.unmodifiableMap(globals);
    }

    Frame enclosing() {
        return enclosing;
    }

    Map<String, Object> localStore() {
        return locals;
    }

    Map<String, Object> globalStore() {
        return globals;
    }

    boolean isLocalName(String name) {
        return function != null && function.localNames().contains(name);
    }

    boolean isDeclaredGlobal(String name) {
        return function != null && function.globalNames().contains(name);
    }

    Set<String> localNames() {
        return function == null ? Set.of() : function.localNames();
    }

    @Override
    public String toString() {
        return "Frame[" + functionName() + "#" + invocationId + "]";
    }
}
