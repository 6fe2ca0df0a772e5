package org.dynflow.interp;

/**
 * 解释器的逐行回调，等价于行级 trace 机制。
 * <p>
 * 所有回调都在解释器的执行线程上同步调用。实现方不应抛出异常：解释器不会替它兜底。
 */
public interface LineHook {

    /**
     * 即将执行 frame 中的第 line 行
     */
    void onLine(Frame frame, int line);

    /**
     * 一次调用（包括模块顶层）开始，尚未执行任何一行
     */
    default void onCall(Frame frame) {
    }

    /**
     * 一次调用结束，无论是正常返回还是因错误退出
     */
    default void onReturn(Frame frame) {
    }
}
