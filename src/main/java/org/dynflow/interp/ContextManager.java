package org.dynflow.interp;

/**
 * with 语句使用的上下文管理器
 */
public interface ContextManager {

    /**
     * 进入 with 块，返回值绑定到 as 后面的目标
     */
    Object enter();

    /**
     * 离开 with 块
     *
     * @param error 块内抛出的错误，正常结束时为 null
     * @return true 表示吞掉该错误
     */
    boolean exit(ProgramError error);
}
