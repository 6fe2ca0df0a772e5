package org.dynflow.ast;

/**
 * 名字出现的位置：读取、写入或删除
 */
public enum ExprContext {
    LOAD, STORE, DEL
}
