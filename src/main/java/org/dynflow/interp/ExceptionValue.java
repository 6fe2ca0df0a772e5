package org.dynflow.interp;

/**
 * 由 ValueError("...") 之类的调用创建、等待被 raise 的错误对象
 */
public record ExceptionValue(String type, String message) {

    @Override
    public String toString() {
        return type + "(" + Values.repr(message) + ")";
    }
}
