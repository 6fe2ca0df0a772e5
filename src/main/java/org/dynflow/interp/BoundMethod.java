package org.dynflow.interp;

/**
 * 内置类型上的方法引用，例如 {@code lst.append}
 */
public record BoundMethod(Object self, String name) {

    @Override
    public String toString() {
        return "<built-in method " + name + " of " + Values.typeName(self) + " object>";
    }
}
