package org.dynflow.ast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * 语法树节点的公共父类。
 * <p>
 * 每个节点记录自己在源码中的起始位置（行号从 1 开始），并提供先序遍历整棵子树的 {@link #walk(Consumer)}。
 */
public abstract class Node {

    public final int line;
    public final int column;

    protected Node(int line, int column) {
        this.line = line;
        this.column = column;
    }

    /**
     * 直接子节点，按源码顺序；没有子节点时返回空列表
     */
    public abstract List<Node> children();

    public abstract void accept(NodeVisitor visitor);

    /**
     * 先序遍历以当前节点为根的子树（包括当前节点本身）
     */
    public void walk(Consumer<Node> consumer) {
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            Node n = stack.pop();
            consumer.accept(n);
            List<Node> kids = n.children();
            for (int i = kids.size() - 1; i >= 0; i--) {
                stack.push(kids.get(i));
            }
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "@" + line + ":" + column;
    }
}
