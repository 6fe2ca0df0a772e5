package org.dynflow.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次分析所解析出的整个程序，创建后不再修改
 */
public final class Module extends Node {

    public final String sourceName;
    public final List<Stmt> body;

    public Module(String sourceName, List<Stmt> body) {
        super(1, 1);
        this.sourceName = sourceName;
        this.body = List.copyOf(body);
    }

    @Override
    public List<Node> children() {
        return new ArrayList<>(body);
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visitModule(this);
    }
}
