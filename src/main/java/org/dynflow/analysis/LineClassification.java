package org.dynflow.analysis;

import java.util.Set;
import java.util.TreeSet;

/**
 * 一行源码上出现的名字，按用途分成四组。all = used ∪ assigned。
 *
 * @param used     读取位置出现的名字
 * @param assigned 被绑定的名字
 * @param rhs      赋值右侧（以及 for 的可迭代对象、with 的上下文表达式、增量赋值的目标）中的名字
 * @param all      used 与 assigned 的并集
 */
public record LineClassification(Set<String> used, Set<String> assigned, Set<String> rhs, Set<String> all) {

    public LineClassification {
        used = Set.copyOf(used);
        assigned = Set.copyOf(assigned);
        rhs = Set.copyOf(rhs);
        all = Set.copyOf(all);
    }

    public static LineClassification of(Set<String> used, Set<String> assigned, Set<String> rhs) {
        Set<String> all = new TreeSet<>(used);
        all.addAll(assigned);
        return new LineClassification(used, assigned, rhs, all);
    }

    /**
     * 该行需要报告依赖的变量：读取的名字，加上既被赋值又出现在右侧的名字（s += x 中的 s）
     */
    public Set<String> emitCandidates() {
        Set<String> out = new TreeSet<>(used);
        for (String name : assigned) {
            if (rhs.contains(name)) out.add(name);
        }
        return out;
    }
}
