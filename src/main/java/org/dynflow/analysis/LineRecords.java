package org.dynflow.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 按行号分组的记录，供逐行展示使用
 */
public record LineRecords(int line, List<DependencyRecord> records) {

    public LineRecords {
        records = List.copyOf(records);
    }

    /**
     * 按行号升序分组，组内保持原有顺序
     */
    public static List<LineRecords> groupByLine(List<DependencyRecord> records) {
        Map<Integer, List<DependencyRecord>> byLine = new TreeMap<>();
        for (DependencyRecord r : records) {
            byLine.computeIfAbsent(r.line(), k -> new ArrayList<>()).add(r);
        }
        List<LineRecords> out = new ArrayList<>();
        byLine.forEach((line, rs) -> out.add(new LineRecords(line, rs)));
        return out;
    }

    /**
     * 该行出现过的最大执行次数
     */
    public int executions() {
        return records.stream().mapToInt(DependencyRecord::execution).max().orElse(0);
    }
}
