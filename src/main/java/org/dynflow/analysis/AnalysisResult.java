package org.dynflow.analysis;

import java.util.List;
import java.util.Optional;

/**
 * 一次分析的结果。被分析程序中途出错时，records 仍包含出错前收集到的全部记录，error 给出错误描述。
 */
public final class AnalysisResult {

    private final List<DependencyRecord> records;
    private final String error;

    public AnalysisResult(List<DependencyRecord> records, String error) {
        this.records = List.copyOf(records);
        this.error = error;
    }

    public List<DependencyRecord> records() {
        return records;
    }

    /**
     * 形如 {@code ZeroDivisionError: division by zero (line 3)}
     */
    public Optional<String> error() {
        return Optional.ofNullable(error);
    }

    public boolean completed() {
        return error == null;
    }

    @Override
    public String toString() {
        return "AnalysisResult[" + records.size() + " records" + (error == null ? "" : ", error=" + error) + "]";
    }
}
