package org.dynflow.analysis;

/**
 * 一条依赖记录：第 line 行第 execution 次执行时，variable 依赖于 dependency。
 */
public record DependencyRecord(int line, int execution, String variable, String dependency) {
}
