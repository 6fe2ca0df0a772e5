package org.dynflow.ast;

public enum BoolOperator {
    AND, OR
}
