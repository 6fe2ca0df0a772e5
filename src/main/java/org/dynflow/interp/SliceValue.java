package org.dynflow.interp;

/**
 * 下标中的切片 lower:upper:step，缺省部分为 null
 */
public record SliceValue(Object lower, Object upper, Object step) {
}
