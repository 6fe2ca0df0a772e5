package org.dynflow.interp;

import java.util.Arrays;
import java.util.List;

/**
 * 不可变序列
 */
public final class Tuple {

    public static final Tuple EMPTY = new Tuple(new Object[0]);

    private final Object[] items;

    private Tuple(Object[] items) {
        this.items = items;
    }

    public static Tuple of(Object... items) {
        return new Tuple(items.clone());
    }

    public static Tuple of(List<?> items) {
        return new Tuple(items.toArray());
    }

    public int size() {
        return items.length;
    }

    public Object get(int i) {
        return items[i];
    }

    public List<Object> asList() {
        return Arrays.asList(items.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tuple other)) return false;
        if (items.length != other.items.length) return false;
        for (int i = 0; i < items.length; i++) {
            if (!Values.eq(items[i], other.items[i])) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (Object item : items) {
            h = 31 * h + Values.hash(item);
        }
        return h;
    }

    @Override
    public String toString() {
        return Values.repr(this);
    }
}
