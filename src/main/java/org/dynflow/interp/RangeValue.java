package org.dynflow.interp;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * range(start, stop, step)，惰性求值
 */
public record RangeValue(long start, long stop, long step) implements Iterable<Object> {

    public RangeValue {
        if (step == 0) {
            throw ProgramError.valueError("range() arg 3 must not be zero");
        }
    }

    public long length() {
        if (step > 0 && start < stop) return (stop - start - 1) / step + 1;
        if (step < 0 && start > stop) return (start - stop - 1) / (-step) + 1;
        return 0;
    }

    public long get(long i) {
        return start + i * step;
    }

    public boolean contains(long v) {
        if (step > 0 ? (v < start || v >= stop) : (v > start || v <= stop)) return false;
        return (v - start) % step == 0;
    }

    @Override
    public Iterator<Object> iterator() {
        return new Iterator<>() {
            private long i = 0;
            private final long n = length();

            @Override
            public boolean hasNext() {
                return i < n;
            }

            @Override
            public Object next() {
                if (i >= n) throw new NoSuchElementException();
                return get(i++);
            }
        };
    }

    @Override
    public String toString() {
        return step == 1 ? "range(" + start + ", " + stop + ")" : "range(" + start + ", " + stop + ", " + step + ")";
    }
}
