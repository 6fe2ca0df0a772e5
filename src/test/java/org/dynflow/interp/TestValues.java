package org.dynflow.interp;

import org.dynflow.ast.CmpOperator;
import org.dynflow.ast.Operator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestValues {

    @Test
    public void testFloatRepr() {
        assertEquals("0.5", Values.repr(0.5));
        assertEquals("2.0", Values.repr(2.0));
        assertEquals("10000000.0", Values.repr(1e7));
        assertEquals("0.001", Values.repr(0.001));
        assertEquals("1e+16", Values.repr(1e16));
        assertEquals("1.5e-05", Values.repr(1.5e-5));
        assertEquals("inf", Values.repr(Double.POSITIVE_INFINITY));
    }

    @Test
    public void testStringRepr() {
        assertEquals("'a'", Values.repr("a"));
        assertEquals("\"it's\"", Values.repr("it's"));
        assertEquals("'a\\nb'", Values.repr("a\nb"));
        assertEquals("a", Values.str("a"));
    }

    @Test
    public void testArithmetic() {
        assertEquals(7L, Values.binary(Operator.ADD, 3L, 4L));
        assertEquals(-2L, Values.binary(Operator.FLOOR_DIV, -7L, 4L));
        assertEquals(1L, Values.binary(Operator.MOD, -7L, 4L));
        assertEquals(1024L, Values.binary(Operator.POW, 2L, 10L));
        assertEquals(2.5, Values.binary(Operator.DIV, 5L, 2L));
        assertEquals("abab", Values.binary(Operator.MULT, "ab", 2L));
        assertEquals("OverflowError", assertThrows(ProgramError.class,
                () -> Values.binary(Operator.MULT, Long.MAX_VALUE, 2L)).getType());
        assertEquals("TypeError", assertThrows(ProgramError.class,
                () -> Values.binary(Operator.ADD, "a", 1L)).getType());
    }

    @Test
    public void testComparison() {
        assertTrue(Values.compare(CmpOperator.EQ, 1L, 1.0));
        assertTrue(Values.compare(CmpOperator.LT, "a", "b"));
        assertTrue(Values.compare(CmpOperator.IN, 2L, List.of(1L, 2L)));
        assertTrue(Values.compare(CmpOperator.NOT_IN, "z", "abc"));
        assertThrows(ProgramError.class, () -> Values.compare(CmpOperator.LT, 1L, "a"));
    }

    @Test
    public void testSlicing() {
        List<Object> xs = new ArrayList<>(List.of(0L, 1L, 2L, 3L, 4L));
        assertEquals(List.of(1L, 2L), Values.getItem(xs, new SliceValue(1L, 3L, null)));
        assertEquals(List.of(4L, 3L, 2L, 1L, 0L), Values.getItem(xs, new SliceValue(null, null, -1L)));
        assertEquals("cba", Values.getItem("abc", new SliceValue(null, null, -1L)));
        assertEquals(4L, Values.getItem(xs, -1L));
        assertEquals("IndexError", assertThrows(ProgramError.class, () -> Values.getItem(xs, 5L)).getType());
    }

    @Test
    public void testTruthiness() {
        assertFalse(Values.truthy(0L));
        assertFalse(Values.truthy(""));
        assertFalse(Values.truthy(List.of()));
        assertFalse(Values.truthy(null));
        assertTrue(Values.truthy("x"));
        assertTrue(Values.truthy(Tuple.of(1L)));
    }
}
