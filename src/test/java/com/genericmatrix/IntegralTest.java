package com.genericmatrix;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

public class IntegralTest {

    @Test
    public void ringOperations() {
        Integral a = Integral.of(7);
        Integral b = Integral.of(-3);
        assertEquals(Integral.of(4), a.add(b));
        assertEquals(Integral.of(10), a.subtract(b));
        assertEquals(Integral.of(-21), a.multiply(b));
        assertEquals(Integral.of(3), b.negate());
    }

    @Test
    public void identitiesAndZero() {
        assertTrue(Integral.TYPE.zero().isZero());
        assertEquals(Integral.ONE, Integral.TYPE.one());
        assertSame(Integral.ZERO, Integral.ZERO.negate());
        assertEquals(Integral.ZERO, Integral.of(5).subtract(Integral.of(5)));
    }

    @Test
    public void noOverflowBeyondLong() {
        Integral big = Integral.of(Long.MAX_VALUE);
        BigInteger expected = BigInteger.valueOf(Long.MAX_VALUE).multiply(BigInteger.valueOf(Long.MAX_VALUE));
        assertEquals(expected, big.multiply(big).value());
    }

    @Test
    public void equalityAndToString() {
        assertEquals(Integral.of(12), new Integral(BigInteger.valueOf(12)));
        assertEquals(Integral.of(12).hashCode(), new Integral(BigInteger.valueOf(12)).hashCode());
        assertEquals("-42", Integral.of(-42).toString());
        assertThrows(NullPointerException.class, () -> new Integral(null));
    }
}
