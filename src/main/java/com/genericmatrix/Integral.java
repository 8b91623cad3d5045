package com.genericmatrix;

import java.math.BigInteger;
import java.util.Objects;

/** Immutable arbitrary-precision integer; exact, so matrix identities hold without rounding. */
public final class Integral implements Numeric<Integral> {
    public static final Integral ZERO = new Integral(BigInteger.ZERO);
    public static final Integral ONE  = new Integral(BigInteger.ONE);

    /** Element descriptor for matrices of integers. */
    public static final NumericType<Integral> TYPE = new NumericType<Integral>() {
        @Override public Integral zero() { return ZERO; }
        @Override public Integral one()  { return ONE; }
        @Override public String toString() { return "Integral"; }
    };

    private final BigInteger v;

    public Integral(BigInteger value) {
        this.v = Objects.requireNonNull(value, "value");
    }

    public static Integral of(long k) {
        if (k == 0) return ZERO;
        if (k == 1) return ONE;
        return new Integral(BigInteger.valueOf(k));
    }

    public BigInteger value() { return v; }

    @Override public Integral add(Integral o)      { return new Integral(v.add(o.v)); }
    @Override public Integral subtract(Integral o) { return new Integral(v.subtract(o.v)); }
    @Override public Integral multiply(Integral o) { return new Integral(v.multiply(o.v)); }
    @Override public Integral negate()             { return v.signum() == 0 ? ZERO : new Integral(v.negate()); }
    @Override public boolean isZero()              { return v.signum() == 0; }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Integral)) return false;
        return v.equals(((Integral) obj).v);
    }

    @Override public int hashCode() { return v.hashCode(); }

    @Override public String toString() { return v.toString(); }
}
