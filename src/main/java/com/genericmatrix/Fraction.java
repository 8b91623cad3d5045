package com.genericmatrix;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Exact rational matrix element. Always stored in lowest terms with a
 * positive denominator, so structural equality is value equality.
 */
public final class Fraction implements Numeric<Fraction> {
    public static final Fraction ZERO = new Fraction(BigInteger.ZERO, BigInteger.ONE);
    public static final Fraction ONE  = new Fraction(BigInteger.ONE,  BigInteger.ONE);

    /** Element descriptor for matrices of rationals. */
    public static final NumericType<Fraction> TYPE = new NumericType<Fraction>() {
        @Override public Fraction zero() { return ZERO; }
        @Override public Fraction one()  { return ONE; }
        @Override public String toString() { return "Fraction"; }
    };

    private final BigInteger num;
    private final BigInteger den;      // > 0

    /** @throws ArithmeticException if {@code denominator} is zero */
    public Fraction(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "numerator");
        Objects.requireNonNull(denominator, "denominator");
        if (denominator.signum() == 0) throw new ArithmeticException("Zero denominator");
        BigInteger g = numerator.gcd(denominator);
        if (denominator.signum() < 0) g = g.negate();
        this.num = numerator.divide(g);
        this.den = denominator.divide(g);
    }

    public static Fraction of(long k) { return k == 0 ? ZERO : new Fraction(BigInteger.valueOf(k), BigInteger.ONE); }
    public static Fraction of(long numerator, long denominator) {
        return new Fraction(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public BigInteger numerator()   { return num; }
    public BigInteger denominator() { return den; }

    @Override public Fraction add(Fraction o) {
        if (den.equals(o.den)) return new Fraction(num.add(o.num), den);
        return new Fraction(num.multiply(o.den).add(o.num.multiply(den)), den.multiply(o.den));
    }

    @Override public Fraction subtract(Fraction o) {
        if (den.equals(o.den)) return new Fraction(num.subtract(o.num), den);
        return new Fraction(num.multiply(o.den).subtract(o.num.multiply(den)), den.multiply(o.den));
    }

    @Override public Fraction multiply(Fraction o) {
        if (isZero() || o.isZero()) return ZERO;
        // cross-cancel first so the products stay small
        BigInteger g1 = num.gcd(o.den);
        BigInteger g2 = o.num.gcd(den);
        return new Fraction(num.divide(g1).multiply(o.num.divide(g2)),
                den.divide(g2).multiply(o.den.divide(g1)));
    }

    @Override public Fraction negate() { return isZero() ? this : new Fraction(num.negate(), den); }
    @Override public boolean isZero()  { return num.signum() == 0; }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Fraction)) return false;
        Fraction o = (Fraction) obj;
        return num.equals(o.num) && den.equals(o.den);
    }

    @Override public int hashCode() { return Objects.hash(num, den); }

    @Override public String toString() {
        return den.equals(BigInteger.ONE) ? num.toString() : num + "/" + den;
    }
}
