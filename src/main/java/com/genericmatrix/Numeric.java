package com.genericmatrix;

/**
 * Minimal exact-number abstraction for matrix code: the ring operations a
 * matrix cell must support. Implementations are immutable.
 */
public interface Numeric<T extends Numeric<T>> {
    T add(T o);
    T subtract(T o);
    T multiply(T o);
    T negate();
    boolean isZero();
}
