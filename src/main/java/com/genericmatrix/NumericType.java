package com.genericmatrix;

/**
 * Supplies the identities of an element type. Every {@link Matrix} carries
 * one, since zero-filled and identity matrices have no cell to ask.
 */
public interface NumericType<T extends Numeric<T>> {
    /** Additive identity. */
    T zero();

    /** Multiplicative identity. */
    T one();
}
