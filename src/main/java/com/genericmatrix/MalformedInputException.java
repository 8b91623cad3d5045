package com.genericmatrix;

/** Rows of unequal length, no rows at all, or a non-positive dimension. */
public final class MalformedInputException extends MatrixException {

    public MalformedInputException(String message) {
        super(Kind.MALFORMED_INPUT, message);
    }
}
