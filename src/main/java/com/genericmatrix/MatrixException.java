package com.genericmatrix;

/**
 * Base of every failure raised by {@link Matrix}. Catch a subclass to react to
 * one failure, or catch this and switch on {@link #kind()}.
 */
public abstract class MatrixException extends RuntimeException {

    public enum Kind {
        /** Empty or ragged rows given to a factory. */
        MALFORMED_INPUT,
        /** Operand sizes incompatible for the operation. */
        SHAPE_MISMATCH,
        /** Choose/Remove given an empty index set, or left with one. */
        EMPTY_SELECTION,
        /** A row or column index outside the current dimensions. */
        INDEX_OUT_OF_BOUNDS,
        /** Operation defined only for square matrices. */
        NOT_SQUARE
    }

    private final Kind kind;

    protected MatrixException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() { return kind; }
}
