package com.genericmatrix;

/**
 * A row or column index outside {@code [0, bound)}. Raised by checked element
 * access and by Choose/Remove.
 */
public final class MatrixIndexOutOfBoundsException extends MatrixException {

    public enum Axis { ROW, COLUMN }

    private final Axis axis;
    private final int index;
    private final int bound;

    public MatrixIndexOutOfBoundsException(Axis axis, int index, int bound) {
        super(Kind.INDEX_OUT_OF_BOUNDS,
                (axis == Axis.ROW ? "Row" : "Column") + " index " + index + " out of range [0, " + bound + ")");
        this.axis = axis;
        this.index = index;
        this.bound = bound;
    }

    public Axis getAxis() { return axis; }
    public int getIndex() { return index; }
    public int getBound() { return bound; }
}
