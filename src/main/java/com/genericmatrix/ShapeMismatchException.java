package com.genericmatrix;

/** Operand sizes do not fit the operation; carries both sizes. */
public final class ShapeMismatchException extends MatrixException {

    private final Size left;
    private final Size right;

    public ShapeMismatchException(String operation, Size left, Size right) {
        super(Kind.SHAPE_MISMATCH, "Cannot " + operation + " " + left + " and " + right);
        this.left = left;
        this.right = right;
    }

    public Size getLeft()  { return left; }
    public Size getRight() { return right; }
}
