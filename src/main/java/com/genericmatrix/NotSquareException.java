package com.genericmatrix;

public final class NotSquareException extends MatrixException {

    private final Size size;

    public NotSquareException(String operation, Size size) {
        super(Kind.NOT_SQUARE, operation + " requires a square matrix, got " + size);
        this.size = size;
    }

    public Size getSize() { return size; }
}
