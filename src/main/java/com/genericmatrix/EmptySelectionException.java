package com.genericmatrix;

public final class EmptySelectionException extends MatrixException {

    public EmptySelectionException(String message) {
        super(Kind.EMPTY_SELECTION, message);
    }
}
