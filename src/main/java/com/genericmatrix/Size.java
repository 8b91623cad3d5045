package com.genericmatrix;

/** Immutable (rows, columns) pair. Equality is componentwise. */
public final class Size {
    private final int rows;
    private final int columns;

    private Size(int rows, int columns) {
        if (rows < 0 || columns < 0) {
            throw new IllegalArgumentException("Negative dimensions: " + rows + "x" + columns);
        }
        this.rows = rows;
        this.columns = columns;
    }

    public static Size of(int rows, int columns) { return new Size(rows, columns); }

    public int rows()    { return rows; }
    public int columns() { return columns; }

    public boolean isSquare() { return rows == columns; }

    /** The size with rows and columns swapped. */
    public Size transposed() { return new Size(columns, rows); }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Size)) return false;
        Size o = (Size) obj;
        return rows == o.rows && columns == o.columns;
    }

    @Override public int hashCode() { return rows * 31 + columns; }

    @Override public String toString() { return rows + "x" + columns; }
}
