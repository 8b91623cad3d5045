package com.genericmatrix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.BinaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A dense matrix over an exact {@link Numeric} element type. Rows and
 * columns are indexed from zero.
 *
 * <p>Every instance has at least one row and one column, and all rows have
 * the same length. Apart from {@link #set}, {@link #transpose()} and the
 * {@code *InPlace} methods, every operation returns a new, independent
 * matrix; no two instances share storage. Mutating operations validate first
 * and build the new storage completely before swapping it in, so a failure
 * leaves the receiver unchanged.
 *
 * <p>Failures are reported as subclasses of {@link MatrixException}; no
 * operation returns a placeholder value in place of a failure. Instances are
 * not thread-safe.
 */
public final class Matrix<T extends Numeric<T>> {
    private static final Logger logger = LoggerFactory.getLogger(Matrix.class);

    private final NumericType<T> type;
    private List<List<T>> rows;         // rows.get(r).get(c)
    private Size size;
    private boolean transposed;         // flipped by transpose() only

    /** Takes ownership of {@code rows}; callers guarantee it is rectangular and non-empty. */
    private Matrix(NumericType<T> type, List<List<T>> rows, Size size) {
        this.type = type;
        this.rows = rows;
        this.size = size;
    }

    // ---- construction ----

    /**
     * Builds a matrix from a list of rows. The rows are copied.
     *
     * @throws MalformedInputException if there are no rows, the first row is
     *         empty, two rows differ in length, or a row or cell is null
     */
    public static <T extends Numeric<T>> Matrix<T> of(NumericType<T> type, List<? extends List<T>> rows) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(rows, "rows");
        if (rows.isEmpty()) throw failure(new MalformedInputException("No rows supplied"));
        List<T> first = rows.get(0);
        if (first == null) throw failure(new MalformedInputException("Row 0 is null"));
        int m = rows.size();
        int n = first.size();
        if (n == 0) throw failure(new MalformedInputException("Row 0 is empty"));

        List<List<T>> grid = new ArrayList<>(m);
        for (int i = 0; i < m; i++) {
            List<T> row = rows.get(i);
            if (row == null) throw failure(new MalformedInputException("Row " + i + " is null"));
            if (row.size() != n) {
                throw failure(new MalformedInputException(
                        "Row " + i + " has " + row.size() + " values, expected " + n));
            }
            List<T> copy = new ArrayList<>(n);
            for (int j = 0; j < n; j++) {
                T v = row.get(j);
                if (v == null) throw failure(new MalformedInputException("Null value at (" + i + ", " + j + ")"));
                copy.add(v);
            }
            grid.add(copy);
        }
        return new Matrix<>(type, grid, Size.of(m, n));
    }

    /** Array form of {@link #of(NumericType, List)}; same validation. */
    public static <T extends Numeric<T>> Matrix<T> of(NumericType<T> type, T[][] rows) {
        Objects.requireNonNull(rows, "rows");
        List<List<T>> lists = new ArrayList<>(rows.length);
        for (T[] row : rows) {
            if (row == null) { lists.add(null); continue; }
            List<T> r = new ArrayList<>(row.length);
            Collections.addAll(r, row);
            lists.add(r);
        }
        return of(type, lists);
    }

    /**
     * Matrix of the given size with every cell set to {@code type.zero()}.
     *
     * @throws MalformedInputException if either dimension is zero
     */
    public static <T extends Numeric<T>> Matrix<T> zero(NumericType<T> type, Size size) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(size, "size");
        if (size.rows() < 1 || size.columns() < 1) {
            throw failure(new MalformedInputException("Matrix size must be at least 1x1, got " + size));
        }
        return new Matrix<>(type, filled(size, type.zero()), size);
    }

    /**
     * Square matrix with {@code one()} on the diagonal and {@code zero()} elsewhere.
     *
     * @throws MalformedInputException if {@code order < 1}
     */
    public static <T extends Numeric<T>> Matrix<T> identity(NumericType<T> type, int order) {
        Objects.requireNonNull(type, "type");
        if (order < 1) throw failure(new MalformedInputException("Identity order must be at least 1, got " + order));
        Size s = Size.of(order, order);
        List<List<T>> grid = filled(s, type.zero());
        T one = type.one();
        for (int i = 0; i < order; i++) grid.get(i).set(i, one);
        return new Matrix<>(type, grid, s);
    }

    private static <T> List<List<T>> filled(Size s, T value) {
        List<List<T>> grid = new ArrayList<>(s.rows());
        for (int i = 0; i < s.rows(); i++) grid.add(new ArrayList<>(Collections.nCopies(s.columns(), value)));
        return grid;
    }

    // ---- shape ----

    public NumericType<T> type() { return type; }
    public Size size()           { return size; }
    public int rowCount()        { return size.rows(); }
    public int columnCount()     { return size.columns(); }

    /** True after {@link #transpose()} has run an odd number of times on this instance. */
    public boolean isTransposed() { return transposed; }

    public boolean isSquare() { return size.isSquare(); }

    // ---- element access ----

    /**
     * Returns the entry at row {@code r}, column {@code c}.
     *
     * @throws MatrixIndexOutOfBoundsException if either index is out of range
     */
    public T get(int r, int c) {
        checkIndex(r, c);
        return cell(r, c);
    }

    /**
     * Sets the entry at row {@code r}, column {@code c}.
     *
     * @throws MatrixIndexOutOfBoundsException if either index is out of range
     */
    public void set(int r, int c, T value) {
        checkIndex(r, c);
        rows.get(r).set(c, Objects.requireNonNull(value, "value"));
    }

    /** Unchecked read for internal loops whose indices are already valid. */
    T cell(int r, int c) {
        return rows.get(r).get(c);
    }

    private void checkIndex(int r, int c) {
        checkBound(r, size.rows(), MatrixIndexOutOfBoundsException.Axis.ROW);
        checkBound(c, size.columns(), MatrixIndexOutOfBoundsException.Axis.COLUMN);
    }

    private static void checkBound(int index, int bound, MatrixIndexOutOfBoundsException.Axis axis) {
        if (index < 0 || index >= bound) throw failure(new MatrixIndexOutOfBoundsException(axis, index, bound));
    }

    // ---- arithmetic ----

    /**
     * Elementwise sum.
     *
     * @throws ShapeMismatchException if the sizes differ
     */
    public Matrix<T> add(Matrix<T> other) {
        requireSameSize("add", other);
        return new Matrix<>(type, combine(other, (x, y) -> x.add(y)), size);
    }

    /**
     * Elementwise difference {@code this - other}.
     *
     * @throws ShapeMismatchException if the sizes differ
     */
    public Matrix<T> subtract(Matrix<T> other) {
        requireSameSize("subtract", other);
        return new Matrix<>(type, combine(other, (x, y) -> x.subtract(y)), size);
    }

    /** In-place form of {@link #add(Matrix)}. */
    public void addInPlace(Matrix<T> other) {
        requireSameSize("add", other);
        rows = combine(other, (x, y) -> x.add(y));
    }

    /** In-place form of {@link #subtract(Matrix)}. */
    public void subtractInPlace(Matrix<T> other) {
        requireSameSize("subtract", other);
        rows = combine(other, (x, y) -> x.subtract(y));
    }

    /**
     * Matrix product {@code this * other}; each cell is the dot product of a
     * row of this matrix and a column of {@code other}.
     *
     * @throws ShapeMismatchException if {@code this.columnCount() != other.rowCount()}
     */
    public Matrix<T> multiply(Matrix<T> other) {
        Objects.requireNonNull(other, "other");
        if (size.columns() != other.size.rows()) {
            throw failure(new ShapeMismatchException("multiply", size, other.size));
        }
        int m = size.rows(), inner = size.columns(), p = other.size.columns();
        List<List<T>> grid = new ArrayList<>(m);
        for (int i = 0; i < m; i++) {
            List<T> row = new ArrayList<>(p);
            for (int j = 0; j < p; j++) {
                T acc = type.zero();
                for (int k = 0; k < inner; k++) {
                    acc = acc.add(cell(i, k).multiply(other.cell(k, j)));
                }
                row.add(acc);
            }
            grid.add(row);
        }
        return new Matrix<>(type, grid, Size.of(m, p));
    }

    /** Every cell multiplied by {@code scalar}. */
    public Matrix<T> multiply(T scalar) {
        return new Matrix<>(type, scaled(scalar), size);
    }

    /**
     * {@code scalar * matrix}. Computed as {@code matrix * scalar}, which
     * assumes the element type's multiplication is commutative.
     */
    public static <T extends Numeric<T>> Matrix<T> multiply(T scalar, Matrix<T> matrix) {
        return matrix.multiply(scalar);
    }

    /** In-place form of {@link #multiply(Numeric)}. */
    public void multiplyInPlace(T scalar) {
        rows = scaled(scalar);
    }

    /** Scalar multiple by {@code -one}. */
    public Matrix<T> negate() {
        return multiply(type.one().negate());
    }

    private void requireSameSize(String operation, Matrix<T> other) {
        Objects.requireNonNull(other, "other");
        if (!size.equals(other.size)) throw failure(new ShapeMismatchException(operation, size, other.size));
    }

    private List<List<T>> combine(Matrix<T> other, BinaryOperator<T> op) {
        List<List<T>> grid = new ArrayList<>(size.rows());
        for (int i = 0; i < size.rows(); i++) {
            List<T> row = new ArrayList<>(size.columns());
            for (int j = 0; j < size.columns(); j++) row.add(op.apply(cell(i, j), other.cell(i, j)));
            grid.add(row);
        }
        return grid;
    }

    private List<List<T>> scaled(T scalar) {
        Objects.requireNonNull(scalar, "scalar");
        List<List<T>> grid = new ArrayList<>(size.rows());
        for (List<T> source : rows) {
            List<T> row = new ArrayList<>(size.columns());
            for (T v : source) row.add(v.multiply(scalar));
            grid.add(row);
        }
        return grid;
    }

    // ---- transpose ----

    /** New matrix with rows and columns swapped; this instance is untouched. */
    public Matrix<T> transposed() {
        return new Matrix<>(type, flipped(), size.transposed());
    }

    /** Swaps rows and columns of this instance and toggles {@link #isTransposed()}. */
    public void transpose() {
        List<List<T>> grid = flipped();
        rows = grid;
        size = size.transposed();
        transposed = !transposed;
    }

    private List<List<T>> flipped() {
        List<List<T>> grid = new ArrayList<>(size.columns());
        for (int j = 0; j < size.columns(); j++) {
            List<T> row = new ArrayList<>(size.rows());
            for (int i = 0; i < size.rows(); i++) row.add(cell(i, j));
            grid.add(row);
        }
        return grid;
    }

    // ---- submatrices ----

    /**
     * Submatrix made of the given rows and columns. Each index set is
     * deduplicated and sorted first, so the order the caller supplies does not
     * matter.
     *
     * @throws EmptySelectionException if either index set is empty
     * @throws MatrixIndexOutOfBoundsException if any index is out of range
     */
    public Matrix<T> choose(int[] rows, int[] columns) {
        requireSelection(rows, columns);
        int[] r = Indices.sortedUnique(rows);
        int[] c = Indices.sortedUnique(columns);
        for (int v : r) checkBound(v, size.rows(), MatrixIndexOutOfBoundsException.Axis.ROW);
        for (int v : c) checkBound(v, size.columns(), MatrixIndexOutOfBoundsException.Axis.COLUMN);
        return select(r, c);
    }

    /**
     * Submatrix left after deleting the given rows and columns; equivalent to
     * {@link #choose} on the complements.
     *
     * @throws EmptySelectionException if either index set is empty, or if
     *         every row or every column is removed
     * @throws MatrixIndexOutOfBoundsException if any index is out of range
     */
    public Matrix<T> remove(int[] rows, int[] columns) {
        requireSelection(rows, columns);
        for (int v : rows) checkBound(v, size.rows(), MatrixIndexOutOfBoundsException.Axis.ROW);
        for (int v : columns) checkBound(v, size.columns(), MatrixIndexOutOfBoundsException.Axis.COLUMN);
        return choose(Indices.complement(rows, size.rows()), Indices.complement(columns, size.columns()));
    }

    /** {@link #choose} without the emptiness and range checks. Indices must be valid. */
    Matrix<T> chooseUnchecked(int[] rows, int[] columns) {
        return select(Indices.sortedUnique(rows), Indices.sortedUnique(columns));
    }

    /** {@link #remove} without the emptiness and range checks. Indices must be valid. */
    Matrix<T> removeUnchecked(int[] rows, int[] columns) {
        return chooseUnchecked(Indices.complement(rows, size.rows()), Indices.complement(columns, size.columns()));
    }

    private static void requireSelection(int[] rows, int[] columns) {
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(columns, "columns");
        if (rows.length == 0 || columns.length == 0) {
            throw failure(new EmptySelectionException("Row and column index sets must both be non-empty"));
        }
    }

    /** rowIndices and columnIndices are sorted, unique and in range. */
    private Matrix<T> select(int[] rowIndices, int[] columnIndices) {
        List<List<T>> grid = new ArrayList<>(rowIndices.length);
        for (int r : rowIndices) {
            List<T> source = rows.get(r);
            List<T> row = new ArrayList<>(columnIndices.length);
            for (int c : columnIndices) row.add(source.get(c));
            grid.add(row);
        }
        return new Matrix<>(type, grid, Size.of(rowIndices.length, columnIndices.length));
    }

    // ---- determinant & predicates ----

    /**
     * Determinant by Laplace expansion along the first row. Runs in
     * factorial time; meant for small matrices.
     *
     * @throws NotSquareException if the matrix is not square
     */
    public T determinant() {
        if (!isSquare()) throw failure(new NotSquareException("determinant", size));
        return expand();
    }

    private T expand() {
        int n = size.rows();
        if (n == 1) return cell(0, 0);
        logger.trace("Cofactor expansion of order {}", n);

        T one = type.one();
        T minusOne = one.negate();
        int[] firstRow = {0};
        T det = type.zero();
        for (int j = 0; j < n; j++) {
            T sign = (j % 2 == 0) ? one : minusOne;
            T cofactor = sign.multiply(removeUnchecked(firstRow, new int[] { j }).expand());
            det = det.add(cell(0, j).multiply(cofactor));
        }
        return det;
    }

    /**
     * True iff the determinant is zero.
     *
     * @throws NotSquareException if the matrix is not square
     */
    public boolean isDegenerate() {
        if (!isSquare()) throw failure(new NotSquareException("isDegenerate", size));
        return expand().isZero();
    }

    /** Square and equal to its transpose. */
    public boolean isSymmetric() {
        return isSquare() && transposed().equals(this);
    }

    /** Square and equal to the negation of its transpose. */
    public boolean isAntisymmetric() {
        return isSquare() && transposed().negate().equals(this);
    }

    // ---- copies ----

    /** Independent copy, including the {@link #isTransposed()} flag. */
    public Matrix<T> copy() {
        List<List<T>> grid = new ArrayList<>(size.rows());
        for (List<T> row : rows) grid.add(new ArrayList<>(row));
        Matrix<T> m = new Matrix<>(type, grid, size);
        m.transposed = transposed;
        return m;
    }

    /** Snapshot of the cells as unmodifiable nested lists. */
    public List<List<T>> toList() {
        List<List<T>> out = new ArrayList<>(size.rows());
        for (List<T> row : rows) out.add(Collections.unmodifiableList(new ArrayList<>(row)));
        return Collections.unmodifiableList(out);
    }

    // ---- Object ----

    /**
     * Same size and equal cells. Matrices of different size are unequal;
     * the element type and the transposed flag are not compared.
     */
    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Matrix)) return false;
        Matrix<?> o = (Matrix<?>) obj;
        if (!size.equals(o.size)) {
            logger.debug("Matrices of size {} and {} are never equal", size, o.size);
            return false;
        }
        return rows.equals(o.rows);
    }

    @Override public int hashCode() { return rows.hashCode(); }

    @Override public String toString() {
        return "Matrix " + size + " " + rows;
    }

    private static <E extends MatrixException> E failure(E e) {
        logger.debug("{}: {}", e.kind(), e.getMessage());
        return e;
    }
}
