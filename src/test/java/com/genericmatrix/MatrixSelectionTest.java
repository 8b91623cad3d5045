package com.genericmatrix;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/** Choose/Remove and their unchecked counterparts. */
public class MatrixSelectionTest {

    private static Matrix<Integral> m(long[]... rows) {
        Integral[][] a = new Integral[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            a[i] = new Integral[rows[i].length];
            for (int j = 0; j < rows[i].length; j++) a[i][j] = Integral.of(rows[i][j]);
        }
        return Matrix.of(Integral.TYPE, a);
    }

    private final Matrix<Integral> a = m(
            new long[]{1, 3, -5, 4},
            new long[]{3, 2, 7, 6},
            new long[]{-8, 4, 5, 2});

    @Test
    public void chooseRowsAndColumns() {
        assertEquals(m(new long[]{3, 7, 6}, new long[]{-8, 5, 2}),
                a.choose(new int[]{1, 2}, new int[]{0, 2, 3}));
    }

    @Test
    public void chooseIgnoresOrderAndDuplicates() {
        Matrix<Integral> sorted = a.choose(new int[]{1, 2}, new int[]{0, 1});
        assertEquals(sorted, a.choose(new int[]{2, 1}, new int[]{1, 0}));
        assertEquals(sorted, a.choose(new int[]{2, 1, 2, 1}, new int[]{1, 0, 0}));
        assertEquals(Size.of(2, 2), sorted.size());
    }

    @Test
    public void chooseSingleCell() {
        assertEquals(m(new long[]{7}), a.choose(new int[]{1}, new int[]{2}));
    }

    @Test
    public void chooseEverythingCopies() {
        Matrix<Integral> all = a.choose(new int[]{0, 1, 2}, new int[]{0, 1, 2, 3});
        assertEquals(a, all);
        all.set(0, 0, Integral.of(100));
        assertEquals(Integral.of(1), a.get(0, 0));
    }

    @Test
    public void emptySelectionFails() {
        EmptySelectionException e = assertThrows(EmptySelectionException.class,
                () -> a.choose(new int[0], new int[]{0}));
        assertEquals(MatrixException.Kind.EMPTY_SELECTION, e.kind());
        assertThrows(EmptySelectionException.class, () -> a.choose(new int[]{0}, new int[0]));
        assertThrows(EmptySelectionException.class, () -> a.remove(new int[0], new int[]{0}));
        assertThrows(EmptySelectionException.class, () -> a.remove(new int[]{1}, new int[0]));
    }

    @Test
    public void outOfRangeSelectionFails() {
        MatrixIndexOutOfBoundsException row = assertThrows(MatrixIndexOutOfBoundsException.class,
                () -> a.choose(new int[]{0, 3}, new int[]{0}));
        assertEquals(MatrixIndexOutOfBoundsException.Axis.ROW, row.getAxis());
        assertEquals(3, row.getIndex());

        MatrixIndexOutOfBoundsException col = assertThrows(MatrixIndexOutOfBoundsException.class,
                () -> a.choose(new int[]{0}, new int[]{-1, 2}));
        assertEquals(MatrixIndexOutOfBoundsException.Axis.COLUMN, col.getAxis());

        assertThrows(MatrixIndexOutOfBoundsException.class, () -> a.remove(new int[]{5}, new int[]{0}));
        assertThrows(MatrixIndexOutOfBoundsException.class, () -> a.remove(new int[]{0}, new int[]{4}));
    }

    @Test
    public void removeRowZeroAndColumnOne() {
        Matrix<Integral> r = a.remove(new int[]{0}, new int[]{1});
        assertEquals(Size.of(2, 3), r.size());
        assertEquals(m(new long[]{3, 7, 6}, new long[]{-8, 5, 2}), r);
    }

    @Test
    public void removeIsTheComplementOfChoose() {
        assertEquals(a.choose(new int[]{1}, new int[]{0, 3}),
                a.remove(new int[]{0, 2}, new int[]{1, 2}));
        assertEquals(a.choose(new int[]{0, 2}, new int[]{0, 1, 2}),
                a.remove(new int[]{1, 1}, new int[]{3}));
    }

    @Test
    public void removingEveryRowLeavesNothing() {
        assertThrows(EmptySelectionException.class, () -> a.remove(new int[]{0, 1, 2}, new int[]{0}));
        assertThrows(EmptySelectionException.class, () -> a.remove(new int[]{0}, new int[]{3, 2, 1, 0}));
    }

    @Test
    public void uncheckedPathsMatchValidatedOnes() {
        int[][] rowSets = { {0}, {2, 0}, {1, 1, 2} };
        int[][] colSets = { {3}, {0, 2}, {3, 1, 1} };
        for (int[] rows : rowSets) {
            for (int[] cols : colSets) {
                assertEquals(a.choose(rows, cols), a.chooseUnchecked(rows, cols));
                assertEquals(a.remove(rows, cols), a.removeUnchecked(rows, cols));
            }
        }
    }

    @Test
    public void uncheckedRemoveIsUncheckedChooseOfComplements() {
        assertEquals(a.chooseUnchecked(new int[]{1, 2}, new int[]{0, 2, 3}),
                a.removeUnchecked(new int[]{0}, new int[]{1}));
        assertEquals(a.chooseUnchecked(new int[]{0}, new int[]{3}),
                a.removeUnchecked(new int[]{2, 1, 2}, new int[]{0, 1, 2}));
    }

    @Test
    public void selectionDoesNotAliasSource() {
        Matrix<Integral> minor = a.removeUnchecked(new int[]{0}, new int[]{0});
        minor.set(0, 0, Integral.ZERO);
        assertEquals(Integral.of(2), a.get(1, 1));
    }
}
