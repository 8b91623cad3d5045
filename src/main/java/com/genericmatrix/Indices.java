package com.genericmatrix;

import java.util.TreeSet;

/** Index-set arithmetic shared by the checked and unchecked selection paths. */
final class Indices {

    private Indices() {}

    /** Sorted ascending, duplicates dropped. */
    static int[] sortedUnique(int[] indices) {
        TreeSet<Integer> s = new TreeSet<>();
        for (int v : indices) s.add(v);
        return toArray(s);
    }

    /** {@code 0..bound-1} minus {@code removed}, ascending. Out-of-range entries are ignored. */
    static int[] complement(int[] removed, int bound) {
        boolean[] gone = new boolean[bound];
        int kept = bound;
        for (int v : removed) {
            if (v >= 0 && v < bound && !gone[v]) { gone[v] = true; kept--; }
        }
        int[] out = new int[kept];
        int k = 0;
        for (int i = 0; i < bound; i++) if (!gone[i]) out[k++] = i;
        return out;
    }

    private static int[] toArray(TreeSet<Integer> s) {
        int[] a = new int[s.size()];
        int i = 0;
        for (int v : s) a[i++] = v;
        return a;
    }
}
