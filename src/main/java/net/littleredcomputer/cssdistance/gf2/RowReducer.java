package net.littleredcomputer.cssdistance.gf2;

import java.util.stream.IntStream;

/**
 * Gaussian elimination over GF(2).
 */
public final class RowReducer {
    private RowReducer() {}

    /**
     * Reduce m to systematic form: the result's first {@code rank} columns form an identity
     * block. Columns are swapped as needed to bring pivots forward; the swaps are recorded in
     * the column permutation.
     */
    public static ReducedMatrix reduce(BinaryMatrix m) {
        return eliminate(m, true);
    }

    /**
     * Reduce m to reduced row echelon form using row operations only. Linearly dependent rows
     * are dropped and the column permutation is the identity.
     */
    public static ReducedMatrix rowReduce(BinaryMatrix m) {
        return eliminate(m, false);
    }

    public static int rank(BinaryMatrix m) {
        return eliminate(m, false).rank();
    }

    /**
     * @return true if v is a GF(2) combination of the rows of m
     */
    public static boolean inRowSpace(BinaryMatrix m, boolean[] v) {
        return rank(m.appendRow(v)) == rank(m);
    }

    private static ReducedMatrix eliminate(BinaryMatrix m, boolean swapColumns) {
        final int R = m.rows();
        final int C = m.cols();
        boolean[][] a = m.copyOfBits();
        boolean[][] t = new boolean[R][R];
        for (int i = 0; i < R; ++i) t[i][i] = true;
        int[] perm = IntStream.range(0, C).toArray();

        int r = 0;
        for (int c = 0; c < C && r < R; ++c) {
            int pi = -1, pj = -1;
            if (swapColumns) {
                // Search the remaining columns, left to right, for any pivot.
                SEARCH:
                for (int j = c; j < C; ++j) {
                    for (int i = r; i < R; ++i) {
                        if (a[i][j]) {
                            pi = i;
                            pj = j;
                            break SEARCH;
                        }
                    }
                }
                if (pi < 0) break;
                if (pj != c) {
                    for (boolean[] row : a) {
                        boolean tmp = row[c];
                        row[c] = row[pj];
                        row[pj] = tmp;
                    }
                    int tmp = perm[c];
                    perm[c] = perm[pj];
                    perm[pj] = tmp;
                }
            } else {
                for (int i = r; i < R; ++i) {
                    if (a[i][c]) {
                        pi = i;
                        break;
                    }
                }
                if (pi < 0) continue;
            }
            swap(a, r, pi);
            swap(t, r, pi);
            for (int i = 0; i < R; ++i) {
                if (i != r && a[i][c]) {
                    xorInto(a[i], a[r]);
                    xorInto(t[i], t[r]);
                }
            }
            ++r;
        }
        boolean[][] kept = new boolean[r][];
        boolean[][] keptT = new boolean[r][];
        System.arraycopy(a, 0, kept, 0, r);
        System.arraycopy(t, 0, keptT, 0, r);
        return new ReducedMatrix(BinaryMatrix.wrap(r, C, kept), r, BinaryMatrix.wrap(r, R, keptT), perm);
    }

    private static void swap(boolean[][] a, int i, int j) {
        if (i == j) return;
        boolean[] tmp = a[i];
        a[i] = a[j];
        a[j] = tmp;
    }

    private static void xorInto(boolean[] dst, boolean[] src) {
        for (int k = 0; k < dst.length; ++k) dst[k] ^= src[k];
    }
}
