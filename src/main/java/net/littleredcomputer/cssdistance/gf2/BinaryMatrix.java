package net.littleredcomputer.cssdistance.gf2;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An immutable matrix over GF(2). Rows are stored as boolean arrays, which is
 * plenty for the parity-check matrices of codes with a few hundred qubits.
 */
public final class BinaryMatrix {
    private static final Splitter lineSplitter = Splitter.onPattern("\\r?\\n").trimResults().omitEmptyStrings();
    private static final CharMatcher separators = CharMatcher.anyOf(" \t,[]");
    private final int rows;
    private final int cols;
    private final boolean[][] x;

    private BinaryMatrix(int rows, int cols, boolean[][] x) {
        this.rows = rows;
        this.cols = cols;
        this.x = x;
    }

    public static BinaryMatrix zero(int rows, int cols) {
        if (rows < 0 || cols < 0) throw new IllegalArgumentException("negative matrix dimension");
        return new BinaryMatrix(rows, cols, new boolean[rows][cols]);
    }

    public static BinaryMatrix identity(int n) {
        boolean[][] x = new boolean[n][n];
        for (int i = 0; i < n; ++i) x[i][i] = true;
        return new BinaryMatrix(n, n, x);
    }

    /**
     * The n×n permutation matrix moving each coordinate one place to the right (cyclically).
     */
    public static BinaryMatrix cyclicShift(int n) {
        boolean[][] x = new boolean[n][n];
        for (int i = 0; i < n; ++i) x[i][(i + 1) % n] = true;
        return new BinaryMatrix(n, n, x);
    }

    /**
     * Build a matrix from rows of 0/1 integers. All rows must have the same length.
     */
    public static BinaryMatrix of(int[]... rows) {
        int c = rows.length == 0 ? 0 : rows[0].length;
        boolean[][] x = new boolean[rows.length][];
        for (int i = 0; i < rows.length; ++i) {
            if (rows[i].length != c) throw new IllegalArgumentException("ragged matrix: row " + i);
            x[i] = new boolean[c];
            for (int j = 0; j < c; ++j) {
                if (rows[i][j] != 0 && rows[i][j] != 1) {
                    throw new IllegalArgumentException(String.format("entry (%d,%d) is %d, not a bit", i, j, rows[i][j]));
                }
                x[i][j] = rows[i][j] == 1;
            }
        }
        return new BinaryMatrix(rows.length, c, x);
    }

    public static BinaryMatrix fromRows(List<boolean[]> rows, int cols) {
        boolean[][] x = new boolean[rows.size()][];
        for (int i = 0; i < x.length; ++i) {
            if (rows.get(i).length != cols) throw new IllegalArgumentException("ragged matrix: row " + i);
            x[i] = rows.get(i).clone();
        }
        return new BinaryMatrix(x.length, cols, x);
    }

    public static BinaryMatrix parse(String s) {
        return parse(new StringReader(s));
    }

    /**
     * Parse a matrix written one row per line. Within a row, the bits may be run together
     * ("0110") or separated by spaces, tabs or commas. Lines starting with 'c' or '#' are
     * comments.
     */
    public static BinaryMatrix parse(Reader r) {
        List<boolean[]> rows = new ArrayList<>();
        int cols = -1;
        String text = new BufferedReader(r).lines().collect(Collectors.joining("\n"));
        for (String line : lineSplitter.split(text)) {
            if (line.startsWith("c") || line.startsWith("#")) continue;
            String bits = separators.removeFrom(line);
            boolean[] row = new boolean[bits.length()];
            for (int j = 0; j < bits.length(); ++j) {
                char ch = bits.charAt(j);
                if (ch != '0' && ch != '1') {
                    throw new IllegalArgumentException(String.format("invalid matrix entry '%c' in row %d", ch, rows.size()));
                }
                row[j] = ch == '1';
            }
            if (cols < 0) cols = row.length;
            else if (row.length != cols) throw new IllegalArgumentException("ragged matrix: row " + rows.size());
            rows.add(row);
        }
        return fromRows(rows, Math.max(cols, 0));
    }

    public int rows() { return rows; }
    public int cols() { return cols; }

    public boolean get(int i, int j) { return x[i][j]; }

    public boolean[] row(int i) { return x[i].clone(); }

    public int rowWeight(int i) {
        int w = 0;
        for (boolean b : x[i]) if (b) ++w;
        return w;
    }

    public boolean isZero() {
        for (boolean[] row : x) for (boolean b : row) if (b) return false;
        return true;
    }

    public BinaryMatrix transpose() {
        boolean[][] y = new boolean[cols][rows];
        for (int i = 0; i < rows; ++i) for (int j = 0; j < cols; ++j) y[j][i] = x[i][j];
        return new BinaryMatrix(cols, rows, y);
    }

    public BinaryMatrix times(BinaryMatrix o) {
        if (cols != o.rows) throw new IllegalArgumentException(String.format("cannot multiply %dx%d by %dx%d", rows, cols, o.rows, o.cols));
        boolean[][] y = new boolean[rows][o.cols];
        for (int i = 0; i < rows; ++i) {
            for (int k = 0; k < cols; ++k) {
                if (!x[i][k]) continue;
                for (int j = 0; j < o.cols; ++j) y[i][j] ^= o.x[k][j];
            }
        }
        return new BinaryMatrix(rows, o.cols, y);
    }

    /**
     * @return this · oᵀ (mod 2); both matrices must have the same number of columns
     */
    public BinaryMatrix multiplyTranspose(BinaryMatrix o) {
        if (cols != o.cols) throw new IllegalArgumentException(String.format("column counts differ: %d vs %d", cols, o.cols));
        boolean[][] y = new boolean[rows][o.rows];
        for (int i = 0; i < rows; ++i) {
            for (int j = 0; j < o.rows; ++j) {
                boolean p = false;
                for (int k = 0; k < cols; ++k) p ^= x[i][k] & o.x[j][k];
                y[i][j] = p;
            }
        }
        return new BinaryMatrix(rows, o.rows, y);
    }

    /**
     * @return the syndrome this · v (mod 2)
     */
    public boolean[] times(boolean[] v) {
        if (v.length != cols) throw new IllegalArgumentException("vector length " + v.length + " != " + cols);
        boolean[] s = new boolean[rows];
        for (int i = 0; i < rows; ++i) {
            boolean p = false;
            for (int j = 0; j < cols; ++j) p ^= x[i][j] & v[j];
            s[i] = p;
        }
        return s;
    }

    /**
     * Column j of the result is column {@code permutation[j]} of this matrix.
     */
    public BinaryMatrix permuteColumns(int[] permutation) {
        if (permutation.length != cols) throw new IllegalArgumentException("permutation has wrong length");
        boolean[][] y = new boolean[rows][cols];
        for (int i = 0; i < rows; ++i) for (int j = 0; j < cols; ++j) y[i][j] = x[i][permutation[j]];
        return new BinaryMatrix(rows, cols, y);
    }

    public BinaryMatrix selectRows(int from, int to) {
        if (from < 0 || to > rows || from > to) throw new IndexOutOfBoundsException("rows [" + from + "," + to + ")");
        boolean[][] y = new boolean[to - from][];
        for (int i = from; i < to; ++i) y[i - from] = x[i].clone();
        return new BinaryMatrix(to - from, cols, y);
    }

    public BinaryMatrix selectColumns(int from, int to) {
        if (from < 0 || to > cols || from > to) throw new IndexOutOfBoundsException("columns [" + from + "," + to + ")");
        boolean[][] y = new boolean[rows][];
        for (int i = 0; i < rows; ++i) y[i] = Arrays.copyOfRange(x[i], from, to);
        return new BinaryMatrix(rows, to - from, y);
    }

    public BinaryMatrix appendRow(boolean[] row) {
        if (row.length != cols) throw new IllegalArgumentException("row length " + row.length + " != " + cols);
        boolean[][] y = Arrays.copyOf(x, rows + 1);
        y[rows] = row.clone();
        return new BinaryMatrix(rows + 1, cols, y);
    }

    public BinaryMatrix hstack(BinaryMatrix o) {
        if (rows != o.rows) throw new IllegalArgumentException(String.format("row counts differ: %d vs %d", rows, o.rows));
        boolean[][] y = new boolean[rows][cols + o.cols];
        for (int i = 0; i < rows; ++i) {
            System.arraycopy(x[i], 0, y[i], 0, cols);
            System.arraycopy(o.x[i], 0, y[i], cols, o.cols);
        }
        return new BinaryMatrix(rows, cols + o.cols, y);
    }

    public BinaryMatrix plus(BinaryMatrix o) {
        if (rows != o.rows || cols != o.cols) throw new IllegalArgumentException("shapes differ");
        boolean[][] y = new boolean[rows][cols];
        for (int i = 0; i < rows; ++i) for (int j = 0; j < cols; ++j) y[i][j] = x[i][j] ^ o.x[i][j];
        return new BinaryMatrix(rows, cols, y);
    }

    /**
     * @return the Kronecker product this ⊗ o
     */
    public BinaryMatrix kron(BinaryMatrix o) {
        boolean[][] y = new boolean[rows * o.rows][cols * o.cols];
        for (int i = 0; i < rows; ++i) {
            for (int j = 0; j < cols; ++j) {
                if (!x[i][j]) continue;
                for (int k = 0; k < o.rows; ++k) {
                    for (int l = 0; l < o.cols; ++l) y[i * o.rows + k][j * o.cols + l] = o.x[k][l];
                }
            }
        }
        return new BinaryMatrix(rows * o.rows, cols * o.cols, y);
    }

    // Package-private: RowReducer works on a private copy.
    boolean[][] copyOfBits() {
        boolean[][] y = new boolean[rows][];
        for (int i = 0; i < rows; ++i) y[i] = x[i].clone();
        return y;
    }

    static BinaryMatrix wrap(int rows, int cols, boolean[][] bits) {
        return new BinaryMatrix(rows, cols, bits);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BinaryMatrix m = (BinaryMatrix) o;
        return rows == m.rows && cols == m.cols && Arrays.deepEquals(x, m.x);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + cols) + Arrays.deepHashCode(x);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (boolean[] row : x) {
            for (boolean b : row) sb.append(b ? '1' : '0');
            sb.append('\n');
        }
        return sb.toString();
    }
}
