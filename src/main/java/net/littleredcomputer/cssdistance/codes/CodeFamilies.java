package net.littleredcomputer.cssdistance.codes;

import net.littleredcomputer.cssdistance.CssCode;
import net.littleredcomputer.cssdistance.gf2.BinaryMatrix;

/**
 * Constructors for some well-known families of CSS codes.
 */
public final class CodeFamilies {
    private CodeFamilies() {}

    /**
     * The [7,4,3] Hamming code's parity checks; column j is the binary expansion of j+1.
     */
    public static BinaryMatrix hamming7() {
        return BinaryMatrix.of(
                new int[]{0, 0, 0, 1, 1, 1, 1},
                new int[]{0, 1, 1, 0, 0, 1, 1},
                new int[]{1, 0, 1, 0, 1, 0, 1});
    }

    /**
     * Steane's [[7,1,3]] code: both check matrices are the Hamming code's.
     */
    public static CssCode steane() {
        return new CssCode(hamming7(), hamming7());
    }

    /**
     * The (L-1)×L checks of the length-L repetition code: row i compares bits i and i+1.
     */
    public static BinaryMatrix repetition(int L) {
        if (L < 2) throw new IllegalArgumentException("repetition code needs length ≥ 2");
        int[][] rows = new int[L - 1][L];
        for (int i = 0; i < L - 1; ++i) {
            rows[i][i] = 1;
            rows[i][i + 1] = 1;
        }
        return BinaryMatrix.of(rows);
    }

    /**
     * The L×L checks of the repetition code on a cycle: I + S where S is the cyclic shift.
     */
    public static BinaryMatrix cyclicRepetition(int L) {
        if (L < 2) throw new IllegalArgumentException("repetition code needs length ≥ 2");
        return BinaryMatrix.identity(L).plus(BinaryMatrix.cyclicShift(L));
    }

    /**
     * The hypergraph product of classical codes with checks H1 (m1×n1) and H2 (m2×n2):
     * HX = [H1⊗I(n2) | I(m1)⊗H2ᵀ], HZ = [I(n1)⊗H2 | H1ᵀ⊗I(m2)].
     */
    public static CssCode hypergraphProduct(BinaryMatrix h1, BinaryMatrix h2) {
        BinaryMatrix hx = h1.kron(BinaryMatrix.identity(h2.cols()))
                .hstack(BinaryMatrix.identity(h1.rows()).kron(h2.transpose()));
        BinaryMatrix hz = BinaryMatrix.identity(h1.cols()).kron(h2)
                .hstack(h1.transpose().kron(BinaryMatrix.identity(h2.rows())));
        return new CssCode(hx, hz);
    }

    /**
     * Kitaev's toric code on an L×L torus: [[2L², 2, L]].
     */
    public static CssCode toric(int L) {
        BinaryMatrix h = cyclicRepetition(L);
        return hypergraphProduct(h, h);
    }

    /**
     * A bivariate bicycle code. With x = S(l)⊗I(m) and y = I(l)⊗S(m), A and B are sums of
     * monomials x^i·y^j, each given as a pair {i, j}; HX = [A | B] and HZ = [Bᵀ | Aᵀ].
     */
    public static CssCode bivariateBicycle(int l, int m, int[][] aTerms, int[][] bTerms) {
        BinaryMatrix a = polynomial(l, m, aTerms);
        BinaryMatrix b = polynomial(l, m, bTerms);
        return new CssCode(a.hstack(b), b.transpose().hstack(a.transpose()));
    }

    /**
     * The [[72,12,6]] bivariate bicycle code: l = m = 6, A = x³ + y + y², B = y³ + x + x².
     */
    public static CssCode bb72() {
        return bivariateBicycle(6, 6,
                new int[][]{{3, 0}, {0, 1}, {0, 2}},
                new int[][]{{0, 3}, {1, 0}, {2, 0}});
    }

    private static BinaryMatrix polynomial(int l, int m, int[][] terms) {
        BinaryMatrix x = BinaryMatrix.cyclicShift(l).kron(BinaryMatrix.identity(m));
        BinaryMatrix y = BinaryMatrix.identity(l).kron(BinaryMatrix.cyclicShift(m));
        BinaryMatrix p = BinaryMatrix.zero(l * m, l * m);
        for (int[] t : terms) {
            if (t.length != 2) throw new IllegalArgumentException("a monomial is a pair of exponents");
            p = p.plus(power(x, t[0]).times(power(y, t[1])));
        }
        return p;
    }

    private static BinaryMatrix power(BinaryMatrix m, int e) {
        if (e < 0) throw new IllegalArgumentException("negative exponent");
        BinaryMatrix r = BinaryMatrix.identity(m.rows());
        for (int i = 0; i < e; ++i) r = r.times(m);
        return r;
    }
}
