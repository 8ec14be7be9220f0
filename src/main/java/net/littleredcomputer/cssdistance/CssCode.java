package net.littleredcomputer.cssdistance;

import net.littleredcomputer.cssdistance.gf2.BinaryMatrix;
import net.littleredcomputer.cssdistance.gf2.RowReducer;

/**
 * A CSS code given by its X- and Z-type parity-check matrices. Construction checks that the
 * matrices have the same number of columns (one per physical qubit) and that
 * HX·HZᵀ = 0 (mod 2).
 */
public final class CssCode {
    private final BinaryMatrix hx;
    private final BinaryMatrix hz;
    private final int k;

    public CssCode(BinaryMatrix hx, BinaryMatrix hz) {
        checkCommutation(hx, hz);
        this.hx = hx;
        this.hz = hz;
        this.k = hx.cols() - RowReducer.rank(hx) - RowReducer.rank(hz);
    }

    /**
     * Throw unless hx and hz are the parity checks of a CSS code on at least one qubit.
     */
    public static void checkCommutation(BinaryMatrix hx, BinaryMatrix hz) {
        if (hx.cols() != hz.cols()) {
            throw new CodeConfigurationException(String.format("HX has %d columns but HZ has %d", hx.cols(), hz.cols()));
        }
        if (hx.cols() == 0) throw new CodeConfigurationException("a code needs at least one qubit");
        if (!hx.multiplyTranspose(hz).isZero()) {
            throw new CodeConfigurationException("HX·HZᵀ ≠ 0 (mod 2): the X and Z checks do not commute");
        }
    }

    public BinaryMatrix hx() { return hx; }
    public BinaryMatrix hz() { return hz; }

    /** @return the number of physical qubits */
    public int n() { return hx.cols(); }

    /** @return the number of logical qubits, n - rank(HX) - rank(HZ) */
    public int k() { return k; }

    /**
     * @return the code with the roles of the X and Z checks exchanged
     */
    public CssCode dual() {
        return new CssCode(hz, hx);
    }

    @Override
    public String toString() {
        return String.format("[[%d,%d]] CSS code (%d X checks, %d Z checks)", n(), k, hx.rows(), hz.rows());
    }
}
