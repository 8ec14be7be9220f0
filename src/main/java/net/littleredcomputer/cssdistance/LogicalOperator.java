package net.littleredcomputer.cssdistance;

import gnu.trove.list.array.TIntArrayList;

import java.util.Arrays;

/**
 * A Pauli operator of a single type (X or Z), given by its support on the physical qubits.
 */
public final class LogicalOperator {
    private final int nQubits;
    private final int[] support;

    public LogicalOperator(boolean[] indicator) {
        TIntArrayList s = new TIntArrayList();
        for (int i = 0; i < indicator.length; ++i) if (indicator[i]) s.add(i);
        this.nQubits = indicator.length;
        this.support = s.toArray();
    }

    public int weight() { return support.length; }
    public int nQubits() { return nQubits; }

    /** @return the qubits acted on, in increasing order */
    public int[] support() { return support.clone(); }

    public boolean[] indicator() {
        boolean[] x = new boolean[nQubits];
        for (int q : support) x[q] = true;
        return x;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LogicalOperator that = (LogicalOperator) o;
        return nQubits == that.nQubits && Arrays.equals(support, that.support);
    }

    @Override
    public int hashCode() {
        return 31 * nQubits + Arrays.hashCode(support);
    }

    @Override
    public String toString() {
        return "weight " + weight() + " on " + Arrays.toString(support);
    }
}
