package net.littleredcomputer.cssdistance.encode;

import com.google.common.collect.ImmutableMap;
import net.littleredcomputer.cssdistance.cnf.CnfInstance;

import java.util.Map;

/**
 * The CNF for one "is there a logical operator of weight ≤ bound?" question, and what is
 * needed to read its models: variable p+1 (for p &lt; n) is the qubit at permuted position p,
 * which is original qubit {@code columnPermutation()[p]}.
 */
public final class CompiledQuery {
    private final CnfInstance cnf;
    private final int[] columnPermutation;
    private final int bound;
    private final ImmutableMap<String, Integer> ancillasByTerm;

    CompiledQuery(CnfInstance cnf, int[] columnPermutation, int bound, ImmutableMap<String, Integer> ancillasByTerm) {
        this.cnf = cnf;
        this.columnPermutation = columnPermutation;
        this.bound = bound;
        this.ancillasByTerm = ancillasByTerm;
    }

    public CnfInstance cnf() { return cnf; }
    public int[] columnPermutation() { return columnPermutation.clone(); }
    public int bound() { return bound; }
    public int nQubits() { return columnPermutation.length; }

    /** @return variables beyond the qubits, per predicate term in compilation order */
    public Map<String, Integer> ancillasByTerm() { return ancillasByTerm; }

    public int ancillas() { return cnf.nVariables() - nQubits(); }

    /**
     * @param model truth values of the instance's variables (variable v at index v-1)
     * @return the indicator vector of the operator on the original qubit order
     */
    public boolean[] operator(boolean[] model) {
        if (model.length < nQubits()) throw new IllegalArgumentException("model is shorter than the number of qubits");
        boolean[] x = new boolean[nQubits()];
        for (int p = 0; p < x.length; ++p) x[columnPermutation[p]] = model[p];
        return x;
    }

    @Override
    public String toString() {
        return String.format("weight ≤ %d on %d qubits: %s, ancillas %s", bound, nQubits(), cnf, ancillasByTerm);
    }
}
