package net.littleredcomputer.cssdistance.encode;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.cssdistance.CodeConfigurationException;
import net.littleredcomputer.cssdistance.cnf.CnfInstance;
import net.littleredcomputer.cssdistance.codes.CodeFamilies;
import net.littleredcomputer.cssdistance.gf2.BinaryMatrix;
import net.littleredcomputer.cssdistance.gf2.RowReducer;
import net.littleredcomputer.cssdistance.oracle.OracleSession;
import net.littleredcomputer.cssdistance.oracle.Sat4jOracle;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class DistanceQueryCompilerTest {
    private final DistanceQueryCompiler compiler = new DistanceQueryCompiler();
    private final Sat4jOracle oracle = new Sat4jOracle();

    private boolean solve(CnfInstance cnf) {
        try (OracleSession s = oracle.open()) {
            return s.solve(cnf, false).isSatisfiable();
        }
    }

    /**
     * The compiled instance, with the qubit variables pinned to x by unit clauses.
     */
    private static CnfInstance pinned(CompiledQuery q, boolean[] x) {
        int[] perm = q.columnPermutation();
        List<List<Integer>> clauses = new ArrayList<>(q.cnf().clauses());
        for (int p = 0; p < perm.length; ++p) clauses.add(ImmutableList.of(x[perm[p]] ? p + 1 : -(p + 1)));
        return new CnfInstance(q.cnf().nVariables(), clauses);
    }

    private static boolean[] bits(int v, int n) {
        boolean[] x = new boolean[n];
        for (int i = 0; i < n; ++i) x[i] = ((v >> i) & 1) == 1;
        return x;
    }

    private static boolean isLogical(BinaryMatrix h, BinaryMatrix g, boolean[] x) {
        for (boolean s : h.times(x)) if (s) return false;
        return !RowReducer.inRowSpace(g, x);
    }

    /**
     * With the qubits fixed, the instance is satisfiable exactly when the fixed vector is a
     * logical operator within the weight bound.
     */
    private void checkEveryVector(BinaryMatrix h, BinaryMatrix g, int bound) {
        CompiledQuery q = compiler.compile(h, g, bound);
        final int n = h.cols();
        for (int v = 0; v < 1 << n; ++v) {
            boolean[] x = bits(v, n);
            boolean expected = isLogical(h, g, x) && Integer.bitCount(v) <= bound;
            assertThat(String.format("bound %d x=%s", bound, Integer.toBinaryString(v)), solve(pinned(q, x)), is(expected));
        }
    }

    @Test
    public void steaneEveryVector() {
        BinaryMatrix h = CodeFamilies.hamming7();
        checkEveryVector(h, h, 7);
        checkEveryVector(h, h, 3);
        checkEveryVector(h, h, 2);
    }

    @Test
    public void asymmetricEveryVector() {
        // [[4,2,2]]: the same single check both ways, then a variant where H and G differ.
        BinaryMatrix hx = BinaryMatrix.of(new int[]{1, 1, 1, 1});
        BinaryMatrix hz = BinaryMatrix.of(new int[]{1, 1, 1, 1});
        checkEveryVector(hx, hz, 4);
        checkEveryVector(hx, hz, 2);
        BinaryMatrix g = BinaryMatrix.of(new int[]{0, 1, 1, 0}, new int[]{1, 0, 0, 1});
        BinaryMatrix h = BinaryMatrix.of(new int[]{1, 1, 1, 1});
        checkEveryVector(h, g, 4);
        checkEveryVector(g, h, 4);
        checkEveryVector(g, h, 1);
    }

    @Test
    public void modelsDecodeToLogicalOperators() {
        BinaryMatrix h = CodeFamilies.hamming7();
        CompiledQuery q = compiler.compile(h, h, 3);
        try (OracleSession s = oracle.open()) {
            boolean[] model = s.solve(q.cnf(), false).model().get();
            boolean[] x = q.operator(model);
            assertThat(isLogical(h, h, x), is(true));
        }
    }

    @Test
    public void boundZeroIsUnsatisfiable() {
        BinaryMatrix h = CodeFamilies.hamming7();
        assertThat(solve(compiler.compile(h, h, 0).cnf()), is(false));
    }

    @Test
    public void fullRankRowSpaceChecksAreUnsatisfiable() {
        CompiledQuery q = compiler.compile(BinaryMatrix.zero(1, 3), BinaryMatrix.identity(3), 3);
        assertThat(q.cnf().clauses().stream().anyMatch(List::isEmpty), is(true));
        assertThat(solve(q.cnf()), is(false));
    }

    @Test
    public void ancillaBookkeeping() {
        BinaryMatrix h = CodeFamilies.hamming7();
        CompiledQuery q = compiler.compile(h, h, 3);
        assertThat(q.nQubits(), is(7));
        assertThat(q.bound(), is(3));
        assertThat(q.ancillasByTerm().keySet(), contains("non-stabilizer", "null-space", "weight-bound"));
        assertThat(q.ancillasByTerm().get("weight-bound"), is(6 * 3));
        int sum = q.ancillasByTerm().values().stream().mapToInt(Integer::intValue).sum();
        assertThat(q.ancillas(), is(sum));
        assertThat(q.cnf().nVariables(), is(7 + sum));
    }

    @Test
    public void recompilationGivesTheSameShape() {
        CompiledQuery a = compiler.compile(CodeFamilies.hamming7(), CodeFamilies.hamming7(), 4);
        CompiledQuery b = compiler.compile(CodeFamilies.hamming7(), CodeFamilies.hamming7(), 4);
        assertThat(b.cnf().nVariables(), is(a.cnf().nVariables()));
        assertThat(b.cnf().clauses(), is(a.cnf().clauses()));
        assertThat(b.columnPermutation(), is(a.columnPermutation()));
    }

    @Test
    public void operatorUndoesThePermutation() {
        CompiledQuery q = compiler.compile(CodeFamilies.hamming7(), CodeFamilies.hamming7(), 3);
        int[] perm = q.columnPermutation();
        boolean[] model = new boolean[q.cnf().nVariables()];
        model[0] = true;
        boolean[] x = q.operator(model);
        assertThat(x[perm[0]], is(true));
        int weight = 0;
        for (boolean b : x) if (b) ++weight;
        assertThat(weight, is(1));
    }

    @Test(expected = CodeConfigurationException.class)
    public void negativeBound() {
        compiler.compile(CodeFamilies.hamming7(), CodeFamilies.hamming7(), -1);
    }

    @Test(expected = CodeConfigurationException.class)
    public void mismatchedColumns() {
        compiler.compile(CodeFamilies.hamming7(), BinaryMatrix.identity(6), 3);
    }

    @Test(expected = CodeConfigurationException.class)
    public void anticommutingChecks() {
        compiler.compile(BinaryMatrix.of(new int[]{1, 0}), BinaryMatrix.of(new int[]{1, 1}), 2);
    }
}
