package net.littleredcomputer.cssdistance.cnf;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * Sinz's sequential counter (LT-SEQ). Auxiliary s(i,j) means "at least j+1 of the first
 * i+1 literals are true"; there are (n-1)·bound of them.
 *
 * <p>C. Sinz, Towards an Optimal CNF Encoding of Boolean Cardinality Constraints, CP 2005.
 */
public final class SequentialCounterEncoder implements CardinalityEncoder {

    @Override
    public ClauseSet atMost(int[] x, int bound, int startFreshVariable) {
        if (bound < 0) throw new IllegalArgumentException("negative cardinality bound " + bound);
        if (startFreshVariable < 1) throw new IllegalArgumentException("fresh variables start at 1");
        final int n = x.length;
        final int k = bound;
        List<List<Integer>> out = new ArrayList<>();
        if (k >= n) return new ClauseSet(out, 0);
        if (k == 0) {
            for (int l : x) out.add(ImmutableList.of(-l));
            return new ClauseSet(out, 0);
        }
        // s(i, j) for 0 <= i < n-1, 0 <= j < k.
        final int base = startFreshVariable;
        out.add(ImmutableList.of(-x[0], s(base, k, 0, 0)));
        for (int j = 1; j < k; ++j) out.add(ImmutableList.of(-s(base, k, 0, j)));
        for (int i = 1; i < n - 1; ++i) {
            out.add(ImmutableList.of(-x[i], s(base, k, i, 0)));
            out.add(ImmutableList.of(-s(base, k, i - 1, 0), s(base, k, i, 0)));
            for (int j = 1; j < k; ++j) {
                out.add(ImmutableList.of(-x[i], -s(base, k, i - 1, j - 1), s(base, k, i, j)));
                out.add(ImmutableList.of(-s(base, k, i - 1, j), s(base, k, i, j)));
            }
            out.add(ImmutableList.of(-x[i], -s(base, k, i - 1, k - 1)));
        }
        out.add(ImmutableList.of(-x[n - 1], -s(base, k, n - 2, k - 1)));
        return new ClauseSet(out, (n - 1) * k);
    }

    private static int s(int base, int k, int i, int j) {
        return base + i * k + j;
    }
}
