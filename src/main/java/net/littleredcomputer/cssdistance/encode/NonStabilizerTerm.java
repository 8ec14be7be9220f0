package net.littleredcomputer.cssdistance.encode;

import com.google.common.collect.ImmutableList;
import gnu.trove.list.array.TIntArrayList;
import net.littleredcomputer.cssdistance.cnf.ClauseSet;
import net.littleredcomputer.cssdistance.cnf.ParityGate;
import net.littleredcomputer.cssdistance.cnf.VariableAllocator;
import net.littleredcomputer.cssdistance.gf2.BinaryMatrix;
import net.littleredcomputer.cssdistance.gf2.ReducedMatrix;

import java.util.ArrayList;
import java.util.List;

/**
 * x is not in the row space of the checks.
 *
 * <p>With the checks in systematic form [I | A] (rank r, n columns), the row space is
 * {(u, u·A)}. So x = (x_L, x_R) is outside it exactly when x_R ≠ x_L·A, i.e. when some
 * position j of the right block has x_{r+j} ⊕ ⨁_{i : A[i][j]} x_i = 1. Each such parity gets
 * an output variable y_j, and one clause asks for at least one y_j to be true.
 */
final class NonStabilizerTerm implements PredicateTerm {
    private final BinaryMatrix systematic;
    private final int rank;

    NonStabilizerTerm(ReducedMatrix checks) {
        this.systematic = checks.reduced();
        this.rank = checks.rank();
    }

    @Override
    public String name() { return "non-stabilizer"; }

    @Override
    public ClauseSet encode(VariableAllocator allocator) {
        final int n = systematic.cols();
        final int before = allocator.watermark();
        List<List<Integer>> out = new ArrayList<>();
        TIntArrayList mismatch = new TIntArrayList(n - rank);
        TIntArrayList literals = new TIntArrayList();
        for (int j = rank; j < n; ++j) {
            literals.resetQuick();
            for (int i = 0; i < rank; ++i) {
                if (systematic.get(i, j)) literals.add(i + 1);
            }
            literals.add(j + 1);
            int y = allocator.fresh();
            ParityGate.compile(literals.toArray(), y, allocator, out);
            mismatch.add(y);
        }
        // Empty when the checks have full column rank: nothing is outside the row space.
        ImmutableList.Builder<Integer> any = ImmutableList.builder();
        mismatch.forEach(y -> {
            any.add(y);
            return true;
        });
        out.add(any.build());
        return new ClauseSet(out, allocator.watermark() - before);
    }
}
