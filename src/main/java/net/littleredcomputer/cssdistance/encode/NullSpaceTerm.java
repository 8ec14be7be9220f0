package net.littleredcomputer.cssdistance.encode;

import com.google.common.collect.ImmutableList;
import gnu.trove.list.array.TIntArrayList;
import net.littleredcomputer.cssdistance.cnf.ClauseSet;
import net.littleredcomputer.cssdistance.cnf.ParityGate;
import net.littleredcomputer.cssdistance.cnf.VariableAllocator;
import net.littleredcomputer.cssdistance.gf2.BinaryMatrix;

import java.util.ArrayList;
import java.util.List;

/**
 * H·x = 0 (mod 2): the parity of x over the support of every row of H is even. H should have
 * independent rows (dependent ones only repeat constraints).
 */
final class NullSpaceTerm implements PredicateTerm {
    private final BinaryMatrix checks;

    NullSpaceTerm(BinaryMatrix checks) {
        this.checks = checks;
    }

    @Override
    public String name() { return "null-space"; }

    @Override
    public ClauseSet encode(VariableAllocator allocator) {
        final int before = allocator.watermark();
        List<List<Integer>> out = new ArrayList<>();
        TIntArrayList literals = new TIntArrayList();
        for (int i = 0; i < checks.rows(); ++i) {
            literals.resetQuick();
            for (int j = 0; j < checks.cols(); ++j) {
                if (checks.get(i, j)) literals.add(j + 1);
            }
            int parity = allocator.fresh();
            ParityGate.compile(literals.toArray(), parity, allocator, out);
            out.add(ImmutableList.of(-parity));
        }
        return new ClauseSet(out, allocator.watermark() - before);
    }
}
