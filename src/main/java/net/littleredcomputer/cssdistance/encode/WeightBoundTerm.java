package net.littleredcomputer.cssdistance.encode;

import net.littleredcomputer.cssdistance.EncodingDefectException;
import net.littleredcomputer.cssdistance.cnf.CardinalityEncoder;
import net.littleredcomputer.cssdistance.cnf.ClauseSet;
import net.littleredcomputer.cssdistance.cnf.VariableAllocator;

import java.util.stream.IntStream;

/**
 * |x| ≤ bound, by way of a cardinality encoder. The encoder numbers its own auxiliaries
 * starting just above the allocator's watermark; the allocator is then advanced past them.
 */
final class WeightBoundTerm implements PredicateTerm {
    private final int nQubits;
    private final int bound;
    private final CardinalityEncoder encoder;

    WeightBoundTerm(int nQubits, int bound, CardinalityEncoder encoder) {
        this.nQubits = nQubits;
        this.bound = bound;
        this.encoder = encoder;
    }

    @Override
    public String name() { return "weight-bound"; }

    @Override
    public ClauseSet encode(VariableAllocator allocator) {
        int start = allocator.next();
        ClauseSet cs = encoder.atMost(IntStream.rangeClosed(1, nQubits).toArray(), bound, start);
        int first = allocator.allocate(cs.freshVariables());
        if (first != start) {
            throw new EncodingDefectException(String.format("cardinality auxiliaries began at %d, allocator issued %d", start, first));
        }
        return cs;
    }
}
