package net.littleredcomputer.cssdistance.encode;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.littleredcomputer.cssdistance.CodeConfigurationException;
import net.littleredcomputer.cssdistance.CssCode;
import net.littleredcomputer.cssdistance.cnf.CardinalityEncoder;
import net.littleredcomputer.cssdistance.cnf.ClauseSet;
import net.littleredcomputer.cssdistance.cnf.CnfInstance;
import net.littleredcomputer.cssdistance.cnf.SequentialCounterEncoder;
import net.littleredcomputer.cssdistance.cnf.VariableAllocator;
import net.littleredcomputer.cssdistance.gf2.BinaryMatrix;
import net.littleredcomputer.cssdistance.gf2.ReducedMatrix;
import net.littleredcomputer.cssdistance.gf2.RowReducer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles "exists x with H·x = 0, x ∉ rowspace(G), |x| ≤ bound" into CNF, where H (the
 * null-space checks) and G (the row-space checks) are the two halves of a CSS code. For
 * Z-type logical operators H = HX and G = HZ; for X-type, the other way round.
 *
 * <p>G is brought to systematic form, which permutes its columns. H is permuted the same way
 * before being row reduced, so that qubit variables mean the same thing in every term.
 */
public final class DistanceQueryCompiler {
    private static final Logger log = LogManager.getFormatterLogger();
    private final CardinalityEncoder cardinality;

    public DistanceQueryCompiler() {
        this(new SequentialCounterEncoder());
    }

    public DistanceQueryCompiler(CardinalityEncoder cardinality) {
        this.cardinality = cardinality;
    }

    public CompiledQuery compile(BinaryMatrix nullSpaceChecks, BinaryMatrix rowSpaceChecks, int bound) {
        CssCode.checkCommutation(nullSpaceChecks, rowSpaceChecks);
        if (bound < 0) throw new CodeConfigurationException("weight bound must be non-negative, not " + bound);
        final int n = nullSpaceChecks.cols();

        ReducedMatrix g = RowReducer.reduce(rowSpaceChecks);
        int[] permutation = g.columnPermutation();
        ReducedMatrix h = RowReducer.rowReduce(nullSpaceChecks.permuteColumns(permutation));

        // Fixed order: the allocator's watermark threads through the terms one after another.
        List<PredicateTerm> terms = ImmutableList.of(
                new NonStabilizerTerm(g),
                new NullSpaceTerm(h.reduced()),
                new WeightBoundTerm(n, bound, cardinality));
        VariableAllocator allocator = new VariableAllocator(n);
        List<List<Integer>> clauses = new ArrayList<>();
        ImmutableMap.Builder<String, Integer> ancillas = ImmutableMap.builder();
        for (PredicateTerm t : terms) {
            ClauseSet cs = t.encode(allocator);
            clauses.addAll(cs.clauses());
            ancillas.put(t.name(), cs.freshVariables());
            log.debug("%s term: %s", t.name(), cs);
        }
        CompiledQuery q = new CompiledQuery(new CnfInstance(allocator.watermark(), clauses), permutation, bound, ancillas.build());
        log.debug("compiled %s", q);
        return q;
    }
}
