package net.littleredcomputer.cssdistance.cnf;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertThat;

public class ParityGateTest {
    /**
     * Literals 1..k, every third one negated, so polarity is exercised too.
     */
    private static int[] inputs(int k) {
        return IntStream.rangeClosed(1, k).map(v -> v % 3 == 0 ? -v : v).toArray();
    }

    /**
     * For every assignment of the inputs and the target, some setting of the ancillas
     * satisfies the gate's clauses exactly when the target is the parity of the inputs.
     */
    private void checkTruthTable(int k) {
        int[] literals = inputs(k);
        final int target = k + 1;
        VariableAllocator allocator = new VariableAllocator(k + 1);
        ClauseSet cs = ParityGate.compile(literals, target, allocator);
        CnfInstance p = new CnfInstance(allocator.watermark(), cs.clauses());
        final int ancillas = cs.freshVariables();
        boolean[] v = new boolean[p.nVariables()];
        for (int inputs = 0; inputs < 1 << k; ++inputs) {
            boolean parity = false;
            for (int i = 0; i < k; ++i) {
                v[i] = ((inputs >> i) & 1) == 1;
                parity ^= literals[i] > 0 ? v[i] : !v[i];
            }
            for (int t = 0; t < 2; ++t) {
                v[k] = t == 1;
                boolean satisfiable = false;
                for (int a = 0; a < 1 << ancillas && !satisfiable; ++a) {
                    for (int j = 0; j < ancillas; ++j) v[k + 1 + j] = ((a >> j) & 1) == 1;
                    satisfiable = p.evaluate(v);
                }
                assertThat(String.format("k=%d inputs=%s target=%b", k, Integer.toBinaryString(inputs), v[k]),
                        satisfiable, is(v[k] == parity));
            }
        }
    }

    @Test
    public void truthTables() {
        for (int k = 0; k <= 7; ++k) checkTruthTable(k);
    }

    @Test
    public void twoInputGateIsFourClauses() {
        VariableAllocator a = new VariableAllocator(3);
        ClauseSet cs = ParityGate.compile(new int[]{1, 2}, 3, a);
        assertThat(cs.size(), is(4));
        assertThat(cs.freshVariables(), is(0));
        assertThat(a.watermark(), is(3));
    }

    @Test
    public void ancillaAndClauseCounts() {
        for (int k : new int[]{2, 3, 4, 5, 7, 16, 33}) {
            VariableAllocator a = new VariableAllocator(k + 1);
            ClauseSet cs = ParityGate.compile(inputs(k), k + 1, a);
            assertThat("k=" + k, cs.freshVariables(), is(k - 2));
            assertThat("k=" + k, cs.freshVariables(), is(ParityGate.ancillasFor(k)));
            assertThat("k=" + k, cs.size(), is(4 * (k - 1)));
            assertThat(a.watermark(), is(k + 1 + k - 2));
        }
    }

    @Test
    public void ancillasComeFromAboveTheWatermark() {
        // The target is an old variable and the inputs are scattered; neither affects numbering.
        VariableAllocator a = new VariableAllocator(20);
        int unrelated = a.allocate(5);
        assertThat(unrelated, is(21));
        int[] literals = {17, -3, 9, 12, -1, 4};
        ClauseSet cs = ParityGate.compile(literals, 2, a);
        assertThat(a.watermark(), is(25 + 4));
        List<Integer> fresh = IntStream.rangeClosed(26, 29).boxed().collect(Collectors.toList());
        List<Integer> mentioned = cs.clauses().stream()
                .flatMap(List::stream)
                .map(Math::abs)
                .filter(v -> v > 20)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
        assertThat(mentioned, is(fresh));
        assertThat(mentioned, everyItem(greaterThan(25)));
        assertThat(mentioned, everyItem(lessThanOrEqualTo(a.watermark())));
    }

    @Test
    public void recompilationIsIsomorphic() {
        VariableAllocator a = new VariableAllocator(10);
        ClauseSet first = ParityGate.compile(inputs(9), 10, a);
        ClauseSet second = ParityGate.compile(inputs(9), 10, a);
        assertThat(second.size(), is(first.size()));
        assertThat(second.freshVariables(), is(first.freshVariables()));
        assertThat(second.clauses(), is(not(first.clauses())));
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroTargetThrows() {
        ParityGate.compile(new int[]{1, 2}, 0, new VariableAllocator(2));
    }

    @Test
    public void singleLiteralIsEquivalence() {
        ClauseSet cs = ParityGate.compile(new int[]{-1}, 2, new VariableAllocator(2));
        assertThat(cs.clauses(), contains(ImmutableList.of(-2, -1), ImmutableList.of(2, 1)));
    }
}
