package net.littleredcomputer.cssdistance.cnf;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Clauses forcing a target literal to equal the exclusive or of a list of literals.
 * Only 2-input XOR gates (four 3-literal clauses each) are used. A list of k ≥ 2 literals is
 * split into halves whose parities are named by ancilla variables, so a parity of k literals
 * costs k-1 gates and k-2 ancillas.
 */
public final class ParityGate {
    private ParityGate() {}

    /**
     * Constrain target = literals[0] ⊕ ... ⊕ literals[k-1].
     * @return the clauses, and the number of ancillas taken from the allocator
     */
    public static ClauseSet compile(int[] literals, int target, VariableAllocator allocator) {
        List<List<Integer>> out = new ArrayList<>();
        int before = allocator.watermark();
        compile(literals, target, allocator, out);
        return new ClauseSet(out, allocator.watermark() - before);
    }

    /**
     * As {@link #compile(int[], int, VariableAllocator)}, appending to {@code out}.
     */
    public static void compile(int[] literals, int target, VariableAllocator allocator, List<List<Integer>> out) {
        if (target == 0) throw new IllegalArgumentException("target must be a nonzero literal");
        final int k = literals.length;
        switch (k) {
            case 0:
                out.add(ImmutableList.of(-target));
                break;
            case 1:
                out.add(ImmutableList.of(-target, literals[0]));
                out.add(ImmutableList.of(target, -literals[0]));
                break;
            case 2:
                xor2(target, literals[0], literals[1], out);
                break;
            case 3: {
                int a = allocator.fresh();
                xor2(target, literals[2], a, out);
                xor2(a, literals[0], literals[1], out);
                break;
            }
            default: {
                // Both ancillas are issued before either half is compiled, so each half's own
                // ancillas land above them.
                int a1 = allocator.allocate(2);
                int a2 = a1 + 1;
                xor2(target, a1, a2, out);
                int h = k / 2;
                compile(Arrays.copyOfRange(literals, 0, h), a1, allocator, out);
                compile(Arrays.copyOfRange(literals, h, k), a2, allocator, out);
            }
        }
    }

    /**
     * t = a ⊕ b: forbid the four rows of the truth table where this fails.
     */
    static void xor2(int t, int a, int b, List<List<Integer>> out) {
        out.add(ImmutableList.of(-t, a, b));
        out.add(ImmutableList.of(-t, -a, -b));
        out.add(ImmutableList.of(t, -a, b));
        out.add(ImmutableList.of(t, a, -b));
    }

    /**
     * @return the number of ancillas a parity of k literals consumes
     */
    public static int ancillasFor(int k) {
        return Math.max(0, k - 2);
    }
}
