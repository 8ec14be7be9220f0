package net.littleredcomputer.cssdistance.cnf;

import javax.annotation.CheckReturnValue;

/**
 * Hands out fresh boolean variables for one compilation pass. The watermark is the largest
 * variable number issued so far; it only grows. Variables must be used as soon as they are
 * issued, and a pass never shares its allocator with another.
 */
public final class VariableAllocator {
    private int watermark;

    /**
     * @param reserved variables 1..reserved are already spoken for (e.g., one per qubit)
     */
    public VariableAllocator(int reserved) {
        if (reserved < 0) throw new IllegalArgumentException("negative reservation");
        watermark = reserved;
    }

    /**
     * Issue {@code count} fresh variables.
     * @return the first of the variables first..first+count-1
     */
    @CheckReturnValue
    public int allocate(int count) {
        if (count < 0) throw new IllegalArgumentException("cannot allocate " + count + " variables");
        int first = watermark + 1;
        watermark += count;
        return first;
    }

    @CheckReturnValue
    public int fresh() { return allocate(1); }

    public int watermark() { return watermark; }

    /**
     * @return the variable the next call to {@link #allocate} will begin with
     */
    public int next() { return watermark + 1; }
}
