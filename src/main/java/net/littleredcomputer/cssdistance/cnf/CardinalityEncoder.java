package net.littleredcomputer.cssdistance.cnf;

/**
 * Encodes "at most {@code bound} of these literals are true" as clauses.
 */
public interface CardinalityEncoder {
    /**
     * @param literals the constrained literals
     * @param bound at most this many may be true; must be non-negative
     * @param startFreshVariable the first variable number the encoder may use for its own
     *                           auxiliaries; it must use a contiguous block beginning here
     * @return the clauses and the number of auxiliaries used
     */
    ClauseSet atMost(int[] literals, int bound, int startFreshVariable);
}
