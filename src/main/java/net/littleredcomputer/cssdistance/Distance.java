package net.littleredcomputer.cssdistance;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * The outcome of a distance search: the smallest weight the oracle could not beat, the
 * operator that achieves it (absent only when nothing below the caller's initial bound was
 * found), and how many oracle queries it took.
 */
public final class Distance {
    private final int weight;
    @Nullable private final LogicalOperator witness;
    private final int queries;

    Distance(int weight, @Nullable LogicalOperator witness, int queries) {
        this.weight = weight;
        this.witness = witness;
        this.queries = queries;
    }

    public int weight() { return weight; }
    public Optional<LogicalOperator> witness() { return Optional.ofNullable(witness); }
    public int queries() { return queries; }

    @Override
    public String toString() {
        return "distance " + weight + (witness != null ? " (" + witness + ")" : " (unconfirmed)") + " after " + queries + " queries";
    }
}
