package net.littleredcomputer.cssdistance.cnf;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Clauses emitted by one encoder together with the number of fresh variables it introduced.
 */
public final class ClauseSet {
    private final ImmutableList<ImmutableList<Integer>> clauses;
    private final int freshVariables;

    public ClauseSet(List<? extends List<Integer>> clauses, int freshVariables) {
        if (freshVariables < 0) throw new IllegalArgumentException("negative fresh variable count");
        ImmutableList.Builder<ImmutableList<Integer>> b = ImmutableList.builderWithExpectedSize(clauses.size());
        for (List<Integer> c : clauses) b.add(ImmutableList.copyOf(c));
        this.clauses = b.build();
        this.freshVariables = freshVariables;
    }

    public List<ImmutableList<Integer>> clauses() { return clauses; }
    public int size() { return clauses.size(); }
    public int freshVariables() { return freshVariables; }

    @Override
    public String toString() {
        return clauses.size() + " clauses, " + freshVariables + " fresh variables";
    }
}
