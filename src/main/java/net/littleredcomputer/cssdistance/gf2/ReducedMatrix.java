package net.littleredcomputer.cssdistance.gf2;

/**
 * The outcome of Gaussian elimination of a matrix M over GF(2):
 * {@code rowTransform · M.permuteColumns(columnPermutation) == reduced}. Only the
 * {@code rank} independent rows are kept, so {@code reduced} has full row rank.
 */
public final class ReducedMatrix {
    private final BinaryMatrix reduced;
    private final int rank;
    private final BinaryMatrix rowTransform;
    private final int[] columnPermutation;

    ReducedMatrix(BinaryMatrix reduced, int rank, BinaryMatrix rowTransform, int[] columnPermutation) {
        this.reduced = reduced;
        this.rank = rank;
        this.rowTransform = rowTransform;
        this.columnPermutation = columnPermutation;
    }

    public BinaryMatrix reduced() { return reduced; }
    public int rank() { return rank; }
    public BinaryMatrix rowTransform() { return rowTransform; }

    /**
     * Position j of the reduced matrix holds original column {@code columnPermutation()[j]}.
     */
    public int[] columnPermutation() { return columnPermutation.clone(); }
}
