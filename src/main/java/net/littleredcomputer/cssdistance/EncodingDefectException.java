package net.littleredcomputer.cssdistance;

/**
 * A satisfying assignment failed the independent re-check, or the search saw a bound that
 * did not shrink. Either way the clauses did not say what they were meant to say.
 */
public class EncodingDefectException extends IllegalStateException {
    public EncodingDefectException(String message) {
        super(message);
    }
}
