package net.littleredcomputer.cssdistance;

/**
 * The certificate verifier rejected the oracle's refutation, so "no operator of this weight"
 * has not been established.
 */
public class RefutationNotVerifiedException extends IllegalStateException {
    public RefutationNotVerifiedException(String message) {
        super(message);
    }
}
