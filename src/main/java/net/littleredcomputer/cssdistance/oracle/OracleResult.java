package net.littleredcomputer.cssdistance.oracle;

import net.littleredcomputer.cssdistance.proof.DratProof;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * Satisfiable with a model, or unsatisfiable, possibly with a refutation certificate.
 */
public final class OracleResult {
    @Nullable private final boolean[] model;
    @Nullable private final DratProof certificate;

    private OracleResult(@Nullable boolean[] model, @Nullable DratProof certificate) {
        this.model = model;
        this.certificate = certificate;
    }

    /**
     * @param model truth value of variable v at index v-1
     */
    public static OracleResult satisfiable(boolean[] model) {
        return new OracleResult(model.clone(), null);
    }

    public static OracleResult unsatisfiable(@Nullable DratProof certificate) {
        return new OracleResult(null, certificate);
    }

    public boolean isSatisfiable() { return model != null; }

    public Optional<boolean[]> model() {
        return Optional.ofNullable(model).map(boolean[]::clone);
    }

    public Optional<DratProof> certificate() {
        return Optional.ofNullable(certificate);
    }

    @Override
    public String toString() {
        if (model != null) return "SATISFIABLE";
        return certificate != null ? "UNSATISFIABLE (" + certificate + ")" : "UNSATISFIABLE";
    }
}
