package net.littleredcomputer.cssdistance.proof;

import net.littleredcomputer.cssdistance.cnf.CnfInstance;

/**
 * Checks a refutation certificate against the clauses it claims to refute.
 */
public interface CertificateVerifier {
    /**
     * @return true if the proof is a valid refutation of cnf
     */
    boolean verify(DratProof proof, CnfInstance cnf);
}
