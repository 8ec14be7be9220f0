package net.littleredcomputer.cssdistance.oracle;

import net.littleredcomputer.cssdistance.cnf.CnfInstance;

/**
 * One solver instance, answering one question.
 */
public interface OracleSession extends AutoCloseable {
    /**
     * Decide cnf.
     * @param wantProof if the instance is unsatisfiable, a refutation certificate must come
     *                  back; an oracle that cannot produce one throws
     *                  {@link CertificateUnavailableException}
     */
    OracleResult solve(CnfInstance cnf, boolean wantProof);

    @Override
    void close();
}
