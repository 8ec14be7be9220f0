package net.littleredcomputer.cssdistance.oracle;

/**
 * A refutation certificate was asked for, the instance was unsatisfiable, and no certificate
 * came back.
 */
public class CertificateUnavailableException extends OracleException {
    public CertificateUnavailableException(String message) {
        super(message);
    }
}
