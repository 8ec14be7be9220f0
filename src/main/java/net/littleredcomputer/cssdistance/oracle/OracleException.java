package net.littleredcomputer.cssdistance.oracle;

/**
 * The satisfiability oracle (or another external tool) failed to give an answer: it could not
 * be started, timed out, crashed, or said something we could not parse.
 */
public class OracleException extends RuntimeException {
    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
