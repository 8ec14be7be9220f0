package net.littleredcomputer.cssdistance;

/**
 * The parity-check matrices (or the bounds asked of them) do not describe a valid question:
 * ragged or mismatched matrices, checks that do not commute, a code without logical qubits.
 */
public class CodeConfigurationException extends IllegalArgumentException {
    public CodeConfigurationException(String message) {
        super(message);
    }

    public CodeConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
