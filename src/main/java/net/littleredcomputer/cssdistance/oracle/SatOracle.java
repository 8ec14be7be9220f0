package net.littleredcomputer.cssdistance.oracle;

/**
 * A source of satisfiability-solver sessions. Every question gets its own session, and the
 * caller closes it when done.
 */
public interface SatOracle {
    String name();

    OracleSession open();
}
