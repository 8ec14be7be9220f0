package net.littleredcomputer.cssdistance.oracle;

import com.google.common.primitives.Ints;
import net.littleredcomputer.cssdistance.cnf.CnfInstance;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sat4j.core.VecInt;
import org.sat4j.minisat.SolverFactory;
import org.sat4j.specs.ContradictionException;
import org.sat4j.specs.ISolver;
import org.sat4j.specs.TimeoutException;

import java.util.List;

/**
 * The Sat4j CDCL solver, in process. Each session builds a fresh solver. Sat4j produces no
 * refutation certificates, so asking for one on an unsatisfiable instance fails.
 */
public final class Sat4jOracle implements SatOracle {
    private static final Logger log = LogManager.getFormatterLogger();
    private final int timeoutSeconds;

    public Sat4jOracle() {
        this(0);
    }

    /**
     * @param timeoutSeconds give up after this long; 0 for no limit
     */
    public Sat4jOracle(int timeoutSeconds) {
        if (timeoutSeconds < 0) throw new IllegalArgumentException("negative timeout");
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public String name() { return "sat4j"; }

    @Override
    public OracleSession open() {
        return new Session();
    }

    private final class Session extends AbstractOracleSession {
        private final ISolver solver = SolverFactory.newDefault();

        Session() {
            super("sat4j");
            if (timeoutSeconds > 0) solver.setTimeout(timeoutSeconds);
        }

        @Override
        protected OracleResult doSolve(CnfInstance cnf, boolean wantProof) {
            solver.newVar(cnf.nVariables());
            try {
                for (List<Integer> clause : cnf.clauses()) solver.addClause(new VecInt(Ints.toArray(clause)));
            } catch (ContradictionException e) {
                log.debug("contradiction while loading clauses: %s", e.getMessage());
                return refuted(wantProof);
            }
            boolean satisfiable;
            try {
                satisfiable = solver.isSatisfiable();
            } catch (TimeoutException e) {
                throw new OracleException("sat4j gave up after " + timeoutSeconds + "s", e);
            }
            if (!satisfiable) return refuted(wantProof);
            boolean[] model = new boolean[cnf.nVariables()];
            // Variables that occur in no clause may be missing from the model; they stay false.
            for (int l : solver.model()) {
                int v = Math.abs(l);
                if (v >= 1 && v <= model.length) model[v - 1] = l > 0;
            }
            return OracleResult.satisfiable(model);
        }

        private OracleResult refuted(boolean wantProof) {
            if (wantProof) throw new CertificateUnavailableException("sat4j does not produce refutation certificates");
            return OracleResult.unsatisfiable(null);
        }

        @Override
        protected void release() {
            solver.reset();
        }
    }
}
