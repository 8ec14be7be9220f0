package net.littleredcomputer.cssdistance.oracle;

import com.google.common.base.Stopwatch;
import net.littleredcomputer.cssdistance.cnf.CnfInstance;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

/**
 * Bookkeeping shared by sessions: one question per session, timing, logging, release of
 * resources on close, and the check that a requested certificate really arrived.
 */
public abstract class AbstractOracleSession implements OracleSession {
    private static final Logger log = LogManager.getFormatterLogger(AbstractOracleSession.class);
    private final String name;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();
    private boolean used = false;
    private boolean closed = false;

    protected AbstractOracleSession(String name) {
        this.name = name;
    }

    @Override
    public final OracleResult solve(CnfInstance cnf, boolean wantProof) {
        if (closed) throw new IllegalStateException(name + " session is closed");
        if (used) throw new IllegalStateException(name + " session has already answered a question");
        used = true;
        stopwatch.start();
        OracleResult r;
        try {
            r = doSolve(cnf, wantProof);
        } finally {
            stopwatch.stop();
        }
        log.info(() -> new FormattedMessage("%s %s: %s in %s", name, cnf, r, stopwatch));
        if (wantProof && !r.isSatisfiable() && !r.certificate().isPresent()) {
            throw new CertificateUnavailableException(name + " reported UNSATISFIABLE without the requested certificate");
        }
        return r;
    }

    protected abstract OracleResult doSolve(CnfInstance cnf, boolean wantProof);

    /**
     * Give back whatever the session holds. Called at most once.
     */
    protected void release() {}

    @Override
    public final void close() {
        if (closed) return;
        closed = true;
        release();
    }
}
