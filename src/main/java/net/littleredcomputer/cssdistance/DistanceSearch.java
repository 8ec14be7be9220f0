package net.littleredcomputer.cssdistance;

import com.google.common.base.Stopwatch;
import net.littleredcomputer.cssdistance.encode.CompiledQuery;
import net.littleredcomputer.cssdistance.encode.DistanceQueryCompiler;
import net.littleredcomputer.cssdistance.gf2.BinaryMatrix;
import net.littleredcomputer.cssdistance.gf2.RowReducer;
import net.littleredcomputer.cssdistance.oracle.CertificateUnavailableException;
import net.littleredcomputer.cssdistance.oracle.OracleResult;
import net.littleredcomputer.cssdistance.oracle.OracleSession;
import net.littleredcomputer.cssdistance.oracle.Sat4jOracle;
import net.littleredcomputer.cssdistance.oracle.SatOracle;
import net.littleredcomputer.cssdistance.proof.CertificateVerifier;
import net.littleredcomputer.cssdistance.proof.DratProof;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * Finds the distance of a CSS code by asking the oracle for ever lighter logical operators.
 *
 * <p>Starting from an upper bound w, ask whether an operator of weight at most w-1 exists. If
 * so, its actual weight becomes the new w and we ask again; when the answer is no, w is the
 * distance. Every question is compiled afresh and put to a fresh oracle session.
 *
 * <p>Z-type logical operators lie in the null space of HX and outside the row space of HZ;
 * X-type ones swap the matrices. {@link #distance(BinaryMatrix, BinaryMatrix, int)} takes the
 * two matrices in that order, so each type is one call.
 */
public final class DistanceSearch {
    private static final Logger log = LogManager.getFormatterLogger();
    private SatOracle oracle = new Sat4jOracle();
    private DistanceQueryCompiler compiler = new DistanceQueryCompiler();
    private boolean wantProof = false;
    @Nullable private CertificateVerifier verifier = null;

    public DistanceSearch setOracle(SatOracle oracle) {
        this.oracle = oracle;
        return this;
    }

    public DistanceSearch setCompiler(DistanceQueryCompiler compiler) {
        this.compiler = compiler;
        return this;
    }

    /**
     * Require a refutation certificate from the oracle whenever it says "no".
     */
    public DistanceSearch setWantProof(boolean wantProof) {
        this.wantProof = wantProof;
        return this;
    }

    /**
     * Check certificates with this verifier. Only consulted when proofs are wanted.
     */
    public DistanceSearch setVerifier(@Nullable CertificateVerifier verifier) {
        this.verifier = verifier;
        return this;
    }

    /**
     * Is there an operator x with H·x = 0, x outside the row space of G, and |x| ≤ bound?
     * @param nullSpaceChecks H
     * @param rowSpaceChecks G
     * @return a verified witness, or empty if the oracle refutes the question
     */
    public Optional<LogicalOperator> query(BinaryMatrix nullSpaceChecks, BinaryMatrix rowSpaceChecks, int bound) {
        CompiledQuery q = compiler.compile(nullSpaceChecks, rowSpaceChecks, bound);
        try (OracleSession session = oracle.open()) {
            OracleResult r = session.solve(q.cnf(), wantProof);
            if (r.isSatisfiable()) {
                boolean[] model = r.model().orElseThrow(IllegalStateException::new);
                return Optional.of(WitnessDecoder.decode(model, q, nullSpaceChecks, rowSpaceChecks));
            }
            if (wantProof) {
                DratProof proof = r.certificate().orElseThrow(() ->
                        new CertificateUnavailableException(oracle.name() + " returned no certificate"));
                if (verifier != null && !verifier.verify(proof, q.cnf())) {
                    throw new RefutationNotVerifiedException(String.format("%s refutation of weight ≤ %d was rejected by the verifier", oracle.name(), bound));
                }
            }
            return Optional.empty();
        }
    }

    /**
     * The minimum weight of an operator in the null space of H but outside the row space of G.
     * @param upperBound the search starts by asking for operators of weight below this
     */
    public Distance distance(BinaryMatrix nullSpaceChecks, BinaryMatrix rowSpaceChecks, int upperBound) {
        CssCode.checkCommutation(nullSpaceChecks, rowSpaceChecks);
        final int n = nullSpaceChecks.cols();
        if (n - RowReducer.rank(nullSpaceChecks) - RowReducer.rank(rowSpaceChecks) < 1) {
            throw new CodeConfigurationException("the code has no logical qubits, so its distance is undefined");
        }
        if (upperBound < 1) throw new CodeConfigurationException("upper bound must be positive, not " + upperBound);
        Stopwatch sw = Stopwatch.createStarted();
        int w = upperBound;
        LogicalOperator best = null;
        int queries = 0;
        while (true) {
            Optional<LogicalOperator> found = query(nullSpaceChecks, rowSpaceChecks, w - 1);
            ++queries;
            if (!found.isPresent()) break;
            int next = found.get().weight();
            if (next <= 0 || next >= w) {
                throw new EncodingDefectException(String.format("bound %d answered with weight %d", w - 1, next));
            }
            w = next;
            best = found.get();
            log.info("n=%d: found %s", n, best);
        }
        if (best == null) log.info("n=%d: nothing lighter than %d", n, w);
        Distance d = new Distance(w, best, queries);
        log.info("n=%d: %s in %s", n, d, sw);
        return d;
    }

    /**
     * The minimum weight of a Z-type logical operator, searching down from n.
     */
    public Distance zDistance(CssCode code) {
        // n + 1: the first question (weight ≤ n) always has an answer, so the result has a witness.
        return distance(code.hx(), code.hz(), code.n() + 1);
    }

    public Distance xDistance(CssCode code) {
        return distance(code.hz(), code.hx(), code.n() + 1);
    }

    /**
     * The distance of the code: the lighter of its X- and Z-type distances. The X-type search
     * only looks below the Z-type result.
     */
    public Distance minimumDistance(CssCode code) {
        return minimumDistance(code, code.n() + 1);
    }

    /**
     * As {@link #minimumDistance(CssCode)}, with the Z-type search starting below upperBound.
     */
    public Distance minimumDistance(CssCode code, int upperBound) {
        Distance z = distance(code.hx(), code.hz(), upperBound);
        Distance x = distance(code.hz(), code.hx(), z.weight());
        Distance d = x.witness().isPresent() ? x : z;
        return new Distance(d.weight(), d.witness().orElse(null), z.queries() + x.queries());
    }
}
