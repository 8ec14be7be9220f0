package net.littleredcomputer.cssdistance.oracle;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import net.littleredcomputer.cssdistance.cnf.CnfInstance;
import net.littleredcomputer.cssdistance.proof.DratProof;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A DIMACS solver executable in the style of CaDiCaL or kissat: invoked as
 * {@code solver [flags] input.cnf [proof]}, it reports its verdict with an "s" line and exit
 * code 10 (satisfiable) or 20 (unsatisfiable), the model on "v" lines, and writes a DRAT
 * proof (text or binary) to the second file when one is named.
 */
public final class ProcessOracle implements SatOracle {
    private static final Logger log = LogManager.getFormatterLogger();
    private static final Splitter splitter = Splitter.on(' ').trimResults().omitEmptyStrings();
    private final String executable;
    private final ImmutableList<String> flags;

    public ProcessOracle(String executable, List<String> flags) {
        this.executable = executable;
        this.flags = ImmutableList.copyOf(flags);
    }

    public ProcessOracle(String executable) {
        this(executable, ImmutableList.of());
    }

    @Override
    public String name() { return executable; }

    @Override
    public OracleSession open() {
        return new Session();
    }

    /**
     * Interpret the solver's output lines.
     * @param proof the certificate to attach to an unsatisfiable verdict, if any
     */
    static OracleResult interpret(List<String> output, int exitValue, int nVariables, @Nullable DratProof proof) {
        Boolean satisfiable = null;
        boolean[] model = new boolean[nVariables];
        for (String line : output) {
            if (line.startsWith("s ")) {
                String status = line.substring(2).trim();
                switch (status) {
                    case "SATISFIABLE": satisfiable = true; break;
                    case "UNSATISFIABLE": satisfiable = false; break;
                    default: throw new OracleException("solver status: " + status);
                }
            } else if (line.startsWith("v ")) {
                for (String token : splitter.split(line.substring(2))) {
                    int l;
                    try {
                        l = Integer.parseInt(token);
                    } catch (NumberFormatException e) {
                        throw new OracleException("invalid value line: " + line, e);
                    }
                    if (l == 0) continue;
                    if (Math.abs(l) > nVariables) throw new OracleException("model mentions unknown variable " + l);
                    model[Math.abs(l) - 1] = l > 0;
                }
            }
        }
        if (satisfiable == null) {
            if (exitValue == 10) satisfiable = true;
            else if (exitValue == 20) satisfiable = false;
            else throw new OracleException("solver exited with code " + exitValue + " and no verdict");
        }
        return satisfiable ? OracleResult.satisfiable(model) : OracleResult.unsatisfiable(proof);
    }

    private final class Session extends AbstractOracleSession {
        private final List<Path> temporaries = new ArrayList<>();

        Session() {
            super(executable);
        }

        @Override
        protected OracleResult doSolve(CnfInstance cnf, boolean wantProof) {
            try {
                Path input = temporary(".cnf");
                try (Writer w = Files.newBufferedWriter(input, StandardCharsets.US_ASCII)) {
                    cnf.writeDimacs(w);
                }
                List<String> command = new ArrayList<>();
                command.add(executable);
                command.addAll(flags);
                command.add(input.toString());
                Path proofFile = null;
                if (wantProof) {
                    proofFile = temporary(".drat");
                    command.add(proofFile.toString());
                }
                ExternalCommand run = new ExternalCommand(command);
                int exit = run.run();
                DratProof proof = null;
                if (proofFile != null && Files.size(proofFile) > 0) proof = DratProof.read(Files.readAllBytes(proofFile));
                return interpret(run.output(), exit, cnf.nVariables(), proof);
            } catch (IOException e) {
                throw new OracleException("could not exchange files with " + executable, e);
            }
        }

        private Path temporary(String suffix) throws IOException {
            Path p = Files.createTempFile("cssdistance", suffix);
            temporaries.add(p);
            return p;
        }

        @Override
        protected void release() {
            for (Path p : temporaries) {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.warn("could not delete %s: %s", p, e.getMessage());
                }
            }
        }
    }
}
