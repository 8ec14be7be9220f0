package net.littleredcomputer.cssdistance.proof;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.cssdistance.cnf.CnfInstance;
import net.littleredcomputer.cssdistance.oracle.ExternalCommand;
import net.littleredcomputer.cssdistance.oracle.OracleException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Checks proofs with the drat-trim executable. Both the instance and the proof are handed
 * over as text.
 */
public final class DratTrimVerifier implements CertificateVerifier {
    private static final Logger log = LogManager.getFormatterLogger();
    private final String executable;

    public DratTrimVerifier(String executable) {
        this.executable = executable;
    }

    @Override
    public boolean verify(DratProof proof, CnfInstance cnf) {
        Path input = null;
        Path proofFile = null;
        try {
            input = Files.createTempFile("cssdistance", ".cnf");
            proofFile = Files.createTempFile("cssdistance", ".drat");
            try (Writer w = Files.newBufferedWriter(input, StandardCharsets.US_ASCII)) {
                cnf.writeDimacs(w);
            }
            try (Writer w = Files.newBufferedWriter(proofFile, StandardCharsets.US_ASCII)) {
                proof.writeText(w);
            }
            ExternalCommand run = new ExternalCommand(ImmutableList.of(executable, input.toString(), proofFile.toString()));
            run.run();
            return verdict(run.output());
        } catch (IOException e) {
            throw new OracleException("could not exchange files with " + executable, e);
        } finally {
            deleteTemporary(input);
            deleteTemporary(proofFile);
        }
    }

    static boolean verdict(List<String> output) {
        for (String line : output) {
            String s = line.trim();
            if (s.equals("s VERIFIED")) return true;
            if (s.equals("s NOT VERIFIED")) return false;
        }
        throw new OracleException("drat-trim gave no verdict");
    }

    /**
     * Remove a temporary file. Failure is only logged, so it never hides the verdict.
     * @return true if p is gone
     */
    static boolean deleteTemporary(@Nullable Path p) {
        if (p == null) return true;
        try {
            Files.deleteIfExists(p);
            return true;
        } catch (IOException e) {
            log.warn("could not delete %s: %s", p, e.getMessage());
            return false;
        }
    }
}
