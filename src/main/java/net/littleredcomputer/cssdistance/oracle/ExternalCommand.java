package net.littleredcomputer.cssdistance.oracle;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs an external program to completion, collecting its (merged) output lines.
 */
public final class ExternalCommand {
    private static final Logger log = LogManager.getFormatterLogger();
    private final ImmutableList<String> command;
    private int exitValue;
    private final List<String> output = new ArrayList<>();

    public ExternalCommand(List<String> command) {
        if (command.isEmpty()) throw new IllegalArgumentException("empty command");
        this.command = ImmutableList.copyOf(command);
    }

    /**
     * @return the exit value of the program
     */
    public int run() {
        log.debug("running %s", Joiner.on(' ').join(command));
        Process p;
        try {
            p = new ProcessBuilder(command).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new OracleException("could not start " + command.get(0), e);
        }
        try (BufferedReader r = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) output.add(line);
            exitValue = p.waitFor();
        } catch (IOException e) {
            throw new OracleException("lost contact with " + command.get(0), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleException("interrupted while waiting for " + command.get(0), e);
        } finally {
            if (p.isAlive()) p.destroyForcibly();
        }
        log.debug("%s exited with %d after %d lines of output", command.get(0), exitValue, output.size());
        return exitValue;
    }

    public List<String> output() { return output; }
    public int exitValue() { return exitValue; }
    public String program() { return command.get(0); }
}
