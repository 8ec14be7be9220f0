package net.littleredcomputer.cssdistance;

import com.google.common.base.Joiner;
import com.google.common.base.Stopwatch;
import com.google.common.primitives.Ints;
import net.littleredcomputer.cssdistance.codes.CodeFamilies;
import net.littleredcomputer.cssdistance.encode.CompiledQuery;
import net.littleredcomputer.cssdistance.encode.DistanceQueryCompiler;
import net.littleredcomputer.cssdistance.gf2.BinaryMatrix;
import net.littleredcomputer.cssdistance.oracle.ProcessOracle;
import net.littleredcomputer.cssdistance.oracle.Sat4jOracle;
import net.littleredcomputer.cssdistance.oracle.SatOracle;
import net.littleredcomputer.cssdistance.proof.DratTrimVerifier;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class Main {
    private static final Joiner spaceJoiner = Joiner.on(' ');
    private static final Pattern toricRe = Pattern.compile("toric(\\d+)");
    private static final Pattern hgpRe = Pattern.compile("hgp(\\d+),(\\d+)");

    private static Options options() {
        return new Options()
                .addOption("task", true, "distance, query or cnf")
                .addOption("code", true, "canned code: steane, toric<L>, hgp<a>,<b>, bb72")
                .addOption("hx", true, "file holding the X check matrix (- for stdin)")
                .addOption("hz", true, "file holding the Z check matrix")
                .addOption("bound", true, "weight bound for query/cnf; upper bound for distance, also with -both")
                .addOption("both", false, "distance: minimum over X- and Z-type operators (not with -dual)")
                .addOption("dual", false, "X-type operators instead of Z-type")
                .addOption("solver", true, "sat4j (default) or the path of a DIMACS solver executable")
                .addOption("proof", false, "require refutation certificates")
                .addOption("verifier", true, "path of drat-trim, to check certificates")
                .addOption("timeout", true, "sat4j time limit in seconds");
    }

    private static Reader matrixFile(String p) throws FileNotFoundException {
        return new BufferedReader(p.equals("-") ? new InputStreamReader(System.in, StandardCharsets.UTF_8) : new FileReader(p));
    }

    private static CssCode code(CommandLine cmd) throws IOException {
        if (cmd.hasOption("code")) {
            String c = cmd.getOptionValue("code");
            Matcher tm = toricRe.matcher(c);
            if (tm.matches()) return CodeFamilies.toric(Integer.parseInt(tm.group(1)));
            Matcher hm = hgpRe.matcher(c);
            if (hm.matches()) {
                return CodeFamilies.hypergraphProduct(
                        CodeFamilies.repetition(Integer.parseInt(hm.group(1))),
                        CodeFamilies.repetition(Integer.parseInt(hm.group(2))));
            }
            switch (c) {
                case "steane": return CodeFamilies.steane();
                case "bb72": return CodeFamilies.bb72();
                default: throw new IllegalArgumentException("unknown code: " + c);
            }
        }
        if (!cmd.hasOption("hx") || !cmd.hasOption("hz")) throw new IllegalArgumentException("Must specify -code or both -hx and -hz");
        BinaryMatrix hx = readMatrix("HX", cmd.getOptionValue("hx"));
        BinaryMatrix hz = readMatrix("HZ", cmd.getOptionValue("hz"));
        return new CssCode(hx, hz);
    }

    private static BinaryMatrix readMatrix(String name, String path) throws IOException {
        try (Reader r = matrixFile(path)) {
            return BinaryMatrix.parse(r);
        } catch (IllegalArgumentException e) {
            throw new CodeConfigurationException(name + " in " + path + ": " + e.getMessage(), e);
        }
    }

    private static SatOracle oracle(CommandLine cmd) {
        String s = cmd.getOptionValue("solver", "sat4j");
        if (s.equals("sat4j")) return new Sat4jOracle(Integer.parseInt(cmd.getOptionValue("timeout", "0")));
        return new ProcessOracle(s);
    }

    private static int bound(CommandLine cmd) {
        if (!cmd.hasOption("bound")) throw new IllegalArgumentException("Must specify -bound");
        return Integer.parseInt(cmd.getOptionValue("bound"));
    }

    public static void main(String[] args) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        if (!cmd.hasOption("task")) throw new IllegalArgumentException("Must specify -task");
        String task = cmd.getOptionValue("task");
        if (cmd.hasOption("both") && cmd.hasOption("dual")) {
            throw new IllegalArgumentException("-both already covers both operator types; drop -dual");
        }
        CssCode code = code(cmd);
        // Z-type operators by default: null space of HX, outside the row space of HZ.
        CssCode oriented = cmd.hasOption("dual") ? code.dual() : code;
        DistanceSearch search = new DistanceSearch()
                .setOracle(oracle(cmd))
                .setWantProof(cmd.hasOption("proof"));
        if (cmd.hasOption("verifier")) search.setVerifier(new DratTrimVerifier(cmd.getOptionValue("verifier")));
        System.out.println("c " + code);
        switch (task) {
            case "distance": {
                Stopwatch sw = Stopwatch.createStarted();
                Distance d;
                if (cmd.hasOption("both")) d = cmd.hasOption("bound") ? search.minimumDistance(code, bound(cmd)) : search.minimumDistance(code);
                else if (cmd.hasOption("bound")) d = search.distance(oriented.hx(), oriented.hz(), bound(cmd));
                else d = search.zDistance(oriented);
                sw.stop();
                System.out.println("c " + sw + ", " + d.queries() + " queries");
                System.out.println("d " + d.weight());
                d.witness().ifPresent(w -> System.out.println("v " + spaceJoiner.join(Ints.asList(w.support()))));
                break;
            }
            case "query": {
                int bound = bound(cmd);
                Optional<LogicalOperator> w = search.query(oriented.hx(), oriented.hz(), bound);
                if (w.isPresent()) {
                    System.out.println("s SATISFIABLE");
                    System.out.println("v " + spaceJoiner.join(Ints.asList(w.get().support())));
                } else {
                    System.out.println("s UNSATISFIABLE");
                }
                break;
            }
            case "cnf": {
                CompiledQuery q = new DistanceQueryCompiler().compile(oriented.hx(), oriented.hz(), bound(cmd));
                System.out.println("c " + q);
                System.out.println("c permutation " + spaceJoiner.join(Ints.asList(q.columnPermutation())));
                Writer w = new OutputStreamWriter(System.out, StandardCharsets.US_ASCII);
                q.cnf().writeDimacs(w);
                w.flush();
                break;
            }
            default:
                throw new IllegalArgumentException("unknown task: " + task);
        }
    }
}
