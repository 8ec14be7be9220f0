package net.littleredcomputer.cssdistance.cnf;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.StreamSupport;

/**
 * A conjunction of clauses over the variables 1..{@link #nVariables()}. Literals are
 * signed, non-zero DIMACS integers. Instances are immutable; the number of variables is the
 * watermark of the allocator that produced the clauses, so every literal's magnitude is at
 * most {@code nVariables()}.
 */
public final class CnfInstance {
    private final static Pattern pLineRe = Pattern.compile("p\\s+cnf\\s+([0-9]+)\\s+([0-9]+)\\s*");
    private final static Splitter splitter = Splitter.on(' ').trimResults().omitEmptyStrings();
    private final static Joiner spaceJoiner = Joiner.on(' ');
    private final int nVariables;
    private final ImmutableList<ImmutableList<Integer>> clauses;
    private final int nLiterals;

    public CnfInstance(int nVariables, List<? extends List<Integer>> clauses) {
        if (nVariables < 0) throw new IllegalArgumentException("negative variable count");
        this.nVariables = nVariables;
        ImmutableList.Builder<ImmutableList<Integer>> b = ImmutableList.builderWithExpectedSize(clauses.size());
        int n = 0;
        for (List<Integer> c : clauses) {
            for (int l : c) {
                if (l == 0 || l > nVariables || l < -nVariables) {
                    throw new IllegalArgumentException(String.format("literal %d outside variables 1..%d", l, nVariables));
                }
            }
            n += c.size();
            b.add(ImmutableList.copyOf(c));
        }
        this.clauses = b.build();
        this.nLiterals = n;
    }

    public int nVariables() { return nVariables; }
    public int nClauses() { return clauses.size(); }
    public int nLiterals() { return nLiterals; }
    public List<ImmutableList<Integer>> clauses() { return clauses; }
    public List<Integer> getClause(int i) { return clauses.get(i); }

    /**
     * Evaluate the boolean function represented by the clauses at the specified point.
     * @param p truth values; variable v is p[v-1]
     * @return true if every clause has a true literal
     */
    public boolean evaluate(boolean[] p) {
        if (p.length < nVariables) throw new IllegalArgumentException("assignment covers " + p.length + " of " + nVariables + " variables");
        CLAUSE:
        for (List<Integer> clause : clauses) {
            for (int l : clause) {
                if (p[Math.abs(l) - 1] == (l > 0)) continue CLAUSE;
            }
            return false;
        }
        return true;
    }

    public void writeDimacs(Writer w) throws IOException {
        w.write("p cnf " + nVariables + ' ' + clauses.size() + '\n');
        for (List<Integer> c : clauses) {
            if (!c.isEmpty()) {
                spaceJoiner.appendTo(w, c);
                w.write(' ');
            }
            w.write("0\n");
        }
    }

    public String toDimacs() {
        StringWriter w = new StringWriter();
        try {
            writeDimacs(w);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return w.toString();
    }

    public static CnfInstance parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    /**
     * Parse DIMACS CNF. Comment lines begin with 'c'. An empty clause (a bare 0) is allowed
     * and makes the instance unsatisfiable.
     */
    public static CnfInstance parseFrom(Reader r) {
        List<Integer> literals = new ArrayList<>();
        List<List<Integer>> clauses = new ArrayList<>();
        Iterator<String> ls = new BufferedReader(r).lines().filter(s -> !s.startsWith("c")).iterator();
        if (!ls.hasNext()) throw new IllegalArgumentException("Missing SAT instance data");
        Matcher m = pLineRe.matcher(ls.next());
        if (!m.matches()) throw new IllegalArgumentException("invalid p line");
        int nVar = Integer.parseInt(m.group(1));
        int nClause = Integer.parseInt(m.group(2));
        ls.forEachRemaining(line -> StreamSupport.stream(splitter.split(line).spliterator(), false)
                .mapToInt(Integer::parseInt)
                .forEach(l -> {
                    if (l == 0) {
                        clauses.add(new ArrayList<>(literals));
                        literals.clear();
                    } else {
                        if (l > nVar || l < -nVar) throw new IllegalArgumentException("literal out of declared bounds");
                        literals.add(l);
                    }
                }));
        if (!literals.isEmpty()) throw new IllegalArgumentException("Unterminated final clause");
        if (clauses.size() != nClause) {
            throw new IllegalArgumentException("Observed clause count disagrees with DIMACS p header");
        }
        return new CnfInstance(nVar, clauses);
    }

    @Override
    public String toString() {
        return String.format("CNF(%d variables, %d clauses, %d literals)", nVariables, clauses.size(), nLiterals);
    }
}
