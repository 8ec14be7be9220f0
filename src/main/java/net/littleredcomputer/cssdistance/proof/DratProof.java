package net.littleredcomputer.cssdistance.proof;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A clausal refutation in DRAT form: a sequence of lemma additions and deletions.
 *
 * <p>Two encodings are understood, as documented for drat-trim. In the text form each lemma
 * is a line of DIMACS literals ending in 0, deletions prefixed with "d". In the binary form
 * each lemma starts with the byte 'a' (0x61) or 'd' (0x64), followed by its literals, each
 * mapped to the unsigned number 2·|l| + (l &lt; 0 ? 1 : 0) and written seven bits at a time,
 * least significant group first, with the high bit set on every byte but the last; a zero
 * byte ends the lemma.
 */
public final class DratProof {
    private static final Splitter splitter = Splitter.onPattern("\\s+").omitEmptyStrings();
    private static final Joiner spaceJoiner = Joiner.on(' ');
    private static final int ADD = 'a';
    private static final int DELETE = 'd';

    public static final class Lemma {
        private final boolean deletion;
        private final ImmutableList<Integer> literals;

        public Lemma(boolean deletion, List<Integer> literals) {
            for (int l : literals) if (l == 0) throw new IllegalArgumentException("0 is not a literal");
            this.deletion = deletion;
            this.literals = ImmutableList.copyOf(literals);
        }

        public static Lemma add(Integer... literals) { return new Lemma(false, ImmutableList.copyOf(literals)); }
        public static Lemma delete(Integer... literals) { return new Lemma(true, ImmutableList.copyOf(literals)); }

        public boolean isDeletion() { return deletion; }
        public List<Integer> literals() { return literals; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Lemma lemma = (Lemma) o;
            return deletion == lemma.deletion && literals.equals(lemma.literals);
        }

        @Override
        public int hashCode() { return Objects.hash(deletion, literals); }

        @Override
        public String toString() {
            return (deletion ? "d " : "") + (literals.isEmpty() ? "" : spaceJoiner.join(literals) + ' ') + '0';
        }
    }

    private final ImmutableList<Lemma> lemmas;

    public DratProof(List<Lemma> lemmas) {
        this.lemmas = ImmutableList.copyOf(lemmas);
    }

    public List<Lemma> lemmas() { return lemmas; }
    public int size() { return lemmas.size(); }

    /**
     * @return true if the proof derives the empty clause explicitly
     */
    public boolean derivesEmptyClause() {
        return lemmas.stream().anyMatch(l -> !l.isDeletion() && l.literals().isEmpty());
    }

    public static DratProof parse(String s) {
        return parse(new StringReader(s));
    }

    /**
     * Parse the text form. Lines beginning with 'c' are comments.
     */
    public static DratProof parse(Reader r) {
        List<Lemma> lemmas = new ArrayList<>();
        List<Integer> literals = new ArrayList<>();
        boolean deletion = false;
        boolean pending = false;
        for (String line : (Iterable<String>) new BufferedReader(r).lines()::iterator) {
            if (line.startsWith("c")) continue;
            for (String token : splitter.split(line)) {
                if (token.equals("d")) {
                    if (pending) throw new IllegalArgumentException("'d' in the middle of a lemma");
                    deletion = true;
                    pending = true;
                    continue;
                }
                int l;
                try {
                    l = Integer.parseInt(token);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("invalid token in DRAT proof: " + token, e);
                }
                if (l == 0) {
                    lemmas.add(new Lemma(deletion, literals));
                    literals.clear();
                    deletion = false;
                    pending = false;
                } else {
                    literals.add(l);
                    pending = true;
                }
            }
        }
        if (pending) throw new IllegalArgumentException("Unterminated final lemma");
        return new DratProof(lemmas);
    }

    /**
     * Parse the binary form.
     */
    public static DratProof parseBinary(byte[] bytes) {
        List<Lemma> lemmas = new ArrayList<>();
        int i = 0;
        while (i < bytes.length) {
            int kind = bytes[i++] & 0xff;
            if (kind != ADD && kind != DELETE) {
                throw new IllegalArgumentException(String.format("byte %d: expected 'a' or 'd', found 0x%02x", i - 1, kind));
            }
            List<Integer> literals = new ArrayList<>();
            while (true) {
                long u = 0;
                int shift = 0;
                int b;
                do {
                    if (i >= bytes.length) throw new IllegalArgumentException("truncated binary DRAT lemma");
                    if (shift > 28) throw new IllegalArgumentException("literal too large at byte " + i);
                    b = bytes[i++] & 0xff;
                    u |= (long) (b & 0x7f) << shift;
                    shift += 7;
                } while ((b & 0x80) != 0);
                if (u == 0) break;
                int v = (int) (u >> 1);
                literals.add((u & 1) == 1 ? -v : v);
            }
            lemmas.add(new Lemma(kind == DELETE, literals));
        }
        return new DratProof(lemmas);
    }

    /**
     * Parse either form. Like drat-trim, the decision looks at the leading bytes: text proofs
     * contain only digits, '-', 'd', 'c' comment lines and white space there.
     */
    public static DratProof read(byte[] bytes) {
        return isBinary(bytes) ? parseBinary(bytes) : parse(new String(bytes, StandardCharsets.US_ASCII));
    }

    static boolean isBinary(byte[] bytes) {
        if (bytes.length == 0) return false;
        if (bytes[0] == 'c') return false;
        for (int i = 0; i < Math.min(bytes.length, 10); ++i) {
            int b = bytes[i] & 0xff;
            boolean text = (b >= '0' && b <= '9') || b == '-' || b == 'd' || b == ' ' || b == '\n' || b == '\r' || b == '\t';
            if (!text) return true;
        }
        return false;
    }

    public void writeText(Writer w) throws IOException {
        for (Lemma l : lemmas) {
            w.write(l.toString());
            w.write('\n');
        }
    }

    public String toText() {
        StringWriter w = new StringWriter();
        try {
            writeText(w);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return w.toString();
    }

    public byte[] toBinary() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Lemma l : lemmas) {
            out.write(l.isDeletion() ? DELETE : ADD);
            for (int literal : l.literals()) {
                long u = 2L * Math.abs((long) literal) + (literal < 0 ? 1 : 0);
                while (u > 0x7f) {
                    out.write((int) (u & 0x7f) | 0x80);
                    u >>>= 7;
                }
                out.write((int) u);
            }
            out.write(0);
        }
        return out.toByteArray();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return lemmas.equals(((DratProof) o).lemmas);
    }

    @Override
    public int hashCode() { return lemmas.hashCode(); }

    @Override
    public String toString() {
        return "DRAT proof with " + lemmas.size() + " lemmas";
    }
}
