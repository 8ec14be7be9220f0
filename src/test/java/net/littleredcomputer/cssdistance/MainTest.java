package net.littleredcomputer.cssdistance;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertThat;

public class MainTest {
    @Rule public TemporaryFolder folder = new TemporaryFolder();

    private static List<String> run(String... args) throws Exception {
        PrintStream saved = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8.name()));
        try {
            Main.main(args);
        } finally {
            System.out.flush();
            System.setOut(saved);
        }
        return Arrays.asList(new String(buffer.toByteArray(), StandardCharsets.UTF_8).split("\n"));
    }

    private File matrix(String name, String text) throws Exception {
        File f = folder.newFile(name);
        Files.write(f.toPath(), text.getBytes(StandardCharsets.US_ASCII));
        return f;
    }

    @Test
    public void distanceOfACannedCode() throws Exception {
        assertThat(run("-task", "distance", "-code", "steane"), hasItem("d 3"));
    }

    @Test
    public void bothHonoursTheBound() throws Exception {
        // Nothing lies below 3, so neither search produces a witness line.
        List<String> out = run("-task", "distance", "-code", "steane", "-both", "-bound", "3");
        assertThat(out, hasItem("d 3"));
        assertThat(out, not(hasItem(startsWith("v "))));
    }

    @Test
    public void bothWithoutABound() throws Exception {
        List<String> out = run("-task", "distance", "-code", "hgp4,3", "-both");
        assertThat(out, hasItem("d 3"));
        assertThat(out, hasItem(startsWith("v ")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void bothAndDualConflict() throws Exception {
        run("-task", "distance", "-code", "steane", "-both", "-dual");
    }

    @Test
    public void matrixFiles() throws Exception {
        String h = "c Hamming checks\n0001111\n0110011\n1010101\n";
        File hx = matrix("hx.txt", h);
        File hz = matrix("hz.txt", h);
        assertThat(run("-task", "query", "-hx", hx.getPath(), "-hz", hz.getPath(), "-bound", "2"), hasItem("s UNSATISFIABLE"));
    }

    @Test(expected = CodeConfigurationException.class)
    public void raggedMatrixFile() throws Exception {
        File hx = matrix("hx.txt", "0001111\n011001\n1010101\n");
        File hz = matrix("hz.txt", "0001111\n0110011\n1010101\n");
        run("-task", "distance", "-hx", hx.getPath(), "-hz", hz.getPath());
    }

    @Test(expected = CodeConfigurationException.class)
    public void nonBitMatrixFile() throws Exception {
        File hx = matrix("hx.txt", "0001112\n");
        File hz = matrix("hz.txt", "0001111\n");
        run("-task", "distance", "-hx", hx.getPath(), "-hz", hz.getPath());
    }
}
