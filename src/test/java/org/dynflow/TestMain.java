package org.dynflow;

import org.dynflow.analysis.DependencyRecord;
import org.dynflow.analysis.RecordFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestMain {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return Main.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content, StandardCharsets.UTF_8);
    }

    @Test
    public void testUsage() {
        assertEquals(1, run());
        assertEquals(1, run("only-one"));
        assertEquals(1, run("a", "b", "c"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage"));
    }

    @Test
    public void testTextOutput() throws IOException {
        Path src = write("p.py", "a = 1\nb = a\nc = b + a\nprint(c)\n");
        Path dst = dir.resolve("out.txt");
        assertEquals(0, run(src.toString(), dst.toString()));
        assertEquals("3,1,b,a\n4,1,c,a\n4,1,c,b\n", Files.readString(dst));
        assertEquals("2\n", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    public void testJsonOutput() throws IOException {
        Path src = write("p.py", "a = 1\nb = a\nc = b\n");
        Path dst = dir.resolve("out.json");
        assertEquals(0, run("--json", src.toString(), dst.toString()));
        assertEquals(List.of(new DependencyRecord(3, 1, "b", "a")), RecordFormat.fromJson(Files.readString(dst)));
    }

    @Test
    public void testOutputWrittenWhenProgramFails() throws IOException {
        Path src = write("p.py", "a = 1\nb = a\nc = b\nd = missing\n");
        Path dst = dir.resolve("out.txt");
        assertEquals(3, run(src.toString(), dst.toString()));
        assertEquals("3,1,b,a\n", Files.readString(dst));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("NameError"));
    }

    @Test
    public void testSyntaxError() throws IOException {
        Path src = write("p.py", "x = = 1\n");
        Path dst = dir.resolve("out.txt");
        assertEquals(2, run(src.toString(), dst.toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("SyntaxError"));
        assertFalse(Files.exists(dst));
    }

    @Test
    public void testMissingSource() {
        assertEquals(1, run(dir.resolve("nope.py").toString(), dir.resolve("out.txt").toString()));
    }

    @Test
    public void testInvalidConfiguration() throws IOException {
        Path src = write("p.py", "a = 1\n");
        Path dst = dir.resolve("out.txt");
        System.setProperty("dynflow.maxCallDepth", "deep");
        try {
            assertEquals(1, run(src.toString(), dst.toString()));
        } finally {
            System.clearProperty("dynflow.maxCallDepth");
        }
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("maxCallDepth"));
        assertFalse(Files.exists(dst));
    }
}
