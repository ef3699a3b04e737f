package io.github.eutro.scriptlift.api;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CliTest {
    @TempDir
    Path dir;

    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    final ByteArrayOutputStream err = new ByteArrayOutputStream();

    int run(String... args) throws IOException {
        try (PrintStream o = new PrintStream(out, true, "UTF-8");
             PrintStream e = new PrintStream(err, true, "UTF-8")) {
            return Cli.run(args, o, e);
        }
    }

    String out() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    String err() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8);
    }

    Path script(String name, String text) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, text.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    void testHelp() throws IOException {
        assertEquals(0, run("--help"));
        assertTrue(out().startsWith("usage: scriptlift"));
    }

    @Test
    void testNoFiles() throws IOException {
        assertEquals(1, run());
        assertTrue(err().startsWith("usage: scriptlift"));
    }

    @Test
    void testUnknownFlag() throws IOException {
        assertEquals(1, run("--frobnicate"));
        assertTrue(err().contains("--frobnicate: unknown flag"));
    }

    @Test
    void testBadIterations() throws IOException {
        assertEquals(1, run("--max-iterations", "zero", "x.lua"));
        assertEquals(1, run("--max-iterations"));
    }

    @Test
    void testDecompileFile() throws IOException {
        Path file = script("main.lua", "local x = \"hi\"\nprint(x)\nreturn x");
        assertEquals(0, run("--cfg", "--dot", "--liveness", file.toString()));
        String output = out();
        assertTrue(output.startsWith("var0 = var0\nlocal var0 = constant0\nfunc()\nreturn result\n"), output);
        assertTrue(output.contains("B0 [0000-000c] entry exit -> (none)"), output);
        assertTrue(output.contains("digraph cfg {"), output);
        assertTrue(output.contains("B0 def="), output);
    }

    @Test
    void testMissingFile() throws IOException {
        Path ok = script("ok.lua", "print(1)");
        assertEquals(1, run(dir.resolve("missing.lua").toString(), ok.toString()));
        assertTrue(err().contains("could not read file"));
        assertTrue(out().contains("-- " + ok));
        assertTrue(out().contains("func()"));
    }

    @Test
    void testNothingExtracted() throws IOException {
        Path file = script("empty.lua", "");
        assertEquals(0, run("--", file.toString()));
        assertEquals("-- no instructions available", out().trim());
    }
}
