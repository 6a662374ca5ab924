package com.instaclustr.hasher.cli;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.instaclustr.hasher.TestFiles;
import com.instaclustr.hasher.jackson.JacksonModule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class HasherTest {

    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    public void testDigestsAreCompared() throws Exception {
        final Path reference = TestFiles.createFile(dir, "reference", 100, 1);
        final Path same = TestFiles.createFile(dir, "same", 100, 1);
        final Path other = TestFiles.createFile(dir, "other", 100, 2);

        assertEquals(0, execute("--no-progress", "--chunk-size", "16", reference.toString(), same.toString(), other.toString()));

        final List<String> lines = lines();

        assertTrue(lines.contains(TestFiles.sha256(reference) + "  " + reference));
        assertTrue(lines.contains(TestFiles.sha256(same) + "  " + same));
        assertTrue(lines.contains(TestFiles.sha256(other) + "  " + other));
        assertTrue(lines.contains("Compared with " + reference + ":"));
        assertTrue(lines.contains("MATCH  " + same));
        assertTrue(lines.contains("MISMATCH  " + other));
        assertFalse(lines.stream().anyMatch(line -> line.contains("%")), "progress was printed: " + lines);
    }

    @Test
    public void testProgressIsPrinted() throws Exception {
        final Path file = TestFiles.createFile(dir, "file", 64, 1);

        assertEquals(0, execute("--chunk-size", "16B", "--progress-step", "0", file.toString()));

        final List<String> lines = lines();

        assertTrue(lines.stream().anyMatch(line -> line.startsWith(progress(0, file))), "missing initial progress: " + lines);
        assertTrue(lines.stream().anyMatch(line -> line.startsWith(progress(50, file))), "missing progress: " + lines);
        assertEquals(TestFiles.sha256(file) + "  " + file, lines.get(lines.size() - 1));
    }

    @Test
    public void testEmptyFile() throws Exception {
        final Path file = Files.createFile(dir.resolve("empty"));

        assertEquals(0, execute(file.toString()));
        assertEquals(List.of(TestFiles.EMPTY_SHA256 + "  " + file), lines());
    }

    @Test
    public void testJsonOutput() throws Exception {
        final Path file = TestFiles.createFile(dir, "file", 64, 1);

        assertEquals(0, execute("--json", "--chunk-size", "16", file.toString()));

        final ObjectMapper objectMapper = JacksonModule.createObjectMapper();
        final List<String> lines = lines();

        assertEquals(1 + 4 + 1, lines.size());

        for (final String line : lines) {
            assertEquals(file.toString(), objectMapper.readTree(line).get("file").asText());
        }

        final JsonNode last = objectMapper.readTree(lines.get(lines.size() - 1)).get("state");

        assertEquals("COMPLETED", last.get("type").asText());
        assertEquals(TestFiles.sha256(file), last.get("digest").asText());
    }

    @Test
    public void testMissingFileFails() throws Exception {
        final Path file = TestFiles.createFile(dir, "file", 10, 1);
        final Path missing = dir.resolve("missing");

        assertEquals(1, execute("--no-progress", file.toString(), missing.toString()));

        assertTrue(lines().contains(TestFiles.sha256(file) + "  " + file));
        assertTrue(err.toString().contains(missing + " is not a regular file"));
    }

    @Test
    public void testInvalidArguments() throws Exception {
        final Path file = TestFiles.createFile(dir, "file", 10, 1);

        assertEquals(2, execute());
        assertEquals(2, execute("--chunk-size", "a lot", file.toString()));
        assertEquals(2, execute("--queue-capacity", "0", file.toString()));
        assertEquals(2, execute("--chunk-size", "99999999999GiB", file.toString()));
    }

    private int execute(final String... args) {
        final CommandLine commandLine = new CommandLine(new Hasher());

        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));

        return CLIApplication.execute(commandLine, args);
    }

    private List<String> lines() {
        return Arrays.stream(out.toString().split("\\R"))
            .filter(line -> !line.isEmpty())
            .collect(Collectors.toList());
    }

    private static String progress(final float percent, final Path file) {
        return String.format(Locale.ROOT, "[%6.2f%%] %s (", percent, file);
    }
}
