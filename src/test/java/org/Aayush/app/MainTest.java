package org.Aayush.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CLI Tests")
class MainTest {

    private record Result(int exitCode, String out, String err) {
    }

    private static Result run(String input, String... args) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int exitCode = Main.run(
                args,
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8)
        );
        return new Result(
                exitCode,
                out.toString(StandardCharsets.UTF_8),
                err.toString(StandardCharsets.UTF_8)
        );
    }

    @Test
    @DisplayName("Reads stdin and prints schedule plus status line")
    void testStdinTextOutput() {
        Result result = run("# demo\n10 20 2\n20 30 2\n\n15 25 1\n");

        assertEquals(Main.EXIT_OK, result.exitCode());
        String[] lines = result.out().strip().split("\\R");
        assertArrayEquals(new String[]{"10 20 2", "20 30 2", "Total cost is 4, using 2 intervals."}, lines);
        assertTrue(result.err().isEmpty());
    }

    @Test
    @DisplayName("Reads a file argument")
    void testFileInput(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("intervals.txt");
        Files.writeString(file, "10 20 1\n15 25 5\n");

        Result result = run("", file.toString());
        assertEquals(Main.EXIT_OK, result.exitCode());
        assertTrue(result.out().contains("15 25 5"));
        assertTrue(result.out().contains("Total cost is 5, using 1 interval."));
    }

    @Test
    @DisplayName("Empty input is a valid empty schedule")
    void testEmptyInput() {
        Result result = run("# nothing here\n");
        assertEquals(Main.EXIT_OK, result.exitCode());
        assertEquals("Total cost is 0, using 0 intervals.", result.out().strip());
    }

    @Test
    @DisplayName("JSON output with duplicate merging")
    void testJsonMergeDuplicates() throws Exception {
        Result merged = run("0 10 1\n0 10 3\n", "--json", "--merge-duplicates");
        assertEquals(Main.EXIT_OK, merged.exitCode());
        JsonNode root = new ObjectMapper().readTree(merged.out());
        assertEquals(1, root.get("intervalCount").asInt());
        assertEquals(3.0, root.get("totalCost").asDouble());

        Result plain = run("0 10 1\n0 10 3\n", "--json");
        assertEquals(2, new ObjectMapper().readTree(plain.out()).get("intervalCount").asInt());
    }

    @Test
    @DisplayName("Invalid interval reports reason and line on stderr")
    void testValidationError() {
        Result result = run("0 1 1\n10 5 1\n");
        assertEquals(Main.EXIT_INPUT_ERROR, result.exitCode());
        assertTrue(result.out().isEmpty());
        assertTrue(result.err().startsWith("Error: [WIS_NON_POSITIVE_DURATION] line 2"), result.err());
    }

    @Test
    @DisplayName("Malformed line reports a parse error")
    void testParseError() {
        Result result = run("1 2\n");
        assertEquals(Main.EXIT_INPUT_ERROR, result.exitCode());
        assertTrue(result.err().startsWith("Error: [WIS_PARSE_FIELD_COUNT] line 1"), result.err());
    }

    @Test
    @DisplayName("Missing file is an input error")
    void testMissingFile(@TempDir Path dir) {
        Result result = run("", dir.resolve("absent.txt").toString());
        assertEquals(Main.EXIT_INPUT_ERROR, result.exitCode());
        assertTrue(result.err().startsWith("Error: cannot read"));
    }

    @Test
    @DisplayName("Unknown option prints usage")
    void testUsage() {
        Result result = run("", "--bogus");
        assertEquals(Main.EXIT_USAGE, result.exitCode());
        assertTrue(result.err().startsWith("usage:"));

        assertEquals(Main.EXIT_USAGE, run("", "-x").exitCode());
        assertEquals(Main.EXIT_OK, run("", "--help").exitCode());
        assertEquals(Main.EXIT_OK, run("1 2 3\n", "-").exitCode());
        assertEquals(Main.EXIT_USAGE, run("", "a.txt", "b.txt").exitCode());
    }

    @Test
    @DisplayName("Edge budget from system properties is reported as an input error")
    void testEdgeBudgetError() {
        String previous = System.getProperty("wis.solver.maxEdges");
        try {
            System.setProperty("wis.solver.maxEdges", "1");
            Result result = run("0 1 1\n1 2 1\n2 3 1\n");
            assertEquals(Main.EXIT_INPUT_ERROR, result.exitCode());
            assertTrue(result.err().startsWith("Error: [WIS_EDGE_BUDGET_EXCEEDED]"), result.err());
        } finally {
            if (previous == null) {
                System.clearProperty("wis.solver.maxEdges");
            } else {
                System.setProperty("wis.solver.maxEdges", previous);
            }
        }
    }
}
