package org.Aayush.scheduling.io;

import org.Aayush.scheduling.interval.IntervalStore;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads intervals written one per line as {@code start finish weight}.
 *
 * <p>Everything after {@code #} is a comment; blank lines are skipped. Numbers
 * are decimal literals as accepted by {@link Double#parseDouble}, with the
 * named specials ({@code NaN}, {@code Infinity}) passed through so the store
 * reports them as validation failures instead of parse failures.</p>
 */
public final class IntervalTextParser {
    public static final String REASON_FIELD_COUNT = "WIS_PARSE_FIELD_COUNT";
    public static final String REASON_NOT_A_NUMBER = "WIS_PARSE_NOT_A_NUMBER";

    private static final char COMMENT = '#';
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    // Rejects Java-only forms such as "1d", "0x1p3" or "2f".
    private static final Pattern DECIMAL = Pattern.compile(
            "[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?|[+-]?(Infinity|NaN)");

    /**
     * One parsed line.
     *
     * @param lineNumber 1-based source line.
     */
    public record ParsedTriple(int lineNumber, double start, double finish, double weight) {
    }

    /**
     * Parses every line, failing on the first malformed one.
     */
    public List<ParsedTriple> parse(List<String> lines) {
        List<ParsedTriple> triples = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            ParsedTriple triple = parseLine(lines.get(i), i + 1);
            if (triple != null) {
                triples.add(triple);
            }
        }
        return triples;
    }

    /**
     * Parses all lines from a reader.
     *
     * @throws IOException when reading fails.
     */
    public List<ParsedTriple> parse(Reader reader) throws IOException {
        List<String> lines = new ArrayList<>();
        BufferedReader buffered = reader instanceof BufferedReader
                ? (BufferedReader) reader
                : new BufferedReader(reader);
        String line;
        while ((line = buffered.readLine()) != null) {
            lines.add(line);
        }
        return parse(lines);
    }

    /**
     * Reads all text from a reader and feeds it into a store, labelling each
     * triple with its line.
     *
     * <p>Parsing completes before the first add, so a malformed line never
     * leaves a partially filled store.</p>
     *
     * @throws IOException when reading fails.
     * @throws IntervalParseException on the first malformed line.
     * @throws org.Aayush.scheduling.interval.IntervalValidationException on the first invalid interval.
     */
    public IntervalStore load(Reader reader, IntervalStore store) throws IOException {
        for (ParsedTriple triple : parse(reader)) {
            store.add(triple.start(), triple.finish(), triple.weight(), "line " + triple.lineNumber());
        }
        return store;
    }

    /**
     * Parses one line.
     *
     * @return parsed triple, or {@code null} for blank and comment-only lines.
     */
    ParsedTriple parseLine(String line, int lineNumber) {
        String content = stripComment(line).strip();
        if (content.isEmpty()) {
            return null;
        }
        String[] fields = WHITESPACE.split(content);
        if (fields.length != 3) {
            throw new IntervalParseException(
                    REASON_FIELD_COUNT,
                    lineNumber,
                    "expected 3 fields (start finish weight), got " + fields.length
            );
        }
        return new ParsedTriple(
                lineNumber,
                parseNumber(fields[0], "start", lineNumber),
                parseNumber(fields[1], "finish", lineNumber),
                parseNumber(fields[2], "weight", lineNumber)
        );
    }

    private static String stripComment(String line) {
        int comment = line.indexOf(COMMENT);
        return comment < 0 ? line : line.substring(0, comment);
    }

    private static double parseNumber(String field, String name, int lineNumber) {
        if (!DECIMAL.matcher(field).matches()) {
            throw new IntervalParseException(REASON_NOT_A_NUMBER, lineNumber, name + " is not a number: " + field);
        }
        return Double.parseDouble(field);
    }
}
