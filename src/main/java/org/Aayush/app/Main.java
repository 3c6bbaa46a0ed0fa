package org.Aayush.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.Aayush.scheduling.core.ScheduleResponse;
import org.Aayush.scheduling.core.ScheduleSolver;
import org.Aayush.scheduling.core.SchedulingException;
import org.Aayush.scheduling.interval.IntervalStore;
import org.Aayush.scheduling.interval.IntervalValidationException;
import org.Aayush.scheduling.io.IntervalParseException;
import org.Aayush.scheduling.io.IntervalTextParser;
import org.Aayush.scheduling.io.ScheduleFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line entry point: reads intervals, prints the best schedule.
 *
 * <pre>
 * wis [--json] [--merge-duplicates] [FILE|-]
 * </pre>
 *
 * <p>The schedule goes to stdout; errors go to stderr prefixed with {@code Error: }.</p>
 */
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_INPUT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);
    private static final String USAGE = "usage: wis [--json] [--merge-duplicates] [FILE|-]";

    /**
     * Launches the scheduler CLI.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    /**
     * Runs the CLI against explicit streams.
     *
     * @return process exit code.
     */
    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        boolean json = false;
        boolean mergeDuplicates = false;
        String file = null;
        for (String arg : args) {
            switch (arg) {
                case "--json" -> json = true;
                case "--merge-duplicates" -> mergeDuplicates = true;
                case "-h", "--help" -> {
                    out.println(USAGE);
                    return EXIT_OK;
                }
                default -> {
                    if ((arg.startsWith("-") && !"-".equals(arg)) || file != null) {
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    file = arg;
                }
            }
        }

        try {
            IntervalStore store = readStore(file, in, new IntervalStore(mergeDuplicates));
            LOG.info("Loaded {} intervals from {}", store.size(), describe(file));

            ScheduleResponse response = new ScheduleSolver().solve(store);
            ScheduleFormatter formatter = new ScheduleFormatter();

            if (json) {
                out.println(formatter.toJson(response));
            } else {
                for (String line : formatter.toLines(response)) {
                    out.println(line);
                }
                out.println(formatter.statusLine(response));
            }
            LOG.info("Scheduled {} of {} intervals, total cost {}",
                    response.size(), response.getIntervalCount(), response.getTotalCost());
            return EXIT_OK;
        } catch (IntervalParseException | IntervalValidationException | SchedulingException ex) {
            LOG.warn("Rejected input: {}", ex.getMessage());
            err.println("Error: " + ex.getMessage());
            return EXIT_INPUT_ERROR;
        } catch (JsonProcessingException ex) {
            LOG.error("Failed to render schedule as JSON", ex);
            err.println("Error: " + ex.getOriginalMessage());
            return EXIT_INPUT_ERROR;
        } catch (IOException ex) {
            LOG.error("Failed to read input", ex);
            err.println("Error: cannot read " + describe(file) + ": " + ex.getMessage());
            return EXIT_INPUT_ERROR;
        }
    }

    private static IntervalStore readStore(String file, InputStream in, IntervalStore store) throws IOException {
        IntervalTextParser parser = new IntervalTextParser();
        if (isStdin(file)) {
            // stdin stays open; the caller owns it
            return parser.load(new InputStreamReader(in, StandardCharsets.UTF_8), store);
        }
        try (Reader reader = Files.newBufferedReader(Path.of(file), StandardCharsets.UTF_8)) {
            return parser.load(reader, store);
        }
    }

    private static boolean isStdin(String file) {
        return file == null || "-".equals(file);
    }

    private static String describe(String file) {
        return isStdin(file) ? "stdin" : file;
    }
}
