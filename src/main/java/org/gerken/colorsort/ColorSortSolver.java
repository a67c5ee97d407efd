package org.gerken.colorsort;

import org.gerken.colorsort.logic.FlaskSolver;
import org.gerken.colorsort.logic.ParsedPuzzle;
import org.gerken.colorsort.logic.ProgressReporter;
import org.gerken.colorsort.logic.PuzzleParser;
import org.gerken.colorsort.logic.SearchStatistics;
import org.gerken.colorsort.logic.SolvingMethod;
import org.gerken.colorsort.model.Layout;
import org.gerken.colorsort.model.Move;
import org.gerken.colorsort.model.Solution;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Main class for the Color Sort Solver.
 * Finds a sequence of pours that leaves every flask empty or full with a single color.
 *
 * Architecture:
 * - The puzzle is solved on a dedicated worker thread, one solve per run
 * - The main thread waits for the result with a time limit
 * - Empty flasks are added one at a time until the puzzle becomes solvable
 * - Progress reporter provides periodic status updates
 *
 * Usage:
 *   java ColorSortSolver [-m <method>] [-r <seconds>] <puzzle-file>
 *
 * Examples:
 *   java ColorSortSolver puzzle.txt
 *   java ColorSortSolver -m shortest --max-empty 4 puzzle.txt
 */
public class ColorSortSolver {

    private static final int DEFAULT_REPORT_INTERVAL = 10; // seconds
    private static final int DEFAULT_DURATION_SECONDS = 120 * 60;

    /**
     * Main entry point for the solver.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        Config config = parseArguments(args);

        if (config == null) {
            printUsage();
            System.exit(1);
        }

        System.exit(run(config));
    }

    /**
     * Loads, solves and prints the puzzle named in the configuration.
     *
     * @param config the parsed command-line configuration
     * @return exit code: 0 = solution found, 1 = no solution, time limit reached or error
     */
    static int run(Config config) {
        printHeader(config);

        ParsedPuzzle puzzle;
        try {
            System.out.println("Loading puzzle from: " + config.puzzleFile);
            puzzle = PuzzleParser.parse(config.puzzleFile);
        } catch (IOException e) {
            System.err.println("Error reading puzzle file: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            System.err.println("Error in puzzle file: " + e.getMessage());
            return 1;
        }

        SolvingMethod method = config.method != null ? config.method : puzzle.getMethod();
        Layout layout = puzzle.toLayout();
        System.out.println("Puzzle loaded successfully.");
        System.out.println("Flasks: " + layout.getFlaskCount() + ", capacity: " + layout.getCapacity());
        System.out.println("Method: " + method);
        System.out.println(layout.toString(puzzle.getColorNames()));
        System.out.println();

        SearchStatistics statistics = new SearchStatistics();
        FlaskSolver solver;
        try {
            solver = new FlaskSolver(puzzle.getCapacity(), config.minEmptyFlasks, config.maxEmptyFlasks, statistics);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        Solution solution = solve(solver, puzzle, method, config);
        if (solution == null) {
            return 1;
        }

        if (solution.isFound()) {
            printSolution(solution, puzzle, config.puzzleFile);
            return 0;
        }
        System.out.println("No solution found with up to " + solution.getEmptyFlaskCount() + " empty flasks.");
        return 1;
    }

    /**
     * Solves the puzzle on a dedicated worker thread, waiting at most the configured duration.
     *
     * @return the solution, or null if the time limit was reached or solving failed
     */
    private static Solution solve(FlaskSolver solver, ParsedPuzzle puzzle, SolvingMethod method, Config config) {
        ExecutorService worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "color-sort-solver");
            thread.setDaemon(true);
            return thread;
        });

        // Create and start progress reporter thread (unless disabled)
        ProgressReporter reporter = null;
        if (config.reportInterval > 0) {
            reporter = new ProgressReporter(solver.getStatistics(), config.reportInterval);
            Thread reporterThread = new Thread(reporter, "progress-reporter");
            reporterThread.setDaemon(true);
            reporterThread.start();
        }

        System.out.println("Search started (will run for at most " + formatSeconds(config.durationSeconds) + ")...\n");

        Solution solution = null;
        try {
            CompletableFuture<Solution> future = solver.solveAsync(puzzle.getLayersMatrix(), method, worker);
            solution = future.get(config.durationSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            // The search has no cancellation point; the daemon worker is abandoned and dies with the JVM
            System.out.println("\nTime limit reached without a solution.");
        } catch (ExecutionException e) {
            System.err.println("Error solving puzzle: " + e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            worker.shutdownNow();
            if (reporter != null) {
                reporter.stop();
                reporter.printFinalSummary(solution != null && solution.isFound());
            }
        }
        return solution;
    }

    /**
     * Prints the solution (sequence of moves) to console and writes it to a solution file.
     * If puzzle file is "name.txt", solution file will be "name.solution.txt".
     *
     * @param solution the solution
     * @param puzzle the solved puzzle
     * @param puzzleFile the puzzle file path (used to derive solution file path)
     */
    private static void printSolution(Solution solution, ParsedPuzzle puzzle, String puzzleFile) {
        List<Move> moves = solution.getMoves();
        List<String> colorNames = puzzle.getColorNames();

        System.out.println("\nSOLUTION FOUND!");
        System.out.println("Empty flasks needed: " + solution.getEmptyFlaskCount());
        System.out.println("Number of moves: " + moves.size());
        System.out.println("\nMove sequence:");

        for (int i = 0; i < moves.size(); i++) {
            System.out.printf("%3d. %s%n", i + 1, moves.get(i).getNotation());
        }

        // Write solution to file
        String solutionFile = getSolutionFilePath(puzzleFile);
        try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(Path.of(solutionFile), StandardCharsets.UTF_8))) {
            writer.println("# Color Sort Puzzle Solution");
            writer.println("# Puzzle: " + puzzleFile);
            writer.println("# Empty flasks: " + solution.getEmptyFlaskCount());
            writer.println("# Moves: " + moves.size());
            writer.println();

            // Section 1: Move sequence
            writer.println("Move sequence:");
            for (int i = 0; i < moves.size(); i++) {
                writer.printf("%3d. %s%n", i + 1, moves.get(i).getNotation());
            }

            // Section 2: Moves with layouts
            writer.println();
            writer.println("=".repeat(60));
            writer.println("Step-by-step layouts:");
            writer.println("=".repeat(60));

            Layout current = puzzle.toLayout().withEmptyFlasks(solution.getEmptyFlaskCount());
            writer.println();
            writer.println("Initial state:");
            writer.println(current.toString(colorNames));

            for (int i = 0; i < moves.size(); i++) {
                Move move = moves.get(i);
                current = current.applyMove(move);

                writer.println();
                writer.printf("After move %d: %s%n", i + 1, move.getNotation());
                writer.println(current.toString(colorNames));
            }

            System.out.println("\nSolution written to: " + solutionFile);
        } catch (IOException e) {
            System.err.println("Warning: Could not write solution file: " + e.getMessage());
        }
    }

    /**
     * Computes the solution file path for a given puzzle file.
     * If puzzle file is "name.txt", solution file is "name.solution.txt".
     *
     * @param puzzleFile the puzzle file path
     * @return the solution file path
     */
    static String getSolutionFilePath(String puzzleFile) {
        if (puzzleFile.endsWith(".txt")) {
            return puzzleFile.substring(0, puzzleFile.length() - 4) + ".solution.txt";
        }
        return puzzleFile + ".solution.txt";
    }

    /**
     * Parses command-line arguments.
     *
     * @return the configuration, or null if the arguments are invalid or help was requested
     */
    static Config parseArguments(String[] args) {
        Config config = new Config();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];

            if (arg.equals("-m") || arg.equals("--method")) {
                if (i + 1 >= args.length) {
                    System.err.println("Error: " + arg + " requires a value");
                    return null;
                }
                try {
                    config.method = SolvingMethod.fromName(args[++i]);
                } catch (IllegalArgumentException e) {
                    System.err.println("Error: " + e.getMessage());
                    return null;
                }
            } else if (arg.equals("--min-empty") || arg.equals("--max-empty")) {
                if (i + 1 >= args.length) {
                    System.err.println("Error: " + arg + " requires a value");
                    return null;
                }
                int value;
                try {
                    value = Integer.parseInt(args[++i]);
                } catch (NumberFormatException e) {
                    System.err.println("Error: invalid empty flask count: " + args[i]);
                    return null;
                }
                if (value < 0) {
                    System.err.println("Error: empty flask count must be non-negative");
                    return null;
                }
                if (arg.equals("--min-empty")) {
                    config.minEmptyFlasks = value;
                } else {
                    config.maxEmptyFlasks = value;
                }
            } else if (arg.equals("-r") || arg.equals("--report")) {
                if (i + 1 >= args.length) {
                    System.err.println("Error: " + arg + " requires a value");
                    return null;
                }
                try {
                    config.reportInterval = Integer.parseInt(args[++i]);
                    if (config.reportInterval < 0) {
                        System.err.println("Error: report interval must be non-negative (0 to disable)");
                        return null;
                    }
                } catch (NumberFormatException e) {
                    System.err.println("Error: invalid report interval: " + args[i]);
                    return null;
                }
            } else if (arg.equals("-dur") || arg.equals("--duration")) {
                if (i + 1 >= args.length) {
                    System.err.println("Error: " + arg + " requires a value");
                    return null;
                }
                String durationStr = args[++i];
                long durationSeconds = parseDuration(durationStr);
                if (durationSeconds < 1) {
                    System.err.println("Error: invalid duration: " + durationStr);
                    return null;
                }
                config.durationSeconds = durationSeconds;
            } else if (arg.equals("-h") || arg.equals("--help")) {
                return null; // Will trigger usage message
            } else if (arg.startsWith("-")) {
                System.err.println("Error: unknown option: " + arg);
                return null;
            } else {
                // Assume it's the puzzle file
                if (config.puzzleFile != null) {
                    System.err.println("Error: multiple puzzle files specified");
                    return null;
                }
                config.puzzleFile = arg;
            }
        }

        if (config.puzzleFile == null) {
            System.err.println("Error: no puzzle file specified");
            return null;
        }
        if (config.maxEmptyFlasks < config.minEmptyFlasks) {
            System.err.println("Error: --max-empty must not be less than --min-empty");
            return null;
        }

        return config;
    }

    /**
     * Parses a duration string with optional time unit suffix.
     * Supported units: s (seconds), m (minutes, default), h (hours), d (days).
     * Examples: "30" = 30 minutes, "45s" = 45 seconds, "2h" = 2 hours.
     *
     * @param durationStr the duration string to parse
     * @return duration in seconds, or -1 if parsing fails
     */
    static long parseDuration(String durationStr) {
        if (durationStr == null || durationStr.isEmpty()) {
            return -1;
        }

        // Find where the number ends and the unit begins
        int unitStart = durationStr.length();
        for (int i = 0; i < durationStr.length(); i++) {
            if (!Character.isDigit(durationStr.charAt(i))) {
                unitStart = i;
                break;
            }
        }

        String numberPart = durationStr.substring(0, unitStart);
        String unitPart = durationStr.substring(unitStart).toLowerCase();
        if (numberPart.isEmpty()) {
            return -1;
        }

        long value;
        try {
            value = Long.parseLong(numberPart);
        } catch (NumberFormatException e) {
            return -1;
        }

        switch (unitPart) {
            case "":
            case "m":
                return value * 60;
            case "s":
                return value;
            case "h":
                return value * 60 * 60;
            case "d":
                return value * 60 * 60 * 24;
            default:
                return -1;
        }
    }

    private static String formatSeconds(long seconds) {
        if (seconds % 60 != 0) {
            return seconds + " seconds";
        }
        return (seconds / 60) + " minutes";
    }

    /**
     * Prints usage information.
     */
    private static void printUsage() {
        System.out.println("Color Sort Solver");
        System.out.println();
        System.out.println("Usage: java -jar color-sort-solver.jar [options] <puzzle-file>");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  -m, --method <name>   fastest, balanced or shortest (default: from puzzle file, else fastest)");
        System.out.println("  --min-empty <N>       First number of empty flasks to try (default: " + FlaskSolver.DEFAULT_MIN_EMPTY_FLASKS + ")");
        System.out.println("  --max-empty <N>       Last number of empty flasks to try (default: " + FlaskSolver.DEFAULT_MAX_EMPTY_FLASKS + ")");
        System.out.println("  -r, --report <N>      Progress report interval in seconds (default: " + DEFAULT_REPORT_INTERVAL + ", 0 to disable)");
        System.out.println("  -dur, --duration <N>  Time limit with optional unit suffix (default: 120m)");
        System.out.println("                        Units: s (seconds), m (minutes), h (hours), d (days)");
        System.out.println("  -h, --help            Show this help message");
        System.out.println();
        System.out.println("Example:");
        System.out.println("  java -jar color-sort-solver.jar -m balanced --max-empty 2 puzzle.txt");
    }

    /**
     * Prints application header.
     */
    private static void printHeader(Config config) {
        System.out.println("=".repeat(80));
        System.out.println("Color Sort Solver");
        System.out.println("=".repeat(80));
        System.out.println("Configuration:");
        System.out.println("  Method: " + (config.method != null ? config.method : "from puzzle file"));
        System.out.println("  Empty flasks: " + config.minEmptyFlasks + " to " + config.maxEmptyFlasks);
        System.out.println("  Report interval: " + (config.reportInterval > 0 ? config.reportInterval + " seconds" : "disabled"));
        System.out.println("  Duration: " + formatSeconds(config.durationSeconds));
        System.out.println("=".repeat(80));
        System.out.println();
    }

    /**
     * Configuration holder.
     */
    static class Config {
        String puzzleFile;
        SolvingMethod method;
        int minEmptyFlasks = FlaskSolver.DEFAULT_MIN_EMPTY_FLASKS;
        int maxEmptyFlasks = FlaskSolver.DEFAULT_MAX_EMPTY_FLASKS;
        int reportInterval = DEFAULT_REPORT_INTERVAL;
        long durationSeconds = DEFAULT_DURATION_SECONDS;
    }
}
