package org.gerken.colorsort.logic;

import java.io.PrintStream;

/**
 * Periodically reports progress during the solving process.
 * Runs as a background thread and outputs statistics at configurable intervals.
 */
public class ProgressReporter implements Runnable {

    private final SearchStatistics statistics;
    private final long reportIntervalMs;
    private final PrintStream out;
    private final long startTime;
    private volatile boolean stopped;

    /**
     * Creates a new progress reporter printing to standard output.
     *
     * @param statistics the statistics of the running search
     * @param reportIntervalSeconds seconds between reports
     */
    public ProgressReporter(SearchStatistics statistics, int reportIntervalSeconds) {
        this(statistics, reportIntervalSeconds * 1000L, System.out);
    }

    /**
     * Creates a new progress reporter.
     *
     * @param statistics the statistics of the running search
     * @param reportIntervalMs milliseconds between reports
     * @param out where reports are printed
     */
    public ProgressReporter(SearchStatistics statistics, long reportIntervalMs, PrintStream out) {
        this.statistics = statistics;
        this.reportIntervalMs = reportIntervalMs;
        this.out = out;
        this.startTime = System.currentTimeMillis();
    }

    @Override
    public void run() {
        try {
            while (!stopped) {
                Thread.sleep(reportIntervalMs);

                // Don't report if solving finished during sleep
                if (stopped) {
                    break;
                }

                printProgress();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Stops reporting after the current interval.
     */
    public void stop() {
        stopped = true;
    }

    /**
     * Prints the current progress statistics.
     */
    void printProgress() {
        long expanded = statistics.getStatesExpanded();
        long generated = statistics.getStatesGenerated();
        long duplicates = statistics.getDuplicatesSkipped();
        long pruned = statistics.getStatesPruned();
        double elapsedSeconds = (System.currentTimeMillis() - startTime) / 1000.0;
        double statesPerSecond = elapsedSeconds > 0 ? expanded / elapsedSeconds : 0.0;

        out.printf(
            "[%s] Empty flasks: %d | Frontier: %s %s | Expanded: %s | Generated: %s | " +
            "Duplicates: %s | Pruned: %s | Rate: %s/s%n",
            formatDuration(elapsedSeconds),
            statistics.getEmptyFlaskCount(),
            statistics.getFrontierName(),
            formatCount(statistics.getFrontierSize()),
            formatCount(expanded),
            formatCount(generated),
            formatCount(duplicates),
            formatCount(pruned),
            formatCount((long) statesPerSecond)
        );
    }

    /**
     * Formats a count with compact suffixes (B, M, K) with exactly one decimal place.
     * Examples: 123456789 → "123.5M", 5432 → "5.4K", 123 → "123"
     *
     * @param count the count to format
     * @return formatted string with suffix
     */
    static String formatCount(long count) {
        if (count >= 1_000_000_000L) {
            return String.format("%.1fB", count / 1_000_000_000.0);
        } else if (count >= 1_000_000L) {
            return String.format("%.1fM", count / 1_000_000.0);
        } else if (count >= 1_000L) {
            return String.format("%.1fK", count / 1_000.0);
        } else {
            return String.valueOf(count);
        }
    }

    /**
     * Formats a duration in seconds to a fixed-width string.
     *
     * @param seconds the duration in seconds
     * @return formatted string (e.g., "001:23:45")
     */
    static String formatDuration(double seconds) {
        int totalSeconds = (int) seconds;
        int hours = totalSeconds / 3600;
        int minutes = (totalSeconds % 3600) / 60;
        int secs = totalSeconds % 60;
        return String.format("%03d:%02d:%02d", hours, minutes, secs);
    }

    /**
     * Prints a final summary when solving is complete.
     *
     * @param foundSolution whether a solution was found
     */
    public void printFinalSummary(boolean foundSolution) {
        long expanded = statistics.getStatesExpanded();
        long generated = statistics.getStatesGenerated();
        long duplicates = statistics.getDuplicatesSkipped();
        long pruned = statistics.getStatesPruned();
        double elapsedSeconds = (System.currentTimeMillis() - startTime) / 1000.0;
        double statesPerSecond = elapsedSeconds > 0 ? expanded / elapsedSeconds : 0.0;

        out.println("\n" + "=".repeat(80));
        out.println(foundSolution ? "SOLUTION FOUND!" : "Search complete");
        out.println("=".repeat(80));
        out.printf("Total time:          %s%n", formatDuration(elapsedSeconds));
        out.printf("States expanded:     %s%n", formatCount(expanded));
        out.printf("States generated:    %s%n", formatCount(generated));
        out.printf("Duplicates skipped:  %s%n", formatCount(duplicates));
        out.printf("States pruned:       %s%n", formatCount(pruned));
        out.printf("Processing rate:     %s/second%n", formatCount((long) statesPerSecond));
        out.println("=".repeat(80));
    }
}
