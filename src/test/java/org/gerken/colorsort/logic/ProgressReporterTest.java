package org.gerken.colorsort.logic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ProgressReporterTest {

    @Test
    void formatsCountsWithSuffixes() {
        assertEquals("999", ProgressReporter.formatCount(999));
        assertTrue(ProgressReporter.formatCount(5_432).matches("5[.,]4K"));
        assertTrue(ProgressReporter.formatCount(1_500_000).matches("1[.,]5M"));
        assertTrue(ProgressReporter.formatCount(2_000_000_000L).matches("2[.,]0B"));
    }

    @Test
    void formatsDurations() {
        assertEquals("000:00:00", ProgressReporter.formatDuration(0.4));
        assertEquals("001:02:05", ProgressReporter.formatDuration(3725));
    }

    @Test
    void reportsCurrentAttempt() {
        SearchStatistics statistics = new SearchStatistics();
        statistics.startAttempt(2, "depth-first");
        statistics.incrementStatesExpanded();
        statistics.incrementStatesGenerated();
        statistics.incrementStatesGenerated();
        statistics.setFrontierSize(1);

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ProgressReporter reporter = new ProgressReporter(statistics, 1000,
            new PrintStream(buffer, true, StandardCharsets.UTF_8));
        reporter.printProgress();
        reporter.printFinalSummary(true);

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("Empty flasks: 2"), output);
        assertTrue(output.contains("Frontier: depth-first 1"), output);
        assertTrue(output.contains("Generated: 2"), output);
        assertTrue(output.contains("SOLUTION FOUND!"), output);
    }

    @Test
    void stoppedReporterExits() throws InterruptedException {
        ProgressReporter reporter = new ProgressReporter(new SearchStatistics(), 10,
            new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
        Thread thread = new Thread(reporter);
        thread.start();
        reporter.stop();
        thread.join(5000);

        assertFalse(thread.isAlive());
    }
}
