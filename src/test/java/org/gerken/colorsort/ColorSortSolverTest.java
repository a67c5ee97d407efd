package org.gerken.colorsort;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.gerken.colorsort.logic.SolvingMethod;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ColorSortSolverTest {

    @TempDir
    Path tempDir;

    @Test
    void parsesOptions() {
        ColorSortSolver.Config config = ColorSortSolver.parseArguments(new String[] {
            "-m", "shortest", "--min-empty", "1", "--max-empty", "2", "-r", "0", "-dur", "45s", "puzzle.txt"});

        assertNotNull(config);
        assertEquals(SolvingMethod.SHORTEST, config.method);
        assertEquals(1, config.minEmptyFlasks);
        assertEquals(2, config.maxEmptyFlasks);
        assertEquals(0, config.reportInterval);
        assertEquals(45, config.durationSeconds);
        assertEquals("puzzle.txt", config.puzzleFile);
    }

    @Test
    void invalidArgumentsYieldNoConfig() {
        assertNull(ColorSortSolver.parseArguments(new String[] {}));
        assertNull(ColorSortSolver.parseArguments(new String[] {"-h"}));
        assertNull(ColorSortSolver.parseArguments(new String[] {"-m", "quickest", "p.txt"}));
        assertNull(ColorSortSolver.parseArguments(new String[] {"--min-empty", "3", "--max-empty", "1", "p.txt"}));
        assertNull(ColorSortSolver.parseArguments(new String[] {"--bogus", "p.txt"}));
        assertNull(ColorSortSolver.parseArguments(new String[] {"a.txt", "b.txt"}));
    }

    @Test
    void parsesDurations() {
        assertEquals(30 * 60, ColorSortSolver.parseDuration("30"));
        assertEquals(45, ColorSortSolver.parseDuration("45s"));
        assertEquals(5 * 60, ColorSortSolver.parseDuration("5m"));
        assertEquals(2 * 3600, ColorSortSolver.parseDuration("2H"));
        assertEquals(-1, ColorSortSolver.parseDuration("h"));
        assertEquals(-1, ColorSortSolver.parseDuration("10w"));
    }

    @Test
    void derivesSolutionFilePath() {
        assertEquals("puzzles/a.solution.txt", ColorSortSolver.getSolutionFilePath("puzzles/a.txt"));
        assertEquals("a.puz.solution.txt", ColorSortSolver.getSolutionFilePath("a.puz"));
    }

    @Test
    void solvesPuzzleFileAndWritesSolution() throws IOException {
        Path puzzle = tempDir.resolve("interleaved.txt");
        Files.write(puzzle, List.of("CAPACITY 4", "FLASKS", "RED BLUE RED BLUE", "BLUE RED BLUE RED"),
            StandardCharsets.UTF_8);
        ColorSortSolver.Config config = ColorSortSolver.parseArguments(new String[] {"-r", "0", puzzle.toString()});

        assertEquals(0, ColorSortSolver.run(config));

        Path solution = tempDir.resolve("interleaved.solution.txt");
        assertTrue(Files.exists(solution));
        String text = Files.readString(solution, StandardCharsets.UTF_8);
        assertTrue(text.contains("Move sequence:"), text);
        assertTrue(text.contains("After move 1:"), text);
    }

    @Test
    void solutionFileKeepsNonAsciiColorNames() throws IOException {
        Path puzzle = tempDir.resolve("accents.txt");
        Files.write(puzzle, List.of("FLASKS", "ROSÉ BLEU ROSÉ BLEU", "BLEU ROSÉ BLEU ROSÉ"), StandardCharsets.UTF_8);
        ColorSortSolver.Config config = ColorSortSolver.parseArguments(new String[] {"-r", "0", puzzle.toString()});

        assertEquals(0, ColorSortSolver.run(config));

        String text = Files.readString(tempDir.resolve("accents.solution.txt"), StandardCharsets.UTF_8);
        assertTrue(text.contains("ROSÉ"), text);
    }

    @Test
    void unsolvablePuzzleExitsWithFailure() throws IOException {
        Path puzzle = tempDir.resolve("short.txt");
        Files.write(puzzle, List.of("FLASKS", "A B", "B A"), StandardCharsets.UTF_8);
        ColorSortSolver.Config config = ColorSortSolver.parseArguments(
            new String[] {"-r", "0", "--max-empty", "1", puzzle.toString()});

        assertEquals(1, ColorSortSolver.run(config));
        assertTrue(Files.notExists(tempDir.resolve("short.solution.txt")));
    }

    @Test
    void malformedPuzzleExitsWithFailure() throws IOException {
        Path puzzle = tempDir.resolve("broken.txt");
        Files.write(puzzle, List.of("CAPACITY 2", "FLASKS", "A A A"), StandardCharsets.UTF_8);

        assertEquals(1, ColorSortSolver.run(ColorSortSolver.parseArguments(new String[] {puzzle.toString()})));
    }
}
