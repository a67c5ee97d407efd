package org.gerken.colorsort.logic;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.gerken.colorsort.model.Layout;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PuzzleParserTest {

    @TempDir
    Path tempDir;

    @Test
    void parsesPuzzleFile() throws IOException {
        Path file = tempDir.resolve("puzzle.txt");
        Files.write(file, List.of(
            "# Two interleaved flasks",
            "CAPACITY 4",
            "METHOD Balanced",
            "",
            "FLASKS",
            "RED BLUE RED BLUE",
            "BLUE RED BLUE RED",
            "EMPTY",
            "-"), StandardCharsets.UTF_8);

        ParsedPuzzle puzzle = PuzzleParser.parse(file.toString());

        assertEquals(4, puzzle.getCapacity());
        assertEquals(SolvingMethod.BALANCED, puzzle.getMethod());
        assertEquals(List.of("RED", "BLUE"), puzzle.getColorNames());
        assertArrayEquals(new int[][] {{0, 1, 0, 1}, {1, 0, 1, 0}, {}, {}}, puzzle.getLayersMatrix());
        assertEquals(4, puzzle.toLayout().getFlaskCount());
    }

    @Test
    void directivesAreOptional() {
        ParsedPuzzle puzzle = PuzzleParser.parseText("FLASKS\nA B\nB A\n");

        assertEquals(FlaskSolver.DEFAULT_CAPACITY, puzzle.getCapacity());
        assertEquals(SolvingMethod.FASTEST, puzzle.getMethod());
        assertArrayEquals(new int[][] {{0, 1}, {1, 0}}, puzzle.getLayersMatrix());
    }

    @Test
    void malformedFilesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> PuzzleParser.parseText("CAPACITY 4\n"));
        assertThrows(IllegalArgumentException.class, () -> PuzzleParser.parseText("FLASKS\n# nothing\n"));
        assertThrows(IllegalArgumentException.class, () -> PuzzleParser.parseText("CAPACITY four\nFLASKS\nA\n"));
        assertThrows(IllegalArgumentException.class, () -> PuzzleParser.parseText("CAPACITY 0\nFLASKS\nA\n"));
        assertThrows(IllegalArgumentException.class, () -> PuzzleParser.parseText("METHOD slowest\nFLASKS\nA\n"));
        assertThrows(IllegalArgumentException.class, () -> PuzzleParser.parseText("COLORS 3\nFLASKS\nA\n"));
    }

    @Test
    void rowLongerThanCapacityNamesTheFlask() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> PuzzleParser.parseText("CAPACITY 2\nFLASKS\nA B\nA B A\n"));

        assertEquals("Flask 2 has 3 layers, capacity is 2", e.getMessage());
    }

    @Test
    void reservedWordsAreNotColorNames() {
        assertThrows(IllegalArgumentException.class, () -> PuzzleParser.parseText("FLASKS\nRED EMPTY\n"));
        assertThrows(IllegalArgumentException.class, () -> PuzzleParser.parseText("FLASKS\n- RED\n"));

        Layout layout = new Layout(4, new int[][] {{0}, {1, 0}});
        assertThrows(IllegalArgumentException.class,
            () -> PuzzleParser.format(layout, List.of("EMPTY", "RED"), SolvingMethod.FASTEST));
        assertThrows(IllegalArgumentException.class,
            () -> PuzzleParser.format(layout, List.of("-", "RED"), SolvingMethod.FASTEST));
        assertThrows(IllegalArgumentException.class,
            () -> PuzzleParser.format(layout, List.of("DARK RED", "RED"), SolvingMethod.FASTEST));
    }

    @Test
    void missingFileFailsWithIOException() {
        assertThrows(IOException.class, () -> PuzzleParser.parse(tempDir.resolve("missing.txt").toString()));
    }

    @Test
    void formattedLayoutParsesBack() {
        Layout layout = new Layout(3, new int[][] {{0, 1}, {}, {1, 1, 0}});
        List<String> names = List.of("GREEN", "PINK");

        String text = PuzzleParser.format(layout, names, SolvingMethod.SHORTEST);
        ParsedPuzzle parsed = PuzzleParser.parseText(text);

        assertTrue(text.contains("EMPTY"));
        assertEquals(SolvingMethod.SHORTEST, parsed.getMethod());
        assertEquals(layout, parsed.toLayout());
        assertEquals(names, parsed.getColorNames());
    }
}
