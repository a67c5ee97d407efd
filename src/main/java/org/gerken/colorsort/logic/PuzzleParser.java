package org.gerken.colorsort.logic;

import org.gerken.colorsort.model.Layout;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses puzzle input files.
 *
 * Format:
 * # Comments start with #
 * CAPACITY <number>          (optional, default 4)
 * METHOD <method>            (optional: fastest, balanced or shortest; default fastest)
 * FLASKS
 * <color> <color> ...        (one flask per line, bottom to top)
 * EMPTY                      (an empty flask; "-" also works)
 *
 * EMPTY and - are reserved and cannot be used as color names.
 *
 * Color names are assigned IDs in order of first appearance.
 *
 * Example:
 * CAPACITY 4
 * METHOD balanced
 * FLASKS
 * RED BLUE RED BLUE
 * BLUE RED BLUE RED
 * EMPTY
 */
public class PuzzleParser {

    private static final String EMPTY_FLASK = "EMPTY";
    private static final String EMPTY_FLASK_SHORT = "-";

    /**
     * Parses a puzzle file.
     *
     * @param filename path to the puzzle file
     * @return the parsed puzzle
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file format is invalid
     */
    public static ParsedPuzzle parse(String filename) throws IOException {
        try (Reader reader = Files.newBufferedReader(Path.of(filename), StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    /**
     * Parses puzzle text held in memory.
     *
     * @param text the puzzle text
     * @return the parsed puzzle
     * @throws IllegalArgumentException if the format is invalid
     */
    public static ParsedPuzzle parseText(String text) {
        try {
            return parse(new StringReader(text));
        } catch (IOException e) {
            throw new IllegalStateException("Reading from a string failed", e);
        }
    }

    /**
     * Parses a puzzle from a reader.
     *
     * @param source the puzzle text
     * @return the parsed puzzle
     * @throws IOException if reading fails
     * @throws IllegalArgumentException if the format is invalid
     */
    public static ParsedPuzzle parse(Reader source) throws IOException {
        BufferedReader reader = new BufferedReader(source);
        int capacity = FlaskSolver.DEFAULT_CAPACITY;
        SolvingMethod method = SolvingMethod.FASTEST;
        Map<String, Integer> colorIds = new HashMap<>();
        List<String> colorNames = new ArrayList<>();
        List<String[]> flaskLines = new ArrayList<>();
        boolean inFlasksSection = false;
        int lineNumber = 0;

        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            line = line.trim();

            // Skip empty lines and comments
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }

            if (line.equals("FLASKS")) {
                inFlasksSection = true;
            } else if (inFlasksSection) {
                flaskLines.add(line.split("\\s+"));
            } else if (line.startsWith("CAPACITY ")) {
                capacity = parseCapacity(line.substring(9).trim(), lineNumber);
            } else if (line.startsWith("METHOD ")) {
                method = SolvingMethod.fromName(line.substring(7).trim());
            } else {
                throw new IllegalArgumentException("Unknown directive on line " + lineNumber + ": " + line);
            }
        }

        // Validate input
        if (!inFlasksSection) {
            throw new IllegalArgumentException("No FLASKS section");
        }
        if (flaskLines.isEmpty()) {
            throw new IllegalArgumentException("No flasks defined");
        }

        int[][] layersMatrix = new int[flaskLines.size()][];
        for (int i = 0; i < flaskLines.size(); i++) {
            String[] tokens = flaskLines.get(i);
            if (tokens.length == 1 && (tokens[0].equals(EMPTY_FLASK) || tokens[0].equals(EMPTY_FLASK_SHORT))) {
                layersMatrix[i] = new int[0];
                continue;
            }
            if (tokens.length > capacity) {
                throw new IllegalArgumentException(String.format(
                    "Flask %d has %d layers, capacity is %d", i + 1, tokens.length, capacity));
            }
            int[] layers = new int[tokens.length];
            for (int j = 0; j < tokens.length; j++) {
                if (isReserved(tokens[j])) {
                    throw new IllegalArgumentException(String.format(
                        "Flask %d uses reserved word '%s' as a color name", i + 1, tokens[j]));
                }
                Integer id = colorIds.get(tokens[j]);
                if (id == null) {
                    id = colorNames.size();
                    colorIds.put(tokens[j], id);
                    colorNames.add(tokens[j]);
                }
                layers[j] = id;
            }
            layersMatrix[i] = layers;
        }

        return new ParsedPuzzle(capacity, layersMatrix, colorNames, method);
    }

    private static boolean isReserved(String token) {
        return token.equals(EMPTY_FLASK) || token.equals(EMPTY_FLASK_SHORT);
    }

    private static int parseCapacity(String value, int lineNumber) {
        int capacity;
        try {
            capacity = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid capacity on line " + lineNumber + ": " + value, e);
        }
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive on line " + lineNumber + ": " + capacity);
        }
        return capacity;
    }

    /**
     * Formats a layout in the puzzle file format, so it can be read back by {@link #parse(String)}.
     *
     * @param layout the layout to format
     * @param colorNames color names indexed by color ID
     * @param method the solving method to record
     * @return the puzzle text
     * @throws IllegalArgumentException if a color name is empty, contains whitespace or is a reserved word
     */
    public static String format(Layout layout, List<String> colorNames, SolvingMethod method) {
        for (String name : colorNames) {
            if (name == null || name.isEmpty() || isReserved(name) || name.chars().anyMatch(Character::isWhitespace)) {
                throw new IllegalArgumentException("Color name cannot be written to a puzzle file: '" + name + "'");
            }
        }
        StringBuilder result = new StringBuilder();
        result.append("CAPACITY ").append(layout.getCapacity()).append('\n');
        result.append("METHOD ").append(method.getName()).append('\n');
        result.append("FLASKS\n");
        for (int[] layers : layout.getLayersMatrix()) {
            if (layers.length == 0) {
                result.append(EMPTY_FLASK);
            }
            for (int i = 0; i < layers.length; i++) {
                if (i > 0) {
                    result.append(' ');
                }
                int color = layers[i];
                result.append(color < colorNames.size() ? colorNames.get(color) : String.valueOf(color));
            }
            result.append('\n');
        }
        return result.toString();
    }
}
