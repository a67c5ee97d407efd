package org.gerken.colorsort.model;

import java.util.Arrays;
import java.util.List;

/**
 * Represents the puzzle layout - an ordered collection of flasks sharing one capacity.
 * Flasks are addressed by 0-based index and labeled 1, 2, 3, etc. when printed.
 *
 * A layout is solved when every flask is in its final state.
 */
public class Layout {

    private final int capacity;
    private final Flask[] flasks;

    /**
     * Creates a new layout from a matrix of layers.
     * Each row lists one flask's colors bottom to top; rows may be shorter than capacity.
     *
     * @param capacity the capacity shared by all flasks
     * @param layersMatrix one row of color IDs per flask
     * @throws IllegalArgumentException if a row is null or longer than capacity
     */
    public Layout(int capacity, int[][] layersMatrix) {
        this.capacity = capacity;
        this.flasks = new Flask[layersMatrix.length];
        for (int i = 0; i < layersMatrix.length; i++) {
            if (layersMatrix[i] == null) {
                throw new IllegalArgumentException("Flask " + (i + 1) + " has no layers array");
            }
            flasks[i] = new Flask(capacity, layersMatrix[i]);
        }
    }

    /**
     * Creates a layout that takes ownership of the given flasks.
     */
    private Layout(int capacity, Flask[] flasks) {
        this.capacity = capacity;
        this.flasks = flasks;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getFlaskCount() {
        return flasks.length;
    }

    /**
     * Gets a copy of the flask at the specified index.
     *
     * @param index the flask index (0-based)
     * @return a copy of the flask
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public Flask getFlask(int index) {
        checkIndex(index);
        return flasks[index].copy();
    }

    /**
     * Gets the layout as a matrix of layers, one row per flask.
     *
     * @return a new matrix independent of this layout
     */
    public int[][] getLayersMatrix() {
        int[][] matrix = new int[flasks.length][];
        for (int i = 0; i < flasks.length; i++) {
            matrix[i] = flasks[i].getLayers();
        }
        return matrix;
    }

    /**
     * Gets the total number of layers across all flasks.
     *
     * @return the layer count
     */
    public int getTotalLayers() {
        int total = 0;
        for (Flask flask : flasks) {
            total += flask.getSize();
        }
        return total;
    }

    /**
     * Checks if this layout is solved.
     * A layout is solved when every flask is either empty or full with a single color.
     *
     * @return true if the layout is solved
     */
    public boolean isSolved() {
        for (Flask flask : flasks) {
            if (!flask.isInFinalState()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks whether pouring from one flask into another is allowed.
     *
     * @param source index of the flask poured from
     * @param destination index of the flask poured into
     * @return true if the transfusion is valid; always false when source equals destination
     * @throws IndexOutOfBoundsException if either index is out of range
     */
    public boolean isTransfusionValid(int source, int destination) {
        checkIndex(source);
        checkIndex(destination);
        if (source == destination) {
            return false;
        }
        return Flask.isTransfusionValid(flasks[source], flasks[destination]);
    }

    /**
     * Pours from one flask into another, in place.
     * Pouring a flask into itself does nothing.
     *
     * @param source index of the flask poured from
     * @param destination index of the flask poured into
     * @throws IndexOutOfBoundsException if either index is out of range
     * @throws IllegalStateException if the transfusion is not valid
     */
    public void transfuse(int source, int destination) {
        checkIndex(source);
        checkIndex(destination);
        if (source == destination) {
            return;
        }
        Flask.transfuse(flasks[source], flasks[destination]);
    }

    /**
     * Creates a new layout with the move applied. This layout is left unchanged.
     *
     * @param move the move to apply
     * @return a new layout after the pour
     */
    public Layout applyMove(Move move) {
        Layout next = copy();
        next.transfuse(move.getSource(), move.getDestination());
        return next;
    }

    /**
     * Creates a new layout by applying every move in order.
     *
     * @param moves the moves to apply
     * @return the resulting layout
     * @throws IllegalStateException if any move is not valid at its point in the sequence
     */
    public Layout replay(List<Move> moves) {
        Layout current = copy();
        for (Move move : moves) {
            current.transfuse(move.getSource(), move.getDestination());
        }
        return current;
    }

    /**
     * Creates a copy of this layout with empty flasks appended after the existing ones.
     *
     * @param count the number of empty flasks to add
     * @return the extended layout
     */
    public Layout withEmptyFlasks(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Empty flask count must be non-negative: " + count);
        }
        Flask[] extended = new Flask[flasks.length + count];
        for (int i = 0; i < flasks.length; i++) {
            extended[i] = flasks[i].copy();
        }
        for (int i = flasks.length; i < extended.length; i++) {
            extended[i] = new Flask(capacity);
        }
        return new Layout(capacity, extended);
    }

    /**
     * Creates a deep copy of this layout.
     *
     * @return a new layout with copies of all flasks
     */
    public Layout copy() {
        return withEmptyFlasks(0);
    }

    /**
     * Returns the flasks as strings, sorted and joined by newlines.
     * Two layouts that differ only by the order of their flasks have the same canonical form.
     *
     * @return the canonical form
     */
    public String canonicalForm() {
        String[] rendered = new String[flasks.length];
        for (int i = 0; i < flasks.length; i++) {
            rendered[i] = flasks[i].toString();
        }
        Arrays.sort(rendered);
        return String.join("\n", rendered);
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= flasks.length) {
            throw new IndexOutOfBoundsException(
                "Flask index " + index + " is out of bounds for " + flasks.length + " flasks");
        }
    }

    /**
     * Returns a string representation of the layout using color names.
     * Format: 1 | RED    BLUE   RED    |
     *
     * @param colorNames list of color names where index matches color ID
     * @return formatted string representation of the layout
     */
    public String toString(List<String> colorNames) {
        int maxColorLen = 1;
        for (String name : colorNames) {
            maxColorLen = Math.max(maxColorLen, name.length());
        }
        int labelWidth = String.valueOf(flasks.length).length();

        StringBuilder result = new StringBuilder();
        for (int i = 0; i < flasks.length; i++) {
            result.append(String.format("%" + labelWidth + "d |", i + 1));
            int[] layers = flasks[i].getLayers();
            for (int slot = 0; slot < capacity; slot++) {
                String cell = slot < layers.length ? colorName(colorNames, layers[slot]) : ".";
                result.append(' ').append(String.format("%-" + maxColorLen + "s", cell));
            }
            result.append(" |");
            if (i < flasks.length - 1) {
                result.append("\n");
            }
        }
        return result.toString();
    }

    private static String colorName(List<String> colorNames, int color) {
        if (color >= 0 && color < colorNames.size() && colorNames.get(color) != null) {
            return colorNames.get(color);
        }
        return String.valueOf(color);
    }

    /**
     * Returns a string representation of the layout using color IDs.
     */
    @Override
    public String toString() {
        return toString(List.of());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Layout layout = (Layout) o;
        return capacity == layout.capacity && Arrays.equals(flasks, layout.flasks);
    }

    @Override
    public int hashCode() {
        return 31 * capacity + Arrays.hashCode(flasks);
    }
}
