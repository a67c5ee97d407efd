package org.gerken.colorsort.logic;

import org.gerken.colorsort.model.Layout;

import java.util.Collections;
import java.util.List;

/**
 * A puzzle as read from a puzzle file: the flasks as color IDs, the color names
 * for display, the flask capacity and the requested solving method.
 */
public class ParsedPuzzle {

    private final int capacity;
    private final int[][] layersMatrix;
    private final List<String> colorNames;
    private final SolvingMethod method;

    public ParsedPuzzle(int capacity, int[][] layersMatrix, List<String> colorNames, SolvingMethod method) {
        this.capacity = capacity;
        this.layersMatrix = layersMatrix;
        this.colorNames = Collections.unmodifiableList(colorNames);
        this.method = method;
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Gets the flasks as color IDs, one row per flask, bottom to top.
     *
     * @return a copy of the layers matrix
     */
    public int[][] getLayersMatrix() {
        int[][] copy = new int[layersMatrix.length][];
        for (int i = 0; i < layersMatrix.length; i++) {
            copy[i] = layersMatrix[i].clone();
        }
        return copy;
    }

    /**
     * Gets the color names, indexed by color ID.
     *
     * @return unmodifiable list of color names
     */
    public List<String> getColorNames() {
        return colorNames;
    }

    public SolvingMethod getMethod() {
        return method;
    }

    /**
     * Builds the initial layout of this puzzle.
     *
     * @return the layout
     */
    public Layout toLayout() {
        return new Layout(capacity, layersMatrix);
    }
}
