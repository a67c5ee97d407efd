package org.gerken.colorsort.logic;

import org.gerken.colorsort.model.Layout;

/**
 * Measures how close a layout is to being sorted.
 * The metric counts adjacent layers of the same color across all flasks;
 * a full single-color flask of capacity C contributes C - 1.
 */
public final class SortednessMetric {

    private SortednessMetric() {
    }

    /**
     * Computes the sortedness metric of a layout.
     *
     * @param layout the layout
     * @return the number of adjacent equal-color layer pairs
     */
    public static int of(Layout layout) {
        int metric = 0;
        for (int[] layers : layout.getLayersMatrix()) {
            for (int i = 1; i < layers.length; i++) {
                if (layers[i] == layers[i - 1]) {
                    metric++;
                }
            }
        }
        return metric;
    }
}
