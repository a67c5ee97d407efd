package org.gerken.colorsort.model;

import java.util.Arrays;

/**
 * Represents a single flask - a stack of colored layers with a fixed capacity.
 * Layers are stored bottom to top; the last layer is the top of the flask.
 * Colors are represented as integers for efficiency; only equality matters.
 *
 * A flask can only be changed through {@link #transfuse(Flask, Flask)}.
 */
public class Flask {

    private final int capacity;
    private final int[] layers;
    private int size;

    /**
     * Creates a new flask with the given capacity and initial layers.
     *
     * @param capacity the maximum number of layers
     * @param layers the initial layers, bottom to top
     * @throws IllegalArgumentException if capacity is not positive or there are more layers than capacity
     */
    public Flask(int capacity, int... layers) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Flask capacity must be positive: " + capacity);
        }
        if (layers.length > capacity) {
            throw new IllegalArgumentException(
                String.format("Cannot fill flask over its limit: %d layers, capacity %d", layers.length, capacity));
        }
        this.capacity = capacity;
        this.layers = Arrays.copyOf(layers, capacity);
        this.size = layers.length;
    }

    /**
     * Gets the capacity of this flask.
     *
     * @return the maximum number of layers
     */
    public int getCapacity() {
        return capacity;
    }

    /**
     * Gets the number of layers currently in this flask.
     *
     * @return the layer count
     */
    public int getSize() {
        return size;
    }

    /**
     * Gets the free capacity of this flask.
     *
     * @return the number of layers that can still be poured in
     */
    public int getFreeCapacity() {
        return capacity - size;
    }

    /**
     * Gets a copy of the layers, bottom to top.
     *
     * @return the layer colors
     */
    public int[] getLayers() {
        return Arrays.copyOf(layers, size);
    }

    /**
     * Gets the color of the top layer.
     *
     * @return the top color
     * @throws IllegalStateException if the flask is empty
     */
    public int getTopColor() {
        if (size == 0) {
            throw new IllegalStateException("Empty flask has no top color");
        }
        return layers[size - 1];
    }

    /**
     * Gets the length of the run of equal colors at the top of this flask.
     *
     * @return the run length, 0 for an empty flask
     */
    public int getTopRunLength() {
        if (size == 0) {
            return 0;
        }
        int top = layers[size - 1];
        int run = 1;
        for (int i = size - 2; i >= 0 && layers[i] == top; i--) {
            run++;
        }
        return run;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean isFull() {
        return size == capacity;
    }

    /**
     * Checks if this flask is in its final state.
     * A flask is final when it is empty, or full with layers of one color.
     *
     * @return true if the flask is in its final state
     */
    public boolean isInFinalState() {
        if (isEmpty()) {
            return true;
        }
        return isFull() && getTopRunLength() == size;
    }

    /**
     * Creates an independent copy of this flask.
     *
     * @return a new flask with the same capacity and layers
     */
    public Flask copy() {
        return new Flask(capacity, getLayers());
    }

    /**
     * Checks whether pouring from one flask into another is allowed.
     * The source must not be empty, the destination must not be full, and
     * a non-empty destination must have the same top color as the source.
     *
     * @param source the flask poured from
     * @param destination the flask poured into
     * @return true if the transfusion is valid
     */
    public static boolean isTransfusionValid(Flask source, Flask destination) {
        if (source.isEmpty()) {
            return false;
        }
        if (destination.isFull()) {
            return false;
        }
        return destination.isEmpty() || source.getTopColor() == destination.getTopColor();
    }

    /**
     * Pours the top run of the source into the destination.
     * Moves as many layers as both the run length and the destination's free capacity allow.
     *
     * @param source the flask poured from
     * @param destination the flask poured into
     * @return the number of layers moved
     * @throws IllegalStateException if the transfusion is not valid
     */
    public static int transfuse(Flask source, Flask destination) {
        if (!isTransfusionValid(source, destination)) {
            throw new IllegalStateException(
                "Transfusion from [" + source + "] to [" + destination + "] is invalid");
        }

        int moved = Math.min(source.getTopRunLength(), destination.getFreeCapacity());
        for (int i = 0; i < moved; i++) {
            destination.layers[destination.size++] = source.layers[--source.size];
        }
        return moved;
    }

    /**
     * Returns the layers as comma-separated color IDs, bottom to top.
     */
    @Override
    public String toString() {
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < size; i++) {
            if (i > 0) {
                result.append(',');
            }
            result.append(layers[i]);
        }
        return result.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Flask flask = (Flask) o;
        return capacity == flask.capacity && Arrays.equals(getLayers(), flask.getLayers());
    }

    @Override
    public int hashCode() {
        return 31 * capacity + Arrays.hashCode(getLayers());
    }
}
