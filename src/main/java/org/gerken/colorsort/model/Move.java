package org.gerken.colorsort.model;

/**
 * Represents a move in the puzzle - pouring from one flask into another.
 * Flask indices are 0-based; the notation uses 1-based numbers (e.g., "3 -> 5").
 */
public class Move {

    private final int source;
    private final int destination;
    private final String notation;

    /**
     * Creates a move between two flasks.
     *
     * @param source index of the flask poured from (0-based)
     * @param destination index of the flask poured into (0-based)
     */
    public Move(int source, int destination) {
        this.source = source;
        this.destination = destination;
        this.notation = (source + 1) + " -> " + (destination + 1);
    }

    public int getSource() {
        return source;
    }

    public int getDestination() {
        return destination;
    }

    /**
     * Gets the move in human-readable notation (e.g., "3 -> 5").
     *
     * @return the move notation
     */
    public String getNotation() {
        return notation;
    }

    @Override
    public String toString() {
        return notation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Move move = (Move) o;
        return source == move.source && destination == move.destination;
    }

    @Override
    public int hashCode() {
        return 31 * source + destination;
    }
}
