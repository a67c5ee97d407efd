package org.gerken.colorsort.model;

import java.util.Collections;
import java.util.List;

/**
 * The outcome of solving a puzzle.
 * Move indices refer to the extended layout: the original flasks followed by
 * {@link #getEmptyFlaskCount()} empty ones.
 */
public class Solution {

    private final boolean found;
    private final List<Move> moves;
    private final int emptyFlaskCount;
    private final long statesExpanded;

    private Solution(boolean found, List<Move> moves, int emptyFlaskCount, long statesExpanded) {
        this.found = found;
        this.moves = Collections.unmodifiableList(moves);
        this.emptyFlaskCount = emptyFlaskCount;
        this.statesExpanded = statesExpanded;
    }

    /**
     * Creates a solution that was found.
     *
     * @param moves the moves, in order
     * @param emptyFlaskCount the number of empty flasks added to the puzzle
     * @param statesExpanded the number of states expanded across all attempts
     * @return the solution
     */
    public static Solution found(List<Move> moves, int emptyFlaskCount, long statesExpanded) {
        return new Solution(true, List.copyOf(moves), emptyFlaskCount, statesExpanded);
    }

    /**
     * Creates the outcome for a puzzle with no solution up to the empty flask bound.
     *
     * @param emptyFlaskBound the largest empty flask count tried
     * @param statesExpanded the number of states expanded across all attempts
     * @return the outcome
     */
    public static Solution notFound(int emptyFlaskBound, long statesExpanded) {
        return new Solution(false, List.of(), emptyFlaskBound, statesExpanded);
    }

    public boolean isFound() {
        return found;
    }

    /**
     * Gets the moves of the solution.
     *
     * @return unmodifiable list of moves, empty if no solution was found
     */
    public List<Move> getMoves() {
        return moves;
    }

    /**
     * Gets the number of empty flasks the solution uses.
     * When no solution was found, this is the bound that was reached.
     *
     * @return the empty flask count
     */
    public int getEmptyFlaskCount() {
        return emptyFlaskCount;
    }

    public long getStatesExpanded() {
        return statesExpanded;
    }

    @Override
    public String toString() {
        if (!found) {
            return "No solution with up to " + emptyFlaskCount + " empty flasks";
        }
        return moves.size() + " moves with " + emptyFlaskCount + " empty flasks: " + moves;
    }
}
