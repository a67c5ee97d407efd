package org.gerken.colorsort.model;

import org.gerken.colorsort.logic.SortednessMetric;

import java.util.ArrayList;
import java.util.List;

/**
 * Represents a layout in the search space.
 * Includes the current layout and links to the node it was reached from,
 * so the move history can be rebuilt without copying lists on every expansion.
 */
public class SearchNode {

    private static final int METRIC_NOT_COMPUTED = -1;

    private final Layout layout;
    private final Move lastMove;
    private final SearchNode previous;
    private final int moveCount;
    private int metric = METRIC_NOT_COMPUTED;

    /**
     * Creates a root node for the given layout with no moves.
     *
     * @param layout the starting layout
     */
    public SearchNode(Layout layout) {
        this(layout, null, null);
    }

    private SearchNode(Layout layout, Move lastMove, SearchNode previous) {
        this.layout = layout;
        this.lastMove = lastMove;
        this.previous = previous;
        this.moveCount = previous == null ? 0 : previous.moveCount + 1;
    }

    /**
     * Gets the layout for this node.
     *
     * @return the layout
     */
    public Layout getLayout() {
        return layout;
    }

    /**
     * Gets the last move taken to reach this node.
     *
     * @return the last move, or null if this is the root node
     */
    public Move getLastMove() {
        return lastMove;
    }

    /**
     * Gets the node this one was expanded from.
     *
     * @return the previous node, or null if this is the root node
     */
    public SearchNode getPrevious() {
        return previous;
    }

    /**
     * Gets the number of moves taken to reach this node.
     *
     * @return the move count
     */
    public int getMoveCount() {
        return moveCount;
    }

    /**
     * Gets the sortedness metric of this node's layout.
     * Computed on first use, since depth-first search never needs it.
     *
     * @return the metric
     */
    public int getMetric() {
        if (metric == METRIC_NOT_COMPUTED) {
            metric = SortednessMetric.of(layout);
        }
        return metric;
    }

    /**
     * Creates a child node reached from this one by a move.
     * The child's layout must already have the move applied.
     *
     * @param move the move taken
     * @param childLayout the layout after the move
     * @return the child node
     */
    public SearchNode child(Move move, Layout childLayout) {
        return new SearchNode(childLayout, move, this);
    }

    /**
     * Checks if the layout in this node is solved.
     *
     * @return true if the layout is solved
     */
    public boolean isSolved() {
        return layout.isSolved();
    }

    /**
     * Gets the complete move history from the root to this node.
     * Traverses the previous chain to build the list in order.
     *
     * @return list of moves in order from first to last
     */
    public List<Move> getMoveHistory() {
        Move[] history = new Move[moveCount];
        SearchNode current = this;
        while (current != null && current.lastMove != null) {
            history[current.moveCount - 1] = current.lastMove;
            current = current.previous;
        }
        return new ArrayList<>(List.of(history));
    }

    @Override
    public String toString() {
        return layout.toString() + "\nMoves: " + moveCount;
    }
}
