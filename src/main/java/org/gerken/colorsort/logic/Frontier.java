package org.gerken.colorsort.logic;

import org.gerken.colorsort.model.SearchNode;

/**
 * Holds the search nodes that have not been expanded yet.
 * The implementation decides the expansion order and which nodes are worth keeping.
 */
public interface Frontier {

    /**
     * Adds a node to the frontier.
     *
     * @param node the node to add
     */
    void push(SearchNode node);

    /**
     * Retrieves and removes the next node to expand.
     *
     * @return the next node, or null if the frontier is empty
     */
    SearchNode poll();

    boolean isEmpty();

    int size();

    /**
     * Determines whether a node should be kept in the search.
     * Called before a node is pushed and again when it is polled, since
     * the criteria may have tightened in between. May update internal state.
     *
     * @param node the node to evaluate
     * @return true if the node should be kept
     */
    boolean admit(SearchNode node);

    /**
     * Returns a descriptive name for this frontier.
     * Useful for logging and progress reporting.
     *
     * @return the name of this frontier
     */
    String getName();
}
