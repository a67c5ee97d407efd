package org.gerken.colorsort.logic;

import org.gerken.colorsort.model.SearchNode;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Frontier that expands the most recently added node first (LIFO).
 * Dives deep into the search tree and finds a solution quickly,
 * with no bound on its length. Every node is admitted.
 */
public class DepthFirstFrontier implements Frontier {

    private final Deque<SearchNode> stack = new ArrayDeque<>();

    @Override
    public void push(SearchNode node) {
        stack.push(node);
    }

    @Override
    public SearchNode poll() {
        return stack.poll();
    }

    @Override
    public boolean isEmpty() {
        return stack.isEmpty();
    }

    @Override
    public int size() {
        return stack.size();
    }

    @Override
    public boolean admit(SearchNode node) {
        return true;
    }

    @Override
    public String getName() {
        return "depth-first";
    }
}
