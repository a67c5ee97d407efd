package org.gerken.colorsort.logic;

import org.gerken.colorsort.model.SearchNode;

import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Frontier ordered by move count (fewest first), then by sortedness metric (highest first).
 *
 * Nodes are explored in shells of increasing move count. Within each move count only
 * nodes whose metric is within {@code tolerance} of the best metric seen at that move
 * count are kept. This is a beam-style heuristic: it usually finds short solutions,
 * but it can prune the shortest one and it can miss solutions altogether.
 */
public class PriorityFrontier implements Frontier {

    private static final Comparator<SearchNode> ORDER =
        Comparator.comparingInt(SearchNode::getMoveCount)
            .thenComparing(Comparator.comparingInt(SearchNode::getMetric).reversed());

    private final PriorityQueue<SearchNode> queue = new PriorityQueue<>(ORDER);
    private final Map<Integer, Integer> bestMetricByMoveCount = new HashMap<>();
    private final int tolerance;

    /**
     * Creates a priority frontier.
     *
     * @param tolerance how far below the best metric at its move count a node may fall and still be kept
     * @throws IllegalArgumentException if tolerance is negative
     */
    public PriorityFrontier(int tolerance) {
        if (tolerance < 0) {
            throw new IllegalArgumentException("Metric tolerance must be non-negative: " + tolerance);
        }
        this.tolerance = tolerance;
    }

    public int getTolerance() {
        return tolerance;
    }

    @Override
    public void push(SearchNode node) {
        queue.add(node);
    }

    @Override
    public SearchNode poll() {
        return queue.poll();
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public int size() {
        return queue.size();
    }

    /**
     * Admits a node if its metric is within tolerance of the best metric at its move count.
     * The first node seen at a move count sets the best metric; an admitted node with a
     * higher metric raises it.
     */
    @Override
    public boolean admit(SearchNode node) {
        int moveCount = node.getMoveCount();
        int metric = node.getMetric();
        Integer best = bestMetricByMoveCount.get(moveCount);
        if (best == null) {
            bestMetricByMoveCount.put(moveCount, metric);
            return true;
        }
        if (best > metric + tolerance) {
            return false;
        }
        if (metric > best) {
            bestMetricByMoveCount.put(moveCount, metric);
        }
        return true;
    }

    /**
     * Gets the best metric seen so far at a move count.
     *
     * @param moveCount the move count
     * @return the best metric, or null if no node with that move count was seen
     */
    public Integer getBestMetric(int moveCount) {
        return bestMetricByMoveCount.get(moveCount);
    }

    @Override
    public String getName() {
        return "priority(tolerance=" + tolerance + ")";
    }
}
