package org.gerken.colorsort.logic;

import org.gerken.colorsort.model.Layout;
import org.gerken.colorsort.model.Move;
import org.gerken.colorsort.model.Solution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Solves color-sort puzzles, adding empty flasks one at a time until a solution appears.
 *
 * Some layouts cannot be solved with few empty flasks but become solvable with more
 * scratch space. The solver tries every empty flask count from the configured minimum
 * to the maximum, in order, and returns the first solution found.
 *
 * A solve call can run for a long time and offers no cancellation point; hosts that
 * need a time limit should run it through {@link #solveAsync} on a dedicated executor.
 */
public class FlaskSolver {

    private static final Logger LOG = LoggerFactory.getLogger(FlaskSolver.class);

    public static final int DEFAULT_CAPACITY = 4;
    public static final int DEFAULT_MIN_EMPTY_FLASKS = 0;
    public static final int DEFAULT_MAX_EMPTY_FLASKS = 3;

    private final int capacity;
    private final int minEmptyFlasks;
    private final int maxEmptyFlasks;
    private final SearchStatistics statistics;

    /**
     * Creates a solver with the default capacity and empty flask bounds.
     */
    public FlaskSolver() {
        this(DEFAULT_CAPACITY, DEFAULT_MIN_EMPTY_FLASKS, DEFAULT_MAX_EMPTY_FLASKS);
    }

    /**
     * Creates a solver.
     *
     * @param capacity the capacity of every flask
     * @param minEmptyFlasks the first number of empty flasks to try
     * @param maxEmptyFlasks the last number of empty flasks to try
     * @throws IllegalArgumentException if capacity is not positive or the bounds are not 0 <= min <= max
     */
    public FlaskSolver(int capacity, int minEmptyFlasks, int maxEmptyFlasks) {
        this(capacity, minEmptyFlasks, maxEmptyFlasks, new SearchStatistics());
    }

    /**
     * Creates a solver that records search progress in the given statistics.
     *
     * @param capacity the capacity of every flask
     * @param minEmptyFlasks the first number of empty flasks to try
     * @param maxEmptyFlasks the last number of empty flasks to try
     * @param statistics the statistics to update while searching
     */
    public FlaskSolver(int capacity, int minEmptyFlasks, int maxEmptyFlasks, SearchStatistics statistics) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        if (minEmptyFlasks < 0 || maxEmptyFlasks < minEmptyFlasks) {
            throw new IllegalArgumentException(
                "Empty flask bounds must satisfy 0 <= min <= max, got " + minEmptyFlasks + ".." + maxEmptyFlasks);
        }
        this.capacity = capacity;
        this.minEmptyFlasks = minEmptyFlasks;
        this.maxEmptyFlasks = maxEmptyFlasks;
        this.statistics = statistics;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getMinEmptyFlasks() {
        return minEmptyFlasks;
    }

    public int getMaxEmptyFlasks() {
        return maxEmptyFlasks;
    }

    public SearchStatistics getStatistics() {
        return statistics;
    }

    /**
     * Solves a puzzle.
     *
     * @param layersMatrix one row of color IDs per flask, bottom to top
     * @param method the solving method
     * @return the solution, or a not-found outcome if no empty flask count up to the maximum works
     * @throws IllegalArgumentException if a row is longer than capacity or the matrix or method is missing
     */
    public Solution solve(int[][] layersMatrix, SolvingMethod method) {
        if (layersMatrix == null) {
            throw new IllegalArgumentException("Layers matrix is required");
        }
        if (method == null) {
            throw new IllegalArgumentException("Solving method is required");
        }
        // Validates every row before any search starts
        Layout initial = new Layout(capacity, layersMatrix);

        if (initial.isSolved()) {
            LOG.info("Puzzle is already solved");
            return Solution.found(List.of(), minEmptyFlasks, 0);
        }

        SearchEngine engine = new SearchEngine(statistics);
        long expandedBefore = statistics.getStatesExpanded();

        for (int emptyFlasks = minEmptyFlasks; emptyFlasks <= maxEmptyFlasks; emptyFlasks++) {
            Frontier frontier = method.newFrontier();
            statistics.startAttempt(emptyFlasks, frontier.getName());
            LOG.debug("Trying {} method with {} empty flasks", method, emptyFlasks);

            List<Move> moves = engine.search(initial.withEmptyFlasks(emptyFlasks), frontier);
            if (moves != null) {
                long expanded = statistics.getStatesExpanded() - expandedBefore;
                LOG.info("Found {}-move solution using {} empty flasks ({} method, {} states expanded)",
                    moves.size(), emptyFlasks, method, expanded);
                return Solution.found(moves, emptyFlasks, expanded);
            }
        }

        long expanded = statistics.getStatesExpanded() - expandedBefore;
        LOG.info("No solution with up to {} empty flasks ({} method, {} states expanded)",
            maxEmptyFlasks, method, expanded);
        return Solution.notFound(maxEmptyFlasks, expanded);
    }

    /**
     * Solves a puzzle on the given executor.
     * Invalid input completes the returned future exceptionally.
     *
     * @param layersMatrix one row of color IDs per flask, bottom to top
     * @param method the solving method
     * @param executor the executor that runs the search
     * @return a future completed with the solution
     */
    public CompletableFuture<Solution> solveAsync(int[][] layersMatrix, SolvingMethod method, Executor executor) {
        int[][] snapshot = copyMatrix(layersMatrix);
        return CompletableFuture.supplyAsync(() -> solve(snapshot, method), executor);
    }

    private static int[][] copyMatrix(int[][] matrix) {
        if (matrix == null) {
            return null;
        }
        int[][] copy = new int[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            copy[i] = matrix[i] == null ? null : matrix[i].clone();
        }
        return copy;
    }
}
