package org.gerken.colorsort.logic;

import org.gerken.colorsort.model.Layout;
import org.gerken.colorsort.model.Move;
import org.gerken.colorsort.model.SearchNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Explores the graph of layouts reachable by valid pours until a solved layout is found.
 *
 * The expansion order and pruning are delegated to a {@link Frontier}; the engine itself
 * only guarantees that no layout is expanded twice. Two layouts count as the same state
 * when their {@link StateFingerprint fingerprints} match, regardless of flask order.
 *
 * An engine instance is not thread-safe; run one search at a time per instance.
 */
public class SearchEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SearchEngine.class);

    private final SearchStatistics statistics;

    public SearchEngine() {
        this(new SearchStatistics());
    }

    /**
     * Creates an engine that records progress in the given statistics.
     *
     * @param statistics the shared statistics, possibly read by a reporter thread
     */
    public SearchEngine(SearchStatistics statistics) {
        this.statistics = statistics;
    }

    public SearchStatistics getStatistics() {
        return statistics;
    }

    /**
     * Searches for a sequence of moves that solves the layout.
     *
     * A solved child returns immediately, so a layout that is already solved is not
     * recognised as its own solution; callers check that case before searching.
     *
     * @param start the layout to solve
     * @param frontier an empty frontier that determines expansion order and pruning
     * @return the moves of the first solution found, or null if the search space is exhausted
     */
    public List<Move> search(Layout start, Frontier frontier) {
        Set<String> visited = new HashSet<>();
        visited.add(StateFingerprint.of(start));

        SearchNode root = new SearchNode(start);
        if (frontier.admit(root)) {
            frontier.push(root);
        }

        long expandedBefore = statistics.getStatesExpanded();
        while (!frontier.isEmpty()) {
            SearchNode node = frontier.poll();
            statistics.setFrontierSize(frontier.size());

            if (!frontier.admit(node)) {
                statistics.incrementStatesPruned();
                continue;
            }

            SearchNode solution = expand(node, frontier, visited);
            statistics.incrementStatesExpanded();
            if (solution != null) {
                LOG.debug("Solution of {} moves found with {} frontier after {} expansions",
                    solution.getMoveCount(), frontier.getName(),
                    statistics.getStatesExpanded() - expandedBefore);
                return solution.getMoveHistory();
            }
        }

        LOG.debug("Search space exhausted with {} frontier after {} expansions ({} states visited)",
            frontier.getName(), statistics.getStatesExpanded() - expandedBefore, visited.size());
        return null;
    }

    /**
     * Generates every unvisited successor of a node.
     * Pairs are tried with the source outer and the destination inner, both ascending.
     *
     * @return the first solved successor, or null if none was generated
     */
    private SearchNode expand(SearchNode node, Frontier frontier, Set<String> visited) {
        Layout layout = node.getLayout();
        int flaskCount = layout.getFlaskCount();

        for (int source = 0; source < flaskCount; source++) {
            for (int destination = 0; destination < flaskCount; destination++) {
                if (!layout.isTransfusionValid(source, destination)) {
                    continue;
                }

                Move move = new Move(source, destination);
                Layout next = layout.applyMove(move);
                if (!visited.add(StateFingerprint.of(next))) {
                    statistics.incrementDuplicatesSkipped();
                    continue;
                }

                SearchNode child = node.child(move, next);
                statistics.incrementStatesGenerated();

                if (child.isSolved()) {
                    return child;
                }

                if (frontier.admit(child)) {
                    frontier.push(child);
                } else {
                    statistics.incrementStatesPruned();
                }
            }
        }
        statistics.setFrontierSize(frontier.size());
        return null;
    }
}
