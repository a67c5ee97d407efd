package org.gerken.colorsort.logic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.gerken.colorsort.model.Layout;
import org.gerken.colorsort.model.Move;
import org.gerken.colorsort.model.SearchNode;
import org.junit.jupiter.api.Test;

class SearchEngineTest {

    /**
     * Depth-first frontier that remembers the fingerprint of every node handed out for expansion.
     */
    private static final class RecordingFrontier extends DepthFirstFrontier {
        final List<String> polled = new ArrayList<>();

        @Override
        public SearchNode poll() {
            SearchNode node = super.poll();
            if (node != null) {
                polled.add(StateFingerprint.of(node.getLayout()));
            }
            return node;
        }
    }

    @Test
    void findsValidSolution() {
        Layout start = new Layout(2, new int[][] {{0, 1}, {1, 0}, {}});

        List<Move> moves = new SearchEngine().search(start, new DepthFirstFrontier());

        assertNotNull(moves);
        assertFalse(moves.isEmpty());
        assertTrue(start.replay(moves).isSolved());
    }

    @Test
    void priorityFrontierFindsValidSolution() {
        Layout start = new Layout(4, new int[][] {{0, 1, 0, 1}, {1, 0, 1, 0}, {}, {}});

        List<Move> moves = new SearchEngine().search(start, new PriorityFrontier(1));

        assertNotNull(moves);
        assertTrue(start.replay(moves).isSolved());
    }

    @Test
    void exhaustsUnsolvableLayoutWithoutRevisitingStates() {
        // Two layers per color can never fill a flask of four
        Layout start = new Layout(4, new int[][] {{0, 1}, {1, 0}, {}, {}});
        RecordingFrontier frontier = new RecordingFrontier();
        SearchStatistics statistics = new SearchStatistics();

        List<Move> moves = new SearchEngine(statistics).search(start, frontier);

        assertNull(moves);
        Set<String> distinct = new HashSet<>(frontier.polled);
        assertEquals(frontier.polled.size(), distinct.size(), "No state is expanded twice");
        assertEquals(frontier.polled.size(), statistics.getStatesExpanded());
        assertEquals(statistics.getStatesGenerated() + 1, statistics.getStatesExpanded(),
            "Every generated state and the root are expanded once");
        assertTrue(statistics.getDuplicatesSkipped() > 0);
    }

    @Test
    void layoutWithNoValidMovesIsExhaustedImmediately() {
        Layout start = new Layout(2, new int[][] {{0, 1}, {1, 0}});
        SearchStatistics statistics = new SearchStatistics();

        assertNull(new SearchEngine(statistics).search(start, new DepthFirstFrontier()));
        assertEquals(1, statistics.getStatesExpanded());
        assertEquals(0, statistics.getStatesGenerated());
    }
}
