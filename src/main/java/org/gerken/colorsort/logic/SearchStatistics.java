package org.gerken.colorsort.logic;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counters describing search progress.
 * Updated by the thread running the search and read by the progress reporter,
 * so values may be slightly stale when read from another thread.
 */
public class SearchStatistics {

    private final AtomicLong statesExpanded = new AtomicLong(0);
    private final AtomicLong statesGenerated = new AtomicLong(0);
    private final AtomicLong duplicatesSkipped = new AtomicLong(0);
    private final AtomicLong statesPruned = new AtomicLong(0);
    private volatile int frontierSize;
    private volatile int emptyFlaskCount;
    private volatile String frontierName = "none";

    // ========== Updates ==========

    public void incrementStatesExpanded() {
        statesExpanded.incrementAndGet();
    }

    public void incrementStatesGenerated() {
        statesGenerated.incrementAndGet();
    }

    public void incrementDuplicatesSkipped() {
        duplicatesSkipped.incrementAndGet();
    }

    public void incrementStatesPruned() {
        statesPruned.incrementAndGet();
    }

    public void setFrontierSize(int frontierSize) {
        this.frontierSize = frontierSize;
    }

    /**
     * Records which attempt is running: the number of empty flasks and the frontier in use.
     *
     * @param emptyFlaskCount the number of empty flasks added
     * @param frontierName the frontier's name
     */
    public void startAttempt(int emptyFlaskCount, String frontierName) {
        this.emptyFlaskCount = emptyFlaskCount;
        this.frontierName = frontierName;
        this.frontierSize = 0;
    }

    // ========== Reads ==========

    public long getStatesExpanded() {
        return statesExpanded.get();
    }

    public long getStatesGenerated() {
        return statesGenerated.get();
    }

    public long getDuplicatesSkipped() {
        return duplicatesSkipped.get();
    }

    public long getStatesPruned() {
        return statesPruned.get();
    }

    public int getFrontierSize() {
        return frontierSize;
    }

    public int getEmptyFlaskCount() {
        return emptyFlaskCount;
    }

    public String getFrontierName() {
        return frontierName;
    }
}
