package org.gerken.colorsort.logic;

import java.util.Locale;

/**
 * The ways a puzzle can be solved, trading search time against solution length.
 */
public enum SolvingMethod {

    /** Depth-first search: finds some solution quickly, with no bound on its length. */
    FASTEST("fastest"),

    /** Priority search keeping nodes within 1 of the best metric per move count. */
    BALANCED("balanced"),

    /** Priority search keeping only the best-metric nodes per move count. */
    SHORTEST("shortest");

    private final String name;

    SolvingMethod(String name) {
        this.name = name;
    }

    /**
     * Gets the lowercase name used in puzzle files and on the command line.
     *
     * @return the method name
     */
    public String getName() {
        return name;
    }

    /**
     * Creates the frontier that implements this method.
     *
     * @return a new, empty frontier
     */
    public Frontier newFrontier() {
        switch (this) {
            case SHORTEST:
                return new PriorityFrontier(0);
            case BALANCED:
                return new PriorityFrontier(1);
            case FASTEST:
            default:
                return new DepthFirstFrontier();
        }
    }

    /**
     * Looks up a method by name, ignoring case.
     *
     * @param name the method name
     * @return the matching method
     * @throws IllegalArgumentException if no method has that name
     */
    public static SolvingMethod fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (SolvingMethod method : values()) {
                if (method.name.equals(normalized)) {
                    return method;
                }
            }
        }
        throw new IllegalArgumentException(
            "Unknown solving method: " + name + " (expected fastest, balanced or shortest)");
    }

    @Override
    public String toString() {
        return name;
    }
}
