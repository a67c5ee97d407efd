package org.gerken.colorsort.logic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class SolvingMethodTest {

    @Test
    void namesAreCaseInsensitive() {
        assertEquals(SolvingMethod.FASTEST, SolvingMethod.fromName("fastest"));
        assertEquals(SolvingMethod.BALANCED, SolvingMethod.fromName("Balanced"));
        assertEquals(SolvingMethod.SHORTEST, SolvingMethod.fromName(" SHORTEST "));
        assertEquals("shortest", SolvingMethod.SHORTEST.toString());
    }

    @Test
    void unknownNamesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> SolvingMethod.fromName("quickest"));
        assertThrows(IllegalArgumentException.class, () -> SolvingMethod.fromName(null));
    }

    @Test
    void methodsMapToFrontiers() {
        assertInstanceOf(DepthFirstFrontier.class, SolvingMethod.FASTEST.newFrontier());

        PriorityFrontier balanced = assertInstanceOf(PriorityFrontier.class, SolvingMethod.BALANCED.newFrontier());
        assertEquals(1, balanced.getTolerance());

        PriorityFrontier shortest = assertInstanceOf(PriorityFrontier.class, SolvingMethod.SHORTEST.newFrontier());
        assertEquals(0, shortest.getTolerance());
    }
}
