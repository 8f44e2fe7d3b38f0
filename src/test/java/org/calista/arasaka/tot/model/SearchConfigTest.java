package org.calista.arasaka.tot.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SearchConfigTest {

    @Test
    void defaultsAreValid() {
        SearchConfig c = SearchConfig.defaults();
        assertSame(c, c.validate());
        assertEquals(3, c.maxDepth);
        assertEquals(3, c.branchesPerNode);
        assertEquals(2, c.beamWidth);
        assertEquals(0.3, c.minScoreThreshold);
    }

    @Test
    void outOfRangeOptionsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> SearchConfig.of(0, 3, 2, 0.3));
        assertThrows(IllegalArgumentException.class, () -> SearchConfig.of(3, 0, 2, 0.3));
        assertThrows(IllegalArgumentException.class, () -> SearchConfig.of(3, 3, 0, 0.3));
        assertThrows(IllegalArgumentException.class, () -> SearchConfig.of(3, 3, 2, -0.1));
        assertThrows(IllegalArgumentException.class, () -> SearchConfig.of(3, 3, 2, 1.5));
    }

    @Test
    void beamWiderThanFanOutIsAllowed() {
        SearchConfig c = SearchConfig.of(2, 1, 4, 0.0);
        assertEquals(4, c.beamWidth);
    }

    @Test
    void copiesChangeOneOption() {
        SearchConfig c = SearchConfig.defaults().withBeamWidth(1).withMaxDepth(5);
        assertEquals(SearchConfig.of(5, 3, 1, 0.3), c);
    }
}
