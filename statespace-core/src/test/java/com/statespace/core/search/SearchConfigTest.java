package com.statespace.core.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SearchConfigTest {

    @Test
    void defaultsUseAllProcessorsAndNoDepthCap() {
        SearchConfig config = SearchConfig.defaults();

        assertEquals(Runtime.getRuntime().availableProcessors(), config.parallelism());
        assertEquals(SearchConfig.DEFAULT_FORK_DEPTH_THRESHOLD, config.forkDepthThreshold());
        assertFalse(config.isDepthBounded());
    }

    @Test
    void withersReplaceOneField() {
        SearchConfig config = SearchConfig.defaults().withParallelism(3).withForkDepthThreshold(0).withMaxDepthLimit(12);

        assertEquals(3, config.parallelism());
        assertEquals(0, config.forkDepthThreshold());
        assertEquals(12, config.maxDepthLimit());
        assertTrue(config.isDepthBounded());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new SearchConfig(0, 8, 10));
        assertThrows(IllegalArgumentException.class, () -> new SearchConfig(1, -1, 10));
        assertThrows(IllegalArgumentException.class, () -> new SearchConfig(1, 8, 0));
    }
}
