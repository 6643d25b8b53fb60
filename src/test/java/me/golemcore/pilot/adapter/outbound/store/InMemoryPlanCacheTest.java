package me.golemcore.pilot.adapter.outbound.store;

import me.golemcore.pilot.domain.model.PlanningResult;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryPlanCacheTest {

    private static InMemoryPlanCache cacheOf(int maxEntries) {
        PilotProperties properties = new PilotProperties();
        properties.getPlanner().setCacheMaxEntries(maxEntries);
        return new InMemoryPlanCache(properties);
    }

    private static PlanningResult result(double confidence) {
        return PlanningResult.builder().confidence(confidence).build();
    }

    @Test
    void shouldReturnStoredResult() {
        InMemoryPlanCache cache = cacheOf(4);
        PlanningResult stored = result(0.8);

        cache.store("objective @ ", stored);

        assertEquals(stored, cache.lookup("objective @ ").orElseThrow());
        assertTrue(cache.lookup("other @ ").isEmpty());
    }

    @Test
    void shouldEvictLeastRecentlyUsedEntry() {
        InMemoryPlanCache cache = cacheOf(2);
        cache.store("a", result(0.1));
        cache.store("b", result(0.2));
        cache.lookup("a");

        cache.store("c", result(0.3));

        assertEquals(2, cache.size());
        assertTrue(cache.lookup("a").isPresent());
        assertTrue(cache.lookup("b").isEmpty());
        assertTrue(cache.lookup("c").isPresent());
    }

    @Test
    void shouldKeepAtLeastOneEntry() {
        InMemoryPlanCache cache = cacheOf(0);

        cache.store("a", result(0.1));

        assertEquals(1, cache.size());
    }
}
