package application;

import domain.engine.IndexedHeapFrontier;
import domain.engine.LevelBucketFrontier;
import domain.engine.SearchEngine;
import domain.observer.SearchObserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class SearchEngineFactoryTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(SearchEngineFactory.PROP_FRONTIER_STRATEGY);
    }

    @Test
    void createsFrontierPerStrategy() {
        assertInstanceOf(IndexedHeapFrontier.class,
            SearchEngineFactory.createFrontier(SearchConfiguration.FrontierStrategy.INDEXED_HEAP));
        assertInstanceOf(LevelBucketFrontier.class,
            SearchEngineFactory.createFrontier(SearchConfiguration.FrontierStrategy.LEVEL_BUCKET));
    }

    @Test
    void systemPropertySelectsStrategy() {
        assumeTrue(System.getenv(SearchEngineFactory.ENV_FRONTIER_STRATEGY) == null);

        System.setProperty(SearchEngineFactory.PROP_FRONTIER_STRATEGY, "level_bucket");
        assertEquals(SearchConfiguration.FrontierStrategy.LEVEL_BUCKET,
            SearchEngineFactory.configuredFrontierStrategy());
    }

    @Test
    void invalidPropertyFallsBackToDefault() {
        assumeTrue(System.getenv(SearchEngineFactory.ENV_FRONTIER_STRATEGY) == null);

        System.setProperty(SearchEngineFactory.PROP_FRONTIER_STRATEGY, "fibonacci");
        assertEquals(SearchEngineFactory.DEFAULT_FRONTIER_STRATEGY,
            SearchEngineFactory.configuredFrontierStrategy());
    }

    @Test
    void engineUsesConfiguredFrontier() {
        SearchConfiguration config = new SearchConfiguration.Builder()
            .setGoal(10)
            .setSeeds(List.of(3.0))
            .setFrontierStrategy(SearchConfiguration.FrontierStrategy.LEVEL_BUCKET)
            .build();

        SearchEngine engine = SearchEngineFactory.createSearchEngine(config, SearchObserver.NONE);

        assertInstanceOf(LevelBucketFrontier.class, engine.getState().getFrontier());
        assertEquals(20, engine.getState().getBestTermCount());
        assertTrue(engine.search().isSuccess());
    }
}
