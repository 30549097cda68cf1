package application;

import domain.engine.BestFirstSearchEngine;
import domain.engine.CandidateGenerator;
import domain.engine.Frontier;
import domain.engine.IndexedHeapFrontier;
import domain.engine.LevelBucketFrontier;
import domain.engine.SearchEngine;
import domain.engine.SearchState;
import domain.observer.SearchObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating {@link SearchEngine} instances and their parts from configuration.
 *
 * <p>Centralizes all engine creation logic in a single class. This decouples
 * {@link SearchOrchestrator} from the concrete frontier realizations and makes it easy to
 * add one without touching the orchestrator.
 *
 * <h3>Supported frontier strategies</h3>
 * <ul>
 *   <li><b>INDEXED_HEAP</b>: cost-ordered heap, lazy stale-record skipping (default)</li>
 *   <li><b>LEVEL_BUCKET</b>: per-level cache rebuilt by scanning the live entries</li>
 * </ul>
 *
 * <h3>Configuration</h3>
 * <p>The default strategy can be selected via:
 * <ul>
 *   <li>Environment variable: {@code MINTERM_FRONTIER=LEVEL_BUCKET}</li>
 *   <li>System property: {@code -Dminterm.frontier=INDEXED_HEAP}</li>
 *   <li>Explicitly: {@link SearchConfiguration.Builder#setFrontierStrategy}</li>
 * </ul>
 *
 * @see SearchEngine
 * @see SearchConfiguration.FrontierStrategy
 */
public final class SearchEngineFactory {

    private static final Logger log = LoggerFactory.getLogger(SearchEngineFactory.class);

    /**
     * Environment variable for configuring the frontier strategy.
     */
    static final String ENV_FRONTIER_STRATEGY = "MINTERM_FRONTIER";

    /**
     * System property for configuring the frontier strategy.
     */
    static final String PROP_FRONTIER_STRATEGY = "minterm.frontier";

    /**
     * Strategy used when nothing is configured.
     */
    static final SearchConfiguration.FrontierStrategy DEFAULT_FRONTIER_STRATEGY =
        SearchConfiguration.FrontierStrategy.INDEXED_HEAP;

    /**
     * Creates an empty {@link Frontier} for the given strategy.
     *
     * @param strategy the frontier strategy from configuration
     * @return a new, empty frontier
     * @throws IllegalStateException if strategy is unknown
     */
    public static Frontier createFrontier(SearchConfiguration.FrontierStrategy strategy) {
        switch (strategy) {
            case INDEXED_HEAP:
                return new IndexedHeapFrontier();

            case LEVEL_BUCKET:
                return new LevelBucketFrontier();

            default:
                throw new IllegalStateException(
                    "Unknown frontier strategy: " + strategy + ". " +
                    "This indicates a configuration validation bug.");
        }
    }

    /**
     * Creates a fresh {@link SearchState} (empty frontier and closed store).
     *
     * @param config search configuration
     * @return run state for one search
     */
    public static SearchState createState(SearchConfiguration config) {
        return new SearchState(
            createFrontier(config.getFrontierStrategy()),
            config.getGoal(),
            config.getInitialTermBound());
    }

    /**
     * Creates a candidate generator for the configured domain and operator set.
     *
     * @param config search configuration
     * @return the generator
     */
    public static CandidateGenerator createGenerator(SearchConfiguration config) {
        return new CandidateGenerator(config.getNumericDomain(), config.getOperators());
    }

    /**
     * Creates a ready-to-run {@link SearchEngine}.
     *
     * @param config   search configuration
     * @param observer progress observer
     * @return a single-use engine owning a fresh state
     */
    public static SearchEngine createSearchEngine(SearchConfiguration config, SearchObserver observer) {
        return new BestFirstSearchEngine(
            createState(config),
            createGenerator(config),
            config.getSeeds(),
            config.getGoalTolerance(),
            config.getMinMagnitude(),
            config.getMaxMagnitude(),
            observer);
    }

    /**
     * Gets the configured frontier strategy from environment or system properties.
     *
     * @return configured strategy, or {@link #DEFAULT_FRONTIER_STRATEGY} if not configured
     */
    public static SearchConfiguration.FrontierStrategy configuredFrontierStrategy() {
        // Check environment variable first
        String envStrategy = System.getenv(ENV_FRONTIER_STRATEGY);
        if (envStrategy != null && !envStrategy.isEmpty()) {
            try {
                return SearchConfiguration.FrontierStrategy.valueOf(envStrategy.toUpperCase());
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring invalid frontier strategy in {}: {}", ENV_FRONTIER_STRATEGY, envStrategy);
            }
        }

        // Check system property
        String propStrategy = System.getProperty(PROP_FRONTIER_STRATEGY);
        if (propStrategy != null && !propStrategy.isEmpty()) {
            try {
                return SearchConfiguration.FrontierStrategy.valueOf(propStrategy.toUpperCase());
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring invalid frontier strategy in {}: {}", PROP_FRONTIER_STRATEGY, propStrategy);
            }
        }

        return DEFAULT_FRONTIER_STRATEGY;
    }

    /**
     * Private constructor to prevent instantiation.
     *
     * <p>This is a pure utility class with only static factory methods.
     */
    private SearchEngineFactory() {
        throw new AssertionError("Factory class: do not instantiate");
    }
}
