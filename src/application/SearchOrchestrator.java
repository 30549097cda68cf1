package application;

import domain.engine.SearchEngine;
import domain.model.SearchOutcome;
import domain.observer.LoggingSearchObserver;
import domain.observer.SearchObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one minimal-expression search from a validated configuration.
 *
 * <h3>Phase sequence</h3>
 * <ol>
 *   <li><b>SETUP</b>: build the frontier, closed store and candidate generator for the
 *       configured strategy, domain and operator set.</li>
 *   <li><b>SEARCH</b>: best-first expansion until the goal bound is proven or the frontier
 *       is exhausted.</li>
 * </ol>
 *
 * <p>A fresh engine (and thus a fresh state) is built for every call to {@link #search()},
 * so one orchestrator may be reused.
 *
 * @see SearchConfiguration
 * @see SearchEngineFactory
 */
public final class SearchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SearchOrchestrator.class);

    private final SearchConfiguration config;
    private final SearchObserver observer;

    /**
     * Constructs an orchestrator that reports progress to the log.
     *
     * @param config immutable search parameters
     */
    public SearchOrchestrator(SearchConfiguration config) {
        this(config, new LoggingSearchObserver(config.getNumericDomain()));
    }

    /**
     * Constructs an orchestrator with a custom observer.
     *
     * @param config   immutable search parameters
     * @param observer progress observer
     */
    public SearchOrchestrator(SearchConfiguration config, SearchObserver observer) {
        this.config = config;
        this.observer = observer;
    }

    /**
     * Executes the search.
     *
     * @return the outcome; {@link SearchOutcome.Status#FAILED} if the goal is unreachable
     * @throws domain.engine.SearchInvariantException if the engine detects an internal defect
     */
    public SearchOutcome search() {
        long startTime = System.currentTimeMillis();

        // PHASE 1: Setup
        if (config.isDebugMode()) {
            log.info("[Phase 1: SETUP] {}", config);
        }
        SearchEngine engine = SearchEngineFactory.createSearchEngine(config, observer);
        logPhaseCompletion(1, startTime);

        // PHASE 2: Search
        long phase2Start = System.currentTimeMillis();
        if (config.isDebugMode()) {
            log.info("[Phase 2: SEARCH] Best-first search over {} seed(s) for goal {}",
                config.getSeeds().size(), config.getNumericDomain().format(config.getGoal()));
        }
        SearchOutcome outcome = engine.search();
        logPhaseCompletion(2, phase2Start);

        if (config.isDebugMode()) {
            long totalTime = System.currentTimeMillis() - startTime;
            log.info("[TOTAL] Time: {} ms, {}", totalTime, outcome.getStatistics());
        }
        return outcome;
    }

    public SearchConfiguration getConfig() {
        return config;
    }

    /**
     * Logs phase completion time if debug mode is enabled.
     *
     * @param phaseNumber the phase number (1 or 2)
     * @param startTime   phase start time in milliseconds
     */
    private void logPhaseCompletion(int phaseNumber, long startTime) {
        if (config.isDebugMode()) {
            long duration = System.currentTimeMillis() - startTime;
            log.info("[Phase {}] Time: {} ms", phaseNumber, duration);
        }
    }
}
