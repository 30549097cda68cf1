package domain.engine;

import domain.model.SearchOutcome;

/**
 * A search for the cheapest expression that evaluates to a goal value.
 *
 * <p>Implementations own their {@link SearchState}; an instance performs one run.
 *
 * <h3>Implemented strategies</h3>
 * <ul>
 *   <li>{@link BestFirstSearchEngine}: uniform-cost best-first expansion on term count</li>
 * </ul>
 *
 * @see application.SearchEngineFactory
 */
public interface SearchEngine {

    /**
     * Runs the search to a terminal state.
     *
     * @return {@link SearchOutcome.Status#SUCCEEDED} with a minimal expression, or
     *         {@link SearchOutcome.Status#FAILED} if the goal is unreachable
     * @throws SearchInvariantException if an internal invariant is violated
     * @throws IllegalStateException    if this instance has already run
     */
    SearchOutcome search();

    /**
     * Returns the state this engine operates on, for inspection after a run.
     *
     * @return the run state
     */
    SearchState getState();
}
