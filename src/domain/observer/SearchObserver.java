package domain.observer;

import domain.model.ExpressionNode;
import domain.model.SearchOutcome;

/**
 * Receives advisory progress events from a running search.
 *
 * <p>Callbacks run synchronously on the search thread and must not touch search state;
 * they have no influence on the result.
 */
public interface SearchObserver {

    /** Observer that ignores every event. */
    SearchObserver NONE = new SearchObserver() {
        @Override
        public void onLevelReached(int level, int openCount, int settledCount) {
        }

        @Override
        public void onProgress(ExpressionNode expanding, long expansions, int openCount, int settledCount) {
        }

        @Override
        public void onGoalImproved(int termCount, String expression) {
        }

        @Override
        public void onSearchComplete(SearchOutcome outcome) {
        }
    };

    /**
     * A node of a higher cost than any before was settled.
     *
     * @param level        the new cost level
     * @param openCount    live frontier entries
     * @param settledCount settled values
     */
    void onLevelReached(int level, int openCount, int settledCount);

    /**
     * Periodic progress report (geometric cadence).
     *
     * @param expanding    node just settled
     * @param expansions   nodes settled so far
     * @param openCount    live frontier entries
     * @param settledCount settled values
     */
    void onProgress(ExpressionNode expanding, long expansions, int openCount, int settledCount);

    /**
     * A cheaper expression for the goal was discovered. It is not final yet.
     *
     * @param termCount  cost of the new witness
     * @param expression witness in infix form
     */
    void onGoalImproved(int termCount, String expression);

    /**
     * The search reached a terminal state.
     *
     * @param outcome the final result
     */
    void onSearchComplete(SearchOutcome outcome);
}
