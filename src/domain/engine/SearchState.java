package domain.engine;

import domain.model.ExpressionNode;

/**
 * All mutable state of one search run: the open set, the settled set and the best known
 * term count for the goal.
 *
 * <p>Owned by exactly one {@link SearchEngine}. The access pattern is strictly
 * single-threaded, so no field is guarded.
 *
 * <h3>Invariants</h3>
 * <ul>
 *   <li>A value is open or settled, never both.</li>
 *   <li>{@link #getBestTermCount()} only decreases.</li>
 *   <li>Once {@link #isGoalFound()} holds, the goal value is open or settled.</li>
 * </ul>
 */
public final class SearchState {

    private final Frontier frontier;
    private final ClosedStore closed;
    private final double goal;
    private int bestTermCount;
    private boolean goalFound = false;

    /**
     * Creates the state for one run.
     *
     * @param frontier         an empty frontier
     * @param goal             canonical goal value
     * @param initialTermBound loose upper bound on the goal's term count; candidates must
     *                         cost strictly less
     */
    public SearchState(Frontier frontier, double goal, int initialTermBound) {
        this.frontier = frontier;
        this.closed = new ClosedStore();
        this.goal = goal;
        this.bestTermCount = initialTermBound;
    }

    public Frontier getFrontier() { return frontier; }
    public ClosedStore getClosed() { return closed; }
    public double getGoal() { return goal; }
    public int getBestTermCount() { return bestTermCount; }
    public boolean isGoalFound() { return goalFound; }

    /**
     * Records a cheaper expression for the goal.
     *
     * @param termCount cost of the new goal expression
     * @throws SearchInvariantException if {@code termCount} does not improve the bound
     */
    void improveGoal(int termCount) {
        if (termCount >= bestTermCount) {
            throw new SearchInvariantException(
                "Goal bound must strictly decrease: " + termCount + " >= " + bestTermCount);
        }
        bestTermCount = termCount;
        goalFound = true;
    }

    /**
     * Returns the best known node for a value: the settled node if any, else the open one.
     *
     * @param value the value to look up
     * @return the node, or {@code null} if the value is unknown
     */
    public ExpressionNode lookupBestKnown(double value) {
        ExpressionNode node = closed.get(value);
        return node != null ? node : frontier.lookup(value);
    }
}
