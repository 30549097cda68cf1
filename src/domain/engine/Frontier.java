package domain.engine;

import domain.model.ExpressionNode;

/**
 * The open set: discovered expressions whose minimal cost is not yet proven.
 *
 * <p>Keyed by value; holds at most one <em>live</em> node per value. Implementations may
 * keep superseded records around (stale records) as long as {@link #extractMin()} never
 * returns one.
 *
 * <h3>Implementations</h3>
 * <ul>
 *   <li>{@link IndexedHeapFrontier}: cost-ordered heap with lazy stale-record skipping (default)</li>
 *   <li>{@link LevelBucketFrontier}: cost-level cache rebuilt by a forward-moving scan</li>
 * </ul>
 *
 * <h3>Monotonic front</h3>
 * <p>Every inserted node must cost strictly more than the most recently extracted one.
 * Once a cost level has been drained nothing cheaper can legitimately appear, so a
 * violation is reported as a {@link SearchInvariantException}.
 *
 * <p>Not thread-safe: a frontier is owned by a single {@link SearchState}.
 */
public interface Frontier {

    /**
     * Adds a node, or replaces the live node for the same value if this one is strictly
     * cheaper. A node that is not cheaper than the live one is discarded.
     *
     * @param node the candidate node
     * @return {@code true} if {@code node} is now the live entry for its value
     * @throws SearchInvariantException if {@code node.termCount < 1} or does not exceed
     *                                  {@link #lastExtractedCost()}
     */
    boolean insertOrImprove(ExpressionNode node);

    /**
     * Removes and returns a live node of globally minimal cost.
     *
     * @return the extracted node
     * @throws SearchInvariantException if the frontier has no live entry
     */
    ExpressionNode extractMin();

    /**
     * Returns the live node for a value.
     *
     * @param value the value to look up
     * @return the live node, or {@code null} if the value is not open
     */
    ExpressionNode lookup(double value);

    /**
     * Returns whether a value is open.
     *
     * @param value the value to check
     * @return {@code true} if a live node exists for {@code value}
     */
    boolean contains(double value);

    /**
     * Returns whether there is no live entry left.
     *
     * @return {@code true} if {@link #extractMin()} would fail
     */
    boolean isEmpty();

    /**
     * Evicts live entries that cost {@code costCeiling} or more, except the entry for
     * {@code exemptValue}. Such entries can no longer lead to a cheaper goal expression.
     *
     * @param costCeiling entries at or above this cost are dead
     * @param exemptValue value that must survive (the goal)
     */
    void discardAtOrAbove(int costCeiling, double exemptValue);

    /** Cost of the most recently extracted node; 0 before the first extraction. */
    int lastExtractedCost();

    /** Physical number of records held, stale ones included. */
    int size();

    /** Number of live entries. */
    int liveCount();

    /** Number of superseded records still held. */
    int staleCount();

    /** Total number of entries evicted by {@link #discardAtOrAbove(int, double)}. */
    long deadCount();

    /** Total number of stale records skipped by {@link #extractMin()}. */
    long staleSkipped();
}
