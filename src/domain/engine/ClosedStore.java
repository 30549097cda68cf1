package domain.engine;

import domain.model.ExpressionNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only store of settled values: each holds its proven-minimal node.
 *
 * <p>Entries are never updated or removed. Besides the value lookup, the store keeps
 * nodes in settle order; since nodes are settled straight out of
 * {@link Frontier#extractMin()}, that order is non-decreasing in term count.
 */
public final class ClosedStore {

    private final Map<Double, ExpressionNode> byValue = new HashMap<>();
    private final List<ExpressionNode> settleOrder = new ArrayList<>();

    /**
     * Settles a node.
     *
     * @param node the node just extracted from the frontier
     * @throws SearchInvariantException if the value is already settled, or if the node is
     *                                  cheaper than the last settled one
     */
    public void settle(ExpressionNode node) {
        if (byValue.containsKey(node.value)) {
            throw new SearchInvariantException("Value settled twice: " + node);
        }
        if (!settleOrder.isEmpty()
                && settleOrder.get(settleOrder.size() - 1).termCount > node.termCount) {
            throw new SearchInvariantException("Settle order is not monotonic at " + node);
        }
        byValue.put(node.value, node);
        settleOrder.add(node);
    }

    public boolean contains(double value) {
        return byValue.containsKey(value);
    }

    /**
     * Returns the settled node for a value.
     *
     * @param value the value to look up
     * @return the node, or {@code null} if the value is not settled
     */
    public ExpressionNode get(double value) {
        return byValue.get(value);
    }

    /**
     * Returns all settled nodes in settle order (non-decreasing term count).
     *
     * @return read-only view; grows as nodes are settled
     */
    public List<ExpressionNode> settledInOrder() {
        return Collections.unmodifiableList(settleOrder);
    }

    public int size() {
        return settleOrder.size();
    }
}
