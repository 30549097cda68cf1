package domain.engine;

import domain.model.ExpressionNode;
import domain.model.Operator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Behaviour every {@link Frontier} realization must share.
 */
abstract class FrontierContract {

    protected Frontier frontier;

    protected abstract Frontier createFrontier();

    @BeforeEach
    void setUp() {
        frontier = createFrontier();
    }

    static ExpressionNode node(double value, int cost) {
        return new ExpressionNode(value, 1, 1, cost, Operator.ADD);
    }

    @Test
    void startsEmpty() {
        assertTrue(frontier.isEmpty());
        assertEquals(0, frontier.liveCount());
        assertEquals(0, frontier.lastExtractedCost());
    }

    @Test
    void extractsInNonDecreasingCost() {
        frontier.insertOrImprove(node(30, 3));
        frontier.insertOrImprove(node(10, 1));
        frontier.insertOrImprove(node(20, 2));
        frontier.insertOrImprove(node(21, 2));

        List<Integer> costs = new ArrayList<>();
        while (!frontier.isEmpty()) {
            costs.add(frontier.extractMin().termCount);
        }
        assertEquals(List.of(1, 2, 2, 3), costs);
        assertEquals(3, frontier.lastExtractedCost());
    }

    @Test
    void sameCostNodesAreAllExtracted() {
        frontier.insertOrImprove(node(5, 2));
        frontier.insertOrImprove(node(6, 2));
        frontier.insertOrImprove(node(7, 2));

        Set<Double> values = new HashSet<>();
        for (int i = 0; i < 3; i++) {
            values.add(frontier.extractMin().value);
        }
        assertEquals(Set.of(5.0, 6.0, 7.0), values);
        assertTrue(frontier.isEmpty());
    }

    @Test
    void reinsertingTheSameNodeIsNoOp() {
        assertTrue(frontier.insertOrImprove(node(5, 3)));
        assertFalse(frontier.insertOrImprove(node(5, 3)));
        assertEquals(1, frontier.liveCount());
        assertEquals(5.0, frontier.extractMin().value);
        assertTrue(frontier.isEmpty());
    }

    @Test
    void cheaperNodeReplacesLiveEntry() {
        assertTrue(frontier.insertOrImprove(node(5, 4)));
        assertTrue(frontier.insertOrImprove(node(5, 2)));

        assertEquals(2, frontier.lookup(5).termCount);
        assertEquals(1, frontier.liveCount());

        ExpressionNode extracted = frontier.extractMin();
        assertEquals(2, extracted.termCount);
        assertTrue(frontier.isEmpty());
    }

    @Test
    void costlierNodeIsDiscarded() {
        frontier.insertOrImprove(node(5, 2));
        assertFalse(frontier.insertOrImprove(node(5, 3)));
        assertEquals(2, frontier.lookup(5).termCount);
    }

    @Test
    void supersededEntryIsNeverExtracted() {
        frontier.insertOrImprove(node(1, 3));
        frontier.insertOrImprove(node(2, 4));
        frontier.insertOrImprove(node(2, 2));

        ExpressionNode first = frontier.extractMin();
        ExpressionNode second = frontier.extractMin();
        assertEquals(2.0, first.value);
        assertEquals(2, first.termCount);
        assertEquals(1.0, second.value);
        assertTrue(frontier.isEmpty());
    }

    @Test
    void lookupAndContains() {
        frontier.insertOrImprove(node(42, 2));
        assertTrue(frontier.contains(42));
        assertFalse(frontier.contains(43));
        assertNull(frontier.lookup(43));

        frontier.extractMin();
        assertFalse(frontier.contains(42));
    }

    @Test
    void extractFromEmptyThrows() {
        assertThrows(SearchInvariantException.class, () -> frontier.extractMin());
    }

    @Test
    void insertAtOrBelowExtractedCostThrows() {
        frontier.insertOrImprove(node(5, 2));
        frontier.extractMin();

        assertThrows(SearchInvariantException.class, () -> frontier.insertOrImprove(node(6, 2)));
        assertThrows(SearchInvariantException.class, () -> frontier.insertOrImprove(node(7, 1)));
        assertTrue(frontier.insertOrImprove(node(8, 3)));
    }

    @Test
    void nonPositiveCostThrows() {
        assertThrows(SearchInvariantException.class, () -> frontier.insertOrImprove(node(5, 0)));
    }

    @Test
    void discardEvictsDeadEntriesButKeepsExemptValue() {
        frontier.insertOrImprove(node(1, 2));
        frontier.insertOrImprove(node(2, 3));
        frontier.insertOrImprove(node(3, 4));
        frontier.insertOrImprove(node(99, 5));

        frontier.discardAtOrAbove(3, 99);

        assertEquals(2, frontier.liveCount());
        assertEquals(2, frontier.deadCount());
        assertTrue(frontier.contains(1));
        assertTrue(frontier.contains(99));
        assertFalse(frontier.contains(2));

        assertEquals(1.0, frontier.extractMin().value);
        assertEquals(99.0, frontier.extractMin().value);
        assertTrue(frontier.isEmpty());
    }

    @Test
    void discardingEverythingEmptiesTheFrontier() {
        frontier.insertOrImprove(node(1, 4));
        frontier.insertOrImprove(node(2, 5));

        frontier.discardAtOrAbove(2, 1000);

        assertTrue(frontier.isEmpty());
        assertThrows(SearchInvariantException.class, () -> frontier.extractMin());
    }
}
