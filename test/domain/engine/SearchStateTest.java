package domain.engine;

import domain.model.ExpressionNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SearchStateTest {

    @Test
    void goalBoundOnlyDecreases() {
        SearchState state = new SearchState(new IndexedHeapFrontier(), 7, 17);
        assertFalse(state.isGoalFound());
        assertEquals(17, state.getBestTermCount());

        state.improveGoal(9);
        assertTrue(state.isGoalFound());
        assertEquals(9, state.getBestTermCount());

        assertThrows(SearchInvariantException.class, () -> state.improveGoal(9));
        assertThrows(SearchInvariantException.class, () -> state.improveGoal(12));
        state.improveGoal(4);
        assertEquals(4, state.getBestTermCount());
    }

    @Test
    void lookupPrefersSettledNode() {
        SearchState state = new SearchState(new LevelBucketFrontier(), 7, 17);
        ExpressionNode leaf = ExpressionNode.leaf(3);
        state.getClosed().settle(leaf);
        ExpressionNode open = FrontierContract.node(6, 2);
        state.getFrontier().insertOrImprove(open);

        assertSame(leaf, state.lookupBestKnown(3));
        assertSame(open, state.lookupBestKnown(6));
        assertNull(state.lookupBestKnown(8));
    }
}
