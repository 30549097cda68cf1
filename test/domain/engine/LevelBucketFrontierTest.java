package domain.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LevelBucketFrontierTest extends FrontierContract {

    @Override
    protected Frontier createFrontier() {
        return new LevelBucketFrontier();
    }

    @Test
    void levelAdvancesOnlyWhenDrained() {
        LevelBucketFrontier buckets = (LevelBucketFrontier) frontier;
        buckets.insertOrImprove(node(1, 2));
        buckets.insertOrImprove(node(2, 2));
        buckets.insertOrImprove(node(3, 4));

        buckets.extractMin();
        assertEquals(2, buckets.currentLevel());
        assertEquals(1, buckets.levelSize());
        assertEquals(1, buckets.levelScans());

        // A later level may still receive inserts while the current one drains
        buckets.insertOrImprove(node(4, 3));
        buckets.extractMin();
        assertEquals(0, buckets.levelSize());

        assertEquals(4.0, buckets.extractMin().value);
        assertEquals(3, buckets.currentLevel());
        assertEquals(3.0, buckets.extractMin().value);
        assertEquals(4, buckets.currentLevel());
        assertEquals(3, buckets.levelScans());
    }

    @Test
    void neverReportsStaleRecords() {
        frontier.insertOrImprove(node(5, 4));
        frontier.insertOrImprove(node(5, 2));

        assertEquals(0, frontier.staleCount());
        assertEquals(1, frontier.size());
    }
}
