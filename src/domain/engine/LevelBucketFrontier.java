package domain.engine;

import domain.model.ExpressionNode;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Frontier realized as a value→node map plus a cache of every value at the current
 * minimum cost level.
 *
 * <p>Insertion is a plain map update. When the level cache runs dry, one scan over the
 * live map finds the next minimum cost and caches all values at that cost. The level only
 * moves forward (the monotonic front guarantees nothing cheaper can arrive), so each live
 * entry is scanned once per level it waits through.
 *
 * <p>A cached value sits at the global minimum cost, so it can neither be improved nor be
 * evicted as dead; the cache therefore never holds superseded values and
 * {@link #staleCount()} is always zero. Popped values are still checked against the map.
 *
 * <p>Keys are compared with {@link Double#equals(Object)}; callers pass canonical values.
 */
public final class LevelBucketFrontier implements Frontier {

    private final Map<Double, ExpressionNode> live = new HashMap<>();
    private final ArrayDeque<Double> levelCache = new ArrayDeque<>();

    private int level = 0;
    private int lastExtractedCost = 0;
    private long deadCount = 0;
    private long staleSkipped = 0;
    private long levelScans = 0;

    @Override
    public boolean insertOrImprove(ExpressionNode node) {
        if (node.termCount < 1) {
            throw new SearchInvariantException("Non-positive term count: " + node);
        }
        if (node.termCount <= lastExtractedCost) {
            throw new SearchInvariantException(
                "Monotonic front violated: cost " + node.termCount
                    + " inserted after extracting cost " + lastExtractedCost + " (" + node + ")");
        }

        ExpressionNode existing = live.get(node.value);
        if (existing != null && existing.termCount <= node.termCount) {
            return false;
        }
        live.put(node.value, node);
        return true;
    }

    @Override
    public ExpressionNode extractMin() {
        if (live.isEmpty()) {
            throw new SearchInvariantException("extractMin on an empty frontier");
        }
        while (true) {
            if (levelCache.isEmpty()) {
                recache();
            }
            Double value = levelCache.poll();
            ExpressionNode node = live.get(value);
            if (node == null || node.termCount != level) {
                staleSkipped++;
                continue;
            }
            live.remove(value);
            lastExtractedCost = level;
            return node;
        }
    }

    /**
     * Advances {@link #level} to the minimum live cost and caches every value at it.
     */
    private void recache() {
        int min = Integer.MAX_VALUE;
        for (ExpressionNode node : live.values()) {
            if (node.termCount < min) {
                min = node.termCount;
                levelCache.clear();
            }
            if (node.termCount == min) {
                levelCache.add(node.value);
            }
        }
        if (min <= level) {
            throw new SearchInvariantException(
                "Level scan moved backwards: minimum cost " + min + " at level " + level);
        }
        level = min;
        levelScans++;
    }

    @Override
    public ExpressionNode lookup(double value) {
        return live.get(value);
    }

    @Override
    public boolean contains(double value) {
        return live.containsKey(value);
    }

    @Override
    public boolean isEmpty() {
        return live.isEmpty();
    }

    @Override
    public void discardAtOrAbove(int costCeiling, double exemptValue) {
        Iterator<ExpressionNode> it = live.values().iterator();
        while (it.hasNext()) {
            ExpressionNode node = it.next();
            if (node.termCount >= costCeiling && Double.compare(node.value, exemptValue) != 0) {
                it.remove();
                deadCount++;
            }
        }
    }

    /**
     * Returns the cost level currently being drained.
     *
     * @return the current level; 0 before the first extraction
     */
    public int currentLevel() {
        return level;
    }

    /**
     * Returns how many values remain cached at the current level.
     *
     * @return level cache size
     */
    public int levelSize() {
        return levelCache.size();
    }

    /**
     * Returns how many level scans have been performed.
     *
     * @return number of full scans over the live map
     */
    public long levelScans() {
        return levelScans;
    }

    @Override
    public int lastExtractedCost() {
        return lastExtractedCost;
    }

    @Override
    public int size() {
        return live.size();
    }

    @Override
    public int liveCount() {
        return live.size();
    }

    @Override
    public int staleCount() {
        return 0;
    }

    @Override
    public long deadCount() {
        return deadCount;
    }

    @Override
    public long staleSkipped() {
        return staleSkipped;
    }
}
