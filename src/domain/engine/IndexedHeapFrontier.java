package domain.engine;

import domain.model.ExpressionNode;

import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Frontier realized as a cost-ordered heap over an authoritative value→node map.
 *
 * <h3>Design: Lazy Eviction</h3>
 * <ul>
 *   <li><b>Insert/improve:</b> O(log n). The map is updated and a new heap record is
 *       pushed; the record for the previous, more expensive node is left in place.</li>
 *   <li><b>Extract:</b> heap records are popped until one matches the map (same value,
 *       same cost). Every other record is stale and is dropped.</li>
 *   <li><b>Eviction:</b> dead entries are removed from the map only; their heap records
 *       become stale and are dropped on the way.</li>
 * </ul>
 *
 * <p>Each record is popped at most once, so the amortized cost of skipping stale records
 * is O(log n) per insertion that produced them.
 *
 * <p>Ties between equal-cost records are broken by insertion order.
 *
 * <p>Keys are compared with {@link Double#equals(Object)}; callers pass canonical values
 * (see {@link domain.model.NumericDomain#canonical(double)}).
 */
public final class IndexedHeapFrontier implements Frontier {

    /** Heap record: a (cost, value) claim checked against {@link #live} on extraction. */
    private static final class Record {
        final int cost;
        final long sequence;
        final double value;

        Record(int cost, long sequence, double value) {
            this.cost = cost;
            this.sequence = sequence;
            this.value = value;
        }
    }

    private final Map<Double, ExpressionNode> live = new HashMap<>();
    private final PriorityQueue<Record> heap = new PriorityQueue<>(
        Comparator.comparingInt((Record r) -> r.cost).thenComparingLong(r -> r.sequence));

    private long nextSequence = 0;
    private int lastExtractedCost = 0;
    private long deadCount = 0;
    private long staleSkipped = 0;

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
        heap.offer(new Record(node.termCount, nextSequence++, node.value));
        return true;
    }

    @Override
    public ExpressionNode extractMin() {
        if (live.isEmpty()) {
            throw new SearchInvariantException("extractMin on an empty frontier");
        }
        while (true) {
            Record record = heap.poll();
            if (record == null) {
                throw new SearchInvariantException(
                    "Frontier bookkeeping broken: " + live.size() + " live entries without heap records");
            }
            ExpressionNode node = live.get(record.value);
            if (node == null || node.termCount != record.cost) {
                staleSkipped++;
                continue;
            }
            live.remove(record.value);
            lastExtractedCost = node.termCount;
            if (live.isEmpty() && !heap.isEmpty()) {
                // Only stale records remain
                staleSkipped += heap.size();
                heap.clear();
            }
            return node;
        }
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

    @Override
    public int lastExtractedCost() {
        return lastExtractedCost;
    }

    @Override
    public int size() {
        return heap.size();
    }

    @Override
    public int liveCount() {
        return live.size();
    }

    @Override
    public int staleCount() {
        return heap.size() - live.size();
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
