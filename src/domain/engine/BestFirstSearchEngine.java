package domain.engine;

import domain.model.ExpressionNode;
import domain.model.NumericDomain;
import domain.model.SearchOutcome;
import domain.model.SearchStatistics;
import domain.observer.SearchObserver;

import java.util.List;
import java.util.function.Consumer;

/**
 * Best-first (uniform-cost) search: always settles the open expression with the fewest
 * terms.
 *
 * <h3>Loop</h3>
 * <ol>
 *   <li>Seed every seed value as a one-term leaf.</li>
 *   <li>Extract the cheapest open node {@code N} and settle it.</li>
 *   <li>Combine {@code N} with every settled node (itself included) and pass each
 *       candidate through the discover filter.</li>
 *   <li>Stop once {@code bestTermCount <= N.termCount + 1}.</li>
 * </ol>
 *
 * <h3>Discover filter</h3>
 * A candidate enters the frontier only if its value is not settled, its magnitude lies in
 * {@code [minMagnitude, maxMagnitude)}, and it costs strictly less than the best known goal
 * expression. A value matching the goal (within tolerance in REAL mode) is snapped to the
 * exact goal first.
 *
 * <p><b>Optimality:</b> every future candidate combines two settled nodes, so it costs at
 * least {@code N.termCount + 1} (assuming one-term leaves). Once that reaches the goal
 * bound no cheaper goal expression can appear.
 * <br><b>Memory:</b> bounded by the magnitude band and the cost bound; frontier entries
 * that can no longer beat the bound are evicted whenever it tightens.
 */
public final class BestFirstSearchEngine implements SearchEngine {

    /** Expansion count of the first progress report; later reports come every 3/2 as many. */
    static final long FIRST_PROGRESS_REPORT = 100;

    private final SearchState state;
    private final CandidateGenerator generator;
    private final ExpressionRenderer renderer;
    private final SearchObserver observer;
    private final List<Double> seeds;
    private final NumericDomain domain;
    private final double goal;
    private final double goalTolerance;
    private final double minMagnitude;
    private final double maxMagnitude;
    private final Consumer<ExpressionNode> discoverSink = this::discover;

    private boolean started = false;
    private long expansions = 0;
    private long nextProgressReport = FIRST_PROGRESS_REPORT;
    private long candidatesGenerated = 0;
    private long candidatesAccepted = 0;

    /**
     * Constructs a best-first engine.
     *
     * @param state         fresh run state (empty frontier and closed store)
     * @param generator     candidate generator for the active domain and operator set
     * @param seeds         seed values (canonical, at least one)
     * @param goalTolerance REAL-mode goal matching tolerance
     * @param minMagnitude  inclusive lower bound on candidate magnitude
     * @param maxMagnitude  exclusive upper bound on candidate magnitude
     * @param observer      progress observer
     */
    public BestFirstSearchEngine(SearchState state,
                                 CandidateGenerator generator,
                                 List<Double> seeds,
                                 double goalTolerance,
                                 double minMagnitude,
                                 double maxMagnitude,
                                 SearchObserver observer) {
        this.state = state;
        this.generator = generator;
        this.domain = generator.getDomain();
        this.renderer = new ExpressionRenderer(state, domain);
        this.observer = observer;
        this.seeds = seeds;
        this.goal = state.getGoal();
        this.goalTolerance = goalTolerance;
        this.minMagnitude = minMagnitude;
        this.maxMagnitude = maxMagnitude;
    }

    @Override
    public SearchOutcome search() {
        if (started) {
            throw new IllegalStateException("Search engine already ran; create a new engine per search");
        }
        started = true;
        long startTime = System.currentTimeMillis();

        Frontier frontier = state.getFrontier();
        ClosedStore closed = state.getClosed();
        seed();

        int level = 0;
        while (true) {
            if (frontier.isEmpty()) {
                return finish(false, startTime);
            }

            ExpressionNode current = frontier.extractMin();
            // Settle first so the node is combined with itself
            closed.settle(current);
            expansions++;

            if (current.termCount > level) {
                level = current.termCount;
                observer.onLevelReached(level, frontier.liveCount(), closed.size());
            }
            if (expansions == nextProgressReport) {
                observer.onProgress(current, expansions, frontier.liveCount(), closed.size());
                nextProgressReport = nextProgressReport * 3 / 2;
            }

            expand(current);

            if (state.getBestTermCount() <= current.termCount + 1) {
                return finish(state.isGoalFound(), startTime);
            }
        }
    }

    @Override
    public SearchState getState() {
        return state;
    }

    private void seed() {
        for (double seed : seeds) {
            ExpressionNode leaf = ExpressionNode.leaf(domain.canonical(seed));
            if (domain.matchesGoal(leaf.value, goal, goalTolerance)) {
                leaf = leaf.withValue(goal);
            }
            if (state.getFrontier().insertOrImprove(leaf) && leaf.value == goal
                    && leaf.termCount < state.getBestTermCount()) {
                recordGoal(leaf);
            }
        }
    }

    /**
     * Combines a freshly settled node with every settled node.
     *
     * <p>Settled nodes come in non-decreasing cost, so the first peer whose combined cost
     * reaches the goal bound ends the scan.
     */
    private void expand(ExpressionNode current) {
        List<ExpressionNode> settled = state.getClosed().settledInOrder();
        int count = settled.size();
        for (int i = 0; i < count; i++) {
            ExpressionNode peer = settled.get(i);
            if (current.termCount + peer.termCount >= state.getBestTermCount()) {
                break;
            }
            generator.generate(current, peer, discoverSink);
        }
    }

    private void discover(ExpressionNode candidate) {
        candidatesGenerated++;
        ExpressionNode node = candidate;
        if (domain.matchesGoal(node.value, goal, goalTolerance)) {
            node = node.withValue(goal);
        }

        if (state.getClosed().contains(node.value)) return;

        double magnitude = Math.abs(node.value);
        if (!Double.isFinite(magnitude) || magnitude < minMagnitude || magnitude >= maxMagnitude) return;

        if (node.termCount >= state.getBestTermCount()) return;

        if (!state.getFrontier().insertOrImprove(node)) return;
        candidatesAccepted++;

        if (node.value == goal) {
            recordGoal(node);
        }
    }

    private void recordGoal(ExpressionNode node) {
        state.improveGoal(node.termCount);
        state.getFrontier().discardAtOrAbove(node.termCount, goal);
        observer.onGoalImproved(node.termCount, renderer.renderInfix(goal));
    }

    private SearchOutcome finish(boolean succeeded, long startTime) {
        Frontier frontier = state.getFrontier();
        SearchStatistics statistics = new SearchStatistics(
            expansions,
            state.getClosed().size(),
            frontier.liveCount(),
            frontier.deadCount(),
            frontier.staleSkipped(),
            candidatesGenerated,
            candidatesAccepted,
            System.currentTimeMillis() - startTime);

        SearchOutcome outcome;
        if (succeeded) {
            outcome = SearchOutcome.success(goal,
                renderer.renderInfix(goal),
                renderer.renderPostfix(goal),
                state.getBestTermCount(),
                statistics);
        } else {
            outcome = SearchOutcome.unreachable(goal, statistics);
        }
        observer.onSearchComplete(outcome);
        return outcome;
    }
}
