package domain.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of one search run: either a minimal expression for the goal or a failure reason.
 *
 * <h3>Success</h3>
 * <p>Carries the fully parenthesized infix form, the postfix (RPN) token list and the
 * term count. Both expression views contain exactly {@code termCount} literals.
 *
 * <h3>Failure</h3>
 * <p>The goal could not be reached under the active configuration. This is an expected
 * outcome, not an error; engine defects are reported by
 * {@link domain.engine.SearchInvariantException} instead.
 */
public final class SearchOutcome {

    /** Reason attached to every failed outcome. */
    public static final String UNREACHABLE = "unreachable";

    /** Terminal state of the search. */
    public enum Status {
        SUCCEEDED,
        FAILED
    }

    private final Status status;
    private final double goal;
    private final String expression;
    private final List<String> postfix;
    private final int termCount;
    private final String reason;
    private final SearchStatistics statistics;

    private SearchOutcome(Status status, double goal, String expression, List<String> postfix,
                          int termCount, String reason, SearchStatistics statistics) {
        this.status = status;
        this.goal = goal;
        this.expression = expression;
        this.postfix = postfix;
        this.termCount = termCount;
        this.reason = reason;
        this.statistics = Objects.requireNonNull(statistics, "statistics");
    }

    /**
     * Creates a successful outcome.
     *
     * @param goal       the goal value
     * @param expression fully parenthesized infix expression
     * @param postfix    postfix token list
     * @param termCount  proven-minimal number of leaf terms
     * @param statistics run counters
     * @return a {@link Status#SUCCEEDED} outcome
     */
    public static SearchOutcome success(double goal, String expression, List<String> postfix,
                                        int termCount, SearchStatistics statistics) {
        return new SearchOutcome(Status.SUCCEEDED, goal, expression,
            Collections.unmodifiableList(postfix), termCount, null, statistics);
    }

    /**
     * Creates a failed outcome with reason {@link #UNREACHABLE}.
     *
     * @param goal       the goal value
     * @param statistics run counters
     * @return a {@link Status#FAILED} outcome
     */
    public static SearchOutcome unreachable(double goal, SearchStatistics statistics) {
        return new SearchOutcome(Status.FAILED, goal, null, Collections.<String>emptyList(),
            0, UNREACHABLE, statistics);
    }

    public Status getStatus() { return status; }
    public boolean isSuccess() { return status == Status.SUCCEEDED; }
    public double getGoal() { return goal; }

    /** Infix expression; {@code null} on failure. */
    public String getExpression() { return expression; }

    /** Postfix tokens; empty on failure. */
    public List<String> getPostfix() { return postfix; }

    /** Minimal term count; 0 on failure. */
    public int getTermCount() { return termCount; }

    /** Failure reason; {@code null} on success. */
    public String getReason() { return reason; }

    public SearchStatistics getStatistics() { return statistics; }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "Success{expression=" + expression + ", termCount=" + termCount + "}";
        }
        return "Failure{reason=" + reason + "}";
    }
}
