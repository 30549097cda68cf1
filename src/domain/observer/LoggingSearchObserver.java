package domain.observer;

import domain.model.ExpressionNode;
import domain.model.NumericDomain;
import domain.model.SearchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes search progress to the log.
 *
 * <p>Level changes and goal improvements are logged at INFO, periodic expansion reports
 * at DEBUG.
 */
public final class LoggingSearchObserver implements SearchObserver {

    private static final Logger log = LoggerFactory.getLogger(LoggingSearchObserver.class);

    private final NumericDomain domain;

    public LoggingSearchObserver(NumericDomain domain) {
        this.domain = domain;
    }

    @Override
    public void onLevelReached(int level, int openCount, int settledCount) {
        log.info("Now at level {} ({} open, {} settled)", level, openCount, settledCount);
    }

    @Override
    public void onProgress(ExpressionNode expanding, long expansions, int openCount, int settledCount) {
        log.debug("Expanding {} at depth {} after {} expansions, {} open, {} settled",
            domain.format(expanding.value), expanding.termCount, expansions, openCount, settledCount);
    }

    @Override
    public void onGoalImproved(int termCount, String expression) {
        log.info("One way ({} terms) = {}", termCount, expression);
    }

    @Override
    public void onSearchComplete(SearchOutcome outcome) {
        if (outcome.isSuccess()) {
            log.info("Done after {} settled values: {} terms needed for {}",
                outcome.getStatistics().getSettledCount(), outcome.getTermCount(),
                domain.format(outcome.getGoal()));
        } else {
            log.info("Goal {} is {} under the current configuration ({})",
                domain.format(outcome.getGoal()), outcome.getReason(), outcome.getStatistics());
        }
    }
}
