package domain.engine;

import domain.model.ExpressionNode;
import domain.model.SearchOutcome;
import domain.observer.SearchObserver;

import java.util.ArrayList;
import java.util.List;

/**
 * Observer that records every event for later assertions.
 */
public final class RecordingObserver implements SearchObserver {

    public final List<Integer> levels = new ArrayList<>();
    public final List<Long> progressReports = new ArrayList<>();
    public final List<Integer> goalTermCounts = new ArrayList<>();
    public final List<String> goalExpressions = new ArrayList<>();
    public final List<SearchOutcome> completions = new ArrayList<>();

    @Override
    public void onLevelReached(int level, int openCount, int settledCount) {
        levels.add(level);
    }

    @Override
    public void onProgress(ExpressionNode expanding, long expansions, int openCount, int settledCount) {
        progressReports.add(expansions);
    }

    @Override
    public void onGoalImproved(int termCount, String expression) {
        goalTermCounts.add(termCount);
        goalExpressions.add(expression);
    }

    @Override
    public void onSearchComplete(SearchOutcome outcome) {
        completions.add(outcome);
    }
}
