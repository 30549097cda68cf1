package application;

import domain.engine.PostfixEvaluator;
import domain.engine.RecordingObserver;
import domain.model.NumericDomain;
import domain.model.Operator;
import domain.model.SearchOutcome;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SearchOrchestratorTest {

    @Test
    void runsSearchAndNotifiesObserver() {
        SearchConfiguration config = new SearchConfiguration.Builder()
            .setGoal(100)
            .setSeeds(List.of(4.0))
            .setDebugMode(true)
            .build();
        RecordingObserver observer = new RecordingObserver();

        SearchOutcome outcome = new SearchOrchestrator(config, observer).search();

        assertTrue(outcome.isSuccess());
        assertEquals(6, outcome.getTermCount());
        assertEquals(100.0, PostfixEvaluator.evaluate(outcome.getPostfix()));
        assertEquals(List.of(outcome), observer.completions);
    }

    @Test
    void orchestratorCanBeReused() {
        SearchConfiguration config = new SearchConfiguration.Builder()
            .setGoal(17)
            .addSeed(2)
            .build();
        SearchOrchestrator orchestrator = new SearchOrchestrator(config);

        SearchOutcome first = orchestrator.search();
        SearchOutcome second = orchestrator.search();

        assertEquals(6, first.getTermCount());
        assertEquals(first.getTermCount(), second.getTermCount());
        assertEquals(first.getExpression(), second.getExpression());
    }

    @Test
    void unreachableGoalIsAnOutcomeNotAnError() {
        SearchConfiguration config = new SearchConfiguration.Builder()
            .setGoal(3)
            .addSeed(2)
            .setOperators(EnumSet.of(Operator.MUL, Operator.DIV))
            .build();

        SearchOutcome outcome = new SearchOrchestrator(config).search();

        assertFalse(outcome.isSuccess());
        assertEquals(SearchOutcome.UNREACHABLE, outcome.getReason());
    }

    @Test
    void realModeWithTolerance() {
        SearchConfiguration config = new SearchConfiguration.Builder()
            .setGoal(0.3333333)
            .addSeed(3)
            .setNumericDomain(NumericDomain.REAL)
            .setGoalTolerance(1e-6)
            .build();

        SearchOutcome outcome = new SearchOrchestrator(config).search();

        assertEquals(3, outcome.getTermCount());
        assertEquals(1.0 / 3.0, PostfixEvaluator.evaluate(outcome.getPostfix()), 1e-12);
    }
}
