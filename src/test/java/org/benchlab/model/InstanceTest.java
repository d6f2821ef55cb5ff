package org.benchlab.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InstanceTest {
    @Test
    void updatesNeverTouchTheOriginal() {
        LabeledInstance original = new LabeledInstance("q-1", "What is 2 + 2?", "4");

        Instance attempted = original.withAttempt(Attempt.success("4", 0.5d));
        Instance scored = attempted.withEvaluation("exact_match", List.of(true));

        assertNotSame(original, attempted);
        assertTrue(original.attempts().isEmpty());
        assertEquals(1, attempted.attempts().size());
        assertFalse(attempted.hasEvaluation("exact_match"));
        assertEquals(List.of(true), scored.evaluation("exact_match"));
        assertEquals(LabeledInstance.class, scored.getClass());
        assertEquals("What is 2 + 2?", ((LabeledInstance) scored).prompt());
    }

    @Test
    void exposedListsAreReadOnly() {
        Instance instance = new LabeledInstance("q-1", "p", "4")
            .withAttempt(Attempt.success("4", 0.5d))
            .withEvaluation("exact_match", List.of(true));

        assertThrows(UnsupportedOperationException.class, () -> instance.attempts().add(Attempt.failure(0.1d)));
        assertThrows(UnsupportedOperationException.class, () -> instance.evaluation("exact_match").add(false));
        assertThrows(UnsupportedOperationException.class, () -> instance.evaluations().clear());
    }

    @Test
    void evaluationsKeepNullScoresInAttemptOrder() {
        Instance instance = new LabeledInstance("q-1", "p", "4")
            .withEvaluation("exact_match", Arrays.asList(true, null, false));

        List<Object> scores = instance.evaluation("exact_match");
        assertEquals(3, scores.size());
        assertEquals(true, scores.get(0));
        assertNull(scores.get(1));
        assertEquals(false, scores.get(2));
    }

    @Test
    void derivedViewsFollowAttempts() {
        Instance instance = new LabeledInstance("q-1", "p", "4")
            .withAttempt(new Attempt("4", 0.5d, AttemptStatus.SUCCESS, Map.of("tokens", 10L)))
            .withAttempt(Attempt.timeout(2.0d))
            .withAttempt(new Attempt("5", 0.25d, AttemptStatus.SUCCESS, Map.of("tokens", 7L, "calls", 1L)));

        assertEquals(Arrays.asList("4", null, "5"), instance.responses());
        assertEquals(List.of(0.5d, 2.0d, 0.25d), instance.runtimes());
        assertEquals(List.of(AttemptStatus.SUCCESS, AttemptStatus.TIMEOUT, AttemptStatus.SUCCESS), instance.statuses());
        assertEquals(Map.of("tokens", 17L, "calls", 1L), instance.usage());
    }

    @Test
    void clearedDropsAttemptsAndScores() {
        Instance instance = new LabeledInstance("q-1", "p", "4")
            .withAttempt(Attempt.success("4", 0.5d))
            .withEvaluation("exact_match", List.of(true));

        Instance cleared = instance.cleared();
        Instance unscored = instance.withoutEvaluations();

        assertTrue(cleared.attempts().isEmpty());
        assertTrue(cleared.evaluations().isEmpty());
        assertEquals(1, unscored.attempts().size());
        assertTrue(unscored.evaluations().isEmpty());
        assertEquals(new LabeledInstance("q-1", "p", "4"), cleared);
    }

    @Test
    void attemptRejectsNegativeRuntime() {
        assertThrows(IllegalArgumentException.class, () -> Attempt.success("4", -0.1d));
        assertEquals(AttemptStatus.TIMEOUT, AttemptStatus.fromText(" Timeout "));
        assertThrows(IllegalArgumentException.class, () -> AttemptStatus.fromText("crashed"));
    }

    @Test
    void listSourceIndexesByPositionAndId() {
        ListInstanceSource source = ListInstanceSource.of(
            new LabeledInstance("q-1", "p1", "1"),
            new LabeledInstance("q-2", "p2", "2")
        );

        assertEquals(2, source.size());
        assertEquals("q-2", source.get(1).id());
        assertEquals("q-1", source.get("q-1").id());
        assertThrows(IllegalArgumentException.class, () -> source.get("q-9"));
        assertThrows(IllegalArgumentException.class, () -> ListInstanceSource.of(
            new LabeledInstance("q-1", "p1", "1"),
            new LabeledInstance("q-1", "p2", "2")
        ));
    }
}
