package org.benchlab.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.benchlab.fixtures.RecordingLogger;
import org.benchlab.model.Attempt;
import org.benchlab.model.Instance;
import org.benchlab.model.LabeledInstance;
import org.benchlab.model.ListInstanceSource;
import org.benchlab.model.Spec;
import org.junit.jupiter.api.Test;

class InstanceSelectionTest {
    private final ListInstanceSource source = ListInstanceSource.of(
        new LabeledInstance("q-1", "p1", "1"),
        new LabeledInstance("q-2", "p2", "2"),
        new LabeledInstance("q-3", "p3", "3"),
        new LabeledInstance("q-4", "p4", "4")
    );
    private final RecordingLogger logger = new RecordingLogger();

    private List<String> selectedIds(Spec spec) {
        return Benchmark.select(spec, source, logger).stream().map(Instance::id).toList();
    }

    @Test
    void selectsEverythingByDefault() {
        assertEquals(List.of("q-1", "q-2", "q-3", "q-4"), selectedIds(Spec.builder("s").build()));
    }

    @Test
    void selectsLeadingInstancesByCount() {
        assertEquals(List.of("q-1", "q-2"), selectedIds(Spec.builder("s").nInstance(2).build()));
        assertEquals(4, selectedIds(Spec.builder("s").nInstance(10).build()).size());
    }

    @Test
    void selectsListedIdsInGivenOrder() {
        Spec spec = Spec.builder("s").instanceIds(List.of("q-3", "q-1")).build();

        assertEquals(List.of("q-3", "q-1"), selectedIds(spec));
        assertTrue(logger.events("WARN").isEmpty());
    }

    @Test
    void combinesCountAndIdsWithWarning() {
        Spec spec = Spec.builder("s").instanceIds(List.of("q-4", "q-2", "q-1")).nInstance(2).build();

        assertEquals(List.of("q-4", "q-2"), selectedIds(spec));
        assertEquals(1, logger.events("WARN").size());
        assertTrue(logger.events("WARN").get(0).message().startsWith("both n_instance and instance_ids are set"));
    }

    @Test
    void unknownIdIsRejected() {
        Spec spec = Spec.builder("s").instanceIds(List.of("q-9")).build();

        assertThrows(IllegalArgumentException.class, () -> selectedIds(spec));
    }

    @Test
    void createdBenchmarkHoldsClearedSelection() {
        Instance attempted = new LabeledInstance("q-5", "p5", "5")
            .withAttempt(Attempt.success("5", 0.1d));
        Benchmark benchmark = Benchmark.create(
            Spec.builder("s").build(),
            ListInstanceSource.of(attempted),
            List.of(),
            List.of(),
            logger
        );

        assertEquals(StageType.BENCHMARK, benchmark.stageType());
        assertTrue(benchmark.instances().get(0).attempts().isEmpty());
    }
}
