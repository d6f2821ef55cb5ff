package org.benchlab.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.benchlab.aggregate.Aggregator;
import org.benchlab.aggregate.ConsensusAggregator;
import org.benchlab.fixtures.MathQaInstance;
import org.benchlab.metric.ExactMatchMetric;
import org.benchlab.metric.Metric;
import org.benchlab.model.Attempt;
import org.benchlab.model.Instance;
import org.benchlab.model.LabeledInstance;
import org.benchlab.model.TypeTag;
import org.junit.jupiter.api.Test;

class TypeRegistryTest {
    @Test
    void serviceContributorsExtendBuiltIns() {
        TypeRegistry loaded = TypeRegistry.loadDefault();
        TypeRegistry builtIns = TypeRegistry.defaults();

        assertTrue(loaded.hasInstance(MathQaInstance.TYPE_TAG));
        assertTrue(loaded.hasInstance(LabeledInstance.TYPE_TAG));
        assertFalse(builtIns.hasInstance(MathQaInstance.TYPE_TAG));
        assertTrue(builtIns.hasMetric(ExactMatchMetric.TYPE_TAG));
        assertTrue(builtIns.hasAggregator(ConsensusAggregator.TYPE_TAG));
    }

    @Test
    void recreatesInstancesFromRecords() {
        Instance original = new LabeledInstance("q-1", "2 + 2", "4")
            .withAttempt(Attempt.success("4", 0.5d))
            .withEvaluation("exact_match", List.of(true));

        InstanceRecord record = InstanceRecord.fromDocument(InstanceRecord.of(original).toDocument());
        Instance rebuilt = TypeRegistry.defaults().createInstance(record);

        assertEquals(original, rebuilt);
    }

    @Test
    void createsComponentsFromParameters() {
        TypeRegistry registry = TypeRegistry.defaults();

        Metric<?> metric = registry.createMetric(ExactMatchMetric.TYPE_TAG, Map.of("name", "strict"));
        Aggregator aggregator = registry.createAggregator(ConsensusAggregator.TYPE_TAG, Map.of("target", "strict"));

        assertEquals("strict", metric.name());
        assertInstanceOf(ConsensusAggregator.class, aggregator);
        assertEquals("consensus_strict", aggregator.name());
        assertEquals("exact_match", registry.createMetric(ExactMatchMetric.TYPE_TAG, Map.of()).name());
        assertThrows(IllegalArgumentException.class, () -> registry.createAggregator(ConsensusAggregator.TYPE_TAG, Map.of()));
    }

    @Test
    void rejectsUnknownAndDuplicateTypes() {
        TypeRegistry registry = TypeRegistry.defaults();

        assertThrows(
            IllegalArgumentException.class,
            () -> registry.createMetric(TypeTag.of("elsewhere", "Fuzzy"), Map.of())
        );
        assertThrows(
            IllegalArgumentException.class,
            () -> TypeRegistry.builder()
                .registerMetric(ExactMatchMetric.TYPE_TAG, parameters -> new ExactMatchMetric())
                .registerMetric(ExactMatchMetric.TYPE_TAG, parameters -> new ExactMatchMetric())
        );
    }

    @Test
    void recordRejectsReservedFieldNames() {
        assertThrows(IllegalArgumentException.class, () -> new InstanceRecord(
            LabeledInstance.TYPE_TAG,
            "q-1",
            List.of(),
            Map.of(),
            Map.of("_attempts", "x")
        ));
    }
}
