package org.benchlab.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import org.benchlab.aggregate.AccuracyAggregator;
import org.benchlab.aggregate.Aggregator;
import org.benchlab.aggregate.ConsensusAggregator;
import org.benchlab.aggregate.PassAtKAggregator;
import org.benchlab.aggregate.RuntimesAggregator;
import org.benchlab.aggregate.StatusAggregator;
import org.benchlab.metric.ExactMatchMetric;
import org.benchlab.metric.Metric;
import org.benchlab.model.Instance;
import org.benchlab.model.LabeledInstance;
import org.benchlab.model.TypeTag;

/**
 * Explicit map from stored type tags to factories. Artifacts and worker requests are only
 * ever materialized through registered factories.
 */
public final class TypeRegistry {
    @FunctionalInterface
    public interface InstanceFactory {
        Instance create(InstanceRecord record);
    }

    @FunctionalInterface
    public interface ComponentFactory<T> {
        T create(Map<String, Object> parameters);
    }

    private final Map<TypeTag, InstanceFactory> instances;
    private final Map<TypeTag, ComponentFactory<? extends Metric<?>>> metrics;
    private final Map<TypeTag, ComponentFactory<? extends Aggregator>> aggregators;

    private TypeRegistry(Builder builder) {
        this.instances = Collections.unmodifiableMap(new LinkedHashMap<>(builder.instances));
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metrics));
        this.aggregators = Collections.unmodifiableMap(new LinkedHashMap<>(builder.aggregators));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Built-in types only.
     */
    public static TypeRegistry defaults() {
        return builder().registerBuiltIns().build();
    }

    /**
     * Built-in types plus every {@link TypeRegistryContributor} on the classpath.
     */
    public static TypeRegistry loadDefault() {
        Builder builder = builder().registerBuiltIns();
        for (TypeRegistryContributor contributor : ServiceLoader.load(TypeRegistryContributor.class)) {
            contributor.contribute(builder);
        }
        return builder.build();
    }

    public boolean hasInstance(TypeTag tag) {
        return instances.containsKey(tag);
    }

    public boolean hasMetric(TypeTag tag) {
        return metrics.containsKey(tag);
    }

    public boolean hasAggregator(TypeTag tag) {
        return aggregators.containsKey(tag);
    }

    public Instance createInstance(InstanceRecord record) {
        Objects.requireNonNull(record, "record");
        InstanceFactory factory = instances.get(record.typeTag());
        if (factory == null) {
            throw new IllegalArgumentException("unregistered instance type: " + record.typeTag());
        }
        Instance instance = factory.create(record);
        if (!record.typeTag().equals(instance.typeTag())) {
            throw new IllegalStateException(
                "factory for " + record.typeTag() + " produced an instance tagged " + instance.typeTag());
        }
        return instance;
    }

    public Metric<?> createMetric(TypeTag tag, Map<String, Object> parameters) {
        ComponentFactory<? extends Metric<?>> factory = metrics.get(Objects.requireNonNull(tag, "tag"));
        if (factory == null) {
            throw new IllegalArgumentException("unregistered metric type: " + tag);
        }
        return factory.create(parameters == null ? Map.of() : parameters);
    }

    public Aggregator createAggregator(TypeTag tag, Map<String, Object> parameters) {
        ComponentFactory<? extends Aggregator> factory = aggregators.get(Objects.requireNonNull(tag, "tag"));
        if (factory == null) {
            throw new IllegalArgumentException("unregistered aggregator type: " + tag);
        }
        return factory.create(parameters == null ? Map.of() : parameters);
    }

    static String requireParameter(Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        if (!(value instanceof String text) || text.isBlank()) {
            throw new IllegalArgumentException("missing string parameter '" + key + "'");
        }
        return text;
    }

    public static final class Builder {
        private final Map<TypeTag, InstanceFactory> instances = new LinkedHashMap<>();
        private final Map<TypeTag, ComponentFactory<? extends Metric<?>>> metrics = new LinkedHashMap<>();
        private final Map<TypeTag, ComponentFactory<? extends Aggregator>> aggregators = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder registerInstance(TypeTag tag, InstanceFactory factory) {
            register(instances, tag, factory, "instance");
            return this;
        }

        public Builder registerMetric(TypeTag tag, ComponentFactory<? extends Metric<?>> factory) {
            register(metrics, tag, factory, "metric");
            return this;
        }

        public Builder registerAggregator(TypeTag tag, ComponentFactory<? extends Aggregator> factory) {
            register(aggregators, tag, factory, "aggregator");
            return this;
        }

        public TypeRegistry build() {
            return new TypeRegistry(this);
        }

        private Builder registerBuiltIns() {
            registerInstance(LabeledInstance.TYPE_TAG, record -> new LabeledInstance(
                record.id(),
                record.stringField("prompt"),
                record.stringField("ground_truth"),
                record.attempts(),
                record.evaluations()
            ));
            registerMetric(ExactMatchMetric.TYPE_TAG, parameters -> parameters.containsKey("name")
                ? new ExactMatchMetric(requireParameter(parameters, "name"))
                : new ExactMatchMetric());
            registerAggregator(RuntimesAggregator.TYPE_TAG, parameters -> new RuntimesAggregator());
            registerAggregator(StatusAggregator.TYPE_TAG, parameters -> new StatusAggregator());
            registerAggregator(ConsensusAggregator.TYPE_TAG,
                parameters -> new ConsensusAggregator(requireParameter(parameters, "target")));
            registerAggregator(PassAtKAggregator.TYPE_TAG,
                parameters -> new PassAtKAggregator(requireParameter(parameters, "target")));
            registerAggregator(AccuracyAggregator.TYPE_TAG,
                parameters -> new AccuracyAggregator(requireParameter(parameters, "target")));
            return this;
        }

        private static <F> void register(Map<TypeTag, F> registry, TypeTag tag, F factory, String kind) {
            Objects.requireNonNull(tag, "tag");
            Objects.requireNonNull(factory, "factory");
            if (registry.putIfAbsent(tag, factory) != null) {
                throw new IllegalArgumentException("duplicate " + kind + " type registration: " + tag);
            }
        }
    }
}
