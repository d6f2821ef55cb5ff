package org.benchlab.state;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.benchlab.aggregate.Aggregator;
import org.benchlab.metric.Metric;
import org.benchlab.model.ConsistencyException;
import org.benchlab.model.Instance;
import org.benchlab.model.Spec;
import org.benchlab.obs.CorrelationContext;
import org.benchlab.obs.JsonLinesLogger;

/**
 * Immutable snapshot of one lifecycle stage.
 *
 * <p>All instances share one concrete class, instance ids are unique and metric names are
 * unique; violations fail at construction.
 */
public abstract class BenchmarkStage {
    private final Spec spec;
    private final List<Instance> instances;
    private final List<Metric<?>> metrics;
    private final List<Aggregator> aggregators;
    private final JsonLinesLogger logger;

    protected BenchmarkStage(
        Spec spec,
        List<? extends Instance> instances,
        List<? extends Metric<?>> metrics,
        List<? extends Aggregator> aggregators,
        JsonLinesLogger logger
    ) {
        this.spec = Objects.requireNonNull(spec, "spec");
        this.instances = checkInstances(instances);
        this.metrics = checkMetrics(metrics);
        this.aggregators = List.copyOf(Objects.requireNonNull(aggregators, "aggregators"));
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public abstract StageType stageType();

    public final Spec spec() {
        return spec;
    }

    public final List<Instance> instances() {
        return instances;
    }

    public final List<Metric<?>> metrics() {
        return metrics;
    }

    public final List<Aggregator> aggregators() {
        return aggregators;
    }

    public final JsonLinesLogger logger() {
        return logger;
    }

    /**
     * Concrete class shared by every instance; empty for a stage without instances.
     */
    public final Optional<Class<? extends Instance>> instanceClass() {
        return instances.isEmpty() ? Optional.empty() : Optional.of(instances.get(0).getClass());
    }

    public final Optional<Metric<?>> metric(String name) {
        for (Metric<?> metric : metrics) {
            if (metric.name().equals(name)) {
                return Optional.of(metric);
            }
        }
        return Optional.empty();
    }

    protected final CorrelationContext correlation(String step) {
        return CorrelationContext.of(spec.name(), step);
    }

    @Override
    public String toString() {
        return stageType().label() + "{name=" + spec.name() + ", instances=" + instances.size()
            + ", metrics=" + metrics.size() + ", aggregators=" + aggregators.size() + "}";
    }

    private static List<Instance> checkInstances(List<? extends Instance> instances) {
        Objects.requireNonNull(instances, "instances");
        List<Instance> copy = new ArrayList<>(instances.size());
        Set<String> ids = new HashSet<>();
        Class<?> expected = null;
        for (int i = 0; i < instances.size(); i++) {
            Instance instance = Objects.requireNonNull(instances.get(i), "instances[" + i + "]");
            if (expected == null) {
                expected = instance.getClass();
            } else if (instance.getClass() != expected) {
                throw new ConsistencyException(
                    "all instances must share one type: instances[" + i + "] ('" + instance.id() + "') is "
                        + instance.getClass().getName() + " but instances[0] is " + expected.getName());
            }
            if (!ids.add(instance.id())) {
                throw new ConsistencyException("duplicate instance id: " + instance.id());
            }
            copy.add(instance);
        }
        return List.copyOf(copy);
    }

    private static List<Metric<?>> checkMetrics(List<? extends Metric<?>> metrics) {
        Objects.requireNonNull(metrics, "metrics");
        Set<String> names = new HashSet<>();
        for (Metric<?> metric : metrics) {
            Objects.requireNonNull(metric, "metric");
            if (!names.add(metric.name())) {
                throw new ConsistencyException("metric '" + metric.name() + "' is registered more than once");
            }
        }
        return List.copyOf(metrics);
    }
}
