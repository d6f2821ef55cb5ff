package org.benchlab.state;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.benchlab.aggregate.Aggregator;
import org.benchlab.metric.Metric;
import org.benchlab.model.Instance;
import org.benchlab.model.Spec;
import org.benchlab.obs.CorrelationContext;
import org.benchlab.obs.JsonLinesLogger;

/**
 * Executed instances, not yet scored.
 */
public final class BenchmarkExec extends BenchmarkStage {
    BenchmarkExec(
        Spec spec,
        List<? extends Instance> instances,
        List<? extends Metric<?>> metrics,
        List<? extends Aggregator> aggregators,
        JsonLinesLogger logger
    ) {
        super(spec, instances, metrics, aggregators, logger);
    }

    /**
     * Execution stage over executed instances; any stored scores are dropped.
     */
    public static BenchmarkExec of(
        Spec spec,
        List<? extends Instance> instances,
        List<? extends Metric<?>> metrics,
        List<? extends Aggregator> aggregators,
        JsonLinesLogger logger
    ) {
        Objects.requireNonNull(instances, "instances");
        List<Instance> unscored = new ArrayList<>(instances.size());
        for (Instance instance : instances) {
            unscored.add(Objects.requireNonNull(instance, "instance").withoutEvaluations());
        }
        return new BenchmarkExec(spec, unscored, metrics, aggregators, logger);
    }

    @Override
    public StageType stageType() {
        return StageType.EXEC;
    }

    public BenchmarkExec withMetric(Metric<?> metric) {
        Objects.requireNonNull(metric, "metric");
        List<Metric<?>> updated = new ArrayList<>(metrics());
        updated.add(metric);
        return new BenchmarkExec(spec(), instances(), updated, aggregators(), logger());
    }

    public BenchmarkExec withAggregator(Aggregator aggregator) {
        Objects.requireNonNull(aggregator, "aggregator");
        List<Aggregator> updated = new ArrayList<>(aggregators());
        updated.add(aggregator);
        return new BenchmarkExec(spec(), instances(), metrics(), updated, logger());
    }

    /**
     * Scores every attempt of every instance with every metric.
     */
    public BenchmarkEval evaluate() {
        CorrelationContext context = correlation("evaluate");
        logger().info("evaluation started", context, Map.of("metrics", metrics().size()));
        long startedAt = System.nanoTime();
        List<Instance> scored = new ArrayList<>(instances());
        for (Metric<?> metric : metrics()) {
            for (int i = 0; i < scored.size(); i++) {
                scored.set(i, metric.apply(scored.get(i), logger(), context));
            }
            logger().debug("metric applied", context, Map.of("metric", metric.name()));
        }
        double elapsed = (System.nanoTime() - startedAt) / 1_000_000_000.0d;
        logger().info("evaluation finished", context, Map.of("elapsedSeconds", elapsed));
        return new BenchmarkEval(spec().withEvaluationTime(elapsed), scored, metrics(), aggregators(), logger());
    }
}
