package org.benchlab.state;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.benchlab.aggregate.Aggregator;
import org.benchlab.aggregate.Report;
import org.benchlab.metric.Metric;
import org.benchlab.model.Instance;
import org.benchlab.model.Spec;
import org.benchlab.obs.CorrelationContext;
import org.benchlab.obs.JsonLinesLogger;
import org.benchlab.stats.MetricStats;
import org.benchlab.stats.StatsInsufficientDataException;

/**
 * Scored instances.
 */
public final class BenchmarkEval extends BenchmarkStage {
    BenchmarkEval(
        Spec spec,
        List<? extends Instance> instances,
        List<? extends Metric<?>> metrics,
        List<? extends Aggregator> aggregators,
        JsonLinesLogger logger
    ) {
        super(spec, instances, metrics, aggregators, logger);
    }

    public static BenchmarkEval of(
        Spec spec,
        List<? extends Instance> instances,
        List<? extends Metric<?>> metrics,
        List<? extends Aggregator> aggregators,
        JsonLinesLogger logger
    ) {
        return new BenchmarkEval(spec, instances, metrics, aggregators, logger);
    }

    @Override
    public StageType stageType() {
        return StageType.EVAL;
    }

    /**
     * Runs every aggregator over all instances; reports follow the aggregator order.
     */
    public BenchmarkReport report() {
        CorrelationContext context = correlation("report");
        List<Report> reports = new ArrayList<>(aggregators().size());
        for (Aggregator aggregator : aggregators()) {
            Report report = aggregator.aggregate(instances());
            reports.add(report);
            logger().info("aggregator reported", context, Map.of("aggregator", aggregator.name(), "outer", report.outer()));
        }
        return new BenchmarkReport(spec(), instances(), metrics(), aggregators(), reports, logger());
    }

    /**
     * Per-instance stats of one metric, keyed by instance id. Instances without a valid score
     * are left out.
     */
    public Map<String, MetricStats> instanceStats(String metricName) {
        Metric<?> metric = requireMetric(metricName);
        Map<String, MetricStats> stats = new LinkedHashMap<>();
        for (Instance instance : instances()) {
            List<Object> scores = instance.evaluation(metric.name());
            if (scores.stream().anyMatch(Objects::nonNull)) {
                stats.put(instance.id(), metric.type().fromEval(metric.name(), scores));
            }
        }
        return stats;
    }

    /**
     * Stats of one metric pooled across instances.
     */
    public MetricStats metricStats(String metricName) {
        Metric<?> metric = requireMetric(metricName);
        Map<String, MetricStats> perInstance = instanceStats(metricName);
        if (perInstance.isEmpty()) {
            int attempts = 0;
            for (Instance instance : instances()) {
                attempts += instance.evaluation(metric.name()).size();
            }
            throw new StatsInsufficientDataException(metric.name(), attempts);
        }
        return metric.type().aggregate(new ArrayList<>(perInstance.values()));
    }

    private Metric<?> requireMetric(String metricName) {
        return metric(metricName)
            .orElseThrow(() -> new IllegalArgumentException("unknown metric: " + metricName));
    }
}
