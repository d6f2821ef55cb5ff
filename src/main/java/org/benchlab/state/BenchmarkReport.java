package org.benchlab.state;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.benchlab.aggregate.Aggregator;
import org.benchlab.aggregate.Report;
import org.benchlab.metric.Metric;
import org.benchlab.model.Instance;
import org.benchlab.model.Spec;
import org.benchlab.obs.JsonLinesLogger;

/**
 * Final stage: scored instances plus one report per aggregator.
 */
public final class BenchmarkReport extends BenchmarkStage {
    private final List<Report> reports;

    BenchmarkReport(
        Spec spec,
        List<? extends Instance> instances,
        List<? extends Metric<?>> metrics,
        List<? extends Aggregator> aggregators,
        List<Report> reports,
        JsonLinesLogger logger
    ) {
        super(spec, instances, metrics, aggregators, logger);
        this.reports = List.copyOf(Objects.requireNonNull(reports, "reports"));
        if (this.reports.size() != aggregators().size()) {
            throw new IllegalArgumentException(
                "expected one report per aggregator (" + aggregators().size() + ") but got " + this.reports.size());
        }
    }

    public static BenchmarkReport of(
        Spec spec,
        List<? extends Instance> instances,
        List<? extends Metric<?>> metrics,
        List<? extends Aggregator> aggregators,
        List<Report> reports,
        JsonLinesLogger logger
    ) {
        return new BenchmarkReport(spec, instances, metrics, aggregators, reports, logger);
    }

    @Override
    public StageType stageType() {
        return StageType.REPORT;
    }

    /**
     * Reports in aggregator order.
     */
    public List<Report> reports() {
        return reports;
    }

    public Optional<Report> report(String aggregatorName) {
        for (Report report : reports) {
            if (report.aggregatorName().equals(aggregatorName)) {
                return Optional.of(report);
            }
        }
        return Optional.empty();
    }
}
