package org.benchlab.state;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.benchlab.aggregate.Aggregator;
import org.benchlab.exec.BenchmarkCallable;
import org.benchlab.exec.ExecutionOutcome;
import org.benchlab.exec.ProcessTimedExecutor;
import org.benchlab.exec.TimedExecution;
import org.benchlab.exec.TimedExecutor;
import org.benchlab.metric.Metric;
import org.benchlab.model.Attempt;
import org.benchlab.model.AttemptStatus;
import org.benchlab.model.Instance;
import org.benchlab.model.InstanceSource;
import org.benchlab.model.Spec;
import org.benchlab.obs.BenchmarkLoggers;
import org.benchlab.obs.CorrelationContext;
import org.benchlab.obs.JsonLinesLogger;

/**
 * First stage: selected, unexecuted instances.
 */
public final class Benchmark extends BenchmarkStage {
    private Benchmark(
        Spec spec,
        List<? extends Instance> instances,
        List<? extends Metric<?>> metrics,
        List<? extends Aggregator> aggregators,
        JsonLinesLogger logger
    ) {
        super(spec, instances, metrics, aggregators, logger);
    }

    public static Benchmark create(
        Spec spec,
        InstanceSource source,
        List<? extends Metric<?>> metrics,
        List<? extends Aggregator> aggregators
    ) {
        Objects.requireNonNull(spec, "spec");
        return create(spec, source, metrics, aggregators, BenchmarkLoggers.forSpec(spec));
    }

    /**
     * Selects instances from the source according to the {@link Spec}:
     * <ol>
     *   <li>neither {@code n_instance} nor {@code instance_ids}: every instance in source order;</li>
     *   <li>only {@code n_instance}: the first n in source order;</li>
     *   <li>only {@code instance_ids}: exactly those ids, in the given order;</li>
     *   <li>both: the first {@code min(n_instance, len(instance_ids))} ids, with a warning.</li>
     * </ol>
     */
    public static Benchmark create(
        Spec spec,
        InstanceSource source,
        List<? extends Metric<?>> metrics,
        List<? extends Aggregator> aggregators,
        JsonLinesLogger logger
    ) {
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(logger, "logger");
        List<Instance> selected = select(spec, source, logger);
        return of(spec, selected, metrics, aggregators, logger);
    }

    /**
     * Benchmark over already selected instances; attempts and scores are dropped.
     */
    public static Benchmark of(
        Spec spec,
        List<? extends Instance> instances,
        List<? extends Metric<?>> metrics,
        List<? extends Aggregator> aggregators,
        JsonLinesLogger logger
    ) {
        Objects.requireNonNull(instances, "instances");
        List<Instance> cleared = new ArrayList<>(instances.size());
        for (Instance instance : instances) {
            cleared.add(Objects.requireNonNull(instance, "instance").cleared());
        }
        return new Benchmark(spec, cleared, metrics, aggregators, logger);
    }

    @Override
    public StageType stageType() {
        return StageType.BENCHMARK;
    }

    /**
     * Runs every selected instance {@code n_attempts} times, each call in its own worker process.
     */
    public BenchmarkExec run(BenchmarkCallable callable) {
        return run(callable, Map.of());
    }

    public BenchmarkExec run(BenchmarkCallable callable, Map<String, String> args) {
        try (ProcessTimedExecutor executor = new ProcessTimedExecutor()) {
            return run(callable, args, executor);
        }
    }

    /**
     * Runs with a caller-owned executor, which is left open.
     */
    public BenchmarkExec run(BenchmarkCallable callable, Map<String, String> args, TimedExecutor executor) {
        Objects.requireNonNull(callable, "callable");
        Objects.requireNonNull(executor, "executor");
        Map<String, String> callArgs = args == null ? Map.of() : Map.copyOf(args);
        if (!instances().isEmpty()) {
            executor.checkSupported(callable, instances().get(0));
        }
        Duration timeout = spec().timeout()
            .map(seconds -> Duration.ofNanos(Math.round(seconds * 1_000_000_000.0d)))
            .orElse(null);
        CorrelationContext context = correlation("run");
        Map<String, Object> startFields = new LinkedHashMap<>();
        startFields.put("instances", instances().size());
        startFields.put("attempts", spec().nAttempts());
        startFields.put("timeout", spec().timeout().orElse(null));
        logger().info("benchmark run started", context, startFields);

        long startedAt = System.nanoTime();
        List<Instance> executed = new ArrayList<>(instances().size());
        int failures = 0;
        int timeouts = 0;
        for (Instance instance : instances()) {
            Instance current = instance;
            for (int attemptNumber = 1; attemptNumber <= spec().nAttempts(); attemptNumber++) {
                TimedExecution execution = executor.execute(callable, timeout, instance, callArgs);
                Attempt attempt = toAttempt(execution);
                current = current.withAttempt(attempt);
                logAttempt(context.forAttempt(instance.id(), attemptNumber), execution, attempt);
                if (attempt.status() == AttemptStatus.FAILURE) {
                    failures++;
                } else if (attempt.status() == AttemptStatus.TIMEOUT) {
                    timeouts++;
                }
            }
            executed.add(current);
        }
        double elapsed = (System.nanoTime() - startedAt) / 1_000_000_000.0d;

        Map<String, Object> finishFields = new LinkedHashMap<>();
        finishFields.put("elapsedSeconds", elapsed);
        finishFields.put("failures", failures);
        finishFields.put("timeouts", timeouts);
        logger().info("benchmark run finished", context, finishFields);
        return new BenchmarkExec(spec().withExecutionTime(elapsed), executed, metrics(), aggregators(), logger());
    }

    static Attempt toAttempt(TimedExecution execution) {
        if (execution.outcome() == ExecutionOutcome.SUCCESS) {
            return execution.result()
                .map(output -> new Attempt(output.answer(), execution.runtimeSeconds(), AttemptStatus.SUCCESS, output.usage()))
                .orElseThrow();
        }
        if (execution.outcome() == ExecutionOutcome.TIMEOUT) {
            return Attempt.timeout(execution.runtimeSeconds());
        }
        return Attempt.failure(execution.runtimeSeconds());
    }

    private void logAttempt(CorrelationContext context, TimedExecution execution, Attempt attempt) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("status", attempt.status().text());
        fields.put("runtime", execution.runtimeSeconds());
        if (execution.outcome() == ExecutionOutcome.ERROR) {
            fields.put("errorType", execution.errorType().orElse(null));
            fields.put("errorMessage", execution.errorMessage().orElse(null));
            logger().error("attempt failed", context, fields);
            return;
        }
        logger().info("attempt finished", context, fields);
    }

    static List<Instance> select(Spec spec, InstanceSource source, JsonLinesLogger logger) {
        List<String> ids = spec.instanceIds();
        Integer limit = spec.nInstance().orElse(null);
        List<Instance> selected = new ArrayList<>();
        if (ids.isEmpty()) {
            int count = limit == null ? source.size() : Math.min(limit, source.size());
            for (int i = 0; i < count; i++) {
                selected.add(source.get(i));
            }
            return selected;
        }
        List<String> chosen = ids;
        if (limit != null) {
            chosen = ids.subList(0, Math.min(limit, ids.size()));
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("n_instance", limit);
            fields.put("instance_ids", ids.size());
            fields.put("selected", chosen.size());
            logger.warn(
                "both n_instance and instance_ids are set; using the first min(n_instance, len(instance_ids)) ids",
                CorrelationContext.of(spec.name(), "select"),
                fields
            );
        }
        for (String id : chosen) {
            selected.add(source.get(id));
        }
        return selected;
    }
}
