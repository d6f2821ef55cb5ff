package org.benchlab.artifact;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.benchlab.aggregate.Aggregator;
import org.benchlab.aggregate.Report;
import org.benchlab.codec.BsonValues;
import org.benchlab.metric.Metric;
import org.benchlab.model.Instance;
import org.benchlab.model.Spec;
import org.benchlab.model.TypeTag;
import org.benchlab.obs.BenchmarkLoggers;
import org.benchlab.obs.CorrelationContext;
import org.benchlab.obs.JsonLinesLogger;
import org.benchlab.registry.InstanceRecord;
import org.benchlab.registry.TypeRegistry;
import org.benchlab.state.Benchmark;
import org.benchlab.state.BenchmarkEval;
import org.benchlab.state.BenchmarkExec;
import org.benchlab.state.BenchmarkReport;
import org.benchlab.state.BenchmarkStage;
import org.benchlab.state.StageType;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInvalidOperationException;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.json.JsonParseException;

/**
 * Self-describing JSON form of every lifecycle stage.
 *
 * <p>Artifacts record a type tag for the stage, each instance, each metric and each aggregator.
 * Loading resolves those tags through a {@link TypeRegistry} only. An artifact recorded at
 * stage S can be loaded as any stage T with rank(S) >= rank(T); data beyond T is dropped.
 */
public final class ArtifactCodec {
    public static final String STAGE_MODULE = "benchlab.state";

    static final String METADATA = "metadata";
    static final String SPEC = "spec";
    static final String INSTANCES = "instances";
    static final String METRICS = "metrics";
    static final String AGGREGATORS = "aggregators";
    static final String REPORTS = "reports";
    static final String REPORT_AGGREGATOR = "aggregator";
    static final String REPORT_OUTER = "outer";
    static final String REPORT_INNER = "inner";

    private final TypeRegistry registry;
    private final Function<Spec, JsonLinesLogger> loggerFactory;

    public ArtifactCodec() {
        this(TypeRegistry.loadDefault());
    }

    public ArtifactCodec(TypeRegistry registry) {
        this(registry, BenchmarkLoggers::forSpec);
    }

    /**
     * @param loggerFactory supplies the logger attached to loaded stages
     */
    public ArtifactCodec(TypeRegistry registry, Function<Spec, JsonLinesLogger> loggerFactory) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.loggerFactory = Objects.requireNonNull(loggerFactory, "loggerFactory");
    }

    public String toJson(BenchmarkStage stage) {
        return toDocument(stage).toJson(BsonValues.PRETTY_JSON);
    }

    public BsonDocument toDocument(BenchmarkStage stage) {
        Objects.requireNonNull(stage, "stage");
        BsonDocument document = new BsonDocument();
        BsonDocument metadata = new BsonDocument();
        metadata.put(InstanceRecord.CLASS_NAME, new BsonString(stage.stageType().label()));
        metadata.put(InstanceRecord.CLASS_MODULE, new BsonString(STAGE_MODULE));
        document.put(METADATA, metadata);
        document.put(SPEC, BsonValues.toBsonDocument(stage.spec().toMap()));

        BsonArray instances = new BsonArray();
        for (Instance instance : stage.instances()) {
            instances.add(InstanceRecord.of(instance).toDocument());
        }
        document.put(INSTANCES, instances);

        BsonArray metrics = new BsonArray();
        for (Metric<?> metric : stage.metrics()) {
            metrics.add(componentDocument(metric.typeTag(), metric.parameters()));
        }
        document.put(METRICS, metrics);

        BsonArray aggregators = new BsonArray();
        for (Aggregator aggregator : stage.aggregators()) {
            aggregators.add(componentDocument(aggregator.typeTag(), aggregator.parameters()));
        }
        document.put(AGGREGATORS, aggregators);

        if (stage instanceof BenchmarkReport report) {
            BsonArray reports = new BsonArray();
            for (Report item : report.reports()) {
                BsonDocument encoded = new BsonDocument();
                encoded.put(REPORT_AGGREGATOR, new BsonString(item.aggregatorName()));
                encoded.put(REPORT_OUTER, new BsonDouble(item.outer()));
                encoded.put(REPORT_INNER, BsonValues.toBsonDocument(item.inner()));
                reports.add(encoded);
            }
            document.put(REPORTS, reports);
        }
        return document;
    }

    /**
     * Writes the artifact, appending {@code .json} when the file name has no extension.
     *
     * @return the path written
     */
    public Path writeJson(BenchmarkStage stage, Path path) throws IOException {
        Path target = ArtifactPaths.resolveOutput(path, "json");
        Files.writeString(target, toJson(stage), StandardCharsets.UTF_8);
        stage.logger().info(
            "artifact written",
            CorrelationContext.of(stage.spec().name(), "artifact"),
            Map.of("path", target.toString(), "stage", stage.stageType().label())
        );
        return target;
    }

    /**
     * Loads the artifact as the stage it was recorded at.
     */
    public BenchmarkStage fromJson(String json) {
        BsonDocument document = parse(json);
        return decode(document, recordedStage(document));
    }

    public BenchmarkStage fromJson(String json, StageType target) {
        Objects.requireNonNull(target, "target");
        return decode(parse(json), target);
    }

    public BenchmarkStage readJson(Path path) throws IOException {
        try {
            return fromJson(Files.readString(path, StandardCharsets.UTF_8));
        } catch (ArtifactCorruptedException e) {
            throw e.withSource(path);
        }
    }

    public BenchmarkStage readJson(Path path, StageType target) throws IOException {
        try {
            return fromJson(Files.readString(path, StandardCharsets.UTF_8), target);
        } catch (ArtifactCorruptedException e) {
            throw e.withSource(path);
        }
    }

    public Benchmark readBenchmark(Path path) throws IOException {
        return (Benchmark) readJson(path, StageType.BENCHMARK);
    }

    public BenchmarkExec readExecution(Path path) throws IOException {
        return (BenchmarkExec) readJson(path, StageType.EXEC);
    }

    public BenchmarkEval readEvaluation(Path path) throws IOException {
        return (BenchmarkEval) readJson(path, StageType.EVAL);
    }

    public BenchmarkReport readReport(Path path) throws IOException {
        return (BenchmarkReport) readJson(path, StageType.REPORT);
    }

    /**
     * Stage recorded in the artifact metadata.
     */
    public static StageType recordedStage(String json) {
        return recordedStage(parse(json));
    }

    private BenchmarkStage decode(BsonDocument document, StageType target) {
        StageType recorded = recordedStage(document);
        if (!recorded.canBuild(target)) {
            throw new ArtifactCorruptedException(
                "Incompatible Artifact Stage: Cannot initialize a '" + target.label()
                    + "' from a '" + recorded.label() + "' file");
        }

        Spec spec = decodeSpec(document);
        List<Instance> instances = decodeInstances(document);
        List<Metric<?>> metrics = decodeComponents(document, METRICS, "metric",
            (tag, parameters) -> registry.hasMetric(tag) ? registry.createMetric(tag, parameters) : null);
        List<Aggregator> aggregators = decodeComponents(document, AGGREGATORS, "aggregator",
            (tag, parameters) -> registry.hasAggregator(tag) ? registry.createAggregator(tag, parameters) : null);

        JsonLinesLogger logger = loggerFactory.apply(spec);
        BenchmarkStage stage;
        try {
            stage = switch (target) {
                case BENCHMARK -> Benchmark.of(spec, instances, metrics, aggregators, logger);
                case EXEC -> BenchmarkExec.of(spec, instances, metrics, aggregators, logger);
                case EVAL -> BenchmarkEval.of(spec, instances, metrics, aggregators, logger);
                case REPORT -> BenchmarkReport.of(spec, instances, metrics, aggregators, decodeReports(document), logger);
            };
        } catch (IllegalArgumentException e) {
            throw new ArtifactCorruptedException("inconsistent artifact: " + e.getMessage(), e);
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("recordedStage", recorded.label());
        fields.put("stage", target.label());
        fields.put("instances", instances.size());
        logger.info("artifact loaded", CorrelationContext.of(spec.name(), "artifact"), fields);
        return stage;
    }

    private static BsonDocument parse(String json) {
        Objects.requireNonNull(json, "json");
        try {
            return BsonDocument.parse(json);
        } catch (JsonParseException | BsonInvalidOperationException e) {
            throw new ArtifactCorruptedException("malformed artifact JSON: " + e.getMessage(), e);
        }
    }

    private static StageType recordedStage(BsonDocument document) {
        BsonValue metadata = document.get(METADATA);
        if (metadata == null || !metadata.isDocument()) {
            throw new ArtifactCorruptedException("artifact is missing its metadata block");
        }
        String module = BsonValues.readString(metadata.asDocument(), InstanceRecord.CLASS_MODULE);
        String name = BsonValues.readString(metadata.asDocument(), InstanceRecord.CLASS_NAME);
        if (module == null || name == null) {
            throw new ArtifactCorruptedException("artifact metadata must name class_module and class_name");
        }
        if (!STAGE_MODULE.equals(module)) {
            throw new ArtifactCorruptedException("unknown stage module '" + module + "'");
        }
        try {
            return StageType.fromLabel(name);
        } catch (IllegalArgumentException e) {
            throw new ArtifactCorruptedException("unknown stage class '" + name + "'", e);
        }
    }

    private static Spec decodeSpec(BsonDocument document) {
        BsonValue raw = document.get(SPEC);
        if (raw == null || !raw.isDocument()) {
            throw new ArtifactCorruptedException("artifact is missing its spec block");
        }
        try {
            return Spec.fromMap(BsonValues.toJavaMap(raw.asDocument()));
        } catch (IllegalArgumentException e) {
            throw new ArtifactCorruptedException("invalid spec block: " + e.getMessage(), e);
        }
    }

    private List<Instance> decodeInstances(BsonDocument document) {
        BsonArray records = requireArray(document, INSTANCES);
        List<Instance> instances = new ArrayList<>(records.size());
        TypeTag expected = null;
        for (int i = 0; i < records.size(); i++) {
            BsonValue raw = records.get(i);
            if (!raw.isDocument()) {
                throw new ArtifactCorruptedException("instances[" + i + "] is not a document");
            }
            InstanceRecord record;
            try {
                record = InstanceRecord.fromDocument(raw.asDocument());
            } catch (IllegalArgumentException e) {
                throw new ArtifactCorruptedException("instances[" + i + "]: " + e.getMessage(), e);
            }
            if (expected == null) {
                expected = record.typeTag();
            } else if (!expected.equals(record.typeTag())) {
                throw new ArtifactCorruptedException(
                    "all instances must share one type: instances[" + i + "] ('" + record.id() + "') is "
                        + record.typeTag() + " but instances[0] is " + expected);
            }
            if (!registry.hasInstance(record.typeTag())) {
                throw new ArtifactCorruptedException(
                    "instances[" + i + "] ('" + record.id() + "') has unregistered type " + record.typeTag());
            }
            try {
                instances.add(registry.createInstance(record));
            } catch (IllegalArgumentException e) {
                throw new ArtifactCorruptedException(
                    "instances[" + i + "] ('" + record.id() + "'): " + e.getMessage(), e);
            }
        }
        return instances;
    }

    @FunctionalInterface
    private interface ComponentResolver<T> {
        T resolve(TypeTag tag, Map<String, Object> parameters);
    }

    private static <T> List<T> decodeComponents(
        BsonDocument document,
        String key,
        String kind,
        ComponentResolver<T> resolver
    ) {
        BsonArray entries = requireArray(document, key);
        List<T> components = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            BsonValue raw = entries.get(i);
            if (!raw.isDocument()) {
                throw new ArtifactCorruptedException(key + "[" + i + "] is not a document");
            }
            Map<String, Object> fields = BsonValues.toJavaMap(raw.asDocument());
            Object module = fields.remove(InstanceRecord.CLASS_MODULE);
            Object name = fields.remove(InstanceRecord.CLASS_NAME);
            if (!(module instanceof String) || !(name instanceof String)) {
                throw new ArtifactCorruptedException(key + "[" + i + "] must name class_module and class_name");
            }
            TypeTag tag = TypeTag.of((String) module, (String) name);
            T component;
            try {
                component = resolver.resolve(tag, fields);
            } catch (IllegalArgumentException e) {
                throw new ArtifactCorruptedException(key + "[" + i + "] (" + tag + "): " + e.getMessage(), e);
            }
            if (component == null) {
                throw new ArtifactCorruptedException(key + "[" + i + "] has unregistered " + kind + " type " + tag);
            }
            components.add(component);
        }
        return components;
    }

    private static List<Report> decodeReports(BsonDocument document) {
        BsonArray entries = requireArray(document, REPORTS);
        List<Report> reports = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            BsonValue raw = entries.get(i);
            if (!raw.isDocument()) {
                throw new ArtifactCorruptedException(REPORTS + "[" + i + "] is not a document");
            }
            BsonDocument entry = raw.asDocument();
            String aggregator = BsonValues.readString(entry, REPORT_AGGREGATOR);
            Double outer = BsonValues.readDouble(entry, REPORT_OUTER);
            BsonValue inner = entry.get(REPORT_INNER);
            if (aggregator == null || outer == null || inner == null || !inner.isDocument()) {
                throw new ArtifactCorruptedException(REPORTS + "[" + i + "] must carry aggregator, outer and inner");
            }
            Map<String, Double> values = new LinkedHashMap<>();
            for (Map.Entry<String, BsonValue> value : inner.asDocument().entrySet()) {
                if (!value.getValue().isNumber()) {
                    throw new ArtifactCorruptedException(
                        REPORTS + "[" + i + "].inner." + value.getKey() + " must be a number");
                }
                values.put(value.getKey(), value.getValue().asNumber().doubleValue());
            }
            reports.add(new Report(aggregator, outer, values));
        }
        return reports;
    }

    private static BsonArray requireArray(BsonDocument document, String key) {
        BsonValue value = document.get(key);
        if (value == null || !value.isArray()) {
            throw new ArtifactCorruptedException("artifact is missing the '" + key + "' array");
        }
        return value.asArray();
    }

    private static BsonDocument componentDocument(TypeTag tag, Map<String, Object> parameters) {
        BsonDocument document = new BsonDocument();
        document.put(InstanceRecord.CLASS_MODULE, new BsonString(tag.module()));
        document.put(InstanceRecord.CLASS_NAME, new BsonString(tag.name()));
        for (Map.Entry<String, Object> entry : parameters.entrySet()) {
            document.put(entry.getKey(), BsonValues.toBsonValue(entry.getValue()));
        }
        return document;
    }
}
