package org.benchlab.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.benchlab.codec.BsonValues;
import org.benchlab.model.Attempt;
import org.benchlab.model.AttemptStatus;
import org.benchlab.model.Instance;
import org.benchlab.model.TypeTag;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.BsonValue;

/**
 * Portable form of an instance: type tag, bookkeeping and domain fields.
 * Shared by the artifact codec and the isolated worker channel.
 */
public final class InstanceRecord {
    public static final String CLASS_MODULE = "class_module";
    public static final String CLASS_NAME = "class_name";
    public static final String ID = "id";
    public static final String ATTEMPTS = "_attempts";
    public static final String EVALUATIONS = "_evaluated_attempts";
    public static final String RESPONSE = "_response";
    public static final String RUNTIME = "_runtime";
    public static final String STATUS = "_status";
    public static final String TOKEN_USAGE = "_token_usage";

    private static final Set<String> RESERVED = Set.of(CLASS_MODULE, CLASS_NAME, ID, ATTEMPTS, EVALUATIONS);

    private final TypeTag typeTag;
    private final String id;
    private final List<Attempt> attempts;
    private final Map<String, List<Object>> evaluations;
    private final Map<String, Object> fields;

    public InstanceRecord(
        TypeTag typeTag,
        String id,
        List<Attempt> attempts,
        Map<String, List<Object>> evaluations,
        Map<String, Object> fields
    ) {
        this.typeTag = Objects.requireNonNull(typeTag, "typeTag");
        this.id = Objects.requireNonNull(id, "id");
        this.attempts = List.copyOf(Objects.requireNonNull(attempts, "attempts"));
        Map<String, List<Object>> evaluationsCopy = new LinkedHashMap<>();
        for (Map.Entry<String, List<Object>> entry : Objects.requireNonNull(evaluations, "evaluations").entrySet()) {
            evaluationsCopy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
        }
        this.evaluations = Collections.unmodifiableMap(evaluationsCopy);
        Map<String, Object> fieldsCopy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : Objects.requireNonNull(fields, "fields").entrySet()) {
            if (RESERVED.contains(entry.getKey())) {
                throw new IllegalArgumentException("instance field name is reserved: " + entry.getKey());
            }
            fieldsCopy.put(entry.getKey(), entry.getValue());
        }
        this.fields = Collections.unmodifiableMap(fieldsCopy);
    }

    public static InstanceRecord of(Instance instance) {
        Objects.requireNonNull(instance, "instance");
        return new InstanceRecord(
            instance.typeTag(),
            instance.id(),
            instance.attempts(),
            instance.evaluations(),
            instance.fields()
        );
    }

    public TypeTag typeTag() {
        return typeTag;
    }

    public String id() {
        return id;
    }

    public List<Attempt> attempts() {
        return attempts;
    }

    public Map<String, List<Object>> evaluations() {
        return evaluations;
    }

    public Map<String, Object> fields() {
        return fields;
    }

    /**
     * Domain field that must be present; it may still be null.
     */
    public Object field(String name) {
        if (!fields.containsKey(name)) {
            throw new IllegalArgumentException("instance record '" + id + "' is missing field '" + name + "'");
        }
        return fields.get(name);
    }

    public String stringField(String name) {
        Object value = field(name);
        if (value != null && !(value instanceof String)) {
            throw new IllegalArgumentException(
                "instance record '" + id + "' field '" + name + "' must be a string");
        }
        return (String) value;
    }

    public BsonDocument toDocument() {
        BsonDocument document = new BsonDocument();
        document.put(CLASS_MODULE, new BsonString(typeTag.module()));
        document.put(CLASS_NAME, new BsonString(typeTag.name()));
        document.put(ID, new BsonString(id));
        BsonArray attemptArray = new BsonArray();
        for (Attempt attempt : attempts) {
            attemptArray.add(encodeAttempt(attempt));
        }
        document.put(ATTEMPTS, attemptArray);
        document.put(EVALUATIONS, BsonValues.toBsonDocument(evaluations));
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            document.put(entry.getKey(), BsonValues.toBsonValue(entry.getValue()));
        }
        return document;
    }

    /**
     * @throws IllegalArgumentException when the document is not a well-formed instance record
     */
    public static InstanceRecord fromDocument(BsonDocument document) {
        Objects.requireNonNull(document, "document");
        String module = BsonValues.readString(document, CLASS_MODULE);
        String name = BsonValues.readString(document, CLASS_NAME);
        if (module == null || name == null) {
            throw new IllegalArgumentException("instance record is missing class_module/class_name");
        }
        BsonValue rawId = document.get(ID);
        if (rawId == null || rawId.isNull()) {
            throw new IllegalArgumentException("instance record is missing id");
        }
        String id = rawId.isString() ? rawId.asString().getValue() : String.valueOf(BsonValues.toJavaValue(rawId));

        List<Attempt> attempts = new ArrayList<>();
        BsonValue rawAttempts = document.get(ATTEMPTS);
        if (rawAttempts != null && !rawAttempts.isNull()) {
            if (!rawAttempts.isArray()) {
                throw new IllegalArgumentException("instance record '" + id + "': _attempts must be an array");
            }
            int index = 0;
            for (BsonValue item : rawAttempts.asArray()) {
                if (!item.isDocument()) {
                    throw new IllegalArgumentException(
                        "instance record '" + id + "': _attempts[" + index + "] must be a document");
                }
                attempts.add(decodeAttempt(id, index, item.asDocument()));
                index++;
            }
        }

        Map<String, List<Object>> evaluations = new LinkedHashMap<>();
        BsonValue rawEvaluations = document.get(EVALUATIONS);
        if (rawEvaluations != null && !rawEvaluations.isNull()) {
            if (!rawEvaluations.isDocument()) {
                throw new IllegalArgumentException(
                    "instance record '" + id + "': _evaluated_attempts must be a document");
            }
            for (Map.Entry<String, BsonValue> entry : rawEvaluations.asDocument().entrySet()) {
                if (!entry.getValue().isArray()) {
                    throw new IllegalArgumentException(
                        "instance record '" + id + "': scores of metric '" + entry.getKey() + "' must be an array");
                }
                List<Object> scores = new ArrayList<>();
                for (BsonValue score : entry.getValue().asArray()) {
                    scores.add(BsonValues.toJavaValue(score));
                }
                evaluations.put(entry.getKey(), scores);
            }
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        for (Map.Entry<String, BsonValue> entry : document.entrySet()) {
            if (!RESERVED.contains(entry.getKey())) {
                fields.put(entry.getKey(), BsonValues.toJavaValue(entry.getValue()));
            }
        }
        return new InstanceRecord(TypeTag.of(module, name), id, attempts, evaluations, fields);
    }

    private static BsonDocument encodeAttempt(Attempt attempt) {
        BsonDocument document = new BsonDocument();
        document.put(RESPONSE, attempt.response().<BsonValue>map(BsonString::new).orElse(BsonNull.VALUE));
        document.put(RUNTIME, attempt.runtime().<BsonValue>map(BsonDouble::new).orElse(BsonNull.VALUE));
        document.put(STATUS, new BsonString(attempt.status().text()));
        document.put(TOKEN_USAGE, BsonValues.toBsonDocument(attempt.usage()));
        return document;
    }

    private static Attempt decodeAttempt(String id, int index, BsonDocument document) {
        String status = BsonValues.readString(document, STATUS);
        if (status == null) {
            throw new IllegalArgumentException(
                "instance record '" + id + "': _attempts[" + index + "] is missing _status");
        }
        Map<String, Long> usage = new LinkedHashMap<>();
        BsonValue rawUsage = document.get(TOKEN_USAGE);
        if (rawUsage != null && rawUsage.isDocument()) {
            for (Map.Entry<String, BsonValue> entry : rawUsage.asDocument().entrySet()) {
                if (!entry.getValue().isNumber()) {
                    throw new IllegalArgumentException(
                        "instance record '" + id + "': usage counter '" + entry.getKey() + "' must be a number");
                }
                usage.put(entry.getKey(), entry.getValue().asNumber().longValue());
            }
        }
        return new Attempt(
            BsonValues.readString(document, RESPONSE),
            BsonValues.readDouble(document, RUNTIME),
            AttemptStatus.fromText(status),
            usage
        );
    }

    @Override
    public String toString() {
        return "InstanceRecord{type=" + typeTag + ", id=" + id + ", attempts=" + attempts.size() + "}";
    }
}
