package org.benchlab.exec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.benchlab.codec.BsonValues;
import org.benchlab.registry.InstanceRecord;
import org.bson.BsonDocument;
import org.bson.BsonInvalidOperationException;
import org.bson.BsonValue;
import org.bson.json.JsonParseException;

/**
 * JSON messages exchanged with {@link IsolatedWorker}: one request on the worker's stdin; on its
 * stdout a ready line once the callable is built, then one result line. A setup failure sends
 * a single error line instead.
 */
final class WorkerMessages {
    static final String CALLABLE = "callable";
    static final String INSTANCE = "instance";
    static final String ARGS = "args";
    static final String STATUS = "status";
    static final String ANSWER = "answer";
    static final String USAGE = "usage";
    static final String RUNTIME = "runtime";
    static final String ERROR_TYPE = "error_type";
    static final String ERROR_MESSAGE = "error_message";

    static final String STATUS_SUCCESS = "success";
    static final String STATUS_ERROR = "error";
    static final String STATUS_READY = "ready";

    private WorkerMessages() {
    }

    record Request(String callableClass, InstanceRecord instance, Map<String, String> args) {
        Request {
            Objects.requireNonNull(callableClass, "callableClass");
            Objects.requireNonNull(instance, "instance");
            args = Map.copyOf(Objects.requireNonNull(args, "args"));
        }
    }

    static String encodeRequest(Request request) {
        BsonDocument document = new BsonDocument();
        document.put(CALLABLE, BsonValues.toBsonValue(request.callableClass()));
        document.put(INSTANCE, request.instance().toDocument());
        document.put(ARGS, BsonValues.toBsonDocument(request.args()));
        return document.toJson(BsonValues.COMPACT_JSON);
    }

    static Request decodeRequest(String json) {
        BsonDocument document = BsonDocument.parse(json);
        String callableClass = BsonValues.readString(document, CALLABLE);
        if (callableClass == null) {
            throw new IllegalArgumentException("worker request is missing the callable class");
        }
        BsonValue instance = document.get(INSTANCE);
        if (instance == null || !instance.isDocument()) {
            throw new IllegalArgumentException("worker request is missing the instance record");
        }
        Map<String, String> args = new LinkedHashMap<>();
        BsonValue rawArgs = document.get(ARGS);
        if (rawArgs != null && rawArgs.isDocument()) {
            for (Map.Entry<String, BsonValue> entry : rawArgs.asDocument().entrySet()) {
                args.put(entry.getKey(), String.valueOf(BsonValues.toJavaValue(entry.getValue())));
            }
        }
        return new Request(callableClass, InstanceRecord.fromDocument(instance.asDocument()), args);
    }

    static String encodeReady() {
        BsonDocument document = new BsonDocument();
        document.put(STATUS, BsonValues.toBsonValue(STATUS_READY));
        return document.toJson(BsonValues.COMPACT_JSON);
    }

    static boolean isReady(String line) {
        try {
            return STATUS_READY.equals(BsonValues.readString(BsonDocument.parse(line), STATUS));
        } catch (JsonParseException | BsonInvalidOperationException e) {
            return false;
        }
    }

    static String encodeSuccess(double runtimeSeconds, BenchmarkOutput output) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put(STATUS, STATUS_SUCCESS);
        message.put(RUNTIME, runtimeSeconds);
        message.put(ANSWER, output.answer());
        message.put(USAGE, output.usage());
        return BsonValues.toBsonDocument(message).toJson(BsonValues.COMPACT_JSON);
    }

    static String encodeError(double runtimeSeconds, Throwable error) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put(STATUS, STATUS_ERROR);
        message.put(RUNTIME, runtimeSeconds);
        message.put(ERROR_TYPE, error.getClass().getName());
        message.put(ERROR_MESSAGE, error.getMessage());
        return BsonValues.toBsonDocument(message).toJson(BsonValues.COMPACT_JSON);
    }

    /**
     * Turns the worker's result line into an execution. The worker-measured runtime is used when
     * present, otherwise {@code fallbackRuntime}.
     */
    static TimedExecution decodeResult(String line, double fallbackRuntime) {
        BsonDocument document;
        try {
            document = BsonDocument.parse(line);
        } catch (JsonParseException | BsonInvalidOperationException e) {
            return TimedExecution.error(fallbackRuntime, "WorkerProtocolException", "unreadable worker message: " + line);
        }
        Double reported = BsonValues.readDouble(document, RUNTIME);
        double runtime = reported == null || reported < 0.0d ? fallbackRuntime : reported;
        String status = BsonValues.readString(document, STATUS);
        if (STATUS_SUCCESS.equals(status)) {
            Map<String, Long> usage = new LinkedHashMap<>();
            BsonValue rawUsage = document.get(USAGE);
            if (rawUsage != null && rawUsage.isDocument()) {
                for (Map.Entry<String, BsonValue> entry : rawUsage.asDocument().entrySet()) {
                    if (entry.getValue().isNumber()) {
                        usage.put(entry.getKey(), entry.getValue().asNumber().longValue());
                    }
                }
            }
            return TimedExecution.success(runtime, BenchmarkOutput.of(BsonValues.readString(document, ANSWER), usage));
        }
        if (STATUS_ERROR.equals(status)) {
            String errorType = BsonValues.readString(document, ERROR_TYPE);
            return TimedExecution.error(
                runtime,
                errorType == null ? "UnknownError" : errorType,
                BsonValues.readString(document, ERROR_MESSAGE)
            );
        }
        return TimedExecution.error(runtime, "WorkerProtocolException", "unknown worker status: " + status);
    }
}
