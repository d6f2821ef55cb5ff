package org.benchlab.codec;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDecimal128;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;
import org.bson.types.Decimal128;

/**
 * Conversions between plain Java values and BSON values, shared by the artifact
 * codec, the worker channel, the config loader and the logger.
 */
public final class BsonValues {
    public static final JsonWriterSettings PRETTY_JSON = JsonWriterSettings.builder()
        .outputMode(JsonMode.RELAXED)
        .indent(true)
        .build();
    public static final JsonWriterSettings COMPACT_JSON = JsonWriterSettings.builder()
        .outputMode(JsonMode.RELAXED)
        .build();

    private BsonValues() {
    }

    public static Map<String, Object> toJavaMap(BsonDocument document) {
        Objects.requireNonNull(document, "document");
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, BsonValue> entry : document.entrySet()) {
            result.put(entry.getKey(), toJavaValue(entry.getValue()));
        }
        return result;
    }

    public static Object toJavaValue(BsonValue value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isDocument()) {
            return toJavaMap(value.asDocument());
        }
        if (value.isArray()) {
            List<Object> results = new ArrayList<>();
            for (BsonValue item : value.asArray()) {
                results.add(toJavaValue(item));
            }
            return results;
        }
        if (value.isString()) {
            return value.asString().getValue();
        }
        if (value.isBoolean()) {
            return value.asBoolean().getValue();
        }
        if (value.isInt32()) {
            return value.asInt32().getValue();
        }
        if (value.isInt64()) {
            return value.asInt64().getValue();
        }
        if (value.isDouble()) {
            return value.asDouble().getValue();
        }
        if (value.isDecimal128()) {
            return value.asDecimal128().decimal128Value().bigDecimalValue();
        }
        return value.toString();
    }

    public static BsonValue toBsonValue(Object value) {
        if (value == null) {
            return BsonNull.VALUE;
        }
        if (value instanceof BsonValue bsonValue) {
            return bsonValue;
        }
        if (value instanceof String s) {
            return new BsonString(s);
        }
        if (value instanceof Boolean b) {
            return BsonBoolean.valueOf(b);
        }
        if (value instanceof Integer n) {
            return new BsonInt32(n);
        }
        if (value instanceof Long n) {
            return new BsonInt64(n);
        }
        if (value instanceof Double n) {
            return new BsonDouble(n);
        }
        if (value instanceof Float n) {
            return new BsonDouble(n.doubleValue());
        }
        if (value instanceof Short n) {
            return new BsonInt32(n.intValue());
        }
        if (value instanceof Byte n) {
            return new BsonInt32(n.intValue());
        }
        if (value instanceof BigDecimal decimal) {
            return new BsonDecimal128(new Decimal128(decimal));
        }
        if (value instanceof Enum<?> e) {
            return new BsonString(e.toString());
        }
        if (value instanceof Map<?, ?> map) {
            return toBsonDocument(map);
        }
        if (value instanceof Collection<?> collection) {
            BsonArray array = new BsonArray();
            for (Object item : collection) {
                array.add(toBsonValue(item));
            }
            return array;
        }
        throw new IllegalArgumentException("unsupported value type: " + value.getClass().getName());
    }

    public static BsonDocument toBsonDocument(Map<?, ?> source) {
        Objects.requireNonNull(source, "source");
        BsonDocument document = new BsonDocument();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            Object key = Objects.requireNonNull(entry.getKey(), "document key");
            document.put(String.valueOf(key), toBsonValue(entry.getValue()));
        }
        return document;
    }

    public static String readString(BsonDocument document, String key) {
        BsonValue value = document.get(key);
        if (value == null || !value.isString()) {
            return null;
        }
        return value.asString().getValue();
    }

    public static Double readDouble(BsonDocument document, String key) {
        BsonValue value = document.get(key);
        if (value == null || !value.isNumber()) {
            return null;
        }
        return value.asNumber().doubleValue();
    }
}
