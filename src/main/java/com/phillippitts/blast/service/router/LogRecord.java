package com.phillippitts.blast.service.router;

import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One record bound for a category stream.
 *
 * @param category target stream
 * @param timestamp creation time (producer side)
 * @param severity record level
 * @param message short human-readable message
 * @param fields category-specific structured payload (ignored for text categories)
 */
public record LogRecord(LogCategory category,
                        Instant timestamp,
                        Severity severity,
                        String message,
                        Map<String, Object> fields) {

    public LogRecord {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(severity, "severity");
        message = message == null ? "" : message;
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static LogRecord of(LogCategory category, Instant timestamp, Severity severity, String message) {
        return new LogRecord(category, timestamp, severity, message, Map.of());
    }

    /**
     * Renders this record as a single line without the trailing newline.
     * Structured categories produce a JSON object, text categories a plain log line.
     */
    public String toLine() {
        if (!category.isStructured()) {
            return timestamp + " [" + severity + "] " + message.replace('\n', ' ');
        }
        JSONObject json = new JSONObject();
        for (Map.Entry<String, Object> e : fields.entrySet()) {
            json.put(e.getKey(), toJsonValue(e.getValue()));
        }
        json.put("timestamp", timestamp.toString());
        json.put("level", severity.name());
        json.put("category", category.label());
        json.put("message", message);
        return json.toString();
    }

    /**
     * Converts a payload value into something {@link JSONObject} accepts. JSON has no NaN or
     * Infinity, so such samples are written as strings instead of failing the whole line.
     */
    static Object toJsonValue(Object value) {
        if (value == null) {
            return JSONObject.NULL;
        }
        if (value instanceof Map<?, ?> map) {
            JSONObject nested = new JSONObject();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                nested.put(String.valueOf(e.getKey()), toJsonValue(e.getValue()));
            }
            return nested;
        }
        if (value instanceof Collection<?> collection) {
            JSONArray array = new JSONArray();
            for (Object element : collection) {
                array.put(toJsonValue(element));
            }
            return array;
        }
        if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
            return d.toString();
        }
        if (value instanceof Float f && (f.isNaN() || f.isInfinite())) {
            return f.toString();
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        return JSONObject.wrap(value);
    }
}
