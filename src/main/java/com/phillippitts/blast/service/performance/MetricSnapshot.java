package com.phillippitts.blast.service.performance;

import com.phillippitts.blast.util.TimeUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable view of one metric's running statistics.
 */
public record MetricSnapshot(String name, long count, double total, double min, double max,
                             double last, double average, String unit) {

    /** Payload form with values rounded to three decimals. */
    Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("count", count);
        fields.put("average", TimeUtils.round3(average));
        fields.put("min", count == 0 ? null : TimeUtils.round3(min));
        fields.put("max", count == 0 ? null : TimeUtils.round3(max));
        fields.put("last", TimeUtils.round3(last));
        fields.put("total", TimeUtils.round3(total));
        fields.put("unit", unit);
        return fields;
    }
}
