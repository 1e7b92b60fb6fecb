package com.phillippitts.blast.service.events;

import java.util.Objects;

/**
 * Threshold limits for one sensor. A sample at or above a limit enters that zone.
 *
 * @param sensorId stable sensor identifier used for deduplication
 * @param name display name
 * @param warning warning limit
 * @param danger danger limit, must not be below {@code warning}
 * @param critical critical limit, or {@link Double#POSITIVE_INFINITY} when the sensor has none
 * @param unit engineering unit for log output
 */
public record SensorLimits(String sensorId, String name, double warning, double danger,
                           double critical, String unit) {

    public SensorLimits {
        Objects.requireNonNull(sensorId, "sensorId");
        name = name == null ? sensorId : name;
        unit = unit == null ? "" : unit;
        if (danger < warning) {
            throw new IllegalArgumentException("danger limit must be >= warning limit for " + sensorId);
        }
        if (critical < danger) {
            throw new IllegalArgumentException("critical limit must be >= danger limit for " + sensorId);
        }
    }

    public SensorLimits(String sensorId, String name, double warning, double danger, String unit) {
        this(sensorId, name, warning, danger, Double.POSITIVE_INFINITY, unit);
    }

    public ThresholdZone zoneOf(double value) {
        if (value >= critical) {
            return ThresholdZone.CRITICAL;
        }
        if (value >= danger) {
            return ThresholdZone.DANGER;
        }
        if (value >= warning) {
            return ThresholdZone.WARNING;
        }
        return ThresholdZone.NORMAL;
    }

    /** Limit that bounds the given zone, or 0 for {@link ThresholdZone#NORMAL}. */
    double limitFor(ThresholdZone zone) {
        return switch (zone) {
            case WARNING -> warning;
            case DANGER -> danger;
            case CRITICAL -> critical;
            case NORMAL -> 0d;
        };
    }
}
