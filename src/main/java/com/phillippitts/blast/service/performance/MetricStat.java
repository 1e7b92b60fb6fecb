package com.phillippitts.blast.service.performance;

/**
 * Running statistics for one metric. Not thread-safe; guarded by the monitor's lock.
 */
final class MetricStat {

    private final String name;
    private long count;
    private double total;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;
    private double last;

    MetricStat(String name) {
        this.name = name;
    }

    void add(double value) {
        count++;
        total += value;
        min = Math.min(min, value);
        max = Math.max(max, value);
        last = value;
    }

    double average() {
        return count == 0 ? 0d : total / count;
    }

    MetricSnapshot snapshot(String unit) {
        return new MetricSnapshot(name, count, total,
                count == 0 ? 0d : min, count == 0 ? 0d : max, last, average(), unit == null ? "" : unit);
    }
}
