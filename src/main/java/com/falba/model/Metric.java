package com.falba.model;

/**
 * A named measurement taken by a benchmark. Unlike facts, several metrics of
 * a run may share a name (repeated samples, one histogram per probe).
 *
 * @param unit optional unit, {@code null} when the value is unitless
 */
public record Metric(String name, AttributeValue value, String unit) {

    public Metric {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("metric name is required");
        }
        if (value == null) {
            value = AttributeValue.NullValue.INSTANCE;
        }
    }

    public static Metric of(String name, AttributeValue value) {
        return new Metric(name, value, null);
    }

    public static Metric of(String name, Object value) {
        return new Metric(name, AttributeValue.fromJava(value), null);
    }
}
