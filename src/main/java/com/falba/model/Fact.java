package com.falba.model;

/**
 * A named observation about a run, e.g. the kernel command line or the CPU
 * model. Fact names are unique within a {@link Run}.
 *
 * @param unit optional unit, {@code null} when the value is unitless
 */
public record Fact(String name, AttributeValue value, String unit) {

    public Fact {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("fact name is required");
        }
        if (value == null) {
            value = AttributeValue.NullValue.INSTANCE;
        }
    }

    public static Fact of(String name, AttributeValue value) {
        return new Fact(name, value, null);
    }

    public static Fact of(String name, Object value) {
        return new Fact(name, AttributeValue.fromJava(value), null);
    }
}
