package com.falba.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dynamically-typed value carried by a {@link Fact} or a {@link Metric}.
 *
 * The set of variants is closed: boolean, 64-bit integer, double, string,
 * ordered list, string-keyed map and null. Every consumer that needs to
 * branch on the runtime type switches on {@link #kind()}, so adding a variant
 * breaks the build instead of silently falling through.
 */
public sealed interface AttributeValue {

    enum Kind {
        BOOL,
        INT,
        DOUBLE,
        STRING,
        LIST,
        MAP,
        NULL
    }

    Kind kind();

    /** Plain Java form: Boolean, Long, Double, String, List, Map or null. */
    Object toJava();

    record BoolValue(boolean value) implements AttributeValue {
        @Override
        public Kind kind() {
            return Kind.BOOL;
        }

        @Override
        public Object toJava() {
            return value;
        }
    }

    record IntValue(long value) implements AttributeValue {
        @Override
        public Kind kind() {
            return Kind.INT;
        }

        @Override
        public Object toJava() {
            return value;
        }
    }

    record DoubleValue(double value) implements AttributeValue {
        @Override
        public Kind kind() {
            return Kind.DOUBLE;
        }

        @Override
        public Object toJava() {
            return value;
        }
    }

    record StringValue(String value) implements AttributeValue {
        public StringValue {
            if (value == null) {
                throw new IllegalArgumentException("string value cannot be null, use NullValue");
            }
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }

        @Override
        public Object toJava() {
            return value;
        }
    }

    record ListValue(List<AttributeValue> values) implements AttributeValue {
        public ListValue {
            values = List.copyOf(values);
        }

        @Override
        public Kind kind() {
            return Kind.LIST;
        }

        @Override
        public Object toJava() {
            List<Object> out = new ArrayList<>(values.size());
            for (AttributeValue v : values) {
                out.add(v.toJava());
            }
            return Collections.unmodifiableList(out);
        }
    }

    record MapValue(Map<String, AttributeValue> entries) implements AttributeValue {
        public MapValue {
            // keeps insertion order, histogram buckets read in log order
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public Kind kind() {
            return Kind.MAP;
        }

        @Override
        public Object toJava() {
            Map<String, Object> out = new LinkedHashMap<>();
            entries.forEach((k, v) -> out.put(k, v.toJava()));
            return Collections.unmodifiableMap(out);
        }
    }

    enum NullValue implements AttributeValue {
        INSTANCE;

        @Override
        public Kind kind() {
            return Kind.NULL;
        }

        @Override
        public Object toJava() {
            return null;
        }
    }

    static AttributeValue of(boolean value) {
        return new BoolValue(value);
    }

    static AttributeValue of(long value) {
        return new IntValue(value);
    }

    static AttributeValue of(double value) {
        return new DoubleValue(value);
    }

    static AttributeValue of(String value) {
        return value == null ? NullValue.INSTANCE : new StringValue(value);
    }

    /**
     * Converts a parsed JSON tree. Integral numbers that fit into a long become
     * {@link IntValue}; every other number becomes {@link DoubleValue}.
     */
    static AttributeValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NullValue.INSTANCE;
        }
        if (node.isBoolean()) {
            return new BoolValue(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? new IntValue(node.longValue()) : new DoubleValue(node.doubleValue());
        }
        if (node.isNumber()) {
            return new DoubleValue(node.doubleValue());
        }
        if (node.isTextual()) {
            return new StringValue(node.textValue());
        }
        if (node.isArray()) {
            List<AttributeValue> values = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                values.add(fromJson(element));
            }
            return new ListValue(values);
        }
        if (node.isObject()) {
            Map<String, AttributeValue> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), fromJson(field.getValue()));
            }
            return new MapValue(entries);
        }
        // binary and POJO nodes only come from hand-built trees
        return new StringValue(node.asText());
    }

    /**
     * Converts a plain Java value. Integer types widen to {@link IntValue}, floating
     * types to {@link DoubleValue}; maps are keyed by {@code String.valueOf(key)}.
     */
    static AttributeValue fromJava(Object value) {
        if (value == null) {
            return NullValue.INSTANCE;
        }
        if (value instanceof AttributeValue attribute) {
            return attribute;
        }
        if (value instanceof Boolean b) {
            return new BoolValue(b);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return new IntValue(((Number) value).longValue());
        }
        if (value instanceof Number n) {
            return new DoubleValue(n.doubleValue());
        }
        if (value instanceof CharSequence text) {
            return new StringValue(text.toString());
        }
        if (value instanceof List<?> list) {
            List<AttributeValue> values = new ArrayList<>(list.size());
            for (Object element : list) {
                values.add(fromJava(element));
            }
            return new ListValue(values);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, AttributeValue> entries = new LinkedHashMap<>();
            map.forEach((k, v) -> entries.put(String.valueOf(k), fromJava(v)));
            return new MapValue(entries);
        }
        throw new IllegalArgumentException("unsupported attribute value type: " + value.getClass().getName());
    }
}
