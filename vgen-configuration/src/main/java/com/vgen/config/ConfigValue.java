package com.vgen.config;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Node of a parsed configuration tree. The set of node kinds is closed ({@link Kind});
 * consumers switch on {@link #kind()} instead of probing runtime types.
 * <p>
 * Map entries keep their declaration order. All instances are immutable.
 */
public sealed interface ConfigValue permits ConfigValue.StringValue, ConfigValue.IntegerValue,
        ConfigValue.DecimalValue, ConfigValue.BooleanValue, ConfigValue.NullValue, ConfigValue.ListValue,
        ConfigValue.MapValue {

    enum Kind {
        STRING,
        INTEGER,
        DECIMAL,
        BOOLEAN,
        NULL,
        LIST,
        MAP
    }

    /** Shared null node; also returned for absent map keys. */
    ConfigValue NULL = new NullValue();

    Kind kind();

    /**
     * Converts this node to plain Java values: String, Long, Double, Boolean, null,
     * {@code List<Object>} and {@code Map<String, Object>} (insertion ordered).
     */
    Object toPlain();

    default boolean isNull() {
        return kind() == Kind.NULL;
    }

    /** Value for {@code key} when this is a map; {@link #NULL} otherwise or when absent. */
    default ConfigValue get(String key) {
        return NULL;
    }

    /** Whether this is a map that declares {@code key} (even with a null value). */
    default boolean has(String key) {
        return false;
    }

    default Map<String, ConfigValue> entries() {
        return Map.of();
    }

    default List<ConfigValue> items() {
        return List.of();
    }

    default String asString(String defaultValue) {
        return switch (kind()) {
            case STRING, INTEGER, DECIMAL, BOOLEAN -> String.valueOf(toPlain());
            case NULL, LIST, MAP -> defaultValue;
        };
    }

    default long asLong(long defaultValue) {
        return switch (kind()) {
            case INTEGER -> (Long) toPlain();
            case DECIMAL -> ((Double) toPlain()).longValue();
            case STRING -> parseLongOr(((StringValue) this).value(), defaultValue);
            case BOOLEAN, NULL, LIST, MAP -> defaultValue;
        };
    }

    default int asInt(int defaultValue) {
        long v = asLong(defaultValue);
        return v > Integer.MAX_VALUE || v < Integer.MIN_VALUE ? defaultValue : (int) v;
    }

    default double asDouble(double defaultValue) {
        return switch (kind()) {
            case INTEGER -> ((Long) toPlain()).doubleValue();
            case DECIMAL -> (Double) toPlain();
            case STRING -> parseDoubleOr(((StringValue) this).value(), defaultValue);
            case BOOLEAN, NULL, LIST, MAP -> defaultValue;
        };
    }

    default boolean asBoolean(boolean defaultValue) {
        return switch (kind()) {
            case BOOLEAN -> (Boolean) toPlain();
            case STRING -> {
                String s = ((StringValue) this).value().trim();
                if ("true".equalsIgnoreCase(s)) yield true;
                if ("false".equalsIgnoreCase(s)) yield false;
                yield defaultValue;
            }
            case INTEGER, DECIMAL, NULL, LIST, MAP -> defaultValue;
        };
    }

    /**
     * Items of a list as strings (scalars only); a single scalar becomes a one-element list.
     * Returns {@code defaultValue} for null and map nodes.
     */
    default List<String> asStringList(List<String> defaultValue) {
        return switch (kind()) {
            case LIST -> {
                List<String> out = new ArrayList<>();
                for (ConfigValue item : items()) {
                    String s = item.asString(null);
                    if (s != null) out.add(s);
                }
                yield List.copyOf(out);
            }
            case STRING, INTEGER, DECIMAL, BOOLEAN -> List.of(asString(""));
            case NULL, MAP -> defaultValue;
        };
    }

    private static long parseLongOr(String s, long defaultValue) {
        try {
            return Long.parseLong(s.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static double parseDoubleOr(String s, double defaultValue) {
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    static ConfigValue of(String value) {
        return value == null ? NULL : new StringValue(value);
    }

    static ConfigValue of(long value) {
        return new IntegerValue(value);
    }

    static ConfigValue of(double value) {
        return new DecimalValue(value);
    }

    static ConfigValue of(boolean value) {
        return new BooleanValue(value);
    }

    /**
     * Builds a tree from plain Java values as produced by Jackson ({@code readValue(json, Object.class)})
     * or by {@link ConfigParser}. Unknown object types are kept as their string form.
     */
    static ConfigValue fromPlain(Object value) {
        if (value == null) return NULL;
        if (value instanceof ConfigValue) return (ConfigValue) value;
        if (value instanceof String) return new StringValue((String) value);
        if (value instanceof Boolean) return new BooleanValue((Boolean) value);
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return new IntegerValue(((Number) value).longValue());
        }
        if (value instanceof BigInteger) {
            BigInteger big = (BigInteger) value;
            return big.bitLength() < 64 ? new IntegerValue(big.longValue()) : new DecimalValue(big.doubleValue());
        }
        if (value instanceof BigDecimal || value instanceof Double || value instanceof Float) {
            return new DecimalValue(((Number) value).doubleValue());
        }
        if (value instanceof Map) {
            Map<String, ConfigValue> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                out.put(String.valueOf(e.getKey()), fromPlain(e.getValue()));
            }
            return new MapValue(out);
        }
        if (value instanceof List) {
            List<ConfigValue> out = new ArrayList<>();
            for (Object o : (List<?>) value) {
                out.add(fromPlain(o));
            }
            return new ListValue(out);
        }
        return new StringValue(value.toString());
    }

    record StringValue(String value) implements ConfigValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    record IntegerValue(long value) implements ConfigValue {
        @Override
        public Kind kind() {
            return Kind.INTEGER;
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    record DecimalValue(double value) implements ConfigValue {
        @Override
        public Kind kind() {
            return Kind.DECIMAL;
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    record BooleanValue(boolean value) implements ConfigValue {
        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    record NullValue() implements ConfigValue {
        @Override
        public Kind kind() {
            return Kind.NULL;
        }

        @Override
        public Object toPlain() {
            return null;
        }
    }

    record ListValue(List<ConfigValue> values) implements ConfigValue {
        public ListValue {
            values = values != null ? Collections.unmodifiableList(new ArrayList<>(values)) : List.of();
        }

        @Override
        public Kind kind() {
            return Kind.LIST;
        }

        @Override
        public List<ConfigValue> items() {
            return values;
        }

        @Override
        public Object toPlain() {
            List<Object> out = new ArrayList<>(values.size());
            for (ConfigValue v : values) {
                out.add(v.toPlain());
            }
            return out;
        }
    }

    record MapValue(Map<String, ConfigValue> values) implements ConfigValue {
        public MapValue {
            values = values != null ? Collections.unmodifiableMap(new LinkedHashMap<>(values)) : Map.of();
        }

        @Override
        public Kind kind() {
            return Kind.MAP;
        }

        @Override
        public ConfigValue get(String key) {
            ConfigValue v = values.get(key);
            return v != null ? v : NULL;
        }

        @Override
        public boolean has(String key) {
            return values.containsKey(key);
        }

        @Override
        public Map<String, ConfigValue> entries() {
            return values;
        }

        @Override
        public Object toPlain() {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<String, ConfigValue> e : values.entrySet()) {
                out.put(e.getKey(), e.getValue().toPlain());
            }
            return out;
        }
    }
}
