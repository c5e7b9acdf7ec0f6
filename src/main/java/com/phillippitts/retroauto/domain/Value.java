package com.phillippitts.retroauto.domain;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable typed script value (int, float, string, bool, duration, or a tuple of values).
 */
public final class Value {

    public static final Value TRUE = new Value(ValueType.BOOL, Boolean.TRUE);
    public static final Value FALSE = new Value(ValueType.BOOL, Boolean.FALSE);

    private final ValueType type;
    private final Object raw;

    private Value(ValueType type, Object raw) {
        this.type = type;
        this.raw = raw;
    }

    public static Value ofInt(long v) {
        return new Value(ValueType.INT, v);
    }

    public static Value ofFloat(double v) {
        return new Value(ValueType.FLOAT, v);
    }

    public static Value ofString(String v) {
        return new Value(ValueType.STRING, Objects.requireNonNull(v, "string value"));
    }

    public static Value ofBool(boolean v) {
        return v ? TRUE : FALSE;
    }

    public static Value ofDuration(Duration v) {
        return new Value(ValueType.DURATION, Objects.requireNonNull(v, "duration value"));
    }

    public static Value ofList(List<Value> items) {
        return new Value(ValueType.LIST, List.copyOf(items));
    }

    public ValueType type() {
        return type;
    }

    public boolean isNumeric() {
        return type == ValueType.INT || type == ValueType.FLOAT;
    }

    public long asLong() {
        return switch (type) {
            case INT -> (Long) raw;
            case FLOAT -> (long) (double) (Double) raw;
            case DURATION -> ((Duration) raw).toMillis();
            default -> throw typeError("int");
        };
    }

    public double asDouble() {
        return switch (type) {
            case INT -> (double) (Long) raw;
            case FLOAT -> (Double) raw;
            default -> throw typeError("float");
        };
    }

    public boolean asBoolean() {
        if (type != ValueType.BOOL) {
            throw typeError("bool");
        }
        return (Boolean) raw;
    }

    public Duration asDuration() {
        return switch (type) {
            case DURATION -> (Duration) raw;
            // Bare integers are read as milliseconds
            case INT -> Duration.ofMillis((Long) raw);
            default -> throw typeError("duration");
        };
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        if (type != ValueType.LIST) {
            throw typeError("tuple");
        }
        return (List<Value>) raw;
    }

    /** String form used for text output and string concatenation. */
    public String asText() {
        return switch (type) {
            case STRING -> (String) raw;
            case DURATION -> ((Duration) raw).toMillis() + "ms";
            case LIST -> asList().stream().map(Value::asText).collect(Collectors.joining(", ", "(", ")"));
            default -> String.valueOf(raw);
        };
    }

    public boolean isTruthy() {
        return switch (type) {
            case BOOL -> (Boolean) raw;
            case INT -> (Long) raw != 0L;
            case FLOAT -> (Double) raw != 0.0;
            case STRING -> !((String) raw).isEmpty();
            case DURATION -> !((Duration) raw).isZero();
            case LIST -> !asList().isEmpty();
        };
    }

    private IllegalArgumentException typeError(String expected) {
        return new IllegalArgumentException("Expected " + expected + " but got " + type.name().toLowerCase() + " " + asText());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Value other)) {
            return false;
        }
        return type == other.type && raw.equals(other.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, raw);
    }

    @Override
    public String toString() {
        return type.name().toLowerCase() + ":" + asText();
    }
}
