package com.example.lence.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * A caller-supplied parameter value. Every shape a request can carry maps to exactly one variant;
 * {@link Unsupported} keeps shapes outside the encodable domain so interpolation can reject them by name.
 */
public sealed interface ParamValue
        permits ParamValue.Text, ParamValue.Number, ParamValue.Bool, ParamValue.Null,
        ParamValue.ListValue, ParamValue.Unsupported {

    record Text(String value) implements ParamValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }
    }

    record Number(BigDecimal value) implements ParamValue {
        public Number {
            Objects.requireNonNull(value, "value");
        }
    }

    record Bool(boolean value) implements ParamValue {
    }

    record Null() implements ParamValue {
    }

    record ListValue(List<ParamValue> elements) implements ParamValue {
        public ListValue {
            elements = List.copyOf(elements);
        }
    }

    /**
     * @param description what was supplied, e.g. {@code "object"} or {@code "non-finite number"}
     */
    record Unsupported(String description) implements ParamValue {
    }

    Null NULL = new Null();

    static ParamValue of(String value) {
        return value == null ? NULL : new Text(value);
    }

    static ParamValue of(long value) {
        return new Number(BigDecimal.valueOf(value));
    }

    static ParamValue of(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return new Unsupported("non-finite number " + value);
        }
        return new Number(BigDecimal.valueOf(value));
    }

    static ParamValue of(boolean value) {
        return new Bool(value);
    }

    static ParamValue list(ParamValue... elements) {
        return new ListValue(List.of(elements));
    }
}
