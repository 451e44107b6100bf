package io.tabula.kernel;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A single cell of a series: a number, a piece of text, an absent value, or any other object.
 * <p>
 * Equality is structural for every variant. Numbers are held as {@code double}, so
 * {@code Value.of(1)} and {@code Value.of(1.0d)} are equal, as are {@code 0} and {@code -0.0}.
 */
public sealed interface Value permits Value.Numeric, Value.Text, Value.Null, Value.Other {

    Null NULL = new Null();

    /**
     * Wraps a plain Java object. Every {@link Number} is converted with {@code doubleValue()},
     * so {@code long} and {@code BigDecimal} inputs beyond 2<sup>53</sup> lose precision and
     * distinct inputs may become one value.
     */
    static Value of(Object raw) {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof Value value) {
            return value;
        }
        if (raw instanceof Number number) {
            return new Numeric(number.doubleValue());
        }
        if (raw instanceof CharSequence || raw instanceof Character) {
            return new Text(raw.toString());
        }
        return new Other(raw);
    }

    static Value number(double number) {
        return new Numeric(number);
    }

    ValueType type();

    /**
     * @return the plain Java object behind this value ({@code Double}, {@code String},
     * {@code null} or the wrapped object)
     */
    Object unwrap();

    default boolean isNumeric() {
        return false;
    }

    default boolean isNull() {
        return false;
    }

    default double asDouble() {
        throw new IllegalStateException("Not a number: " + this);
    }

    record Numeric(double value) implements Value {
        public Numeric {
            // -0.0 is stored as 0.0
            value = value == 0 ? 0.0 : value;
        }

        @Override
        public ValueType type() {
            return ValueType.NUMBER;
        }

        @Override
        public Object unwrap() {
            return value;
        }

        @Override
        public boolean isNumeric() {
            return true;
        }

        @Override
        public double asDouble() {
            return value;
        }

        @Override
        public String toString() {
            if (Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15) {
                return BigDecimal.valueOf(value).toBigInteger().toString();
            }
            return Double.toString(value);
        }
    }

    record Text(String value) implements Value {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ValueType type() {
            return ValueType.TEXT;
        }

        @Override
        public Object unwrap() {
            return value;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    record Null() implements Value {

        @Override
        public ValueType type() {
            return ValueType.NULL;
        }

        @Override
        public Object unwrap() {
            return null;
        }

        @Override
        public boolean isNull() {
            return true;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    record Other(Object value) implements Value {
        public Other {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ValueType type() {
            return ValueType.OTHER;
        }

        @Override
        public Object unwrap() {
            return value;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }
}
