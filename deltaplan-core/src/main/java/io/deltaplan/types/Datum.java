/*
 * Datum.java
 *
 * This source file is part of the deltaplan open source project
 *
 * Copyright 2021-2024 the deltaplan project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.deltaplan.types;

import io.deltaplan.annotation.API;
import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * A typed scalar value. Integer types hold a {@link Long}, floating point types a {@link Double}, {@code numeric}
 * a {@link BigDecimal}, {@code date} a {@link LocalDate} and {@code timestamp} a {@link LocalDateTime}.
 * A datum whose value is {@code null} is the SQL null of its type.
 *
 * <p>
 * Datums of the same type are ordered with SQL semantics; {@code null} orders after every non-null value.
 * </p>
 */
@API(API.Status.STABLE)
public final class Datum implements Comparable<Datum> {
    @SuppressWarnings({"unchecked", "rawtypes"})
    private static final Comparator<Object> VALUE_COMPARATOR =
            Comparator.nullsLast((left, right) -> ((Comparable)left).compareTo(right));

    @Nonnull
    private final ScalarType type;
    @Nullable
    private final Object value;

    private Datum(@Nonnull ScalarType type, @Nullable Object value) {
        this.type = type;
        this.value = value;
    }

    @Nonnull
    public static Datum bool(boolean value) {
        return new Datum(ScalarType.BOOL, value);
    }

    @Nonnull
    public static Datum int32(int value) {
        return new Datum(ScalarType.INT32, (long)value);
    }

    @Nonnull
    public static Datum int64(long value) {
        return new Datum(ScalarType.INT64, value);
    }

    @Nonnull
    public static Datum float64(double value) {
        return new Datum(ScalarType.FLOAT64, value);
    }

    @Nonnull
    public static Datum string(@Nonnull String value) {
        return new Datum(ScalarType.STRING, value);
    }

    @Nonnull
    public static Datum nullOf(@Nonnull ScalarType type) {
        return new Datum(type, null);
    }

    /**
     * Create a datum of the given type holding a value of the matching Java class.
     * @param type the scalar type
     * @param value the value, or {@code null} for SQL null
     * @return the datum
     * @throws IllegalArgumentException if the value's class does not match the type
     */
    @Nonnull
    public static Datum of(@Nonnull ScalarType type, @Nullable Object value) {
        Preconditions.checkArgument(value == null || javaClassOf(type).isInstance(value),
                "value %s does not match type %s", value, type);
        if (value != null && type.isInteger()) {
            Preconditions.checkArgument(fitsInteger(type, (Long)value), "value %s out of range for %s", value, type);
        }
        return new Datum(type, value);
    }

    /**
     * The scalar type an untyped literal value takes when nothing else determines it: integers are
     * {@code int64}, decimals {@code float64}, text {@code string} and truth values {@code bool}.
     * @param rawValue a {@link Long}, {@link BigDecimal}, {@link String} or {@link Boolean}
     * @return the default type, or empty for {@code null} and other classes
     */
    @Nonnull
    public static Optional<ScalarType> defaultTypeOf(@Nullable Object rawValue) {
        if (rawValue instanceof Long) {
            return Optional.of(ScalarType.INT64);
        } else if (rawValue instanceof BigDecimal) {
            return Optional.of(ScalarType.FLOAT64);
        } else if (rawValue instanceof String) {
            return Optional.of(ScalarType.STRING);
        } else if (rawValue instanceof Boolean) {
            return Optional.of(ScalarType.BOOL);
        }
        return Optional.empty();
    }

    /**
     * Convert an untyped literal value to a datum of the given type. Integers convert to any numeric type that holds
     * them exactly. Decimals convert to {@code numeric}, and to a floating point type if they are within its range,
     * rounding to the nearest value. Text converts to {@code string}, and to {@code date} and {@code timestamp} if it
     * parses. Truth values convert to {@code bool}. There is no conversion between other pairs.
     * @param type the target type
     * @param rawValue a {@link Long}, {@link BigDecimal}, {@link String}, {@link Boolean} or {@code null}
     * @return the datum, or empty if the value cannot be represented in the type
     */
    @Nonnull
    public static Optional<Datum> coerce(@Nonnull ScalarType type, @Nullable Object rawValue) {
        if (rawValue == null) {
            return Optional.of(nullOf(type));
        }
        switch (type) {
            case BOOL:
                return rawValue instanceof Boolean ? Optional.of(new Datum(type, rawValue)) : Optional.empty();
            case INT16:
            case INT32:
            case INT64:
                if (rawValue instanceof Long && fitsInteger(type, (Long)rawValue)) {
                    return Optional.of(new Datum(type, rawValue));
                }
                return Optional.empty();
            case FLOAT32:
            case FLOAT64:
                if (rawValue instanceof Long) {
                    return toFloatingPoint(type, BigDecimal.valueOf((Long)rawValue), true).map(value -> new Datum(type, value));
                } else if (rawValue instanceof BigDecimal) {
                    return toFloatingPoint(type, (BigDecimal)rawValue, false).map(value -> new Datum(type, value));
                }
                return Optional.empty();
            case NUMERIC:
                if (rawValue instanceof Long) {
                    return Optional.of(new Datum(type, BigDecimal.valueOf((Long)rawValue)));
                } else if (rawValue instanceof BigDecimal) {
                    return Optional.of(new Datum(type, rawValue));
                }
                return Optional.empty();
            case STRING:
                return rawValue instanceof String ? Optional.of(new Datum(type, rawValue)) : Optional.empty();
            case DATE:
                return parseTemporal(rawValue, text -> LocalDate.parse(text)).map(date -> new Datum(type, date));
            case TIMESTAMP:
                return parseTemporal(rawValue, text -> LocalDateTime.parse(text.replace(' ', 'T'))).map(ts -> new Datum(type, ts));
            default:
                throw new IllegalStateException("unknown scalar type " + type);
        }
    }

    @Nonnull
    private static <T> Optional<T> parseTemporal(@Nonnull Object rawValue, @Nonnull Function<String, T> parser) {
        if (!(rawValue instanceof String)) {
            return Optional.empty();
        }
        try {
            return Optional.of(parser.apply((String)rawValue));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Convert an exact value to a floating point type. The result has to be finite in the target type, and, if
     * {@code exact} is set, equal to the value it was converted from.
     */
    @Nonnull
    private static Optional<Double> toFloatingPoint(@Nonnull ScalarType type, @Nonnull BigDecimal value, boolean exact) {
        final double converted = type == ScalarType.FLOAT32 ? value.floatValue() : value.doubleValue();
        if (Double.isInfinite(converted)) {
            return Optional.empty();
        }
        if (exact && new BigDecimal(converted).compareTo(value) != 0) {
            return Optional.empty();
        }
        return Optional.of(value.doubleValue());
    }

    private static boolean fitsInteger(@Nonnull ScalarType type, long value) {
        switch (type) {
            case INT16:
                return value >= Short.MIN_VALUE && value <= Short.MAX_VALUE;
            case INT32:
                return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
            default:
                return true;
        }
    }

    @Nonnull
    private static Class<?> javaClassOf(@Nonnull ScalarType type) {
        switch (type) {
            case BOOL:
                return Boolean.class;
            case INT16:
            case INT32:
            case INT64:
                return Long.class;
            case FLOAT32:
            case FLOAT64:
                return Double.class;
            case NUMERIC:
                return BigDecimal.class;
            case STRING:
                return String.class;
            case DATE:
                return LocalDate.class;
            case TIMESTAMP:
                return LocalDateTime.class;
            default:
                throw new IllegalStateException("unknown scalar type " + type);
        }
    }

    @Nonnull
    public ScalarType getType() {
        return type;
    }

    @Nullable
    public Object getValue() {
        return value;
    }

    public boolean isNull() {
        return value == null;
    }

    public boolean isTrue() {
        return Boolean.TRUE.equals(value);
    }

    public long getLong() {
        Preconditions.checkState(value instanceof Long, "datum %s is not an integer", this);
        return (Long)value;
    }

    public double getDouble() {
        Preconditions.checkState(value instanceof Double, "datum %s is not floating point", this);
        return (Double)value;
    }

    @Nonnull
    public BigDecimal getNumeric() {
        Preconditions.checkState(value instanceof BigDecimal, "datum %s is not numeric", this);
        return (BigDecimal)value;
    }

    @Override
    public int compareTo(@Nonnull Datum other) {
        Preconditions.checkArgument(type == other.type, "cannot compare %s with %s", type, other.type);
        return VALUE_COMPARATOR.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Datum)) {
            return false;
        }
        Datum datum = (Datum)o;
        return type == datum.type && Objects.equals(value, datum.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    /**
     * Render the datum the way it appears in explain output.
     * @return the rendered value
     */
    @Override
    public String toString() {
        if (value == null) {
            return "null";
        }
        switch (type) {
            case STRING:
            case DATE:
            case TIMESTAMP:
                return quote(value.toString());
            case NUMERIC:
                return ((BigDecimal)value).toPlainString();
            case FLOAT32:
            case FLOAT64:
                // finite values render without an exponent, like numeric
                return Double.isFinite((Double)value) ? BigDecimal.valueOf((Double)value).toPlainString() : value.toString();
            default:
                return value.toString();
        }
    }

    @Nonnull
    private static String quote(@Nonnull String text) {
        final StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append('"').toString();
    }
}
