package io.github.cyfko.qsfilter.core.utils;

import io.github.cyfko.qsfilter.core.api.FieldCategory;

import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the Java type of a column to the {@link FieldCategory} that decides which operators apply.
 * <p>
 * Primitive types are unwrapped to their boxed counterpart before classification, and
 * subclasses classify like the type they extend, so {@code int}, {@code Integer} and
 * {@code java.sql.Timestamp} all resolve as expected. Types outside the table below are
 * unclassified and only accept {@code is_null} and {@code is_not_null}.
 * </p>
 *
 * <table>
 *   <caption>Classification</caption>
 *   <tr><th>Category</th><th>Java types</th></tr>
 *   <tr><td>INTEGER</td><td>Integer, Long, Short, Byte, BigInteger</td></tr>
 *   <tr><td>BOOLEAN</td><td>Boolean</td></tr>
 *   <tr><td>TEXT</td><td>String</td></tr>
 *   <tr><td>TIMESTAMP</td><td>LocalDateTime, LocalDate, OffsetDateTime, ZonedDateTime, Instant, java.util.Date</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class TypeClassifier {

    private static final Map<Class<?>, Class<?>> PRIMITIVE_WRAPPERS = Map.of(
            int.class, Integer.class,
            long.class, Long.class,
            short.class, Short.class,
            byte.class, Byte.class,
            boolean.class, Boolean.class,
            double.class, Double.class,
            float.class, Float.class,
            char.class, Character.class
    );

    private static final List<Class<?>> INTEGER_TYPES = List.of(
            Integer.class, Long.class, Short.class, Byte.class, BigInteger.class);

    private static final List<Class<?>> TIMESTAMP_TYPES = List.of(
            LocalDateTime.class, LocalDate.class, OffsetDateTime.class, ZonedDateTime.class,
            Instant.class, Date.class);

    private TypeClassifier() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Classifies a column type.
     *
     * @param type the Java type of the column, may be {@code null}
     * @return the category, or empty if the type is not classified
     */
    public static Optional<FieldCategory> classify(Class<?> type) {
        if (type == null) {
            return Optional.empty();
        }
        Class<?> effective = unwrap(type);

        if (isAnyOf(effective, INTEGER_TYPES)) return Optional.of(FieldCategory.INTEGER);
        if (effective == Boolean.class) return Optional.of(FieldCategory.BOOLEAN);
        if (effective == String.class) return Optional.of(FieldCategory.TEXT);
        if (isAnyOf(effective, TIMESTAMP_TYPES)) return Optional.of(FieldCategory.TIMESTAMP);

        return Optional.empty();
    }

    /**
     * Returns the boxed type for a primitive, or the type itself otherwise.
     *
     * @param type a Java type
     * @return the wrapper class for primitives, {@code type} for everything else
     */
    public static Class<?> unwrap(Class<?> type) {
        return type.isPrimitive() ? PRIMITIVE_WRAPPERS.getOrDefault(type, type) : type;
    }

    private static boolean isAnyOf(Class<?> type, List<Class<?>> candidates) {
        for (Class<?> candidate : candidates) {
            if (candidate.isAssignableFrom(type)) {
                return true;
            }
        }
        return false;
    }
}
