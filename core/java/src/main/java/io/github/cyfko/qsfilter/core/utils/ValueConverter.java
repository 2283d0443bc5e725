package io.github.cyfko.qsfilter.core.utils;

import io.github.cyfko.qsfilter.core.api.FieldCategory;
import io.github.cyfko.qsfilter.core.config.FilterConfig;
import io.github.cyfko.qsfilter.core.exception.ConversionException;

import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Converts raw query-string values into the native type of the targeted column.
 * <p>
 * The target is given as the column's Java type; its {@link FieldCategory} decides how the
 * text is read:
 * </p>
 * <ul>
 *   <li><strong>INTEGER</strong> - parsed as an integral number of the exact target type,
 *       surrounding whitespace ignored</li>
 *   <li><strong>TEXT</strong> - passed through unchanged</li>
 *   <li><strong>TIMESTAMP</strong> - parsed with {@link TemporalParser} and adapted to the target
 *       type; values without offset are read in the configured zone</li>
 *   <li><strong>BOOLEAN</strong> and unclassified types - not convertible, the operators that apply
 *       to them take no value</li>
 * </ul>
 *
 * <pre>{@code
 * ValueConverter.convert(Long.class, "55");                      // 55L
 * ValueConverter.convert(LocalDateTime.class, "2016-01-01");     // 2016-01-01T00:00
 * ValueConverter.convertList(Integer.class, "1, 3");             // [1, 3]
 * ValueConverter.convertList(Integer.class, "1,,3");             // ConversionException
 * }</pre>
 *
 * @since 1.0.0
 */
public final class ValueConverter {

    private ValueConverter() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Converts a value with the default configuration, without field attribution.
     *
     * @see #convert(String, Class, String, FilterConfig)
     */
    public static Object convert(Class<?> targetType, String raw) {
        return convert(null, targetType, raw, FilterConfig.defaults());
    }

    /**
     * Converts a single value.
     *
     * @param field      the field being filtered, reported in errors
     * @param targetType the Java type of the column
     * @param raw        the raw value
     * @param config     the filter configuration
     * @return the converted value
     * @throws ConversionException if the value cannot be read as the target type
     */
    public static Object convert(String field, Class<?> targetType, String raw, FilterConfig config) {
        if (raw == null) {
            throw new ConversionException(field, "A value is required for field " + field);
        }
        FieldCategory category = TypeClassifier.classify(targetType)
                .orElseThrow(() -> new ConversionException(field,
                        String.format("Cannot convert '%s': type %s of field %s is not supported",
                                raw, targetType == null ? null : targetType.getName(), field)));

        return switch (category) {
            case INTEGER -> toInteger(field, TypeClassifier.unwrap(targetType), raw);
            case TEXT -> raw;
            case TIMESTAMP -> toTemporal(field, targetType, raw, config.getZoneId());
            case BOOLEAN -> throw new ConversionException(field,
                    "Boolean field " + field + " only accepts is_true, is_false, is_null and is_not_null");
        };
    }

    /**
     * Converts a list value with the default configuration, without field attribution.
     *
     * @see #convertList(String, Class, String, FilterConfig)
     */
    public static List<Object> convertList(Class<?> targetType, String raw) {
        return convertList(null, targetType, raw, FilterConfig.defaults());
    }

    /**
     * Splits a comma-separated value and converts every element.
     * <p>
     * Elements are trimmed but empty elements are kept, so they fail for numeric and temporal
     * columns and become empty strings for text columns.
     * </p>
     *
     * @param field      the field being filtered, reported in errors
     * @param targetType the Java type of the column
     * @param raw        the comma-separated raw value
     * @param config     the filter configuration
     * @return the converted elements, in order
     * @throws ConversionException if any element cannot be converted
     */
    public static List<Object> convertList(String field, Class<?> targetType, String raw, FilterConfig config) {
        if (raw == null) {
            throw new ConversionException(field, "A list value is required for field " + field);
        }
        String[] items = raw.split(",", -1);
        List<Object> values = new ArrayList<>(items.length);
        for (String item : items) {
            values.add(convert(field, targetType, item.trim(), config));
        }
        return values;
    }

    // ========================================
    // INTERNAL: Integral numbers
    // ========================================

    private static Object toInteger(String field, Class<?> type, String raw) {
        String str = raw.trim();
        try {
            if (type == Integer.class) return Integer.valueOf(str);
            if (type == Long.class) return Long.valueOf(str);
            if (type == Short.class) return Short.valueOf(str);
            if (type == Byte.class) return Byte.valueOf(str);
            if (type == BigInteger.class) return new BigInteger(str);
        } catch (NumberFormatException e) {
            throw new ConversionException(field,
                    String.format("Cannot convert '%s' to %s for field %s", raw, type.getSimpleName(), field), e);
        }
        throw new ConversionException(field, "Unsupported integer type: " + type.getName());
    }

    // ========================================
    // INTERNAL: Dates and timestamps
    // ========================================

    private static Object toTemporal(String field, Class<?> type, String raw, ZoneId zone) {
        Temporal parsed;
        try {
            parsed = TemporalParser.parse(raw);
        } catch (DateTimeParseException e) {
            throw new ConversionException(field,
                    String.format("Cannot convert '%s' to a date/time for field %s", raw, field), e);
        }

        ZonedDateTime zoned = parsed instanceof ZonedDateTime z
                ? z
                : ((LocalDateTime) parsed).atZone(zone);

        if (type == LocalDateTime.class) return zoned.withZoneSameInstant(zone).toLocalDateTime();
        if (type == LocalDate.class) return zoned.withZoneSameInstant(zone).toLocalDate();
        if (type == OffsetDateTime.class) return zoned.toOffsetDateTime();
        if (type == ZonedDateTime.class) return zoned;
        if (type == Instant.class) return zoned.toInstant();
        if (type == java.sql.Timestamp.class) return java.sql.Timestamp.from(zoned.toInstant());
        if (type == java.sql.Date.class) return java.sql.Date.valueOf(zoned.withZoneSameInstant(zone).toLocalDate());
        if (Date.class.isAssignableFrom(type)) return Date.from(zoned.toInstant());

        throw new ConversionException(field, "Unsupported temporal type: " + type.getName());
    }
}
