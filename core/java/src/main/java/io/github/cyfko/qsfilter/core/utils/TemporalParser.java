package io.github.cyfko.qsfilter.core.utils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.Temporal;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;

/**
 * Lenient date/time parser for query-string values.
 * <p>
 * Accepts the ISO-8601 family and a handful of human-readable forms. The result is a
 * {@link ZonedDateTime} when the text carries an offset or zone, a {@link LocalDateTime}
 * otherwise; date-only inputs resolve to midnight.
 * </p>
 *
 * <p><strong>Accepted forms</strong> (time part optional unless stated):</p>
 * <ul>
 *   <li>{@code 2016-01-01}, {@code 2016-01-01T01:00:00}, {@code 2016-01-01 01:00},
 *       {@code 2016-06-14T06:46:02.296028+00:00}, {@code 2016-01-01T01:00Z[Europe/Berlin]}</li>
 *   <li>{@code 2016/01/01 01:00:00}</li>
 *   <li>{@code 01.01.2016 01:00}</li>
 *   <li>{@code Fri, 1 Jan 2016 01:00:00 GMT} (RFC 1123, time required)</li>
 *   <li>{@code 1 Jan 2016}, {@code 1 January 2016 01:00}</li>
 *   <li>{@code Jan 1, 2016}, {@code January 1, 2016 01:00:00}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class TemporalParser {

    private static final DateTimeFormatter OPTIONAL_TIME = new DateTimeFormatterBuilder()
            .optionalStart()
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().optionalStart().appendLiteral(' ').optionalEnd().appendOffsetId().optionalEnd()
            .optionalStart().appendLiteral('[').parseCaseSensitive().appendZoneRegionId().appendLiteral(']').optionalEnd()
            .optionalEnd()
            .toFormatter(Locale.ENGLISH);

    private static final List<DateTimeFormatter> FORMATTERS = List.of(
            withOptionalTime(DateTimeFormatter.ISO_LOCAL_DATE),
            withOptionalTime(DateTimeFormatter.ofPattern("uuuu/MM/dd", Locale.ENGLISH)),
            withOptionalTime(DateTimeFormatter.ofPattern("dd.MM.uuuu", Locale.ENGLISH)),
            DateTimeFormatter.RFC_1123_DATE_TIME,
            withOptionalTime(DateTimeFormatter.ofPattern("d [MMMM][MMM] uuuu", Locale.ENGLISH)),
            withOptionalTime(DateTimeFormatter.ofPattern("[MMMM][MMM] d, uuuu", Locale.ENGLISH))
    );

    private TemporalParser() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Parses a date or date-time.
     *
     * @param text the raw value
     * @return a {@link ZonedDateTime} or a {@link LocalDateTime}
     * @throws DateTimeParseException if no supported form matches
     */
    public static Temporal parse(String text) {
        String trimmed = text.trim();
        DateTimeParseException first = null;

        for (DateTimeFormatter formatter : FORMATTERS) {
            try {
                TemporalAccessor parsed = formatter.parseBest(trimmed,
                        ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
                if (parsed instanceof LocalDate date) {
                    return date.atStartOfDay();
                }
                return (Temporal) parsed;
            } catch (DateTimeParseException e) {
                if (first == null) {
                    first = e;
                }
            }
        }

        throw new DateTimeParseException("Unrecognized date/time: '" + text + "'", text, 0, first);
    }

    private static DateTimeFormatter withOptionalTime(DateTimeFormatter date) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .append(date)
                .append(OPTIONAL_TIME)
                .toFormatter(Locale.ENGLISH);
    }
}
