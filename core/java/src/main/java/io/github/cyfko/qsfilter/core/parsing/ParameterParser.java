package io.github.cyfko.qsfilter.core.parsing;

import io.github.cyfko.qsfilter.core.api.FilterDescriptor;
import io.github.cyfko.qsfilter.core.api.Op;
import io.github.cyfko.qsfilter.core.exception.InvalidParameterException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Splits raw query keys into field names and operator symbols.
 *
 * <h2>Grammar</h2>
 * <pre>
 *   key      := field | field "__" operator | field "__with__" subfield "__" suboperator
 * </pre>
 * <ul>
 *   <li>The split happens on the <em>last</em> {@code __}, so field names may themselves contain
 *       double underscores: {@code field_with__underscore__eq} is field
 *       {@code field_with__underscore}, operator {@code eq}.</li>
 *   <li>A key without delimiter is an equality filter.</li>
 *   <li>An operator is lowercased only when it is exactly two characters long ({@code EQ},
 *       {@code GT}, {@code IN}). Longer tokens keep their case, which leaves relationship
 *       sub-expressions untouched.</li>
 *   <li>A key made of exactly four {@code __}-separated segments is a relationship filter. Its
 *       third and fourth segments are moved into the value, giving
 *       {@code {name: seg1, op: seg2, value: "seg3__seg4=" + value}}.</li>
 * </ul>
 *
 * <h2>Examples</h2>
 * <pre>{@code
 * ParameterParser.splitOperator("age");          // (age, eq)
 * ParameterParser.splitOperator("age__GT");      // (age, gt)
 * ParameterParser.splitOperator("name__LIKE");   // (name, LIKE) - rejected later as unknown
 * ParameterParser.parse("pets__with__name__eq", "Hooch");
 * // FilterDescriptor[name=pets, op=with, value=name__eq=Hooch]
 * }</pre>
 *
 * <p>All methods are stateless and thread-safe.</p>
 *
 * @since 1.0.0
 */
public final class ParameterParser {

    /** Separator between a field name and its operator. */
    public static final String DELIMITER = "__";

    /** Operator assumed when a key carries none. */
    public static final String DEFAULT_OPERATOR = Op.EQ.getSymbol();

    /** Separator between the operator-qualified field and the value of a relationship sub-expression. */
    public static final char SUBQUERY_SEPARATOR = '=';

    private static final int RELATIONSHIP_SEGMENTS = 4;

    private ParameterParser() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * A query key split into its field name and operator symbol.
     *
     * @param name     the field name
     * @param operator the operator symbol
     */
    public record ParsedKey(String name, String operator) {}

    /**
     * Splits a key on the last delimiter.
     *
     * @param key the raw query key
     * @return the field name and the operator symbol
     * @throws InvalidParameterException if the field name is empty
     */
    public static ParsedKey splitOperator(String key) {
        int idx = key.lastIndexOf(DELIMITER);

        String name;
        String operator;
        if (idx < 0) {
            name = key;
            operator = DEFAULT_OPERATOR;
        } else {
            name = key.substring(0, idx);
            operator = key.substring(idx + DELIMITER.length());
            if (operator.length() == 2) {
                operator = operator.toLowerCase(Locale.ROOT);
            }
        }

        if (name.isEmpty()) {
            throw new InvalidParameterException(key, "No valid parameter provided in key '" + key + "'");
        }
        return new ParsedKey(name, operator);
    }

    /**
     * Splits a key on every delimiter, scanning from the right.
     * <p>
     * Overlapping underscores are resolved in favour of the rightmost delimiter:
     * {@code "a___b"} gives {@code ["a_", "b"]}.
     * </p>
     *
     * @param key the raw query key
     * @return the segments in their original left-to-right order
     */
    public static List<String> segments(String key) {
        List<String> parts = new ArrayList<>();
        int end = key.length();
        int idx;
        while ((idx = key.lastIndexOf(DELIMITER, end - DELIMITER.length())) >= 0) {
            parts.add(key.substring(idx + DELIMITER.length(), end));
            end = idx;
        }
        parts.add(key.substring(0, end));
        Collections.reverse(parts);
        return parts;
    }

    /**
     * Parses one query parameter into a filter descriptor, repacking relationship keys.
     *
     * @param key   the raw query key
     * @param value the raw value, may be {@code null}
     * @return the filter descriptor
     * @throws InvalidParameterException if the field name is empty
     */
    public static FilterDescriptor parse(String key, String value) {
        List<String> segments = segments(key);
        if (segments.size() == RELATIONSHIP_SEGMENTS) {
            ParsedKey outer = splitOperator(segments.get(0) + DELIMITER + segments.get(1));
            String embedded = segments.get(2) + DELIMITER + segments.get(3)
                    + SUBQUERY_SEPARATOR + (value == null ? "" : value);
            return new FilterDescriptor(outer.name(), outer.operator(), embedded);
        }

        ParsedKey parsed = splitOperator(key);
        return new FilterDescriptor(parsed.name(), parsed.operator(), value);
    }
}
