package io.github.cyfko.qsfilter.core.parsing;

import io.github.cyfko.qsfilter.core.exception.MalformedSubqueryException;

/**
 * The filter embedded in the value of a {@code with} descriptor.
 * <p>
 * {@link ParameterParser#parse(String, String)} packs {@code pets__with__name__eq=Hooch} into
 * the value {@code name__eq=Hooch}. This record unpacks it: everything before the first
 * {@code =} is an operator-qualified field parsed with the same rules as a top-level key,
 * everything after it is the raw value.
 * </p>
 *
 * @param field    the field of the related entity
 * @param operator the operator symbol
 * @param value    the raw value, possibly empty
 * @since 1.0.0
 */
public record SubExpression(String field, String operator, String value) {

    /**
     * Parses a relationship sub-expression.
     *
     * @param relationship the relationship attribute carrying the expression, used in error reports
     * @param raw          the descriptor value
     * @return the embedded filter
     * @throws MalformedSubqueryException if {@code raw} is {@code null} or has no {@code =}
     * @throws io.github.cyfko.qsfilter.core.exception.InvalidParameterException if the embedded field name is empty
     */
    public static SubExpression parse(String relationship, String raw) {
        int idx = raw == null ? -1 : raw.indexOf(ParameterParser.SUBQUERY_SEPARATOR);
        if (idx < 0) {
            throw new MalformedSubqueryException(relationship, String.format(
                    "Sub-expression '%s' on relationship %s must have the form field__operator=value",
                    raw, relationship));
        }

        ParameterParser.ParsedKey key = ParameterParser.splitOperator(raw.substring(0, idx));
        return new SubExpression(key.name(), key.operator(), raw.substring(idx + 1));
    }
}
