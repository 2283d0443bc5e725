package io.github.cyfko.qsfilter.core.exception;

/**
 * Base class of every error raised while turning query-string parameters into a query.
 * <p>
 * All subclasses describe a malformed request rather than a transient failure: they are
 * raised eagerly while the query is being built, before anything is executed, and the
 * surrounding HTTP layer is expected to translate them into a client error response.
 * </p>
 *
 * <p><strong>Error taxonomy:</strong></p>
 * <ul>
 *   <li>{@link InvalidParameterException} - a query key or reserved parameter cannot be parsed</li>
 *   <li>{@link ColumnNotFoundException} - a filter or order field does not exist on the target</li>
 *   <li>{@link UnsupportedOperatorException} - the operator is unknown or not legal for the field type</li>
 *   <li>{@link ConversionException} - a raw value cannot be converted to the field type</li>
 *   <li>{@link NotMappedException} - {@code with} was used on an attribute that is not a relationship</li>
 *   <li>{@link MalformedSubqueryException} - a relationship sub-expression lacks its {@code =} separator</li>
 * </ul>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * try {
 *     applier.apply(target, FilterBuilder.buildFilters(query));
 * } catch (FilterException e) {
 *     return badRequest(e.getClass().getSimpleName(), e.getField(), e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterException extends RuntimeException {

    private final String field;

    /**
     * Constructs a new exception for the given field.
     *
     * @param field   the offending field name, or {@code null} when unknown
     * @param message the detail message
     */
    public FilterException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * Constructs a new exception for the given field with an underlying cause.
     *
     * @param field   the offending field name, or {@code null} when unknown
     * @param message the detail message
     * @param cause   the cause of this exception
     */
    public FilterException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /**
     * Returns the name of the field the failure relates to.
     *
     * @return the field name, or {@code null} if the failure is not tied to a field
     */
    public String getField() {
        return field;
    }
}
