package io.github.cyfko.qsfilter.core.exception;

/**
 * Thrown when a query key cannot be split into a field name and an operator,
 * or when a reserved parameter such as {@code _limit} carries an unusable value.
 *
 * <pre>{@code
 * ParameterParser.splitOperator("__eq");
 * // -> InvalidParameterException: No valid parameter provided in key '__eq'
 * }</pre>
 *
 * @since 1.0.0
 */
public class InvalidParameterException extends FilterException {

    public InvalidParameterException(String field, String message) {
        super(field, message);
    }

    public InvalidParameterException(String field, String message, Throwable cause) {
        super(field, message, cause);
    }
}
