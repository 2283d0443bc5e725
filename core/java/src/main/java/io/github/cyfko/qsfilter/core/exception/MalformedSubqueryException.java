package io.github.cyfko.qsfilter.core.exception;

/**
 * Thrown when the value of a {@code with} filter is not of the form
 * {@code related_field__related_op=value}.
 *
 * @since 1.0.0
 */
public class MalformedSubqueryException extends FilterException {

    public MalformedSubqueryException(String field, String message) {
        super(field, message);
    }
}
