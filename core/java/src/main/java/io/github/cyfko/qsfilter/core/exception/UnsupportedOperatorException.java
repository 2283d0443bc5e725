package io.github.cyfko.qsfilter.core.exception;

/**
 * Thrown when an operator is unknown, or is not legal for the type category of the
 * field it is applied to (for instance {@code like} on an integer column).
 *
 * @since 1.0.0
 */
public class UnsupportedOperatorException extends FilterException {

    private final String operator;

    public UnsupportedOperatorException(String field, String operator, String message) {
        super(field, message);
        this.operator = operator;
    }

    /**
     * @return the operator symbol as it appeared in the request
     */
    public String getOperator() {
        return operator;
    }
}
