package io.github.cyfko.qsfilter.core.api;

/**
 * Shape of the operand an operator expects.
 *
 * @since 1.0.0
 */
public enum Arity {

    /** No operand; any supplied value is ignored. */
    UNARY,

    /** A single value converted to the column type. */
    BINARY,

    /** A comma-separated list, each element converted to the column type. */
    LIST,

    /** A {@code related_field__related_op=value} sub-expression evaluated on a related entity. */
    RELATIONSHIP;

    /**
     * @return {@code true} if the operator needs a value in the request
     */
    public boolean requiresValue() {
        return this != UNARY;
    }
}
