package io.github.cyfko.qsfilter.core.exception;

/**
 * Thrown when a filter or order field does not name a column of the query target.
 *
 * @since 1.0.0
 */
public class ColumnNotFoundException extends FilterException {

    public ColumnNotFoundException(String field) {
        super(field, "column " + field + " not found");
    }
}
