package io.github.cyfko.qsfilter.jpa.target;

/**
 * Resolves a field name from a filter into a column of the current query.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ColumnResolver {

    /**
     * @param name the field name from the request
     * @return the resolved column
     * @throws io.github.cyfko.qsfilter.core.exception.ColumnNotFoundException if no such column exists
     */
    Column resolveColumn(String name);
}
