package io.github.cyfko.qsfilter.core.model;

import io.github.cyfko.qsfilter.core.exception.InvalidParameterException;

/**
 * Limit, offset and ordering requested for one query.
 * <p>
 * Every component is optional. The limit is never trusted as-is: {@link #effectiveLimit(int)}
 * clamps it to the configured ceiling and substitutes the ceiling when it is absent. An offset
 * is only meaningful when positive; zero and absent offsets are both left out of the query.
 * </p>
 *
 * <pre>{@code
 * Pagination.none();                              // limit = ceiling, no offset, store order
 * Pagination.of(20, 40, "created_at", false);     // 20 rows after 40, newest first
 * }</pre>
 *
 * @param limit     requested row count, or {@code null}
 * @param offset    rows to skip, or {@code null}
 * @param orderBy   column to order by, or {@code null} for store order
 * @param ascending sort direction, ignored without {@code orderBy}
 * @since 1.0.0
 */
public record Pagination(Integer limit, Integer offset, String orderBy, boolean ascending) {

    private static final Pagination NONE = new Pagination(null, null, null, true);

    public Pagination {
        if (limit != null && limit < 0) {
            throw new InvalidParameterException(RequestParameters.LIMIT, "Limit cannot be negative. Provided: " + limit);
        }
        if (offset != null && offset < 0) {
            throw new InvalidParameterException(RequestParameters.OFFSET, "Offset cannot be negative. Provided: " + offset);
        }
        if (orderBy != null && orderBy.isBlank()) {
            orderBy = null;
        }
    }

    public static Pagination none() {
        return NONE;
    }

    public static Pagination of(Integer limit, Integer offset, String orderBy, boolean ascending) {
        return new Pagination(limit, offset, orderBy, ascending);
    }

    /**
     * Returns the limit to put on the query.
     *
     * @param ceiling the maximum number of rows allowed
     * @return {@code ceiling} when no limit was requested, {@code min(limit, ceiling)} otherwise
     */
    public int effectiveLimit(int ceiling) {
        return limit == null ? ceiling : Math.min(limit, ceiling);
    }

    /**
     * @return {@code true} when an offset was requested and is greater than zero
     */
    public boolean hasOffset() {
        return offset != null && offset > 0;
    }

    public boolean hasOrder() {
        return orderBy != null;
    }
}
