package io.github.cyfko.qsfilter.jpa.target;

import jakarta.persistence.criteria.CriteriaBuilder;

/**
 * Data source filters are applied to.
 * <p>
 * Two kinds exist, sharing this capability surface:
 * </p>
 * <ul>
 *   <li>{@link FlatSelection} - an entity, optionally joined with related entities, seen as one
 *       flat set of case-insensitively named columns producing {@link jakarta.persistence.Tuple} rows;
 *       no relationship traversal</li>
 *   <li>{@link EntityTarget} - a relational entity whose attributes are looked up directly and
 *       whose relationships can be traversed one level deep with {@code with}</li>
 * </ul>
 *
 * @param <R> the row type produced by queries over this target
 * @since 1.0.0
 */
public sealed interface QueryTarget<R> permits FlatSelection, EntityTarget {

    /**
     * @return the criteria builder predicates for this target are created with
     */
    CriteriaBuilder criteriaBuilder();

    /**
     * Starts a new query over the target.
     *
     * @return a select with no restriction, ordering or pagination
     */
    TargetSelect<R> buildSelect();
}
