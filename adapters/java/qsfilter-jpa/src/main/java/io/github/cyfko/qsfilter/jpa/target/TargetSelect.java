package io.github.cyfko.qsfilter.jpa.target;

import jakarta.persistence.criteria.CriteriaQuery;

/**
 * A freshly built select over a {@link QueryTarget}, against which filters and ordering are resolved.
 * <p>
 * Each call to {@link QueryTarget#buildSelect()} returns a new instance with its own
 * {@link CriteriaQuery} and roots; instances are not shared between requests.
 * </p>
 *
 * @param <R> the row type of the query
 * @since 1.0.0
 */
public interface TargetSelect<R> extends ColumnResolver {

    /**
     * @return the criteria query, without restriction, ordering or pagination yet
     */
    CriteriaQuery<R> query();

    /**
     * Resolves a relationship attribute for the {@code with} operator.
     *
     * @param name the attribute name
     * @return the relationship
     * @throws io.github.cyfko.qsfilter.core.exception.NotMappedException if the attribute is not a relationship,
     *         or the target exposes no relationships
     * @throws io.github.cyfko.qsfilter.core.exception.ColumnNotFoundException if the attribute does not exist
     */
    Relationship resolveRelationship(String name);
}
