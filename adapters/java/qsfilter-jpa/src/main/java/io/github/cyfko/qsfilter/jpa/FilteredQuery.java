package io.github.cyfko.qsfilter.jpa;

import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import jakarta.persistence.criteria.CriteriaQuery;

import java.util.List;
import java.util.Objects;

/**
 * A filtered, ordered criteria query together with its pagination, not yet executed.
 * <p>
 * Criteria queries carry no row window, so the effective limit and the optional offset travel
 * alongside and are applied when a {@link TypedQuery} is created. Execution, transactions and
 * timeouts are the caller's business.
 * </p>
 *
 * <pre>{@code
 * FilteredQuery<Tuple> filtered = applier.apply(target, filters, Pagination.of(2, null, "userId", true));
 * List<Tuple> rows = filtered.getResultList(entityManager);
 * }</pre>
 *
 * @param criteria the criteria query with restriction and ordering applied
 * @param limit    maximum number of rows, already clamped to the configured ceiling
 * @param offset   rows to skip, or {@code null} when no offset applies
 * @param <R>      the row type
 * @since 1.0.0
 */
public record FilteredQuery<R>(CriteriaQuery<R> criteria, int limit, Integer offset) {

    public FilteredQuery {
        Objects.requireNonNull(criteria, "criteria cannot be null");
        if (limit < 0) {
            throw new IllegalArgumentException("limit cannot be negative. Provided: " + limit);
        }
        if (offset != null && offset <= 0) {
            throw new IllegalArgumentException("offset must be positive when present. Provided: " + offset);
        }
    }

    public boolean hasOffset() {
        return offset != null;
    }

    /**
     * Creates an executable query with the row window applied.
     *
     * @param em the entity manager to run the query with
     * @return the typed query, ready to execute
     */
    public TypedQuery<R> createQuery(EntityManager em) {
        TypedQuery<R> query = em.createQuery(criteria);
        query.setMaxResults(limit);
        if (offset != null) {
            query.setFirstResult(offset);
        }
        return query;
    }

    /**
     * Executes the query.
     *
     * @param em the entity manager to run the query with
     * @return the matching rows
     */
    public List<R> getResultList(EntityManager em) {
        return createQuery(em).getResultList();
    }
}
