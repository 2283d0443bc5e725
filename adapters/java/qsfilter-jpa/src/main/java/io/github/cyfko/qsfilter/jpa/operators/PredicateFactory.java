package io.github.cyfko.qsfilter.jpa.operators;

import io.github.cyfko.qsfilter.jpa.target.Column;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Predicate;

/**
 * Builds the JPA predicate of one operator.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface PredicateFactory {

    /**
     * @param cb     the criteria builder
     * @param column the resolved column, already checked against the operator's categories
     * @param value  {@code null} for unary operators, the converted value for binary ones,
     *               a {@code List} of converted values for list operators
     * @return the predicate
     */
    Predicate build(CriteriaBuilder cb, Column column, Object value);
}
