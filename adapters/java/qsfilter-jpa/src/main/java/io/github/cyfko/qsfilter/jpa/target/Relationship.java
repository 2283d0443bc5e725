package io.github.cyfko.qsfilter.jpa.target;

import jakarta.persistence.criteria.AbstractQuery;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import jakarta.persistence.metamodel.ManagedType;

import java.util.Objects;
import java.util.function.Function;

/**
 * A relationship attribute of an {@link EntityTarget}, resolved for one query.
 * <p>
 * Filtering through a relationship produces a correlated {@code EXISTS} subquery that joins the
 * related entity and applies an inner predicate to it:
 * </p>
 * <ul>
 *   <li>to-many: at least one related row matches</li>
 *   <li>to-one: the related row exists and matches</li>
 * </ul>
 * <p>
 * The inner predicate only sees the basic attributes of the related entity through a
 * {@link ColumnResolver}; it cannot traverse further.
 * </p>
 *
 * <pre>{@code
 * // owners having at least one pet named Hooch
 * Relationship pets = select.resolveRelationship("pets");
 * Predicate p = pets.anyMatch(cb, related -> cb.equal(related.resolveColumn("petName").path(), "Hooch"));
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Relationship {

    /**
     * Cardinality of the relationship as seen from the owning entity.
     */
    public enum Kind {
        /** many-to-one or one-to-one */
        TO_ONE,
        /** one-to-many or many-to-many */
        TO_MANY
    }

    private final String name;
    private final Kind kind;
    private final AbstractQuery<?> query;
    private final Root<?> owner;
    private final ManagedType<?> relatedType;

    Relationship(String name, Kind kind, AbstractQuery<?> query, Root<?> owner, ManagedType<?> relatedType) {
        this.name = Objects.requireNonNull(name);
        this.kind = Objects.requireNonNull(kind);
        this.query = Objects.requireNonNull(query);
        this.owner = Objects.requireNonNull(owner);
        this.relatedType = Objects.requireNonNull(relatedType);
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the Java type of the related entity
     */
    public Class<?> getRelatedType() {
        return relatedType.getJavaType();
    }

    /**
     * Builds the predicate "a related row exists and satisfies {@code inner}".
     *
     * @param cb    the criteria builder
     * @param inner builds the predicate over the related entity's columns
     * @return an {@code EXISTS} predicate correlated with the owning query
     */
    public Predicate anyMatch(CriteriaBuilder cb, Function<ColumnResolver, Predicate> inner) {
        return exists(cb, owner, inner);
    }

    private <Y> Predicate exists(CriteriaBuilder cb, Root<Y> root, Function<ColumnResolver, Predicate> inner) {
        Subquery<Integer> subquery = query.subquery(Integer.class);
        Root<Y> correlated = subquery.correlate(root);
        Join<Y, ?> related = correlated.join(name);

        ColumnResolver resolver = field -> Attributes.basicColumn(related, relatedType, field);
        subquery.select(cb.literal(1)).where(inner.apply(resolver));
        return cb.exists(subquery);
    }

    @Override
    public String toString() {
        return "Relationship{" + name + ", " + kind + " " + relatedType.getJavaType().getSimpleName() + "}";
    }
}
