package io.github.cyfko.qsfilter.jpa.target;

import io.github.cyfko.qsfilter.core.exception.ColumnNotFoundException;
import io.github.cyfko.qsfilter.core.exception.NotMappedException;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.ManagedType;

import java.util.Objects;

/**
 * A relational entity as query target.
 * <p>
 * Filter fields are looked up directly (case-sensitive) among the entity's attributes.
 * Association attributes are relationships usable with {@code with}; queries return the
 * entity itself.
 * </p>
 *
 * <pre>{@code
 * EntityTarget<Owner> owners = EntityTarget.of(emf, Owner.class);
 * FilteredQuery<Owner> query = applier.apply(owners, FilterBuilder.buildFilters(
 *         Map.of("pets__with__petName__eq", "Hooch")));
 * List<Owner> result = query.getResultList(entityManager);
 * }</pre>
 *
 * @param <E> the entity type
 * @since 1.0.0
 */
public final class EntityTarget<E> implements QueryTarget<E> {

    private final CriteriaBuilder cb;
    private final EntityType<E> entityType;

    private EntityTarget(CriteriaBuilder cb, EntityType<E> entityType) {
        this.cb = cb;
        this.entityType = entityType;
    }

    /**
     * @param emf        the factory whose metamodel declares the entity
     * @param entityType the entity class
     * @return the target
     * @throws IllegalArgumentException if the class is not a managed entity
     */
    public static <E> EntityTarget<E> of(EntityManagerFactory emf, Class<E> entityType) {
        Objects.requireNonNull(emf, "emf cannot be null");
        Objects.requireNonNull(entityType, "entityType cannot be null");
        return new EntityTarget<>(emf.getCriteriaBuilder(), emf.getMetamodel().entity(entityType));
    }

    public Class<E> getEntityType() {
        return entityType.getJavaType();
    }

    @Override
    public CriteriaBuilder criteriaBuilder() {
        return cb;
    }

    @Override
    public TargetSelect<E> buildSelect() {
        CriteriaQuery<E> query = cb.createQuery(entityType.getJavaType());
        Root<E> root = query.from(entityType);
        query.select(root);
        return new EntitySelect(query, root);
    }

    @Override
    public String toString() {
        return "EntityTarget{" + entityType.getName() + "}";
    }

    private final class EntitySelect implements TargetSelect<E> {
        private final CriteriaQuery<E> query;
        private final Root<E> root;

        private EntitySelect(CriteriaQuery<E> query, Root<E> root) {
            this.query = query;
            this.root = root;
        }

        @Override
        public CriteriaQuery<E> query() {
            return query;
        }

        @Override
        public Column resolveColumn(String name) {
            return Attributes.column(root, entityType, name);
        }

        @Override
        public Relationship resolveRelationship(String name) {
            Attribute<?, ?> attribute = Attributes.find(entityType, name)
                    .orElseThrow(() -> new ColumnNotFoundException(name));
            if (!attribute.isAssociation()) {
                throw new NotMappedException(name, String.format(
                        "Attribute %s of %s is not a relationship", name, entityType.getName()));
            }
            ManagedType<?> related = Attributes.targetType(attribute)
                    .orElseThrow(() -> new NotMappedException(name, "Relationship " + name + " has no entity type"));

            Relationship.Kind kind = attribute.isCollection() ? Relationship.Kind.TO_MANY : Relationship.Kind.TO_ONE;
            return new Relationship(name, kind, query, root, related);
        }
    }
}
