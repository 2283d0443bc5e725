package io.github.cyfko.qsfilter.jpa.target;

import io.github.cyfko.qsfilter.core.exception.ColumnNotFoundException;
import io.github.cyfko.qsfilter.core.exception.NotMappedException;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Tuple;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.From;
import jakarta.persistence.criteria.JoinType;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Selection;
import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.ManagedType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A flat, tabular selection over an entity and optionally some of its to-one relationships.
 * <p>
 * The basic attributes of the root entity and of every joined entity form a single namespace of
 * columns. Column names are matched case-insensitively, and each row is returned as a
 * {@link Tuple} whose elements are aliased with the column names. Relationships are not
 * exposed: {@code with} is rejected on a flat selection.
 * </p>
 * <p>
 * Root columns keep their names. A joined column whose name is already taken is exposed as
 * {@code <association>_<attribute>}, so joining {@code town} onto an entity that also has an
 * {@code id} yields the columns {@code id} (the root's) and {@code town_id}.
 * </p>
 *
 * <pre>{@code
 * // user JOIN location, as flat records
 * FlatSelection users = FlatSelection.of(emf, User.class).join("location");
 *
 * FilteredQuery<Tuple> query = applier.apply(users, List.of(
 *         new FilterDescriptor("locationName", "like", "%gart%")));
 * for (Tuple row : query.getResultList(em)) {
 *     String name = row.get("userName", String.class);
 * }
 * }</pre>
 *
 * <p>Instances are immutable; {@link #join(String)} returns a new selection.</p>
 *
 * @since 1.0.0
 */
public final class FlatSelection implements QueryTarget<Tuple> {

    private static final int ROOT = -1;

    private record JoinSpec(String attribute, JoinType type, ManagedType<?> related) {}

    /** Where a column comes from: the root ({@link #ROOT}) or the join at {@code source}. */
    private record ColumnSpec(String name, int source, String attribute) {}

    private final CriteriaBuilder cb;
    private final EntityType<?> rootType;
    private final List<JoinSpec> joins;
    private final List<ColumnSpec> columns;

    private FlatSelection(CriteriaBuilder cb, EntityType<?> rootType, List<JoinSpec> joins) {
        this.cb = cb;
        this.rootType = rootType;
        this.joins = joins;
        this.columns = layout(rootType, joins);
    }

    /**
     * @param emf      the factory whose metamodel declares the entity
     * @param rootType the entity selected from
     * @return a selection over the basic attributes of {@code rootType}
     */
    public static FlatSelection of(EntityManagerFactory emf, Class<?> rootType) {
        Objects.requireNonNull(emf, "emf cannot be null");
        Objects.requireNonNull(rootType, "rootType cannot be null");
        return new FlatSelection(emf.getCriteriaBuilder(), emf.getMetamodel().entity(rootType), List.of());
    }

    /**
     * Adds the columns of a related entity through an inner join.
     *
     * @param attribute a to-one association of the root entity
     * @return a new selection including the related columns
     * @throws IllegalArgumentException if {@code attribute} is not a to-one association, or a
     *                                  related column cannot be given a unique name
     */
    public FlatSelection join(String attribute) {
        return join(attribute, JoinType.INNER);
    }

    /**
     * Adds the columns of a related entity through a left outer join.
     *
     * @param attribute a to-one association of the root entity
     * @return a new selection including the related columns
     * @throws IllegalArgumentException if {@code attribute} is not a to-one association, or a
     *                                  related column cannot be given a unique name
     */
    public FlatSelection leftJoin(String attribute) {
        return join(attribute, JoinType.LEFT);
    }

    private FlatSelection join(String attribute, JoinType type) {
        Attribute<?, ?> association = Attributes.find(rootType, attribute)
                .filter(Attribute::isAssociation)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Attribute " + attribute + " is not an association of " + rootType.getName()));
        if (association.isCollection()) {
            throw new IllegalArgumentException(
                    "Only to-one associations can be flattened, " + attribute + " is a collection");
        }
        ManagedType<?> related = Attributes.targetType(association).orElseThrow(() -> new IllegalArgumentException(
                "Association " + attribute + " has no managed target type"));

        List<JoinSpec> extended = new ArrayList<>(joins);
        extended.add(new JoinSpec(attribute, type, related));
        return new FlatSelection(cb, rootType, List.copyOf(extended));
    }

    @Override
    public CriteriaBuilder criteriaBuilder() {
        return cb;
    }

    @Override
    public TargetSelect<Tuple> buildSelect() {
        CriteriaQuery<Tuple> query = cb.createTupleQuery();
        Root<?> root = query.from(rootType);

        List<From<?, ?>> sources = new ArrayList<>(joins.size());
        for (JoinSpec spec : joins) {
            sources.add(root.join(spec.attribute(), spec.type()));
        }

        Map<String, Column> resolved = new LinkedHashMap<>();
        List<Selection<?>> selections = new ArrayList<>(columns.size());
        for (ColumnSpec spec : columns) {
            From<?, ?> from = spec.source() == ROOT ? root : sources.get(spec.source());
            Column column = new Column(spec.name(), from.get(spec.attribute()), false);
            resolved.put(spec.name().toLowerCase(Locale.ROOT), column);
            selections.add(column.path().alias(spec.name()));
        }
        query.multiselect(selections);

        return new FlatSelect(query, Collections.unmodifiableMap(resolved));
    }

    // ========================================
    // INTERNAL: Column naming
    // ========================================

    private static List<ColumnSpec> layout(EntityType<?> rootType, List<JoinSpec> joins) {
        Map<String, ColumnSpec> taken = new LinkedHashMap<>();
        for (String name : basicNames(rootType)) {
            taken.put(name.toLowerCase(Locale.ROOT), new ColumnSpec(name, ROOT, name));
        }

        for (int i = 0; i < joins.size(); i++) {
            JoinSpec join = joins.get(i);
            for (String name : basicNames(join.related())) {
                String exposed = taken.containsKey(name.toLowerCase(Locale.ROOT))
                        ? join.attribute() + "_" + name
                        : name;
                ColumnSpec previous = taken.putIfAbsent(exposed.toLowerCase(Locale.ROOT),
                        new ColumnSpec(exposed, i, name));
                if (previous != null) {
                    throw new IllegalArgumentException(String.format(
                            "Column %s of association %s clashes with column %s already selected",
                            name, join.attribute(), previous.name()));
                }
            }
        }
        return List.copyOf(taken.values());
    }

    private static List<String> basicNames(ManagedType<?> type) {
        List<String> names = new ArrayList<>();
        for (Attribute<?, ?> attribute : type.getAttributes()) {
            if (Attributes.isBasic(attribute)) {
                names.add(attribute.getName());
            }
        }
        Collections.sort(names);
        return names;
    }

    @Override
    public String toString() {
        return "FlatSelection{" + rootType.getName() + (joins.isEmpty() ? "" : ", joins=" + joins.stream()
                .map(JoinSpec::attribute).toList()) + "}";
    }

    private static final class FlatSelect implements TargetSelect<Tuple> {
        private final CriteriaQuery<Tuple> query;
        private final Map<String, Column> columns;

        private FlatSelect(CriteriaQuery<Tuple> query, Map<String, Column> columns) {
            this.query = query;
            this.columns = columns;
        }

        @Override
        public CriteriaQuery<Tuple> query() {
            return query;
        }

        @Override
        public Column resolveColumn(String name) {
            Column column = columns.get(name.toLowerCase(Locale.ROOT));
            if (column == null) {
                throw new ColumnNotFoundException(name);
            }
            return column;
        }

        @Override
        public Relationship resolveRelationship(String name) {
            throw new NotMappedException(name, "Flat selections expose no relationships, cannot traverse " + name);
        }
    }
}
