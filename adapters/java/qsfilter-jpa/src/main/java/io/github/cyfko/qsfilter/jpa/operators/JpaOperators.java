package io.github.cyfko.qsfilter.jpa.operators;

import io.github.cyfko.qsfilter.core.api.Arity;
import io.github.cyfko.qsfilter.core.api.Op;
import io.github.cyfko.qsfilter.jpa.target.Column;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Predicate;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Frozen registry binding every column operator of {@link Op} to its JPA predicate.
 * <p>
 * The registry is populated once, in the static initializer, and exposed read-only; it is safe
 * to use from any number of request threads without synchronization. {@link Op#WITH} has no
 * entry: it applies to relationships, not columns, and is handled by the query applier through
 * {@link io.github.cyfko.qsfilter.jpa.target.Relationship}.
 * </p>
 *
 * <h2>Predicates</h2>
 * <ul>
 *   <li>{@code is_null} / {@code is_not_null} - {@code IS [NOT] NULL}, or {@code IS [NOT] EMPTY}
 *       on to-many attributes</li>
 *   <li>{@code is_true} / {@code is_false} - boolean tests</li>
 *   <li>{@code eq}, {@code ne}, {@code gt}, {@code gte}, {@code lt}, {@code lte} - comparisons</li>
 *   <li>{@code ieq} - {@code lower(column) = lower(value)}</li>
 *   <li>{@code like} / {@code not_like} - pattern match, collation of the store decides case</li>
 *   <li>{@code ilike} / {@code not_ilike} - {@code lower(column) [NOT] LIKE lower(pattern)}</li>
 *   <li>{@code in} / {@code not_in} - membership over the converted list</li>
 * </ul>
 *
 * <p>Type legality is not checked here; callers verify {@link Op#supports} first.</p>
 *
 * @since 1.0.0
 */
public final class JpaOperators {

    private static final Map<Op, PredicateFactory> FACTORIES;

    static {
        Map<Op, PredicateFactory> factories = new EnumMap<>(Op.class);

        factories.put(Op.IS_NULL, (cb, c, v) -> c.collection() ? cb.isEmpty(collection(c)) : cb.isNull(c.path()));
        factories.put(Op.IS_NOT_NULL, (cb, c, v) -> c.collection() ? cb.isNotEmpty(collection(c)) : cb.isNotNull(c.path()));
        factories.put(Op.IS_TRUE, (cb, c, v) -> cb.isTrue(bool(c)));
        factories.put(Op.IS_FALSE, (cb, c, v) -> cb.isFalse(bool(c)));

        factories.put(Op.EQ, (cb, c, v) -> cb.equal(c.path(), v));
        factories.put(Op.NE, (cb, c, v) -> cb.notEqual(c.path(), v));
        factories.put(Op.IEQ, (cb, c, v) -> cb.equal(cb.lower(text(c)), lower(v)));

        factories.put(Op.GT, (cb, c, v) -> cb.greaterThan(comparable(c), comparable(v)));
        factories.put(Op.GTE, (cb, c, v) -> cb.greaterThanOrEqualTo(comparable(c), comparable(v)));
        factories.put(Op.LT, (cb, c, v) -> cb.lessThan(comparable(c), comparable(v)));
        factories.put(Op.LTE, (cb, c, v) -> cb.lessThanOrEqualTo(comparable(c), comparable(v)));

        factories.put(Op.LIKE, (cb, c, v) -> cb.like(text(c), v.toString()));
        factories.put(Op.NOT_LIKE, (cb, c, v) -> cb.notLike(text(c), v.toString()));
        factories.put(Op.ILIKE, (cb, c, v) -> cb.like(cb.lower(text(c)), lower(v)));
        factories.put(Op.NOT_ILIKE, (cb, c, v) -> cb.notLike(cb.lower(text(c)), lower(v)));

        factories.put(Op.IN, (cb, c, v) -> c.path().in(list(v)));
        factories.put(Op.NOT_IN, (cb, c, v) -> cb.not(c.path().in(list(v))));

        for (Op op : Op.values()) {
            if (op.getArity() != Arity.RELATIONSHIP && !factories.containsKey(op)) {
                throw new IllegalStateException("No predicate factory registered for operator " + op.getSymbol());
            }
        }
        FACTORIES = Collections.unmodifiableMap(factories);
    }

    private JpaOperators() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Returns the predicate factory of a column operator.
     *
     * @param op the operator
     * @return its factory
     * @throws IllegalArgumentException for {@link Op#WITH}, which has no column predicate
     */
    public static PredicateFactory get(Op op) {
        PredicateFactory factory = FACTORIES.get(op);
        if (factory == null) {
            throw new IllegalArgumentException("Operator " + op.getSymbol() + " does not apply to columns");
        }
        return factory;
    }

    /**
     * Builds the predicate of {@code op} over {@code column}.
     *
     * @see PredicateFactory#build(CriteriaBuilder, Column, Object)
     */
    public static Predicate build(Op op, CriteriaBuilder cb, Column column, Object value) {
        return get(op).build(cb, column, value);
    }

    /**
     * @return an unmodifiable view of the registry
     */
    public static Map<Op, PredicateFactory> registered() {
        return FACTORIES;
    }

    // ========================================
    // JPA-Specific Safe Casting Methods
    // ========================================

    @SuppressWarnings("unchecked")
    private static Expression<String> text(Column column) {
        return (Expression<String>) column.path();
    }

    @SuppressWarnings("unchecked")
    private static Expression<Boolean> bool(Column column) {
        return (Expression<Boolean>) column.path();
    }

    @SuppressWarnings("unchecked")
    private static Expression<Collection<?>> collection(Column column) {
        return (Expression<Collection<?>>) column.path();
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    private static Expression<Comparable> comparable(Column column) {
        return (Expression<Comparable>) column.path();
    }

    @SuppressWarnings("rawtypes")
    private static Comparable comparable(Object value) {
        if (value instanceof Comparable<?> cmp) {
            return cmp;
        }
        throw new IllegalArgumentException("Value is not Comparable: " + value);
    }

    private static String lower(Object value) {
        return value.toString().toLowerCase(Locale.ROOT);
    }

    private static Collection<?> list(Object value) {
        if (value instanceof Collection<?> values) {
            return values;
        }
        return List.of(value);
    }
}
