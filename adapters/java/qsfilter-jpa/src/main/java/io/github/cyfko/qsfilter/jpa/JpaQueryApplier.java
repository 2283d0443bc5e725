package io.github.cyfko.qsfilter.jpa;

import io.github.cyfko.qsfilter.core.api.FieldCategory;
import io.github.cyfko.qsfilter.core.api.FilterDescriptor;
import io.github.cyfko.qsfilter.core.api.Op;
import io.github.cyfko.qsfilter.core.config.FilterConfig;
import io.github.cyfko.qsfilter.core.exception.UnsupportedOperatorException;
import io.github.cyfko.qsfilter.core.model.Pagination;
import io.github.cyfko.qsfilter.core.model.RequestParameters;
import io.github.cyfko.qsfilter.core.parsing.FilterBuilder;
import io.github.cyfko.qsfilter.core.parsing.SubExpression;
import io.github.cyfko.qsfilter.core.utils.ValueConverter;
import io.github.cyfko.qsfilter.jpa.operators.JpaOperators;
import io.github.cyfko.qsfilter.jpa.target.Column;
import io.github.cyfko.qsfilter.jpa.target.ColumnResolver;
import io.github.cyfko.qsfilter.jpa.target.QueryTarget;
import io.github.cyfko.qsfilter.jpa.target.Relationship;
import io.github.cyfko.qsfilter.jpa.target.TargetSelect;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Applies filter descriptors, ordering and pagination to a {@link QueryTarget}.
 *
 * <h2>Processing</h2>
 * <ol>
 *   <li>A new select is built over the target.</li>
 *   <li>Each filter, in order, has its operator looked up, its column (or, for {@code with}, its
 *       relationship) resolved, its arity and type category checked, its value converted, and its
 *       predicate built.</li>
 *   <li>All predicates are combined with AND. Without filters no restriction is set at all.</li>
 *   <li>The order column is resolved like a filter column; descending order on request.</li>
 *   <li>The limit defaults to, and is clamped at, {@link FilterConfig#getMaxLimit()}; an offset is
 *       kept only when positive.</li>
 * </ol>
 * <p>
 * Every failure is a {@link io.github.cyfko.qsfilter.core.exception.FilterException} raised while
 * the query is built; nothing is ever partially applied. The returned {@link FilteredQuery} is
 * not executed.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * JpaQueryApplier applier = new JpaQueryApplier();
 *
 * // GET /users?userName__ieq=oli&location__with__locationName__eq=Karlsruhe&_order=userId&_desc
 * FilteredQuery<User> query = applier.apply(EntityTarget.of(emf, User.class), request.getParameterMap());
 * List<User> users = query.getResultList(em);
 * }</pre>
 *
 * <p>
 * Instances hold only their configuration and can be shared between threads.
 * </p>
 *
 * @since 1.0.0
 */
public class JpaQueryApplier {

    private static final Logger logger = Logger.getLogger(JpaQueryApplier.class.getName());

    private final FilterConfig config;

    public JpaQueryApplier() {
        this(FilterConfig.defaults());
    }

    public JpaQueryApplier(FilterConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    public FilterConfig getConfig() {
        return config;
    }

    /**
     * Applies filters with the default limit, no offset and store order.
     */
    public <R> FilteredQuery<R> apply(QueryTarget<R> target, List<FilterDescriptor> filters) {
        return apply(target, filters, Pagination.none());
    }

    /**
     * Applies filters with explicit pagination arguments.
     *
     * @param limit     requested row count, or {@code null} for the ceiling
     * @param offset    rows to skip, or {@code null}; zero means no offset
     * @param orderBy   column to order by, or {@code null}
     * @param ascending sort direction
     */
    public <R> FilteredQuery<R> apply(QueryTarget<R> target, List<FilterDescriptor> filters,
                                      Integer limit, Integer offset, String orderBy, boolean ascending) {
        return apply(target, filters, Pagination.of(limit, offset, orderBy, ascending));
    }

    /**
     * Parses a decoded query-string map, reserved pagination keys included, and applies it.
     *
     * @param target the query target
     * @param query  the request parameters, e.g. {@code {age__gt=55, _limit=20}}
     * @return the filtered query
     * @see RequestParameters
     */
    public <R> FilteredQuery<R> apply(QueryTarget<R> target, Map<String, String> query) {
        RequestParameters parameters = RequestParameters.from(query);
        return apply(target, FilterBuilder.buildFilters(parameters.filters()), parameters.pagination());
    }

    /**
     * Applies filters and pagination to a target.
     *
     * @param target     the query target
     * @param filters    the filter descriptors, applied in order
     * @param pagination limit, offset and ordering
     * @param <R>        the row type
     * @return the composed query, not executed
     * @throws io.github.cyfko.qsfilter.core.exception.FilterException if any filter or the order column is invalid
     */
    public <R> FilteredQuery<R> apply(QueryTarget<R> target, List<FilterDescriptor> filters, Pagination pagination) {
        Objects.requireNonNull(target, "target cannot be null");
        Objects.requireNonNull(filters, "filters cannot be null");
        Objects.requireNonNull(pagination, "pagination cannot be null");

        CriteriaBuilder cb = target.criteriaBuilder();
        TargetSelect<R> select = target.buildSelect();
        CriteriaQuery<R> query = select.query();

        List<Predicate> restrictions = new ArrayList<>(filters.size());
        for (FilterDescriptor filter : filters) {
            restrictions.add(toPredicate(cb, select, filter));
        }
        if (!restrictions.isEmpty()) {
            query.where(restrictions.toArray(new Predicate[0]));
        }

        if (pagination.hasOrder()) {
            Column order = select.resolveColumn(pagination.orderBy());
            if (!order.basic()) {
                throw new UnsupportedOperatorException(order.name(), RequestParameters.ORDER, String.format(
                        "Cannot order by %s: only basic attributes can be ordered", order.name()));
            }
            query.orderBy(pagination.ascending() ? cb.asc(order.path()) : cb.desc(order.path()));
        }

        int ceiling = config.getMaxLimit();
        int limit = pagination.effectiveLimit(ceiling);
        if (pagination.limit() != null && pagination.limit() > ceiling) {
            logger.fine(() -> String.format("Requested limit %d exceeds ceiling, clamped to %d", pagination.limit(), ceiling));
        }
        Integer offset = pagination.hasOffset() ? pagination.offset() : null;

        logger.fine(() -> String.format("Applied %d filter(s) to %s: limit=%d, offset=%s, order=%s%s",
                filters.size(), target, limit, offset, pagination.orderBy(),
                pagination.hasOrder() && !pagination.ascending() ? " desc" : ""));

        return new FilteredQuery<>(query, limit, offset);
    }

    // ========================================
    // INTERNAL: Filter dispatch
    // ========================================

    private Predicate toPredicate(CriteriaBuilder cb, TargetSelect<?> select, FilterDescriptor filter) {
        Op op = lookup(filter.name(), filter.op());
        if (op == Op.WITH) {
            Relationship relationship = select.resolveRelationship(filter.name());
            return toRelationshipPredicate(cb, relationship, filter.value());
        }
        return toColumnPredicate(cb, select, filter.name(), op, filter.value());
    }

    private Predicate toRelationshipPredicate(CriteriaBuilder cb, Relationship relationship, String value) {
        SubExpression sub = SubExpression.parse(relationship.getName(), value);
        Op innerOp = lookup(sub.field(), sub.operator());
        if (innerOp == Op.WITH) {
            throw new UnsupportedOperatorException(sub.field(), sub.operator(), String.format(
                    "Cannot traverse %s from relationship %s: only one level of relationships is supported",
                    sub.field(), relationship.getName()));
        }

        logger.fine(() -> String.format("Filtering %s through %s %s %s",
                relationship, sub.field(), sub.operator(), sub.value()));
        return relationship.anyMatch(cb, related -> toColumnPredicate(cb, related, sub.field(), innerOp, sub.value()));
    }

    private Predicate toColumnPredicate(CriteriaBuilder cb, ColumnResolver resolver, String field, Op op, String value) {
        Column column = resolver.resolveColumn(field);
        FieldCategory category = column.category().orElse(null);
        if (!op.supports(category)) {
            throw new UnsupportedOperatorException(field, op.getSymbol(), String.format(
                    "Cannot apply filter %s to field %s of type %s",
                    op.getSymbol(), field, column.javaType().getSimpleName()));
        }

        Object converted = switch (op.getArity()) {
            case UNARY -> null;
            case BINARY -> ValueConverter.convert(field, column.javaType(), value, config);
            case LIST -> ValueConverter.convertList(field, column.javaType(), value, config);
            case RELATIONSHIP -> throw new IllegalStateException("Relationship operator reached column dispatch");
        };
        return JpaOperators.build(op, cb, column, converted);
    }

    private static Op lookup(String field, String symbol) {
        return Op.fromSymbol(symbol).orElseThrow(() -> new UnsupportedOperatorException(field, symbol,
                String.format("Unknown operator %s for field %s", symbol, field)));
    }
}
