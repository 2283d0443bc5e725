package io.github.cyfko.qsfilter.core.api;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static io.github.cyfko.qsfilter.core.api.FieldCategory.*;

/**
 * Closed catalogue of the operators understood in query keys.
 * <p>
 * Each operator carries the symbol used after the {@code __} delimiter, its {@link Arity},
 * and the set of {@link FieldCategory} values it may be applied to. The catalogue is fixed
 * at compile time; there is no runtime registration.
 * </p>
 *
 * <p><strong>Query-key examples:</strong></p>
 * <pre>{@code
 * age=55                       -> Op.EQ  (no operator defaults to eq)
 * age__gt=55                   -> Op.GT
 * name__ilike=%joe%            -> Op.ILIKE
 * id__in=1,3                   -> Op.IN
 * deleted_at__is_null          -> Op.IS_NULL
 * pets__with__name__eq=Hooch   -> Op.WITH
 * }</pre>
 *
 * <p><strong>Operator table:</strong></p>
 * <ul>
 *     <li>is_null, is_not_null - unary, any field</li>
 *     <li>is_true, is_false - unary, Boolean</li>
 *     <li>eq, ne - Integer, Text, Timestamp</li>
 *     <li>ieq - Text, case-insensitive equality</li>
 *     <li>gt, gte, lt, lte - Integer, Timestamp</li>
 *     <li>like, not_like - Text, collation-dependent case sensitivity</li>
 *     <li>ilike, not_ilike - Text, always case-insensitive</li>
 *     <li>in, not_in - Integer, Text, comma-separated list</li>
 *     <li>with - relationship attributes only</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Op {

    /** Field is null. */
    IS_NULL("is_null", Arity.UNARY, EnumSet.allOf(FieldCategory.class)),

    /** Field is not null. */
    IS_NOT_NULL("is_not_null", Arity.UNARY, EnumSet.allOf(FieldCategory.class)),

    /** Boolean field is true. */
    IS_TRUE("is_true", Arity.UNARY, EnumSet.of(BOOLEAN)),

    /** Boolean field is false. */
    IS_FALSE("is_false", Arity.UNARY, EnumSet.of(BOOLEAN)),

    EQ("eq", Arity.BINARY, EnumSet.of(INTEGER, TEXT, TIMESTAMP)),

    NE("ne", Arity.BINARY, EnumSet.of(INTEGER, TEXT, TIMESTAMP)),

    /** Case-insensitive equality, both sides lowercased. */
    IEQ("ieq", Arity.BINARY, EnumSet.of(TEXT)),

    GT("gt", Arity.BINARY, EnumSet.of(INTEGER, TIMESTAMP)),

    GTE("gte", Arity.BINARY, EnumSet.of(INTEGER, TIMESTAMP)),

    LT("lt", Arity.BINARY, EnumSet.of(INTEGER, TIMESTAMP)),

    LTE("lte", Arity.BINARY, EnumSet.of(INTEGER, TIMESTAMP)),

    /** Pattern match; case sensitivity follows the collation of the store. */
    LIKE("like", Arity.BINARY, EnumSet.of(TEXT)),

    NOT_LIKE("not_like", Arity.BINARY, EnumSet.of(TEXT)),

    /** Pattern match, always case-insensitive. */
    ILIKE("ilike", Arity.BINARY, EnumSet.of(TEXT)),

    NOT_ILIKE("not_ilike", Arity.BINARY, EnumSet.of(TEXT)),

    IN("in", Arity.LIST, EnumSet.of(INTEGER, TEXT)),

    NOT_IN("not_in", Arity.LIST, EnumSet.of(INTEGER, TEXT)),

    /** One-hop relationship traversal; applies to relationship attributes, never to columns. */
    WITH("with", Arity.RELATIONSHIP, EnumSet.noneOf(FieldCategory.class));

    private static final Map<String, Op> BY_SYMBOL = Stream.of(values())
            .collect(Collectors.toUnmodifiableMap(Op::getSymbol, Function.identity()));

    private final String symbol;
    private final Arity arity;
    private final Set<FieldCategory> categories;

    Op(String symbol, Arity arity, Set<FieldCategory> categories) {
        this.symbol = symbol;
        this.arity = arity;
        this.categories = Collections.unmodifiableSet(categories);
    }

    /**
     * Returns the symbol written after the {@code __} delimiter in a query key.
     *
     * @return the operator symbol, e.g. {@code "gte"}
     */
    public String getSymbol() {
        return symbol;
    }

    public Arity getArity() {
        return arity;
    }

    /**
     * @return the categories this operator may be applied to, unmodifiable
     */
    public Set<FieldCategory> getCategories() {
        return categories;
    }

    /**
     * Tells whether this operator can be applied to a column of the given category.
     * <p>
     * Nullability checks accept every column, including columns whose type is not
     * classified ({@code category == null}). {@link #WITH} accepts no column at all.
     * </p>
     *
     * @param category the column category, or {@code null} for an unclassified type
     * @return {@code true} if the operator is legal for the category
     */
    public boolean supports(FieldCategory category) {
        if (this == IS_NULL || this == IS_NOT_NULL) {
            return true;
        }
        return category != null && categories.contains(category);
    }

    /**
     * Finds an operator by its exact symbol.
     * <p>
     * Lookup is case-sensitive: the parser only lowercases two-character operators,
     * so {@code "EQ"} arrives here as {@code "eq"} while {@code "LIKE"} stays unknown.
     * </p>
     *
     * @param symbol the operator symbol from the query key
     * @return the matching operator, or empty if the symbol is not in the catalogue
     */
    public static Optional<Op> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_SYMBOL.get(symbol));
    }
}
