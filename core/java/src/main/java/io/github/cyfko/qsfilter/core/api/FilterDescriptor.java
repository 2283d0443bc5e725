package io.github.cyfko.qsfilter.core.api;

import java.util.Objects;
import java.util.Optional;

/**
 * One filter parsed from a query key: the field name, the operator symbol and the raw value.
 * <p>
 * The operator is kept as the raw symbol rather than an {@link Op}: unknown symbols are
 * rejected by the query applier, which also knows the field being filtered and can report it.
 * </p>
 *
 * <pre>{@code
 * // ?age__gt=55
 * new FilterDescriptor("age", "gt", "55");
 *
 * // ?deleted_at__is_null  (unary, value ignored)
 * FilterDescriptor.unary("deleted_at", "is_null");
 * }</pre>
 *
 * @param name  the field name, never blank
 * @param op    the operator symbol, never {@code null}
 * @param value the raw value, or {@code null} when none was supplied
 * @since 1.0.0
 */
public record FilterDescriptor(String name, String op, String value) {

    public FilterDescriptor {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(op, "op cannot be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
    }

    /**
     * Creates a descriptor for an operator that takes no value.
     *
     * @param name the field name
     * @param op   the operator symbol
     * @return a descriptor without value
     */
    public static FilterDescriptor unary(String name, String op) {
        return new FilterDescriptor(name, op, null);
    }

    /**
     * @return the catalogue entry for {@link #op()}, if the symbol is known
     */
    public Optional<Op> operator() {
        return Op.fromSymbol(op);
    }
}
