package io.github.cyfko.qsfilter.jpa.target;

import io.github.cyfko.qsfilter.core.exception.ColumnNotFoundException;
import jakarta.persistence.criteria.From;
import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.ManagedType;
import jakarta.persistence.metamodel.PluralAttribute;
import jakarta.persistence.metamodel.SingularAttribute;
import jakarta.persistence.metamodel.Type;

import java.util.Optional;

/**
 * Metamodel lookups shared by the query targets.
 */
final class Attributes {

    private Attributes() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    static Optional<Attribute<?, ?>> find(ManagedType<?> type, String name) {
        for (Attribute<?, ?> attribute : type.getAttributes()) {
            if (attribute.getName().equals(name)) {
                return Optional.of(attribute);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves an attribute by its exact name into a column of {@code from}.
     */
    static Column column(From<?, ?> from, ManagedType<?> type, String name) {
        Attribute<?, ?> attribute = find(type, name).orElseThrow(() -> new ColumnNotFoundException(name));
        return new Column(attribute.getName(), from.get(attribute.getName()),
                attribute.isCollection(), isBasic(attribute));
    }

    /**
     * Resolves a basic attribute by its exact name; associations and element collections are not columns here.
     */
    static Column basicColumn(From<?, ?> from, ManagedType<?> type, String name) {
        Attribute<?, ?> attribute = find(type, name)
                .filter(Attributes::isBasic)
                .orElseThrow(() -> new ColumnNotFoundException(name));
        return new Column(attribute.getName(), from.get(attribute.getName()), false, true);
    }

    static boolean isBasic(Attribute<?, ?> attribute) {
        return attribute.getPersistentAttributeType() == Attribute.PersistentAttributeType.BASIC;
    }

    /**
     * Returns the managed type on the other side of an association or embedded attribute.
     */
    static Optional<ManagedType<?>> targetType(Attribute<?, ?> attribute) {
        Type<?> type;
        if (attribute instanceof PluralAttribute<?, ?, ?> plural) {
            type = plural.getElementType();
        } else if (attribute instanceof SingularAttribute<?, ?> singular) {
            type = singular.getType();
        } else {
            return Optional.empty();
        }
        return type instanceof ManagedType<?> managed ? Optional.of(managed) : Optional.empty();
    }
}
