package io.github.cyfko.qsfilter.jpa.target;

import io.github.cyfko.qsfilter.core.api.FieldCategory;
import io.github.cyfko.qsfilter.core.utils.TypeClassifier;
import jakarta.persistence.criteria.Path;

import java.util.Objects;
import java.util.Optional;

/**
 * A resolved, filterable attribute of a query target.
 *
 * @param name       the attribute name as declared in the metamodel
 * @param path       the criteria path of the attribute in the current query
 * @param collection {@code true} for to-many attributes, whose nullability means emptiness
 * @param basic      {@code true} for plain value attributes, the only ones a query can be ordered by
 * @since 1.0.0
 */
public record Column(String name, Path<?> path, boolean collection, boolean basic) {

    public Column {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(path, "path cannot be null");
    }

    /**
     * A column that is basic unless it is a collection.
     */
    public Column(String name, Path<?> path, boolean collection) {
        this(name, path, collection, !collection);
    }

    /**
     * @return the Java type of the attribute
     */
    public Class<?> javaType() {
        return path.getJavaType();
    }

    /**
     * Classifies the column. Collections and associations are never classified.
     *
     * @return the category, or empty for an unclassified column
     */
    public Optional<FieldCategory> category() {
        return collection ? Optional.empty() : TypeClassifier.classify(javaType());
    }
}
