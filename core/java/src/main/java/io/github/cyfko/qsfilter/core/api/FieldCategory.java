package io.github.cyfko.qsfilter.core.api;

/**
 * Type categories operators are restricted by.
 * <p>
 * Every queryable column falls into at most one category, determined from its Java type
 * by {@link io.github.cyfko.qsfilter.core.utils.TypeClassifier}. A column whose type maps
 * to none of them only accepts the nullability operators.
 * </p>
 *
 * @since 1.0.0
 */
public enum FieldCategory {

    /** Integral numbers: {@code Integer}, {@code Long}, {@code Short}, {@code Byte}, {@code BigInteger}. */
    INTEGER,

    /** {@code Boolean} flags. */
    BOOLEAN,

    /** Character data held in {@code String}. */
    TEXT,

    /** Dates and timestamps from {@code java.time} and {@code java.util.Date}. */
    TIMESTAMP
}
