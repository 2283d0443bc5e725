package io.github.cyfko.qsfilter.core.exception;

/**
 * Thrown when a raw query-string value cannot be converted into the native type
 * of the targeted field.
 *
 * <pre>{@code
 * ValueConverter.convert(Integer.class, "abc");
 * // -> ConversionException: Cannot convert 'abc' to Integer
 * }</pre>
 *
 * @since 1.0.0
 */
public class ConversionException extends FilterException {

    public ConversionException(String field, String message) {
        super(field, message);
    }

    public ConversionException(String field, String message, Throwable cause) {
        super(field, message, cause);
    }
}
