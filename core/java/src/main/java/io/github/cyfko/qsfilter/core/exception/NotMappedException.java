package io.github.cyfko.qsfilter.core.exception;

/**
 * Thrown when the {@code with} operator targets an attribute that is not a mapped
 * relationship, or a target that exposes no relationships at all.
 *
 * @since 1.0.0
 */
public class NotMappedException extends FilterException {

    public NotMappedException(String field, String message) {
        super(field, message);
    }
}
