package tech.policyhub.rbac.common.errors;

/**
 * Thrown before any I/O when a filtered read names fields outside the
 * policy tuple or supplies no usable values.
 */
public class MalformedFilterException extends IllegalArgumentException {

    public MalformedFilterException(String message) {
        super(message);
    }
}
