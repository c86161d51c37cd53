package tech.policyhub.rbac.common.errors;

/**
 * Thrown when the policy store, the role metadata store or the transaction
 * manager fails with a checked exception.
 */
public class PolicyStoreException extends RuntimeException {

    public PolicyStoreException(String message) {
        super(message);
    }

    public PolicyStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
