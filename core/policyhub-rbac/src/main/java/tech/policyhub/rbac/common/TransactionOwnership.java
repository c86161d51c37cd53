package tech.policyhub.rbac.common;

/**
 * Who is responsible for committing or rolling back a transaction.
 */
public enum TransactionOwnership {
    /** Opened by the operation itself; it commits on success and rolls back on failure. */
    OWNED_BY_CALLEE,
    /** Passed in by the caller; the operation never commits or rolls it back. */
    SUPPLIED_BY_CALLER
}
