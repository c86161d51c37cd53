package tech.policyhub.rbac.test;

import tech.policyhub.rbac.common.TransactionProvider;

/**
 * {@link TransactionProvider} for unit tests. Binds the open transaction to
 * the provider the way JTA binds it to the thread, so fakes can join it.
 */
public class InMemoryTransactionProvider implements TransactionProvider {

    private InMemoryTransaction current;
    private int begun;
    private int committed;
    private int rolledBack;
    private boolean failNextCommit;

    @Override
    public InMemoryTransaction begin() {
        if (current != null) {
            throw new IllegalStateException("A transaction is already active");
        }
        begun++;
        current = new InMemoryTransaction(this);
        return current;
    }

    public InMemoryTransaction current() {
        return current;
    }

    /**
     * The next commit fails and rolls back instead.
     */
    public void failNextCommit() {
        failNextCommit = true;
    }

    public int begun() {
        return begun;
    }

    public int committed() {
        return committed;
    }

    public int rolledBack() {
        return rolledBack;
    }

    boolean consumeCommitFailure() {
        boolean fail = failNextCommit;
        failNextCommit = false;
        return fail;
    }

    void completed(InMemoryTransaction tx, boolean commit) {
        if (current == tx) {
            current = null;
        }
        if (commit) {
            committed++;
        } else {
            rolledBack++;
        }
    }
}
