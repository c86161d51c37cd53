package tech.policyhub.rbac.test;

import tech.policyhub.rbac.authorization.RoleMetadata;
import tech.policyhub.rbac.authorization.RoleMetadataRepository;
import tech.policyhub.rbac.common.PolicyTransaction;
import tech.policyhub.rbac.common.errors.PolicyStoreException;
import tech.policyhub.rbac.common.errors.RoleMetadataNotFoundException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link RoleMetadataRepository} backed by a map. Stored records are copies;
 * writes are undone when the transaction rolls back.
 */
public class InMemoryRoleMetadataRepository implements RoleMetadataRepository {

    private final Map<String, RoleMetadata> records = new LinkedHashMap<>();
    private int nextId = 1;
    private boolean failOnCreate;

    @Override
    public Optional<RoleMetadata> findRoleMetadata(String roleEntityRef, PolicyTransaction tx) {
        requireActive(tx);
        RoleMetadata found = records.get(roleEntityRef);
        return found == null ? Optional.empty() : Optional.of(found.copy());
    }

    @Override
    public void createRoleMetadata(RoleMetadata metadata, PolicyTransaction tx) {
        InMemoryTransaction memoryTx = requireActive(tx);
        if (failOnCreate) {
            throw new PolicyStoreException("Simulated create failure for " + metadata.roleEntityRef);
        }
        if (records.containsKey(metadata.roleEntityRef)) {
            throw new PolicyStoreException("Duplicate role metadata " + metadata.roleEntityRef);
        }
        RoleMetadata stored = metadata.copy();
        if (stored.id == null) {
            stored.id = String.format("rmd_%013d", nextId++);
        }
        records.put(stored.roleEntityRef, stored);
        memoryTx.recordUndo(() -> records.remove(stored.roleEntityRef));
    }

    @Override
    public void updateRoleMetadata(RoleMetadata metadata, String roleEntityRef, PolicyTransaction tx) {
        InMemoryTransaction memoryTx = requireActive(tx);
        RoleMetadata previous = records.remove(roleEntityRef);
        if (previous == null) {
            throw new RoleMetadataNotFoundException(roleEntityRef);
        }
        RoleMetadata stored = metadata.copy();
        stored.id = previous.id;
        RoleMetadata displaced = records.put(stored.roleEntityRef, stored);
        memoryTx.recordUndo(() -> {
            records.remove(stored.roleEntityRef);
            if (displaced != null) {
                records.put(displaced.roleEntityRef, displaced);
            }
            records.put(roleEntityRef, previous);
        });
    }

    @Override
    public void removeRoleMetadata(String roleEntityRef, PolicyTransaction tx) {
        InMemoryTransaction memoryTx = requireActive(tx);
        RoleMetadata removed = records.remove(roleEntityRef);
        if (removed != null) {
            memoryTx.recordUndo(() -> records.put(roleEntityRef, removed));
        }
    }

    /**
     * Store a record outside any transaction.
     */
    public void seed(RoleMetadata metadata) {
        RoleMetadata stored = metadata.copy();
        if (stored.id == null) {
            stored.id = String.format("rmd_%013d", nextId++);
        }
        records.put(stored.roleEntityRef, stored);
    }

    public Optional<RoleMetadata> get(String roleEntityRef) {
        return Optional.ofNullable(records.get(roleEntityRef)).map(RoleMetadata::copy);
    }

    public int size() {
        return records.size();
    }

    public void failOnCreate() {
        failOnCreate = true;
    }

    private static InMemoryTransaction requireActive(PolicyTransaction tx) {
        if (tx == null || !tx.isActive()) {
            throw new IllegalStateException("Role metadata access requires an active transaction");
        }
        return (InMemoryTransaction) tx;
    }
}
