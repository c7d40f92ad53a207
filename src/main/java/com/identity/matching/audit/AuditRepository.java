package com.identity.matching.audit;

import java.time.Instant;
import java.util.List;

/**
 * Storage backend for audit entries. Entries are append-only.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    List<AuditEntry> findByIdentityId(String identityId);

    List<AuditEntry> findByAction(AuditAction action);

    List<AuditEntry> findByActorId(String actorId);

    /**
     * Gets entries with {@code start <= timestamp <= end}.
     */
    List<AuditEntry> findBetween(Instant start, Instant end);

    int count();

    /**
     * Gets the most recent entries, up to the specified limit, oldest first.
     */
    List<AuditEntry> findRecent(int limit);
}
