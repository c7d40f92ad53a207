package com.identity.matching.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Records and queries audit entries. Entries are timestamped with the injected clock.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;
    private final Clock clock;

    public AuditService() {
        this(new InMemoryAuditRepository(), Clock.systemUTC());
    }

    public AuditService(AuditRepository repository, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public AuditEntry record(AuditAction action, String identityId, String actorId, Map<String, Object> details) {
        AuditEntry entry = AuditEntry.builder()
                .action(action)
                .identityId(identityId)
                .actorId(actorId)
                .details(details)
                .timestamp(clock.instant())
                .build();
        repository.save(entry);
        log.debug("audit.recorded action={} identityId={} actor={}", action, identityId, actorId);
        return entry;
    }

    public AuditEntry record(AuditAction action, String identityId, String actorId) {
        return record(action, identityId, actorId, null);
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public List<AuditEntry> getEntriesForIdentity(String identityId) {
        return repository.findByIdentityId(identityId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public List<AuditEntry> getRecentEntries(int limit) {
        return repository.findRecent(limit);
    }

    public int size() {
        return repository.count();
    }

    public AuditRepository getRepository() {
        return repository;
    }
}
