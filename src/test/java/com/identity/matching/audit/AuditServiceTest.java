package com.identity.matching.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.identity.matching.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AuditService Tests")
class AuditServiceTest {

    private AuditService auditService;

    @BeforeEach
    void setUp() {
        auditService = new AuditService(new InMemoryAuditRepository(), CLOCK);
    }

    @Test
    @DisplayName("Entries should be stamped with the injected clock")
    void timestamps() {
        AuditEntry entry = auditService.record(AuditAction.IDENTITY_ENROLLED, "alice", "admin",
                Map.of("accepted", 3));

        assertEquals(NOW, entry.timestamp());
        assertEquals(3, entry.details().get("accepted"));
        assertNotNull(entry.id());
    }

    @Test
    @DisplayName("Entries should be queryable by identity, action and actor")
    void queries() {
        auditService.record(AuditAction.IDENTITY_ENROLLED, "alice", "admin");
        auditService.record(AuditAction.AUTHENTICATION_ATTEMPTED, "alice", "kiosk");
        auditService.record(AuditAction.IDENTITY_ENROLLED, "bob", "admin");
        auditService.record(AuditAction.REGISTRY_CLEARED, null, "admin");

        assertEquals(4, auditService.size());
        assertEquals(2, auditService.getEntriesForIdentity("alice").size());
        assertEquals(2, auditService.getEntriesByAction(AuditAction.IDENTITY_ENROLLED).size());
        assertEquals(1, auditService.getRepository().findByActorId("kiosk").size());
        assertTrue(auditService.getEntriesByAction(AuditAction.REGISTRY_CLEARED).get(0).details().isEmpty());
    }

    @Test
    @DisplayName("Recent entries should be the latest ones in order")
    void recentEntries() {
        auditService.record(AuditAction.IDENTITY_ENROLLED, "a", "admin");
        auditService.record(AuditAction.IDENTITY_ENROLLED, "b", "admin");
        auditService.record(AuditAction.IDENTITY_ENROLLED, "c", "admin");

        List<AuditEntry> recent = auditService.getRecentEntries(2);

        assertEquals(List.of("b", "c"), recent.stream().map(AuditEntry::identityId).toList());
        assertEquals(3, auditService.getRecentEntries(10).size());
    }

    @Test
    @DisplayName("Entries should be findable by time range")
    void between() {
        AuditService later = new AuditService(auditService.getRepository(),
                Clock.fixed(NOW.plusSeconds(3600), ZoneOffset.UTC));
        auditService.record(AuditAction.IDENTITY_EXPORTED, "alice", "admin");
        later.record(AuditAction.IDENTITY_REMOVED, "alice", "admin");

        List<AuditEntry> firstHalf = auditService.getRepository().findBetween(NOW, NOW.plusSeconds(60));

        assertEquals(1, firstHalf.size());
        assertEquals(AuditAction.IDENTITY_EXPORTED, firstHalf.get(0).action());
    }

    @Test
    @DisplayName("Details should be copied defensively")
    void immutableDetails() {
        AuditEntry entry = auditService.record(AuditAction.IDENTITY_REMOVED, "alice", "admin", Map.of("samples", 2));

        assertThrows(UnsupportedOperationException.class, () -> entry.details().put("samples", 3));
    }
}
