package me.golemcore.chorus.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentMemoryTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
    private static final Duration WEEK = Duration.ofDays(7);

    @Test
    void shouldRefuseDemotionOfCoreMemory() {
        AgentMemory memory = AgentMemory.builder().id(1L).memoryType(MemoryType.CORE).build();

        assertThrows(IllegalStateException.class, () -> memory.setMemoryType(MemoryType.JOURNAL));
        assertDoesNotThrow(() -> memory.setMemoryType(MemoryType.CORE));
    }

    @Test
    void shouldKeepConstitutionalFlagPermanent() {
        AgentMemory memory = AgentMemory.builder().id(1L).memoryType(MemoryType.CORE).build();
        memory.markConstitutional();

        assertThrows(IllegalStateException.class, () -> memory.setConstitutional(false));
        assertTrue(memory.isConstitutional());
    }

    @Test
    void shouldExpireJournalOutsideWindow() {
        AgentMemory fresh = journal(NOW.minus(Duration.ofDays(6)));
        AgentMemory stale = journal(NOW.minus(Duration.ofDays(8)));

        assertTrue(fresh.isLive(NOW, WEEK));
        assertTrue(stale.isExpired(NOW, WEEK));
        assertFalse(stale.isLive(NOW, WEEK));
    }

    @Test
    void shouldNeverExpireCoreMemory() {
        AgentMemory core = AgentMemory.builder().memoryType(MemoryType.CORE)
                .createdAt(NOW.minus(Duration.ofDays(400))).build();

        assertFalse(core.isExpired(NOW, WEEK));
    }

    @Test
    void shouldTreatDiscardedAsNotLive() {
        AgentMemory memory = journal(NOW);
        memory.setDiscarded(true);

        assertFalse(memory.isLive(NOW, WEEK));
    }

    private static AgentMemory journal(Instant createdAt) {
        return AgentMemory.builder().memoryType(MemoryType.JOURNAL).createdAt(createdAt).build();
    }
}
