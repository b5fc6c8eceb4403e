package me.golemcore.chorus.domain.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.chorus.adapter.outbound.storage.InMemoryAgentRepository;
import me.golemcore.chorus.adapter.outbound.storage.InMemoryAuditLog;
import me.golemcore.chorus.adapter.outbound.storage.InMemoryMemoryRepository;
import me.golemcore.chorus.domain.component.ToolContext;
import me.golemcore.chorus.domain.model.Agent;
import me.golemcore.chorus.domain.model.AgentMemory;
import me.golemcore.chorus.domain.model.AuditEntry;
import me.golemcore.chorus.domain.model.MemoryType;
import me.golemcore.chorus.domain.model.ToolResult;
import me.golemcore.chorus.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RefinementSessionTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private InMemoryMemoryRepository memoryRepository;
    private InMemoryAgentRepository agentRepository;
    private InMemoryAuditLog auditLog;
    private Agent agent;
    private RefinementSession session;

    @BeforeEach
    void setUp() {
        memoryRepository = new InMemoryMemoryRepository();
        agentRepository = new InMemoryAgentRepository();
        auditLog = new InMemoryAuditLog();
        agent = agentRepository.save(Agent.builder().id("ada").accountId("acc-1").name("Ada").build());
        session = newSession(3);
    }

    @Test
    void shouldMergeMemoriesKeepingEarliestDate() {
        AgentMemory first = core("Sam likes tea", NOW.minus(Duration.ofDays(20)));
        AgentMemory second = core("Sam enjoys tea in the morning", NOW.minus(Duration.ofDays(5)));

        ToolResult result = run(Map.of("action", "consolidate", "ids", first.getId() + "," + second.getId(),
                "content", "Sam drinks tea every morning"));

        assertTrue(result.isSuccess());
        List<AgentMemory> remaining = memoryRepository.findByAgent("ada");
        assertEquals(1, remaining.size());
        assertEquals("Sam drinks tea every morning", remaining.get(0).getContent());
        assertEquals(NOW.minus(Duration.ofDays(20)), remaining.get(0).getCreatedAt());
        assertTrue(first.isDiscarded());
        assertTrue(second.isDiscarded());
        assertEquals(2, session.getStats().get("consolidated"));
        assertEquals(1, session.getOperations());
        AuditEntry audit = auditLog.findByAgent("ada").get(0);
        assertEquals("memory_refinement_consolidate", audit.action());
        assertEquals(session.getSessionId(), audit.payload().get("session_id"));
    }

    @Test
    void shouldAcceptIdListFromModel() {
        AgentMemory first = core("a", NOW);
        AgentMemory second = core("b", NOW);

        ToolResult result = run(Map.of("action", "consolidate", "ids", List.of(first.getId(), second.getId()),
                "content", "ab"));

        assertTrue(result.isSuccess());
    }

    @Test
    void shouldRequireTwoIdsToConsolidate() {
        AgentMemory only = core("a", NOW);

        ToolResult result = run(Map.of("action", "consolidate", "ids", String.valueOf(only.getId()),
                "content", "x"));

        assertEquals("consolidate requires at least 2 memory IDs", result.getError());
        assertEquals(0, session.getOperations());
    }

    @Test
    void shouldRefuseToMergeConstitutionalMemory() {
        AgentMemory constitution = core("I never lie", NOW);
        constitution.markConstitutional();
        AgentMemory other = core("I try not to lie", NOW);

        ToolResult result = run(Map.of("action", "consolidate", "ids", constitution.getId() + "," + other.getId(),
                "content", "merged"));

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("Cannot consolidate constitutional memories"));
        assertFalse(other.isDiscarded());
    }

    @Test
    void shouldRefuseToDeleteConstitutionalMemory() {
        AgentMemory constitution = core("I never lie", NOW);
        constitution.markConstitutional();

        ToolResult result = run(Map.of("action", "delete", "id", String.valueOf(constitution.getId())));

        assertEquals("Cannot delete constitutional memory #" + constitution.getId(), result.getError());
        assertFalse(constitution.isDiscarded());
    }

    @Test
    void shouldAllowRewordingConstitutionalMemory() {
        AgentMemory constitution = core("I never lie.", NOW);
        constitution.markConstitutional();

        ToolResult result = run(Map.of("action", "update", "id", "#" + constitution.getId(),
                "content", "I am always honest."));

        assertTrue(result.isSuccess());
        assertEquals("I am always honest.", constitution.getContent());
        assertTrue(constitution.isConstitutional());
        Map<String, Object> payload = auditLog.findByAgent("ada").get(0).payload();
        assertEquals("I never lie.", payload.get("before"));
        assertEquals("I am always honest.", payload.get("after"));
    }

    @Test
    void shouldDeleteAndProtect() {
        AgentMemory duplicate = core("dup", NOW);
        AgentMemory keeper = core("keeper", NOW);

        assertTrue(run(Map.of("action", "delete", "id", String.valueOf(duplicate.getId()))).isSuccess());
        assertTrue(run(Map.of("action", "protect", "id", String.valueOf(keeper.getId()))).isSuccess());

        assertTrue(duplicate.isDiscarded());
        assertTrue(keeper.isConstitutional());
        assertEquals(1, session.getStats().get("deleted"));
        assertEquals(1, session.getStats().get("protected"));
    }

    @Test
    void shouldOnlySeeOwnCoreMemories() {
        memoryRepository.create(AgentMemory.builder().agentId("bo").memoryType(MemoryType.CORE)
                .content("Bo's secret").createdAt(NOW).build());
        AgentMemory journal = memoryRepository.create(AgentMemory.builder().agentId("ada")
                .memoryType(MemoryType.JOURNAL).content("secret journal").createdAt(NOW).build());

        ToolResult search = run(Map.of("action", "search", "query", "secret"));
        ToolResult delete = run(Map.of("action", "delete", "id", String.valueOf(journal.getId())));

        assertTrue(search.getOutput().contains("\"count\":0"));
        assertEquals("Memory #" + journal.getId() + " not found", delete.getError());
    }

    @Test
    void shouldEnforceOperationCapOnMutationsOnly() {
        AgentMemory memory = core("text", NOW);
        String id = String.valueOf(memory.getId());
        for (int i = 0; i < 3; i++) {
            assertTrue(run(Map.of("action", "update", "id", id, "content", "text " + i)).isSuccess());
        }

        ToolResult blocked = run(Map.of("action", "update", "id", id, "content", "one more"));
        ToolResult search = run(Map.of("action", "search", "query", "text"));

        assertEquals("Operation limit reached (3). Call complete to finish.", blocked.getError());
        assertTrue(search.isSuccess());
        assertEquals(3, session.getOperations());
    }

    @Test
    void shouldNotCountFailedActions() {
        run(Map.of("action", "delete", "id", "999"));

        assertEquals(0, session.getOperations());
    }

    @Test
    void shouldWriteJournalAndTimestampOnComplete() {
        ToolResult result = run(Map.of("action", "complete", "summary", "Merged two tea memories"));

        assertTrue(result.isSuccess());
        assertTrue(session.isCompleted());
        assertEquals(NOW, agent.getLastRefinementAt());
        AgentMemory entry = memoryRepository.findByAgent("ada").get(0);
        assertTrue(entry.isJournal());
        assertEquals("Refinement session: Merged two tea memories", entry.getContent());
        assertEquals("memory_refinement_complete", auditLog.findByAgent("ada").get(0).action());
    }

    @Test
    void shouldRejectActionsAfterComplete() {
        run(Map.of("action", "complete", "summary", "done"));

        ToolResult result = run(Map.of("action", "search", "query", "x"));

        assertEquals("Refinement session already completed", result.getError());
    }

    @Test
    void shouldMarkRefinedWithoutJournalWhenClosedOpen() {
        session.closeIfOpen();

        assertEquals(NOW, agent.getLastRefinementAt());
        assertTrue(memoryRepository.findByAgent("ada").isEmpty());
    }

    @Test
    void shouldReportMissingParameters() {
        assertEquals("id is required for update", run(Map.of("action", "update", "content", "x")).getError());
        assertEquals("summary is required for complete", run(Map.of("action", "complete")).getError());
        assertNull(agent.getLastRefinementAt());
    }

    @Test
    void shouldRejectUnknownAction() {
        assertTrue(run(Map.of("action", "shred")).getError().startsWith("Invalid action 'shred'"));
    }

    private RefinementSession newSession(int maxOperations) {
        return new RefinementSession(agent, maxOperations, memoryRepository, agentRepository, auditLog,
                new ObjectMapper(), new MutableClock(NOW));
    }

    private ToolResult run(Map<String, Object> parameters) {
        return session.execute(new ToolContext("ada", null), parameters).join();
    }

    private AgentMemory core(String content, Instant createdAt) {
        return memoryRepository.create(AgentMemory.builder()
                .agentId("ada")
                .memoryType(MemoryType.CORE)
                .content(content)
                .tokenEstimate(content.length() / 4)
                .createdAt(createdAt)
                .build());
    }
}
