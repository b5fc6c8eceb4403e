package me.golemcore.chorus.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.chorus.adapter.outbound.storage.InMemoryMemoryRepository;
import me.golemcore.chorus.domain.component.ToolContext;
import me.golemcore.chorus.domain.model.AgentMemory;
import me.golemcore.chorus.domain.model.ToolResult;
import me.golemcore.chorus.infrastructure.config.ChorusProperties;
import me.golemcore.chorus.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SaveMemoryToolTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private InMemoryMemoryRepository memoryRepository;
    private SaveMemoryTool tool;

    @BeforeEach
    void setUp() {
        memoryRepository = new InMemoryMemoryRepository();
        tool = new SaveMemoryTool(memoryRepository, new ChorusProperties(), objectMapper, new MutableClock(NOW));
    }

    @Test
    void shouldSaveJournalEntryWithExpiry() throws Exception {
        ToolResult result = tool.execute(new ToolContext("ada", "chat-1"),
                Map.of("content", " Sam is moving to Lisbon ", "memory_type", "journal")).join();

        assertTrue(result.isSuccess());
        JsonNode body = objectMapper.readTree(result.getOutput());
        assertEquals("journal", body.get("memory_type").asText());
        assertEquals("2026-03-17", body.get("expires_around").asText());
        List<AgentMemory> saved = memoryRepository.findByAgent("ada");
        assertEquals(1, saved.size());
        assertEquals("Sam is moving to Lisbon", saved.get(0).getContent());
        assertTrue(saved.get(0).isJournal());
        assertEquals(6, saved.get(0).getTokenEstimate());
        assertEquals(NOW, saved.get(0).getCreatedAt());
    }

    @Test
    void shouldSaveCoreMemoryWithPermanenceNote() throws Exception {
        ToolResult result = tool.execute(new ToolContext("ada", null),
                Map.of("content", "I care about clear writing", "memory_type", "CORE")).join();

        JsonNode body = objectMapper.readTree(result.getOutput());
        assertEquals("core", body.get("memory_type").asText());
        assertTrue(body.has("note"));
        assertFalse(body.has("expires_around"));
        assertTrue(memoryRepository.findByAgent("ada").get(0).isCore());
    }

    @Test
    void shouldRejectInvalidType() {
        ToolResult result = tool.execute(new ToolContext("ada", null),
                Map.of("content", "x", "memory_type", "diary")).join();

        assertEquals("Invalid memory_type 'diary'. Use journal or core.", result.getError());
        assertTrue(memoryRepository.findByAgent("ada").isEmpty());
    }

    @Test
    void shouldRejectBlankContent() {
        ToolResult result = tool.execute(new ToolContext("ada", null),
                Map.of("content", "   ", "memory_type", "core")).join();

        assertEquals("content is required", result.getError());
    }

    @Test
    void shouldRequireCallingAgent() {
        ToolResult result = tool.execute(null, Map.of("content", "x", "memory_type", "core")).join();

        assertEquals("No current agent", result.getError());
    }
}
