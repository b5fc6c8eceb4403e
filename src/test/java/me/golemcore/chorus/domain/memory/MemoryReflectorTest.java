package me.golemcore.chorus.domain.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.chorus.adapter.outbound.storage.InMemoryAgentRepository;
import me.golemcore.chorus.adapter.outbound.storage.InMemoryMemoryRepository;
import me.golemcore.chorus.domain.model.Agent;
import me.golemcore.chorus.domain.model.AgentMemory;
import me.golemcore.chorus.domain.model.MemoryType;
import me.golemcore.chorus.domain.model.ProviderErrorKind;
import me.golemcore.chorus.domain.service.AgentPromptService;
import me.golemcore.chorus.domain.service.StructuredOutputParser;
import me.golemcore.chorus.domain.turn.ProviderCallException;
import me.golemcore.chorus.infrastructure.config.ChorusProperties;
import me.golemcore.chorus.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MemoryReflectorTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private InMemoryAgentRepository agentRepository;
    private InMemoryMemoryRepository memoryRepository;
    private AgentPromptService promptService;
    private MemoryReflector reflector;
    private Agent ada;

    @BeforeEach
    void setUp() {
        agentRepository = new InMemoryAgentRepository();
        memoryRepository = new InMemoryMemoryRepository();
        promptService = mock(AgentPromptService.class);
        MemoryContextService contextService = new MemoryContextService(memoryRepository, new ChorusProperties(),
                new MutableClock(NOW));
        reflector = new MemoryReflector(agentRepository, memoryRepository, contextService, promptService,
                new StructuredOutputParser(new ObjectMapper()));
        ada = agentRepository.save(Agent.builder().id("ada").name("Ada").modelId("openai/gpt-4.1").build());
    }

    @Test
    void shouldSkipAgentWithoutLiveJournal() {
        memory("ada", MemoryType.JOURNAL, "too old", NOW.minus(Duration.ofDays(9)));

        assertEquals(0, reflector.reflect(ada));

        verify(promptService, never()).ask(any(), anyString(), anyString());
    }

    @Test
    void shouldPromoteChosenEntriesOnly() {
        AgentMemory first = memory("ada", MemoryType.JOURNAL, "Sam prefers mornings", NOW.minus(Duration.ofDays(2)));
        AgentMemory second = memory("ada", MemoryType.JOURNAL, "Lunch was pasta", NOW.minus(Duration.ofDays(1)));
        when(promptService.ask(eq(ada), anyString(), anyString())).thenReturn("{\"promote\": [1]}");

        assertEquals(1, reflector.reflect(ada));

        assertTrue(first.isCore());
        assertTrue(second.isJournal());
    }

    @Test
    void shouldIgnoreOutOfRangeAndDuplicateIndices() {
        AgentMemory only = memory("ada", MemoryType.JOURNAL, "Met Bo", NOW.minus(Duration.ofHours(3)));
        when(promptService.ask(eq(ada), anyString(), anyString())).thenReturn("{\"promote\": [0, 1, 1, 7, -2]}");

        assertEquals(1, reflector.reflect(ada));
        assertTrue(only.isCore());
    }

    @Test
    void shouldIgnoreIndicesBeyondIntRange() {
        AgentMemory only = memory("ada", MemoryType.JOURNAL, "Met Bo", NOW.minus(Duration.ofHours(3)));
        when(promptService.ask(eq(ada), anyString(), anyString()))
                .thenReturn("{\"promote\": [4294967297, \"99999999999\"]}");

        assertEquals(0, reflector.reflect(ada));
        assertTrue(only.isJournal());
    }

    @Test
    void shouldPromoteNothingOnUnparseableReply() {
        AgentMemory entry = memory("ada", MemoryType.JOURNAL, "Met Bo", NOW.minus(Duration.ofHours(3)));
        when(promptService.ask(eq(ada), anyString(), anyString())).thenReturn("Nothing seems important.");

        assertEquals(0, reflector.reflect(ada));
        assertTrue(entry.isJournal());
    }

    @Test
    void shouldNumberJournalInPromptAndShowCore() {
        memory("ada", MemoryType.CORE, "I value honesty", NOW.minus(Duration.ofDays(30)));
        memory("ada", MemoryType.JOURNAL, "Met Bo", Instant.parse("2026-03-09T08:00:00Z"));
        when(promptService.ask(eq(ada), anyString(), anyString())).thenReturn("{\"promote\": []}");

        reflector.reflect(ada);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(promptService).ask(eq(ada), anyString(), prompt.capture());
        assertTrue(prompt.getValue().contains("1. I value honesty"));
        assertTrue(prompt.getValue().contains("1. [2026-03-09] Met Bo"));
    }

    @Test
    void shouldContinueSweepAfterAgentFailure() {
        Agent bo = agentRepository.save(Agent.builder().id("bo").name("Bo").modelId("openai/gpt-4.1").build());
        memory("ada", MemoryType.JOURNAL, "Ada's note", NOW.minus(Duration.ofHours(1)));
        AgentMemory boNote = memory("bo", MemoryType.JOURNAL, "Bo's note", NOW.minus(Duration.ofHours(1)));
        when(promptService.ask(eq(ada), anyString(), anyString()))
                .thenThrow(new ProviderCallException(ProviderErrorKind.NETWORK, "timeout", null));
        when(promptService.ask(eq(bo), anyString(), anyString())).thenReturn("{\"promote\": [1]}");

        assertEquals(1, reflector.sweep());
        assertTrue(boNote.isCore());
    }

    private AgentMemory memory(String agentId, MemoryType type, String content, Instant createdAt) {
        return memoryRepository.create(AgentMemory.builder()
                .agentId(agentId)
                .memoryType(type)
                .content(content)
                .tokenEstimate(content.length() / 4)
                .createdAt(createdAt)
                .build());
    }
}
