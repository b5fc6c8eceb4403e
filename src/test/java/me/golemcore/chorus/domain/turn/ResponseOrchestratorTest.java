package me.golemcore.chorus.domain.turn;

import me.golemcore.chorus.adapter.outbound.storage.InMemoryChatRepository;
import me.golemcore.chorus.adapter.outbound.storage.InMemoryMessageRepository;
import me.golemcore.chorus.domain.model.Agent;
import me.golemcore.chorus.domain.model.Chat;
import me.golemcore.chorus.domain.model.LlmEvent;
import me.golemcore.chorus.domain.model.LlmRequest;
import me.golemcore.chorus.domain.model.LlmResponse;
import me.golemcore.chorus.domain.model.LlmUsage;
import me.golemcore.chorus.domain.model.Message;
import me.golemcore.chorus.domain.model.Provider;
import me.golemcore.chorus.domain.model.ProviderErrorKind;
import me.golemcore.chorus.domain.model.ProviderSelection;
import me.golemcore.chorus.domain.model.RetryPolicy;
import me.golemcore.chorus.domain.model.RuntimeEvent;
import me.golemcore.chorus.domain.model.RuntimeEventType;
import me.golemcore.chorus.domain.model.ThinkingConfig;
import me.golemcore.chorus.domain.model.TurnOutcome;
import me.golemcore.chorus.domain.provider.MissingCapabilityException;
import me.golemcore.chorus.domain.provider.ProviderSelector;
import me.golemcore.chorus.domain.provider.UnsupportedThinkingException;
import me.golemcore.chorus.infrastructure.config.ChorusProperties;
import me.golemcore.chorus.port.outbound.AgentRepositoryPort;
import me.golemcore.chorus.port.outbound.ChatRepositoryPort;
import me.golemcore.chorus.port.outbound.ContextBuilderPort;
import me.golemcore.chorus.port.outbound.LlmPort;
import me.golemcore.chorus.port.outbound.TaskQueuePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResponseOrchestratorTest {

    private static final String CHAT_ID = "chat-1";
    private static final String AGENT_ID = "agent-a";
    private static final String MODEL = "anthropic/claude-sonnet-4";

    private ChatRepositoryPort chatRepository;
    private AgentRepositoryPort agentRepository;
    private InMemoryMessageRepository messageRepository;
    private ContextBuilderPort contextBuilder;
    private LlmPort llmPort;
    private ProviderSelector providerSelector;
    private ToolCatalog toolCatalog;
    private TaskQueuePort taskQueue;
    private TurnRetryPolicy turnRetryPolicy;
    private List<RuntimeEvent> broadcasts;
    private Agent agent;
    private ResponseOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        chatRepository = mock(ChatRepositoryPort.class);
        agentRepository = mock(AgentRepositoryPort.class);
        messageRepository = new InMemoryMessageRepository(new InMemoryChatRepository());
        contextBuilder = mock(ContextBuilderPort.class);
        llmPort = mock(LlmPort.class);
        providerSelector = mock(ProviderSelector.class);
        toolCatalog = mock(ToolCatalog.class);
        taskQueue = mock(TaskQueuePort.class);
        turnRetryPolicy = mock(TurnRetryPolicy.class);
        broadcasts = new ArrayList<>();
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

        agent = Agent.builder().id(AGENT_ID).accountId("acc-1").name("Ada").modelId(MODEL).build();
        when(chatRepository.findById(CHAT_ID)).thenReturn(Optional.of(Chat.builder().id(CHAT_ID).build()));
        when(agentRepository.findById(AGENT_ID)).thenReturn(Optional.of(agent));
        when(contextBuilder.buildContext(any(), any(), any())).thenAnswer(inv -> LlmRequest.builder()
                .systemPrompt("You are Ada"));
        when(providerSelector.selectForAgent(agent))
                .thenReturn(new ProviderSelection(Provider.OPENROUTER, MODEL, MODEL));
        when(toolCatalog.toolsFor(agent)).thenReturn(List.of());

        orchestrator = new ResponseOrchestrator(chatRepository, agentRepository, messageRepository,
                contextBuilder, llmPort, providerSelector, toolCatalog, broadcasts::add, taskQueue,
                turnRetryPolicy, event -> {
                }, new ChorusProperties(), clock);
    }

    @Test
    void shouldPersistFinalReplyOfCompletedTurn() {
        when(llmPort.stream(any())).thenReturn(Flux.just(
                new LlmEvent.NewMessage(),
                new LlmEvent.ContentDelta("Hello"),
                LlmEvent.EndMessage.reply(LlmResponse.builder()
                        .content("Hello")
                        .model(MODEL)
                        .usage(LlmUsage.builder().inputTokens(12).outputTokens(2).totalTokens(14).build())
                        .finishReason("STOP")
                        .build())));

        TurnOutcome outcome = orchestrator.runTurn(CHAT_ID, AGENT_ID, null);

        assertEquals(TurnOutcome.COMPLETED, outcome);
        List<Message> messages = messageRepository.findAfter(CHAT_ID, null);
        assertEquals(1, messages.size());
        assertEquals("Hello", messages.get(0).getContent());
        assertEquals(12, messages.get(0).getInputTokens());
        assertEquals(2, messages.get(0).getOutputTokens());
    }

    @Test
    void shouldPassInitiationReasonAndToolContextToRequest() {
        when(llmPort.stream(any())).thenReturn(Flux.empty());

        orchestrator.runTurn(CHAT_ID, AGENT_ID, "following up on the launch");

        verify(contextBuilder).buildContext(any(), eq(agent), eq("following up on the launch"));
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).stream(captor.capture());
        assertEquals(AGENT_ID, captor.getValue().getToolContext().agentId());
        assertEquals(CHAT_ID, captor.getValue().getToolContext().chatId());
        assertNull(captor.getValue().getThinking());
    }

    @Test
    void shouldDiscardEmptyPartialAndRefreshRegistryOnUnknownModel() {
        when(llmPort.stream(any())).thenReturn(Flux.concat(
                Flux.just(new LlmEvent.NewMessage()),
                Flux.error(new ProviderCallException(ProviderErrorKind.MODEL_NOT_FOUND, "no such model", null))));

        assertThrows(ProviderCallException.class, () -> orchestrator.runTurn(CHAT_ID, AGENT_ID, null));

        assertTrue(messageRepository.findAfter(CHAT_ID, null).isEmpty());
        verify(llmPort).refreshModelRegistry();
        RuntimeEvent error = broadcasts.stream()
                .filter(event -> event.type() == RuntimeEventType.TURN_ERROR)
                .findFirst()
                .orElseThrow();
        assertEquals("model_not_found", error.payload().get("code"));
    }

    @Test
    void shouldNotRefreshRegistryOnRateLimit() {
        when(llmPort.stream(any())).thenReturn(
                Flux.error(new ProviderCallException(ProviderErrorKind.RATE_LIMIT, "slow down", null)));

        assertThrows(ProviderCallException.class, () -> orchestrator.runTurn(CHAT_ID, AGENT_ID, null));

        verify(llmPort, never()).refreshModelRegistry();
    }

    @Test
    void shouldAbortWithoutModelCallWhenCapabilityMissing() {
        when(providerSelector.selectForAgent(agent)).thenThrow(new MissingCapabilityException("no key"));

        TurnOutcome outcome = orchestrator.runTurn(CHAT_ID, AGENT_ID, null);

        assertEquals(TurnOutcome.ABORTED, outcome);
        verify(llmPort, never()).stream(any());
        assertEquals(RuntimeEventType.TURN_ERROR, broadcasts.get(0).type());
        assertEquals("missing_capability", broadcasts.get(0).payload().get("code"));
    }

    @Test
    void shouldConfigureThinkingForDirectSelection() {
        agent.setThinkingBudget(10000);
        ProviderSelection direct = new ProviderSelection(Provider.ANTHROPIC, "claude-sonnet-4-20250514", MODEL);
        ThinkingConfig thinking = ThinkingConfig.structured(10000);
        when(providerSelector.selectForAgent(agent)).thenReturn(direct);
        when(providerSelector.configureThinking(direct, 10000)).thenReturn(thinking);
        when(llmPort.stream(any())).thenReturn(Flux.empty());

        orchestrator.runTurn(CHAT_ID, AGENT_ID, null);

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).stream(captor.capture());
        assertSame(thinking, captor.getValue().getThinking());
    }

    @Test
    void shouldConfigureEffortThinkingForAggregatedSelection() {
        agent.setThinkingBudget(4000);
        ProviderSelection aggregated = new ProviderSelection(Provider.OPENROUTER, "x-ai/grok-4", "x-ai/grok-4");
        ThinkingConfig thinking = ThinkingConfig.builder()
                .mode(ThinkingConfig.Mode.RAW_EFFORT)
                .effort("medium")
                .maxCompletionTokens(12000)
                .build();
        when(providerSelector.selectForAgent(agent)).thenReturn(aggregated);
        when(providerSelector.configureThinking(aggregated, 4000)).thenReturn(thinking);
        when(llmPort.stream(any())).thenReturn(Flux.empty());

        orchestrator.runTurn(CHAT_ID, AGENT_ID, null);

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).stream(captor.capture());
        assertSame(thinking, captor.getValue().getThinking());
    }

    @Test
    void shouldRunWithoutThinkingWhenProviderHasNoThinkingSupport() {
        agent.setThinkingBudget(10000);
        ProviderSelection direct = new ProviderSelection(Provider.GEMINI, "gemini-2.5-pro", "google/gemini-2.5-pro");
        when(providerSelector.selectForAgent(agent)).thenReturn(direct);
        when(providerSelector.configureThinking(eq(direct), anyInt()))
                .thenThrow(new UnsupportedThinkingException("none"));
        when(llmPort.stream(any())).thenReturn(Flux.empty());

        assertEquals(TurnOutcome.COMPLETED, orchestrator.runTurn(CHAT_ID, AGENT_ID, null));
    }

    @Test
    void shouldFailForUnknownChat() {
        when(chatRepository.findById("missing")).thenReturn(Optional.empty());

        assertThrows(IllegalArgumentException.class, () -> orchestrator.runTurn("missing", AGENT_ID, null));
    }

    @Test
    void shouldScheduleTurnWithTurnRetryPolicy() {
        RetryPolicy policy = RetryPolicy.none();
        when(turnRetryPolicy.policy()).thenReturn(policy);

        orchestrator.schedule(CHAT_ID, AGENT_ID, null, Duration.ofSeconds(3));

        verify(taskQueue).submit(any(TaskQueuePort.QueuedTask.class), eq(Duration.ofSeconds(3)), eq(policy));
        verify(llmPort, never()).stream(any());
        verify(contextBuilder, never()).buildContext(any(), any(), isNull());
    }
}
