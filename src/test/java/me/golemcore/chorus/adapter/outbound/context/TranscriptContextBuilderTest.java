package me.golemcore.chorus.adapter.outbound.context;

import me.golemcore.chorus.adapter.outbound.storage.InMemoryChatRepository;
import me.golemcore.chorus.adapter.outbound.storage.InMemoryMemoryRepository;
import me.golemcore.chorus.adapter.outbound.storage.InMemoryMessageRepository;
import me.golemcore.chorus.domain.memory.MemoryContextService;
import me.golemcore.chorus.domain.model.Agent;
import me.golemcore.chorus.domain.model.AgentMemory;
import me.golemcore.chorus.domain.model.Chat;
import me.golemcore.chorus.domain.model.LlmRequest;
import me.golemcore.chorus.domain.model.MemoryType;
import me.golemcore.chorus.domain.model.Message;
import me.golemcore.chorus.infrastructure.config.ChorusProperties;
import me.golemcore.chorus.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TranscriptContextBuilderTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private InMemoryMessageRepository messageRepository;
    private InMemoryMemoryRepository memoryRepository;
    private TranscriptContextBuilder builder;
    private Agent ada;
    private Chat chat;

    @BeforeEach
    void setUp() {
        messageRepository = new InMemoryMessageRepository(new InMemoryChatRepository());
        memoryRepository = new InMemoryMemoryRepository();
        builder = new TranscriptContextBuilder(messageRepository,
                new MemoryContextService(memoryRepository, new ChorusProperties(), new MutableClock(NOW)));
        ada = Agent.builder().id("ada").name("Ada").systemPrompt("You are Ada.").build();
        chat = Chat.builder().id("chat-1").manualResponses(true).agentIds(List.of("ada", "bo")).build();
    }

    @Test
    void shouldRenderOtherVoicesAsNamedUserMessages() {
        add(Message.ROLE_USER, null, "Sam", "Morning all!");
        add(Message.ROLE_ASSISTANT, "bo", "Bo", "Hi Sam.");
        add(Message.ROLE_ASSISTANT, "ada", "Ada", "Good morning.");
        add(Message.ROLE_TOOL, "ada", null, "tool output");
        add(Message.ROLE_ASSISTANT, "bo", "Bo", " ");

        LlmRequest request = builder.buildContext(chat, ada, null).build();

        List<Message> history = request.getMessages();
        assertEquals(3, history.size());
        assertEquals("[Sam]: Morning all!", history.get(0).getContent());
        assertTrue(history.get(0).isUserMessage());
        assertEquals("[Bo]: Hi Sam.", history.get(1).getContent());
        assertTrue(history.get(1).isUserMessage());
        assertEquals("Good morning.", history.get(2).getContent());
        assertTrue(history.get(2).isAssistantMessage());
    }

    @Test
    void shouldComposeSystemPromptWithMemoryAndGroupNote() {
        memoryRepository.create(AgentMemory.builder().agentId("ada").memoryType(MemoryType.CORE)
                .content("Sam is my teammate").createdAt(NOW).build());

        String system = builder.buildContext(chat, ada, null).build().getSystemPrompt();

        assertTrue(system.startsWith("You are Ada."));
        assertTrue(system.contains("- Sam is my teammate"));
        assertTrue(system.contains("You are Ada in a group conversation."));
        assertFalse(system.contains("# Why you are speaking now"));
    }

    @Test
    void shouldExplainSelfInitiatedTurn() {
        String system = builder.buildContext(chat, ada, "follow up on the launch").build().getSystemPrompt();

        assertTrue(system.contains("# Why you are speaking now"));
        assertTrue(system.contains("Your reason: follow up on the launch"));
    }

    @Test
    void shouldOmitGroupNoteInDirectChat() {
        Chat direct = Chat.builder().id("chat-2").agentIds(List.of("ada")).build();

        String system = builder.buildContext(direct, ada, null).build().getSystemPrompt();

        assertEquals("You are Ada.", system);
    }

    private void add(String role, String agentId, String author, String content) {
        messageRepository.create(Message.builder()
                .chatId("chat-1")
                .role(role)
                .agentId(agentId)
                .authorName(author)
                .content(content)
                .createdAt(NOW)
                .build());
    }
}
