package me.golemcore.chorus.adapter.outbound.storage;

import me.golemcore.chorus.domain.model.Chat;
import me.golemcore.chorus.domain.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryMessageRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private InMemoryChatRepository chatRepository;
    private InMemoryMessageRepository repository;

    @BeforeEach
    void setUp() {
        chatRepository = new InMemoryChatRepository();
        repository = new InMemoryMessageRepository(chatRepository);
    }

    @Test
    void shouldAssignIncreasingIds() {
        Message first = repository.create(userMessage("chat-1", "a", NOW));
        Message second = repository.create(userMessage("chat-1", "b", NOW));

        assertTrue(second.getId() > first.getId());
    }

    @Test
    void shouldListMessagesAfterWatermarkInOrder() {
        Message first = repository.create(userMessage("chat-1", "first", NOW));
        repository.create(userMessage("chat-1", "second", NOW.plusSeconds(1)));
        repository.create(userMessage("chat-1", "third", NOW.plusSeconds(2)));
        repository.create(userMessage("chat-2", "other", NOW.plusSeconds(3)));

        List<Message> after = repository.findAfter("chat-1", first.getId());

        assertEquals(List.of("second", "third"), after.stream().map(Message::getContent).toList());
        assertEquals("third", repository.findLatest("chat-1").orElseThrow().getContent());
    }

    @Test
    void shouldRejectUpdateOfUnknownMessage() {
        Message stray = Message.builder().id(42L).chatId("chat-1").build();

        assertThrows(IllegalArgumentException.class, () -> repository.update(stray));
    }

    @Test
    void shouldForgetDeletedMessage() {
        Message message = repository.create(userMessage("chat-1", "oops", NOW));

        repository.delete(message.getId());

        assertTrue(repository.findById(message.getId()).isEmpty());
    }

    @Test
    void shouldIgnoreAgentAuthoredMessagesForHumanActivity() {
        repository.create(Message.builder().chatId("chat-1").role(Message.ROLE_ASSISTANT).agentId("ada")
                .content("hi").createdAt(NOW).build());
        repository.create(Message.builder().chatId("chat-1").role(Message.ROLE_USER).agentId("ada")
                .content("opening").createdAt(NOW).build());

        assertFalse(repository.hasHumanMessageSince("chat-1", NOW.minusSeconds(60)));
    }

    @Test
    void shouldDetectHumanActivityAcrossAccountChats() {
        chatRepository.save(Chat.builder().id("chat-1").accountId("acc").createdAt(NOW).build());
        chatRepository.save(Chat.builder().id("chat-2").accountId("acc").createdAt(NOW).build());
        repository.create(userMessage("chat-2", "hello", NOW));

        assertTrue(repository.existsHumanMessageForAccountSince("acc", NOW));
        assertFalse(repository.existsHumanMessageForAccountSince("acc", NOW.plusSeconds(1)));
        assertFalse(repository.existsHumanMessageForAccountSince("other", NOW.minusSeconds(60)));
    }

    private static Message userMessage(String chatId, String content, Instant createdAt) {
        return Message.builder()
                .chatId(chatId)
                .role(Message.ROLE_USER)
                .content(content)
                .createdAt(createdAt)
                .build();
    }
}
