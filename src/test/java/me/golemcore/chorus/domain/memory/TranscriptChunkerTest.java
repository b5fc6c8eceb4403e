package me.golemcore.chorus.domain.memory;

import me.golemcore.chorus.domain.model.Message;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TranscriptChunkerTest {

    @Test
    void shouldReturnNoChunksForEmptyTranscript() {
        assertTrue(TranscriptChunker.chunk(List.of(), 100, Message::getContent).isEmpty());
    }

    @Test
    void shouldKeepSmallTranscriptInOneChunk() {
        List<Message> messages = List.of(message("a".repeat(40)), message("b".repeat(40)));

        List<List<Message>> chunks = TranscriptChunker.chunk(messages, 100, Message::getContent);

        assertEquals(1, chunks.size());
        assertEquals(2, chunks.get(0).size());
    }

    @Test
    void shouldSplitWhenTargetWouldBeExceeded() {
        List<Message> messages = List.of(message("a".repeat(40)), message("b".repeat(40)),
                message("c".repeat(40)));

        List<List<Message>> chunks = TranscriptChunker.chunk(messages, 20, Message::getContent);

        assertEquals(2, chunks.size());
        assertEquals(2, chunks.get(0).size());
        assertEquals(1, chunks.get(1).size());
    }

    @Test
    void shouldNeverSplitSingleOversizedMessage() {
        List<Message> messages = List.of(message("x".repeat(400)), message("y"));

        List<List<Message>> chunks = TranscriptChunker.chunk(messages, 10, Message::getContent);

        assertEquals(2, chunks.size());
        assertEquals(1, chunks.get(0).size());
        assertEquals("y", chunks.get(1).get(0).getContent());
    }

    private static Message message(String content) {
        return Message.builder().role(Message.ROLE_USER).content(content).build();
    }
}
