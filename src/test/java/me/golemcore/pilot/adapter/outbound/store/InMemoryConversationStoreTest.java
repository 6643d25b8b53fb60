package me.golemcore.pilot.adapter.outbound.store;

import me.golemcore.pilot.domain.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryConversationStoreTest {

    private static final String CONVERSATION_ID = "conv-1";

    private InMemoryConversationStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryConversationStore();
    }

    private static Message assistant(String content) {
        return Message.builder().role(Message.ROLE_ASSISTANT).content(content).build();
    }

    @Test
    void shouldAppendMessagesInOrder() {
        store.push(CONVERSATION_ID, assistant("first"));
        store.push(CONVERSATION_ID, assistant("second"));

        List<Message> messages = store.getMessages(CONVERSATION_ID);
        assertEquals(2, messages.size());
        assertEquals("first", messages.get(0).getContent());
        assertEquals("second", messages.get(1).getContent());
    }

    @Test
    void shouldUpdateOnlyLastMessage() {
        store.push(CONVERSATION_ID, assistant("first"));
        store.push(CONVERSATION_ID, assistant("live"));

        store.updateLast(CONVERSATION_ID, last -> last.toBuilder().content("live, updated").build());

        List<Message> messages = store.getMessages(CONVERSATION_ID);
        assertEquals("first", messages.get(0).getContent());
        assertEquals("live, updated", messages.get(1).getContent());
    }

    @Test
    void shouldLeaveContentUnchangedOnIdentityUpdate() {
        Message live = assistant("Navigated to https://example.com");
        store.push(CONVERSATION_ID, live);

        store.updateLast(CONVERSATION_ID, UnaryOperator.identity());
        store.updateLast(CONVERSATION_ID, UnaryOperator.identity());

        List<Message> messages = store.getMessages(CONVERSATION_ID);
        assertEquals(1, messages.size());
        assertEquals(live, messages.get(0));
    }

    @Test
    void shouldIgnoreNullUpdaterResult() {
        store.push(CONVERSATION_ID, assistant("live"));

        store.updateLast(CONVERSATION_ID, last -> null);

        assertEquals("live", store.getMessages(CONVERSATION_ID).get(0).getContent());
    }

    @Test
    void shouldIgnoreUpdateOfUnknownConversation() {
        store.updateLast("missing", last -> assistant("never"));

        assertTrue(store.getMessages("missing").isEmpty());
    }

    @Test
    void shouldReturnDetachedCopy() {
        store.push(CONVERSATION_ID, assistant("live"));

        List<Message> messages = store.getMessages(CONVERSATION_ID);

        assertThrows(UnsupportedOperationException.class, () -> messages.add(assistant("other")));
        assertEquals(1, store.getMessages(CONVERSATION_ID).size());
    }
}
