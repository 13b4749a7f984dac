package io.github.healprint.chat.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.bson.Document;
import org.junit.jupiter.api.Test;

class MeteredConversationDocumentStoreTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final InMemoryConversationDocumentStore delegate =
            new InMemoryConversationDocumentStore();
    private final MeteredConversationDocumentStore store =
            new MeteredConversationDocumentStore(registry, delegate);

    @Test
    void recordsOneTimerPerOperation() {
        store.insertOne(new Document("conversation_id", "c1").append("user_id", "u1"));
        store.findOne(new Document("conversation_id", "c1"));
        store.findOne(new Document("conversation_id", "c1"));
        long modified =
                store.updateOne(
                        new Document("conversation_id", "c1"),
                        DocumentPatch.create().set("title", "Skin"));
        long deleted = store.deleteOne(new Document("conversation_id", "c1"));

        assertEquals(1, modified);
        assertEquals(1, deleted);
        assertEquals(1, timerCount("insertOne"));
        assertEquals(2, timerCount("findOne"));
        assertEquals(1, timerCount("updateOne"));
        assertEquals(1, timerCount("deleteOne"));
    }

    @Test
    void passesStoreFailuresThrough() {
        delegate.setFailing(true);

        StoreUnavailableException e =
                assertThrows(
                        StoreUnavailableException.class,
                        () -> store.find(new Document("user_id", "u1"), null, 0));
        assertEquals("find", e.getOperation());
        assertTrue(timerCount("find") >= 1);
    }

    private long timerCount(String operation) {
        return registry.timer("healprint.store.operation", "operation", operation).count();
    }
}
