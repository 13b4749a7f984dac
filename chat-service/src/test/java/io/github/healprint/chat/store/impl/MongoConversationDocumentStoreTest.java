package io.github.healprint.chat.store.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mongodb.MongoSocketReadTimeoutException;
import com.mongodb.ServerAddress;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import io.github.healprint.chat.store.DocumentPatch;
import io.github.healprint.chat.store.StoreUnavailableException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.bson.BsonDocument;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class MongoConversationDocumentStoreTest {

    private MongoCollection<Document> collection;
    private MongoConversationDocumentStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        MongoClient client = mock(MongoClient.class);
        MongoDatabase database = mock(MongoDatabase.class);
        collection = mock(MongoCollection.class);
        when(client.getDatabase("healprint")).thenReturn(database);
        when(database.getCollection("conversations")).thenReturn(collection);

        store = new MongoConversationDocumentStore();
        store.mongoClient = client;
        store.databaseName = "healprint";
        store.timeout = Duration.ofSeconds(10);
    }

    @Test
    @SuppressWarnings("unchecked")
    void findOneAppliesServerTimeout() {
        FindIterable<Document> iterable = mock(FindIterable.class);
        when(collection.find(any(Bson.class))).thenReturn(iterable);
        when(iterable.maxTime(anyLong(), eq(TimeUnit.MILLISECONDS))).thenReturn(iterable);
        when(iterable.first()).thenReturn(new Document("conversation_id", "c1"));

        Optional<Document> found = store.findOne(new Document("conversation_id", "c1"));

        assertTrue(found.isPresent());
        verify(iterable).maxTime(10_000L, TimeUnit.MILLISECONDS);
    }

    @Test
    @SuppressWarnings("unchecked")
    void projectedFindExcludesValuesAndLimitsFields() {
        FindIterable<Document> iterable = mock(FindIterable.class);
        when(collection.find(any(Bson.class))).thenReturn(iterable);
        when(iterable.projection(any(Bson.class))).thenReturn(iterable);
        when(iterable.maxTime(anyLong(), eq(TimeUnit.MILLISECONDS))).thenReturn(iterable);
        when(iterable.into(any())).thenAnswer(invocation -> invocation.getArgument(0));

        store.findProjected(
                new Document("user_id", "u1"),
                new Document("assessment_stage", "completed"),
                List.of("conversation_id"));

        ArgumentCaptor<Bson> filter = ArgumentCaptor.forClass(Bson.class);
        verify(collection).find(filter.capture());
        BsonDocument rendered = filter.getValue().toBsonDocument();
        assertTrue(rendered.toJson().contains("\"$ne\": \"completed\""));
        assertTrue(rendered.toJson().contains("\"user_id\": \"u1\""));

        ArgumentCaptor<Bson> projection = ArgumentCaptor.forClass(Bson.class);
        verify(iterable).projection(projection.capture());
        BsonDocument fields = projection.getValue().toBsonDocument();
        assertEquals(1, fields.getInt32("conversation_id").getValue());
        assertEquals(0, fields.getInt32("_id").getValue());
        verify(iterable).maxTime(10_000L, TimeUnit.MILLISECONDS);
    }

    @Test
    void updateCombinesPatchOperators() {
        when(collection.updateOne(any(Bson.class), any(Bson.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        long modified =
                store.updateOne(
                        new Document("conversation_id", "c1"),
                        DocumentPatch.create()
                                .push("messages", new Document("role", "user"))
                                .set("last_message", "hi")
                                .max("updated_at", 5L));

        assertEquals(1L, modified);
        ArgumentCaptor<Bson> update = ArgumentCaptor.forClass(Bson.class);
        verify(collection).updateOne(any(Bson.class), update.capture());
        BsonDocument rendered = update.getValue().toBsonDocument();
        assertTrue(rendered.containsKey("$set"));
        assertTrue(rendered.containsKey("$push"));
        assertTrue(rendered.containsKey("$max"));
    }

    @Test
    void emptyPatchIsNotSent() {
        assertEquals(0L, store.updateOne(new Document("conversation_id", "c1"), DocumentPatch.create()));
        verify(collection, never()).updateOne(any(Bson.class), any(Bson.class));
    }

    @Test
    void deleteReturnsDeletedCount() {
        when(collection.deleteOne(any(Bson.class))).thenReturn(DeleteResult.acknowledged(0));

        assertEquals(0L, store.deleteOne(new Document("conversation_id", "missing")));
    }

    @Test
    void driverFailuresBecomeStoreUnavailable() {
        when(collection.deleteOne(any(Bson.class)))
                .thenThrow(
                        new MongoSocketReadTimeoutException(
                                "read timed out", new ServerAddress(), new RuntimeException()));

        StoreUnavailableException e =
                assertThrows(
                        StoreUnavailableException.class,
                        () -> store.deleteOne(new Document("conversation_id", "c1")));
        assertEquals("deleteOne", e.getOperation());
    }
}
