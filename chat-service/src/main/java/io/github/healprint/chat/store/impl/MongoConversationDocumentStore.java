package io.github.healprint.chat.store.impl;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.Updates;
import com.mongodb.client.result.InsertOneResult;
import io.github.healprint.chat.store.ConversationDocumentStore;
import io.github.healprint.chat.store.DocumentPatch;
import io.github.healprint.chat.store.SortOrder;
import io.github.healprint.chat.store.StoreUnavailableException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * MongoDB backed conversation store. Reads carry a server-side {@code maxTime}; writes are bounded
 * by the client socket and server-selection timeouts configured under {@code quarkus.mongodb}.
 */
@ApplicationScoped
public class MongoConversationDocumentStore implements ConversationDocumentStore {

    private static final Logger LOG = Logger.getLogger(MongoConversationDocumentStore.class);
    private static final String COLLECTION = "conversations";

    @Inject MongoClient mongoClient;

    @ConfigProperty(name = "healprint.store.database", defaultValue = "healprint")
    String databaseName;

    @ConfigProperty(name = "healprint.store.timeout", defaultValue = "PT10S")
    Duration timeout;

    private MongoCollection<Document> getCollection() {
        return mongoClient.getDatabase(databaseName).getCollection(COLLECTION);
    }

    @Override
    public Optional<Document> findOne(Document filter) {
        try {
            return Optional.ofNullable(
                    getCollection()
                            .find(toFilter(filter))
                            .maxTime(timeout.toMillis(), TimeUnit.MILLISECONDS)
                            .first());
        } catch (MongoException e) {
            throw unavailable("findOne", e);
        }
    }

    @Override
    public List<Document> find(Document filter, SortOrder sort, int limit) {
        try {
            var cursor =
                    getCollection()
                            .find(toFilter(filter))
                            .maxTime(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (sort != null) {
                cursor =
                        cursor.sort(
                                sort.descending()
                                        ? Sorts.descending(sort.field())
                                        : Sorts.ascending(sort.field()));
            }
            if (limit > 0) {
                cursor = cursor.limit(limit);
            }
            return cursor.into(new ArrayList<>());
        } catch (MongoException e) {
            throw unavailable("find", e);
        }
    }

    @Override
    public List<Document> findProjected(Document filter, Document excluded, List<String> fields) {
        List<Bson> clauses = new ArrayList<>();
        clauses.add(toFilter(filter));
        if (excluded != null) {
            excluded.forEach((field, value) -> clauses.add(Filters.ne(field, value)));
        }
        try {
            return getCollection()
                    .find(clauses.size() == 1 ? clauses.get(0) : Filters.and(clauses))
                    .projection(
                            Projections.fields(
                                    Projections.include(fields), Projections.excludeId()))
                    .maxTime(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .into(new ArrayList<>());
        } catch (MongoException e) {
            throw unavailable("findProjected", e);
        }
    }

    @Override
    public String insertOne(Document document) {
        try {
            InsertOneResult result = getCollection().insertOne(document);
            BsonValue id = result.getInsertedId();
            if (id == null) {
                return null;
            }
            return id.isObjectId() ? id.asObjectId().getValue().toHexString() : id.toString();
        } catch (MongoException e) {
            throw unavailable("insertOne", e);
        }
    }

    @Override
    public long updateOne(Document filter, DocumentPatch patch) {
        if (patch.isEmpty()) {
            return 0;
        }
        List<Bson> updates = new ArrayList<>();
        patch.sets().forEach((field, value) -> updates.add(Updates.set(field, value)));
        patch.pushes().forEach((field, value) -> updates.add(Updates.push(field, value)));
        patch.maxes().forEach((field, value) -> updates.add(Updates.max(field, value)));
        try {
            return getCollection()
                    .updateOne(toFilter(filter), Updates.combine(updates))
                    .getModifiedCount();
        } catch (MongoException e) {
            throw unavailable("updateOne", e);
        }
    }

    @Override
    public long deleteOne(Document filter) {
        try {
            return getCollection().deleteOne(toFilter(filter)).getDeletedCount();
        } catch (MongoException e) {
            throw unavailable("deleteOne", e);
        }
    }

    private static Bson toFilter(Document filter) {
        if (filter == null || filter.isEmpty()) {
            return new Document();
        }
        List<Bson> clauses = new ArrayList<>();
        filter.forEach((field, value) -> clauses.add(Filters.eq(field, value)));
        return clauses.size() == 1 ? clauses.get(0) : Filters.and(clauses);
    }

    private static StoreUnavailableException unavailable(String operation, MongoException e) {
        LOG.warnf(e, "MongoDB %s failed on collection %s", operation, COLLECTION);
        return new StoreUnavailableException(operation, e);
    }
}
