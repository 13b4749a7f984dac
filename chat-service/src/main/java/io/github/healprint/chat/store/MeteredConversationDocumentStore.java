package io.github.healprint.chat.store;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import org.bson.Document;

/**
 * Decorator that wraps a ConversationDocumentStore with timing metrics. Every operation is
 * recorded with the Micrometer timer "healprint.store.operation" tagged by "operation".
 */
public class MeteredConversationDocumentStore implements ConversationDocumentStore {

    private static final String METRIC = "healprint.store.operation";

    private final MeterRegistry registry;
    private final ConversationDocumentStore delegate;

    public MeteredConversationDocumentStore(
            MeterRegistry registry, ConversationDocumentStore delegate) {
        this.registry = registry;
        this.delegate = delegate;
    }

    @Override
    public Optional<Document> findOne(Document filter) {
        return registry.timer(METRIC, "operation", "findOne")
                .record(() -> delegate.findOne(filter));
    }

    @Override
    public List<Document> find(Document filter, SortOrder sort, int limit) {
        return registry.timer(METRIC, "operation", "find")
                .record(() -> delegate.find(filter, sort, limit));
    }

    @Override
    public List<Document> findProjected(Document filter, Document excluded, List<String> fields) {
        return registry.timer(METRIC, "operation", "findProjected")
                .record(() -> delegate.findProjected(filter, excluded, fields));
    }

    @Override
    public String insertOne(Document document) {
        return registry.timer(METRIC, "operation", "insertOne")
                .record(() -> delegate.insertOne(document));
    }

    @Override
    public long updateOne(Document filter, DocumentPatch patch) {
        Long modified =
                registry.timer(METRIC, "operation", "updateOne")
                        .record(() -> delegate.updateOne(filter, patch));
        return modified != null ? modified : 0L;
    }

    @Override
    public long deleteOne(Document filter) {
        Long deleted =
                registry.timer(METRIC, "operation", "deleteOne")
                        .record(() -> delegate.deleteOne(filter));
        return deleted != null ? deleted : 0L;
    }
}
