package io.github.healprint.chat.store;

import java.util.List;
import java.util.Optional;
import org.bson.Document;

/**
 * Durable storage for conversation documents. Filters are field equality matches; an empty filter
 * matches every document.
 *
 * <p>Implementations throw {@link StoreUnavailableException} when the backend cannot serve the
 * call, including when the call times out.
 */
public interface ConversationDocumentStore {

    Optional<Document> findOne(Document filter);

    /**
     * Returns matching documents ordered by {@code sort}. A {@code limit} of zero or less returns
     * every match.
     */
    List<Document> find(Document filter, SortOrder sort, int limit);

    /**
     * Returns only {@code fields} of the documents that match {@code filter} and differ from every
     * field of {@code excluded}. An empty {@code excluded} applies no exclusion.
     */
    List<Document> findProjected(Document filter, Document excluded, List<String> fields);

    /** Inserts the document and returns the backend identifier assigned to it. */
    String insertOne(Document document);

    /** Applies the patch to the first matching document and returns the modified count. */
    long updateOne(Document filter, DocumentPatch patch);

    long deleteOne(Document filter);
}
