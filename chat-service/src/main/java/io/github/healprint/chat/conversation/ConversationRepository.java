package io.github.healprint.chat.conversation;

import static io.github.healprint.chat.conversation.ConversationDocuments.ASSESSMENT_STAGE;
import static io.github.healprint.chat.conversation.ConversationDocuments.CONVERSATION_ID;
import static io.github.healprint.chat.conversation.ConversationDocuments.LAST_MESSAGE;
import static io.github.healprint.chat.conversation.ConversationDocuments.MESSAGES;
import static io.github.healprint.chat.conversation.ConversationDocuments.NEEDS_DIAGNOSIS;
import static io.github.healprint.chat.conversation.ConversationDocuments.SYMPTOMS_COLLECTED;
import static io.github.healprint.chat.conversation.ConversationDocuments.UPDATED_AT;
import static io.github.healprint.chat.conversation.ConversationDocuments.USER_ID;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.healprint.chat.api.dto.ConversationDto;
import io.github.healprint.chat.api.dto.ConversationSummaryDto;
import io.github.healprint.chat.api.dto.MessageDto;
import io.github.healprint.chat.cache.CacheLookup;
import io.github.healprint.chat.cache.SessionCache;
import io.github.healprint.chat.cache.SessionCacheKeys;
import io.github.healprint.chat.cache.SessionCacheSelector;
import io.github.healprint.chat.config.DocumentStoreSelector;
import io.github.healprint.chat.model.AssessmentStage;
import io.github.healprint.chat.store.ConversationDocumentStore;
import io.github.healprint.chat.store.DocumentPatch;
import io.github.healprint.chat.store.SortOrder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import org.bson.Document;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Conversation persistence with a cache-aside read path. The document store is the source of
 * truth; every write invalidates the affected cache keys after the store accepted it. Cache
 * failures are logged and never surface to callers; store failures propagate as {@link
 * io.github.healprint.chat.store.StoreUnavailableException}.
 */
@ApplicationScoped
public class ConversationRepository {

    private static final Logger LOG = Logger.getLogger(ConversationRepository.class);

    static final int USER_CONVERSATION_LIMIT = 50;
    static final String DEFAULT_TITLE = "New Conversation";

    private static final TypeReference<List<ConversationSummaryDto>> SUMMARY_LIST =
            new TypeReference<>() {};

    private final ConversationDocumentStore store;
    private final SessionCache cache;
    private final ObjectMapper objectMapper;
    private final Duration cacheTtl;
    private final Clock clock;

    @Inject
    public ConversationRepository(
            DocumentStoreSelector storeSelector,
            SessionCacheSelector cacheSelector,
            ObjectMapper objectMapper,
            @ConfigProperty(name = "healprint.cache.ttl", defaultValue = "PT24H") Duration cacheTtl) {
        this(
                storeSelector.getStore(),
                cacheSelector.select(),
                objectMapper,
                cacheTtl,
                Clock.systemUTC());
    }

    public ConversationRepository(
            ConversationDocumentStore store,
            SessionCache cache,
            ObjectMapper objectMapper,
            Duration cacheTtl,
            Clock clock) {
        this.store = store;
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.cacheTtl = cacheTtl;
        this.clock = clock;
    }

    public Optional<ConversationDto> getConversation(String conversationId) {
        String key = SessionCacheKeys.conversation(conversationId);
        Optional<ConversationDto> cached = readCached(key, ConversationDto.class);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<Document> doc = store.findOne(ConversationDocuments.byId(conversationId));
        if (doc.isEmpty()) {
            return Optional.empty();
        }
        ConversationDto conversation = ConversationDocuments.toConversation(doc.get());
        writeCached(key, conversation);
        return Optional.of(conversation);
    }

    /** Returns the user's most recently updated conversations, newest first. */
    public List<ConversationSummaryDto> getUserConversations(String userId) {
        String key = SessionCacheKeys.userConversations(userId);
        CacheLookup lookup = cache.get(key);
        if (lookup.isHit()) {
            try {
                return objectMapper.readValue(lookup.value(), SUMMARY_LIST);
            } catch (JsonProcessingException e) {
                LOG.warnf(e, "Discarding unreadable cache entry %s", key);
                cache.delete(key);
            }
        }
        List<ConversationSummaryDto> summaries =
                store
                        .find(
                                ConversationDocuments.byUser(userId),
                                SortOrder.descending(UPDATED_AT),
                                USER_CONVERSATION_LIMIT)
                        .stream()
                        .map(ConversationDocuments::toSummary)
                        .toList();
        writeCached(key, summaries);
        return summaries;
    }

    /**
     * Starts a new conversation for the user. Every conversation of the user that is still open
     * is completed first, so the new one is the only active conversation.
     */
    public ConversationDto createConversation(String userId, String title) {
        completeActiveConversations(userId);

        Instant now = now();
        String conversationId = allocateId(userId, now);
        String resolvedTitle = title == null || title.isBlank() ? DEFAULT_TITLE : title;
        Document doc =
                ConversationDocuments.newConversation(conversationId, userId, resolvedTitle, now);
        store.insertOne(doc);
        invalidate(SessionCacheKeys.userConversations(userId));
        LOG.infof("Created conversation %s for user %s", conversationId, userId);
        return ConversationDocuments.toConversation(doc);
    }

    /**
     * Moves every non-completed conversation of the user to completed and returns the count.
     * {@code updated_at} is left alone so the user's list stays ordered by message activity.
     */
    public int completeActiveConversations(String userId) {
        int completed = 0;
        List<Document> active =
                store.findProjected(
                        ConversationDocuments.byUser(userId),
                        new Document(ASSESSMENT_STAGE, AssessmentStage.COMPLETED.toValue()),
                        List.of(CONVERSATION_ID));
        for (Document doc : active) {
            String conversationId = doc.getString(CONVERSATION_ID);
            DocumentPatch patch =
                    DocumentPatch.create()
                            .set(ASSESSMENT_STAGE, AssessmentStage.COMPLETED.toValue())
                            .set(NEEDS_DIAGNOSIS, false);
            if (store.updateOne(ConversationDocuments.byId(conversationId), patch) > 0) {
                completed++;
            }
            invalidate(SessionCacheKeys.conversation(conversationId));
        }
        if (completed > 0) {
            invalidate(SessionCacheKeys.userConversations(userId));
            LOG.infof("Completed %d active conversation(s) for user %s", completed, userId);
        }
        return completed;
    }

    /**
     * Appends {@code message} and applies {@code delta}. Returns false if no conversation with
     * that id exists.
     */
    public boolean updateConversation(
            String conversationId, MessageDto message, AssessmentDelta delta) {
        DocumentPatch patch =
                DocumentPatch.create()
                        .push(MESSAGES, ConversationDocuments.toDocument(message))
                        .set(LAST_MESSAGE, ConversationDocuments.preview(message.getContent()))
                        .max(UPDATED_AT, ConversationDocuments.toDate(now()));
        if (delta != null) {
            if (delta.stage() != null) {
                patch.set(ASSESSMENT_STAGE, delta.stage().toValue());
            }
            if (delta.symptoms() != null) {
                patch.set(SYMPTOMS_COLLECTED, ConversationDocuments.toDocument(delta.symptoms()));
            }
            if (delta.needsDiagnosis() != null) {
                patch.set(NEEDS_DIAGNOSIS, delta.needsDiagnosis());
            }
        }

        long modified = store.updateOne(ConversationDocuments.byId(conversationId), patch);
        if (modified == 0) {
            return false;
        }
        invalidate(SessionCacheKeys.conversation(conversationId));
        store.findOne(ConversationDocuments.byId(conversationId))
                .map(doc -> doc.getString(USER_ID))
                .ifPresent(userId -> invalidate(SessionCacheKeys.userConversations(userId)));
        return true;
    }

    public boolean deleteConversation(String conversationId) {
        Optional<String> userId =
                store.findOne(ConversationDocuments.byId(conversationId))
                        .map(doc -> doc.getString(USER_ID));
        if (userId.isEmpty()) {
            return false;
        }
        long deleted = store.deleteOne(ConversationDocuments.byId(conversationId));
        invalidate(SessionCacheKeys.conversation(conversationId));
        invalidate(SessionCacheKeys.userConversations(userId.get()));
        if (deleted > 0) {
            LOG.infof("Deleted conversation %s", conversationId);
        }
        return deleted > 0;
    }

    private String allocateId(String userId, Instant now) {
        String base = "conv_" + userId + "_" + now.getEpochSecond();
        String candidate = base;
        int suffix = 0;
        while (store.findOne(ConversationDocuments.byId(candidate)).isPresent()) {
            suffix++;
            candidate = base + "_" + suffix;
        }
        return candidate;
    }

    // Mongo stores dates with millisecond precision.
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private <T> Optional<T> readCached(String key, Class<T> type) {
        CacheLookup lookup = cache.get(key);
        if (!lookup.isHit()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(lookup.value(), type));
        } catch (JsonProcessingException e) {
            LOG.warnf(e, "Discarding unreadable cache entry %s", key);
            cache.delete(key);
            return Optional.empty();
        }
    }

    private void writeCached(String key, Object value) {
        try {
            cache.put(key, objectMapper.writeValueAsString(value), cacheTtl);
        } catch (JsonProcessingException e) {
            LOG.warnf(e, "Failed to serialize cache entry %s", key);
        }
    }

    private void invalidate(String key) {
        if (!cache.delete(key)) {
            LOG.debugf("Cache entry %s not invalidated, cache unavailable", key);
        }
    }
}
