package io.github.healprint.chat.config;

import io.github.healprint.chat.store.ConversationDocumentStore;
import io.github.healprint.chat.store.MeteredConversationDocumentStore;
import io.github.healprint.chat.store.impl.MongoConversationDocumentStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class DocumentStoreSelector {

    @ConfigProperty(name = "healprint.store.type", defaultValue = "mongo")
    String storeType;

    @Inject Instance<MongoConversationDocumentStore> mongoStore;

    @Inject MeterRegistry meterRegistry;

    private ConversationDocumentStore meteredStore;

    @PostConstruct
    void init() {
        meteredStore = new MeteredConversationDocumentStore(meterRegistry, selectDelegate());
    }

    public ConversationDocumentStore getStore() {
        return meteredStore;
    }

    ConversationDocumentStore selectDelegate() {
        String type = storeType == null ? "mongo" : storeType.trim().toLowerCase();
        if ("mongo".equals(type) || "mongodb".equals(type)) {
            return mongoStore.get();
        }
        throw new IllegalStateException("Unsupported healprint.store.type: " + storeType);
    }
}
