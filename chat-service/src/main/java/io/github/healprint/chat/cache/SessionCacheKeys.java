package io.github.healprint.chat.cache;

public final class SessionCacheKeys {

    private static final String CONVERSATION_PREFIX = "conversation:";
    private static final String USER_CONVERSATIONS_PREFIX = "user_conversations:";

    private SessionCacheKeys() {}

    public static String conversation(String conversationId) {
        return CONVERSATION_PREFIX + conversationId;
    }

    public static String userConversations(String userId) {
        return USER_CONVERSATIONS_PREFIX + userId;
    }
}
