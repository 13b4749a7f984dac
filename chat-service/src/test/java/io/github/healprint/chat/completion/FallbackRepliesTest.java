package io.github.healprint.chat.completion;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class FallbackRepliesTest {

    private final FallbackReplies replies = new FallbackReplies();

    @Test
    void picksReplyByFirstMatchingKeywordGroup() {
        assertEquals(FallbackReplies.GREETING, replies.replyTo("Hello there"));
        assertEquals(FallbackReplies.SKIN, replies.replyTo("I get a rash on my arms"));
        assertEquals(FallbackReplies.HAIR, replies.replyTo("my hair is falling out"));
        assertEquals(FallbackReplies.SUPPORT, replies.replyTo("can support contact me"));
        assertEquals(FallbackReplies.DEFAULT, replies.replyTo("ok"));
        assertEquals(FallbackReplies.DEFAULT, replies.replyTo(null));
    }
}
