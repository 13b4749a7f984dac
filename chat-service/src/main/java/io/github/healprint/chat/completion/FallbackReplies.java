package io.github.healprint.chat.completion;

import java.util.List;
import java.util.Locale;

/** Keyword-matched canned replies used while no completion model is configured. */
public class FallbackReplies {

    static final String GREETING =
            "Hello! I'm HealPrint AI, your health and wellness assistant. I'm currently"
                    + " experiencing some technical difficulties with my AI processing, but I'm"
                    + " here to help guide you through your health journey. Please describe any"
                    + " skin, hair, or health concerns you'd like to discuss.";
    static final String SKIN =
            "I understand you're concerned about skin issues. While I'm experiencing technical"
                    + " difficulties with my AI analysis, I can still provide general guidance."
                    + " Common skin concerns often relate to diet, stress, hormones, or skincare"
                    + " routines. Would you like to share more details about your specific skin"
                    + " concerns?";
    static final String HAIR =
            "Hair health is often connected to internal factors like nutrition, stress, and"
                    + " hormonal balance. While I'm having technical difficulties with my AI"
                    + " processing, I can still offer general advice. What specific hair concerns"
                    + " are you experiencing?";
    static final String SUPPORT =
            "I'm here to help! While I'm experiencing some technical difficulties with my AI"
                    + " processing, our support team is available to assist you. You can reach us"
                    + " at support@healprint.xyz or try again later when the service is fully"
                    + " restored.";
    static final String DEFAULT =
            "Thank you for your message. I'm currently experiencing some technical difficulties"
                    + " with my AI processing capabilities, but I'm still here to help guide you"
                    + " through your health journey. Please feel free to describe any health"
                    + " concerns you have, and I'll do my best to provide helpful guidance.";

    private static final List<String> GREETING_WORDS = List.of("hello", "hi", "hey", "start");
    private static final List<String> SKIN_WORDS = List.of("skin", "acne", "rash", "dry", "oily");
    private static final List<String> HAIR_WORDS = List.of("hair", "thinning");
    private static final List<String> SUPPORT_WORDS = List.of("help", "support", "contact");

    public String replyTo(String userMessage) {
        String text = userMessage == null ? "" : userMessage.toLowerCase(Locale.ROOT);
        if (containsAny(text, GREETING_WORDS)) {
            return GREETING;
        }
        if (containsAny(text, SKIN_WORDS)) {
            return SKIN;
        }
        if (containsAny(text, HAIR_WORDS)) {
            return HAIR;
        }
        if (containsAny(text, SUPPORT_WORDS)) {
            return SUPPORT;
        }
        return DEFAULT;
    }

    private static boolean containsAny(String text, List<String> words) {
        return words.stream().anyMatch(text::contains);
    }
}
