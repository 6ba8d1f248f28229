package me.go_gradually.ceddy.domain.wakeword;

import java.util.Locale;

/**
 * Trigger phrase that gates whether an utterance gets an assistant reply.
 * Matching is a case-insensitive exact substring test, with no fuzzy matching.
 */
public record WakeWord(String phrase) {
    public static final String DEFAULT_PHRASE = "Hey Ceddy";

    public WakeWord {
        if (phrase == null || phrase.isBlank()) {
            throw new IllegalArgumentException("Wake word phrase is required");
        }
    }

    public static WakeWord of(String phrase) {
        return new WakeWord(phrase);
    }

    public static WakeWord defaultPhrase() {
        return new WakeWord(DEFAULT_PHRASE);
    }

    public boolean isContainedIn(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        return text.toLowerCase(Locale.ROOT).contains(phrase.toLowerCase(Locale.ROOT));
    }
}
