package me.go_gradually.ceddy.domain.wakeword;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WakeWordTest {

    private final WakeWord wakeWord = WakeWord.of("Hey Ceddy");

    @Test
    void isContainedIn_ignoresCase() {
        assertTrue(wakeWord.isContainedIn("hey CEDDY please help"));
    }

    @Test
    void isContainedIn_matchesSubstringInsideSentence() {
        assertTrue(wakeWord.isContainedIn("Okay, hey ceddy, which club for 150?"));
    }

    @Test
    void isContainedIn_rejectsPartialPhrase() {
        assertFalse(wakeWord.isContainedIn("hey ced"));
    }

    @Test
    void isContainedIn_returnsFalseForEmptyOrNull() {
        assertFalse(wakeWord.isContainedIn(""));
        assertFalse(wakeWord.isContainedIn(null));
    }

    @Test
    void blankPhrase_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> WakeWord.of(" "));
    }

    @Test
    void defaultPhrase_isHeyCeddy() {
        assertEquals("Hey Ceddy", WakeWord.defaultPhrase().phrase());
    }
}
