package com.dcruver.ideatree.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class IdeaMatcherTest {

    @Test
    void testNormalizedEqualityMatches() {
        assertTrue(IdeaMatcher.matches("  Pan   Integral ", "pan integral"));
        assertTrue(IdeaMatcher.matches("té", "TÉ"));
    }

    @Test
    void testContainmentNeedsThreeCharacters() {
        assertTrue(IdeaMatcher.matches("leche", "leche de avena"));
        assertTrue(IdeaMatcher.matches("leche de avena", "leche"));
        assertFalse(IdeaMatcher.matches("té", "té verde"));
    }

    @Test
    void testBlankNeverMatches() {
        assertFalse(IdeaMatcher.matches("", ""));
        assertFalse(IdeaMatcher.matches(null, "pan"));
        assertFalse(IdeaMatcher.matches("   ", "pan"));
    }

    @Test
    void testExactMatchBeatsContainment() {
        List<String> ideas = List.of("pan integral", "queso", "pan");

        assertEquals(OptionalInt.of(2), IdeaMatcher.bestMatch(ideas, "Pan"));
    }

    @Test
    void testFirstContainmentWins() {
        List<String> ideas = List.of("queso", "pan integral", "pan de molde");

        assertEquals(OptionalInt.of(1), IdeaMatcher.bestMatch(ideas, "pan"));
        assertTrue(IdeaMatcher.bestMatch(ideas, "leche").isEmpty());
    }

    @Test
    void testSameText() {
        assertTrue(IdeaMatcher.sameText(" Pan  Integral", "pan integral"));
        assertFalse(IdeaMatcher.sameText("pan", "pan integral"));
        assertFalse(IdeaMatcher.sameText("", ""));
    }
}
