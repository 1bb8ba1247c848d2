package com.dcruver.ideatree.classify;

import com.dcruver.ideatree.domain.Action;
import com.dcruver.ideatree.domain.CanonicalMutation;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ReminderPreDetectorTest {

    // a Saturday
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 2, 28, 10, 0);

    private final ReminderPreDetector english = new ReminderPreDetector(LanguageRules.english(), Duration.ofMinutes(5));
    private final ReminderPreDetector spanish = new ReminderPreDetector(LanguageRules.spanish(), Duration.ofMinutes(5));

    private CanonicalMutation detect(ReminderPreDetector detector, String note) {
        Optional<CanonicalMutation> result = detector.detect(note, NOW);
        assertTrue(result.isPresent(), "expected a reminder for: " + note);
        return result.get();
    }

    @Test
    void testTomorrowAtHour() {
        CanonicalMutation reminder = detect(english, "remind me tomorrow at 9 to call the dentist");

        assertEquals(Action.REMIND, reminder.getAction());
        assertTrue(reminder.isMakesSense());
        assertEquals(LocalDateTime.of(2026, 3, 1, 9, 0), reminder.getRemindAt());
        assertEquals("call the dentist", reminder.getIdea());
        assertFalse(reminder.isNewGroup());
        assertNull(reminder.getRename());
    }

    @Test
    void testHourWithoutAt() {
        CanonicalMutation reminder = detect(english, "remind me tomorrow 9 to call the dentist");

        assertEquals(LocalDateTime.of(2026, 3, 1, 9, 0), reminder.getRemindAt());
        assertEquals("call the dentist", reminder.getIdea());
    }

    @Test
    void testSpanishHourWithoutALas() {
        CanonicalMutation reminder = detect(spanish, "recuérdame mañana 9 llamar al dentista");

        assertEquals(LocalDateTime.of(2026, 3, 1, 9, 0), reminder.getRemindAt());
        assertEquals("llamar al dentista", reminder.getIdea());
    }

    @Test
    void testNumberThatIsNotAnHour() {
        CanonicalMutation counted = detect(english, "remind me to buy 3 apples");
        CanonicalMutation duration = detect(english, "remind me tomorrow 2 hours of piano");

        assertEquals(NOW.plusMinutes(5), counted.getRemindAt());
        assertEquals("buy 3 apples", counted.getIdea());
        assertEquals(NOW.plusDays(1).plusMinutes(5), duration.getRemindAt());
    }

    @Test
    void testNoTimeFallsBackToFiveMinutes() {
        CanonicalMutation reminder = detect(english, "remind me to water the plants");

        assertEquals(NOW.plusMinutes(5), reminder.getRemindAt());
        assertEquals("water the plants", reminder.getIdea());
    }

    @Test
    void testPassedTimeRollsOverToTomorrow() {
        CanonicalMutation reminder = detect(english, "remind me at 8:30 to stretch");

        assertEquals(LocalDateTime.of(2026, 3, 1, 8, 30), reminder.getRemindAt());
        assertEquals("stretch", reminder.getIdea());
    }

    @Test
    void testPmAddsTwelveHours() {
        CanonicalMutation reminder = detect(english, "remind me at 7 pm to call mom");

        assertEquals(LocalDateTime.of(2026, 2, 28, 19, 0), reminder.getRemindAt());
        assertEquals("call mom", reminder.getIdea());
    }

    @Test
    void testSameWeekdayMeansNextWeek() {
        CanonicalMutation reminder = detect(english, "remind me on saturday to buy bread");

        assertEquals(NOW.plusDays(7).plusMinutes(5), reminder.getRemindAt());
        assertEquals("buy bread", reminder.getIdea());
    }

    @Test
    void testRelativeOffsetWins() {
        CanonicalMutation reminder = detect(english, "remind me in 20 minutes to check the oven");

        assertEquals(NOW.plusMinutes(20), reminder.getRemindAt());
        assertEquals("check the oven", reminder.getIdea());
    }

    @Test
    void testSpanishTomorrowAtHour() {
        CanonicalMutation reminder = detect(spanish, "recuérdame mañana a las 9 llamar al dentista");

        assertEquals(LocalDateTime.of(2026, 3, 1, 9, 0), reminder.getRemindAt());
        assertEquals("llamar al dentista", reminder.getIdea());
    }

    @Test
    void testSpanishDayAfterTomorrow() {
        CanonicalMutation reminder = detect(spanish, "recuérdame pasado mañana pagar el alquiler");

        assertEquals(NOW.plusDays(2).plusMinutes(5), reminder.getRemindAt());
        assertEquals("pagar el alquiler", reminder.getIdea());
    }

    @Test
    void testSpanishMorningIsNotTomorrow() {
        CanonicalMutation reminder = detect(spanish, "avísame el lunes por la mañana ir al banco");

        // Saturday to Monday
        assertEquals(NOW.plusDays(2).plusMinutes(5), reminder.getRemindAt());
    }

    @Test
    void testSpanishAfternoonMarker() {
        CanonicalMutation reminder = detect(spanish, "recuérdame a las 5 de la tarde sacar la basura");

        assertEquals(LocalDateTime.of(2026, 2, 28, 17, 0), reminder.getRemindAt());
        assertEquals("sacar la basura", reminder.getIdea());
    }

    @Test
    void testMessageFallsBackToNote() {
        CanonicalMutation reminder = detect(english, "remind me tomorrow");

        assertEquals("remind me tomorrow", reminder.getIdea());
    }

    @Test
    void testNoTriggerNoReminder() {
        assertTrue(english.detect("buy bread tomorrow at 9", NOW).isEmpty());
        assertTrue(spanish.detect("comprar pan mañana", NOW).isEmpty());
        assertTrue(spanish.detect("  ", NOW).isEmpty());
    }
}
