package com.dcruver.ideatree.classify;

import com.dcruver.ideatree.domain.CanonicalMutation;
import lombok.extern.slf4j.Slf4j;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises reminder requests without asking the model and resolves their
 * relative date/time wording against a reference "now".
 *
 * A recognised reminder short-circuits classification entirely.
 */
@Slf4j
public class ReminderPreDetector {

    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\\s,.:;!?¡¿-]+|[\\s,.:;!?¡¿-]+$");

    private final LanguageRules rules;
    private final Duration fallbackDelay;
    private final Pattern weekdayPattern;

    public ReminderPreDetector(LanguageRules rules, Duration fallbackDelay) {
        this.rules = rules;
        this.fallbackDelay = fallbackDelay;
        this.weekdayPattern = rules.weekdayPattern();
    }

    public Duration getFallbackDelay() {
        return fallbackDelay;
    }

    public Optional<CanonicalMutation> detect(String note, LocalDateTime now) {
        if (note == null || note.isBlank()) {
            return Optional.empty();
        }
        Matcher trigger = rules.getReminderTrigger().matcher(note);
        if (!trigger.find()) {
            return Optional.empty();
        }

        List<int[]> consumed = new ArrayList<>();
        consumed.add(new int[]{trigger.start(), trigger.end()});

        LocalDateTime fireAt = resolveFireTime(note, now.truncatedTo(ChronoUnit.SECONDS), consumed);
        String message = extractMessage(note, consumed);

        log.info("Reminder detected: '{}' at {}", message, fireAt);
        return Optional.of(CanonicalMutation.reminder(message, fireAt));
    }

    private LocalDateTime resolveFireTime(String note, LocalDateTime now, List<int[]> consumed) {
        Matcher relative = rules.getRelativeOffset().matcher(note);
        if (relative.find()) {
            consumed.add(new int[]{relative.start(), relative.end()});
            long amount = Long.parseLong(relative.group(1));
            boolean hours = relative.group(2).toLowerCase(rules.getLocale()).startsWith("h");
            return hours ? now.plusHours(amount) : now.plusMinutes(amount);
        }

        Integer dayOffset = resolveDayOffset(note, now.getDayOfWeek(), consumed);
        LocalTime time = resolveTime(note, consumed);

        if (time == null) {
            LocalDateTime fallback = now.plus(fallbackDelay);
            return dayOffset == null ? fallback : fallback.plusDays(dayOffset);
        }
        if (dayOffset != null) {
            return now.toLocalDate().plusDays(dayOffset).atTime(time);
        }
        LocalDateTime sameDay = now.toLocalDate().atTime(time);
        return sameDay.isBefore(now) ? sameDay.plusDays(1) : sameDay;
    }

    private Integer resolveDayOffset(String note, DayOfWeek today, List<int[]> consumed) {
        Matcher todayWords = rules.getToday().matcher(note);
        if (todayWords.find()) {
            consumed.add(new int[]{todayWords.start(), todayWords.end()});
        }

        Matcher dayAfter = rules.getDayAfterTomorrow().matcher(note);
        if (dayAfter.find()) {
            consumed.add(new int[]{dayAfter.start(), dayAfter.end()});
            return 2;
        }
        Matcher tomorrow = rules.getTomorrow().matcher(note);
        if (tomorrow.find()) {
            consumed.add(new int[]{tomorrow.start(), tomorrow.end()});
            return 1;
        }
        Matcher weekday = weekdayPattern.matcher(note);
        if (weekday.find()) {
            consumed.add(new int[]{weekday.start(), weekday.end()});
            DayOfWeek target = rules.getWeekdays().get(weekday.group(1).toLowerCase(rules.getLocale()));
            int days = target.getValue() - today.getValue();
            return days <= 0 ? days + 7 : days;
        }
        return null;
    }

    private LocalTime resolveTime(String note, List<int[]> consumed) {
        for (Pattern pattern : rules.getTimePatterns()) {
            Matcher matcher = pattern.matcher(note);
            while (matcher.find()) {
                int hour = Integer.parseInt(matcher.group(1));
                String minuteText = matcher.group(2);
                int minute = minuteText == null || minuteText.isEmpty() ? 0 : Integer.parseInt(minuteText);
                String meridiem = matcher.group(3);
                if (meridiem != null) {
                    String marker = meridiem.strip().toLowerCase(rules.getLocale());
                    if (rules.getPmMarker().matcher(marker).find() && hour >= 1 && hour < 12) {
                        hour += 12;
                    } else if (marker.startsWith("a") && hour == 12) {
                        hour = 0;
                    }
                }
                if (hour <= 23 && minute <= 59) {
                    consumed.add(new int[]{matcher.start(), matcher.end()});
                    return LocalTime.of(hour, minute);
                }
            }
        }
        return null;
    }

    private String extractMessage(String note, List<int[]> consumed) {
        StringBuilder text = new StringBuilder(note);
        consumed.sort(Comparator.comparingInt((int[] span) -> span[0]).reversed());
        int lowestCut = Integer.MAX_VALUE;
        for (int[] span : consumed) {
            // spans are applied right to left; skip any that overlap one already cut
            if (span[1] > lowestCut) {
                continue;
            }
            text.replace(span[0], span[1], " ");
            lowestCut = span[0];
        }

        String message = text.toString().replaceAll("\\s+", " ");
        message = EDGE_PUNCTUATION.matcher(message).replaceAll("");
        message = rules.getMessageLeadingFiller().matcher(message).replaceFirst("");
        message = rules.getMessageTrailingFiller().matcher(message).replaceFirst("");
        message = EDGE_PUNCTUATION.matcher(message).replaceAll("");
        return message.isBlank() ? note.strip() : message;
    }
}
