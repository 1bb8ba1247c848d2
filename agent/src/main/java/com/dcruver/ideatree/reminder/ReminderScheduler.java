package com.dcruver.ideatree.reminder;

import com.dcruver.ideatree.domain.ScheduledReminder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Hands reminders to the store so the dispatcher picks them up when due.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReminderScheduler {

    private final ReminderStore store;

    public ScheduledReminder schedule(String message, LocalDateTime fireAt) {
        return schedule(ScheduledReminder.of(message, fireAt));
    }

    public ScheduledReminder schedule(ScheduledReminder reminder) {
        ScheduledReminder saved = store.save(reminder);
        log.info("Scheduled reminder #{} '{}' for {}", saved.getId(), saved.getMessage(), saved.getFireAt());
        return saved;
    }
}
