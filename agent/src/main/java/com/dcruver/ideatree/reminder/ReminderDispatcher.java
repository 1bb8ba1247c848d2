package com.dcruver.ideatree.reminder;

import com.dcruver.ideatree.domain.ScheduledReminder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Polls the store for due reminders and delivers each one at most once.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReminderDispatcher {

    private final ReminderStore store;
    private final ReminderNotifier notifier;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${ideatree.reminders.poll-interval-ms:30000}")
    public void poll() {
        dispatchDue();
    }

    /**
     * Deliver every due reminder. Returns how many were delivered by this call.
     */
    public int dispatchDue() {
        List<ScheduledReminder> due = store.findDue(LocalDateTime.now(clock));
        int delivered = 0;
        for (ScheduledReminder reminder : due) {
            if (!store.markSent(reminder.getId())) {
                log.debug("Reminder #{} already claimed", reminder.getId());
                continue;
            }
            try {
                notifier.deliver(reminder.withSent(true));
                delivered++;
            } catch (Exception e) {
                log.error("Failed to deliver reminder #{}", reminder.getId(), e);
            }
        }
        if (delivered > 0) {
            log.info("Delivered {} reminder(s)", delivered);
        }
        return delivered;
    }
}
