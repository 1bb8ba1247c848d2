package com.dcruver.ideatree.reminder;

import com.dcruver.ideatree.domain.ScheduledReminder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class LoggingReminderNotifier implements ReminderNotifier {

    @Override
    public void deliver(ScheduledReminder reminder) {
        log.info("REMINDER [{}]: {}", reminder.getFireAt(), reminder.getMessage());
    }
}
