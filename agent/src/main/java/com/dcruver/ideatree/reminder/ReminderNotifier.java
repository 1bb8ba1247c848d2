package com.dcruver.ideatree.reminder;

import com.dcruver.ideatree.domain.ScheduledReminder;

/**
 * Delivers a reminder whose time has come.
 */
public interface ReminderNotifier {

    void deliver(ScheduledReminder reminder);
}
