package com.dcruver.ideatree.domain;

import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.time.LocalDateTime;

/**
 * A notification to deliver once its fire time has passed.
 */
@Data
@Builder
@With
public class ScheduledReminder {
    private final Long id;
    private final String message;
    private final LocalDateTime fireAt;
    private final boolean sent;
    private final LocalDateTime createdAt;

    public static ScheduledReminder of(String message, LocalDateTime fireAt) {
        return ScheduledReminder.builder()
            .message(message)
            .fireAt(fireAt)
            .sent(false)
            .build();
    }

    public boolean isDue(LocalDateTime now) {
        return !sent && !fireAt.isAfter(now);
    }
}
