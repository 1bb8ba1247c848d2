package com.dcruver.ideatree.service;

import com.dcruver.ideatree.domain.CanonicalMutation;
import com.dcruver.ideatree.domain.ChangeSet;
import com.dcruver.ideatree.domain.ScheduledReminder;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of ingesting one note.
 */
@Value
@Builder
public class IngestionResult {

    public enum Status {
        APPLIED,
        UNCLASSIFIABLE,
        PENDING
    }

    Status status;
    String note;
    @Builder.Default
    List<CanonicalMutation> mutations = List.of();
    ChangeSet changes;
    @Builder.Default
    List<ScheduledReminder> reminders = List.of();
    Long pendingId;
    String message;
}
