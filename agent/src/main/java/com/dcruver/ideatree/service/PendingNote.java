package com.dcruver.ideatree.service;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * A note stored unclassified while the model was unavailable.
 */
@Data
@Builder
public class PendingNote {

    public enum Status {
        PENDING,
        PROCESSED,
        DISCARDED
    }

    private final long id;
    private final String text;
    private final String reason;
    private final Status status;
    private final LocalDateTime createdAt;
}
