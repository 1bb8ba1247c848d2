package com.dcruver.ideatree.domain;

/**
 * Base type for failures that stop a note from being classified.
 */
public abstract class IdeaTreeException extends RuntimeException {

    protected IdeaTreeException(String message) {
        super(message);
    }

    protected IdeaTreeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether submitting the same note again may succeed.
     */
    public abstract boolean isRetryable();
}
