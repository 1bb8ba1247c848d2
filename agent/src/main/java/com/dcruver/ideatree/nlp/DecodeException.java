package com.dcruver.ideatree.nlp;

import com.dcruver.ideatree.domain.IdeaTreeException;
import lombok.Getter;

/**
 * The model answered, but nothing structured could be recovered from the answer.
 */
@Getter
public class DecodeException extends IdeaTreeException {

    private final String rawText;

    public DecodeException(String message, String rawText) {
        super(message);
        this.rawText = rawText;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
