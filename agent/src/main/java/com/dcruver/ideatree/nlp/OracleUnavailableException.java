package com.dcruver.ideatree.nlp;

import com.dcruver.ideatree.domain.IdeaTreeException;

/**
 * The classification model could not be reached or did not answer in time.
 */
public class OracleUnavailableException extends IdeaTreeException {

    public OracleUnavailableException(String message) {
        super(message);
    }

    public OracleUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
