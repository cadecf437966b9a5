package com.papertrail.core;

/**
 * Base of the unchecked exceptions thrown by the analysis core.
 */
public class PaperTrailException extends RuntimeException {

    public PaperTrailException(String message) {
        super(message);
    }

    public PaperTrailException(String message, Throwable cause) {
        super(message, cause);
    }
}
