package com.inbox.jobtracker.ingest.service;

/**
 * Raised when the run cannot start: the mailbox or an external service is unreachable,
 * rejects the credentials, or is not configured. Nothing has been processed when this is thrown.
 */
public class TrackerSetupException extends RuntimeException {
    public TrackerSetupException(String message) {
        super(message);
    }

    public TrackerSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
