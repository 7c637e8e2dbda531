package com.inbox.jobtracker.ingest.mail;

public class MailboxReadException extends RuntimeException {
    public MailboxReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
