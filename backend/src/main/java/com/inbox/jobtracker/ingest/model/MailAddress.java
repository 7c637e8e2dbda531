package com.inbox.jobtracker.ingest.model;

public record MailAddress(
    String mailbox,
    String host
) {
    public String asEmail() {
        return (mailbox == null ? "" : mailbox) + "@" + (host == null ? "" : host);
    }
}
