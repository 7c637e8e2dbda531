package com.inbox.jobtracker.ingest.model;

import java.time.Instant;
import java.util.List;

public record MessageEnvelope(
    String subject,
    List<MailAddress> from,
    Instant receivedAt
) {
    public MessageEnvelope {
        subject = subject == null ? "" : subject;
        from = from == null ? List.of() : List.copyOf(from);
    }
}
