package com.inbox.jobtracker.ingest.model;

import java.time.Instant;

public record CandidateRecord(
    String subject,
    String normalizedBody,
    String sender,
    Instant receivedAt
) {
}
