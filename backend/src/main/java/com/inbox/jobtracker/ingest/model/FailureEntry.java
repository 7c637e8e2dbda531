package com.inbox.jobtracker.ingest.model;

import java.time.Instant;

public record FailureEntry(
    Instant receivedAt,
    String sender,
    String subject,
    String normalizedBody,
    String reason
) {
    public static FailureEntry of(CandidateRecord candidate, String reason) {
        return new FailureEntry(
            candidate.receivedAt(),
            candidate.sender(),
            candidate.subject(),
            candidate.normalizedBody(),
            reason
        );
    }
}
