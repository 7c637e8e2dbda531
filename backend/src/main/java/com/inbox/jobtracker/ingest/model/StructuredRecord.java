package com.inbox.jobtracker.ingest.model;

import java.time.Instant;

public record StructuredRecord(
    String company,
    String position,
    String status,
    Instant sourceDate,
    String sourceEmail
) {
    public boolean isBlank() {
        return (company == null || company.isBlank()) && (position == null || position.isBlank());
    }
}
