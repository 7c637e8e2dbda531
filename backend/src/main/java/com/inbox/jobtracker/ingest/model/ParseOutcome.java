package com.inbox.jobtracker.ingest.model;

/**
 * Result of semantic parsing. {@link Empty} replaces the old convention of treating a
 * record with blank company and position as "nothing extracted".
 */
public sealed interface ParseOutcome permits ParseOutcome.Parsed, ParseOutcome.Empty {

    static ParseOutcome of(StructuredRecord record) {
        if (record == null || record.isBlank()) {
            return new Empty("no company or position extracted");
        }
        return new Parsed(record);
    }

    static ParseOutcome empty(String detail) {
        return new Empty(detail);
    }

    record Parsed(StructuredRecord record) implements ParseOutcome {
    }

    record Empty(String detail) implements ParseOutcome {
    }
}
