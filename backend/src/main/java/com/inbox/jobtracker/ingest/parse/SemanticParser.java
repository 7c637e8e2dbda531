package com.inbox.jobtracker.ingest.parse;

import com.inbox.jobtracker.ingest.model.ParseOutcome;

import java.time.Instant;

public interface SemanticParser {

    ParseOutcome parse(String subject, String body, String senderEmail, Instant receivedAt);

    /**
     * Checked once before a run starts; throws
     * {@link com.inbox.jobtracker.ingest.service.TrackerSetupException} when the service is unusable.
     */
    default void verifySetup() {
    }
}
