package com.inbox.jobtracker.ingest.mail;

import java.time.Instant;

public interface MailboxReader {

    /**
     * Opens the mailbox and selects every message received at or after {@code since}.
     * Messages are materialized lazily while the returned batch is iterated.
     *
     * @throws com.inbox.jobtracker.ingest.service.TrackerSetupException if the mailbox cannot be
     *     reached, authenticated or searched
     */
    MessageBatch fetch(Instant since);
}
