package com.inbox.jobtracker.ingest.pipeline;

import com.inbox.jobtracker.ingest.model.CandidateRecord;
import com.inbox.jobtracker.ingest.model.StructuredRecord;

/**
 * Item carried from extraction to reconciliation. A pending item still needs parsing; after the
 * parse stage it holds either a record to reconcile or the reason it was dropped.
 */
public record ParsedCandidate(
    CandidateRecord candidate,
    StructuredRecord record,
    String failureReason
) {
    public static ParsedCandidate pending(CandidateRecord candidate) {
        return new ParsedCandidate(candidate, null, null);
    }

    public static ParsedCandidate parsed(CandidateRecord candidate, StructuredRecord record) {
        return new ParsedCandidate(candidate, record, null);
    }

    public static ParsedCandidate failed(CandidateRecord candidate, String reason) {
        return new ParsedCandidate(candidate, null, reason);
    }

    public boolean isParsed() {
        return record != null;
    }

    public boolean isPending() {
        return record == null && failureReason == null;
    }
}
