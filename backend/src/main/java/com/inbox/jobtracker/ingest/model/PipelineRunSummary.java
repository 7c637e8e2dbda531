package com.inbox.jobtracker.ingest.model;

import java.time.Instant;
import java.util.List;

public record PipelineRunSummary(
    Instant startedAt,
    Instant finishedAt,
    String status,
    int messagesFound,
    int candidatesExtracted,
    int recordsUpserted,
    List<FailureEntry> failures,
    FailureReport failureReport
) {
    public static final String NO_MESSAGES = "NO_MESSAGES";
    public static final String COMPLETED = "COMPLETED";
    public static final String COMPLETED_WITH_FAILURES = "COMPLETED_WITH_FAILURES";
    public static final String FETCH_INCOMPLETE = "FETCH_INCOMPLETE";
    public static final String STAGE_FAILED = "STAGE_FAILED";

    public PipelineRunSummary {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }
}
