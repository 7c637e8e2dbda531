package com.inbox.jobtracker.ingest.report;

import com.inbox.jobtracker.ingest.model.FailureEntry;
import com.inbox.jobtracker.ingest.model.FailureReport;

import java.util.List;

public interface FailureReporter {

    /**
     * Persists the run's failures for manual review. Never throws: an unwritable destination
     * is reported through {@link FailureReport#errorMessage()}.
     */
    FailureReport report(List<FailureEntry> entries);
}
