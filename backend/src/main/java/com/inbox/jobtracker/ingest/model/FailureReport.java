package com.inbox.jobtracker.ingest.model;

import java.nio.file.Path;

public record FailureReport(
    int rowsWritten,
    Path path,
    String errorMessage
) {
    public static FailureReport nothingToReport() {
        return new FailureReport(0, null, null);
    }

    public boolean isWritten() {
        return path != null && errorMessage == null;
    }
}
