package com.inbox.jobtracker.ingest.model;

public record UpsertResult(
    boolean successful,
    String action,
    String failureReason
) {
    public static UpsertResult created() {
        return new UpsertResult(true, "created", null);
    }

    public static UpsertResult updated() {
        return new UpsertResult(true, "updated", null);
    }

    public static UpsertResult failure(String reason) {
        return new UpsertResult(false, null, reason == null || reason.isBlank() ? "store_error" : reason);
    }
}
