package com.inbox.jobtracker.ingest.model;

public record HttpCallResult(
    int statusCode,
    String body,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String describeFailure() {
        if (errorCode != null) {
            return errorCode + (errorMessage == null || errorMessage.isBlank() ? "" : " (" + errorMessage + ")");
        }
        return "HTTP " + statusCode;
    }
}
