package com.inbox.jobtracker.ingest.model;

/**
 * One leaf MIME part. {@code contentType} is the raw header value and may be null or
 * malformed; {@code content} is already transfer-decoded.
 */
public record BodyPart(
    String contentType,
    byte[] content
) {
    public BodyPart {
        content = content == null ? new byte[0] : content;
    }
}
