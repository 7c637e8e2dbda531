package com.inbox.jobtracker.ingest.model;

import java.util.List;

/**
 * A mailbox entry before filtering. A null envelope means the server returned no
 * envelope metadata for the message.
 */
public record RawMessage(
    MessageEnvelope envelope,
    List<BodyPart> bodyParts
) {
    public RawMessage {
        bodyParts = bodyParts == null ? List.of() : List.copyOf(bodyParts);
    }

    public boolean hasEnvelope() {
        return envelope != null;
    }
}
