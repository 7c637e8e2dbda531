package com.inbox.jobtracker.ingest.mail;

import com.inbox.jobtracker.ingest.model.RawMessage;

import java.util.Iterator;
import java.util.List;

/**
 * Search result of one mailbox query, in the mailbox's native order. Iteration may fail
 * part-way with {@link MailboxReadException} if the connection drops.
 */
public interface MessageBatch extends Iterable<RawMessage>, AutoCloseable {

    int size();

    @Override
    void close();

    static MessageBatch of(List<RawMessage> messages) {
        List<RawMessage> copy = List.copyOf(messages);
        return new MessageBatch() {
            @Override
            public int size() {
                return copy.size();
            }

            @Override
            public Iterator<RawMessage> iterator() {
                return copy.iterator();
            }

            @Override
            public void close() {
            }
        };
    }
}
