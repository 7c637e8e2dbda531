package com.inbox.jobtracker.ingest.store;

import com.inbox.jobtracker.ingest.model.StructuredRecord;
import com.inbox.jobtracker.ingest.model.UpsertResult;

public interface StoreReconciler {

    /**
     * Creates or updates the tracking entry identified by the record's company and position.
     * Store-side problems are returned as {@link UpsertResult#failure(String)}, not thrown.
     */
    UpsertResult upsert(StructuredRecord record);

    default void verifySetup() {
    }
}
