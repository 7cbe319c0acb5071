package com.buildhook.dispatcher.store;

import com.buildhook.dispatcher.model.CheckRunKey;
import com.buildhook.dispatcher.model.CheckRunRecord;

/**
 * Durable storage for task → check-run mappings.
 */
public interface CheckRunStore {

    /**
     * @throws RecordStoreException NOT_FOUND if no check-run is recorded for the task
     */
    CheckRunRecord load(CheckRunKey key);

    /**
     * @throws RecordStoreException ALREADY_EXISTS if the (task group, task) pair is already recorded
     */
    CheckRunRecord create(CheckRunRecord record);
}
