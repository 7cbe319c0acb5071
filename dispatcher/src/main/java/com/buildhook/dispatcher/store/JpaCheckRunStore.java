package com.buildhook.dispatcher.store;

import com.buildhook.dispatcher.model.CheckRunKey;
import com.buildhook.dispatcher.model.CheckRunRecord;
import com.buildhook.dispatcher.repository.CheckRunRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * {@link CheckRunStore} backed by the check_runs table.
 */
@Component
public class JpaCheckRunStore implements CheckRunStore {

    private final CheckRunRepository repo;

    public JpaCheckRunStore(CheckRunRepository repo) {
        this.repo = repo;
    }

    @Override
    public CheckRunRecord load(CheckRunKey key) {
        return repo.findById(new CheckRunRecord.Pk(key.taskGroupId(), key.taskId()))
                .orElseThrow(() -> new RecordStoreException(RecordStoreException.Kind.NOT_FOUND,
                        "No check run for task " + key.taskId() + " in group " + key.taskGroupId()));
    }

    @Override
    public CheckRunRecord create(CheckRunRecord record) {
        try {
            return repo.saveAndFlush(record);
        } catch (DataIntegrityViolationException e) {
            if (repo.existsById(record.getId())) {
                throw new RecordStoreException(RecordStoreException.Kind.ALREADY_EXISTS,
                        "Check run already recorded for task " + record.getTaskId()
                        + " in group " + record.getTaskGroupId(), e);
            }
            throw e;
        }
    }
}
