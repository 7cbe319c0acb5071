package com.buildhook.dispatcher.store;

import com.buildhook.dispatcher.model.Build;
import com.buildhook.dispatcher.repository.BuildRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Consumer;

/**
 * {@link BuildStore} backed by the builds table.
 *
 * modify() relies on the @Version column of {@link Build}: the UPDATE only
 * matches if the version read is still current, otherwise Hibernate raises an
 * optimistic-lock failure and we re-read and re-apply the mutator.
 */
@Component
public class JpaBuildStore implements BuildStore {

    private static final Logger log = LoggerFactory.getLogger(JpaBuildStore.class);

    static final int MAX_MODIFY_ATTEMPTS = 5;

    private final BuildRepository     repo;
    private final TransactionTemplate tx;

    public JpaBuildStore(BuildRepository repo, TransactionTemplate tx) {
        this.repo = repo;
        this.tx   = tx;
    }

    @Override
    public Build load(String taskGroupId) {
        return repo.findById(taskGroupId).orElseThrow(() -> notFound(taskGroupId));
    }

    @Override
    public Build create(Build build) {
        try {
            return repo.saveAndFlush(build);
        } catch (DataIntegrityViolationException e) {
            // Primary-key collision is the only expected violation; anything
            // else (a NOT NULL column, say) is a real error.
            if (repo.existsById(build.getTaskGroupId())) {
                throw new RecordStoreException(RecordStoreException.Kind.ALREADY_EXISTS,
                        "Build already exists for task group " + build.getTaskGroupId(), e);
            }
            throw e;
        }
    }

    @Override
    public Build modify(String taskGroupId, Consumer<Build> mutator) {
        for (int attempt = 1; attempt <= MAX_MODIFY_ATTEMPTS; attempt++) {
            try {
                return tx.execute(status -> {
                    Build build = repo.findById(taskGroupId).orElseThrow(() -> notFound(taskGroupId));
                    mutator.accept(build);
                    return repo.saveAndFlush(build);
                });
            } catch (OptimisticLockingFailureException e) {
                log.debug("Concurrent update on build {} (attempt {}/{}), retrying",
                        taskGroupId, attempt, MAX_MODIFY_ATTEMPTS);
            }
        }
        throw new RecordStoreException(RecordStoreException.Kind.CONFLICT,
                "Gave up modifying build " + taskGroupId + " after "
                + MAX_MODIFY_ATTEMPTS + " concurrent updates");
    }

    private static RecordStoreException notFound(String taskGroupId) {
        return new RecordStoreException(RecordStoreException.Kind.NOT_FOUND,
                "No build for task group " + taskGroupId);
    }
}
