package com.buildhook.dispatcher.store;

import com.buildhook.dispatcher.model.Build;

import java.util.function.Consumer;

/**
 * Durable storage for build records, keyed by task-group id.
 */
public interface BuildStore {

    /**
     * @throws RecordStoreException NOT_FOUND if no build exists for the task group
     */
    Build load(String taskGroupId);

    /**
     * Insert a new build.
     *
     * @throws RecordStoreException ALREADY_EXISTS if a build with the same task-group id exists
     */
    Build create(Build build);

    /**
     * Atomic read-modify-write: load the build, apply {@code mutator}, store it
     * only if nobody else changed it in between, retrying on conflict.
     *
     * @throws RecordStoreException NOT_FOUND if the build does not exist,
     *                              CONFLICT if every attempt lost the race
     */
    Build modify(String taskGroupId, Consumer<Build> mutator);
}
