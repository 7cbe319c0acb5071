package com.buildhook.dispatcher.intree;

/**
 * Turns a repository's .taskcluster.yml into the task graph for one event.
 *
 * Pure: no I/O, the same request always compiles to the same graph apart from
 * generated ids and timestamps.
 */
public interface ConfigCompiler {

    /**
     * @return the graph; empty when the config has no tasks for this event
     * @throws ConfigException when the config is malformed
     */
    TaskGraph compile(CompileRequest request);
}
