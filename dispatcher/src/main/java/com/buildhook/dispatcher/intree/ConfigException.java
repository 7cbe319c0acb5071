package com.buildhook.dispatcher.intree;

/**
 * A repository's .taskcluster.yml is unusable.
 *
 * This is the user's problem, not ours: the job handler explains it in a
 * GitHub comment and drops the event instead of retrying.
 *
 * PARSE  : the file is not valid YAML
 * SCHEMA : valid YAML, but not a valid config (wrong version, bad task entry)
 */
public class ConfigException extends RuntimeException {

    public enum Kind { PARSE, SCHEMA }

    private final Kind kind;

    public ConfigException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ConfigException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
