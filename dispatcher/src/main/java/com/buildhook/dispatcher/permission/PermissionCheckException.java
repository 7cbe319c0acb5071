package com.buildhook.dispatcher.permission;

/**
 * The pull-request policy could not be read because the default branch's
 * .taskcluster.yml does not parse.
 */
public class PermissionCheckException extends RuntimeException {

    private final String branch;

    public PermissionCheckException(String branch, String message, Throwable cause) {
        super(message, cause);
        this.branch = branch;
    }

    /** Default branch whose config was unreadable. */
    public String getBranch() { return branch; }
}
