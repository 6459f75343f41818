package com.stagediff.core.git;

/**
 * Thrown when a git process cannot be run or a diff command exits with an error.
 */
public class GitCommandException extends RuntimeException {

    public GitCommandException(String message) {
        super(message);
    }

    public GitCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
