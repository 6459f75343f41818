package com.stagediff.core.git;

/**
 * Thrown when the staged snapshot (the index) of a working copy cannot be read.
 */
public class SnapshotLoadException extends RuntimeException {

    public SnapshotLoadException(String message) {
        super(message);
    }

    public SnapshotLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
