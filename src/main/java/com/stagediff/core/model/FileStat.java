package com.stagediff.core.model;

/**
 * One changed path as reported by the diff engine.
 *
 * @param path    path relative to the working copy root (the new path for renames)
 * @param added   lines added; for binary paths the byte size of the new side
 * @param deleted lines deleted; for binary paths the byte size of the old side
 * @param binary  true when the engine could not count lines
 */
public record FileStat(
    String path,
    long added,
    long deleted,
    boolean binary
) {

    public static FileStat text(String path, long added, long deleted) {
        return new FileStat(path, added, deleted, false);
    }

    /** A binary path whose sizes are not known yet. */
    public static FileStat binary(String path) {
        return new FileStat(path, 0, 0, true);
    }

    public FileStat withCounts(long newAdded, long newDeleted) {
        return new FileStat(path, newAdded, newDeleted, binary);
    }
}
