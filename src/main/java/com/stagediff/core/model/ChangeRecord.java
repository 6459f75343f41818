package com.stagediff.core.model;

import java.util.Objects;

/**
 * Change summary for a single path across both phases.
 *
 * <p>The two deltas are independent: {@link #withDelta} replaces the delta of
 * one phase and carries the other one over untouched.
 *
 * @param path         path relative to the working copy root, the record's identity
 * @param workingDelta last delta reported by the {@link Phase#WORKING_COPY} pass
 * @param stagedDelta  last delta reported by the {@link Phase#STAGED} pass
 */
public record ChangeRecord(
    String path,
    Delta workingDelta,
    Delta stagedDelta
) {

    public ChangeRecord {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(workingDelta, "workingDelta");
        Objects.requireNonNull(stagedDelta, "stagedDelta");
    }

    /** A record seen for the first time: no change observed in either phase. */
    public static ChangeRecord unchanged(String path) {
        return new ChangeRecord(path, Delta.NONE, Delta.NONE);
    }

    public Delta delta(Phase phase) {
        return switch (phase) {
            case WORKING_COPY -> workingDelta;
            case STAGED -> stagedDelta;
        };
    }

    public ChangeRecord withDelta(Phase phase, Delta delta) {
        return switch (phase) {
            case WORKING_COPY -> new ChangeRecord(path, delta, stagedDelta);
            case STAGED -> new ChangeRecord(path, workingDelta, delta);
        };
    }
}
