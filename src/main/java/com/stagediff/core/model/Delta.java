package com.stagediff.core.model;

/**
 * Line-level change magnitude for one path in one phase.
 *
 * @param added   lines added, never negative
 * @param deleted lines deleted, never negative
 */
public record Delta(long added, long deleted) {

    public static final Delta NONE = new Delta(0, 0);

    public Delta {
        if (added < 0 || deleted < 0) {
            throw new IllegalArgumentException(
                    "Delta counts must be non-negative: +%d/-%d".formatted(added, deleted));
        }
    }

    public boolean isChanged() {
        return added != 0 || deleted != 0;
    }

    @Override
    public String toString() {
        return "+" + added + "/-" + deleted;
    }
}
