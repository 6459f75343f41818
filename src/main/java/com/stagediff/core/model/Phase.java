package com.stagediff.core.model;

/**
 * The two comparison passes that feed a status report, in execution order.
 */
public enum Phase {
    /** Working copy compared against the staged snapshot. */
    WORKING_COPY,
    /** Staged snapshot compared against the baseline commit (or the empty tree). */
    STAGED
}
