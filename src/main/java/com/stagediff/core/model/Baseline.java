package com.stagediff.core.model;

/**
 * The tree the staged snapshot is compared against.
 *
 * @param id    commit id, or {@link #EMPTY_TREE_ID} when the reference does not resolve
 * @param label the reference name as requested, for logging
 */
public record Baseline(String id, String label) {

    /** Well-known id of the empty tree in SHA-1 repositories. */
    public static final String EMPTY_TREE_ID = "4b825dc642cb6eb9a060e54bf8d69288fbee4904";

    public static Baseline emptyTree(String label) {
        return new Baseline(EMPTY_TREE_ID, label);
    }

    public boolean isEmptyTree() {
        return EMPTY_TREE_ID.equals(id);
    }
}
