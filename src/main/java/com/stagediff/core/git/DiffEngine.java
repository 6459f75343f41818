package com.stagediff.core.git;

import com.stagediff.core.model.Baseline;
import com.stagediff.core.model.FileStat;

import java.nio.file.Path;
import java.util.List;

/**
 * Source of per-path line counts for the two comparisons a status report needs.
 *
 * <p>Both methods return the changed paths in the order the engine produced them.
 */
public interface DiffEngine {

    /**
     * Compares the working copy against the staged snapshot.
     *
     * @param workDir  working copy root
     * @param pathspec paths to restrict the comparison to; empty means everything
     */
    List<FileStat> diffWorkingCopy(Path workDir, List<String> pathspec);

    /**
     * Compares the staged snapshot against {@code baseline}.
     *
     * @param workDir  working copy root
     * @param baseline commit or empty tree to compare against
     * @param pathspec paths to restrict the comparison to; empty means everything
     */
    List<FileStat> diffStaged(Path workDir, Baseline baseline, List<String> pathspec);
}
