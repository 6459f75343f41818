package com.stagediff.core.git;

import java.nio.file.Path;

/**
 * Checks that the staged snapshot of a working copy can be read.
 */
public class StagedSnapshotLoader {

    private final GitCommandRunner runner;

    public StagedSnapshotLoader(GitCommandRunner runner) {
        this.runner = runner;
    }

    /**
     * @throws SnapshotLoadException if the index is missing, corrupt, or git cannot run
     */
    public void load(Path workDir) {
        GitResult result;
        try {
            result = runner.run(workDir, "ls-files", "--stage", "-z");
        } catch (GitCommandException e) {
            throw new SnapshotLoadException("Cannot read staged snapshot in " + workDir, e);
        }
        if (!result.isSuccess()) {
            throw new SnapshotLoadException("Cannot read staged snapshot in %s (exit code %d): %s"
                    .formatted(workDir, result.exitCode(), result.stderr().strip()));
        }
    }
}
