package com.stagediff.core.git;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Test runner that records git invocations and replays canned results
 * instead of starting processes.
 */
public class RecordingGitCommandRunner extends GitCommandRunner {

    private final List<List<String>> executedCommands = new ArrayList<>();
    private final Deque<GitResult> results = new ArrayDeque<>();
    private final GitResult fallback = new GitResult(0, "", "");

    public RecordingGitCommandRunner() {
        super("git");
    }

    public RecordingGitCommandRunner thenReturn(int exitCode, String stdout) {
        results.add(new GitResult(exitCode, stdout, exitCode == 0 ? "" : "fatal: simulated failure"));
        return this;
    }

    public List<List<String>> getExecutedCommands() {
        return executedCommands;
    }

    @Override
    public GitResult run(Path workDir, List<String> args) {
        executedCommands.add(List.copyOf(args));
        return results.isEmpty() ? fallback : results.poll();
    }
}
