package com.stagediff.core.git;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Runs the {@code git} executable in a working copy and captures its output.
 *
 * <p>This class shells out to the {@code git} CLI via {@link ProcessBuilder}
 * rather than depending on JGit. Output is kept as raw text so that
 * {@code -z} (NUL-terminated) formats survive intact.
 */
public class GitCommandRunner {

    private static final Logger log = LoggerFactory.getLogger(GitCommandRunner.class);

    private final String gitExecutable;

    /**
     * @param gitExecutable name or absolute path of the git binary
     */
    public GitCommandRunner(String gitExecutable) {
        this.gitExecutable = gitExecutable;
    }

    public String getGitExecutable() {
        return gitExecutable;
    }

    /**
     * Runs a git command and captures stdout and stderr.
     *
     * <p>A non-zero exit code is returned to the caller, not thrown; only a
     * failure to run the process at all raises {@link GitCommandException}.
     *
     * @param workDir working directory for the git command
     * @param args    git arguments (e.g. "diff-files", "--numstat", "-z")
     * @return exit code and captured output
     */
    public GitResult run(Path workDir, List<String> args) {
        var command = buildCommand(args);
        log.debug("Running: {}", String.join(" ", command));

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(false)
                    .start();
            process.getOutputStream().close();

            // stderr is drained concurrently; git blocks once either pipe fills up
            CompletableFuture<String> stderrFuture = CompletableFuture.supplyAsync(() -> {
                try {
                    return readFully(process.getErrorStream());
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
            String stdout = readFully(process.getInputStream());
            String stderr = joinStderr(stderrFuture);
            int exitCode = process.waitFor();

            if (!stderr.isBlank()) {
                log.debug("git stderr: {}", stderr.strip());
            }
            return new GitResult(exitCode, stdout, stderr);
        } catch (IOException e) {
            log.error("Git command failed: {}", String.join(" ", command), e);
            throw new GitCommandException("Git command failed: " + String.join(" ", command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitCommandException("Interrupted while running: " + String.join(" ", command), e);
        }
    }

    public GitResult run(Path workDir, String... args) {
        return run(workDir, Arrays.asList(args));
    }

    List<String> buildCommand(List<String> args) {
        var command = new ArrayList<String>(args.size() + 1);
        command.add(gitExecutable);
        command.addAll(args);
        return command;
    }

    private static String joinStderr(CompletableFuture<String> stderrFuture) throws IOException {
        try {
            return stderrFuture.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof UncheckedIOException io) {
                throw io.getCause();
            }
            throw e;
        }
    }

    private static String readFully(InputStream in) throws IOException {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
